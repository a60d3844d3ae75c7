package com.jay.riskengine.account;

import com.jay.riskengine.config.EngineConfig;
import com.jay.riskengine.model.AccountState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Holds the one process-wide {@link AccountState}.
 *
 * Reads are lock-free (immutable value behind a volatile reference). Replacement is
 * reserved for the settlement engine and for startup recovery, both of which run
 * under the engine lock.
 */
@Slf4j
@Component
public class AccountStateStore {

    private volatile AccountState current;

    public AccountStateStore(EngineConfig config) {
        this.current = AccountState.initial(config.account().getInitialBalance());
        log.info("Account initialised with balance {}", current.initialBalance());
    }

    public AccountState current() {
        return current;
    }

    public void replace(AccountState next) {
        this.current = next;
    }
}
