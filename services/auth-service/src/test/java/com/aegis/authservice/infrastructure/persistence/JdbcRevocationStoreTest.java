package com.aegis.authservice.infrastructure.persistence;

import com.aegis.authservice.domain.port.RevocationStore;
import com.aegis.authservice.domain.port.RevocationStoreContract;
import com.aegis.authservice.support.H2Databases;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;

@DisplayName("JdbcRevocationStore")
class JdbcRevocationStoreTest extends RevocationStoreContract {

    @Override
    protected RevocationStore createStore() {
        return new JdbcRevocationStore(H2Databases.migrated(), Duration.ofSeconds(5));
    }
}
