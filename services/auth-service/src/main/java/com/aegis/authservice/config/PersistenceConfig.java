package com.aegis.authservice.config;

import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.authservice.domain.port.RevocationStore;
import com.aegis.authservice.infrastructure.memory.InMemoryIdentityStore;
import com.aegis.authservice.infrastructure.memory.InMemoryRevocationStore;
import com.aegis.authservice.infrastructure.persistence.JdbcIdentityStore;
import com.aegis.authservice.infrastructure.persistence.JdbcRevocationStore;
import java.time.Clock;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the store implementations from {@code aegis.store.mode}.
 *
 * <ul>
 *   <li>{@code jdbc} (default): tables created by Flyway on the configured DataSource
 *   <li>{@code memory}: process-local maps; data is lost on restart
 * </ul>
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Configuration
    @ConditionalOnProperty(
            prefix = "aegis.store",
            name = "mode",
            havingValue = "jdbc",
            matchIfMissing = true)
    static class Jdbc {

        @Bean
        IdentityStore identityStore(DataSource dataSource, StoreProperties store, Clock clock) {
            log.info("Using JDBC stores (query timeout {})", store.queryTimeout());
            return new JdbcIdentityStore(dataSource, store.queryTimeout(), clock);
        }

        @Bean
        RevocationStore revocationStore(DataSource dataSource, StoreProperties store) {
            return new JdbcRevocationStore(dataSource, store.queryTimeout());
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "aegis.store", name = "mode", havingValue = "memory")
    static class Memory {

        @Bean
        IdentityStore identityStore(Clock clock) {
            log.warn("Using in-memory stores; identities and revocations are not persisted");
            return new InMemoryIdentityStore(clock);
        }

        @Bean
        RevocationStore revocationStore() {
            return new InMemoryRevocationStore();
        }
    }
}
