package com.aegis.authservice.infrastructure.memory;

import com.aegis.authservice.domain.port.RevocationStore;
import com.aegis.authservice.domain.port.RevocationStoreContract;
import org.junit.jupiter.api.DisplayName;

@DisplayName("InMemoryRevocationStore")
class InMemoryRevocationStoreTest extends RevocationStoreContract {

    @Override
    protected RevocationStore createStore() {
        return new InMemoryRevocationStore();
    }
}
