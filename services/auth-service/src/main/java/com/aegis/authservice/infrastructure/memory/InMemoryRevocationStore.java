package com.aegis.authservice.infrastructure.memory;

import com.aegis.authservice.domain.model.RevocationRecord;
import com.aegis.authservice.domain.port.RevocationStore;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** {@link RevocationStore} backed by a {@link ConcurrentHashMap}; {@code putIfAbsent} is the CAS. */
public class InMemoryRevocationStore implements RevocationStore {

    private final Map<String, RevocationRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean revokeIfAbsent(RevocationRecord record) {
        return records.putIfAbsent(record.jti(), record) == null;
    }

    @Override
    public boolean isRevoked(String jti) {
        return records.containsKey(jti);
    }

    @Override
    public int purgeExpired(Instant now) {
        int purged = 0;
        for (Map.Entry<String, RevocationRecord> entry : records.entrySet()) {
            if (entry.getValue().isPurgeableAt(now)
                    && records.remove(entry.getKey(), entry.getValue())) {
                purged++;
            }
        }
        return purged;
    }
}
