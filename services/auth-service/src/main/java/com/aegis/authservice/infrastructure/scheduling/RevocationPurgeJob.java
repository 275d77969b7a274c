package com.aegis.authservice.infrastructure.scheduling;

import com.aegis.authservice.domain.service.SessionAuthority;
import com.aegis.observability.CorrelationContext;
import com.aegis.observability.CorrelationContextHolder;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically deletes revocation records of refresh tokens that have expired. Best effort: a
 * failed run is logged and the next one tries again. Each run logs under its own correlation
 * id ({@value #CORRELATION_PREFIX} plus a UUID).
 */
@Component
public class RevocationPurgeJob {

    private static final Logger log = LoggerFactory.getLogger(RevocationPurgeJob.class);

    static final String CORRELATION_PREFIX = "revocation-purge-";

    private final SessionAuthority sessions;

    public RevocationPurgeJob(SessionAuthority sessions) {
        this.sessions = sessions;
    }

    @Scheduled(
            fixedDelayString = "${aegis.auth.revocation-purge-interval:PT1H}",
            initialDelayString = "${aegis.auth.revocation-purge-interval:PT1H}")
    public void purge() {
        CorrelationContext context =
                CorrelationContext.anonymous(
                        CORRELATION_PREFIX + UUID.randomUUID(), UUID.randomUUID().toString());
        CorrelationContextHolder.runWithContext(context, this::purgeOnce);
    }

    private void purgeOnce() {
        try {
            sessions.purgeExpiredRevocations();
        } catch (RuntimeException e) {
            log.warn("Revocation purge failed; will retry on next run", e);
        }
    }
}
