package com.aegis.authservice.infrastructure.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aegis.authservice.domain.error.StoreUnavailableException;
import com.aegis.authservice.domain.service.SessionAuthority;
import com.aegis.observability.CorrelationContextHolder;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("RevocationPurgeJob")
class RevocationPurgeJobTest {

    private final SessionAuthority sessions = mock(SessionAuthority.class);
    private final RevocationPurgeJob job = new RevocationPurgeJob(sessions);

    @Test
    @DisplayName("delegates to the session authority")
    void purges() {
        when(sessions.purgeExpiredRevocations()).thenReturn(3);

        job.purge();

        verify(sessions).purgeExpiredRevocations();
    }

    @Test
    @DisplayName("a failed run does not propagate")
    void failureIsContained() {
        when(sessions.purgeExpiredRevocations())
                .thenThrow(new StoreUnavailableException("timeout", null));

        assertThatCode(job::purge).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("each run logs under its own correlation id and leaves the thread clean")
    void runsWithCorrelationId() {
        AtomicReference<String> seen = new AtomicReference<>();
        when(sessions.purgeExpiredRevocations())
                .thenAnswer(
                        invocation -> {
                            seen.set(MDC.get("correlationId"));
                            return 0;
                        });

        job.purge();

        assertThat(seen.get()).startsWith(RevocationPurgeJob.CORRELATION_PREFIX);
        assertThat(CorrelationContextHolder.get()).isEmpty();
        assertThat(MDC.get("correlationId")).isNull();
    }
}
