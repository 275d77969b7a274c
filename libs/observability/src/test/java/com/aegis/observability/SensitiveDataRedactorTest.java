package com.aegis.observability;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    @Test
    @DisplayName("maskEmail keeps the first character and the domain")
    void maskEmail() {
        assertThat(SensitiveDataRedactor.maskEmail("alice@x.com")).isEqualTo("a***@x.com");
        assertThat(SensitiveDataRedactor.maskEmail("not-an-email")).isEqualTo(SensitiveDataRedactor.REDACTED);
        assertThat(SensitiveDataRedactor.maskEmail("@x.com")).isEqualTo(SensitiveDataRedactor.REDACTED);
        assertThat(SensitiveDataRedactor.maskEmail(null)).isNull();
    }
}
