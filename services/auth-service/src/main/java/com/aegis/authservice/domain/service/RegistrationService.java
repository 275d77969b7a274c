package com.aegis.authservice.domain.service;

import com.aegis.authservice.domain.error.DuplicateEmailException;
import com.aegis.authservice.domain.model.Emails;
import com.aegis.authservice.domain.model.Registration;
import com.aegis.authservice.domain.model.Tenant;
import com.aegis.authservice.domain.model.User;
import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.observability.MetricFactory;
import com.aegis.observability.SensitiveDataRedactor;
import com.aegis.security.BCryptCredentialHasher;
import com.aegis.security.CredentialHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Onboards a new user, optionally together with a tenant they own.
 *
 * <p>The user is created first so a duplicate email fails before anything else is written. When a
 * tenant is requested and provisioning fails, the user is deleted again and the original failure
 * is rethrown.
 */
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    static final String METRIC_REGISTRATION = "aegis.auth.registration";

    public static final int MAX_FULL_NAME_LENGTH = 200;

    private final IdentityStore identities;
    private final CredentialHasher hasher;
    private final TenantProvisioner provisioner;
    private final MetricFactory metrics;

    public RegistrationService(
            IdentityStore identities,
            CredentialHasher hasher,
            TenantProvisioner provisioner,
            MetricFactory metrics) {
        this.identities = identities;
        this.hasher = hasher;
        this.provisioner = provisioner;
        this.metrics = metrics;
    }

    /**
     * @param fullName optional display name
     * @param tenantName optional; when present a tenant is created with the user as owner
     * @throws IllegalArgumentException invalid email, password, name
     * @throws DuplicateEmailException the email is taken (case-insensitive)
     */
    public Registration register(String email, String password, String fullName, String tenantName) {
        validateEmail(email);
        validatePassword(password);
        String name = normalizeFullName(fullName);
        if (tenantName != null) {
            TenantProvisioner.validateName(tenantName);
        }

        User user;
        try {
            user = identities.createUser(email.strip(), hasher.hash(password), name);
        } catch (DuplicateEmailException e) {
            metrics.recordOutcome(METRIC_REGISTRATION, "duplicate_email");
            log.info(
                    "Registration rejected for {}: email taken",
                    SensitiveDataRedactor.maskEmail(email));
            throw e;
        }

        if (tenantName == null) {
            metrics.recordOutcome(METRIC_REGISTRATION, "success");
            log.info("Registered user {}", user.id());
            return new Registration(user.id(), null);
        }

        Tenant tenant;
        try {
            tenant = provisioner.provision(tenantName, user.id());
        } catch (RuntimeException e) {
            metrics.recordOutcome(METRIC_REGISTRATION, "compensated");
            log.warn("Tenant provisioning failed for new user {}; deleting user", user.id());
            try {
                identities.deleteUser(user.id());
            } catch (RuntimeException cleanup) {
                log.error("Could not delete user {} after failed registration", user.id(), cleanup);
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        metrics.recordOutcome(METRIC_REGISTRATION, "success");
        log.info("Registered user {} as owner of tenant {}", user.id(), tenant.id());
        return new Registration(user.id(), tenant.id());
    }

    static void validateEmail(String email) {
        if (!Emails.isWellFormed(email)) {
            throw new IllegalArgumentException("Email address is not valid");
        }
    }

    /** Between 1 and {@value BCryptCredentialHasher#MAX_PASSWORD_BYTES} UTF-8 bytes. */
    static void validatePassword(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password must not be empty");
        }
        if (BCryptCredentialHasher.exceedsLimit(password)) {
            throw new IllegalArgumentException(
                    "Password must be at most "
                            + BCryptCredentialHasher.MAX_PASSWORD_BYTES
                            + " bytes");
        }
    }

    /** Strips the name; blank becomes null. */
    static String normalizeFullName(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return null;
        }
        String stripped = fullName.strip();
        if (stripped.length() > MAX_FULL_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Full name must be at most " + MAX_FULL_NAME_LENGTH + " characters");
        }
        return stripped;
    }
}
