package com.aegis.authservice.domain.service;

import com.aegis.authservice.domain.error.InactiveUserException;
import com.aegis.authservice.domain.error.InvalidCredentialsException;
import com.aegis.authservice.domain.model.User;
import com.aegis.authservice.domain.model.UserProfile;
import com.aegis.authservice.domain.port.IdentityStore;
import com.aegis.security.CredentialHasher;
import com.aegis.security.TokenClaims;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Self-service operations on the caller's own account. */
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    private final IdentityStore identities;
    private final CredentialHasher hasher;

    public UserAccountService(IdentityStore identities, CredentialHasher hasher) {
        this.identities = identities;
        this.hasher = hasher;
    }

    public UserProfile me(TokenClaims caller) {
        return profile(activeCaller(caller), caller);
    }

    /**
     * Replaces the caller's display name. A null or blank name clears it.
     *
     * @throws IllegalArgumentException the name is longer than {@value
     *     RegistrationService#MAX_FULL_NAME_LENGTH} characters
     */
    public UserProfile updateProfile(TokenClaims caller, String fullName) {
        User user = activeCaller(caller);
        User updated =
                identities.updateFullName(user.id(), RegistrationService.normalizeFullName(fullName));
        log.info("User {} updated their profile", user.id());
        return profile(updated, caller);
    }

    /**
     * @throws InvalidCredentialsException the current password does not match
     * @throws IllegalArgumentException the new password is empty or too long
     */
    public void changePassword(TokenClaims caller, String currentPassword, String newPassword) {
        User user = activeCaller(caller);
        if (currentPassword == null || !hasher.verify(currentPassword, user.passwordHash())) {
            log.info("Password change rejected for user {}: current password mismatch", user.id());
            throw new InvalidCredentialsException();
        }
        RegistrationService.validatePassword(newPassword);
        identities.updatePasswordHash(user.id(), hasher.hash(newPassword));
        log.info("User {} changed their password", user.id());
    }

    /**
     * Soft-deletes the caller. Outstanding access tokens run out on their own; refresh tokens
     * are refused from now on.
     */
    public void deactivate(TokenClaims caller) {
        User user = activeCaller(caller);
        identities.setUserActive(user.id(), false);
        log.info("User {} deactivated their account", user.id());
    }

    private static UserProfile profile(User user, TokenClaims caller) {
        return new UserProfile(
                user.id(), user.email(), user.fullName(), caller.tenantId(), caller.role());
    }

    private User activeCaller(TokenClaims caller) {
        UUID userId = AuthorizationEvaluator.parse(caller.subject());
        User user =
                Optional.ofNullable(userId)
                        .flatMap(identities::findUserById)
                        .orElseThrow(InvalidCredentialsException::new);
        if (!user.active()) {
            throw new InactiveUserException();
        }
        return user;
    }
}
