package com.aegis.authservice.api;

import com.aegis.authservice.api.dto.ChangePasswordRequest;
import com.aegis.authservice.api.dto.UpdateProfileRequest;
import com.aegis.authservice.api.dto.UserProfileResponse;
import com.aegis.authservice.domain.service.SessionAuthority;
import com.aegis.authservice.domain.service.UserAccountService;
import com.aegis.security.TokenClaims;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** The caller's own account. Every handler authenticates the bearer token first. */
@RestController
@RequestMapping("/api/v1/users/me")
public class UserController {

    private final SessionAuthority sessions;
    private final UserAccountService accounts;

    public UserController(SessionAuthority sessions, UserAccountService accounts) {
        this.sessions = sessions;
        this.accounts = accounts;
    }

    @GetMapping
    public UserProfileResponse me(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        TokenClaims caller = sessions.authenticate(authorization);
        return UserProfileResponse.from(accounts.me(caller));
    }

    @PatchMapping
    public UserProfileResponse updateProfile(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody UpdateProfileRequest request) {
        TokenClaims caller = sessions.authenticate(authorization);
        return UserProfileResponse.from(accounts.updateProfile(caller, request.fullName()));
    }

    @PostMapping("/password")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void changePassword(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody ChangePasswordRequest request) {
        TokenClaims caller = sessions.authenticate(authorization);
        accounts.changePassword(caller, request.currentPassword(), request.newPassword());
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deactivate(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        accounts.deactivate(sessions.authenticate(authorization));
    }
}
