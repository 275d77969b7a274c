package com.aegis.authservice.api;

import com.aegis.authservice.api.dto.LoginRequest;
import com.aegis.authservice.api.dto.RefreshTokenRequest;
import com.aegis.authservice.api.dto.RegisterRequest;
import com.aegis.authservice.api.dto.RegistrationResponse;
import com.aegis.authservice.api.dto.TokenResponse;
import com.aegis.authservice.domain.service.RegistrationService;
import com.aegis.authservice.domain.service.SessionAuthority;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Anonymous endpoints: registration and the token lifecycle. */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final RegistrationService registrations;
    private final SessionAuthority sessions;

    public AuthController(RegistrationService registrations, SessionAuthority sessions) {
        this.registrations = registrations;
        this.sessions = sessions;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public RegistrationResponse register(@Valid @RequestBody RegisterRequest request) {
        return RegistrationResponse.from(
                registrations.register(
                        request.email(),
                        request.password(),
                        request.fullName(),
                        request.tenantName()));
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        return TokenResponse.from(
                sessions.login(request.email(), request.password(), request.tenantId()));
    }

    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return TokenResponse.from(sessions.refresh(request.refreshToken()));
    }

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(@Valid @RequestBody RefreshTokenRequest request) {
        sessions.logout(request.refreshToken());
    }
}
