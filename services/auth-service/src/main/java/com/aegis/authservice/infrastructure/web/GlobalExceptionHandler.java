package com.aegis.authservice.infrastructure.web;

import com.aegis.authservice.domain.error.AuthServiceException;
import com.aegis.authservice.domain.error.ErrorCode;
import com.aegis.observability.CorrelationContextHolder;
import com.aegis.security.TenantMismatchException;
import com.aegis.security.TokenException;
import java.net.URI;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses:
 *
 * <pre>
 * {
 *   "type": "https://aegis.dev/errors/invalid-credentials",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Invalid email or password",
 *   "code": "INVALID_CREDENTIALS",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Authentication failures (401) always carry the code's fixed message, so the response never
 * says which check failed; the reason is logged instead.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://aegis.dev/errors/";

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(AuthServiceException.class)
    public ProblemDetail handleAuthService(AuthServiceException ex) {
        ErrorCode code = ex.code();
        switch (code) {
            case INTERNAL -> log.error("Internal error: {}", ex.getMessage(), ex);
            case UNAVAILABLE -> log.warn("Store unavailable: {}", ex.getMessage(), ex);
            default -> log.info("{}: {}", code, ex.getMessage());
        }
        String detail =
                code.httpStatus() == 401 || code == ErrorCode.INTERNAL || code == ErrorCode.UNAVAILABLE
                        ? code.defaultMessage()
                        : ex.getMessage();
        return problem(code, detail);
    }

    @ExceptionHandler(TokenException.class)
    public ProblemDetail handleToken(TokenException ex) {
        ErrorCode code = ErrorCode.of(ex);
        log.info("Token rejected ({}): {}", code, ex.getMessage());
        return problem(code, code.defaultMessage());
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Cross-tenant request refused: {}", ex.getMessage());
        return problem(ErrorCode.FORBIDDEN, "Access token is not valid for this tenant");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(ErrorCode.VALIDATION, ex.getMessage());
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return problem(ErrorCode.VALIDATION, "Request could not be read");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        ProblemDetail problem = problem(ErrorCode.VALIDATION, detail);
        problem.setTitle("Validation Error");
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(ErrorCode.INTERNAL, ErrorCode.INTERNAL.defaultMessage());
    }

    private ProblemDetail problem(ErrorCode code, String detail) {
        HttpStatus status = HttpStatus.valueOf(code.httpStatus());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + code.slug()));
        problem.setProperty("code", code.name());
        problem.setProperty("timestamp", clock.instant().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
