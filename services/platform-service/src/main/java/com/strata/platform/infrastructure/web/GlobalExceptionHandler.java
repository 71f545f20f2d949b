package com.strata.platform.infrastructure.web;

import com.strata.observability.CorrelationContextHolder;
import com.strata.platform.error.ErrorKind;
import com.strata.platform.error.PlatformException;
import com.strata.security.AccessDeniedException;
import com.strata.security.DecisionOutcome;
import com.strata.security.SessionTokenException;
import com.strata.security.TenantMismatchException;
import com.strata.tabular.TabularParseException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps every failure to an RFC 7807 {@link ProblemDetail}:
 *
 * <pre>
 * {
 *   "type": "https://strata.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "Read-only account",
 *   "error": "Read-only account",
 *   "timestamp": "2026-03-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Storage and unexpected failures are logged in full and answered with a generic message.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://strata.dev/errors/";

    @ExceptionHandler(PlatformException.class)
    public ResponseEntity<ProblemDetail> handlePlatform(PlatformException ex) {
        ErrorKind kind = ex.kind();
        if (kind.exposesDetail()) {
            log.warn("{}: {}", kind, ex.getMessage());
        } else {
            log.error("{}: {}", kind, ex.getMessage(), ex);
        }
        return respond(kind, ex.getMessage());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(AccessDeniedException ex) {
        ErrorKind kind = ex.outcome() == DecisionOutcome.BAD_REQUEST ? ErrorKind.BAD_REQUEST : ErrorKind.FORBIDDEN;
        log.warn("Policy denied {}: {}", ex.decision().action(), ex.getMessage());
        return respond(kind, ex.decision().reason());
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Cross-tenant access blocked: {}", ex.getMessage());
        return respond(ErrorKind.FORBIDDEN, "Resource belongs to another tenant");
    }

    @ExceptionHandler(SessionTokenException.class)
    public ResponseEntity<ProblemDetail> handleSessionToken(SessionTokenException ex) {
        log.warn("Rejected session token: {}", ex.getMessage());
        return respond(ErrorKind.UNAUTHORIZED, ex.getMessage());
    }

    @ExceptionHandler(TabularParseException.class)
    public ResponseEntity<ProblemDetail> handleTabularParse(TabularParseException ex) {
        log.warn("Unparseable upload: {}", ex.getMessage());
        return respond(ErrorKind.BAD_REQUEST, "Invalid file: " + ex.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException ex) {
        log.error("Storage failure", ex);
        return respond(ErrorKind.STORAGE_FAILURE, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        log.warn("Validation failed: {}", detail);
        return respond(ErrorKind.BAD_REQUEST, detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return respond(ErrorKind.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ProblemDetail> handleBadParameter(Exception ex) {
        log.warn("Bad request parameter: {}", ex.getMessage());
        return respond(ErrorKind.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ProblemDetail> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("Upload too large: {}", ex.getMessage());
        return respond(ErrorKind.BAD_REQUEST, "Uploaded file is too large");
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ProblemDetail> handleMultipart(MultipartException ex) {
        log.warn("Multipart error: {}", ex.getMessage());
        return respond(ErrorKind.BAD_REQUEST, "Malformed multipart body");
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ProblemDetail> handleRouting(Exception ex) {
        HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setProperty("error", ex.getMessage());
        enrichWithCorrelation(problem);
        return ResponseEntity.status(status).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return respond(ErrorKind.INTERNAL_ERROR, null);
    }

    /**
     * Builds the problem body for {@code kind}; {@code message} is replaced by the generic text
     * for kinds that hide their detail.
     */
    static ProblemDetail toProblem(ErrorKind kind, String message) {
        String detail = kind.clientMessage(message);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(kind.status(), detail);
        problem.setTitle(kind.title());
        problem.setType(URI.create(ERROR_TYPE_BASE + kind.slug()));
        problem.setProperty("error", detail);
        enrichWithCorrelation(problem);
        return problem;
    }

    private static ResponseEntity<ProblemDetail> respond(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.status()).body(toProblem(kind, message));
    }

    private static void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
