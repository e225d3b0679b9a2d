package net.modshub.controller.support;

import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import net.modshub.exception.ConcurrentModUpdateException;
import net.modshub.exception.InvalidModRequestException;
import net.modshub.exception.ModAccessDeniedException;
import net.modshub.exception.ModNotFoundException;
import net.modshub.exception.SlugConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps mod-service failures to RFC 9457 ProblemDetail responses.
 *
 * <p>Slug conflict bodies always carry "Slug Already Exists" in both {@code title} and
 * {@code detail}; clients match on either.</p>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SlugConflictException.class)
    public ResponseEntity<ProblemDetail> handleSlugConflict(SlugConflictException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.CONFLICT, SlugConflictException.TITLE, ex.getMessage(), request);
        problem.setProperty("slug", ex.getSlug());
        return respond(problem);
    }

    @ExceptionHandler(ConcurrentModUpdateException.class)
    public ResponseEntity<ProblemDetail> handleConcurrentUpdate(ConcurrentModUpdateException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.CONFLICT, ConcurrentModUpdateException.TITLE, ex.getMessage(), request);
        problem.setProperty("modId", ex.getModId());
        return respond(problem);
    }

    @ExceptionHandler(ModNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(ModNotFoundException ex, HttpServletRequest request) {
        return respond(problem(HttpStatus.NOT_FOUND, "Mod Not Found", ex.getMessage(), request));
    }

    @ExceptionHandler(ModAccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(ModAccessDeniedException ex, HttpServletRequest request) {
        return respond(problem(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), request));
    }

    @ExceptionHandler(InvalidModRequestException.class)
    public ResponseEntity<ProblemDetail> handleInvalidRequest(InvalidModRequestException ex, HttpServletRequest request) {
        return respond(problem(HttpStatus.BAD_REQUEST, "Invalid Mod Request", ex.getMessage(), request));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return respond(problem(HttpStatus.BAD_REQUEST, "Invalid Mod Request", "Malformed JSON request body", request));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleStorageFailure(DataAccessException ex, HttpServletRequest request) {
        log.error("Storage failure serving {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(problem(HttpStatus.SERVICE_UNAVAILABLE, "Storage Unavailable",
            "The mod store could not complete the request. Retry later.", request));
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail, HttpServletRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        problemDetail.setType(URI.create("about:blank"));
        problemDetail.setInstance(URI.create(request.getRequestURI()));
        return problemDetail;
    }

    private static ResponseEntity<ProblemDetail> respond(ProblemDetail problemDetail) {
        return ResponseEntity.status(problemDetail.getStatus())
            .contentType(MediaType.APPLICATION_PROBLEM_JSON)
            .body(problemDetail);
    }
}
