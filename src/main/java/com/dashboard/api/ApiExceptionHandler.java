package com.dashboard.api;

import com.dashboard.domain.exception.AnalyticsOperationException;
import com.dashboard.domain.exception.DataSourceUnavailableException;
import com.dashboard.domain.exception.FeatureNotFoundException;
import com.dashboard.domain.exception.InvalidArgumentException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.util.Map;

/**
 * Maps engine failures to RFC 7807 problem responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
            HttpStatus.BAD_REQUEST, "invalid-argument",
            HttpStatus.NOT_FOUND, "not-found",
            HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
            HttpStatus.NOT_ACCEPTABLE, "not-acceptable",
            HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type",
            HttpStatus.SERVICE_UNAVAILABLE, "data-source-unavailable",
            HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
    );

    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<ProblemDetail> handleInvalidArgument(InvalidArgumentException ex,
                                                               HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex, ex.getMessage(), request);
        response.getBody().setProperty("field", ex.field());
        return response;
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ProblemDetail> handleMissingParameter(MissingServletRequestParameterException ex,
                                                                HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex,
                "Parameter '" + ex.getParameterName() + "' is required", request);
        response.getBody().setProperty("field", ex.getParameterName());
        return response;
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex,
                                                                   HttpServletRequest request) {
        ConstraintViolation<?> violation = ex.getConstraintViolations().iterator().next();
        String field = lastNode(violation.getPropertyPath());
        ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.BAD_REQUEST, ex,
                "Parameter '" + field + "' " + violation.getMessage(), request);
        response.getBody().setProperty("field", field);
        return response;
    }

    @ExceptionHandler(FeatureNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleFeatureNotFound(FeatureNotFoundException ex,
                                                               HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.NOT_FOUND, ex, ex.getMessage(), request);
        response.getBody().setProperty("feature", ex.feature());
        return response;
    }

    @ExceptionHandler(DataSourceUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleDataSourceUnavailable(DataSourceUnavailableException ex,
                                                                     HttpServletRequest request) {
        return buildProblem(HttpStatus.SERVICE_UNAVAILABLE, ex, ex.getMessage(), request);
    }

    @ExceptionHandler(AnalyticsOperationException.class)
    public ResponseEntity<ProblemDetail> handleOperationFailure(AnalyticsOperationException ex,
                                                                HttpServletRequest request) {
        return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, ex.getMessage(), request);
    }

    /**
     * Spring MVC's own failures (unknown path, wrong method, media type) keep their status.
     */
    @ExceptionHandler({ResponseStatusException.class, HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class, HttpMediaTypeNotAcceptableException.class,
            NoHandlerFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<ProblemDetail> handleFrameworkError(Exception ex, HttpServletRequest request) {
        ErrorResponse errorResponse = (ErrorResponse) ex;
        HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        ResponseEntity<ProblemDetail> problem = buildProblem(status, ex, errorResponse.getBody().getDetail(), request);
        return ResponseEntity.status(status)
                .headers(errorResponse.getHeaders())
                .body(problem.getBody());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Unexpected error", request);
    }

    private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex, String detailMessage,
                                                       HttpServletRequest request) {
        logException(status, ex, request);
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, detailMessage);
        detail.setTitle(status.getReasonPhrase());
        detail.setInstance(URI.create(request.getRequestURI()));
        detail.setType(URI.create("https://dashboard.local/problems/"
                + TYPE_SLUGS.getOrDefault(status, status.is4xxClientError() ? "client-error" : "internal-error")));
        detail.setProperty("path", request.getRequestURI());
        return ResponseEntity.status(status).body(detail);
    }

    private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
        String uri = request.getQueryString() == null
                ? request.getRequestURI()
                : request.getRequestURI() + "?" + request.getQueryString();
        String message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getName()
                : ex.getMessage();

        if (status.is5xxServerError()) {
            log.error("Request {} {} from {} failed with status {}: {}",
                    request.getMethod(), uri, clientIp(request), status.value(), message, ex);
        } else {
            log.warn("Request {} {} from {} returned status {}: {}",
                    request.getMethod(), uri, clientIp(request), status.value(), message);
        }
    }

    private String lastNode(Path path) {
        String name = null;
        for (Path.Node node : path) {
            name = node.getName();
        }
        return name;
    }

    private String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
