package win.ixuni.quarry.server.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.exception.InvalidRangeException;
import win.ixuni.quarry.core.exception.QuarryException;
import win.ixuni.quarry.server.filter.RequestIdFilter;

/**
 * Global exception handler
 * <p>
 * Converts exceptions to the S3 XML error body, see {@link S3ErrorResponse}. HEAD responses carry the status
 * only. Actuator endpoints are outside the advice's base package and keep Spring Boot's own error handling.
 */
@Slf4j
@RestControllerAdvice(basePackages = "win.ixuni.quarry")
public class GlobalExceptionHandler {

    @ExceptionHandler(QuarryException.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleQuarryException(QuarryException ex,
            ServerWebExchange exchange) {
        if (ex.getHttpStatus() >= 500) {
            log.error("S3 Error: {} - {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.debug("S3 Error: {} - {}", ex.getErrorCode(), ex.getMessage());
        }

        HttpHeaders headers = new HttpHeaders();
        if (ex instanceof InvalidRangeException rangeException) {
            headers.set(HttpHeaders.CONTENT_RANGE, "bytes */" + rangeException.getObjectSize());
        }

        S3ErrorResponse error = errorBody(ex.getErrorCode(), ex.getMessage(), exchange);
        error.getDetails().putAll(ex.getDetails());
        return respond(HttpStatusCode.valueOf(ex.getHttpStatus()), headers, error, exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleIllegalArgumentException(IllegalArgumentException ex,
            ServerWebExchange exchange) {
        log.debug("Invalid argument: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, new HttpHeaders(),
                errorBody("InvalidArgument", ex.getMessage(), exchange), exchange);
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleUnsupportedOperationException(
            UnsupportedOperationException ex, ServerWebExchange exchange) {
        log.debug("Unsupported operation: {}", ex.getMessage());
        String message = ex.getMessage() != null ? ex.getMessage() : "A header you provided implies functionality that is not implemented";
        return respond(HttpStatus.NOT_IMPLEMENTED, new HttpHeaders(),
                errorBody("NotImplemented", message, exchange), exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleResponseStatusException(ResponseStatusException ex,
            ServerWebExchange exchange) {
        HttpStatusCode status = ex.getStatusCode();
        String code = status.value() == 405 ? "MethodNotAllowed"
                : status.is4xxClientError() ? "InvalidRequest" : "InternalError";
        return respond(status, new HttpHeaders(), errorBody(code, ex.getReason(), exchange), exchange);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Internal error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, new HttpHeaders(),
                errorBody("InternalError", "We encountered an internal error. Please try again.", exchange),
                exchange);
    }

    private S3ErrorResponse errorBody(String code, String message, ServerWebExchange exchange) {
        return S3ErrorResponse.builder()
                .code(code)
                .message(message)
                .resource(exchange.getRequest().getPath().value())
                .requestId(RequestIdFilter.requestId(exchange))
                .build();
    }

    private Mono<ResponseEntity<S3ErrorResponse>> respond(HttpStatusCode status, HttpHeaders headers,
            S3ErrorResponse error, ServerWebExchange exchange) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status).headers(headers);
        if (exchange.getRequest().getMethod() == HttpMethod.HEAD) {
            return Mono.just(builder.build());
        }
        return Mono.just(builder.contentType(MediaType.APPLICATION_XML).body(error));
    }
}
