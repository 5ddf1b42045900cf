package com.myinfra.deployments.ownership.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Translates every unhandled exception of the ownership API into an {@link ErrorResponse}.
 * Resolver contract violations become 400, rejected tokens 401, everything else 500.
 */
@Slf4j
@Component
@Order(-2) // before Spring Boot's DefaultErrorWebExceptionHandler (Order -1)
@RequiredArgsConstructor
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

    private final ObjectMapper objectMapper;

    @Override
    @NonNull
    public Mono<Void> handle(@NonNull ServerWebExchange exchange, @NonNull Throwable ex) {

        ServerHttpResponse response = exchange.getResponse();

        if (response.isCommitted()) {
            log.warn("Response already committed, cannot write error for path={} error={}",
                    exchange.getRequest().getURI().getPath(), ex.getMessage());
            return Mono.error(ex);
        }

        Throwable cause = unwrapCause(ex);

        HttpStatus status;
        String message;

        if (cause instanceof ResponseStatusException rse) {
            status = HttpStatus.valueOf(rse.getStatusCode().value());
            String reason = rse.getReason();
            message = (reason != null && !reason.isBlank())
                    ? reason
                    : status.getReasonPhrase();
        } else if (cause instanceof InvalidIdentityException) {
            status = HttpStatus.BAD_REQUEST;
            message = cause.getMessage();
        } else if (cause instanceof JwtException) {
            status = HttpStatus.UNAUTHORIZED;
            message = "Invalid or malformed identity token.";
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            message = "An unexpected error occurred.";
        }

        String path = exchange.getRequest().getURI().getPath();

        if (status.is5xxServerError()) {
            log.error("Ownership API error - status={} path={} error={}",
                    status.value(), path, cause.getMessage(), cause);
        } else {
            log.warn("Ownership API error - status={} path={} error={}",
                    status.value(), path, cause.getMessage());
        }

        ErrorResponse errorResponse = ErrorResponse.of(status, message, path);

        return writeErrorResponse(response, status, errorResponse);
    }

    /**
     * Serializes the {@link ErrorResponse} to JSON and writes it with the given status.
     *
     * @param response      The server HTTP response
     * @param status        HTTP status to set on the response
     * @param errorResponse The payload to serialize
     * @return {@code Mono<Void>} completing when the write is done
     */
    @NonNull
    private Mono<Void> writeErrorResponse(ServerHttpResponse response,
                                          HttpStatus status,
                                          ErrorResponse errorResponse) {

        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(errorResponse);
        } catch (JsonProcessingException jsonEx) {
            log.error("Failed to serialize ErrorResponse to JSON", jsonEx);

            String fallbackTime = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss"));
            String fallbackJson = String.format(
                    "{\"timestamp\":\"%s\",\"status\":%d,\"error\":\"%s\",\"message\":\"Error serialization failed.\",\"path\":\"%s\"}",
                    fallbackTime, status.value(), status.getReasonPhrase(), errorResponse.getPath()
            );
            bytes = fallbackJson.getBytes(StandardCharsets.UTF_8);
        }

        DataBuffer buffer = response.bufferFactory().wrap(Objects.requireNonNull(bytes));

        return response.writeWith(Mono.just(buffer));
    }

    /**
     * Walks the cause chain. Stops at the first exception that carries its own
     * status mapping, otherwise returns the deepest cause.
     *
     * @param t The top-level throwable
     * @return The exception used for classification
     */
    private Throwable unwrapCause(Throwable t) {
        Throwable curr = t;
        Throwable deepest = t;

        int depth = 0;
        while (curr != null && depth++ < 10) {
            if (curr instanceof ResponseStatusException || curr instanceof InvalidIdentityException) {
                return curr;
            }
            deepest = curr;
            curr = curr.getCause();
        }

        return deepest;
    }
}
