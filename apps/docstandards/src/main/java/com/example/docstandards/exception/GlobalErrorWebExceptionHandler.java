package com.example.docstandards.exception;

import com.example.docstandards.common.util.StringSanitizer;
import com.example.docstandards.observability.filter.CorrelationIdFilter;
import com.example.docstandards.security.exception.AuthenticationException;
import com.example.docstandards.security.exception.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();

        if (error instanceof AuthenticationException) {
            log.warn("Authentication failed: path={}, error={}", path, error.getMessage());
            return createErrorResponse(request, HttpStatus.UNAUTHORIZED, "authentication_error",
                    "Authentication required", path);
        }

        if (error instanceof AuthorizationException) {
            log.warn("Authorization denied: path={}, error={}", path, error.getMessage());
            return createErrorResponse(request, HttpStatus.FORBIDDEN, "authorization_error",
                    "Access denied", path);
        }

        if (error instanceof NotFoundException notFound) {
            log.debug("Not found: path={}, type={}, id={}", path,
                    notFound.getEntityType(), StringSanitizer.forLog(notFound.getEntityId()));
            return createErrorResponse(request, HttpStatus.NOT_FOUND, "not_found", notFound.getMessage(), path);
        }

        if (error instanceof InvalidSourceDocumentException invalidSource) {
            log.warn("Invalid source document: path={}, documentId={}, error={}",
                    path, invalidSource.getDocumentId(), invalidSource.getMessage());
            return createErrorResponse(request, HttpStatus.UNPROCESSABLE_ENTITY, "invalid_source_document",
                    invalidSource.getMessage(), path);
        }

        if (error instanceof CycleRejectedException cycle) {
            log.warn("Folder move rejected: path={}, folderId={}, targetParentId={}",
                    path, cycle.getFolderId(), cycle.getTargetParentId());
            return createErrorResponse(request, HttpStatus.CONFLICT, "cycle_rejected", cycle.getMessage(), path);
        }

        if (error instanceof ConflictException conflict) {
            log.warn("Conflict: path={}, reason={}, error={}", path, conflict.getReason(), conflict.getMessage());
            return createErrorResponse(request, HttpStatus.CONFLICT, conflict.getReason(), conflict.getMessage(), path);
        }

        // Retryable by the client
        if (error instanceof TransientStorageException || error instanceof LockTimeoutException) {
            log.warn("Temporarily unavailable: path={}, error={}", path, error.getMessage());
            return createErrorResponse(request, HttpStatus.SERVICE_UNAVAILABLE, "temporarily_unavailable",
                    "Service temporarily unavailable, retry later", path);
        }

        if (error instanceof WebExchangeBindException bindException) {
            String fieldErrors = bindException.getFieldErrors().stream()
                    .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                    .collect(Collectors.joining(", "));

            log.warn("Validation failed: path={}, errors={}", path, fieldErrors);

            return createErrorResponse(request, HttpStatus.BAD_REQUEST, "validation_error",
                    "Validation failed: " + fieldErrors, path);
        }

        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }

            log.warn("Response status exception: path={}, status={}, reason={}",
                    path, status, statusException.getReason());

            return createErrorResponse(request, status, "request_error",
                    statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase(),
                    path);
        }

        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument: path={}, error={}", path, error.getMessage());
            return createErrorResponse(request, HttpStatus.BAD_REQUEST, "invalid_argument",
                    error.getMessage() != null ? error.getMessage() : "Invalid request parameter", path);
        }

        Map<String, Object> errorAttributes = getErrorAttributes(request, ErrorAttributeOptions.defaults());
        int status = (int) errorAttributes.getOrDefault("status", 500);

        log.error("Unhandled error: path={}, status={}, error={}",
                path, status, error.getMessage(), error);

        return createErrorResponse(
                request,
                HttpStatus.valueOf(status),
                "server_error",
                "An unexpected error occurred",
                path
        );
    }

    private Mono<ServerResponse> createErrorResponse(ServerRequest request, HttpStatus status,
                                                     String error, String message, String path) {
        String correlationId = request.exchange().getResponse().getHeaders()
                .getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER);
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, path, correlationId);

        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}
