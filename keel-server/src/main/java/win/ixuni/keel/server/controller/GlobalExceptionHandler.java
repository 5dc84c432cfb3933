package win.ixuni.keel.server.controller;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import win.ixuni.keel.core.exception.ErrorCode;
import win.ixuni.keel.core.exception.KeelException;

import java.util.UUID;

/**
 * Global exception handler
 * <p>
 * Converts exceptions to S3-standard error response format.
 *
 * <pre>
 * &lt;Error&gt;
 *     &lt;Code&gt;NoSuchBucket&lt;/Code&gt;
 *     &lt;Message&gt;The specified bucket does not exist&lt;/Message&gt;
 *     &lt;Resource&gt;/mybucket&lt;/Resource&gt;
 *     &lt;RequestId&gt;xxx&lt;/RequestId&gt;
 * &lt;/Error&gt;
 * </pre>
 * <p>
 * HEAD responses carry the status only.
 */
@Slf4j
@RestControllerAdvice(basePackages = "win.ixuni.keel")
public class GlobalExceptionHandler {

    private static final MediaType APPLICATION_XML = MediaType.valueOf("application/xml");

    @ExceptionHandler(KeelException.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleKeelException(KeelException ex, ServerHttpRequest request) {
        if (ex.getErrorCode() == ErrorCode.INTERNAL_STORAGE_FAILURE) {
            log.error("Storage failure on {}: {}", request.getPath().value(), ex.getMessage(), ex);
        } else {
            log.debug("S3 Error: {} - {}", ex.getS3Code(), ex.getMessage());
        }
        return respond(ex.getHttpStatus(), ex.getS3Code(), ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleIllegalArgumentException(
            IllegalArgumentException ex, ServerHttpRequest request) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST.value(), "InvalidArgument", ex.getMessage(), request);
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleUnsupportedOperationException(
            UnsupportedOperationException ex, ServerHttpRequest request) {
        log.warn("Unsupported operation: {}", ex.getMessage());
        return respond(HttpStatus.NOT_IMPLEMENTED.value(), "NotImplemented",
                ex.getMessage() != null ? ex.getMessage() : "The requested operation is not supported", request);
    }

    /**
     * Request binding failures raised by WebFlux before the engine is called
     */
    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleResponseStatusException(
            ResponseStatusException ex, ServerHttpRequest request) {
        log.warn("Rejected request {}: {}", request.getPath().value(), ex.getMessage());
        int status = ex.getStatusCode().value();
        String code = status < 500 ? "InvalidRequest" : ErrorCode.INTERNAL_STORAGE_FAILURE.getS3Code();
        return respond(status, code, ex.getReason() != null ? ex.getReason() : ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<S3ErrorResponse>> handleGenericException(Exception ex, ServerHttpRequest request) {
        log.error("Internal error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR.value(), ErrorCode.INTERNAL_STORAGE_FAILURE.getS3Code(),
                "An internal error occurred", request);
    }

    private Mono<ResponseEntity<S3ErrorResponse>> respond(int status, String code, String message,
                                                         ServerHttpRequest request) {
        if (HttpMethod.HEAD.equals(request.getMethod())) {
            return Mono.just(ResponseEntity.status(status).build());
        }
        S3ErrorResponse error = S3ErrorResponse.builder()
                .code(code)
                .message(message)
                .resource(request.getPath().value())
                .requestId(generateRequestId())
                .build();

        return Mono.just(ResponseEntity
                .status(status)
                .contentType(APPLICATION_XML)
                .body(error));
    }

    private String generateRequestId() {
        return UUID.randomUUID().toString().replace("-", "").toUpperCase().substring(0, 16);
    }

    /**
     * S3-standard error response
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JacksonXmlRootElement(localName = "Error")
    public static class S3ErrorResponse {
        @JacksonXmlProperty(localName = "Code")
        private String code;

        @JacksonXmlProperty(localName = "Message")
        private String message;

        @JacksonXmlProperty(localName = "Resource")
        private String resource;

        @JacksonXmlProperty(localName = "RequestId")
        private String requestId;
    }
}
