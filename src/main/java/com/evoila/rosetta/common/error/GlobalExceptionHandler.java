package com.evoila.rosetta.common.error;

import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.exception.QueryTranslationException;
import com.evoila.rosetta.common.model.GlobalErrorResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.webflux.error.ErrorWebExceptionHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.server.MethodNotAllowedException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Maps every failure to a JSON {@link GlobalErrorResponse}. Parse and translation errors are the
 * caller's fault and come back as 400, never as a server error.
 */
@Slf4j
@Configuration
@Order(-2) // Higher priority than DefaultErrorWebExceptionHandler
@RequiredArgsConstructor
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

  private final JsonMapper jsonMapper;

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
    logRequestDetails(exchange, ex);

    ErrorInfo errorInfo = determineErrorResponse(exchange, ex);

    log.debug(
        "Returning error response: {} {} - {}",
        errorInfo.status().value(),
        errorInfo.status().getReasonPhrase(),
        errorInfo.message());

    return writeErrorResponse(
        exchange, errorInfo.status(), errorInfo.message(), errorInfo.errorCode());
  }

  private void logRequestDetails(ServerWebExchange exchange, Throwable ex) {
    String path = exchange.getRequest().getPath().value();
    String method = exchange.getRequest().getMethod().name();
    log.debug("Request {} {} failed with {}", method, path, ex.getClass().getSimpleName());
  }

  /** Determines the appropriate error response based on exception type */
  ErrorInfo determineErrorResponse(ServerWebExchange exchange, Throwable ex) {
    if (ex instanceof QueryParseException e) {
      return handleParseException(e);
    } else if (ex instanceof QueryTranslationException e) {
      return handleTranslationException(e);
    } else if (ex instanceof MethodNotAllowedException e) {
      return handleMethodNotAllowedException(exchange, e);
    } else if (ex instanceof UnsupportedMediaTypeStatusException e) {
      return handleUnsupportedMediaTypeException(e);
    } else if (ex instanceof JacksonException e) {
      return handleJacksonException(e);
    } else if (ex instanceof IllegalArgumentException e) {
      return handleIllegalArgumentException(e);
    } else if (ex instanceof ResponseStatusException e) {
      return handleResponseStatusException(e);
    }
    return handleGenericException(ex);
  }

  private ErrorInfo handleParseException(QueryParseException ex) {
    log.warn("Query parse error: {}", ex.getMessage());
    return new ErrorInfo(HttpStatus.BAD_REQUEST, ex.getMessage(), "PARSE_ERROR");
  }

  private ErrorInfo handleTranslationException(QueryTranslationException ex) {
    log.warn("Query translation error: {}", ex.getMessage());
    return new ErrorInfo(HttpStatus.BAD_REQUEST, ex.getMessage(), "TRANSLATION_ERROR");
  }

  private ErrorInfo handleMethodNotAllowedException(
      ServerWebExchange exchange, MethodNotAllowedException ex) {
    log.warn(
        "Method not allowed: {} for {}",
        ex.getHttpMethod(),
        exchange.getRequest().getPath().value());
    return new ErrorInfo(
        HttpStatus.METHOD_NOT_ALLOWED,
        "Method " + ex.getHttpMethod() + " not allowed",
        "METHOD_NOT_ALLOWED");
  }

  private ErrorInfo handleUnsupportedMediaTypeException(UnsupportedMediaTypeStatusException ex) {
    log.warn("Unsupported media type: {}", ex.getMessage());
    return new ErrorInfo(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported media type", "UNSUPPORTED_MEDIA_TYPE");
  }

  private ErrorInfo handleJacksonException(JacksonException ex) {
    log.warn("JSON processing error: {}", ex.getMessage());
    return new ErrorInfo(HttpStatus.BAD_REQUEST, "Invalid JSON format", "INVALID_JSON");
  }

  private ErrorInfo handleIllegalArgumentException(IllegalArgumentException ex) {
    log.warn("Invalid parameters: {}", ex.getMessage());
    return new ErrorInfo(
        HttpStatus.BAD_REQUEST, "Invalid request parameters: " + ex.getMessage(), "INVALID_PARAMS");
  }

  private ErrorInfo handleResponseStatusException(ResponseStatusException ex) {
    String message = ex.getReason() != null ? ex.getReason() : "Request failed";
    log.warn("Response status exception: {} - {}", ex.getStatusCode(), message);
    return new ErrorInfo(
        HttpStatus.valueOf(ex.getStatusCode().value()), message, "RESPONSE_STATUS_ERROR");
  }

  private ErrorInfo handleGenericException(Throwable ex) {
    log.error("Unhandled internal server error", ex);
    return new ErrorInfo(
        HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "INTERNAL_ERROR");
  }

  /** Internal record for passing error info between methods */
  record ErrorInfo(HttpStatus status, String message, String errorCode) {}

  private Mono<Void> writeErrorResponse(
      ServerWebExchange exchange, HttpStatus status, String message, String errorCode) {
    exchange.getResponse().setStatusCode(status);
    exchange.getResponse().getHeaders().add("Content-Type", MediaType.APPLICATION_JSON_VALUE);

    String path = exchange.getRequest().getPath().value();
    GlobalErrorResponse errorResponse =
        new GlobalErrorResponse(
            status.getReasonPhrase(),
            message,
            status.value(),
            errorCode,
            Instant.now().toString(),
            path);

    String errorJson;
    try {
      errorJson = jsonMapper.writeValueAsString(errorResponse);
    } catch (JacksonException e) {
      log.error("Failed to serialize error response", e);
      errorJson =
          String.format(
              "{\"error\":\"%s\",\"message\":\"%s\",\"status\":%d}",
              status.getReasonPhrase(), errorCode, status.value());
    }

    DataBuffer buffer =
        exchange.getResponse().bufferFactory().wrap(errorJson.getBytes(StandardCharsets.UTF_8));
    return exchange.getResponse().writeWith(Mono.just(buffer));
  }
}
