package com.evoila.rosetta.common.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import com.evoila.rosetta.common.exception.QueryParseException;
import com.evoila.rosetta.common.exception.QueryTranslationException;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.MethodNotAllowedException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;
import reactor.test.StepVerifier;
import tools.jackson.databind.json.JsonMapper;

class GlobalExceptionHandlerTest {

  private GlobalExceptionHandler handler;
  private MockServerWebExchange exchange;

  @BeforeEach
  void setUp() {
    handler = new GlobalExceptionHandler(JsonMapper.builder().build());
    exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/translate"));
  }

  @Test
  void parseException_ShouldMapToBadRequest() {
    // Given
    QueryParseException ex = QueryParseException.at("Unexpected token ')'", "sum(x))", 6);

    // When
    GlobalExceptionHandler.ErrorInfo info = handler.determineErrorResponse(exchange, ex);

    // Then
    assertThat(info.status()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(info.errorCode()).isEqualTo("PARSE_ERROR");
    assertThat(info.message()).isEqualTo(ex.getMessage());
  }

  @Test
  void translationException_ShouldMapToBadRequest() {
    // Given
    QueryTranslationException ex =
        new QueryTranslationException("No translator for dialect: graphite", "graphite");

    // When
    GlobalExceptionHandler.ErrorInfo info = handler.determineErrorResponse(exchange, ex);

    // Then
    assertThat(info.status()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(info.errorCode()).isEqualTo("TRANSLATION_ERROR");
    assertThat(info.message()).isEqualTo("No translator for dialect: graphite");
  }

  @Test
  void illegalArgument_ShouldMapToInvalidParams() {
    GlobalExceptionHandler.ErrorInfo info =
        handler.determineErrorResponse(
            exchange, new IllegalArgumentException("Unknown dialect: cobol"));

    assertThat(info.status()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(info.errorCode()).isEqualTo("INVALID_PARAMS");
    assertThat(info.message()).isEqualTo("Invalid request parameters: Unknown dialect: cobol");
  }

  @Test
  void malformedJson_ShouldMapToInvalidJson() {
    // Given
    Throwable ex = catchThrowable(() -> JsonMapper.builder().build().readTree("{\"query\":"));

    // When
    GlobalExceptionHandler.ErrorInfo info = handler.determineErrorResponse(exchange, ex);

    // Then
    assertThat(info.status()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(info.errorCode()).isEqualTo("INVALID_JSON");
  }

  @Test
  void methodNotAllowed_ShouldMapTo405() {
    MethodNotAllowedException ex =
        new MethodNotAllowedException(HttpMethod.DELETE, Set.of(HttpMethod.POST));

    GlobalExceptionHandler.ErrorInfo info = handler.determineErrorResponse(exchange, ex);

    assertThat(info.status()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
    assertThat(info.errorCode()).isEqualTo("METHOD_NOT_ALLOWED");
  }

  @Test
  void unsupportedMediaType_ShouldMapTo415() {
    GlobalExceptionHandler.ErrorInfo info =
        handler.determineErrorResponse(
            exchange, new UnsupportedMediaTypeStatusException("text/plain"));

    assertThat(info.status()).isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    assertThat(info.errorCode()).isEqualTo("UNSUPPORTED_MEDIA_TYPE");
  }

  @Test
  void responseStatus_ShouldKeepStatusAndReason() {
    GlobalExceptionHandler.ErrorInfo info =
        handler.determineErrorResponse(
            exchange, new ResponseStatusException(HttpStatus.NOT_FOUND, "No such route"));

    assertThat(info.status()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(info.message()).isEqualTo("No such route");
    assertThat(info.errorCode()).isEqualTo("RESPONSE_STATUS_ERROR");
  }

  @Test
  void unexpectedException_ShouldHideDetails() {
    GlobalExceptionHandler.ErrorInfo info =
        handler.determineErrorResponse(exchange, new IllegalStateException("boom"));

    assertThat(info.status()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(info.message()).isEqualTo("Internal server error");
    assertThat(info.errorCode()).isEqualTo("INTERNAL_ERROR");
  }

  @Test
  void handle_ShouldWriteJsonErrorBody() {
    // Given
    QueryParseException ex = new QueryParseException("Unexpected end of query");

    // When
    StepVerifier.create(handler.handle(exchange, ex)).verifyComplete();

    // Then
    assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    StepVerifier.create(exchange.getResponse().getBodyAsString())
        .expectNextMatches(
            body -> {
              assertThat(body).contains("\"errorCode\":\"PARSE_ERROR\"");
              assertThat(body).contains("\"message\":\"Unexpected end of query\"");
              assertThat(body).contains("\"status\":400");
              assertThat(body).contains("\"path\":\"/api/v1/translate\"");
              return true;
            })
        .verifyComplete();
  }
}
