package com.evoila.rosetta.common.controller;

import com.evoila.rosetta.common.model.DetectRequest;
import com.evoila.rosetta.common.model.DetectionResponse;
import com.evoila.rosetta.common.model.DialectInfo;
import com.evoila.rosetta.common.model.ParseRequest;
import com.evoila.rosetta.common.model.ParseResponse;
import com.evoila.rosetta.common.model.TranslateRequest;
import com.evoila.rosetta.common.model.TranslationResponse;
import com.evoila.rosetta.common.service.QueryTranslationService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * HTTP access to detection, parsing and translation. Failures propagate to the global exception
 * handler.
 */
@Slf4j
@RestController
@RequestMapping(value = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class QueryController {

  private final QueryTranslationService translationService;

  @GetMapping("/dialects")
  public Mono<ResponseEntity<List<DialectInfo>>> dialects() {
    return Mono.fromCallable(translationService::dialects).map(ResponseEntity::ok);
  }

  @PostMapping(value = "/detect", consumes = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ResponseEntity<DetectionResponse>> detect(@RequestBody DetectRequest request) {
    log.debug("QueryController: detect request");
    return Mono.fromCallable(() -> translationService.detect(request.query()))
        .map(ResponseEntity::ok);
  }

  @PostMapping(value = "/parse", consumes = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ResponseEntity<ParseResponse>> parse(@RequestBody ParseRequest request) {
    log.debug("QueryController: parse request for dialect {}", request.dialect());
    return Mono.fromCallable(() -> translationService.parse(request.query(), request.dialect()))
        .map(ResponseEntity::ok);
  }

  @PostMapping(value = "/translate", consumes = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ResponseEntity<TranslationResponse>> translate(
      @RequestBody TranslateRequest request) {
    log.debug(
        "QueryController: translate request from {} to {}", request.source(), request.target());
    return Mono.fromCallable(
            () ->
                translationService.translate(
                    request.query(), request.source(), request.target()))
        .map(ResponseEntity::ok);
  }
}
