package com.evoila.rosetta.common.model;

/**
 * Error body returned for every failed request.
 *
 * @param error HTTP reason phrase
 * @param message what went wrong, including the parser position where one is known
 * @param status HTTP status code
 * @param errorCode stable machine readable code such as {@code PARSE_ERROR}
 * @param timestamp ISO-8601 instant of the failure
 * @param path request path
 */
public record GlobalErrorResponse(
    String error, String message, int status, String errorCode, String timestamp, String path) {}
