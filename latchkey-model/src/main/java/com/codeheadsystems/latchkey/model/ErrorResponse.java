package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for every failed request.
 * <p>
 * The {@code error} kind is deliberately coarse: {@code InvalidCredentials} does not say whether
 * the username exists, and {@code Unauthorized} does not say why a token was rejected.
 *
 * @param error   one of {@code InvalidUsername}, {@code WeakPassword}, {@code DuplicateUsername},
 *                {@code InvalidCredentials}, {@code Unauthorized}, {@code InvalidRequest}
 * @param message fixed human-readable text for the error kind
 */
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message) {
}
