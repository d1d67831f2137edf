package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a single security question.
 * <p>
 * Used by: {@code POST /auth/security-question} response and as the element type of
 * {@link SecurityQuestionsResponse}
 *
 * @param id     stable identifier to send back in {@link SignupRequest#securityQuestion()}
 * @param prompt the question text shown to the user
 */
public record SecurityQuestionResponse(
    @JsonProperty("id") String id,
    @JsonProperty("prompt") String prompt) {
}
