package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model listing every security question a user may choose at sign-up.
 * <p>
 * Used by: {@code GET /auth/security-questions} response
 *
 * @param questions the fixed set of questions, in display order
 */
public record SecurityQuestionsResponse(
    @JsonProperty("questions") List<SecurityQuestionResponse> questions) {
}
