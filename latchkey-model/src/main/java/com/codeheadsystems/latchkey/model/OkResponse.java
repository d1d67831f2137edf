package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for operations that only report success.
 *
 * @param ok always {@code true}; failures are reported as {@link ErrorResponse}
 */
public record OkResponse(
    @JsonProperty("ok") boolean ok) {

  /**
   * The shared success response.
   */
  public static final OkResponse OK = new OkResponse(true);
}
