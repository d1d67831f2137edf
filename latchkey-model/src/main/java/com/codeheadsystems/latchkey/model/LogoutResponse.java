package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a logout.
 * <p>
 * Logout always succeeds, but what it achieved depends on the server's configuration, so the
 * response states it explicitly:
 * <ul>
 *   <li>{@code REVOKED}: the token was revoked server-side and is rejected from now on.</li>
 *   <li>{@code NOT_ACTIVE}: the token was already expired, revoked, or invalid.</li>
 *   <li>{@code CLIENT_DISCARD}: the server keeps no revocation state; the token remains valid
 *       until it expires and the client must discard it.</li>
 * </ul>
 * <p>
 * Used by: {@code POST /auth/logout} response
 *
 * @param ok      always {@code true}
 * @param mode    one of {@code REVOKED}, {@code NOT_ACTIVE}, {@code CLIENT_DISCARD}
 * @param message human-readable description of the mode
 */
public record LogoutResponse(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("mode") String mode,
    @JsonProperty("message") String message) {
}
