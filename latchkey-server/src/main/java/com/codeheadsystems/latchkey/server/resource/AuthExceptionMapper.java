package com.codeheadsystems.latchkey.server.resource;

import com.codeheadsystems.latchkey.model.ErrorResponse;
import com.codeheadsystems.latchkey.server.exception.AuthError;
import com.codeheadsystems.latchkey.server.exception.AuthException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps {@link AuthException} to its HTTP status with an {@link ErrorResponse} body.
 */
@Provider
public class AuthExceptionMapper implements ExceptionMapper<AuthException> {

  @Override
  public Response toResponse(AuthException exception) {
    AuthError error = exception.error();
    return Response.status(error.httpStatus())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(error.wireName(), error.message()))
        .build();
  }
}
