package com.codeheadsystems.keystone.server.resource;

import com.codeheadsystems.keystone.model.auth.ErrorResponse;
import com.codeheadsystems.keystone.server.manager.AuthFailureException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders refused auth requests as an {@link ErrorResponse} with a status per reason:
 * {@code INVALID_REQUEST} → 422, {@code INVALID_EMAIL} and {@code EMAIL_TAKEN} → 400,
 * {@code INVALID_CREDENTIALS} → 401.
 */
@Provider
public class AuthFailureExceptionMapper implements ExceptionMapper<AuthFailureException> {

  static final int UNPROCESSABLE_ENTITY = 422;

  private static final Logger log = LoggerFactory.getLogger(AuthFailureExceptionMapper.class);

  @Override
  public Response toResponse(AuthFailureException e) {
    int status = switch (e.reason()) {
      case INVALID_REQUEST -> UNPROCESSABLE_ENTITY;
      case INVALID_EMAIL, EMAIL_TAKEN -> Response.Status.BAD_REQUEST.getStatusCode();
      case INVALID_CREDENTIALS -> Response.Status.UNAUTHORIZED.getStatusCode();
    };
    log.debug("Auth request refused ({}): {}", e.reason(), e.getMessage());
    return Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(e.getMessage()))
        .build();
  }
}
