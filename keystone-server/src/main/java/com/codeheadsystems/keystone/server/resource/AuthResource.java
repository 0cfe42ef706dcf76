package com.codeheadsystems.keystone.server.resource;

import com.codeheadsystems.keystone.model.auth.AuthResponse;
import com.codeheadsystems.keystone.model.auth.LoginRequest;
import com.codeheadsystems.keystone.model.auth.RegisterRequest;
import com.codeheadsystems.keystone.server.manager.AuthenticationManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * JAX-RS resource for account signup and login.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /api/auth/signup}: create an account, 201 with token and account</li>
 *   <li>{@code POST /api/auth/login}: authenticate, 200 with token and account</li>
 * </ul>
 * <p>
 * All logic lives in {@link AuthenticationManager}. Refusals propagate as
 * {@code AuthFailureException} and are rendered by {@link AuthFailureExceptionMapper}, which
 * must be registered alongside this resource.
 */
@Path("/api/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private final AuthenticationManager authenticationManager;

  /**
   * Instantiates a new Auth resource.
   *
   * @param authenticationManager the authentication manager
   */
  public AuthResource(AuthenticationManager authenticationManager) {
    this.authenticationManager = authenticationManager;
  }

  /**
   * Creates a new account.
   */
  @POST
  @Path("/signup")
  public Response signup(RegisterRequest req) {
    AuthResponse response = authenticationManager.register(req);
    return Response.status(Response.Status.CREATED).entity(response).build();
  }

  /**
   * Logs an existing account in.
   */
  @POST
  @Path("/login")
  public AuthResponse login(LoginRequest req) {
    return authenticationManager.login(req);
  }
}
