package io.mural.server.dto;

/** JSON response for POST /login. */
public class LoginResponse {
    public String token;
}
