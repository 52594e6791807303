package io.mural.server.dto;

/**
 * JSON body for POST /login.
 * Example:
 *   { "username": "alice", "password": "password1" }
 */
public class LoginRequest {
    public String username;
    public String password;
}
