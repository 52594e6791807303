package io.mural.server.auth;

/** Missing, unknown or mismatched credentials. Requests failing with this never mutate state. */
public class AuthorizationException extends RuntimeException {

    public AuthorizationException(String message) {
        super(message);
    }
}
