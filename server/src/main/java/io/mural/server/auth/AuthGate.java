package io.mural.server.auth;

/**
 * Capability check in front of board writes.
 * The token format and how tokens are issued are up to the implementation.
 */
public interface AuthGate {

    /**
     * @return the principal the token belongs to
     * @throws AuthorizationException if the token is missing or not valid
     */
    String authenticate(String token);
}
