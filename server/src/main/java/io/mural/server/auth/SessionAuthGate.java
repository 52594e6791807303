// file: server/src/main/java/io/mural/server/auth/SessionAuthGate.java
package io.mural.server.auth;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Username/password login issuing opaque session tokens.
 * <p>
 * Semantics:
 *  - The user table is static configuration (name -> password).
 *  - login() returns a fresh random token per successful call.
 *  - Tokens are node-local and live until the process exits.
 */
public final class SessionAuthGate implements AuthGate {
    private static final Logger log = Logger.getLogger(SessionAuthGate.class.getName());

    private final Map<String, String> users;
    private final Map<String, String> sessions = new ConcurrentHashMap<>();

    public SessionAuthGate(Map<String, String> users) {
        this.users = Map.copyOf(Objects.requireNonNull(users, "users"));
    }

    /**
     * @return a new session token
     * @throws AuthorizationException on unknown user or wrong password
     */
    public String login(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            throw new IllegalArgumentException("username and password required");
        }
        String expected = users.get(username);
        if (expected == null || !expected.equals(password)) {
            log.log(Level.INFO, "Rejected login for {0}", username);
            throw new AuthorizationException("invalid credentials");
        }
        String token = UUID.randomUUID().toString().replace("-", "");
        sessions.put(token, username);
        return token;
    }

    @Override
    public String authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthorizationException("authentication required");
        }
        String user = sessions.get(token.trim());
        if (user == null) {
            throw new AuthorizationException("invalid or expired token");
        }
        return user;
    }
}
