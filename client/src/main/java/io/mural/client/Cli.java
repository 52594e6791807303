// file: client/src/main/java/io/mural/client/Cli.java
package io.mural.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple CLI for interacting with a running board node over HTTP.
 *
 * Usage:
 *   mural-cli [--base-url http://host:port] [--admin-token T] login <user> <password>
 *   mural-cli [...] post <token> <text...>
 *   mural-cli [...] list
 *   mural-cli [...] offline | online | reconcile | peers
 *
 * Examples:
 *   TOKEN=$(mural-cli login alice password1)
 *   mural-cli post "$TOKEN" hello board
 *   mural-cli --base-url http://localhost:8081 list
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";

    /** Global options followed by the command and its arguments. */
    record Options(String baseUrl, String adminToken, String[] rest) {
    }

    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();
    private final String baseUrl;
    private final String adminToken;

    private Cli(String baseUrl, String adminToken) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.adminToken = adminToken;
    }

    public static void main(String[] args) {
        try {
            Options opts = parseOptions(args);
            String[] rest = opts.rest();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(opts.baseUrl(), opts.adminToken());

            switch (cmd) {
                case "login" -> {
                    if (rest.length != 3) {
                        usageAndExit("login requires <user> <password>");
                    }
                    cli.login(rest[1], rest[2]);
                }
                case "post" -> {
                    if (rest.length < 3) {
                        usageAndExit("post requires <token> <text...>");
                    }
                    cli.post(rest[1], String.join(" ", Arrays.copyOfRange(rest, 2, rest.length)));
                }
                case "list" -> cli.list();
                case "offline", "online", "reconcile" -> cli.admin("POST", "/admin/" + cmd);
                case "peers" -> cli.admin("GET", "/admin/peers");
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Options parseOptions(String[] args) {
        String baseUrl = DEFAULT_BASE_URL;
        String adminToken = null;
        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new CliException(flag + " requires a value");
            }
            switch (flag) {
                case "--base-url" -> baseUrl = args[i + 1];
                case "--admin-token" -> adminToken = args[i + 1];
                default -> throw new CliException("unknown option: " + flag);
            }
            i += 2;
        }
        return new Options(baseUrl, adminToken, Arrays.copyOfRange(args, i, args.length));
    }

    /** One board line: "[node-a:3] alice: hello". */
    static String formatMessage(JsonNode m) {
        return "[" + m.path("id").asText() + "] " + m.path("author").asText() + ": " + m.path("content").asText();
    }

    private void login(String user, String password) throws Exception {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("username", user);
        body.put("password", password);

        JsonNode resp = send("POST", "/login", json.writeValueAsString(body), 200, false);
        System.out.println(resp.path("token").asText());
    }

    private void post(String token, String text) throws Exception {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("content", text);
        body.put("token", token);

        JsonNode resp = send("POST", "/messages", json.writeValueAsString(body), 201, false);
        System.out.println(formatMessage(resp));
    }

    private void list() throws Exception {
        JsonNode resp = send("GET", "/messages", null, 200, false);
        JsonNode messages = resp.path("messages");
        if (messages.isEmpty()) {
            System.out.println("(no messages)");
            return;
        }
        for (JsonNode m : messages) {
            System.out.println(formatMessage(m));
        }
    }

    private void admin(String method, String path) throws Exception {
        JsonNode resp = send(method, path, method.equals("POST") ? "" : null, 200, true);
        System.out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(resp));
    }

    private JsonNode send(String method, String path, String body, int expected, boolean admin) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/json")
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (admin && adminToken != null) {
            b.header("X-Admin-Token", adminToken);
        }

        HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != expected) {
            throw new CliException(method + " " + path + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return json.readTree(resp.body());
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  mural-cli [--base-url http://host:port] [--admin-token T] login <user> <password>
                  mural-cli [...] post <token> <text...>
                  mural-cli [...] list
                  mural-cli [...] offline | online | reconcile | peers
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
