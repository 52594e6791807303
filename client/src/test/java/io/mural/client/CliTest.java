package io.mural.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @Test
    void options_before_command_are_consumed() {
        var opts = Cli.parseOptions(new String[]{
                "--base-url", "http://localhost:8081", "--admin-token", "s3cret", "post", "tok", "hello", "board"});

        assertEquals("http://localhost:8081", opts.baseUrl());
        assertEquals("s3cret", opts.adminToken());
        assertArrayEquals(new String[]{"post", "tok", "hello", "board"}, opts.rest());
    }

    @Test
    void defaults_without_options() {
        var opts = Cli.parseOptions(new String[]{"list"});

        assertEquals(Cli.DEFAULT_BASE_URL, opts.baseUrl());
        assertNull(opts.adminToken());
        assertArrayEquals(new String[]{"list"}, opts.rest());
    }

    @Test
    void bad_options_are_reported() {
        assertThrows(Cli.CliException.class, () -> Cli.parseOptions(new String[]{"--base-url"}));
        assertThrows(Cli.CliException.class, () -> Cli.parseOptions(new String[]{"--verbose", "x", "list"}));
    }

    @Test
    void formats_one_line_per_message() throws Exception {
        var node = new ObjectMapper().readTree(
                "{\"id\":\"node-a:3\",\"author\":\"alice\",\"content\":\"hello\",\"counter\":3}");

        assertEquals("[node-a:3] alice: hello", Cli.formatMessage(node));
    }
}
