package io.dripline.client;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for the CLI against a stub HTTP server that records requests:
 *  - Commands map to the right method, path, header and JSON body.
 *  - Non-200 replies surface as CliException with the server's body.
 *  - Argument errors are reported before any request is sent.
 */
class CliTest {

    private record Seen(String method, String uri, String caller, String body) {}

    private HttpServer stub;
    private final List<Seen> seen = new ArrayList<>();
    private volatile int replyStatus = 200;
    private volatile String replyBody = "{\"ok\":true}";
    private String baseUrl;

    @BeforeEach
    void start() throws IOException {
        stub = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        stub.createContext("/", ex -> {
            String body = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            synchronized (seen) {
                seen.add(new Seen(ex.getRequestMethod(), ex.getRequestURI().toString(),
                        ex.getRequestHeaders().getFirst(Cli.CALLER_HEADER), body));
            }
            byte[] out = replyBody.getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(replyStatus, out.length);
            ex.getResponseBody().write(out);
            ex.close();
        });
        stub.start();
        baseUrl = "http://127.0.0.1:" + stub.getAddress().getPort() + "/";
    }

    @AfterEach
    void stop() {
        stub.stop(0);
    }

    private String run(String caller, String... cmd) throws Exception {
        return new Cli(HttpClient.newHttpClient(), baseUrl, caller).run(List.of(cmd));
    }

    @Test
    void claim_posts_json_body() throws Exception {
        String out = run(null, "claim", "3", "17", "0xaa", "1000", "0x01,0x02");

        assertEquals("{\"ok\":true}", out);
        Seen s = seen.get(0);
        assertEquals("POST", s.method());
        assertEquals("/claims", s.uri());
        assertEquals("{\"index\":17,\"account\":\"0xaa\",\"period\":3,\"balance\":\"1000\","
                + "\"proof\":[\"0x01\",\"0x02\"]}", s.body());
    }

    @Test
    void dash_means_empty_proof() throws Exception {
        run(null, "claim", "0", "0", "0xaa", "5", "-");
        assertTrue(seen.get(0).body().endsWith("\"proof\":[]}"));
    }

    @Test
    void queries_build_paths() throws Exception {
        run(null, "status", "4", "9");
        run(null, "status-range", "10", "11", "5,7");
        run(null, "roots", "1", "3");
        run(null, "events", "12", "50");

        assertEquals(List.of(
                "/claims/4/9",
                "/claims/status?indices=5,7&periodBegin=10&periodEnd=11",
                "/roots?periodBegin=1&periodEnd=3",
                "/events?after=12&limit=50"), seen.stream().map(Seen::uri).toList());
    }

    @Test
    void admin_commands_send_caller_header() throws Exception {
        run("0xowner", "seed", "2", "0xroot", "500", "0xfunder");
        run("0xowner", "transfer-owner", "0xnext", "--two-step");

        assertEquals("PUT", seen.get(0).method());
        assertEquals("/admin/roots/2", seen.get(0).uri());
        assertEquals("0xowner", seen.get(0).caller());
        assertEquals("{\"root\":\"0xroot\",\"totalAllocation\":\"500\",\"fundingSource\":\"0xfunder\"}",
                seen.get(0).body());
        assertEquals("{\"newOwner\":\"0xnext\",\"twoStep\":true}", seen.get(1).body());
    }

    @Test
    void admin_command_without_caller_is_rejected_locally() {
        assertThrows(Cli.CliException.class, () -> run(null, "accept-owner"));
        assertTrue(seen.isEmpty());
    }

    @Test
    void error_reply_surfaces_body() {
        replyStatus = 409;
        replyBody = "{\"error\":\"ALREADY_CLAIMED\"}";

        var e = assertThrows(Cli.CliException.class, () -> run(null, "claim", "1", "1", "0xaa", "1", "-"));
        assertTrue(e.getMessage().contains("409"));
        assertTrue(e.getMessage().contains("ALREADY_CLAIMED"));
    }

    @Test
    void bad_arguments_are_rejected() {
        assertThrows(Cli.CliException.class, () -> run(null, "status", "1"));
        assertThrows(Cli.CliException.class, () -> run(null, "status", "x", "1"));
        assertThrows(Cli.CliException.class, () -> run(null, "frobnicate"));
        assertThrows(Cli.CliException.class, () -> Cli.Options.parse(new String[]{"--base-url"}));
        assertTrue(seen.isEmpty());
    }

    @Test
    void options_precede_command() {
        var o = Cli.Options.parse(new String[]{"--caller", "0xabc", "--base-url", "http://h:1", "owner"});
        assertEquals("0xabc", o.caller());
        assertEquals("http://h:1", o.baseUrl());
        assertEquals(List.of("owner"), o.command());
    }
}
