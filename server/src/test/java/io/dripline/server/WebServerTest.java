package io.dripline.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dripline.core.Address;
import io.dripline.core.Hash32;
import io.dripline.core.access.OwnerAccessControl;
import io.dripline.core.ledger.InMemoryToken;
import io.dripline.server.events.ClaimFeed;
import io.dripline.storage.DurableDistributorStore;
import io.dripline.storage.FileSnapshotter;
import io.dripline.storage.FileWal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP API over a real Undertow instance.
 *
 * Focus:
 *  - Seed, claim, batch and query round trips.
 *  - Domain errors map to 403/409/422/502 with an error code body.
 *  - Bad input, unknown paths, wrong methods and large bodies.
 */
class WebServerTest {

    private static final int PORT = 18480; // test-only port
    private static final String BASE = "http://localhost:" + PORT;

    private static final Address OWNER = Address.ofLong(0x0A11);
    private static final Address FUNDER = Address.ofLong(0xF00D);
    private static final Address CUSTODY = Address.ofLong(0xC0DE);
    private static final Address ALICE = Address.ofLong(0xA1);
    private static final Address BOB = Address.ofLong(0xB0B);

    @TempDir
    Path dir;

    private final ObjectMapper json = new ObjectMapper();
    private final TestDistribution d = TestDistribution.of(ALICE, 100, BOB, 250);
    private InMemoryToken token;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        token = new InMemoryToken();
        token.mint(FUNDER, BigInteger.valueOf(1_000));
        token.approve(FUNDER, CUSTODY, BigInteger.valueOf(1_000));

        var store = new DurableDistributorStore(
                new FileWal(dir.resolve("wal"), 1024 * 1024),
                new FileSnapshotter(dir.resolve("snap")));
        var service = new DistributorService(store, token.ledgerFor(CUSTODY), new OwnerAccessControl(OWNER), CUSTODY);
        var feed = new ClaimFeed(100);
        service.addListener(feed);

        server = new WebServer(PORT, service, feed);
        server.start();
        client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    // ---------- helpers ----------

    private HttpResponse<String> send(String method, String path, String body, Address caller) throws Exception {
        var b = HttpRequest.newBuilder(URI.create(BASE + path)).timeout(Duration.ofSeconds(5));
        if (caller != null) b.header(WebServer.CALLER_HEADER, caller.toHex());
        b.method(method, body == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofString(body));
        if (body != null) b.header("Content-Type", "application/json");
        return client.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return send("GET", path, null, null);
    }

    private JsonNode body(HttpResponse<String> r) throws Exception {
        return json.readTree(r.body());
    }

    private HttpResponse<String> seed(long period, Address caller, String total) throws Exception {
        String body = json.writeValueAsString(Map.of(
                "root", d.root().toHex(),
                "totalAllocation", total,
                "fundingSource", FUNDER.toHex()));
        return send("PUT", "/admin/roots/" + period, body, caller);
    }

    private String claimBody(long period, int index) throws Exception {
        var leaf = d.leaf(index);
        var body = new LinkedHashMap<String, Object>();
        body.put("index", leaf.index());
        body.put("account", leaf.account().toHex());
        body.put("period", period);
        body.put("balance", leaf.balance().toString());
        body.put("proof", d.proof(index).stream().map(Hash32::toHex).toList());
        return json.writeValueAsString(body);
    }

    // ---------- happy paths ----------

    @Test
    void health_endpoint_returns_ok() throws Exception {
        var r = get("/admin/health");
        assertEquals(200, r.statusCode());
        assertEquals("ok", body(r).get("status").asText());
    }

    @Test
    void seed_claim_and_query_round_trip() throws Exception {
        assertEquals(200, seed(3, OWNER, "350").statusCode());

        var claim = send("POST", "/claims", claimBody(3, 1), null);
        assertEquals(200, claim.statusCode(), claim.body());
        JsonNode c = body(claim);
        assertTrue(c.get("ok").asBoolean());
        assertEquals(BOB.toHex(), c.get("account").asText());
        assertEquals("250", c.get("amount").asText());
        assertEquals(BigInteger.valueOf(250), token.balanceOf(BOB));

        var one = body(get("/claims/3/1"));
        assertTrue(one.get("claimed").asBoolean());

        var status = body(get("/claims/status?indices=1,0&periodBegin=3&periodEnd=4"));
        assertEquals(List.of(true, false), List.of(
                status.get("claimed").get(0).asBoolean(), status.get("claimed").get(1).asBoolean()));

        var roots = body(get("/roots?periodBegin=2&periodEnd=3")).get("roots");
        assertEquals(Hash32.ZERO.toHex(), roots.get(0).asText());
        assertEquals(d.root().toHex(), roots.get(1).asText());

        var events = body(get("/events?after=0"));
        assertEquals(1, events.get("events").size());
        assertEquals(1, events.get("events").get(0).get("seq").asLong());
        assertEquals(3, events.get("events").get(0).get("period").asLong());
    }

    @Test
    void batch_claim_returns_total() throws Exception {
        seed(1, OWNER, "350");
        seed(2, OWNER, "350");
        var leaf = d.leaf(0);
        String body = json.writeValueAsString(Map.of(
                "account", ALICE.toHex(),
                "entries", List.of(
                        Map.of("index", 0, "period", 1, "balance", leaf.balance().toString(),
                                "proof", d.proof(0).stream().map(Hash32::toHex).toList()),
                        Map.of("index", 0, "period", 2, "balance", leaf.balance().toString(),
                                "proof", d.proof(0).stream().map(Hash32::toHex).toList()))));

        var r = send("POST", "/claims/batch", body, null);
        assertEquals(200, r.statusCode(), r.body());
        assertEquals("200", body(r).get("total").asText());
        assertEquals(2, body(r).get("claimed").size());
        assertEquals(BigInteger.valueOf(200), token.balanceOf(ALICE));
    }

    @Test
    void ownership_transfer_flow() throws Exception {
        var propose = send("POST", "/admin/owner",
                "{\"newOwner\":\"" + BOB.toHex() + "\",\"twoStep\":true}", OWNER);
        assertEquals(200, propose.statusCode());
        assertEquals(BOB.toHex(), body(propose).get("pendingOwner").asText());

        var accept = send("POST", "/admin/owner/accept", null, BOB);
        assertEquals(200, accept.statusCode());
        assertEquals(BOB.toHex(), body(get("/admin/owner")).get("owner").asText());
        assertTrue(body(get("/admin/owner")).get("pendingOwner").isNull());

        assertEquals(403, seed(1, OWNER, "1").statusCode());
        assertEquals(200, seed(1, BOB, "1").statusCode());
    }

    // ---------- domain errors ----------

    @Test
    void domain_errors_map_to_status_codes() throws Exception {
        var unauthorized = seed(1, ALICE, "350");
        assertEquals(403, unauthorized.statusCode());
        assertEquals("UNAUTHORIZED", body(unauthorized).get("error").asText());

        assertEquals(200, seed(1, OWNER, "350").statusCode());
        var again = seed(1, OWNER, "350");
        assertEquals(409, again.statusCode());
        assertEquals("ROOT_ALREADY_SET", body(again).get("error").asText());

        var badProof = send("POST", "/claims", claimBody(2, 0), null);
        assertEquals(422, badProof.statusCode());
        assertEquals("INVALID_PROOF", body(badProof).get("error").asText());

        assertEquals(200, send("POST", "/claims", claimBody(1, 0), null).statusCode());
        var dup = send("POST", "/claims", claimBody(1, 0), null);
        assertEquals(409, dup.statusCode());
        assertEquals("ALREADY_CLAIMED", body(dup).get("error").asText());

        var mismatch = get("/claims/status?indices=1&periodBegin=1&periodEnd=2");
        assertEquals(400, mismatch.statusCode());
        assertEquals("LENGTH_MISMATCH", body(mismatch).get("error").asText());
    }

    @Test
    void refused_payout_is_bad_gateway() throws Exception {
        // Seeded with no funding, so custody cannot pay.
        assertEquals(200, seed(1, OWNER, "0").statusCode());

        var r = send("POST", "/claims", claimBody(1, 1), null);
        assertEquals(502, r.statusCode());
        assertEquals("TRANSFER_FAILED", body(r).get("error").asText());
        assertFalse(body(get("/claims/1/1")).get("claimed").asBoolean());
    }

    // ---------- transport errors ----------

    @Test
    void invalid_json_is_400() throws Exception {
        var r = send("POST", "/claims", "{not json", null);
        assertEquals(400, r.statusCode());
        assertEquals("invalid JSON", body(r).get("message").asText());
    }

    @Test
    void missing_field_and_bad_hex_are_400() throws Exception {
        var missing = send("POST", "/claims", "{\"account\":\"" + ALICE.toHex() + "\"}", null);
        assertEquals(400, missing.statusCode());
        assertEquals("BAD_REQUEST", body(missing).get("error").asText());

        var badHex = seed(1, null, "1");
        assertEquals(400, badHex.statusCode(), "missing caller header");

        var badQuery = get("/roots?periodBegin=x&periodEnd=2");
        assertEquals(400, badQuery.statusCode());
    }

    @Test
    void event_limit_out_of_range_is_400() throws Exception {
        assertEquals(400, get("/events?limit=0").statusCode());
        assertEquals(400, get("/events?limit=1001").statusCode());
        assertEquals(400, get("/events?limit=4294967297").statusCode(), "must not wrap to 1");
        assertEquals(200, get("/events?limit=1000").statusCode());
    }

    @Test
    void unknown_path_is_404_and_wrong_method_is_405() throws Exception {
        assertEquals(404, get("/nope").statusCode());
        assertEquals(404, get("/claims/1/2/3").statusCode());
        assertEquals(405, send("DELETE", "/roots?periodBegin=1&periodEnd=1", null, null).statusCode());
        assertEquals(405, get("/claims").statusCode());
    }

    @Test
    void oversized_body_is_413() throws Exception {
        String big = "x".repeat(1024 * 1024 + 1);
        var r = send("POST", "/claims", big, null);
        assertEquals(413, r.statusCode());
    }
}
