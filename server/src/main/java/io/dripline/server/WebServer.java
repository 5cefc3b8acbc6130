// file: server/src/main/java/io/dripline/server/WebServer.java
package io.dripline.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dripline.core.Address;
import io.dripline.core.DistributorException;
import io.dripline.core.ErrorCode;
import io.dripline.core.Hash32;
import io.dripline.core.Uint256;
import io.dripline.server.dto.*;
import io.dripline.server.events.ClaimEvent;
import io.dripline.server.events.ClaimFeed;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over DistributorService.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map DistributorException codes and bad input to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /claims                     single claim
 *   - POST /claims/batch               batched claim for one account
 *   - GET  /claims/status              ?indices=5,7&periodBegin=10&periodEnd=11
 *   - GET  /claims/{period}/{index}    claimed flag of one index
 *   - GET  /roots                      ?periodBegin=..&periodEnd=..
 *   - PUT  /admin/roots/{period}       seed a period (owner only)
 *   - GET  /admin/owner                current and pending owner
 *   - POST /admin/owner                transfer or propose ownership
 *   - POST /admin/owner/accept         accept a proposed ownership
 *   - GET  /events                     ?after=N&limit=M claim notifications
 *   - GET  /admin/health               basic health check
 *
 * Admin calls identify their caller with the X-Dripline-Caller header. The
 * header is trusted as given, so the admin surface must only be reachable
 * from a trusted network.
 */
public final class WebServer {
    static final String CALLER_HEADER = "X-Dripline-Caller";
    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB
    private static final int DEFAULT_EVENT_LIMIT = 100;
    private static final int MAX_EVENT_LIMIT = 1_000;

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final DistributorService distributor;
    private final ClaimFeed feed;

    public WebServer(int port, DistributorService distributor, ClaimFeed feed) {
        this.distributor = distributor;
        this.feed = feed;
        // Handlers block on the store and the ledger, so run them off the IO threads.
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(new BlockingHandler(this::handle))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private record Reply(int status, Object body) {}

    /** Failure with a fixed HTTP status that is not a domain error. */
    private static final class HttpError extends RuntimeException {
        final int status;
        final String code;

        HttpError(int status, String code, String message) {
            super(message);
            this.status = status;
            this.code = code;
        }
    }

    private void handle(HttpServerExchange ex) {
        long start = System.nanoTime();
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        int status = 500;
        long serviceMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            Reply r = route(ex, method, path);
            serviceMs = (System.nanoTime() - sStart) / 1_000_000L;
            status = r.status();
            send(ex, status, r.body());
        } catch (DistributorException de) {
            status = statusFor(de.code());
            error = de;
            send(ex, status, errorBody(de.code().name(), de.getMessage()));
        } catch (HttpError he) {
            status = he.status;
            error = he;
            send(ex, status, errorBody(he.code, he.getMessage()));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, errorBody("BAD_REQUEST", "invalid JSON"));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, errorBody("BAD_REQUEST", bad.getMessage()));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody("INTERNAL", e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, path, status, totalMs, serviceMs, error);
        }
    }

    private Reply route(HttpServerExchange ex, String method, String path) throws IOException {
        String[] seg = Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toArray(String[]::new);
        if (seg.length == 0) throw notFound(path);

        switch (seg[0]) {
            case "claims" -> {
                if (seg.length == 1) {
                    requireMethod(method, "POST");
                    return handleClaim(ex);
                }
                if (seg.length == 2 && "batch".equals(seg[1])) {
                    requireMethod(method, "POST");
                    return handleBatch(ex);
                }
                if (seg.length == 2 && "status".equals(seg[1])) {
                    requireMethod(method, "GET");
                    return handleStatus(ex);
                }
                if (seg.length == 3) {
                    requireMethod(method, "GET");
                    long period = parseLong(seg[1], "period");
                    long index = parseLong(seg[2], "index");
                    var body = new LinkedHashMap<String, Object>();
                    body.put("period", period);
                    body.put("index", index);
                    body.put("claimed", distributor.isClaimed(period, index));
                    return new Reply(200, body);
                }
            }
            case "roots" -> {
                if (seg.length == 1) {
                    requireMethod(method, "GET");
                    return handleRoots(ex);
                }
            }
            case "events" -> {
                if (seg.length == 1) {
                    requireMethod(method, "GET");
                    return handleEvents(ex);
                }
            }
            case "admin" -> {
                if (seg.length == 2 && "health".equals(seg[1])) {
                    return new Reply(200, Map.of("status", "ok"));
                }
                if (seg.length == 3 && "roots".equals(seg[1])) {
                    requireMethod(method, "PUT");
                    return handleSeed(ex, parseLong(seg[2], "period"));
                }
                if (seg.length == 2 && "owner".equals(seg[1])) {
                    if ("GET".equals(method)) return new Reply(200, ownerBody());
                    requireMethod(method, "POST");
                    return handleOwner(ex);
                }
                if (seg.length == 3 && "owner".equals(seg[1]) && "accept".equals(seg[2])) {
                    requireMethod(method, "POST");
                    distributor.acceptOwnership(caller(ex));
                    return new Reply(200, ownerBody());
                }
            }
            default -> {
                // fall through to 404
            }
        }
        throw notFound(path);
    }

    // ---------- handlers ----------

    /** POST /claims */
    private Reply handleClaim(HttpServerExchange ex) throws IOException {
        var req = json.readValue(readBody(ex), ClaimRequest.class);
        ClaimEvent ev = distributor.claim(
                required(req.index, "index"),
                Address.fromHex(required(req.account, "account")),
                required(req.period, "period"),
                Uint256.parse(required(req.balance, "balance"), "balance"),
                parseProof(req.proof));
        return new Reply(200, toResponse(ev));
    }

    /** POST /claims/batch */
    private Reply handleBatch(HttpServerExchange ex) throws IOException {
        var req = json.readValue(readBody(ex), BatchClaimRequest.class);
        Address account = Address.fromHex(required(req.account, "account"));
        List<BatchClaimRequest.Entry> raw = required(req.entries, "entries");

        List<DistributorService.BatchEntry> entries = new ArrayList<>(raw.size());
        for (BatchClaimRequest.Entry e : raw) {
            if (e == null) throw new IllegalArgumentException("entries must not contain null");
            entries.add(new DistributorService.BatchEntry(
                    required(e.index, "index"),
                    required(e.period, "period"),
                    Uint256.parse(required(e.balance, "balance"), "balance"),
                    parseProof(e.proof)));
        }

        DistributorService.BatchResult r = distributor.claimBatch(account, entries);
        var dto = new BatchClaimResponse();
        dto.ok = true;
        dto.claimed = r.claimed().stream().map(WebServer::toResponse).toList();
        dto.total = r.total().toString();
        return new Reply(200, dto);
    }

    /** GET /claims/status?indices=5,7&periodBegin=10&periodEnd=11 */
    private Reply handleStatus(HttpServerExchange ex) {
        String rawIndices = queryParam(ex, "indices");
        List<Long> indices = new ArrayList<>();
        if (rawIndices != null && !rawIndices.isBlank()) {
            for (String s : rawIndices.split(",")) {
                indices.add(parseLong(s.trim(), "index"));
            }
        }
        long begin = requiredLongParam(ex, "periodBegin");
        long end = requiredLongParam(ex, "periodEnd");
        return new Reply(200, Map.of("claimed", distributor.claimStatus(indices, begin, end)));
    }

    /** GET /roots?periodBegin=..&periodEnd=.. */
    private Reply handleRoots(HttpServerExchange ex) {
        long begin = requiredLongParam(ex, "periodBegin");
        long end = requiredLongParam(ex, "periodEnd");
        List<String> roots = distributor.merkleRoots(begin, end).stream().map(Hash32::toHex).toList();
        return new Reply(200, Map.of("roots", roots));
    }

    /** PUT /admin/roots/{period} */
    private Reply handleSeed(HttpServerExchange ex, long period) throws IOException {
        Address caller = caller(ex);
        var req = json.readValue(readBody(ex), SeedRequest.class);
        Hash32 root = Hash32.fromHex(required(req.root, "root"));
        distributor.seed(
                caller,
                period,
                root,
                Uint256.parse(required(req.totalAllocation, "totalAllocation"), "totalAllocation"),
                Address.fromHex(required(req.fundingSource, "fundingSource")));

        var body = new LinkedHashMap<String, Object>();
        body.put("ok", true);
        body.put("period", period);
        body.put("root", root.toHex());
        return new Reply(200, body);
    }

    /** POST /admin/owner */
    private Reply handleOwner(HttpServerExchange ex) throws IOException {
        Address caller = caller(ex);
        var req = json.readValue(readBody(ex), OwnerRequest.class);
        Address next = Address.fromHex(required(req.newOwner, "newOwner"));
        if (req.twoStep) {
            distributor.proposeOwner(caller, next);
        } else {
            distributor.transferOwnership(caller, next);
        }
        return new Reply(200, ownerBody());
    }

    /** GET /events?after=N&limit=M */
    private Reply handleEvents(HttpServerExchange ex) {
        String afterStr = queryParam(ex, "after");
        String limitStr = queryParam(ex, "limit");
        long after = afterStr == null ? 0L : parseLong(afterStr, "after");
        long rawLimit = limitStr == null ? DEFAULT_EVENT_LIMIT : parseLong(limitStr, "limit");
        if (rawLimit <= 0 || rawLimit > MAX_EVENT_LIMIT) {
            throw new IllegalArgumentException("limit must be in [1, " + MAX_EVENT_LIMIT + "]");
        }
        int limit = (int) rawLimit;

        List<EventEntry> events = new ArrayList<>();
        for (ClaimFeed.Entry e : feed.since(after, limit)) {
            var dto = new EventEntry();
            dto.seq = e.seq();
            dto.period = e.event().period();
            dto.index = e.event().index();
            dto.account = e.event().account().toHex();
            dto.amount = e.event().amount().toString();
            events.add(dto);
        }
        var body = new LinkedHashMap<String, Object>();
        body.put("events", events);
        body.put("lastSeq", feed.lastSeq());
        return new Reply(200, body);
    }

    // ---------- helpers ----------

    private Map<String, Object> ownerBody() {
        var body = new LinkedHashMap<String, Object>();
        body.put("owner", distributor.owner().toHex());
        body.put("pendingOwner", distributor.pendingOwner().map(Address::toHex).orElse(null));
        return body;
    }

    private static ClaimResponse toResponse(ClaimEvent ev) {
        var dto = new ClaimResponse();
        dto.ok = true;
        dto.period = ev.period();
        dto.index = ev.index();
        dto.account = ev.account().toHex();
        dto.amount = ev.amount().toString();
        return dto;
    }

    private static List<Hash32> parseProof(List<String> proof) {
        if (proof == null) return List.of();
        List<Hash32> out = new ArrayList<>(proof.size());
        for (String h : proof) {
            out.add(Hash32.fromHex(required(h, "proof element")));
        }
        return out;
    }

    private static Address caller(HttpServerExchange ex) {
        String raw = ex.getRequestHeaders().getFirst(CALLER_HEADER);
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("missing " + CALLER_HEADER + " header");
        }
        return Address.fromHex(raw.trim());
    }

    private static byte[] readBody(HttpServerExchange ex) throws IOException {
        try (InputStream in = ex.getInputStream()) {
            byte[] data = in.readNBytes(MAX_BODY_BYTES + 1);
            if (data.length > MAX_BODY_BYTES) throw tooLarge();
            return data;
        }
    }

    private static void requireMethod(String method, String expected) {
        if (!expected.equals(method)) {
            throw new HttpError(405, "METHOD_NOT_ALLOWED", "method " + method + " not allowed");
        }
    }

    private static HttpError notFound(String path) {
        return new HttpError(404, "NOT_FOUND", "no route for " + path);
    }

    private static HttpError tooLarge() {
        return new HttpError(413, "PAYLOAD_TOO_LARGE", "request body too large");
    }

    private static String queryParam(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.peekFirst();
    }

    private static long requiredLongParam(HttpServerExchange ex, String name) {
        String v = queryParam(ex, name);
        if (v == null) throw new IllegalArgumentException("missing query param: " + name);
        return parseLong(v, name);
    }

    private static long parseLong(String s, String name) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + s + "'");
        }
    }

    private static <T> T required(T v, String name) {
        if (v == null) throw new IllegalArgumentException(name + " is required");
        return v;
    }

    static int statusFor(ErrorCode code) {
        return switch (code) {
            case ALREADY_CLAIMED, ROOT_ALREADY_SET -> 409;
            case INVALID_PROOF -> 422;
            case LENGTH_MISMATCH -> 400;
            case TRANSFER_FAILED -> 502;
            case UNAUTHORIZED -> 403;
        };
    }

    private static Map<String, Object> errorBody(String code, String message) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", code);
        body.put("message", message == null ? "" : message);
        return body;
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"INTERNAL\",\"message\":\"serialization\"}");
        }
    }
}
