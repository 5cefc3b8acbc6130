// file: client/src/main/java/io/dripline/client/Cli.java
package io.dripline.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Simple CLI for interacting with a running distributor over HTTP.
 *
 * Usage:
 *   dripline-cli [--base-url URL] [--caller ADDR] <command> [args]
 *
 * Examples:
 *   dripline-cli roots 1 4
 *   dripline-cli status 3 17
 *   dripline-cli claim 3 17 0xab..cd 1000 0x11..,0x22..
 *   dripline-cli --caller 0xowner.. seed 3 0xroot.. 5000 0xfunder..
 *
 * Responses are printed as returned by the server (JSON).
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";
    static final String CALLER_HEADER = "X-Dripline-Caller";

    private final HttpClient http;
    private final String baseUrl;
    private final String caller; // may be null; required by admin commands

    Cli(HttpClient http, String baseUrl, String caller) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.caller = caller;
    }

    public static void main(String[] args) {
        try {
            Options opts = Options.parse(args);
            if (opts.command().isEmpty()) {
                usageAndExit("missing command");
            }
            Cli cli = new Cli(HttpClient.newHttpClient(), opts.baseUrl(), opts.caller());
            System.out.println(cli.run(opts.command()));
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /** Global options followed by the command words. */
    record Options(String baseUrl, String caller, List<String> command) {
        static Options parse(String[] args) {
            String baseUrl = DEFAULT_BASE_URL;
            String caller = null;
            int i = 0;
            while (i < args.length && args[i].startsWith("--")) {
                switch (args[i]) {
                    case "--base-url" -> baseUrl = value(args, i);
                    case "--caller" -> caller = value(args, i);
                    default -> throw new CliException("unknown option: " + args[i]);
                }
                i += 2;
            }
            return new Options(baseUrl, caller, Arrays.asList(args).subList(i, args.length));
        }

        private static String value(String[] args, int i) {
            if (i + 1 >= args.length) throw new CliException(args[i] + " requires a value");
            return args[i + 1];
        }
    }

    /** Execute one command and return the response body. */
    String run(List<String> cmd) throws IOException, InterruptedException {
        String name = cmd.get(0);
        List<String> a = cmd.subList(1, cmd.size());
        return switch (name) {
            case "health" -> {
                arity(name, a, 0, "");
                yield call("GET", "/admin/health", null, false);
            }
            case "status" -> {
                arity(name, a, 2, "<period> <index>");
                yield call("GET", "/claims/" + a.get(0) + "/" + a.get(1), null, false);
            }
            case "status-range" -> {
                arity(name, a, 3, "<periodBegin> <periodEnd> <index,index,...>");
                yield call("GET", "/claims/status?indices=" + a.get(2)
                        + "&periodBegin=" + a.get(0) + "&periodEnd=" + a.get(1), null, false);
            }
            case "roots" -> {
                arity(name, a, 2, "<periodBegin> <periodEnd>");
                yield call("GET", "/roots?periodBegin=" + a.get(0) + "&periodEnd=" + a.get(1), null, false);
            }
            case "claim" -> {
                arity(name, a, 5, "<period> <index> <account> <balance> <proof,...|->");
                String body = "{\"index\":" + number(a.get(1))
                        + ",\"account\":" + quote(a.get(2))
                        + ",\"period\":" + number(a.get(0))
                        + ",\"balance\":" + quote(a.get(3))
                        + ",\"proof\":" + proofArray(a.get(4)) + "}";
                yield call("POST", "/claims", body, false);
            }
            case "seed" -> {
                arity(name, a, 4, "<period> <root> <totalAllocation> <fundingSource>");
                String body = "{\"root\":" + quote(a.get(1))
                        + ",\"totalAllocation\":" + quote(a.get(2))
                        + ",\"fundingSource\":" + quote(a.get(3)) + "}";
                yield call("PUT", "/admin/roots/" + number(a.get(0)), body, true);
            }
            case "owner" -> {
                arity(name, a, 0, "");
                yield call("GET", "/admin/owner", null, false);
            }
            case "transfer-owner" -> {
                boolean twoStep = a.contains("--two-step");
                List<String> rest = new ArrayList<>(a);
                rest.remove("--two-step");
                arity(name, rest, 1, "<newOwner> [--two-step]");
                String body = "{\"newOwner\":" + quote(rest.get(0)) + ",\"twoStep\":" + twoStep + "}";
                yield call("POST", "/admin/owner", body, true);
            }
            case "accept-owner" -> {
                arity(name, a, 0, "");
                yield call("POST", "/admin/owner/accept", null, true);
            }
            case "events" -> {
                if (a.size() > 2) throw new CliException("events takes [after] [limit]");
                String after = a.isEmpty() ? "0" : number(a.get(0));
                String path = "/events?after=" + after + (a.size() == 2 ? "&limit=" + number(a.get(1)) : "");
                yield call("GET", path, null, false);
            }
            default -> throw new CliException("unknown command: " + name);
        };
    }

    private String call(String method, String path, String body, boolean needsCaller)
            throws IOException, InterruptedException {
        HttpRequest.Builder b = HttpRequest.newBuilder().uri(URI.create(baseUrl + path));
        if (needsCaller) {
            if (caller == null) throw new CliException("this command requires --caller <address>");
            b.header(CALLER_HEADER, caller);
        }
        if (body != null) {
            b.header("Content-Type", "application/json");
            b.method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            b.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException(method + " " + path + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return resp.body();
    }

    private static void arity(String name, List<String> a, int n, String shape) {
        if (a.size() != n) {
            throw new CliException(name + (shape.isEmpty() ? " takes no arguments" : " requires " + shape));
        }
    }

    private static String number(String s) {
        if (!s.matches("\\d+")) throw new CliException("expected a non-negative integer, got '" + s + "'");
        return s;
    }

    private static String quote(String s) {
        if (s.indexOf('"') >= 0 || s.indexOf('\\') >= 0) {
            throw new CliException("unexpected quote or backslash in '" + s + "'");
        }
        return "\"" + s + "\"";
    }

    /** "-" is an empty proof (single-leaf tree). */
    private static String proofArray(String csv) {
        if ("-".equals(csv)) return "[]";
        List<String> parts = new ArrayList<>();
        for (String h : csv.split(",")) {
            parts.add(quote(h.trim()));
        }
        return "[" + String.join(",", parts) + "]";
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  dripline-cli [--base-url http://host:port] [--caller 0xADDR] <command>

                Commands:
                  health
                  status <period> <index>
                  status-range <periodBegin> <periodEnd> <index,index,...>
                  roots <periodBegin> <periodEnd>
                  claim <period> <index> <account> <balance> <proof,...|->
                  seed <period> <root> <totalAllocation> <fundingSource>   (needs --caller)
                  owner
                  transfer-owner <newOwner> [--two-step]                   (needs --caller)
                  accept-owner                                             (needs --caller)
                  events [after] [limit]
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
