// file: client/src/main/java/io/cardfed/client/Cli.java
package io.cardfed.client;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.PrintStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Simple CLI for querying a running CardFed server over HTTP.
 *
 * Usage:
 *   cardfed-cli [--base-url http://host:port] profile <game> <version> <userId> [--any]
 *   cardfed-cli [--base-url http://host:port] lookup <game> <version> <userId>...
 *   cardfed-cli [--base-url http://host:port] all <game> <version>
 *   cardfed-cli [--base-url http://host:port] card <cardId>
 *
 * Examples:
 *   cardfed-cli profile iidx 25 -E004010000000001
 *   cardfed-cli lookup iidx 25 12 -E004010000000001
 *   cardfed-cli card E004010000000001
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private static final ObjectMapper JSON = new ObjectMapper();

    /** Parsed command line. */
    record Invocation(String baseUrl, String command, List<String> args) {}

    private final HttpClient http;
    private final String baseUrl;
    private final PrintStream out;

    Cli(String baseUrl, HttpClient http, PrintStream out) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
    }

    public static void main(String[] args) {
        try {
            Invocation inv = parse(args);
            new Cli(inv.baseUrl(), HttpClient.newHttpClient(), System.out).run(inv);
        } catch (UsageException e) {
            usageAndExit(e.getMessage());
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Invocation parse(String[] args) {
        String baseUrl = DEFAULT_BASE_URL;
        String[] rest = args;
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new UsageException("--base-url requires a value");
            }
            baseUrl = args[1];
            rest = Arrays.copyOfRange(args, 2, args.length);
        }
        if (rest.length == 0) {
            throw new UsageException("missing command");
        }

        String cmd = rest[0];
        List<String> params = List.of(Arrays.copyOfRange(rest, 1, rest.length));
        switch (cmd) {
            case "profile" -> {
                boolean ok = params.size() == 3 || (params.size() == 4 && "--any".equals(params.get(3)));
                if (!ok) throw new UsageException("profile requires <game> <version> <userId> [--any]");
            }
            case "lookup" -> {
                if (params.size() < 3) throw new UsageException("lookup requires <game> <version> <userId>...");
            }
            case "all" -> {
                if (params.size() != 2) throw new UsageException("all requires <game> <version>");
            }
            case "card" -> {
                if (params.size() != 1) throw new UsageException("card requires <cardId>");
            }
            default -> throw new UsageException("unknown command: " + cmd);
        }
        return new Invocation(baseUrl, cmd, params);
    }

    void run(Invocation inv) throws Exception {
        List<String> p = inv.args();
        switch (inv.command()) {
            case "profile" -> profile(p.get(0), p.get(1), p.get(2), p.size() == 4);
            case "lookup" -> lookup(p.get(0), p.get(1), p.subList(2, p.size()));
            case "all" -> all(p.get(0), p.get(1));
            case "card" -> card(p.get(0));
            default -> throw new UsageException("unknown command: " + inv.command());
        }
    }

    private void profile(String game, String version, String userId, boolean any) throws Exception {
        String path = "/profiles/" + seg(game) + "/" + seg(version) + "/users/" + seg(userId) + (any ? "?any=true" : "");
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri(path)).GET());
        if (resp.statusCode() == 404) {
            out.println("(not found)");
            return;
        }
        expectOk("GET profile", resp);
        print(resp.body());
    }

    private void lookup(String game, String version, List<String> userIds) throws Exception {
        byte[] body = JSON.writeValueAsBytes(Map.of("userIds", userIds));
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri("/profiles/" + seg(game) + "/" + seg(version) + "/lookup"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body)));
        expectOk("POST lookup", resp);
        print(resp.body());
    }

    private void all(String game, String version) throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri("/profiles/" + seg(game) + "/" + seg(version))).GET());
        expectOk("GET all", resp);
        print(resp.body());
    }

    private void card(String cardId) throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri("/users/by-card/" + seg(cardId))).GET());
        expectOk("GET card", resp);
        Map<?, ?> reply = JSON.readValue(resp.body(), Map.class);
        boolean virtual = Boolean.TRUE.equals(reply.get("virtual"));
        out.println(reply.get("userId") + (virtual ? " (virtual)" : " (local)"));
    }

    // ---------- plumbing ----------

    private HttpResponse<String> send(HttpRequest.Builder req) throws Exception {
        return http.send(req.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }

    private static String seg(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static void expectOk(String what, HttpResponse<String> resp) {
        if (resp.statusCode() != 200) {
            throw new CliException(what + " failed (" + resp.statusCode() + "): " + resp.body());
        }
    }

    /** Re-indent a JSON reply; falls back to the raw body if it is not JSON. */
    private void print(String body) {
        try {
            out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(JSON.readTree(body)));
        } catch (Exception e) {
            out.println(body);
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  cardfed-cli [--base-url http://host:port] profile <game> <version> <userId> [--any]
                  cardfed-cli [--base-url http://host:port] lookup <game> <version> <userId>...
                  cardfed-cli [--base-url http://host:port] all <game> <version>
                  cardfed-cli [--base-url http://host:port] card <cardId>
                """);
        System.exit(1);
    }

    static class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }

    static final class UsageException extends CliException {
        UsageException(String msg) {
            super(msg);
        }
    }
}
