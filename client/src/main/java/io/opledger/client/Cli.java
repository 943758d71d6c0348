// file: client/src/main/java/io/opledger/client/Cli.java
package io.opledger.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.PrintStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Command line client for a running registry node.
 *
 * Usage:
 *   opledger-cli [--base-url http://host:port] submit <kind> <recordId> <nonce> <signer>
 *   opledger-cli [--base-url http://host:port] signer <kind> <recordId> <nonce>
 *   opledger-cli [--base-url http://host:port] history <signer>
 *   opledger-cli [--base-url http://host:port] fingerprint <kind> <recordId> <nonce>
 *
 * Exit codes: 0 ok, 1 usage or server error, 2 anything unexpected.
 * "submit" prints ACCEPTED or DUPLICATE; a duplicate is not an error.
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private static final String USAGE = """
            Usage:
              opledger-cli [--base-url http://host:port] submit <kind> <recordId> <nonce> <signer>
              opledger-cli [--base-url http://host:port] signer <kind> <recordId> <nonce>
              opledger-cli [--base-url http://host:port] history <signer>
              opledger-cli [--base-url http://host:port] fingerprint <kind> <recordId> <nonce>
            """;

    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();
    private final String baseUrl;
    private final PrintStream out;

    Cli(String baseUrl, PrintStream out) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs one command and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            String baseUrl = DEFAULT_BASE_URL;
            String[] rest = args;
            if (rest.length >= 1 && "--base-url".equals(rest[0])) {
                if (rest.length < 2) {
                    throw new UsageException("--base-url requires a value");
                }
                baseUrl = rest[1];
                rest = Arrays.copyOfRange(rest, 2, rest.length);
            }
            if (rest.length == 0) {
                throw new UsageException("missing command");
            }

            Cli cli = new Cli(baseUrl, out);
            String cmd = rest[0];
            switch (cmd) {
                case "submit" -> {
                    requireArgs(rest, 5, "submit requires <kind> <recordId> <nonce> <signer>");
                    cli.submit(rest[1], rest[2], parseNonce(rest[3]), rest[4]);
                }
                case "signer" -> {
                    requireArgs(rest, 4, "signer requires <kind> <recordId> <nonce>");
                    cli.signer(rest[1], rest[2], parseNonce(rest[3]));
                }
                case "history" -> {
                    requireArgs(rest, 2, "history requires <signer>");
                    cli.history(rest[1]);
                }
                case "fingerprint" -> {
                    requireArgs(rest, 4, "fingerprint requires <kind> <recordId> <nonce>");
                    cli.fingerprint(rest[1], rest[2], parseNonce(rest[3]));
                }
                default -> throw new UsageException("unknown command: " + cmd);
            }
            return 0;
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.print(USAGE);
            return 1;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            e.printStackTrace(err);
            return 2;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    private void submit(String kind, String recordId, long nonce, String signer) throws Exception {
        ObjectNode body = json.createObjectNode()
                .put("operationKind", kind)
                .put("recordId", recordId)
                .put("nonce", nonce)
                .put("signer", signer);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/registry/operations"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                .build();

        JsonNode resp = expectOk("submit", http.send(req, HttpResponse.BodyHandlers.ofString()));
        if (resp.path("accepted").asBoolean()) {
            out.println("ACCEPTED " + resp.path("fingerprint").asText()
                    + " seq=" + resp.path("sequenceNumber").asLong());
        } else {
            out.println("DUPLICATE " + resp.path("fingerprint").asText());
        }
    }

    private void signer(String kind, String recordId, long nonce) throws Exception {
        HttpResponse<String> resp = get("/registry/signer" + query(kind, recordId, nonce));
        if (resp.statusCode() == 404) {
            out.println("(not found)");
            return;
        }
        out.println(expectOk("signer", resp).path("signer").asText());
    }

    private void history(String signer) throws Exception {
        JsonNode resp = expectOk("history",
                get("/registry/history?signer=" + URLEncoder.encode(signer, StandardCharsets.UTF_8)));
        for (JsonNode e : resp.path("events")) {
            out.println(e.path("sequenceNumber").asLong()
                    + " " + e.path("fingerprint").asText()
                    + " nonce=" + e.path("nonce").asLong());
        }
    }

    private void fingerprint(String kind, String recordId, long nonce) throws Exception {
        out.println(expectOk("fingerprint", get("/registry/fingerprint" + query(kind, recordId, nonce)))
                .path("fingerprint").asText());
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + pathAndQuery))
                .GET()
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode expectOk(String what, HttpResponse<String> resp) throws Exception {
        if (resp.statusCode() != 200) {
            throw new CliException(what + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return json.readTree(resp.body());
    }

    private static String query(String kind, String recordId, long nonce) {
        return "?operationKind=" + URLEncoder.encode(kind, StandardCharsets.UTF_8)
                + "&recordId=" + URLEncoder.encode(recordId, StandardCharsets.UTF_8)
                + "&nonce=" + nonce;
    }

    private static void requireArgs(String[] args, int count, String msg) {
        if (args.length != count) {
            throw new UsageException(msg);
        }
    }

    private static long parseNonce(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new UsageException("nonce must be an integer: " + raw);
        }
    }

    private static class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }

    private static final class UsageException extends CliException {
        UsageException(String msg) {
            super(msg);
        }
    }
}
