package com.polyexplorer.polymarket;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local stand-in for the Gamma API. Unknown paths answer 404 with an empty JSON object.
 */
public final class GammaStubServer implements AutoCloseable {

    private final HttpServer server;
    private final Map<String, Reply> replies = new ConcurrentHashMap<>();

    private record Reply(int status, String body, Map<String, String> headers) {
    }

    public GammaStubServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public GammaStubServer reply(String path, int status, String body) {
        return reply(path, status, body, Map.of());
    }

    public GammaStubServer reply(String path, int status, String body, Map<String, String> headers) {
        replies.put(path, new Reply(status, body, headers));
        return this;
    }

    public GammaStubServer event(String slug, String json) {
        return reply("/events/slug/" + slug, 200, json);
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        Reply reply = replies.getOrDefault(exchange.getRequestURI().getRawPath(), new Reply(404, "{}", Map.of()));
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        reply.headers().forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
        exchange.sendResponseHeaders(reply.status(), bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
