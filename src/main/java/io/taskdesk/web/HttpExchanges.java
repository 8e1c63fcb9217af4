package io.taskdesk.web;

import com.sun.net.httpserver.HttpExchange;
import io.taskdesk.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

final class HttpExchanges {
    private HttpExchanges() {
    }

    /**
     * Query string parameters, merged with an urlencoded form body on POST. Body values win.
     */
    static Map<String, String> parseParams(HttpExchange exchange) throws IOException {
        Map<String, String> out = new LinkedHashMap<>(parseQuery(exchange.getRequestURI()));
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            return out;
        }
        byte[] raw = exchange.getRequestBody().readAllBytes();
        if (raw.length == 0) {
            return out;
        }
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        String normalized = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (!normalized.isEmpty() && !normalized.contains("application/x-www-form-urlencoded")) {
            return out;
        }
        out.putAll(parseQueryString(new String(raw, StandardCharsets.UTF_8)));
        return out;
    }

    static Map<String, String> parseQuery(URI uri) {
        return parseQueryString(uri.getRawQuery());
    }

    static Map<String, String> parseQueryString(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }

    static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeText(exchange, "Method not allowed", 405);
        return false;
    }

    static void writeHtml(HttpExchange exchange, String html, int status) throws IOException {
        write(exchange, html.getBytes(StandardCharsets.UTF_8), "text/html; charset=utf-8", status);
    }

    static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        write(exchange, Jsons.toJson(body).getBytes(StandardCharsets.UTF_8), "application/json; charset=utf-8", status);
    }

    static void writeText(HttpExchange exchange, String text, int status) throws IOException {
        write(exchange, text.getBytes(StandardCharsets.UTF_8), "text/plain; charset=utf-8", status);
    }

    static void redirect(HttpExchange exchange, String location) throws IOException {
        exchange.getResponseHeaders().set("Location", location);
        exchange.sendResponseHeaders(302, -1);
        exchange.close();
    }

    private static void write(HttpExchange exchange, byte[] body, String contentType, int status) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
