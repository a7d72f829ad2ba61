package com.example.webanalyzer.service.fetch;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Понятные пользователю сообщения для HTTP-статусов ответа.
 */
public final class HttpStatusMessages {

    private static final Map<Integer, String> MESSAGES = Map.ofEntries(
            Map.entry(400, "Bad request: The server could not understand the request."),
            Map.entry(401, "Unauthorized: The page requires authentication."),
            Map.entry(403, "Forbidden: Access to the page is denied."),
            Map.entry(404, "Not found: The page does not exist on the server."),
            Map.entry(405, "Method not allowed: The server does not allow GET requests for this page."),
            Map.entry(408, "Request timeout: The server timed out waiting for the request."),
            Map.entry(410, "Gone: The page has been permanently removed."),
            Map.entry(429, "Too many requests: The server is rate limiting requests. Please try again later."),
            Map.entry(500, "Internal server error: The server encountered an error while serving the page."),
            Map.entry(502, "Bad gateway: The server received an invalid response from an upstream server."),
            Map.entry(503, "Service unavailable: The server is temporarily unable to handle the request."),
            Map.entry(504, "Gateway timeout: The server did not receive a timely response from an upstream server.")
    );

    private HttpStatusMessages() {
    }

    /**
     * Сообщение для статуса; для неизвестных кодов {@code HTTP {code}: {reason}}.
     */
    public static String forStatus(int statusCode) {
        String message = MESSAGES.get(statusCode);
        if (message != null) {
            return message;
        }
        HttpStatus status = HttpStatus.resolve(statusCode);
        String reason = status != null ? status.getReasonPhrase() : "Unknown Status";
        return "HTTP " + statusCode + ": " + reason;
    }
}
