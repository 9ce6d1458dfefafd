package com.ryuqq.relay.core.spi;

/**
 * Raw response returned by a {@link Transport}.
 *
 * @param status HTTP-style status code
 * @param text response body, empty when there is none
 * @param reason status reason phrase, may be empty
 * @author Relay Team
 * @since 1.0.0
 */
public record TransportResponse(int status, String text, String reason) {

    public TransportResponse {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("status out of range: " + status);
        }
        text = text == null ? "" : text;
        reason = reason == null || reason.isBlank() ? reasonPhrase(status) : reason;
    }

    public static TransportResponse ok(String text) {
        return new TransportResponse(200, text, "OK");
    }

    public static TransportResponse of(int status) {
        return new TransportResponse(status, "", null);
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /**
     * Default reason phrase for the statuses this framework produces.
     */
    public static String reasonPhrase(int status) {
        return switch (status) {
            case 200 -> "OK";
            case 400 -> "Bad Request";
            case 404 -> "Not Found";
            case 405 -> "Method Not Allowed";
            case 413 -> "Payload Too Large";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "";
        };
    }
}
