package sitecrawler;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

// Raw outcome of one GET: status, body bytes and what the server said about them.
public record TransportResponse(int statusCode, byte[] body, String contentType, String charset, String finalUrl) {

    public TransportResponse {
        body = body == null ? new byte[0] : body;
    }

    public static TransportResponse html(int statusCode, String html, String finalUrl) {
        return new TransportResponse(statusCode, html.getBytes(StandardCharsets.UTF_8),
                "text/html; charset=UTF-8", "UTF-8", finalUrl);
    }

    public static TransportResponse text(int statusCode, String text, String finalUrl) {
        return new TransportResponse(statusCode, text.getBytes(StandardCharsets.UTF_8),
                "text/plain; charset=UTF-8", "UTF-8", finalUrl);
    }

    // Decodes with the declared charset, UTF-8 when none is declared or it is unknown.
    public String bodyAsString() {
        Charset cs = StandardCharsets.UTF_8;
        if (charset != null) {
            try {
                cs = Charset.forName(charset);
            } catch (IllegalArgumentException e) {
                cs = StandardCharsets.UTF_8;
            }
        }
        return new String(body, cs);
    }
}
