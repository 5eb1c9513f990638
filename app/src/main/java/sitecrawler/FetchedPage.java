package sitecrawler;

// Successful fetch: the final response and how many attempts it took.
public record FetchedPage(String url, String finalUrl, int statusCode, byte[] body, String contentType,
                          String charset, int attempts) {
}
