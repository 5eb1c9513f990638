package sitecrawler;

// Raised when a URL (or href) cannot be turned into a canonical absolute URL.
public class UrlNormalizationException extends Exception {

    private final String input;

    public UrlNormalizationException(String message, String input) {
        super(message + ": " + input);
        this.input = input;
    }

    public UrlNormalizationException(String message, String input, Throwable cause) {
        super(message + ": " + input, cause);
        this.input = input;
    }

    public String input() {
        return input;
    }
}
