package sitecrawler;

// Fatal configuration problem (bad seed URL, bad regex, out-of-range option). Aborts before the crawl starts.
public class ConfigException extends IllegalArgumentException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
