package sitecrawler;

import java.util.Locale;

// Which files OutputManager writes for a run.
public enum OutputFormat {
    JSON,
    CSV,
    BOTH;

    public boolean includesJson() {
        return this == JSON || this == BOTH;
    }

    public boolean includesCsv() {
        return this == CSV || this == BOTH;
    }

    public static OutputFormat parse(String raw) {
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigException("Invalid output format: " + raw + " (use json, csv or both)");
        }
    }
}
