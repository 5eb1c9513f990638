package sitecrawler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public enum RecordStatus {
    @JsonProperty("success") SUCCESS,
    @JsonProperty("failed") FAILED,
    @JsonProperty("skipped") SKIPPED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
