package sitecrawler;

import java.util.Locale;

public enum FetchErrorKind {
    NETWORK,
    TIMEOUT,
    HTTP_STATUS,
    // the crawl was stopped while this fetch was waiting; never recorded
    CANCELLED;

    // Value written to PageRecord.error, e.g. "timeout".
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
