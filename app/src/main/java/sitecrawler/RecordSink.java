package sitecrawler;

// Receives every PageRecord as soon as the engine emits it, in emission order. Called from the coordinating thread only.
@FunctionalInterface
public interface RecordSink {

    RecordSink NONE = record -> { };

    void accept(PageRecord record);
}
