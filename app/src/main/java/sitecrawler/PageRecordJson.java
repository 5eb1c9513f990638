package sitecrawler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

// JSON form of PageRecord: snake_case fields, ISO-8601 timestamps.
public final class PageRecordJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<List<PageRecord>> RECORD_LIST = new TypeReference<>() { };

    private PageRecordJson() {
    }

    public static String toJson(PageRecord record) throws JsonProcessingException {
        return MAPPER.writeValueAsString(record);
    }

    public static PageRecord fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, PageRecord.class);
    }

    public static void writeAll(List<PageRecord> records, Path out) throws IOException {
        MAPPER.writeValue(out.toFile(), records);
    }

    public static List<PageRecord> readAll(Path in) throws IOException {
        return MAPPER.readValue(Files.readAllBytes(in), RECORD_LIST);
    }
}
