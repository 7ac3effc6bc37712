package com.govledger.audit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON layout shared by every bundle document: pretty-printed with '\n' line ends on every
 * platform, map keys sorted, instants as ISO-8601 strings.
 */
final class BundleJson {
    static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private static final ObjectWriter WRITER = MAPPER.writer(
            new DefaultPrettyPrinter().withObjectIndenter(new DefaultIndenter("  ", "\n")));

    private BundleJson() {
    }

    static byte[] write(Path path, Object value) throws IOException {
        byte[] bytes = WRITER.writeValueAsBytes(value);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.write(path, bytes);
        return bytes;
    }

    static <T> T read(Path path, Class<T> type) throws IOException {
        T value = MAPPER.readValue(path.toFile(), type);
        if (value == null) {
            throw new JsonParseException(null, path.getFileName() + " holds no JSON object");
        }
        return value;
    }
}
