package org.carball.gantry.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.FieldGroupSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads reference records from an exported JSON file: either a top-level array of flat
 * records, or an object whose {@code records} (or {@code samples}) member is such an array.
 */
@Slf4j
public class JsonReferencePoolLoader implements ReferencePoolLoader {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final Path path;
    private final FieldGroupSchema schema;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JsonReferencePoolLoader(Path path, FieldGroupSchema schema) {
        this.path = path;
        this.schema = schema;
    }

    @Override
    public List<TransactionRecord> load(int limit) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Reference pool file not found: " + path);
        }

        JsonNode root = objectMapper.readTree(Files.readString(path));
        JsonNode array = recordsArray(root);

        List<TransactionRecord> records = new ArrayList<>();
        int skipped = 0;
        for (JsonNode node : array) {
            if (limit > 0 && records.size() >= limit) {
                break;
            }
            if (!node.isObject()) {
                skipped++;
                continue;
            }
            Map<String, Object> raw = objectMapper.convertValue(node, RECORD_TYPE);
            records.add(TransactionRecord.fromRaw(raw, schema));
        }

        if (skipped > 0) {
            log.warn("Skipped {} non-object entries in {}", skipped, path);
        }
        log.info("Loaded {} reference records from {}", records.size(), path.getFileName());
        return records;
    }

    private JsonNode recordsArray(JsonNode root) throws IOException {
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            for (String member : List.of("records", "samples")) {
                JsonNode candidate = root.get(member);
                if (candidate != null && candidate.isArray()) {
                    return candidate;
                }
            }
        }
        throw new IOException("Invalid reference pool format in " + path
                + ": expected an array or an object with a 'records' array");
    }
}
