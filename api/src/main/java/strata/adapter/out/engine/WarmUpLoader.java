package strata.adapter.out.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import strata.adapter.in.dto.WarmUpEntryRequest;
import strata.core.model.WarmUpEntry;

/**
 * Reads warm-up entries from a JSON file.
 *
 * <p>The file holds an array of {@link WarmUpEntryRequest} objects, the same shape the admin
 * warm-up endpoint accepts. Malformed entries are skipped with a warning; an unreadable file
 * yields no entries.
 */
@ApplicationScoped
public class WarmUpLoader {

    private static final Logger LOG = Logger.getLogger(WarmUpLoader.class);

    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public List<WarmUpEntry> load(String file) {
        String json;
        try {
            json = Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warnf("Cannot read cache warm-up file %s: %s", file, e.getMessage());
            return List.of();
        }
        return parse(json);
    }

    public List<WarmUpEntry> parse(String json) {
        List<WarmUpEntryRequest> records;
        try {
            records = OBJECT_MAPPER.readValue(json, new TypeReference<List<WarmUpEntryRequest>>() {});
        } catch (JsonProcessingException e) {
            LOG.warnf("Malformed cache warm-up file: %s", e.getOriginalMessage());
            return List.of();
        }
        if (records == null) {
            return List.of();
        }

        var entries = new ArrayList<WarmUpEntry>(records.size());
        for (int i = 0; i < records.size(); i++) {
            var record = records.get(i);
            try {
                if (record == null) {
                    throw new IllegalArgumentException("missing key");
                }
                entries.add(record.toEntry());
            } catch (IllegalArgumentException e) {
                LOG.warnf("Skipping warm-up entry %d: %s", i, e.getMessage());
            }
        }
        return entries;
    }
}
