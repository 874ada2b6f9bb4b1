package dev.pldb.record;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads entity records from a directory of JSON files, one entity per file.
 *
 * <p>The entity id is the file name without its {@code .json} extension. Files are read in file
 * name order, which becomes the enumeration order of the resulting {@link RecordStore}. A file
 * that is not a JSON object fails the whole load.
 */
@Component
public class JsonRecordLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonRecordLoader.class);

    static final String EXTENSION = ".json";

    private final ObjectMapper objectMapper;

    public JsonRecordLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads every {@code *.json} file in the directory.
     *
     * @param directory the records directory
     * @return records sorted by file name
     * @throws UncheckedIOException if the directory or a file cannot be read or parsed
     * @throws IllegalArgumentException if a file's root is not a JSON object
     */
    public List<EntityRecord> load(Path directory) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list records directory " + directory, e);
        }

        List<EntityRecord> records = new ArrayList<>(files.size());
        for (Path file : files) {
            records.add(read(file));
        }
        log.info("Loaded {} entity records from {}", records.size(), directory);
        return records;
    }

    /**
     * Loads the directory into a fresh store.
     *
     * @param directory the records directory
     * @return a store holding every record of the directory
     */
    public RecordStore loadStore(Path directory) {
        return new RecordStore(load(directory));
    }

    EntityRecord read(Path file) {
        String fileName = file.getFileName().toString();
        String id = fileName.substring(0, fileName.length() - EXTENSION.length());
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse record file " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Record file " + file + " is not a JSON object");
        }
        return new EntityRecord(id, (ObjectNode) root);
    }
}
