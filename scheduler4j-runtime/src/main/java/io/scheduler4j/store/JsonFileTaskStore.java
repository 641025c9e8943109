package io.scheduler4j.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot store writing a JSON array to a single file.
 *
 * <p>The file is rewritten in place on every save. A crash mid-write can leave it truncated;
 * the next load then fails with {@link TaskPersistenceException} and the scheduler starts empty.
 */
public class JsonFileTaskStore extends AbstractSnapshotTaskStore {

    private static final TypeReference<List<TaskSnapshotEntry>> ENTRIES = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileTaskStore(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    protected List<TaskSnapshotEntry> readSnapshot() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<TaskSnapshotEntry> entries = objectMapper.readValue(file.toFile(), ENTRIES);
            return entries == null ? List.of() : entries;
        } catch (IOException e) {
            throw new TaskPersistenceException("Failed to read task snapshot " + file, e);
        }
    }

    @Override
    protected void writeSnapshot(List<TaskSnapshotEntry> entries) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), entries);
        } catch (IOException e) {
            throw new TaskPersistenceException("Failed to write task snapshot " + file, e);
        }
    }

    @Override
    protected String describe() {
        return file.toString();
    }

    public Path file() {
        return file;
    }
}
