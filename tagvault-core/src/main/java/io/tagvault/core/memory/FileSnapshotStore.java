package io.tagvault.core.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class FileSnapshotStore implements SnapshotStore {
    private final Path path;
    private final ObjectMapper mapper;

    public FileSnapshotStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized MemorySnapshot load() throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        JsonNode root = mapper.readTree(Files.readString(path));
        if (root == null || !root.isObject() || !root.hasNonNull("version") || !root.path("records").isObject()) {
            throw new IOException("Invalid memory file format at " + path);
        }
        return mapper.treeToValue(root, MemorySnapshot.class);
    }

    @Override
    public synchronized void save(MemorySnapshot snapshot) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
