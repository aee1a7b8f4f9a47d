package io.tagvault.core.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileSnapshotBackups implements SnapshotBackups {
    private static final Logger LOG = LoggerFactory.getLogger(FileSnapshotBackups.class);

    public static final String EXTENSION = ".json.gz";
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9._-]+");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS")
        .withZone(ZoneOffset.UTC);

    private final Path directory;
    private final int maxBackups;
    private final Clock clock;
    private final ObjectMapper mapper;

    public FileSnapshotBackups(Path directory, int maxBackups, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        if (maxBackups <= 0) {
            throw new IllegalArgumentException("maxBackups must be > 0");
        }
        this.maxBackups = maxBackups;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path directory() {
        return directory;
    }

    @Override
    public synchronized Path create(MemorySnapshot snapshot, String name) throws IOException {
        String baseName = name == null || name.isBlank() ? "memory_backup_" + STAMP.format(clock.instant()) : name.trim();
        if (!VALID_NAME.matcher(baseName).matches()) {
            throw new IllegalArgumentException("backup name may only contain letters, digits, '.', '_' and '-': " + name);
        }
        Files.createDirectories(directory);
        Path target = directory.resolve(baseName + EXTENSION);
        Path tmp = directory.resolve(baseName + EXTENSION + ".tmp");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(tmp))) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(out, snapshot);
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        Files.setLastModifiedTime(target, FileTime.from(clock.instant()));
        LOG.info("Created memory backup {}", target);
        cleanup();
        return target;
    }

    @Override
    public MemorySnapshot read(Path backup) throws IOException {
        if (!Files.exists(backup)) {
            throw new IOException("Backup not found: " + backup);
        }
        JsonNode root;
        try (InputStream in = new GZIPInputStream(Files.newInputStream(backup))) {
            root = mapper.readTree(in);
        }
        if (root == null || !root.isObject() || !root.hasNonNull("version") || !root.path("records").isObject()) {
            throw new IOException("Invalid backup format at " + backup);
        }
        return mapper.treeToValue(root, MemorySnapshot.class);
    }

    @Override
    public synchronized List<Path> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> backups = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(path -> path.getFileName().toString().endsWith(EXTENSION)).forEach(backups::add);
        }
        backups.sort(Comparator.comparing(FileSnapshotBackups::modifiedAt).thenComparing(path -> path.getFileName().toString()));
        return backups;
    }

    private void cleanup() throws IOException {
        List<Path> backups = list();
        int excess = backups.size() - maxBackups;
        for (int i = 0; i < excess; i++) {
            Files.deleteIfExists(backups.get(i));
            LOG.info("Removed old memory backup {}", backups.get(i));
        }
    }

    private static FileTime modifiedAt(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read modification time of " + path, e);
        }
    }
}
