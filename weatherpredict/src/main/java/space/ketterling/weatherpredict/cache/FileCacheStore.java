package space.ketterling.weatherpredict.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.weatherpredict.model.ObservationRecord;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Filesystem cache: one JSON file per key under a single directory.
 *
 * <p>
 * Archive data for a past date never changes, so entries have no expiry.
 * Writes land in a temp file first and are published with an atomic move,
 * which keeps concurrent writers of the same key from tearing the entry.
 * </p>
 */
public final class FileCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(FileCacheStore.class);
    private static final String SUFFIX = ".json";
    private static final String TMP_SUFFIX = ".tmp";

    private final Path dir;
    private final ObjectMapper om;
    private final ObjectReader reader;

    /**
     * Creates a store rooted at {@code dir}; the directory is created lazily.
     */
    public FileCacheStore(Path dir, ObjectMapper om) {
        this.dir = dir;
        this.om = om;
        // a partial entry must not decode to zeros
        this.reader = om.readerFor(ObservationRecord.class)
                .with(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES,
                        DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            // put() retries; reads just miss until then
            log.warn("Could not create cache directory {}: {}", dir, e.getMessage());
        }
    }

    public Path dir() {
        return dir;
    }

    @Override
    public Optional<ObservationRecord> get(CacheKey key) {
        Path file = fileFor(key);
        try {
            byte[] bytes = Files.readAllBytes(file);
            return Optional.of(reader.readValue(bytes));
        } catch (NoSuchFileException e) {
            log.debug("cache miss key={}", key);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Unreadable cache entry {}, treating as miss: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(CacheKey key, ObservationRecord record) {
        Path target = fileFor(key);
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = dir.resolve(key.digest() + "." + UUID.randomUUID() + TMP_SUFFIX);
            Files.write(tmp, om.writeValueAsBytes(record));
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("cache put key={} year={}", key, record.year());
        } catch (Exception e) {
            log.warn("Failed to persist cache entry key={}: {}", key, e.getMessage());
            deleteQuietly(tmp);
        }
    }

    @Override
    public int size() {
        try (Stream<Path> files = Files.list(dir)) {
            return (int) files.filter(FileCacheStore::isEntry).count();
        } catch (IOException e) {
            log.warn("Could not list cache directory {}: {}", dir, e.getMessage());
            return -1;
        }
    }

    /**
     * Deletes the oldest entries until at most {@code maxEntries} remain.
     *
     * @return number of entries removed
     */
    public int compact(int maxEntries) throws IOException {
        if (maxEntries <= 0)
            return 0;

        List<Entry> entries = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                if (!isEntry(p))
                    continue;
                try {
                    entries.add(new Entry(p, Files.getLastModifiedTime(p)));
                } catch (NoSuchFileException gone) {
                    // removed by a concurrent compaction
                }
            }
        }

        int excess = entries.size() - maxEntries;
        if (excess <= 0)
            return 0;

        entries.sort(Comparator.comparing(Entry::modified));
        int removed = 0;
        for (int i = 0; i < excess; i++) {
            if (Files.deleteIfExists(entries.get(i).path()))
                removed++;
        }
        log.info("cache compaction removed {} entries (limit={}, before={})", removed, maxEntries,
                entries.size());
        return removed;
    }

    private Path fileFor(CacheKey key) {
        return dir.resolve(key.digest() + SUFFIX);
    }

    private static boolean isEntry(Path p) {
        return Files.isRegularFile(p) && p.getFileName().toString().endsWith(SUFFIX);
    }

    private static void deleteQuietly(Path p) {
        if (p == null)
            return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}: {}", p, e.getMessage());
        }
    }

    private record Entry(Path path, FileTime modified) {
    }
}
