package org.flutterjs.analyzer.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.smile.SmileFactory;
import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.ir.DeclarationIds;
import org.flutterjs.analyzer.ir.FileDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Persistent store of content hashes and per-file IR, kept in one directory:
 * <pre>
 *   hash_index.json      {version, timestamp, count, hashes: {file: hash}}
 *   modtime_index.json   {file: epochMillis}
 *   metadata.json        {lastAnalysis, fileCount, typeCount}
 *   ir/&lt;md5(file)&gt;.ir    Smile-encoded {@link FileDeclaration}
 * </pre>
 * Every write goes to a sibling temp file first and is then moved into place atomically.
 * I/O failures are logged and turn into cache misses or skipped saves; they never propagate.
 * <p>
 * Thread-safe. Declarations read or written are kept in a bounded in-memory LRU.
 */
public class IncrementalCache {

    private static final Logger LOG = LoggerFactory.getLogger(IncrementalCache.class);

    static final int INDEX_VERSION = 1;
    static final String HASH_INDEX = "hash_index.json";
    static final String MODTIME_INDEX = "modtime_index.json";
    static final String METADATA = "metadata.json";
    static final String IR_DIRECTORY = "ir";
    static final String IR_EXTENSION = ".ir";

    private final Path directory;
    private final ObjectMapper json;
    private final ObjectMapper smile;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<FileIdentity, String> hashes = new TreeMap<>();
    private final Map<FileIdentity, Long> modTimes = new TreeMap<>();
    private final LinkedHashMap<FileIdentity, FileDeclaration> memory;

    /** Serialized form of {@code hash_index.json}. */
    record HashIndex(int version, long timestamp, int count, Map<String, String> hashes) {
    }

    /** Serialized form of {@code metadata.json}. */
    public record Metadata(long lastAnalysis, int fileCount, int typeCount) {
    }

    /**
     * @param directory      The cache directory; created by {@link #initialize()}.
     * @param memoryEntries  Capacity of the in-memory LRU.
     */
    public IncrementalCache(Path directory, int memoryEntries) {
        if (memoryEntries < 1) {
            throw new IllegalArgumentException("memoryEntries must be at least 1, was " + memoryEntries);
        }
        this.directory = directory;
        this.json = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.smile = new ObjectMapper(new SmileFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        this.memory = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<FileIdentity, FileDeclaration> eldest) {
                return size() > memoryEntries;
            }
        };
    }

    /**
     * Creates the directory layout and loads the indexes. A missing, corrupt or
     * version-mismatched index loads as empty.
     */
    public void initialize() {
        try {
            Files.createDirectories(directory.resolve(IR_DIRECTORY));
        } catch (IOException e) {
            LOG.warn("Failed to create cache directory {}: {}", directory, e.getMessage());
        }
        lock.lock();
        try {
            hashes.clear();
            modTimes.clear();
            memory.clear();
            loadHashIndex();
            loadModTimeIndex();
            LOG.debug("Cache at {} holds {} hashes", directory, hashes.size());
        } finally {
            lock.unlock();
        }
    }

    private void loadHashIndex() {
        Path file = directory.resolve(HASH_INDEX);
        if (!Files.exists(file)) return;
        try {
            HashIndex index = json.readValue(file.toFile(), HashIndex.class);
            if (index.version() != INDEX_VERSION || index.hashes() == null) {
                LOG.warn("Ignoring cache index {} with version {}", file, index.version());
                return;
            }
            index.hashes().forEach((path, hash) -> hashes.put(FileIdentity.parse(path), hash));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Ignoring corrupt cache index {}: {}", file, e.getMessage());
        }
    }

    private void loadModTimeIndex() {
        Path file = directory.resolve(MODTIME_INDEX);
        if (!Files.exists(file)) return;
        try {
            Map<String, Long> times = json.readValue(file.toFile(), new TypeReference<Map<String, Long>>() {});
            times.forEach((path, time) -> modTimes.put(FileIdentity.parse(path), time));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Ignoring corrupt modification-time index {}: {}", file, e.getMessage());
        }
    }

    public Path directory() {
        return directory;
    }

    public Optional<String> hashOf(FileIdentity file) {
        lock.lock();
        try {
            return Optional.ofNullable(hashes.get(file));
        } finally {
            lock.unlock();
        }
    }

    public void setHash(FileIdentity file, String hash) {
        lock.lock();
        try {
            hashes.put(file, hash);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The modification time recorded when the file's hash was last stored.
     */
    public Optional<Long> modTimeOf(FileIdentity file) {
        lock.lock();
        try {
            return Optional.ofNullable(modTimes.get(file));
        } finally {
            lock.unlock();
        }
    }

    public void setModTime(FileIdentity file, long epochMillis) {
        lock.lock();
        try {
            modTimes.put(file, epochMillis);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reads a declaration, from memory if present, otherwise from disk.
     *
     * @param file The file.
     * @return The cached IR, or empty on a miss or read failure.
     */
    public Optional<FileDeclaration> getDeclaration(FileIdentity file) {
        lock.lock();
        try {
            FileDeclaration cached = memory.get(file);
            if (cached != null) return Optional.of(cached);
        } finally {
            lock.unlock();
        }
        Path blob = blobOf(file);
        if (!Files.exists(blob)) return Optional.empty();
        try {
            FileDeclaration declaration = smile.readValue(blob.toFile(), FileDeclaration.class);
            lock.lock();
            try {
                memory.put(file, declaration);
            } finally {
                lock.unlock();
            }
            return Optional.of(declaration);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to read cached IR for {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes a declaration to disk and memory.
     *
     * @param file        The file.
     * @param declaration Its IR.
     * @return {@code true} if the blob was written.
     */
    public boolean saveDeclaration(FileIdentity file, FileDeclaration declaration) {
        try {
            writeAtomically(blobOf(file), smile.writeValueAsBytes(declaration));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to cache IR for {}: {}", file, e.getMessage());
            return false;
        }
        lock.lock();
        try {
            memory.put(file, declaration);
        } finally {
            lock.unlock();
        }
        return true;
    }

    /**
     * Saves each entry independently; one failure does not prevent the others.
     *
     * @param declarations The declarations to store.
     * @return The number of entries written.
     */
    public int saveAll(Map<FileIdentity, FileDeclaration> declarations) {
        int saved = 0;
        for (Map.Entry<FileIdentity, FileDeclaration> entry : declarations.entrySet()) {
            if (saveDeclaration(entry.getKey(), entry.getValue())) saved++;
        }
        return saved;
    }

    /**
     * Writes the hash and modification-time indexes.
     *
     * @return {@code true} if both were written.
     */
    public boolean persistIndex() {
        Map<String, String> hashSnapshot = new TreeMap<>();
        Map<String, Long> timeSnapshot = new TreeMap<>();
        lock.lock();
        try {
            hashes.forEach((file, hash) -> hashSnapshot.put(file.path(), hash));
            modTimes.forEach((file, time) -> timeSnapshot.put(file.path(), time));
        } finally {
            lock.unlock();
        }
        try {
            HashIndex index = new HashIndex(INDEX_VERSION, System.currentTimeMillis(), hashSnapshot.size(), hashSnapshot);
            writeAtomically(directory.resolve(HASH_INDEX), json.writeValueAsBytes(index));
            writeAtomically(directory.resolve(MODTIME_INDEX), json.writeValueAsBytes(timeSnapshot));
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to write cache index in {}: {}", directory, e.getMessage());
            return false;
        }
    }

    /**
     * Records summary information about the last run.
     *
     * @return {@code true} if written.
     */
    public boolean writeMetadata(int fileCount, int typeCount) {
        try {
            Metadata metadata = new Metadata(System.currentTimeMillis(), fileCount, typeCount);
            writeAtomically(directory.resolve(METADATA), json.writeValueAsBytes(metadata));
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to write cache metadata in {}: {}", directory, e.getMessage());
            return false;
        }
    }

    public Optional<Metadata> readMetadata() {
        Path file = directory.resolve(METADATA);
        if (!Files.exists(file)) return Optional.empty();
        try {
            return Optional.of(json.readValue(file.toFile(), Metadata.class));
        } catch (IOException e) {
            LOG.warn("Failed to read cache metadata {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Drops index entries and blobs of files that are no longer part of the project.
     *
     * @param existingFiles The files that still exist.
     * @return The number of dropped files.
     */
    public int prune(Collection<FileIdentity> existingFiles) {
        Set<FileIdentity> keep = new HashSet<>(existingFiles);
        Set<FileIdentity> stale = new HashSet<>();
        lock.lock();
        try {
            for (FileIdentity file : hashes.keySet()) {
                if (!keep.contains(file)) stale.add(file);
            }
            for (FileIdentity file : modTimes.keySet()) {
                if (!keep.contains(file)) stale.add(file);
            }
            for (FileIdentity file : stale) {
                hashes.remove(file);
                modTimes.remove(file);
                memory.remove(file);
            }
        } finally {
            lock.unlock();
        }
        for (FileIdentity file : stale) {
            try {
                Files.deleteIfExists(blobOf(file));
            } catch (IOException e) {
                LOG.warn("Failed to delete cached IR for {}: {}", file, e.getMessage());
            }
        }
        if (!stale.isEmpty()) LOG.debug("Pruned {} stale cache entries", stale.size());
        return stale.size();
    }

    /**
     * Removes all entries, in memory and on disk.
     */
    public void clear() {
        lock.lock();
        try {
            hashes.clear();
            modTimes.clear();
            memory.clear();
        } finally {
            lock.unlock();
        }
        Path irDirectory = directory.resolve(IR_DIRECTORY);
        if (Files.isDirectory(irDirectory)) {
            try (Stream<Path> blobs = Files.list(irDirectory)) {
                for (Path blob : (Iterable<Path>) blobs::iterator) {
                    Files.deleteIfExists(blob);
                }
            } catch (IOException e) {
                LOG.warn("Failed to clear cached IR in {}: {}", irDirectory, e.getMessage());
            }
        }
        for (String name : new String[]{HASH_INDEX, MODTIME_INDEX, METADATA}) {
            try {
                Files.deleteIfExists(directory.resolve(name));
            } catch (IOException e) {
                LOG.warn("Failed to delete {}: {}", directory.resolve(name), e.getMessage());
            }
        }
    }

    /**
     * @return The number of files with a stored hash.
     */
    public int size() {
        lock.lock();
        try {
            return hashes.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The number of declarations held in memory.
     */
    public int memorySize() {
        lock.lock();
        try {
            return memory.size();
        } finally {
            lock.unlock();
        }
    }

    Path blobOf(FileIdentity file) {
        return directory.resolve(IR_DIRECTORY).resolve(DeclarationIds.md5Hex(file.path()) + IR_EXTENSION);
    }

    private void writeAtomically(Path target, byte[] data) throws IOException {
        Path parent = target.getParent();
        Files.createDirectories(parent);
        // Suffix keeps temp files out of the *.ir listing
        Path temp = parent.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.write(temp, data);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupEx) {
                LOG.warn("Failed to clean up temp file after move failure: {}", temp, cleanupEx);
            }
            throw e;
        }
    }
}
