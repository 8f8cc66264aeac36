package com.raditha.approx.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.approx.hashing.CanonicalHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Durable record of every variant hash that has been through the pipeline.
 * <p>
 * The file is append-only JSON Lines, one {@link CacheEntry} per line, mirrored in a
 * concurrent map for membership checks. Inserts hold both a per-file monitor (threads of
 * this JVM) and an exclusive {@link FileLock} (other processes). Inside that critical
 * section entries appended by other processes are read first, so check-then-insert is
 * atomic across workers and across processes sharing the file. An entry is never
 * overwritten.
 * <p>
 * A missing file is an empty cache. An unreadable file, or individual lines that do not
 * parse, are logged and skipped rather than failing the run.
 */
public class VariantCache {

    private static final Logger logger = LoggerFactory.getLogger(VariantCache.class);

    private static final ConcurrentMap<Path, Object> FILE_MONITORS = new ConcurrentHashMap<>();
    private static final Pattern BARE_HASH = Pattern.compile("[0-9a-f]{64}");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path file;
    private final Object monitor;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private long readOffset;

    /**
     * Open (or lazily create) the cache stored in {@code file}.
     */
    public VariantCache(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("cache file cannot be null, use inMemory()");
        }
        this.file = file.toAbsolutePath().normalize();
        this.monitor = FILE_MONITORS.computeIfAbsent(this.file, k -> new Object());
        load();
    }

    private VariantCache() {
        this.file = null;
        this.monitor = new Object();
    }

    /**
     * A cache with no backing file. Used by generate-only runs and tests.
     */
    public static VariantCache inMemory() {
        return new VariantCache();
    }

    public boolean contains(String hash) {
        return hash != null && entries.containsKey(hash);
    }

    /**
     * Look up the outcome for {@code hash}. A miss re-reads the file first, so outcomes
     * recorded by other processes sharing the cache are seen.
     */
    public Optional<CacheEntry> get(String hash) {
        if (hash == null) {
            return Optional.empty();
        }
        CacheEntry entry = entries.get(hash);
        if (entry == null && file != null) {
            refresh();
            entry = entries.get(hash);
        }
        return Optional.ofNullable(entry);
    }

    public int size() {
        return entries.size();
    }

    public Map<String, CacheEntry> snapshot() {
        return Map.copyOf(entries);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Insert {@code hash} as a success.
     *
     * @return true only if this call performed the insertion
     */
    public boolean tryAdd(String hash) {
        return recordOutcome(hash, VariantStatus.SUCCESS, null, null);
    }

    /**
     * Insert the outcome for {@code hash} unless one is already recorded. Nothing is
     * kept in memory when the append cannot be written.
     *
     * @return true only if this call performed the insertion
     */
    public boolean recordOutcome(String hash, VariantStatus status, String reason, VariantMetrics metrics) {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("hash cannot be blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (entries.containsKey(hash)) {
            return false;
        }

        CacheEntry entry = new CacheEntry(hash, status, reason, Instant.now(), metrics);
        synchronized (monitor) {
            if (file == null) {
                return entries.putIfAbsent(hash, entry) == null;
            }
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                readAppended(channel);
                if (entries.containsKey(hash)) {
                    return false;
                }
                append(channel, entry);
                entries.put(hash, entry);
                return true;
            } catch (IOException e) {
                logger.error("Could not persist cache entry {} to {}: {}",
                        CanonicalHasher.shortHash(hash), file, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Claim a hash for evaluation by this process. Claims are not persisted; they only
     * stop two workers of the same run from evaluating the same variant at once.
     *
     * @return false if the hash is already recorded, here or by another process, or claimed
     */
    public boolean tryClaim(String hash) {
        return get(hash).isEmpty() && inFlight.add(hash);
    }

    public void release(String hash) {
        inFlight.remove(hash);
    }

    /**
     * Pick up entries appended by other processes since the last read.
     */
    public void refresh() {
        if (file == null) {
            return;
        }
        synchronized (monitor) {
            if (!Files.exists(file)) {
                return;
            }
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
                readAppended(channel);
            } catch (IOException e) {
                logger.warn("Could not refresh cache from {}: {}", file, e.getMessage());
            }
        }
    }

    private void load() {
        synchronized (monitor) {
            if (!Files.exists(file)) {
                logger.debug("No cache at {}, starting empty", file);
                return;
            }
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
                readAppended(channel);
                logger.info("Loaded {} cached variant outcomes from {}", entries.size(), file);
            } catch (IOException e) {
                logger.warn("Cache file {} is unreadable, starting with an empty cache: {}", file, e.getMessage());
                entries.clear();
                readOffset = 0;
            }
        }
    }

    /**
     * Reads complete lines past {@link #readOffset}. A trailing partial line is left for
     * the next read.
     */
    private void readAppended(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size < readOffset) {
            readOffset = 0;
        }
        if (size == readOffset) {
            return;
        }

        ByteBuffer buffer = ByteBuffer.allocate(Math.toIntExact(size - readOffset));
        long position = readOffset;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                break;
            }
            position += read;
        }
        byte[] bytes = buffer.array();
        int complete = lastNewline(bytes, buffer.position()) + 1;
        if (complete == 0) {
            return;
        }

        String text = new String(bytes, 0, complete, StandardCharsets.UTF_8);
        for (String line : text.split("\n")) {
            parseLine(line.strip());
        }
        readOffset += complete;
    }

    private void parseLine(String line) {
        if (line.isEmpty()) {
            return;
        }
        if (BARE_HASH.matcher(line).matches()) {
            entries.putIfAbsent(line, new CacheEntry(line, VariantStatus.SUCCESS, null, null, null));
            return;
        }
        try {
            CacheEntry entry = mapper.readValue(line, CacheEntry.class);
            if (entry.hash() == null || entry.status() == null) {
                logger.warn("Skipping incomplete cache record in {}", file);
                return;
            }
            entries.putIfAbsent(entry.hash(), entry);
        } catch (JsonProcessingException e) {
            logger.warn("Skipping corrupt cache record in {}: {}", file, e.getOriginalMessage());
        }
    }

    private void append(FileChannel channel, CacheEntry entry) throws IOException {
        long position = channel.size();
        String line = mapper.writeValueAsString(entry) + "\n";
        if (position > 0 && !endsWithNewline(channel, position)) {
            line = "\n" + line;
        }
        ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
        channel.force(true);
        readOffset = position;
    }

    private static boolean endsWithNewline(FileChannel channel, long size) throws IOException {
        ByteBuffer last = ByteBuffer.allocate(1);
        channel.read(last, size - 1);
        return last.get(0) == '\n';
    }

    private static int lastNewline(byte[] bytes, int length) {
        for (int i = length - 1; i >= 0; i--) {
            if (bytes[i] == '\n') {
                return i;
            }
        }
        return -1;
    }
}
