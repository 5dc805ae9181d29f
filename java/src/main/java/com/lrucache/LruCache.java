package com.lrucache;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Least-recently-used cache bounded by the encoded size of its contents, optionally persisted to a
 * single file.
 *
 * <p>Entries are kept in recency order: reads and writes of a key move it to the most-recent end,
 * {@link #trim()} evicts from the least-recent end. A persistent cache loads its file when built and
 * writes it back on {@link #save()} or {@link #close()}; by default it is also closed when the JVM
 * exits.
 *
 * <p>Instances are not thread-safe, and nothing coordinates two caches sharing one file.
 *
 * @param <K> key type, with consistent {@code equals}/{@code hashCode}
 * @param <V> value type
 */
public final class LruCache<K, V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LruCache.class);

    public static final int DEFAULT_MAX_ITEM_COUNT = Integer.MAX_VALUE;
    public static final long DEFAULT_MAX_BYTE_SIZE = 1024L * 1024L * 1024L;

    private final LinkedHashMap<K, V> data = new LinkedHashMap<>();
    private final CacheFileFormat<K, V> format;
    private final Path backingPath;
    private final int maxItemCount;
    private final long maxByteSize;
    private final boolean fsyncOnWrite;
    private boolean dirty = false;

    private LruCache(Builder<K, V> builder) throws IOException {
        this.format = new CacheFileFormat<>(builder.keyCodec, builder.valueCodec);
        this.backingPath = builder.backingPath == null ? null : builder.backingPath.toAbsolutePath().normalize();
        this.maxItemCount = builder.maxItemCount;
        this.maxByteSize = builder.maxByteSize;
        this.fsyncOnWrite = builder.fsyncOnWrite;
        load();
        if (backingPath != null && builder.closeOnExit) {
            CacheRegistry registry = builder.registry == null ? CacheRegistry.global() : builder.registry;
            registry.register(this);
        }
    }

    /**
     * Creates a builder whose keys and values are stored with Java serialization.
     *
     * @param <K> key type
     * @param <V> value type
     * @return builder for further customization
     */
    public static <K, V> Builder<K, V> newBuilder() {
        return new Builder<>(EntryCodec.serializable(), EntryCodec.serializable());
    }

    /**
     * Creates a builder that stores keys and values with the given codecs.
     *
     * @param keyCodec codec for keys
     * @param valueCodec codec for values
     * @param <K> key type
     * @param <V> value type
     * @return builder for further customization
     * @throws NullPointerException if either codec is {@code null}
     */
    public static <K, V> Builder<K, V> newBuilder(EntryCodec<K> keyCodec, EntryCodec<V> valueCodec) {
        return new Builder<>(Objects.requireNonNull(keyCodec, "keyCodec"),
                Objects.requireNonNull(valueCodec, "valueCodec"));
    }

    /**
     * Opens a persistent cache with default settings, loading {@code backingPath} if it exists.
     *
     * @param backingPath file the cache persists to
     * @return initialized cache, registered for close at exit
     * @throws IOException if an existing file cannot be read or decoded
     */
    public static <K, V> LruCache<K, V> open(Path backingPath) throws IOException {
        return LruCache.<K, V>newBuilder().backingPath(backingPath).build();
    }

    /**
     * Creates a memory-only cache with default limits.
     *
     * @return empty cache without a backing file
     */
    public static <K, V> LruCache<K, V> inMemory() {
        try {
            return LruCache.<K, V>newBuilder().build();
        } catch (IOException ex) {
            throw new IllegalStateException("memory-only cache performs no I/O", ex);
        }
    }

    /**
     * Returns the value for {@code key} and marks it most recently used.
     *
     * @param key cache key
     * @return value, or empty on a miss
     */
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");
        V value = data.remove(key);
        if (value == null) {
            log.debug("miss key={}", key);
            return Optional.empty();
        }
        log.debug("hit key={}", key);
        data.put(key, value);
        dirty = true;
        return Optional.of(value);
    }

    /**
     * Same as {@link #get(Object)} but returns {@code defaultValue} on a miss.
     */
    public V getOrDefault(K key, V defaultValue) {
        return get(key).orElse(defaultValue);
    }

    /**
     * Checks for {@code key} without changing its recency.
     *
     * @param key cache key
     * @return {@code true} if present
     */
    public boolean contains(K key) {
        Objects.requireNonNull(key, "key");
        return data.containsKey(key);
    }

    /**
     * Stores {@code value} under {@code key}, replacing any previous value, as the most recently used
     * entry.
     *
     * @param key cache key
     * @param value non-null value
     */
    public void set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        log.debug("set key={}", key);
        data.remove(key);
        data.put(key, value);
        dirty = true;
    }

    /**
     * Removes {@code key}.
     *
     * @param key cache key
     * @throws NoSuchElementException if {@code key} is not cached
     */
    public void delete(K key) {
        Objects.requireNonNull(key, "key");
        if (!data.containsKey(key)) {
            throw new NoSuchElementException("Key not found: " + key);
        }
        log.debug("delete key={}", key);
        data.remove(key);
        dirty = true;
    }

    /**
     * Returns the cached value for {@code key}, or loads, stores and returns it on a miss. The loader
     * runs at most once; if it throws, nothing is cached and the exception propagates.
     *
     * @param key cache key
     * @param loader producer of the value for a cold key
     * @param <X> exception type thrown by the loader
     * @return cached or freshly loaded value
     * @throws X if the loader fails
     */
    public <X extends Exception> V getOrLoad(K key, ValueLoader<? extends V, X> loader) throws X {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(loader, "loader");
        V cached = data.remove(key);
        if (cached != null) {
            log.debug("hit key={}", key);
            data.put(key, cached);
            dirty = true;
            return cached;
        }
        log.debug("miss key={}", key);
        V value = Objects.requireNonNull(loader.load(), "loader returned null");
        data.put(key, value);
        dirty = true;
        return value;
    }

    /**
     * Removes every entry.
     */
    public void clear() {
        log.debug("clear");
        data.clear();
        dirty = true;
    }

    public int size() {
        return data.size();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * Returns the keys, least recently used first.
     *
     * @return snapshot of the current key order
     */
    public List<K> keys() {
        return List.copyOf(data.keySet());
    }

    /**
     * Returns the values, least recently used first.
     *
     * @return snapshot of the current values
     */
    public List<V> values() {
        return List.copyOf(data.values());
    }

    /**
     * Returns the entries, least recently used first.
     *
     * @return snapshot of the current key/value pairs
     */
    public List<Map.Entry<K, V>> entries() {
        List<Map.Entry<K, V>> result = new ArrayList<>(data.size());
        for (Map.Entry<K, V> entry : data.entrySet()) {
            result.add(Map.entry(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    /**
     * Computes the size the cache would occupy on disk if saved now.
     *
     * @return encoded size in bytes
     * @throws IOException if an entry cannot be encoded
     */
    public long byteSize() throws IOException {
        return format.estimateBytes(data);
    }

    /**
     * Returns the current entry count and encoded size.
     *
     * @return current cache statistics
     * @throws IOException if an entry cannot be encoded
     */
    public Stats stats() throws IOException {
        return new Stats(data.size(), byteSize());
    }

    /**
     * Evicts least recently used entries until the cache holds at most {@code maxItemCount} entries
     * and its encoded size is at most {@code maxByteSize}. If the empty encoding alone exceeds the
     * byte limit, every entry is evicted.
     *
     * @return number of entries evicted
     * @throws IOException if an entry cannot be encoded
     */
    public int trim() throws IOException {
        List<K> oldestFirst = new ArrayList<>(data.keySet());
        long[] recordBytes = new long[oldestFirst.size()];
        long total = CacheFileFormat.HEADER_BYTES;
        int index = 0;
        for (Map.Entry<K, V> entry : data.entrySet()) {
            recordBytes[index] = format.encodeRecord(entry.getKey(), entry.getValue()).length;
            total += recordBytes[index];
            index++;
        }

        int count = 0;
        while (count < oldestFirst.size() && (data.size() > maxItemCount || total > maxByteSize)) {
            data.remove(oldestFirst.get(count));
            total -= recordBytes[count];
            dirty = true;
            count++;
        }
        if (count > 0) {
            log.debug("trimmed {} items", count);
        }
        return count;
    }

    /**
     * Replaces the in-memory contents with those of the backing file. A missing file, or no backing
     * path at all, leaves the cache empty.
     *
     * @throws CacheFormatException if the file is corrupt
     * @throws IOException if the file cannot be read or an entry cannot be decoded
     */
    public void load() throws IOException {
        if (backingPath == null) {
            return;
        }
        if (!Files.exists(backingPath)) {
            log.debug("persisted cache not found: {}", backingPath);
            data.clear();
            dirty = false;
            return;
        }
        LinkedHashMap<K, V> loaded = format.decode(Files.readAllBytes(backingPath));
        data.clear();
        data.putAll(loaded);
        dirty = false;
        log.debug("loaded {} items from {}", data.size(), backingPath);
    }

    /**
     * Trims the cache and writes it to the backing file if anything changed since the last load or
     * save. Without a backing path this only logs an error.
     *
     * @throws IOException if encoding or writing fails; the cache stays dirty
     */
    public void save() throws IOException {
        if (backingPath == null) {
            log.error("cannot save cache without a backing path");
            return;
        }
        if (!dirty) {
            log.info("no changes to save");
            return;
        }
        trim();
        log.debug("saving cache: {}", backingPath);
        writeAtomically(format.encode(data));
        dirty = false;
    }

    /**
     * Saves the cache. The cache remains usable afterwards.
     *
     * @throws IOException if saving fails
     */
    @Override
    public void close() throws IOException {
        save();
    }

    public boolean isDirty() {
        return dirty;
    }

    public Optional<Path> backingPath() {
        return Optional.ofNullable(backingPath);
    }

    public int maxItemCount() {
        return maxItemCount;
    }

    public long maxByteSize() {
        return maxByteSize;
    }

    @Override
    public String toString() {
        return "LruCache{items=" + data.size() + ", path=" + backingPath + "}";
    }

    private void writeAtomically(byte[] payload) throws IOException {
        Path parent = backingPath.getParent();
        Files.createDirectories(parent);
        Path tempPath = parent.resolve(".tmp-" + backingPath.getFileName() + "-"
                + Long.toHexString(ThreadLocalRandom.current().nextLong()));
        try {
            try (FileChannel channel = FileChannel.open(tempPath,
                    StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(payload);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                if (fsyncOnWrite) {
                    channel.force(true);
                }
            }
            moveAtomically(tempPath, backingPath);
        } catch (IOException ex) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanup) {
                ex.addSuppressed(cleanup);
            }
            throw ex;
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            // fallback without ATOMIC_MOVE
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Builder for configuring {@link LruCache} instances.
     */
    public static final class Builder<K, V> {
        private final EntryCodec<K> keyCodec;
        private final EntryCodec<V> valueCodec;
        private Path backingPath = null;
        private int maxItemCount = DEFAULT_MAX_ITEM_COUNT;
        private long maxByteSize = DEFAULT_MAX_BYTE_SIZE;
        private boolean closeOnExit = true;
        private boolean fsyncOnWrite = false;
        private CacheRegistry registry = null;

        private Builder(EntryCodec<K> keyCodec, EntryCodec<V> valueCodec) {
            this.keyCodec = keyCodec;
            this.valueCodec = valueCodec;
        }

        /**
         * Sets the file the cache loads from and saves to. Without one the cache is memory-only.
         *
         * @param path backing file
         * @return this builder
         * @throws NullPointerException if {@code path} is {@code null}
         */
        public Builder<K, V> backingPath(Path path) {
            this.backingPath = Objects.requireNonNull(path, "path");
            return this;
        }

        /**
         * Caps the number of entries kept by {@link LruCache#trim()}.
         *
         * @param count maximum entry count
         * @return this builder
         * @throws IllegalArgumentException if {@code count} is negative
         */
        public Builder<K, V> maxItemCount(int count) {
            if (count < 0) {
                throw new IllegalArgumentException("maxItemCount must be non-negative, got: " + count);
            }
            this.maxItemCount = count;
            return this;
        }

        /**
         * Caps the encoded size kept by {@link LruCache#trim()}.
         *
         * @param bytes maximum encoded size in bytes
         * @return this builder
         * @throws IllegalArgumentException if {@code bytes} is negative
         */
        public Builder<K, V> maxByteSize(long bytes) {
            if (bytes < 0) {
                throw new IllegalArgumentException("maxByteSize must be non-negative, got: " + bytes);
            }
            this.maxByteSize = bytes;
            return this;
        }

        /**
         * Registers a persistent cache to be closed when the JVM exits. Ignored for memory-only caches.
         *
         * @param enable {@code true} to flush at exit
         * @return this builder
         */
        public Builder<K, V> closeOnExit(boolean enable) {
            this.closeOnExit = enable;
            return this;
        }

        /**
         * Forces saved data to the storage device before the file is replaced.
         *
         * @param fsync whether to fsync on save
         * @return this builder
         */
        public Builder<K, V> fsyncOnWrite(boolean fsync) {
            this.fsyncOnWrite = fsync;
            return this;
        }

        /**
         * Registry used when {@code closeOnExit} is set; defaults to {@link CacheRegistry#global()}.
         *
         * @param registry registry to join
         * @return this builder
         */
        public Builder<K, V> registry(CacheRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            return this;
        }

        /**
         * Builds the cache, loading the backing file when one is configured and exists.
         *
         * @return new cache instance
         * @throws IOException if the backing file cannot be read or decoded
         */
        public LruCache<K, V> build() throws IOException {
            return new LruCache<>(this);
        }
    }
}
