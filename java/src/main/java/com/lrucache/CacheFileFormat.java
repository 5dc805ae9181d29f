package com.lrucache;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Binary layout of a persisted cache.
 *
 * <pre>
 * int magic ("LRUC")
 * int version
 * int count
 * count x { int keyLength, key bytes, int valueLength, value bytes }   oldest first
 * </pre>
 *
 * <p>The file is the header followed by the concatenated records, so the encoded size of a store is
 * {@link #HEADER_BYTES} plus the sum of {@link #encodeRecord} lengths.
 */
final class CacheFileFormat<K, V> {

    static final int MAGIC = 0x4C525543;
    static final int VERSION = 1;
    static final int HEADER_BYTES = 12;

    private final EntryCodec<K> keyCodec;
    private final EntryCodec<V> valueCodec;

    CacheFileFormat(EntryCodec<K> keyCodec, EntryCodec<V> valueCodec) {
        this.keyCodec = Objects.requireNonNull(keyCodec, "keyCodec");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
    }

    /**
     * Returns the exact number of bytes {@link #encode(Map)} produces for {@code entries}.
     */
    long estimateBytes(Map<K, V> entries) throws IOException {
        return encode(entries).length;
    }

    byte[] encode(Map<K, V> entries) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            out.writeInt(MAGIC);
            out.writeInt(VERSION);
            out.writeInt(entries.size());
            for (Map.Entry<K, V> entry : entries.entrySet()) {
                out.write(encodeRecord(entry.getKey(), entry.getValue()));
            }
        }
        return buffer.toByteArray();
    }

    byte[] encodeRecord(K key, V value) throws IOException {
        byte[] keyBytes = keyCodec.encode(key);
        byte[] valueBytes = valueCodec.encode(value);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(keyBytes.length + valueBytes.length + 8);
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            out.writeInt(keyBytes.length);
            out.write(keyBytes);
            out.writeInt(valueBytes.length);
            out.write(valueBytes);
        }
        return buffer.toByteArray();
    }

    /**
     * Decodes a whole cache file, preserving record order.
     *
     * @throws CacheFormatException if the layout is invalid
     */
    LinkedHashMap<K, V> decode(byte[] data) throws IOException {
        ByteArrayInputStream source = new ByteArrayInputStream(data);
        DataInputStream in = new DataInputStream(source);
        try {
            int magic = in.readInt();
            if (magic != MAGIC) {
                throw new CacheFormatException("Not a cache file, bad magic: 0x" + Integer.toHexString(magic));
            }
            int version = in.readInt();
            if (version != VERSION) {
                throw new CacheFormatException("Unsupported cache file version: " + version);
            }
            int count = in.readInt();
            if (count < 0) {
                throw new CacheFormatException("Corrupt entry count: " + count);
            }
            LinkedHashMap<K, V> entries = new LinkedHashMap<>();
            for (int i = 0; i < count; i++) {
                K key = keyCodec.decode(readChunk(in, source));
                V value = valueCodec.decode(readChunk(in, source));
                if (key == null || value == null) {
                    throw new CacheFormatException("Null key or value in record " + i);
                }
                entries.put(key, value);
            }
            if (source.available() > 0) {
                throw new CacheFormatException("Trailing bytes after " + count + " records: " + source.available());
            }
            return entries;
        } catch (EOFException ex) {
            throw new CacheFormatException("Truncated cache file", ex);
        }
    }

    private static byte[] readChunk(DataInputStream in, ByteArrayInputStream source) throws IOException {
        int length = in.readInt();
        if (length < 0 || length > source.available()) {
            throw new CacheFormatException("Corrupt record length: " + length);
        }
        byte[] chunk = new byte[length];
        in.readFully(chunk);
        return chunk;
    }
}
