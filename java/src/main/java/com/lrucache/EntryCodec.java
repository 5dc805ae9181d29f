package com.lrucache;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;

/**
 * Converts cache keys or values to and from the bytes stored in a cache file.
 *
 * <p>Implementations must be deterministic: encoding equal content twice yields the same bytes,
 * otherwise size estimates and saved files disagree.
 *
 * @param <T> type handled by this codec
 */
public interface EntryCodec<T> {

    /**
     * Encodes {@code value} into a standalone byte array.
     *
     * @param value non-null value
     * @return encoded bytes
     * @throws IOException if the value cannot be encoded
     */
    byte[] encode(T value) throws IOException;

    /**
     * Decodes bytes previously produced by {@link #encode(Object)}.
     *
     * @param bytes encoded bytes
     * @return decoded value
     * @throws IOException if the bytes are not a valid encoding
     */
    T decode(byte[] bytes) throws IOException;

    /**
     * UTF-8 text codec.
     *
     * @return string codec
     */
    static EntryCodec<String> string() {
        return StringCodec.INSTANCE;
    }

    /**
     * Raw byte codec; arrays are copied in both directions.
     *
     * @return byte array codec
     */
    static EntryCodec<byte[]> bytes() {
        return BytesCodec.INSTANCE;
    }

    /**
     * Java object serialization codec. Works for any {@link Serializable} graph.
     *
     * @param <T> serializable type
     * @return serialization codec
     */
    @SuppressWarnings("unchecked")
    static <T> EntryCodec<T> serializable() {
        return (EntryCodec<T>) SerializableCodec.INSTANCE;
    }

    final class StringCodec implements EntryCodec<String> {
        private static final StringCodec INSTANCE = new StringCodec();

        private StringCodec() {
        }

        @Override
        public byte[] encode(String value) {
            return value.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String decode(byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    final class BytesCodec implements EntryCodec<byte[]> {
        private static final BytesCodec INSTANCE = new BytesCodec();

        private BytesCodec() {
        }

        @Override
        public byte[] encode(byte[] value) {
            return value.clone();
        }

        @Override
        public byte[] decode(byte[] bytes) {
            return bytes.clone();
        }
    }

    final class SerializableCodec implements EntryCodec<Object> {
        private static final SerializableCodec INSTANCE = new SerializableCodec();

        private SerializableCodec() {
        }

        @Override
        public byte[] encode(Object value) throws IOException {
            if (!(value instanceof Serializable)) {
                throw new InvalidClassException(value.getClass().getName(), "not serializable");
            }
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (ObjectOutputStream out = new ObjectOutputStream(buffer)) {
                out.writeObject(value);
            }
            return buffer.toByteArray();
        }

        @Override
        public Object decode(byte[] bytes) throws IOException {
            try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
                return in.readObject();
            } catch (ClassNotFoundException ex) {
                throw new CacheFormatException("Unknown class in cache entry: " + ex.getMessage(), ex);
            }
        }
    }
}
