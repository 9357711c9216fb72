package io.chatbox.server.core.store;

import io.chatbox.core.ChatException;
import io.chatbox.json.spi.JsonCodec;
import io.chatbox.json.spi.JsonException;
import org.rocksdb.CompressionType;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Embedded durable {@link RowStore} on RocksDB. Rows are stored as JSON.
 */
public final class RocksDbRowStore implements RowStore {
    private static final Logger logger = LoggerFactory.getLogger(RocksDbRowStore.class);

    private static final long DEFAULT_WRITE_BUFFER_SIZE = 16L * 1024 * 1024;
    private static final int DEFAULT_MAX_WRITE_BUFFERS = 3;
    private static final byte[] PING_KEY = "meta:ping".getBytes(StandardCharsets.UTF_8);

    private final RocksDB db;
    private final Options options;
    private final JsonCodec codec;

    public RocksDbRowStore(Path baseDir, JsonCodec codec) {
        this(baseDir, codec, DEFAULT_WRITE_BUFFER_SIZE, DEFAULT_MAX_WRITE_BUFFERS);
    }

    public RocksDbRowStore(Path baseDir, JsonCodec codec, long writeBufferSize, int maxWriteBuffers) {
        Objects.requireNonNull(baseDir, "baseDir");
        this.codec = Objects.requireNonNull(codec, "codec");
        if (writeBufferSize <= 0) {
            throw new IllegalArgumentException("writeBufferSize must be positive");
        }
        if (maxWriteBuffers <= 0) {
            throw new IllegalArgumentException("maxWriteBuffers must be positive");
        }
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create RocksDB directory " + baseDir, e);
        }
        try {
            RocksDB.loadLibrary();
        } catch (UnsatisfiedLinkError e) {
            throw new IllegalStateException(
                    "RocksDB native library failed to load. Add a platform-specific RocksDB JNI dependency at runtime "
                            + "(org.rocksdb:rocksdbjni:<version>:<classifier>, e.g. linux64/win64/osx).",
                    e);
        }
        this.options = new Options()
                .setCreateIfMissing(true)
                .setWriteBufferSize(writeBufferSize)
                .setMaxWriteBufferNumber(maxWriteBuffers)
                .setCompressionType(CompressionType.LZ4_COMPRESSION);
        try {
            this.db = RocksDB.open(options, baseDir.toString());
        } catch (RocksDBException e) {
            options.close();
            throw new ChatException.TransientStore("Failed to open RocksDB at " + baseDir, e);
        }
        logger.info("Opened chat store at {}", baseDir);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            byte[] value = db.get(encodeKey(key));
            return value == null ? Optional.empty() : Optional.of(decode(value, type));
        } catch (RocksDBException e) {
            throw new ChatException.TransientStore("Failed to read " + key, e);
        }
    }

    @Override
    public void put(String key, Object row) {
        Objects.requireNonNull(row, "row");
        try {
            db.put(encodeKey(key), encode(row));
        } catch (RocksDBException e) {
            throw new ChatException.TransientStore("Failed to write " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        byte[] k = encodeKey(key);
        try {
            if (db.get(k) == null) {
                return false;
            }
            db.delete(k);
            return true;
        } catch (RocksDBException e) {
            throw new ChatException.TransientStore("Failed to delete " + key, e);
        }
    }

    @Override
    public <T> List<T> scan(String prefix, Class<T> type) {
        return scanAfter(prefix, prefix, type, Integer.MAX_VALUE, row -> true);
    }

    @Override
    public <T> List<T> scanDescending(String prefix, Class<T> type, int limit, Predicate<? super T> filter) {
        byte[] p = encodeKey(prefix);
        List<T> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator()) {
            it.seekForPrev(upperBound(p));
            while (it.isValid() && out.size() < limit) {
                byte[] key = it.key();
                if (!startsWith(key, p)) {
                    if (compare(key, p) < 0) break;
                    it.prev();
                    continue;
                }
                T row = decode(it.value(), type);
                if (filter.test(row)) out.add(row);
                it.prev();
            }
        }
        return out;
    }

    @Override
    public <T> List<T> scanAfter(String prefix, String afterKey, Class<T> type, int limit, Predicate<? super T> filter) {
        byte[] p = encodeKey(prefix);
        byte[] after = encodeKey(afterKey);
        List<T> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator()) {
            it.seek(after);
            if (it.isValid() && Arrays.equals(it.key(), after)) {
                it.next();
            }
            while (it.isValid() && out.size() < limit && startsWith(it.key(), p)) {
                T row = decode(it.value(), type);
                if (filter.test(row)) out.add(row);
                it.next();
            }
        }
        return out;
    }

    @Override
    public void ping() {
        try {
            db.get(PING_KEY);
        } catch (RocksDBException e) {
            throw new ChatException.TransientStore("RocksDB ping failed", e);
        }
    }

    @Override
    public void close() {
        db.close();
        options.close();
    }

    private byte[] encode(Object row) {
        try {
            return codec.writeBytes(row);
        } catch (JsonException e) {
            throw new IllegalStateException("Failed to encode row " + row.getClass().getName(), e);
        }
    }

    private <T> T decode(byte[] value, Class<T> type) {
        try {
            return codec.readValue(value, type);
        } catch (JsonException e) {
            throw new IllegalStateException("Corrupt row for " + type.getName(), e);
        }
    }

    private static byte[] encodeKey(String key) {
        return Objects.requireNonNull(key, "key").getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] upperBound(byte[] prefix) {
        byte[] bound = Arrays.copyOf(prefix, prefix.length + 1);
        bound[prefix.length] = (byte) 0xFF;
        return bound;
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) return false;
        }
        return true;
    }

    private static int compare(byte[] a, byte[] b) {
        return Arrays.compareUnsigned(a, b);
    }
}
