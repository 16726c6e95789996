package com.flowmable.colormatch;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Statistics of reference images, keyed by a SHA-256 fingerprint of their content
 * together with the {@link ColorSpaceConverter} the statistics were computed in.
 * <p>
 * Lets a batch compute each reference's statistics once. The cache is owned by
 * whoever creates it; entries are only dropped through {@link #invalidate} or
 * {@link #clear}. Safe for concurrent use, and may be shared by extractors with
 * different converters.
 */
public class ReferenceStatsCache {

    private record Key(ColorSpaceConverter converter, String fingerprint) {}

    private final Map<Key, ImageStats> entries = new ConcurrentHashMap<>();

    /**
     * Cached statistics for {@code buffer} in {@code extractor}'s color space,
     * computed with {@code extractor} on first use.
     */
    public ImageStats statsFor(PixelBuffer buffer, StatsExtractor extractor) {
        if (buffer == null) {
            throw new InvalidInputException("Pixel buffer must not be null");
        }
        if (extractor == null) {
            throw new InvalidParameterException("Stats extractor must not be null");
        }
        Key key = new Key(extractor.converter(), fingerprint(buffer));
        return entries.computeIfAbsent(key, k -> extractor.computeStats(buffer));
    }

    /**
     * Drop the entries for {@code buffer} in every color space, if any.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(PixelBuffer buffer) {
        String fingerprint = fingerprint(buffer);
        return entries.keySet().removeIf(key -> key.fingerprint().equals(fingerprint));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Hex SHA-256 over the buffer's shape and samples.
     */
    static String fingerprint(PixelBuffer buffer) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
        digest.update(ByteBuffer.allocate(12)
                .putInt(buffer.width())
                .putInt(buffer.height())
                .putInt(buffer.channels())
                .array());
        digest.update(buffer.data());
        return HexFormat.of().formatHex(digest.digest());
    }
}
