package io.kvlink.field;

import io.kvlink.core.SchemaException;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.zip.Deflater;
import java.util.zip.InflaterInputStream;

/**
 * Compression algorithm of a {@link CompressedField}.
 * <p>
 * Both modes always compress at their maximum level. The level shows up in
 * the stream header, and a fixed header is what lets stored values be
 * recognised on the way back.
 */
public enum CompressionMode {

    /** zlib-wrapped deflate, level 9 (header {@code 78 DA}). */
    DEFLATE(new byte[]{0x78, (byte) 0xDA}, List.of("zlib", "deflate", "gzip", "gz")) {
        @Override
        byte[] compress(byte[] data) {
            Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
            try {
                deflater.setInput(data);
                deflater.finish();
                ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
                byte[] buffer = new byte[4096];
                while (!deflater.finished()) {
                    int written = deflater.deflate(buffer);
                    out.write(buffer, 0, written);
                }
                return out.toByteArray();
            } finally {
                deflater.end();
            }
        }

        @Override
        byte[] decompress(byte[] data) throws IOException {
            try (InflaterInputStream in = new InflaterInputStream(new ByteArrayInputStream(data))) {
                return in.readAllBytes();
            }
        }
    },

    /** bzip2 with 900k blocks (header {@code BZh9}). */
    BZIP2(new byte[]{'B', 'Z', 'h', '9'}, List.of("bz2", "bzip2")) {
        @Override
        byte[] compress(byte[] data) throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
            try (BZip2CompressorOutputStream bzip = new BZip2CompressorOutputStream(out, BZip2CompressorOutputStream.MAX_BLOCKSIZE)) {
                bzip.write(data);
            }
            return out.toByteArray();
        }

        @Override
        byte[] decompress(byte[] data) throws IOException {
            try (BZip2CompressorInputStream in = new BZip2CompressorInputStream(new ByteArrayInputStream(data))) {
                return in.readAllBytes();
            }
        }
    };

    private final byte[] header;
    private final List<String> aliases;

    CompressionMode(byte[] header, List<String> aliases) {
        this.header = header;
        this.aliases = aliases;
    }

    /**
     * Resolve a mode by its name or one of its aliases, ignoring case.
     *
     * @throws SchemaException if no mode matches
     */
    public static CompressionMode forName(String name) {
        if (name != null) {
            String lowered = name.toLowerCase(Locale.ROOT);
            for (CompressionMode mode : values()) {
                if (mode.name().toLowerCase(Locale.ROOT).equals(lowered) || mode.aliases.contains(lowered)) {
                    return mode;
                }
            }
        }
        throw new SchemaException("Invalid compression mode '" + name + "', expected one of " + List.of(values()));
    }

    /**
     * Whether data starts with this mode's stream header.
     */
    public boolean hasHeader(byte[] data) {
        if (data.length < header.length) {
            return false;
        }
        for (int i = 0; i < header.length; i++) {
            if (data[i] != header[i]) {
                return false;
            }
        }
        return true;
    }

    abstract byte[] compress(byte[] data) throws IOException;

    abstract byte[] decompress(byte[] data) throws IOException;
}
