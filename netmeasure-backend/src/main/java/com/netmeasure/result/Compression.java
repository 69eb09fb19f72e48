package com.netmeasure.result;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Compression of a result file, picked from its extension.
 */
public enum Compression {
    GZIP(".gz") {
        @Override
        public InputStream wrap(InputStream in) throws IOException {
            return new GZIPInputStream(in);
        }

        @Override
        public OutputStream wrap(OutputStream out) throws IOException {
            return new GZIPOutputStream(out);
        }
    },
    BZIP2(".bz2") {
        @Override
        public InputStream wrap(InputStream in) throws IOException {
            return new BZip2CompressorInputStream(in);
        }

        @Override
        public OutputStream wrap(OutputStream out) throws IOException {
            return new BZip2CompressorOutputStream(out);
        }
    },
    NONE("") {
        @Override
        public InputStream wrap(InputStream in) {
            return in;
        }

        @Override
        public OutputStream wrap(OutputStream out) {
            return out;
        }
    };

    private final String extension;

    Compression(String extension) {
        this.extension = extension;
    }

    public abstract InputStream wrap(InputStream in) throws IOException;

    public abstract OutputStream wrap(OutputStream out) throws IOException;

    /**
     * Picks the compression for a file name; unknown extensions mean plain JSON.
     */
    public static Compression forFilename(String filename) {
        String lower = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(GZIP.extension)) {
            return GZIP;
        }
        if (lower.endsWith(BZIP2.extension)) {
            return BZIP2;
        }
        return NONE;
    }
}
