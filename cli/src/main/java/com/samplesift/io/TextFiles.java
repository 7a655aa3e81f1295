package com.samplesift.io;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** UTF-8 readers and writers that transparently (de)compress paths ending in {@code .gz}. */
final class TextFiles {

    private TextFiles() {}

    static BufferedReader newReader(Path path) throws IOException {
        InputStream in = Files.newInputStream(path);
        if (isGzip(path)) {
            InputStream raw = in;
            try {
                in = new GZIPInputStream(raw);
            } catch (IOException ex) {
                closeAfterFailure(raw, ex);
                throw ex;
            }
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    static BufferedWriter newWriter(Path path) throws IOException {
        OutputStream out = Files.newOutputStream(path);
        if (isGzip(path)) {
            OutputStream raw = out;
            try {
                out = new GZIPOutputStream(raw);
            } catch (IOException ex) {
                closeAfterFailure(raw, ex);
                throw ex;
            }
        }
        return new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    /** Drops a leading byte order mark. */
    static String stripBom(String line) {
        return line != null && !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }

    private static void closeAfterFailure(Closeable stream, IOException failure) {
        try {
            stream.close();
        } catch (IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    private static boolean isGzip(Path path) {
        return path.getFileName().toString().endsWith(".gz");
    }
}
