package com.samplesift.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Writes kept identifiers, one per line. */
public final class KeptIdWriter {

    private KeptIdWriter() {}

    public static void write(Path path, List<String> ids) throws IOException {
        try (BufferedWriter writer = TextFiles.newWriter(path)) {
            for (String id : ids) {
                writer.write(id);
                writer.newLine();
            }
        }
    }
}
