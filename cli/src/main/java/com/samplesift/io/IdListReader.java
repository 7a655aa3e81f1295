package com.samplesift.io;

import com.samplesift.record.RecordSourceException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/** Reads identifier lists: one id per line, {@code #} starts a comment, blank lines ignored. */
public final class IdListReader {

    private IdListReader() {}

    public static Set<String> read(Path path) throws RecordSourceException {
        Set<String> ids = new LinkedHashSet<>();
        try (BufferedReader reader = TextFiles.newReader(path)) {
            String line;
            boolean first = true;
            while ((line = reader.readLine()) != null) {
                if (first) {
                    line = TextFiles.stripBom(line);
                    first = false;
                }
                int comment = line.indexOf('#');
                String id = (comment >= 0 ? line.substring(0, comment) : line).trim();
                if (!id.isEmpty()) {
                    ids.add(id);
                }
            }
        } catch (IOException ex) {
            throw new RecordSourceException("Failed to read id list " + path + ": " + ex.getMessage(), ex);
        }
        return ids;
    }

    /** Union of several lists, in file order. */
    public static Set<String> readAll(Collection<Path> paths) throws RecordSourceException {
        Set<String> ids = new LinkedHashSet<>();
        for (Path path : paths) {
            ids.addAll(read(path));
        }
        return ids;
    }
}
