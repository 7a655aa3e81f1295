package com.samplesift.io;

import com.samplesift.record.RecordSourceException;
import com.samplesift.selection.ScorePriorities;
import com.samplesift.util.DecimalParser;
import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Reads a headerless two-column TSV of identifier and priority score. */
public final class PriorityScoresReader {

    private PriorityScoresReader() {}

    public static ScorePriorities read(Path path) throws RecordSourceException {
        Map<String, Double> scores = new HashMap<>();
        try (BufferedReader reader = TextFiles.newReader(path)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1) {
                    line = TextFiles.stripBom(line);
                }
                if (line.isBlank()) {
                    continue;
                }
                List<String> cells = DelimitedLineParser.parse(line, '\t');
                if (cells.size() < 2) {
                    throw new RecordSourceException(
                            path + ":" + lineNumber + ": expected an identifier and a priority separated by a tab");
                }
                BigDecimal score;
                try {
                    score = DecimalParser.parse(cells.get(1));
                } catch (NumberFormatException ex) {
                    throw new RecordSourceException(
                            path + ":" + lineNumber + ": priority '" + cells.get(1) + "' is not a number", ex);
                }
                if (score == null) {
                    throw new RecordSourceException(path + ":" + lineNumber + ": missing priority");
                }
                scores.put(cells.get(0).trim(), score.doubleValue());
            }
        } catch (IOException ex) {
            throw new RecordSourceException("Failed to read priorities " + path + ": " + ex.getMessage(), ex);
        }
        return new ScorePriorities(scores);
    }
}
