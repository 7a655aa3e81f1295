package com.samplesift.io;

import java.util.ArrayList;
import java.util.List;

/** Splits one line of comma- or tab-separated text, honoring double-quoted cells. */
public final class DelimitedLineParser {

    private DelimitedLineParser() {}

    /** Picks tab when the header line contains one outside quotes, otherwise comma. */
    public static char sniffDelimiter(String headerLine) {
        int tabs = 0;
        int commas = 0;
        boolean inQuotes = false;
        for (int i = 0; i < headerLine.length(); i++) {
            char ch = headerLine.charAt(i);
            if (ch == '"') {
                inQuotes = !inQuotes;
            } else if (!inQuotes && ch == '\t') {
                tabs++;
            } else if (!inQuotes && ch == ',') {
                commas++;
            }
        }
        return tabs > 0 || commas == 0 ? '\t' : ',';
    }

    public static List<String> parse(String line, char delimiter) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (ch == delimiter && !inQuotes) {
                values.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        values.add(current.toString());
        return values;
    }

    /** Quotes {@code value} when it contains the delimiter, a quote or a line break. */
    public static String quote(String value, char delimiter) {
        if (value.indexOf(delimiter) < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0
                && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
