package com.tagatlas.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * RFC 4180 style parser for hierarchical tag rows.
 * Each line is one row: quoted fields may contain commas, a doubled quote inside
 * quotes is a literal quote. Fields are trimmed and lowercased, empty fields dropped,
 * blank lines skipped.
 */
public final class CsvRowParser {

    private CsvRowParser() {
    }

    public static List<List<String>> parse(Reader reader) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        BufferedReader buffered = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);

        String line;
        while ((line = buffered.readLine()) != null) {
            List<String> row = parseRow(line);
            if (!row.isEmpty()) {
                rows.add(row);
            }
        }
        return rows;
    }

    /**
     * Normalised segments of one line; empty for a blank line
     */
    public static List<String> parseRow(String line) {
        List<String> segments = new ArrayList<>();
        if (line == null || line.isBlank()) {
            return segments;
        }

        for (String field : splitFields(line)) {
            String value = field.trim().toLowerCase(Locale.ROOT);
            if (!value.isEmpty()) {
                segments.add(value);
            }
        }
        return segments;
    }

    /**
     * Raw fields of one line, untrimmed
     */
    public static List<String> splitFields(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '"') {
                if (!inQuotes) {
                    inQuotes = true;
                } else if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = false;
                }
            } else if (c == ',' && !inQuotes) {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }
}
