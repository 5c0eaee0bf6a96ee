package org.ipod.datapipeline.utils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Reads and writes JSON-lines files: one JSON object per line, UTF-8.
 * <p>
 * Record types map field by field; absent nullable fields read as {@code null}.
 */
public final class JsonLines {

    private static final Gson GSON = new GsonBuilder()
            .serializeSpecialFloatingPointValues()
            .create();

    private JsonLines() {
    }

    /**
     * Reads every non-blank line of the file as one row.
     *
     * @param file The file.
     * @param type Row type.
     * @param <T>  Row type.
     * @return The rows in file order.
     * @throws IOException              if the file cannot be read.
     * @throws IllegalArgumentException if a line is not valid JSON for {@code type}.
     */
    public static <T> List<T> read(Path file, Class<T> type) throws IOException {
        List<T> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    T row = GSON.fromJson(line, type);
                    if (row == null) {
                        throw new IllegalArgumentException(String.format("%s:%d: empty JSON value", file, lineNumber));
                    }
                    rows.add(row);
                } catch (RuntimeException e) {
                    throw new IllegalArgumentException(
                            String.format("%s:%d: cannot read %s: %s", file, lineNumber, type.getSimpleName(), e.getMessage()), e);
                }
            }
        }
        return rows;
    }

    /**
     * Writes one line per row, replacing the file.
     *
     * @param file The file.
     * @param rows Rows to write.
     * @return Number of rows written.
     * @throws IOException if the file cannot be written.
     */
    public static int write(Path file, Iterable<?> rows) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        int count = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (Object row : rows) {
                writer.write(GSON.toJson(row));
                writer.newLine();
                count++;
            }
        }
        return count;
    }
}
