package org.streamingml.statespace;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

// Writes a series in the format SeriesReader reads, one value per line.
public final class SeriesWriter {

    private SeriesWriter() {}

    public static void write(Path path, double[] series) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (double value : series) {
                writer.write(Double.toString(value));
                writer.newLine();
            }
        }
    }
}
