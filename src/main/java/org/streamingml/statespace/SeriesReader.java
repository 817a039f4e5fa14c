package org.streamingml.statespace;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// Reads an observation sequence from a text file: one value per line, or comma separated
// values on a line. Blank lines and lines starting with '#' are skipped.
public final class SeriesReader {

    private SeriesReader() {}

    public static double[] read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    public static double[] read(BufferedReader reader, String source) throws IOException {
        List<Double> values = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            for (String token : line.split(",")) {
                token = token.trim();
                if (token.isEmpty()) {
                    continue;
                }
                values.add(parseFinite(token, source + ":" + lineNo));
            }
        }
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }

    // Parses a comma separated list such as "0.5,-0.2,0.1"; an empty string is an empty vector
    public static double[] parseCsv(String csv) {
        if (csv == null || csv.trim().isEmpty()) {
            return new double[0];
        }
        String[] tokens = csv.split(",");
        double[] out = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            out[i] = parseFinite(tokens[i].trim(), "'" + csv + "'");
        }
        return out;
    }

    // NaN and the infinities parse as doubles but are never valid observations or coefficients
    private static double parseFinite(String token, String where) {
        double value;
        try {
            value = Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new ConstructionException("Malformed value '" + token + "' at " + where, e);
        }
        if (!Double.isFinite(value)) {
            throw new ConstructionException("Non-finite value '" + token + "' at " + where);
        }
        return value;
    }
}
