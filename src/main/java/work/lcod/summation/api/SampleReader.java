package work.lcod.summation.api;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Reads samples from a CSV file with the header {@code module,event,col,row,x,y}.
 * {@code module} and {@code event} are required; the other columns default to zero.
 */
public final class SampleReader {
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim(true);

    private SampleReader() {}

    public record Sample(long module, long event, int col, int row, double x, double y) {}

    public static List<Sample> read(Path path) {
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read samples: " + path, ex);
        }
    }

    public static List<Sample> read(Reader reader, String origin) throws IOException {
        try (CSVParser parser = new CSVParser(reader, FORMAT)) {
            List<String> headers = parser.getHeaderNames();
            if (!headers.contains("module") || !headers.contains("event")) {
                throw new IllegalStateException("Samples " + origin + " need 'module' and 'event' columns, got " + headers);
            }
            List<Sample> samples = new ArrayList<>();
            for (CSVRecord record : parser) {
                try {
                    samples.add(new Sample(
                        Long.parseLong(record.get("module")),
                        Long.parseLong(record.get("event")),
                        intOr(record, "col"),
                        intOr(record, "row"),
                        doubleOr(record, "x"),
                        doubleOr(record, "y")
                    ));
                } catch (NumberFormatException ex) {
                    throw new IllegalStateException(
                        "Invalid sample at line " + record.getRecordNumber() + " of " + origin + ": " + ex.getMessage(), ex
                    );
                }
            }
            return samples;
        }
    }

    private static int intOr(CSVRecord record, String column) {
        if (!record.isSet(column) || record.get(column).isEmpty()) {
            return 0;
        }
        return Integer.parseInt(record.get(column));
    }

    private static double doubleOr(CSVRecord record, String column) {
        if (!record.isSet(column) || record.get(column).isEmpty()) {
            return 0.0;
        }
        return Double.parseDouble(record.get(column));
    }
}
