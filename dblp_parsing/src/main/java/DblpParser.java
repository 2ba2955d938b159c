import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Set;

// Tabular output keeps every matching record in memory, use it for a few fields or years only
public class DblpParser {

    private static final DateTimeFormatter LOG_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private boolean showProgress = false;
    private int expectedRows = 1024;

    public DblpParser setShowProgress(boolean showProgress) {
        this.showProgress = showProgress;
        return this;
    }

    // Initial row capacity for tabular output
    public DblpParser setExpectedRows(int expectedRows) {
        this.expectedRows = expectedRows;
        return this;
    }

    public ExtractionResult extractAll(Path source, Path destination, Collection<String> fields,
                                       boolean includeMetadata, OutputMode mode) throws IOException {
        return extract(YearFilter.all(), source, destination, fields, includeMetadata, mode);
    }

    public ExtractionResult extractByYear(String year, Path source, Path destination, Collection<String> fields,
                                          boolean includeMetadata, OutputMode mode) throws IOException {
        return extract(YearFilter.of(year), source, destination, fields, includeMetadata, mode);
    }

    public ExtractionResult extractByYears(Set<String> years, Path source, Path destination, Collection<String> fields,
                                           boolean includeMetadata, OutputMode mode) throws IOException {
        return extract(YearFilter.anyOf(years), source, destination, fields, includeMetadata, mode);
    }

    public static List<String> listSupportedFields() {
        return FeatureSchema.fieldNames();
    }

    public static void printSupportedFields() {
        System.out.printf("The features that can be extracted from the dblp dump are: %s.%n"
                        + "For more info, check on https://dblp.org/faq/index.html%n",
                String.join(", ", FeatureSchema.fieldNames()));
    }

    public ExtractionResult extract(YearFilter filter, Path source, Path destination, Collection<String> fields,
                                    boolean includeMetadata, OutputMode mode) throws IOException {
        // Fail on configuration before touching the dump
        if (mode == null) {
            throw new ConfigurationException("No output mode given, expected 'line-stream' or 'tabular'");
        }
        if (mode == OutputMode.LINE_STREAM && destination == null) {
            throw new ConfigurationException("Output mode 'line-stream' requires a destination file");
        }

        FieldSelection selection = FieldSelection.of(fields);
        log(String.format("Parsing %s (%s). Started.", filter, mode.label()));

        DblpReader reader;
        try {
            reader = DblpReader.open(source, showProgress);
        } catch (LoadFailureException e) {
            log("ERROR: " + e.getMessage() + " Please check your XML and DTD files.");
            throw e;
        }

        ExtractionResult result;
        try (reader) {
            if (mode == OutputMode.LINE_STREAM) {
                try (JsonLinesSink sink = JsonLinesSink.open(destination)) {
                    result = run(reader, sink, selection, includeMetadata, filter, null);
                }
            } else {
                TableSink sink = new TableSink(selection, includeMetadata, expectedRows);
                result = run(reader, sink, selection, includeMetadata, filter, sink.table());
            }
        } catch (LoadFailureException e) {
            log("ERROR: " + e.getMessage());
            throw e;
        }

        log(String.format("Parsing %s (%s). Finished: %d records read, %d written, %d skipped.",
                filter, mode.label(), result.recordsRead(), result.recordsWritten(), result.recordsSkipped()));
        return result;
    }

    static ExtractionResult run(DblpReader reader, RecordSink sink, FieldSelection selection, boolean includeMetadata,
                                YearFilter filter, RecordTable table) throws IOException {
        // The year is always needed for filtering, but only kept if it was asked for
        FieldSelection extraction = filter.acceptsAll() ? selection : selection.with(YearFilter.YEAR);
        RecordExtractor extractor = new RecordExtractor();

        long written = 0;
        long skipped = 0;

        while (reader.hasNext()) {
            Element element = reader.next();

            DblpRecord record;
            try {
                record = extractor.extract(element, extraction, includeMetadata);
            } catch (MissingAttributeException e) {
                System.err.println("WARNING: Skipping record: " + e.getMessage());
                skipped++;
                continue;
            }

            if (!filter.test(record)) {
                continue;
            }
            if (extraction != selection) {
                record = record.project(selection);
            }

            sink.accept(record);
            written++;
        }

        return new ExtractionResult(reader.recordCount(), written, skipped, table);
    }

    private static void log(String message) {
        System.out.println(LocalDateTime.now().format(LOG_TIME) + " DBLP " + message);
    }
}
