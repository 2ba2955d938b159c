import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DblpParserTest {

    @TempDir
    Path tempDir;

    private Path sample;
    private DblpParser parser;

    @BeforeEach
    void setUp() throws Exception {
        sample = Paths.get(getClass().getResource("/sample-dblp.xml").toURI());
        parser = new DblpParser();
    }

    private List<JsonObject> readLines(Path file) throws Exception {
        List<JsonObject> records = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            records.add(JsonParser.parseString(line).getAsJsonObject());
        }
        return records;
    }

    private static List<String> keys(List<JsonObject> records) {
        List<String> keys = new ArrayList<>();
        for (JsonObject record : records) {
            keys.add(record.get("key").getAsString());
        }
        return keys;
    }

    @Test
    void testArticleEndToEnd() throws Exception {
        Path out = tempDir.resolve("dblp.jsonl");

        ExtractionResult result = parser.extractAll(sample, out, Set.of("year", "pages", "title"), true, OutputMode.LINE_STREAM);

        assertEquals(5, result.recordsRead());
        assertEquals(4, result.recordsWritten());
        assertEquals(1, result.recordsSkipped());
        assertNull(result.table());

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals("{\"type\":\"article\",\"key\":\"a1\",\"mdate\":\"2020-01-01\",\"pages\":\"21\",\"title\":\"Foo Bar\",\"year\":\"2022\"}",
                lines.get(0));
        assertEquals("{\"type\":\"inproceedings\",\"key\":\"c1\",\"mdate\":\"2021-05-05\",\"pages\":\"4\",\"title\":\"Streaming & Parsing\",\"year\":\"2021\"}",
                lines.get(1));
    }

    @Test
    void testEveryRecordHasExactlyTheRequestedKeys() throws Exception {
        List<Set<String>> requests = new ArrayList<>();
        for (String field : FeatureSchema.fieldNames()) {
            requests.add(Set.of(field));
        }
        requests.add(Set.of("author", "ee", "title"));
        requests.add(new HashSet<>(FeatureSchema.fieldNames()));

        for (Set<String> fields : requests) {
            for (boolean metadata : new boolean[]{false, true}) {
                Path out = tempDir.resolve("keys.jsonl");
                parser.extractAll(sample, out, fields, metadata, OutputMode.LINE_STREAM);

                Set<String> expected = new HashSet<>(fields);
                expected.add("type");
                if (metadata) {
                    expected.add("key");
                    expected.add("mdate");
                }
                for (JsonObject record : readLines(out)) {
                    assertEquals(expected, record.keySet(), "fields " + fields);
                }
            }
        }
    }

    @Test
    void testAllFieldsWhenNoneRequested() throws Exception {
        Path out = tempDir.resolve("all.jsonl");

        parser.extractAll(sample, out, null, false, OutputMode.LINE_STREAM);

        JsonObject first = readLines(out).get(0);
        assertEquals(FeatureSchema.fieldNames().size() + 1, first.size());
        assertEquals(2, first.getAsJsonArray("author").size());
        assertEquals("J. Test", first.get("journal").getAsString());
        assertEquals(0, first.getAsJsonArray("ee").size());
        assertEquals("", first.get("school").getAsString());
    }

    @Test
    void testSameOutputOnEveryRun() throws Exception {
        Path first = tempDir.resolve("first.jsonl");
        Path second = tempDir.resolve("second.jsonl");

        parser.extractAll(sample, first, null, true, OutputMode.LINE_STREAM);
        parser.extractAll(sample, second, null, true, OutputMode.LINE_STREAM);

        assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
    }

    @Test
    void testByYear() throws Exception {
        Path out = tempDir.resolve("2022.jsonl");

        ExtractionResult result = parser.extractByYear("2022", sample, out, Set.of("title"), true, OutputMode.LINE_STREAM);

        List<JsonObject> records = readLines(out);
        assertEquals(List.of("a1", "t1"), keys(records));
        assertEquals(2, result.recordsWritten());
        // year was only needed for filtering
        assertFalse(records.get(0).has("year"));
    }

    @Test
    void testByYearIsExactStringMatch() throws Exception {
        Path out = tempDir.resolve("y.jsonl");

        parser.extractByYear("22", sample, out, Set.of("year"), false, OutputMode.LINE_STREAM);
        assertTrue(readLines(out).isEmpty());

        parser.extractByYear("2022 ", sample, out, Set.of("year"), false, OutputMode.LINE_STREAM);
        assertTrue(readLines(out).isEmpty());
    }

    @Test
    void testByYearWithoutMetadataKeepsRecordsWithoutKey() throws Exception {
        Path out = tempDir.resolve("2022.jsonl");

        parser.extractByYear("2022", sample, out, Set.of("title", "year"), false, OutputMode.LINE_STREAM);

        List<String> titles = new ArrayList<>();
        for (JsonObject record : readLines(out)) {
            titles.add(record.get("title").getAsString());
        }
        assertEquals(List.of("Foo Bar", "No Key", "Thesis"), titles);
    }

    @Test
    void testByYearsIsUnionOfSingleYears() throws Exception {
        Path union = tempDir.resolve("union.jsonl");
        Path y2021 = tempDir.resolve("2021.jsonl");
        Path y2022 = tempDir.resolve("2022.jsonl");

        parser.extractByYears(Set.of("2021", "2022"), sample, union, Set.of("year"), true, OutputMode.LINE_STREAM);
        parser.extractByYear("2021", sample, y2021, Set.of("year"), true, OutputMode.LINE_STREAM);
        parser.extractByYear("2022", sample, y2022, Set.of("year"), true, OutputMode.LINE_STREAM);

        Set<String> expected = new HashSet<>(keys(readLines(y2021)));
        expected.addAll(keys(readLines(y2022)));
        assertEquals(expected, new HashSet<>(keys(readLines(union))));
        assertEquals(List.of("a1", "c1", "t1"), keys(readLines(union)));
    }

    @Test
    void testTabular() throws Exception {
        ExtractionResult result = parser.setExpectedRows(2)
                .extractAll(sample, null, Set.of("author", "title", "bogus"), true, OutputMode.TABULAR);

        RecordTable table = result.table();
        assertNotNull(table);
        assertEquals(List.of("type", "key", "mdate", "author", "title"), table.columns());
        assertEquals(4, table.rowCount());
        assertEquals(List.of("article", "a1", "2020-01-01", List.of("Alice", "Bob"), "Foo Bar"), table.row(0));
        assertEquals("Home Page", table.get(2, "title"));
        assertEquals(List.of("a1", "c1", "homepages/x/Dave", "t1"), table.column("key"));
        assertThrows(IllegalArgumentException.class, () -> table.get(0, "year"));
    }

    @Test
    void testTabularByYear() throws Exception {
        ExtractionResult result = parser.extractByYear("2021", sample, null, Set.of("booktitle"), false, OutputMode.TABULAR);

        assertEquals(List.of("type", "booktitle"), result.table().columns());
        assertEquals(1, result.table().rowCount());
        assertEquals("CONF", result.table().get(0, "booktitle"));
    }

    @Test
    void testConfigurationErrors() {
        assertThrows(ConfigurationException.class,
                () -> parser.extractAll(sample, null, null, false, OutputMode.LINE_STREAM));
        assertThrows(ConfigurationException.class,
                () -> parser.extractAll(sample, tempDir.resolve("x.jsonl"), null, false, null));
        assertThrows(ConfigurationException.class, () -> OutputMode.of("dataframe"));
        assertEquals(OutputMode.TABULAR, OutputMode.of("tabular"));
        assertEquals(OutputMode.LINE_STREAM, OutputMode.of("line-stream"));
    }

    @Test
    void testConfigurationIsCheckedBeforeLoading() {
        // The source does not exist, but the missing destination is reported first
        assertThrows(ConfigurationException.class,
                () -> parser.extractAll(tempDir.resolve("missing.xml"), null, null, false, OutputMode.LINE_STREAM));
    }

    @Test
    void testLoadFailure() {
        assertThrows(LoadFailureException.class,
                () -> parser.extractAll(tempDir.resolve("missing.xml"), tempDir.resolve("out.jsonl"), null, false, OutputMode.LINE_STREAM));
    }

    @Test
    void testMalformedSourceIsFatal() throws Exception {
        Path broken = tempDir.resolve("broken.xml");
        Files.writeString(broken, "<dblp><article key=\"a\" mdate=\"m\"><year>2020</year></article><article><year>", StandardCharsets.UTF_8);
        Path out = tempDir.resolve("broken.jsonl");

        assertThrows(LoadFailureException.class,
                () -> parser.extractAll(broken, out, Set.of("year"), false, OutputMode.LINE_STREAM));
        // records before the error were already flushed
        assertEquals(1, Files.readAllLines(out, StandardCharsets.UTF_8).size());
    }

    @Test
    void testJsonLinesSinkWritesOneLinePerRecord() throws Exception {
        StringWriter out = new StringWriter();
        JsonLinesSink sink = new JsonLinesSink(out);

        try (DblpReader reader = DblpReader.open(sample, false)) {
            DblpParser.run(reader, sink, FieldSelection.of("ee"), false, YearFilter.all(), null);
        }

        String[] lines = out.toString().split("\n");
        assertEquals(5, lines.length);
        assertEquals("{\"type\":\"inproceedings\",\"ee\":[\"https://doi.org/10.1000/1\",\"https://doi.org/10.1000/2\"]}", lines[1]);
        assertEquals(5, sink.written());
    }

    @Test
    void testListSupportedFields() {
        List<String> fields = DblpParser.listSupportedFields();
        assertTrue(fields.contains("author"));
        assertTrue(fields.contains("year"));
        assertThrows(UnsupportedOperationException.class, () -> fields.add("abstract"));
    }
}
