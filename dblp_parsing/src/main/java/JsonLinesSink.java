import com.google.gson.stream.JsonWriter;

import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one JSON object per line. Each record is flushed as soon as it is
 * written, nothing is held back between records.
 */
public class JsonLinesSink implements RecordSink {

    private final Writer out;
    private long written = 0;

    public JsonLinesSink(Writer out) {
        this.out = out;
    }

    public static JsonLinesSink open(Path file) throws IOException {
        return new JsonLinesSink(new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file.toFile()), StandardCharsets.UTF_8)));
    }

    @Override
    public void accept(DblpRecord record) throws IOException {
        out.write(toJson(record));
        out.write('\n');
        out.flush();
        written++;
    }

    public long written() {
        return written;
    }

    static String toJson(DblpRecord record) throws IOException {
        StringWriter line = new StringWriter();
        try (JsonWriter jsonWriter = new JsonWriter(line)) {
            jsonWriter.setHtmlSafe(false);

            jsonWriter.beginObject();
            for (String name : record.fieldNames()) {
                jsonWriter.name(name);
                Object value = record.get(name);
                if (value instanceof List) {
                    jsonWriter.beginArray();
                    for (Object s : (List<?>) value) {
                        jsonWriter.value((String) s);
                    }
                    jsonWriter.endArray();
                } else {
                    jsonWriter.value((String) value);
                }
            }
            jsonWriter.endObject();
        }
        return line.toString();
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
