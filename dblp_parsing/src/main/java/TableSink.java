import java.util.ArrayList;
import java.util.List;

public class TableSink implements RecordSink {

    private final RecordTable table;

    public TableSink(FieldSelection fields, boolean includeMetadata, int expectedRows) {
        List<String> columns = new ArrayList<>(DblpRecord.metadataNames(includeMetadata));
        columns.addAll(fields.asList());
        table = new RecordTable(columns, expectedRows);
    }

    @Override
    public void accept(DblpRecord record) {
        table.add(record);
    }

    public RecordTable table() {
        return table;
    }

    @Override
    public void close() {
        // rows stay available through table()
    }
}
