import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of extracted records kept in memory, one column per field.
 * <p>
 * The whole filtered result is held until the run ends, so this is meant for
 * slices of the dump (a few fields, a few years). Use line-stream output for
 * the complete dump.
 */
public class RecordTable {

    private final List<String> columns;
    private final Map<String, Integer> index = new HashMap<>();
    private final ArrayList<Object[]> rows;

    public RecordTable(List<String> columns, int expectedRows) {
        this.columns = List.copyOf(columns);
        for (int i = 0; i < this.columns.size(); i++) {
            index.put(this.columns.get(i), i);
        }
        rows = new ArrayList<>(Math.max(expectedRows, 16));
    }

    public void add(DblpRecord record) {
        Object[] row = new Object[columns.size()];
        for (int i = 0; i < row.length; i++) {
            row[i] = record.get(columns.get(i));
        }
        rows.add(row);
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public List<Object> row(int i) {
        return Collections.unmodifiableList(Arrays.asList(rows.get(i)));
    }

    public Object get(int row, String column) {
        Integer col = index.get(column);
        if (col == null) {
            throw new IllegalArgumentException("No column '" + column + "' in " + columns);
        }
        return rows.get(row)[col];
    }

    public List<Object> column(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            values.add(get(i, column));
        }
        return values;
    }
}
