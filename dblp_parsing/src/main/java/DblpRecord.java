import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One record extracted from the dump. Scalar fields hold a {@code String},
 * multi-valued fields an unmodifiable {@code List<String>}.
 */
public final class DblpRecord {

    public static final String TYPE = "type";
    public static final String KEY = "key";
    public static final String MDATE = "mdate";

    private final String type;
    private final String key;
    private final String mdate;
    private final Map<String, Object> values;

    DblpRecord(String type, String key, String mdate, Map<String, Object> values) {
        this.type = type;
        this.key = key;
        this.mdate = mdate;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String type() {
        return type;
    }

    // null unless metadata was extracted
    public String key() {
        return key;
    }

    public String mdate() {
        return mdate;
    }

    public boolean hasMetadata() {
        return key != null;
    }

    public Object get(String name) {
        switch (name) {
            case TYPE:
                return type;
            case KEY:
                return key;
            case MDATE:
                return mdate;
            default:
                return values.get(name);
        }
    }

    public String getString(String name) {
        Object value = get(name);
        return value instanceof String ? (String) value : null;
    }

    // All keys of this record: metadata first, then the extracted fields
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(values.size() + 3);
        names.addAll(metadataNames(hasMetadata()));
        names.addAll(values.keySet());
        return names;
    }

    public DblpRecord project(FieldSelection selection) {
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String field : selection) {
            if (values.containsKey(field)) {
                projected.put(field, values.get(field));
            }
        }
        return new DblpRecord(type, key, mdate, projected);
    }

    static List<String> metadataNames(boolean includeMetadata) {
        return includeMetadata ? List.of(TYPE, KEY, MDATE) : List.of(TYPE);
    }

    @Override
    public String toString() {
        return "DblpRecord{type=" + type + ", key=" + key + ", mdate=" + mdate + ", " + values + "}";
    }
}
