import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class FeatureSchema {

    public enum Cardinality {
        SCALAR,
        MULTI
    }

    // Element types in dblp
    private static final Set<String> RECORD_TYPES = Set.of("article", "inproceedings", "proceedings", "book",
            "incollection", "phdthesis", "mastersthesis", "www", "person", "data");

    // Fields that can be extracted from a record, in output order
    private static final Map<String, Cardinality> FEATURES;

    static {
        Map<String, Cardinality> features = new LinkedHashMap<>();
        features.put("address", Cardinality.SCALAR);
        features.put("author", Cardinality.MULTI);
        features.put("booktitle", Cardinality.SCALAR);
        features.put("cdrom", Cardinality.SCALAR);
        features.put("chapter", Cardinality.SCALAR);
        features.put("cite", Cardinality.MULTI);
        features.put("crossref", Cardinality.SCALAR);
        features.put("editor", Cardinality.MULTI);
        features.put("ee", Cardinality.MULTI);
        features.put("isbn", Cardinality.SCALAR);
        features.put("journal", Cardinality.SCALAR);
        features.put("month", Cardinality.SCALAR);
        features.put("note", Cardinality.SCALAR);
        features.put("number", Cardinality.SCALAR);
        features.put("pages", Cardinality.SCALAR);
        features.put("publisher", Cardinality.SCALAR);
        features.put("publnr", Cardinality.SCALAR);
        features.put("school", Cardinality.SCALAR);
        features.put("series", Cardinality.SCALAR);
        features.put("title", Cardinality.SCALAR);
        features.put("url", Cardinality.SCALAR);
        features.put("volume", Cardinality.SCALAR);
        features.put("year", Cardinality.SCALAR);
        FEATURES = Collections.unmodifiableMap(features);
    }

    private static final List<String> FIELD_NAMES = List.copyOf(FEATURES.keySet());

    private FeatureSchema() {
    }

    public static boolean isValidField(String name) {
        return name != null && FEATURES.containsKey(name);
    }

    public static Cardinality cardinalityOf(String name) {
        Cardinality cardinality = name == null ? null : FEATURES.get(name);
        if (cardinality == null) {
            throw new IllegalArgumentException("Unknown dblp field: " + name);
        }
        return cardinality;
    }

    public static boolean isRecordType(String tag) {
        return tag != null && RECORD_TYPES.contains(tag);
    }

    public static List<String> fieldNames() {
        return FIELD_NAMES;
    }

    public static Set<String> recordTypes() {
        return RECORD_TYPES;
    }
}
