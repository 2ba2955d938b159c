import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Fields requested for one run, never empty, iterated in schema order
public final class FieldSelection implements Iterable<String> {

    private static final FieldSelection ALL = new FieldSelection(FeatureSchema.fieldNames());

    private final List<String> fields;
    private final Set<String> lookup;

    private FieldSelection(Collection<String> fields) {
        this.fields = List.copyOf(fields);
        this.lookup = Set.copyOf(fields);
    }

    public static FieldSelection all() {
        return ALL;
    }

    public static FieldSelection of(Collection<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return ALL;
        }

        Set<String> accepted = new LinkedHashSet<>();
        for (String field : requested) {
            if (FeatureSchema.isValidField(field)) {
                accepted.add(field);
            } else {
                System.err.printf("WARNING: Discarding feature \"%s\" as it cannot be extracted from the dblp dump.%n", field);
            }
        }

        if (accepted.isEmpty()) {
            System.err.println("WARNING: None of the requested features is supported, extracting all features.");
            return ALL;
        }
        return new FieldSelection(inSchemaOrder(accepted));
    }

    public static FieldSelection of(String... requested) {
        return of(List.of(requested));
    }

    // Copy of this selection that also contains the given schema field
    public FieldSelection with(String field) {
        if (contains(field)) {
            return this;
        }
        FeatureSchema.cardinalityOf(field);
        Set<String> extended = new LinkedHashSet<>(fields);
        extended.add(field);
        return new FieldSelection(inSchemaOrder(extended));
    }

    public boolean contains(String field) {
        return field != null && lookup.contains(field);
    }

    public int size() {
        return fields.size();
    }

    public List<String> asList() {
        return fields;
    }

    @Override
    public Iterator<String> iterator() {
        return fields.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldSelection && ((FieldSelection) o).fields.equals(fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return String.join(", ", fields);
    }

    private static List<String> inSchemaOrder(Set<String> fields) {
        List<String> ordered = new ArrayList<>(fields.size());
        for (String name : FeatureSchema.fieldNames()) {
            if (fields.contains(name)) {
                ordered.add(name);
            }
        }
        return Collections.unmodifiableList(ordered);
    }
}
