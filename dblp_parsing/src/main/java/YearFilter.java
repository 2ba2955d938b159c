import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

// Keeps records by the exact string in their "year" field
public final class YearFilter implements Predicate<DblpRecord> {

    public static final String YEAR = "year";

    private static final YearFilter ALL = new YearFilter(null);

    private final Set<String> years;

    private YearFilter(Set<String> years) {
        this.years = years;
    }

    public static YearFilter all() {
        return ALL;
    }

    public static YearFilter of(String year) {
        if (year == null) {
            throw new ConfigurationException("Year must not be null");
        }
        return new YearFilter(Set.of(year));
    }

    public static YearFilter anyOf(Set<String> years) {
        if (years == null || years.isEmpty()) {
            throw new ConfigurationException("At least one year is required");
        }
        return new YearFilter(Set.copyOf(years));
    }

    public boolean acceptsAll() {
        return years == null;
    }

    @Override
    public boolean test(DblpRecord record) {
        if (years == null) {
            return true;
        }
        String year = record.getString(YEAR);
        return year != null && years.contains(year);
    }

    @Override
    public String toString() {
        return years == null ? "all years" : "years " + new TreeSet<>(years);
    }
}
