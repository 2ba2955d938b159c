import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Page count of a dblp "pages" string such as "23-43", "AG83-AG120" or "1-5,10".
// Only the last run of digits of a range bound counts, roman numerals and parts with two dashes count as zero.
public final class PageCounter {

    private static final Pattern COMMA = Pattern.compile(",");
    private static final Pattern DASH = Pattern.compile("-");
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private PageCounter() {
    }

    public static String count(String pages) {
        if (pages == null) {
            return "";
        }

        BigInteger total = BigInteger.ZERO;
        for (String part : COMMA.split(pages, -1)) {
            String[] bounds = DASH.split(part, -1);
            if (bounds.length > 2) {
                continue;
            }
            if (bounds.length == 1) {
                if (lastNumber(bounds[0]) != null) {
                    total = total.add(BigInteger.ONE);
                }
                continue;
            }
            BigInteger first = lastNumber(bounds[0]);
            BigInteger last = lastNumber(bounds[1]);
            if (first == null || last == null || last.compareTo(first) < 0) {
                continue;
            }
            total = total.add(last.subtract(first).add(BigInteger.ONE));
        }
        return total.signum() == 0 ? "" : total.toString();
    }

    // Last run of digits in the string, null if there is none
    static BigInteger lastNumber(String s) {
        Matcher m = DIGITS.matcher(s);
        String digits = null;
        while (m.find()) {
            digits = m.group();
        }
        return digits == null ? null : new BigInteger(digits);
    }
}
