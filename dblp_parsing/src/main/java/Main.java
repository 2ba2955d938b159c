import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class Main {
/*
Usage: Main [dblp.xml[.gz]] [output.jsonl] [--fields a,b,c] [--metadata] [--year Y]... [--tabular] [--list-fields]

Examples:
  Main dblp.xml.gz dblp.jsonl
  Main dblp.xml.gz dblp_2022.jsonl --year 2022
  Main dblp.xml.gz dblp.jsonl --fields url,author,ee,journal,pages,title,year --metadata
*/

    private static final int PREVIEW_ROWS = 5;

    public static void main(String[] args) throws IOException {

        // STEP 1: download dblp dump (2 files) into the working directory
        // curl -O https://dblp.org/xml/dblp.xml.gz
        // curl -O https://dblp.org/xml/dblp.dtd

        List<String> positional = new ArrayList<>();
        List<String> fields = null;
        Set<String> years = new LinkedHashSet<>();
        boolean includeMetadata = false;
        OutputMode mode = OutputMode.LINE_STREAM;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--fields":
                    fields = Arrays.asList(requireValue(args, ++i).split(","));
                    break;
                case "--metadata":
                    includeMetadata = true;
                    break;
                case "--year":
                    years.add(requireValue(args, ++i));
                    break;
                case "--tabular":
                    mode = OutputMode.TABULAR;
                    break;
                case "--mode":
                    mode = OutputMode.of(requireValue(args, ++i));
                    break;
                case "--list-fields":
                    DblpParser.printSupportedFields();
                    return;
                default:
                    positional.add(args[i]);
            }
        }

        Path dblpFile = Paths.get(positional.size() > 0 ? positional.get(0) : "dblp.xml");
        Path jsonFile = mode == OutputMode.LINE_STREAM
                ? Paths.get(positional.size() > 1 ? positional.get(1) : "dblp.json")
                : null;

        // STEP 2: extract records
        DblpParser parser = new DblpParser().setShowProgress(true);
        ExtractionResult result;
        if (years.isEmpty()) {
            result = parser.extractAll(dblpFile, jsonFile, fields, includeMetadata, mode);
        } else if (years.size() == 1) {
            result = parser.extractByYear(years.iterator().next(), dblpFile, jsonFile, fields, includeMetadata, mode);
        } else {
            result = parser.extractByYears(years, dblpFile, jsonFile, fields, includeMetadata, mode);
        }

        System.out.println("Total number of records in dblp : " + result.recordsRead());
        System.out.println("Records extracted               : " + result.recordsWritten());
        System.out.println("Records skipped                 : " + result.recordsSkipped());

        if (result.table() != null) {
            RecordTable table = result.table();
            System.out.println(table.columns());
            for (int i = 0; i < Math.min(PREVIEW_ROWS, table.rowCount()); i++) {
                System.out.println(table.row(i));
            }
        }

        System.out.println("*** [Finished] ***");
    }

    private static String requireValue(String[] args, int i) {
        if (i >= args.length) {
            throw new ConfigurationException("Missing value for " + args[i - 1]);
        }
        return args[i];
    }
}
