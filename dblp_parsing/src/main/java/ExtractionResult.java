// Totals of one run; table is null unless the run used tabular output
public record ExtractionResult(long recordsRead, long recordsWritten, long recordsSkipped, RecordTable table) {
}
