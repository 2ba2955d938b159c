public enum OutputMode {
    LINE_STREAM("line-stream"),
    TABULAR("tabular");

    private final String label;

    OutputMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static OutputMode of(String label) {
        for (OutputMode mode : values()) {
            if (mode.label.equals(label)) {
                return mode;
            }
        }
        throw new ConfigurationException("Unknown output mode '" + label + "', expected 'line-stream' or 'tabular'");
    }
}
