package io.github.searchaggregates;

/**
 * Command line arguments of {@link SearchAggregatesTool}.
 */
public enum Arg {
    SUBMISSION_DATE("submission_date", "sd", true, "Submission date to process, formatted as yyyyMMdd"),
    BUCKET("bucket", "b", true, "Bucket the rollup is written to"),
    PREFIX("prefix", "p", true, "Prefix of the rollup within the output bucket"),
    INPUT_BUCKET("input_bucket", "ib", true, "Bucket of the input dataset"),
    INPUT_PREFIX("input_prefix", "ip", true, "Prefix of the input dataset"),
    SAVE_MODE("save_mode", "sm", true, "Save mode for writing data: error, overwrite, append or ignore"),
    HELP("help", "h", false, "Print this help message");

    private final String argName;
    private final String first;
    private final boolean parameterized;
    private final String helpText;

    Arg(String argName, String first, boolean parameterized, String helpText) {
        this.argName = argName;
        this.first = first;
        this.parameterized = parameterized;
        this.helpText = helpText;
    }

    @Override
    public String toString() {
        return argName;
    }

    public String first() {
        return first;
    }

    public String getArgName() {
        return argName;
    }

    public String getHelpText() {
        return helpText;
    }

    public boolean isParameterized() {
        return parameterized;
    }
}
