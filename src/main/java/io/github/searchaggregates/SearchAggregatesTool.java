package io.github.searchaggregates;

import io.github.searchaggregates.config.JobConfig;
import io.github.searchaggregates.config.JobConfigLoader;
import io.github.searchaggregates.exception.SearchAggregationException;
import io.github.searchaggregates.spark.SearchDashboardJob;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.MissingOptionException;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point of the search dashboard job.
 *
 * <pre>
 * spark-submit --class io.github.searchaggregates.SearchAggregatesTool search-aggregates.jar \
 *   --submission_date 20170801 --bucket telemetry-parquet --prefix search_dashboard
 * </pre>
 */
public class SearchAggregatesTool {
    private static final Logger LOG = LoggerFactory.getLogger(SearchAggregatesTool.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final List<Arg> REQUIRED_ARGS = Arrays.asList(Arg.SUBMISSION_DATE, Arg.BUCKET, Arg.PREFIX);

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args) {
        Options options = createOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printUsage(options);
            return EXIT_USAGE;
        }

        if (cmd.hasOption(Arg.HELP.first())) {
            printUsage(options);
            return 0;
        }

        try {
            JobConfig config = toJobConfig(cmd, JobConfigLoader.load());
            SearchDashboardJob.generateDashboard(config);
            return 0;
        } catch (MissingOptionException e) {
            System.err.println(e.getMessage());
            printUsage(options);
            return EXIT_USAGE;
        } catch (SearchAggregationException e) {
            LOG.error("Search dashboard job failed", e);
            return EXIT_FAILURE;
        } catch (Exception e) {
            // Spark and Hadoop failures, e.g. a missing input path
            LOG.error("Search dashboard job failed with an unexpected error", e);
            return EXIT_FAILURE;
        }
    }

    static Options createOptions() {
        Options options = new Options();
        for (Arg arg : Arg.values()) {
            createOpt(arg, arg.isParameterized(), arg.getHelpText(), options);
        }
        return options;
    }

    /**
     * Applies the parsed options over {@code defaults}. Required options are checked here rather than
     * by the parser so that {@code --help} works on its own.
     */
    static JobConfig toJobConfig(CommandLine cmd, JobConfig.Builder defaults) throws MissingOptionException {
        for (Arg arg : REQUIRED_ARGS) {
            if (!cmd.hasOption(arg.first())) {
                throw new MissingOptionException("Missing required option: --" + arg);
            }
        }

        defaults.submissionDate(getRequiredArgument(cmd, Arg.SUBMISSION_DATE))
                .bucket(getRequiredArgument(cmd, Arg.BUCKET))
                .prefix(getRequiredArgument(cmd, Arg.PREFIX));

        if (cmd.hasOption(Arg.INPUT_BUCKET.first())) {
            defaults.inputBucket(cmd.getOptionValue(Arg.INPUT_BUCKET.first()));
        }
        if (cmd.hasOption(Arg.INPUT_PREFIX.first())) {
            defaults.inputPrefix(cmd.getOptionValue(Arg.INPUT_PREFIX.first()));
        }
        if (cmd.hasOption(Arg.SAVE_MODE.first())) {
            defaults.saveMode(cmd.getOptionValue(Arg.SAVE_MODE.first()));
        }
        return defaults.build();
    }

    private static String getRequiredArgument(CommandLine cmd, Arg arg) {
        return cmd.getOptionValue(arg.first());
    }

    private static void createOpt(Arg name, boolean hasArg, String help, Options options) {
        options.addOption(new Option(name.first(), name.toString(), hasArg, help));
    }

    private static void printUsage(Options options) {
        new HelpFormatter().printHelp("search-aggregates --submission_date <yyyyMMdd> --bucket <bucket> --prefix <prefix>", options);
    }
}
