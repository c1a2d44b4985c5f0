package com.sparky.suppress.tool;

import com.google.common.base.Stopwatch;
import com.sparky.suppress.Const;
import com.sparky.suppress.action.BoundedDeleteExecutor;
import com.sparky.suppress.action.DeleteAction;
import com.sparky.suppress.action.ISuppressionAction;
import com.sparky.suppress.action.NoOpAction;
import com.sparky.suppress.action.UpsertAction;
import com.sparky.suppress.api.SuppressionListApi;
import com.sparky.suppress.batch.RunSummary;
import com.sparky.suppress.batch.SuppressionBatchProcessor;
import com.sparky.suppress.config.ConfigLoader;
import com.sparky.suppress.config.ToolConfig;
import com.sparky.suppress.csv.CsvRowNormalizer;
import com.sparky.suppress.csv.InvalidSuppressionFileException;
import com.sparky.suppress.csv.SuppressionCsvWriter;
import com.sparky.suppress.csv.SuppressionFileReader;
import com.sparky.suppress.csv.SuppressionRecordSource;
import com.sparky.suppress.retrieve.RetrieveResult;
import com.sparky.suppress.retrieve.SuppressionListRetriever;
import com.sparky.suppress.retrieve.TimeRange;
import com.sparky.suppress.util.SuppressionMetrics;
import com.sparky.suppress.web.RateLimitedWebClient;
import com.sparky.suppress.web.SessionPool;
import com.sparky.suppress.web.Sleeper;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.cli.Argument;
import io.vertx.core.cli.CLI;
import io.vertx.core.cli.CLIException;
import io.vertx.core.cli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

//
// command line entry point
//
//   sparky-suppress check|retrieve|update|delete <file> [from_time to_time]
//
// configuration is read from sparkpost.ini in the working directory, or the file named by
// -Dsuppression.config=<path>
//
public class SuppressionListTool {
    private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionListTool.class);

    static final String ARG_COMMAND = "cmd";
    static final String ARG_FILE = "supp_list";
    static final String ARG_FROM = "from_time";
    static final String ARG_TO = "to_time";

    private final Vertx vertx;
    private final ToolConfig config;
    private final Sleeper sleeper;
    private final SuppressionMetrics metrics;

    public SuppressionListTool(Vertx vertx, ToolConfig config) {
        this(vertx, config, Sleeper.THREAD, new SuppressionMetrics());
    }

    SuppressionListTool(Vertx vertx, ToolConfig config, Sleeper sleeper, SuppressionMetrics metrics) {
        this.vertx = vertx;
        this.config = config;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public static void main(String[] args) {
        CommandLine cli = parseArgs(args);
        if (cli == null) {
            System.exit(1);
        }

        // delete workers block while waiting out rate limits
        VertxOptions options = new VertxOptions()
            .setBlockedThreadCheckInterval(60 * 60 * 1000);
        Vertx vertx = Vertx.vertx(options);

        int status;
        try {
            Path configPath = Paths.get(System.getProperty(Const.ConfigPathProp, Const.DefaultConfigPath));
            ToolConfig config = new ConfigLoader(vertx).load(configPath);
            status = new SuppressionListTool(vertx, config).run(cli);
        } catch (Exception e) {
            LOGGER.error("Error: {}", e.getMessage(), e);
            status = 1;
        } finally {
            vertx.close();
        }
        System.exit(status);
    }

    /**
     * @return the parsed command line, or null after printing usage when the arguments are not usable
     */
    static CommandLine parseArgs(String[] args) {
        CLI cli = createCli();
        CommandLine commandLine;
        try {
            commandLine = cli.parse(Arrays.asList(args));
        } catch (CLIException e) {
            printUsage(cli, e.getMessage());
            return null;
        }

        String command = commandLine.getArgumentValue(ARG_COMMAND);
        if (Command.fromName(command) == null) {
            printUsage(cli, "Unknown command: " + command);
            return null;
        }

        String fromTime = commandLine.getArgumentValue(ARG_FROM);
        String toTime = commandLine.getArgumentValue(ARG_TO);
        if ((fromTime == null) != (toTime == null)) {
            printUsage(cli, "from_time and to_time must be given together");
            return null;
        }
        if (fromTime != null && !TimeRange.isExpectedFormat(fromTime)) {
            printUsage(cli, "unrecognised from_time: " + fromTime);
            return null;
        }
        if (toTime != null && !TimeRange.isExpectedFormat(toTime)) {
            printUsage(cli, "unrecognised to_time: " + toTime);
            return null;
        }
        return commandLine;
    }

    static CLI createCli() {
        StringBuilder description = new StringBuilder("Manage the customer suppression list.\n\nCOMMANDS\n");
        for (Command c : Command.values()) {
            description.append(String.format("  %-10s %s%n", c.commandName(), c.description()));
        }
        return CLI.create("sparky-suppress")
            .setSummary("Manage the customer suppression list")
            .setDescription(description.toString())
            .addArgument(new Argument()
                .setIndex(0)
                .setArgName(ARG_COMMAND)
                .setDescription("check|retrieve|update|delete")
                .setRequired(true))
            .addArgument(new Argument()
                .setIndex(1)
                .setArgName(ARG_FILE)
                .setDescription(".csv format file, containing as a minimum the email recipients")
                .setRequired(true))
            .addArgument(new Argument()
                .setIndex(2)
                .setArgName(ARG_FROM)
                .setDescription("retrieve only, format YYYY-MM-DDTHH:MM")
                .setRequired(false))
            .addArgument(new Argument()
                .setIndex(3)
                .setArgName(ARG_TO)
                .setDescription("retrieve only, format YYYY-MM-DDTHH:MM")
                .setRequired(false));
    }

    private static void printUsage(CLI cli, String error) {
        if (error != null) {
            System.err.println(error);
        }
        StringBuilder usage = new StringBuilder();
        cli.usage(usage);
        System.out.println(usage);
    }

    public int run(CommandLine cli) throws IOException, InvalidSuppressionFileException {
        Command command = Command.fromName(cli.getArgumentValue(ARG_COMMAND));
        Path file = Paths.get(cli.<String>getArgumentValue(ARG_FILE));
        String fromTime = cli.getArgumentValue(ARG_FROM);
        String toTime = cli.getArgumentValue(ARG_TO);

        if (command != Command.RETRIEVE && fromTime != null) {
            LOGGER.warn("from_time / to_time only apply to retrieve, ignoring them");
        }

        switch (command) {
            case CHECK:
                runBatch(file, new NoOpAction());
                return 0;
            case RETRIEVE:
                runRetrieve(file, fromTime == null ? null : TimeRange.of(fromTime, toTime, config.timezone()));
                return 0;
            case UPDATE:
                runUpdate(file);
                return 0;
            case DELETE:
                runDelete(file);
                return 0;
            default:
                throw new IllegalStateException("unhandled command " + command);
        }
    }

    RunSummary runUpdate(Path file) throws IOException, InvalidSuppressionFileException {
        return runBatch(file, new UpsertAction(createApi(), createSessions(1).session(0)));
    }

    RunSummary runDelete(Path file) throws IOException, InvalidSuppressionFileException {
        SessionPool sessions = createSessions(config.deleteThreads());
        return runBatch(file, new DeleteAction(new BoundedDeleteExecutor(vertx, sessions, createApi())));
    }

    RunSummary runBatch(Path file, ISuppressionAction action) throws IOException, InvalidSuppressionFileException {
        LOGGER.info("Running {} on {}", action.name(), file);
        try (SuppressionFileReader reader = SuppressionFileReader.open(file, config.fileCharacterEncodings())) {
            SuppressionRecordSource source = new SuppressionRecordSource(reader,
                new CsvRowNormalizer(config.typeDefault(), config.descriptionDefault()));
            return new SuppressionBatchProcessor(config.batchSize(), metrics).process(source, action);
        }
    }

    RetrieveResult runRetrieve(Path file, TimeRange timeRange) throws IOException {
        if (timeRange != null) {
            LOGGER.info("Retrieving suppression-list entries from {} {} to {}", timeRange, config.timezone(), file);
        } else {
            LOGGER.info("Retrieving suppression-list entries (any time-range) to {}", file);
        }
        LOGGER.info("Properties: {}", config.properties());

        final Stopwatch sw = Stopwatch.createStarted();
        SuppressionListRetriever retriever = new SuppressionListRetriever(createApi(), createSessions(1).session(0), config.batchSize());
        RetrieveResult result;
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             SuppressionCsvWriter sink = new SuppressionCsvWriter(out, config.properties())) {
            result = retriever.retrieve(timeRange, sink);
        }
        sw.stop();
        LOGGER.info("Retrieved {} entries in {} pages in {} seconds", result.rows(), result.pages(), sw.elapsed(TimeUnit.SECONDS));
        return result;
    }

    private SuppressionListApi createApi() {
        return new SuppressionListApi(config, new RateLimitedWebClient(sleeper, metrics));
    }

    private SessionPool createSessions(int size) {
        return new SessionPool(size, Duration.ofSeconds(config.requestTimeoutSeconds()));
    }
}
