package com.polyexplorer.app;

import com.polyexplorer.analysis.MarketAnalyzer;
import com.polyexplorer.analysis.PositionAnalyzer;
import com.polyexplorer.config.Config;
import com.polyexplorer.core.error.AnalysisFailure;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.data.http.HttpClientEx;
import com.polyexplorer.model.Market;
import com.polyexplorer.model.MarketGroup;
import com.polyexplorer.model.MarketSummary;
import com.polyexplorer.model.Position;
import com.polyexplorer.model.PositionExposure;
import com.polyexplorer.output.MarketReportPrinter;
import com.polyexplorer.polymarket.PolymarketService;
import com.polyexplorer.positions.PositionFileReader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point. Loads one Polymarket event group, analyzes its markets and prints a
 * console report; any pipeline failure is presented by {@link FailureReporter}.
 *
 * <p>Exit codes: 0 on success, 1 on a pipeline failure, 2 on a usage error.</p>
 */
public class PolyExplorerApplication {
    private static final Logger LOG = LogManager.getLogger(PolyExplorerApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDir;
    private final Clock clock;
    private final FailureReporter reporter = new FailureReporter();

    /**
     * Application bound to the process streams, the current directory and the system clock.
     */
    public PolyExplorerApplication() {
        this(System.out, System.err, Path.of(".").toAbsolutePath().normalize(), Clock.systemUTC());
    }

    PolyExplorerApplication(PrintStream out, PrintStream err, Path workingDir, Clock clock) {
        this.out = out;
        this.err = err;
        this.workingDir = workingDir;
        this.clock = clock;
    }

    public static void main(String[] args) {
        int exit = new PolyExplorerApplication().run(args);
        System.exit(exit);
    }

    /**
     * Parses {@code args} and runs the exploration.
     *
     * @param args command-line arguments
     * @return process exit code
     */
    public int run(String[] args) {
        Options options = buildOptions();
        if (containsHelp(args)) {
            printHelp(options);
            return EXIT_OK;
        }

        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            printHelp(options);
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        String groupSlug = cmd.getOptionValue("market-slug", "").trim();
        if (groupSlug.isEmpty()) {
            err.println("ERROR: --market-slug must not be blank.");
            return EXIT_USAGE;
        }

        Config config = Config.load(workingDir);
        try {
            explore(cmd, config, groupSlug);
            return EXIT_OK;
        } catch (PipelineException e) {
            LOG.debug("pipeline failed at stage {}", e.stage(), e);
            return reporter.present(e, err);
        }
    }

    /**
     * Loads the group, picks the explicit market or every open one, and prints each section.
     * Exposure is added when positions exist for the market or the market was named explicitly.
     */
    private void explore(CommandLine cmd, Config config, String groupSlug) {
        HttpClientEx http = new HttpClientEx(config);
        PolymarketService service = new PolymarketService(config, http);
        MarketAnalyzer marketAnalyzer = new MarketAnalyzer(config, clock);
        PositionAnalyzer positionAnalyzer = new PositionAnalyzer();
        MarketReportPrinter printer = new MarketReportPrinter(out);

        MarketGroup group = service.loadGroup(groupSlug);

        String marketSlug = cmd.getOptionValue("market", "").trim();
        boolean explicitMarket = !marketSlug.isEmpty();
        List<Market> markets = new ArrayList<>();
        if (explicitMarket) {
            markets.add(service.findMarket(group, marketSlug));
        } else {
            for (Market market : group.getMarkets()) {
                if (market.isActive() && !market.isClosed()) {
                    markets.add(market);
                }
            }
            if (markets.isEmpty()) {
                throw new PipelineException(new AnalysisFailure.InsufficientData(
                        "market group", "no active markets in '" + group.getSlug() + "'"));
            }
        }

        Path positionsPath = resolvePositionsPath(cmd, config);
        List<Position> positions = null;
        if (positionsPath != null) {
            positions = new PositionFileReader(http).read(positionsPath);
        }

        printer.printGroup(group);
        for (Market market : markets) {
            MarketSummary summary = marketAnalyzer.summarize(market);
            PositionExposure exposure = null;
            // with an explicit market a missing position set is an error, otherwise such markets are skipped
            if (positions != null && (explicitMarket || positionAnalyzer.hasPositions(market, positions))) {
                exposure = positionAnalyzer.exposure(market, positions);
            }
            printer.printMarket(market, summary, exposure);
        }
        LOG.info("reported {} markets of group {}", markets.size(), group.getSlug());
    }

    // -p wins over positions.path; both resolve against the working directory
    private Path resolvePositionsPath(CommandLine cmd, Config config) {
        String raw = cmd.getOptionValue("positions", "").trim();
        if (!raw.isEmpty()) {
            return workingDir.resolve(raw).normalize();
        }
        return config.getPath("positions.path");
    }

    private static boolean containsHelp(String[] args) {
        if (args == null) {
            return false;
        }
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private void printHelp(Options options) {
        PrintWriter writer = new PrintWriter(out);
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(writer, formatter.getWidth(), "polyexplorer", null, options,
                formatter.getLeftPadding(), formatter.getDescPadding(), null, true);
        writer.flush();
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("s").longOpt("market-slug").hasArg().argName("slug").required()
                .desc("slug of the Polymarket event (market group) to explore").build());
        options.addOption(Option.builder("m").longOpt("market").hasArg().argName("slug")
                .desc("analyze only this market of the group").build());
        options.addOption(Option.builder("p").longOpt("positions").hasArg().argName("csv")
                .desc("CSV file of trader positions to aggregate").build());
        options.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        return options;
    }
}
