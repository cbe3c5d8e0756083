package tether.core;

import tether.core.config.AdapterConfig;
import tether.core.config.AdapterContext;
import tether.core.discovery.TestDiscoverer;
import tether.core.execution.TestExecutor;
import tether.core.host.LocalMachineIdentity;
import tether.core.log.LoggerTestLog;
import tether.core.sink.JsonLinesReporter;
import tether.core.util.Logger;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * The command-line entry point. Discovers or runs the tests of the given assemblies and writes the report, one JSON
 * object per line, to stdout.
 */
public final class EntryPoint {
    private static final Logger LOGGER = Logger.forClass(EntryPoint.class);
    private static final String DISCOVER = "discover";
    private static final String RUN = "run";

    /**
     * We expect to be given the following arguments:
     *
     * args[0] = MODE
     * args[1..K] = each of the K assemblies
     *
     * The MODE is either "discover", to report the test cases of the assemblies, or "run", to run them and report
     * their results. Each assembly is a directory of compiled .class files or a .jar file. The settings of the
     * session are read from the system properties, see {@link AdapterConfig#fromProperties(java.util.Properties)}.
     *
     * @param args The program arguments.
     */
    public static void main(String[] args) {
        if (args == null || args.length < 2 || !(DISCOVER.equals(args[0]) || RUN.equals(args[0]))) {
            System.err.println(usage());
            System.exit(1);
        }

        AdapterConfig config;
        try {
            config = AdapterConfig.fromSystemProperties();
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(usage());
            System.exit(1);
            return;
        }
        if (!config.enableLogger) {
            Logger.globalDisable();
        }
        LOGGER.log("Configuration: " + config);

        AdapterContext context = AdapterContext.of(config, LoggerTestLog.forClass(EntryPoint.class), new LocalMachineIdentity());
        List<String> sources = Arrays.asList(args).subList(1, args.length);

        // Tests may replace System.out while they run, so the report holds on to the stream we start with.
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        JsonLinesReporter reporter = JsonLinesReporter.writingTo(writer);

        int status = 0;
        if (DISCOVER.equals(args[0])) {
            TestDiscoverer.withContext(context).discoverTests(sources, reporter);
        } else if (TestExecutor.withContext(context).runTests(sources, reporter) == 0) {
            status = 2;
        }

        writer.flush();
        LOGGER.log("Exiting.");
        System.exit(status);
    }

    private static String usage() {
        return EntryPoint.class.getName()
                + " <discover|run> <assembly> [[assembly]...]"
                + "\n\tdiscover: report the test cases of the assemblies."
                + "\n\trun: run the test cases of the assemblies and report their results."
                + "\n\tassembly: a path to a directory of .class files or to a .jar file."
                + "\n\tsystem properties: executor_uri, matcher, source_roots, interactive_host, enable_logger.";
    }
}
