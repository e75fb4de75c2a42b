package com.llmorch.orchestrator.config;

import com.llmorch.core.util.Durations;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.time.Duration;

/**
 * Parses command-line flags on top of an environment-derived configuration.
 */
public class CommandLineOptions {

    public static final String HELP_OPTION = "help";
    public static final String KUBECONFIG_OPTION = "kubeconfig";
    public static final String NAMESPACE_OPTION = "namespace";
    public static final String METRICS_PORT_OPTION = "metrics-port";
    public static final String HEALTH_PORT_OPTION = "health-port";
    public static final String LEADER_ELECTION_OPTION = "leader-election";
    public static final String LEADER_LOCK_NAME_OPTION = "leader-lock-name";
    public static final String RECONCILE_INTERVAL_OPTION = "reconcile-interval";
    public static final String MAX_CONCURRENT_OPTION = "max-concurrent-reconciles";
    public static final String IDENTITY_OPTION = "identity";
    public static final String MODEL_CATALOG_OPTION = "model-catalog";
    public static final String REGISTRY_URL_OPTION = "registry-url";
    public static final String PROMETHEUS_URL_OPTION = "prometheus-url";

    private final Options options = createOptions();

    private static Options createOptions() {
        Options options = new Options();

        options.addOption(Option.builder("h")
                .longOpt(HELP_OPTION)
                .hasArg(false)
                .desc("Show this syntax page.")
                .build());

        options.addOption(Option.builder()
                .longOpt(KUBECONFIG_OPTION)
                .hasArg(true)
                .argName("path")
                .desc("Path to a kubeconfig file (empty for in-cluster credentials).")
                .build());

        options.addOption(Option.builder()
                .longOpt(NAMESPACE_OPTION)
                .hasArg(true)
                .argName("name")
                .desc("Namespace to watch (empty for all namespaces).")
                .build());

        options.addOption(Option.builder()
                .longOpt(METRICS_PORT_OPTION)
                .hasArg(true)
                .argName("port")
                .desc("Port of the metrics endpoint (default 8080).")
                .build());

        options.addOption(Option.builder()
                .longOpt(HEALTH_PORT_OPTION)
                .hasArg(true)
                .argName("port")
                .desc("Port of the health endpoint (default 8081).")
                .build());

        options.addOption(Option.builder()
                .longOpt(LEADER_ELECTION_OPTION)
                .hasArg(true)
                .argName("bool")
                .desc("Run leader election; only the leader reconciles (default true).")
                .build());

        options.addOption(Option.builder()
                .longOpt(LEADER_LOCK_NAME_OPTION)
                .hasArg(true)
                .argName("name")
                .desc("Name of the leader lease (default llm-orchestrator-leader).")
                .build());

        options.addOption(Option.builder()
                .longOpt(RECONCILE_INTERVAL_OPTION)
                .hasArg(true)
                .argName("duration")
                .desc("Periodic resync interval, e.g. 30s or PT30S (default 30s).")
                .build());

        options.addOption(Option.builder()
                .longOpt(MAX_CONCURRENT_OPTION)
                .hasArg(true)
                .argName("count")
                .desc("Workloads reconciled in parallel (default 4).")
                .build());

        options.addOption(Option.builder()
                .longOpt(IDENTITY_OPTION)
                .hasArg(true)
                .argName("id")
                .desc("Leader-election identity (default $POD_NAME or the hostname).")
                .build());

        options.addOption(Option.builder()
                .longOpt(MODEL_CATALOG_OPTION)
                .hasArg(true)
                .argName("path")
                .desc("YAML model catalogue used as the model registry.")
                .build());

        options.addOption(Option.builder()
                .longOpt(REGISTRY_URL_OPTION)
                .hasArg(true)
                .argName("url")
                .desc("Base URL of an HTTP model registry; takes precedence over --model-catalog.")
                .build());

        options.addOption(Option.builder()
                .longOpt(PROMETHEUS_URL_OPTION)
                .hasArg(true)
                .argName("url")
                .desc("Prometheus base URL for request-rate, latency and queue-length metrics.")
                .build());

        return options;
    }

    public void printHelp(PrintWriter out) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(out, 100,
                "llm-orchestrator [options]",
                "Deploys, places, scales and monitors LLM inference workloads.",
                options, 2, 4,
                "Exit codes: 0 clean shutdown, 1 configuration error, 2 platform API unreachable.",
                false);
        out.flush();
    }

    /**
     * Applies the flags in {@code args} over {@code base}.
     *
     * @throws IllegalArgumentException on unknown flags or malformed values
     */
    public OrchestratorConfig parseCommandLineArguments(String[] args, OrchestratorConfig base) throws IllegalArgumentException {
        CommandLine cl;
        try {
            CommandLineParser clp = new DefaultParser();
            cl = clp.parse(options, args);
        } catch (ParseException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        if (!cl.getArgList().isEmpty()) {
            throw new IllegalArgumentException("Unexpected arguments: " + cl.getArgList());
        }

        OrchestratorConfig.OrchestratorConfigBuilder builder = base.toBuilder();
        builder.help(cl.hasOption(HELP_OPTION));

        if (cl.hasOption(KUBECONFIG_OPTION)) {
            builder.kubeconfig(cl.getOptionValue(KUBECONFIG_OPTION));
        }
        if (cl.hasOption(NAMESPACE_OPTION)) {
            builder.namespace(cl.getOptionValue(NAMESPACE_OPTION));
            builder.leaderLockNamespace(cl.getOptionValue(NAMESPACE_OPTION).isBlank()
                    ? base.getLeaderLockNamespace() : cl.getOptionValue(NAMESPACE_OPTION));
        }
        if (cl.hasOption(METRICS_PORT_OPTION)) {
            builder.metricsPort(parseInt(cl, METRICS_PORT_OPTION));
        }
        if (cl.hasOption(HEALTH_PORT_OPTION)) {
            builder.healthPort(parseInt(cl, HEALTH_PORT_OPTION));
        }
        if (cl.hasOption(LEADER_ELECTION_OPTION)) {
            builder.leaderElection(parseBoolean(cl, LEADER_ELECTION_OPTION));
        }
        if (cl.hasOption(LEADER_LOCK_NAME_OPTION)) {
            builder.leaderLockName(cl.getOptionValue(LEADER_LOCK_NAME_OPTION));
        }
        if (cl.hasOption(RECONCILE_INTERVAL_OPTION)) {
            builder.reconcileInterval(parseDuration(cl, RECONCILE_INTERVAL_OPTION));
        }
        if (cl.hasOption(MAX_CONCURRENT_OPTION)) {
            builder.maxConcurrentReconciles(parseInt(cl, MAX_CONCURRENT_OPTION));
        }
        if (cl.hasOption(IDENTITY_OPTION)) {
            builder.identity(cl.getOptionValue(IDENTITY_OPTION));
        }
        if (cl.hasOption(MODEL_CATALOG_OPTION)) {
            builder.modelCatalog(cl.getOptionValue(MODEL_CATALOG_OPTION));
        }
        if (cl.hasOption(REGISTRY_URL_OPTION)) {
            builder.registryUrl(cl.getOptionValue(REGISTRY_URL_OPTION));
        }
        if (cl.hasOption(PROMETHEUS_URL_OPTION)) {
            builder.prometheusUrl(cl.getOptionValue(PROMETHEUS_URL_OPTION));
        }
        return builder.build();
    }

    private static int parseInt(CommandLine cl, String option) {
        String value = cl.getOptionValue(option);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for --" + option + ": " + value, e);
        }
    }

    private static boolean parseBoolean(CommandLine cl, String option) {
        String value = cl.getOptionValue(option).trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for --" + option + ": " + value);
    }

    private static Duration parseDuration(CommandLine cl, String option) {
        String value = cl.getOptionValue(option);
        return Durations.parse(value)
                .orElseThrow(() -> new IllegalArgumentException("Invalid value for --" + option + ": " + value));
    }
}
