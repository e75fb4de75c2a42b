package com.llmorch.orchestrator;

import com.llmorch.orchestrator.config.CommandLineOptions;
import com.llmorch.orchestrator.config.OrchestratorConfig;
import com.llmorch.orchestrator.error.PlatformTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;

public class OrchestratorApp {
    private static final Logger log = LoggerFactory.getLogger(OrchestratorApp.class);

    static final int EXIT_CONFIG_ERROR = 1;
    static final int EXIT_PLATFORM_UNREACHABLE = 2;

    public static void main(String[] args) {
        CommandLineOptions options = new CommandLineOptions();
        OrchestratorConfig config;
        try {
            config = options.parseCommandLineArguments(args, OrchestratorConfig.fromEnv());
            if (config.isHelp()) {
                options.printHelp(new PrintWriter(System.out, true, StandardCharsets.UTF_8));
                return;
            }
            config.validate();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            options.printHelp(new PrintWriter(System.err, true, StandardCharsets.UTF_8));
            System.exit(EXIT_CONFIG_ERROR);
            return;
        }

        log.info("Starting LLM orchestrator");
        log.info("  Namespace: {}", config.isAllNamespaces() ? "<all>" : config.getNamespace());
        log.info("  Leader Election: {} (lock {})", config.isLeaderElection(), config.getLeaderLockName());
        log.info("  Max concurrent reconciles: {}", config.getMaxConcurrentReconciles());

        Orchestrator orchestrator;
        try {
            orchestrator = new Orchestrator(config);
        } catch (IllegalArgumentException | UncheckedIOException e) {
            log.error("Fatal configuration error: {}", e.getMessage());
            System.exit(EXIT_CONFIG_ERROR);
            return;
        }

        try {
            orchestrator.start();
        } catch (PlatformTransientException e) {
            log.error("✗ Platform API unreachable at startup: {}", e.getMessage());
            orchestrator.stop();
            System.exit(EXIT_PLATFORM_UNREACHABLE);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        handleShutDown(orchestrator, stopped);
        log.info("LLM orchestrator is ready");

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void handleShutDown(Orchestrator orchestrator, CountDownLatch stopped) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            try {
                orchestrator.stop();
                log.info("Shutdown complete");
            } finally {
                stopped.countDown();
            }
        }, "orchestrator-shutdown"));
    }
}
