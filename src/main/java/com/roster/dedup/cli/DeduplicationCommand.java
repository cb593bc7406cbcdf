package com.roster.dedup.cli;

import com.roster.dedup.api.DeduplicationCoordinator;
import com.roster.dedup.api.DeduplicationOptions;
import com.roster.dedup.api.DeduplicationReport;
import com.roster.dedup.pass.PassResult;
import com.roster.dedup.plan.CancellationToken;
import com.roster.dedup.plan.ExecutionResult;
import com.roster.dedup.plan.JsonPlanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 *
 * <pre>
 *   java -cp app.jar com.roster.dedup.cli.DeduplicationCommand dry-run
 *   java -cp app.jar com.roster.dedup.cli.DeduplicationCommand apply
 *   java -cp app.jar com.roster.dedup.cli.DeduplicationCommand execute-plan data/dedup-plan.json --batch 100
 *   java -cp app.jar com.roster.dedup.cli.DeduplicationCommand dedup-connections
 *   java -cp app.jar com.roster.dedup.cli.DeduplicationCommand recount
 * </pre>
 *
 * <p>The graph is selected with the {@code falkordb.host}, {@code falkordb.port} and
 * {@code falkordb.graph} system properties, falling back to the {@code FALKORDB_HOST},
 * {@code FALKORDB_PORT} and {@code FALKORDB_GRAPH} environment variables. The protected roster
 * is read from {@code entity-dedup.protected-names-path} / {@code DEDUP_PROTECTED_NAMES}.</p>
 */
public final class DeduplicationCommand {
    private static final Logger log = LoggerFactory.getLogger(DeduplicationCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CANCELLED = 130;

    static final String USAGE = "Usage: DeduplicationCommand "
            + "dry-run | apply | execute-plan <path> [--batch N] | dedup-connections | recount";

    private DeduplicationCommand() {
    }

    /**
     * Sub-commands accepted on the command line.
     */
    enum Command {
        DRY_RUN("dry-run"),
        APPLY("apply"),
        EXECUTE_PLAN("execute-plan"),
        DEDUP_CONNECTIONS("dedup-connections"),
        RECOUNT("recount");

        private final String token;

        Command(String token) {
            this.token = token;
        }

        static Command fromToken(String token) {
            return Arrays.stream(values())
                    .filter(c -> c.token.equalsIgnoreCase(token))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown command: " + token));
        }
    }

    /**
     * Parsed command line.
     *
     * @param planPath  plan file for {@code execute-plan}, null otherwise
     * @param batchSize batch size for {@code execute-plan}; 0 disables batching
     */
    record Invocation(Command command, Path planPath, int batchSize) {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Invocation invocation;
        try {
            invocation = parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        CancellationToken cancellation = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = shutdownHook(cancellation, finished);
        Runtime.getRuntime().addShutdownHook(hook);

        try (DeduplicationCoordinator coordinator = DeduplicationCoordinator.builder()
                .falkorDB(setting("falkordb.host", "FALKORDB_HOST", "localhost"),
                        Integer.parseInt(setting("falkordb.port", "FALKORDB_PORT", "6379")),
                        setting("falkordb.graph", "FALKORDB_GRAPH", "roster"))
                .options(options())
                .build()) {
            return dispatch(coordinator, invocation, cancellation, out);
        } catch (RuntimeException e) {
            log.error("dedup.command.failed command={} error={}", invocation.command().token, e.getMessage(), e);
            err.println("Failed: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    /**
     * Hook that requests cancellation and then holds the JVM until {@code finished} is counted
     * down, which {@link #run} does once the coordinator is closed and the plan saved.
     */
    static Thread shutdownHook(CancellationToken cancellation, CountDownLatch finished) {
        return new Thread(() -> {
            log.info("dedup.shutdown.requested - finishing the current action");
            cancellation.cancel();
            try {
                finished.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("dedup.shutdown.interrupted before the run finished");
            }
        }, "dedup-shutdown");
    }

    static int dispatch(DeduplicationCoordinator coordinator, Invocation invocation,
                        CancellationToken cancellation, PrintStream out) {
        switch (invocation.command()) {
            case DRY_RUN:
            case APPLY: {
                DeduplicationReport report = invocation.command() == Command.DRY_RUN
                        ? coordinator.dryRun() : coordinator.apply();
                printReport(report, out);
                report.plan().ifPresent(plan -> out.println("Plan written to "
                        + coordinator.getPlanStore().location() + " (" + plan.getActions().size() + " actions)"));
                return EXIT_OK;
            }
            case EXECUTE_PLAN: {
                ExecutionResult result = coordinator.executePlan(new JsonPlanStore(invocation.planPath()),
                        invocation.batchSize(), cancellation);
                out.println(result);
                if (result.cancelled()) {
                    return EXIT_CANCELLED;
                }
                return result.failed() > 0 ? EXIT_FAILURE : EXIT_OK;
            }
            case DEDUP_CONNECTIONS:
                out.println("Removed " + coordinator.dedupConnections() + " connections");
                return EXIT_OK;
            case RECOUNT:
                out.println("Updated counts of " + coordinator.recount() + " persons");
                return EXIT_OK;
            default:
                throw new IllegalStateException("Unhandled command: " + invocation.command());
        }
    }

    /**
     * Parses the command line.
     *
     * @throws IllegalArgumentException on an unknown command, a missing plan path or a bad batch size
     */
    static Invocation parse(String[] args) {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException("No command given.");
        }
        Command command = Command.fromToken(args[0]);
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        if (command != Command.EXECUTE_PLAN) {
            if (!rest.isEmpty()) {
                throw new IllegalArgumentException("Unexpected arguments: " + rest);
            }
            return new Invocation(command, null, 0);
        }

        Path planPath = null;
        int batchSize = 0;
        for (int i = 0; i < rest.size(); i++) {
            String arg = rest.get(i);
            if ("--batch".equals(arg)) {
                if (i + 1 >= rest.size()) {
                    throw new IllegalArgumentException("--batch requires a value");
                }
                batchSize = parseBatch(rest.get(++i));
            } else if (arg.startsWith("--batch=")) {
                batchSize = parseBatch(arg.substring("--batch=".length()));
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            } else if (planPath == null) {
                planPath = Path.of(arg);
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
        }
        if (planPath == null) {
            throw new IllegalArgumentException("execute-plan requires a plan path");
        }
        return new Invocation(command, planPath, batchSize);
    }

    private static int parseBatch(String value) {
        int batch;
        try {
            batch = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid batch size: " + value, e);
        }
        if (batch < 0) {
            throw new IllegalArgumentException("Batch size must be >= 0: " + value);
        }
        return batch;
    }

    static void printReport(DeduplicationReport report, PrintStream out) {
        out.printf("%s run %s: %d -> %d persons%n", report.mode().command(), report.runId(),
                report.personCountBefore(), report.personCountAfter());
        for (PassResult pass : report.passes()) {
            out.printf("  pass %d %-28s changes=%d persons=%d ambiguous=%d failures=%d%n",
                    pass.pass(), pass.name(), pass.changes(), pass.persons(), pass.ambiguous(), pass.failures());
        }
        if (report.selfLoopsRemoved() > 0) {
            out.println("  self-loops removed: " + report.selfLoopsRemoved());
        }
    }

    private static DeduplicationOptions options() {
        DeduplicationOptions.Builder builder = DeduplicationOptions.builder();
        String protectedNames = setting("entity-dedup.protected-names-path", "DEDUP_PROTECTED_NAMES", null);
        if (protectedNames != null) {
            builder.protectedNamesPath(Path.of(protectedNames));
        }
        String planPath = setting("entity-dedup.plan-path", "DEDUP_PLAN_PATH", null);
        if (planPath != null) {
            builder.planPath(Path.of(planPath));
        }
        return builder.build();
    }

    private static String setting(String property, String env, String fallback) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(env);
        }
        return value == null || value.isBlank() ? fallback : value;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress, hook stays registered");
        }
    }
}
