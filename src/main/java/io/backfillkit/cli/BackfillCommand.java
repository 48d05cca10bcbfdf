package io.backfillkit.cli;

import io.backfillkit.client.HttpStoreClient;
import io.backfillkit.client.StoreClient;
import io.backfillkit.config.BackfillConfig;
import io.backfillkit.config.BackfillSettings;
import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.BackfillException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.error.StoreException;
import io.backfillkit.model.RunStatus;
import io.backfillkit.model.TargetDescriptor;
import io.backfillkit.runtime.BackfillRuntime;
import io.backfillkit.schema.SchemaCatalog;
import io.backfillkit.schema.SystemTablesCatalogSource;
import io.backfillkit.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
        name = "backfill",
        mixinStandardHelpOptions = true,
        description = "Chunked, checkpointed and resumable backfills for analytical store tables",
        subcommands = {
                BackfillCommand.PlanCommand.class,
                BackfillCommand.RunCommand.class,
                BackfillCommand.ResumeCommand.class,
                BackfillCommand.StatusCommand.class,
                BackfillCommand.CancelCommand.class,
                BackfillCommand.DoctorCommand.class,
                BackfillCommand.CheckCommand.class
        }
)
public final class BackfillCommand implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(BackfillCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "State root holding plans, runs and events", defaultValue = BackfillConfig.DEFAULT_STATE_ROOT)
    String root;

    @Option(names = {"--config"}, description = "Settings file (default: <root>/" + BackfillConfig.SETTINGS_FILE_NAME + ")")
    String configFile;

    @Option(names = {"--schema"}, description = "Schema catalog JSON file with tables and materialized views")
    String schemaFile;

    @Option(names = {"--store-url"}, description = "Store HTTP endpoint, e.g. http://localhost:8123")
    String storeUrl;

    @Option(names = {"--store-database"}, description = "Default database for statements")
    String storeDatabase;

    @Option(names = {"--store-user"}, description = "Store user")
    String storeUser;

    @Option(names = {"--store-password"}, description = "Store password")
    String storePassword;

    private final Function<BackfillSettings.Store, StoreClient> storeClientFactory;

    public BackfillCommand() {
        this(HttpStoreClient::new);
    }

    BackfillCommand(Function<BackfillSettings.Store, StoreClient> storeClientFactory) {
        this.storeClientFactory = storeClientFactory;
    }

    @Override
    public void run() {
        out().println("Use subcommands: plan | run | resume | status | cancel | doctor | check");
        out().flush();
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    BackfillSettings settings(Double chunkHours) {
        BackfillConfig config = BackfillConfig.fromRoot(root);
        Path settingsFile = configFile == null || configFile.isBlank()
                ? config.settingsFile()
                : Path.of(configFile);
        BackfillSettings settings = BackfillSettings.load(settingsFile)
                .mergeOverrides(new BackfillSettings.Overrides(chunkHours, storeUrl, storeDatabase, storeUser, storePassword))
                .validate();
        LOG.debug("Effective settings: {}", settings);
        return settings;
    }

    BackfillRuntime runtime(BackfillSettings settings) {
        BackfillRuntime runtime = new BackfillRuntime(BackfillConfig.fromRoot(root), settings);
        runtime.init();
        return runtime;
    }

    StoreClient storeClient(BackfillSettings settings) {
        return storeClientFactory.apply(settings.store());
    }

    /**
     * Schema file when given, else introspection of the configured store, else nothing: planning
     * then relies on an explicit or configured time column.
     */
    SchemaCatalog catalog(BackfillSettings settings, String target) throws StoreException {
        if (schemaFile != null && !schemaFile.isBlank()) {
            return SchemaCatalog.fromFile(Path.of(schemaFile));
        }
        if (settings.store().url() != null) {
            String database = TargetDescriptor.parse(target).database();
            return new SystemTablesCatalogSource(storeClient(settings)).load(database);
        }
        LOG.info("No schema file or store configured; time column auto-detection is unavailable");
        return SchemaCatalog.empty();
    }

    int execute(String command, Callable<Integer> action) {
        try {
            return action.call();
        } catch (BackfillException e) {
            LOG.debug("{} failed", command, e);
            printError(command, e.category().label(), e.kind().code(), e.getMessage());
            return e.exitCode();
        } catch (StoreException e) {
            LOG.debug("{} failed", command, e);
            printError(command, "store", "store_error", e.getMessage());
            return 1;
        } catch (Exception e) {
            LOG.error("{} failed unexpectedly", command, e);
            printError(command, "runtime", "unexpected", e.getMessage() == null ? e.getClass().getName() : e.getMessage());
            return 1;
        }
    }

    void print(Object outcome) {
        out().println(Jsons.toJson(outcome));
        out().flush();
    }

    private void printError(String command, String category, String kind, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("ok", false);
        error.put("command", command);
        error.put("category", category);
        error.put("kind", kind);
        error.put("error", message);
        print(error);
    }

    static int runExitCode(BackfillRuntime.RunOutcome outcome) {
        return RunStatus.COMPLETED.wireName().equals(outcome.status()) ? 0 : 1;
    }

    @Command(name = "plan", description = "Build and persist a deterministic chunk plan (dry run; nothing is executed)")
    static final class PlanCommand implements Callable<Integer> {
        @ParentCommand
        BackfillCommand parent;

        @Option(names = {"--target"}, required = true, description = "Target table as database.table")
        String target;

        @Option(names = {"--from"}, description = "Window start (inclusive), ISO-8601 UTC")
        String from;

        @Option(names = {"--to"}, description = "Window end (exclusive), ISO-8601 UTC")
        String to;

        @Option(names = {"--chunk-hours"}, description = "Chunk size in hours")
        Double chunkHours;

        @Option(names = {"--time-column"}, description = "Column used for window filtering")
        String timeColumn;

        @Option(names = {"--force-large-window"}, description = "Allow windows above limits.maxWindowHours")
        boolean forceLargeWindow;

        @Option(names = {"--force"}, description = "Overwrite a conflicting plan with the same id")
        boolean force;

        @Override
        public Integer call() {
            return parent.execute("plan", () -> {
                BackfillSettings settings = parent.settings(chunkHours);
                BackfillRuntime runtime = parent.runtime(settings);
                BackfillRuntime.PlanOutcome outcome = runtime.plan(
                        new BackfillRuntime.PlanInput(target, from, to, chunkHours, timeColumn, forceLargeWindow, force),
                        parent.catalog(settings, target)
                );
                parent.print(outcome);
                return 0;
            });
        }
    }

    @Command(name = "run", description = "Execute a plan's pending chunks")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        BackfillCommand parent;

        @Option(names = {"--plan-id"}, description = "Plan to execute")
        String planId;

        @Option(names = {"--target"}, description = "Build the plan inline instead of --plan-id")
        String target;

        @Option(names = {"--from"}, description = "Inline plan window start")
        String from;

        @Option(names = {"--to"}, description = "Inline plan window end")
        String to;

        @Option(names = {"--chunk-hours"}, description = "Inline plan chunk size in hours")
        Double chunkHours;

        @Option(names = {"--time-column"}, description = "Inline plan time column")
        String timeColumn;

        @Option(names = {"--force-large-window"}, description = "Allow inline windows above limits.maxWindowHours")
        boolean forceLargeWindow;

        @Option(names = {"--replay-done"}, description = "Re-execute chunks that already succeeded")
        boolean replayDone;

        @Option(names = {"--replay-failed"}, description = "Re-execute chunks that exhausted their retries")
        boolean replayFailed;

        @Option(names = {"--force-overlap"}, description = "Run even if another run on the target is active")
        boolean forceOverlap;

        @Option(names = {"--force-compatibility"}, description = "Run even if the checkpoint was written with other options")
        boolean forceCompatibility;

        @Option(names = {"--force-environment"}, description = "Run against a store other than the one the plan was made for")
        boolean forceEnvironment;

        @Override
        public Integer call() {
            return parent.execute("run", () -> {
                BackfillSettings settings = parent.settings(chunkHours);
                BackfillRuntime runtime = parent.runtime(settings);
                BackfillRuntime.RunInput input = new BackfillRuntime.RunInput(
                        planId, replayDone, replayFailed, forceOverlap, forceCompatibility, forceEnvironment);
                BackfillRuntime.RunOutcome outcome;
                if (planId != null && !planId.isBlank()) {
                    outcome = runtime.run(input, parent.storeClient(settings));
                } else if (target != null && !target.isBlank()) {
                    outcome = runtime.runInline(
                            new BackfillRuntime.PlanInput(target, from, to, chunkHours, timeColumn, forceLargeWindow, false),
                            input,
                            parent.catalog(settings, target),
                            parent.storeClient(settings)
                    );
                } else {
                    throw new BackfillConfigException(ErrorKind.INVALID_OPTION,
                            "run needs --plan-id, or --target with --from/--to.");
                }
                parent.print(outcome);
                return runExitCode(outcome);
            });
        }
    }

    @Command(name = "resume", description = "Continue a run from its checkpoint, retrying failed chunks")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        BackfillCommand parent;

        @Option(names = {"--plan-id"}, required = true, description = "Plan to resume")
        String planId;

        @Option(names = {"--force-overlap"}, description = "Resume even if another run on the target is active")
        boolean forceOverlap;

        @Option(names = {"--force-compatibility"}, description = "Resume even if the checkpoint was written with other options")
        boolean forceCompatibility;

        @Option(names = {"--force-environment"}, description = "Resume against a store other than the one the plan was made for")
        boolean forceEnvironment;

        @Override
        public Integer call() {
            return parent.execute("resume", () -> {
                BackfillSettings settings = parent.settings(null);
                BackfillRuntime runtime = parent.runtime(settings);
                BackfillRuntime.RunOutcome outcome = runtime.resume(
                        new BackfillRuntime.RunInput(planId, false, true, forceOverlap, forceCompatibility, forceEnvironment),
                        parent.storeClient(settings)
                );
                parent.print(outcome);
                return runExitCode(outcome);
            });
        }
    }

    @Command(name = "status", description = "Show run and chunk states of a plan")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        BackfillCommand parent;

        @Option(names = {"--plan-id"}, required = true, description = "Plan id")
        String planId;

        @Override
        public Integer call() {
            return parent.execute("status", () -> {
                BackfillRuntime runtime = parent.runtime(parent.settings(null));
                parent.print(runtime.status(planId));
                return 0;
            });
        }
    }

    @Command(name = "cancel", description = "Stop a run at its next chunk boundary")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        BackfillCommand parent;

        @Option(names = {"--plan-id"}, required = true, description = "Plan id")
        String planId;

        @Override
        public Integer call() {
            return parent.execute("cancel", () -> {
                BackfillRuntime runtime = parent.runtime(parent.settings(null));
                parent.print(runtime.cancel(planId));
                return 0;
            });
        }
    }

    @Command(name = "doctor", description = "Diagnose a plan's run and suggest follow-up commands")
    static final class DoctorCommand implements Callable<Integer> {
        @ParentCommand
        BackfillCommand parent;

        @Option(names = {"--plan-id"}, required = true, description = "Plan id")
        String planId;

        @Override
        public Integer call() {
            return parent.execute("doctor", () -> {
                BackfillRuntime runtime = parent.runtime(parent.settings(null));
                parent.print(runtime.doctor(planId));
                return 0;
            });
        }
    }

    @Command(name = "check", description = "CI hook: report pending or failed backfills across all plans")
    static final class CheckCommand implements Callable<Integer> {
        @ParentCommand
        BackfillCommand parent;

        @Override
        public Integer call() {
            return parent.execute("check", () -> {
                BackfillRuntime runtime = parent.runtime(parent.settings(null));
                BackfillRuntime.CheckOutcome outcome = runtime.check();
                parent.print(outcome);
                return outcome.ok() ? 0 : 1;
            });
        }
    }
}
