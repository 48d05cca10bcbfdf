package io.backfillkit.config;

import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.ErrorKind;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

public final class BackfillConfig {
    public static final String DEFAULT_STATE_ROOT = ".backfill";
    public static final String SETTINGS_FILE_NAME = "backfill-settings.json";

    private static final Pattern PLAN_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Path rootDir;

    public BackfillConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static BackfillConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_STATE_ROOT)
                : Paths.get(root);
        return new BackfillConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path plansDir() {
        return rootDir.resolve("plans");
    }

    public Path runsDir() {
        return rootDir.resolve("runs");
    }

    public Path eventsDir() {
        return rootDir.resolve("events");
    }

    public Path planFile(String planId) {
        return plansDir().resolve(checkedPlanId(planId) + ".json");
    }

    public Path runFile(String planId) {
        return runsDir().resolve(checkedPlanId(planId) + ".json");
    }

    public Path cancelFile(String planId) {
        return runsDir().resolve(checkedPlanId(planId) + ".cancel");
    }

    public Path eventFile(String planId) {
        return eventsDir().resolve(checkedPlanId(planId) + ".ndjson");
    }

    static String checkedPlanId(String planId) {
        String value = planId == null ? "" : planId.trim();
        if (!PLAN_ID.matcher(value).matches()) {
            throw new BackfillConfigException(ErrorKind.PLAN_NOT_FOUND, "Invalid plan id: '" + planId + "'");
        }
        return value;
    }
}
