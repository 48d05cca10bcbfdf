package io.backfillkit.policy;

import io.backfillkit.config.BackfillSettings;
import io.backfillkit.error.BackfillPolicyException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.model.BackfillPlan;
import io.backfillkit.model.BackfillRun;
import io.backfillkit.model.RunStatus;
import io.backfillkit.model.StoreEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Preconditions checked before planning or running. A violation is either rejected with its own
 * {@link ErrorKind} or, when the caller passed the matching force flag, allowed and reported back
 * as overridden so it can be recorded.
 */
public final class PolicyGuard {
    private static final Logger LOG = LoggerFactory.getLogger(PolicyGuard.class);

    private final BackfillSettings.Policy policy;

    public PolicyGuard(BackfillSettings.Policy policy) {
        this.policy = policy;
    }

    public void checkExplicitWindow(boolean fromGiven, boolean toGiven) {
        if (policy.requireExplicitWindow() && (!fromGiven || !toGiven)) {
            throw new BackfillPolicyException(ErrorKind.EXPLICIT_WINDOW_REQUIRED,
                    "Both --from and --to are required (policy.requireExplicitWindow=true).");
        }
    }

    public void checkDryRun(BackfillPlan candidate, BackfillPlan stored) {
        if (!policy.requireDryRunBeforeRun()) {
            return;
        }
        if (stored == null || !stored.equals(candidate)) {
            throw new BackfillPolicyException(ErrorKind.DRY_RUN_REQUIRED,
                    "Plan " + candidate.planId() + " has not been created yet. Run `plan` with the same options first "
                            + "(policy.requireDryRunBeforeRun=true).");
        }
    }

    /**
     * @return true when another active run on the same target was ignored because of {@code force}
     */
    public boolean checkNoOverlap(BackfillPlan plan, List<BackfillRun> runs, boolean force) {
        List<String> overlapping = runs.stream()
                .filter(r -> r.status().isActive())
                .filter(r -> !r.planId().equals(plan.planId()))
                .filter(r -> plan.target().equals(r.target()))
                .map(BackfillRun::planId)
                .toList();
        if (overlapping.isEmpty() || !policy.blockOverlappingRuns()) {
            return false;
        }
        if (force) {
            LOG.warn("Ignoring active runs {} on {} because --force-overlap was given", overlapping, plan.target());
            return true;
        }
        throw new BackfillPolicyException(ErrorKind.OVERLAPPING_RUN,
                "Target " + plan.target() + " already has an active run (plan " + String.join(", ", overlapping)
                        + "). Finish or cancel it, or pass --force-overlap.");
    }

    public boolean checkCompatibility(BackfillRun existing, String expectedToken, boolean force) {
        if (existing == null || existing.compatibilityToken() == null
                || existing.compatibilityToken().equals(expectedToken)) {
            return false;
        }
        if (force) {
            LOG.warn("Run checkpoint for plan {} was written with different options; continuing because --force-compatibility was given",
                    existing.planId());
            return true;
        }
        throw new BackfillPolicyException(ErrorKind.COMPATIBILITY_MISMATCH,
                "Run checkpoint for plan " + existing.planId() + " was created with different runtime options. "
                        + "Restore the original settings or pass --force-compatibility.");
    }

    public boolean checkEnvironment(BackfillPlan plan, StoreEnvironment active, boolean force) {
        StoreEnvironment planned = plan.environment();
        if (planned == null || planned.sameAs(active)) {
            return false;
        }
        if (force) {
            LOG.warn("Plan {} was created for {} / {} but runs against {}; continuing because --force-environment was given",
                    plan.planId(), planned.url(), planned.database(), active == null ? "no configured store" : active.url());
            return true;
        }
        String current = active == null ? "no configured store" : active.url() + " / " + active.database();
        throw new BackfillPolicyException(ErrorKind.ENVIRONMENT_MISMATCH,
                "Plan " + plan.planId() + " was created for " + planned.url() + " / " + planned.database()
                        + " but the current store is " + current + ". Pass --force-environment to run it here.");
    }

    public void checkNotCancelled(BackfillRun run) {
        if (run != null && run.status() == RunStatus.CANCELLED) {
            throw new BackfillPolicyException(ErrorKind.RUN_CANCELLED,
                    "Run for plan " + run.planId() + " is cancelled. Create a new plan or inspect it with `doctor`.");
        }
    }

    public void checkCancellable(BackfillRun run) {
        if (run.status() == RunStatus.COMPLETED) {
            throw new BackfillPolicyException(ErrorKind.RUN_ALREADY_COMPLETED,
                    "Run for plan " + run.planId() + " already completed; nothing to cancel.");
        }
    }
}
