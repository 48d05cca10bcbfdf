package io.backfillkit.error;

/**
 * The request was well formed but unsafe under the active policy (overlapping run, no prior plan,
 * changed options, ...). Kept apart from {@link BackfillConfigException} so tooling can tell the two apart.
 */
public final class BackfillPolicyException extends BackfillException {
    public BackfillPolicyException(ErrorKind kind, String message) {
        super(BackfillConfigException.requireCategory(kind, ErrorCategory.POLICY), message);
    }
}
