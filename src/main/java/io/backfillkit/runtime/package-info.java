/**
 * Runtime orchestration package.
 *
 * <p>{@link io.backfillkit.runtime.BackfillRuntime} is the facade the CLI talks to;
 * {@link io.backfillkit.runtime.ExecutionEngine} executes one plan chunk by chunk,
 * checkpointing every state change before moving on.
 */
package io.backfillkit.runtime;
