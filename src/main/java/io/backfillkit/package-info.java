/**
 * backfillkit source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.backfillkit.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.backfillkit.cli.BackfillCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.backfillkit.runtime.BackfillRuntime} applies policies and drives plan, run, resume and diagnostics.</li>
 *   <li>{@code io.backfillkit.storage.CheckpointStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.backfillkit;
