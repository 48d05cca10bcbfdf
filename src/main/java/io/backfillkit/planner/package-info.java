/**
 * Turns a target and a time window into a deterministic, chunked plan and renders the
 * per-chunk INSERT statements.
 */
package io.backfillkit.planner;
