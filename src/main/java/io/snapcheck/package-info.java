/**
 * snapcheck source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.snapcheck.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.snapcheck.coordinator.ReconcileCoordinator} serializes decisions across concurrent tests.</li>
 *   <li>{@code io.snapcheck.staging.FileStagingStore} stages accepted edits and commits them per file.</li>
 *   <li>{@code io.snapcheck.capture.CaptureReplayRunner} replays captured values as a suite.</li>
 * </ul>
 */
package io.snapcheck;
