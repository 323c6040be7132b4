/**
 * Runtime wiring.
 *
 * <p>{@link io.snapcheck.runtime.SnapcheckRuntime} builds the per-run collaborators and the
 * coordinator; {@link io.snapcheck.runtime.AutoAssert} is what a running test calls at each
 * reconciliation point.
 */
package io.snapcheck.runtime;
