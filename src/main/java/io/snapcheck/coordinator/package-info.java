/**
 * Serializes reconciliation decisions from concurrently running tests onto one coordinator thread.
 */
package io.snapcheck.coordinator;
