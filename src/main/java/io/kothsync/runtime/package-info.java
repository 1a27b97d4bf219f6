/**
 * Runtime wiring.
 *
 * <p>{@link io.kothsync.runtime.KothSyncRuntime} builds the stores, the sweep, lifecycle and telemetry
 * components from one {@link io.kothsync.config.KothSyncConfig}, and attaches them to a host event source
 * on {@code mount}.
 */
package io.kothsync.runtime;
