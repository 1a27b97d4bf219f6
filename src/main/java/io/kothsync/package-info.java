/**
 * kothsync source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.kothsync.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.kothsync.runtime.KothSyncRuntime} wires the components and mounts them on a host.</li>
 *   <li>{@code io.kothsync.sync.DirectorySweep} is the periodic file/store reconciliation pass.</li>
 *   <li>{@code io.kothsync.storage.EntityStore} is the shared persistence layer.</li>
 * </ul>
 */
package io.kothsync;
