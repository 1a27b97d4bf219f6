/**
 * Reconciliation between player files and the shared store: the periodic sweep, forced propagation on
 * connect and disconnect, and kill/death/capture counters.
 */
package io.kothsync.sync;
