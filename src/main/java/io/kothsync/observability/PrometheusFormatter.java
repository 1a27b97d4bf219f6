package io.kothsync.observability;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(SyncMetrics.Snapshot stats, int serverId, int openSessions) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "kothsync_sweeps_total", "Completed directory sweeps", null, null, stats.sweepsTotal());
        appendGauge(sb, "kothsync_sweeps_aborted_total", "Sweeps aborted by a store failure", null, null, stats.sweepsAbortedTotal());
        appendGauge(sb, "kothsync_sweep_ticks_skipped_total", "Scheduler ticks skipped because a sweep was still running", null, null, stats.sweepTicksSkippedTotal());
        appendGauge(sb, "kothsync_entity_pushes_total", "Entity propagations grouped by direction", "direction", "file_to_store", stats.pushedToStoreTotal());
        appendGauge(sb, "kothsync_entity_pushes_total", "Entity propagations grouped by direction", "direction", "store_to_file", stats.pushedToFileTotal());
        appendGauge(sb, "kothsync_entity_pushes_total", "Entity propagations grouped by direction", "direction", "materialize", stats.materializedTotal());
        appendGauge(sb, "kothsync_counter_merges_total", "Stats deltas merged from player files", null, null, stats.countersMergedTotal());
        appendGauge(sb, "kothsync_entity_failures_total", "Entities skipped in a sweep after an I/O or parse failure", null, null, stats.entityFailuresTotal());
        appendGauge(sb, "kothsync_settings_pushed_total", "ServerSettings pushes from the store", null, null, stats.settingsPushedTotal());
        appendGauge(sb, "kothsync_lifecycle_events_total", "Lifecycle events handled", "event", "arrival", stats.arrivalsTotal());
        appendGauge(sb, "kothsync_lifecycle_events_total", "Lifecycle events handled", "event", "departure", stats.departuresTotal());
        appendGauge(sb, "kothsync_telemetry_increments_total", "Kill/death/capture increments applied", null, null, stats.telemetryIncrementsTotal());
        appendGauge(sb, "kothsync_last_sweep_duration_ms", "Duration of the last completed sweep", null, null, stats.lastSweepDurationMs());
        appendGauge(sb, "kothsync_open_sessions", "Open arrival sessions", null, null, openSessions);
        appendGauge(sb, "kothsync_server_info", "Server id marker", "server_id", String.valueOf(serverId), 1L);
        return sb.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
