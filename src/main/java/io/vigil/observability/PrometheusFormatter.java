package io.vigil.observability;

import io.vigil.runtime.VigilRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(VigilRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "vigil_instances", "Instances grouped by reconciled status", "status", stats.instancesByStatus());
        appendGauge(sb, "vigil_instances_stale", "Running instances past the heartbeat timeout", null, null, stats.staleRunning());
        appendGauge(sb, "vigil_transcript_entries", "Committed transcript entries", null, null, stats.transcriptEntries());
        appendGauge(sb, "vigil_emitted_total", "Entries emitted by this process", null, null, stats.emittedTotal());
        appendGauge(sb, "vigil_heartbeats_total", "Heartbeats by outcome", "outcome", "accepted", stats.heartbeatsAccepted());
        appendGauge(sb, "vigil_heartbeats_total", "Heartbeats by outcome", "outcome", "ignored", stats.heartbeatsIgnored());
        appendGauge(sb, "vigil_heartbeats_total", "Heartbeats by outcome", "outcome", "terminal", stats.heartbeatsRejectedTerminal());
        appendGauge(sb, "vigil_reaped_total", "Instances terminated for stale heartbeat", null, null, stats.reapedTotal());
        appendGauge(sb, "vigil_reaper_tick_failures_total", "Reaper ticks that failed", null, null, stats.reaperTickFailuresTotal());
        appendGauge(sb, "vigil_reaper_consecutive_failures", "Consecutive failed reaper ticks", null, null, stats.reaperConsecutiveFailures());
        appendGauge(sb, "vigil_reaper_alert", "Reaper alert flag (1=alerting,0=ok)", null, null, stats.reaperAlerting());
        appendGauge(sb, "vigil_process_probe_failures_total", "Process probe or signal failures", null, null, stats.probeFailuresTotal());
        appendGauge(sb, "vigil_conflicting_transitions_total", "Rejected conflicting terminal transitions", null, null, stats.conflictingTransitionsTotal());
        appendGauge(sb, "vigil_stream_subscribers", "Live stream subscribers", null, null, stats.streamSubscribers());
        appendGauge(sb, "vigil_stream_disconnects_total", "Subscribers disconnected for falling behind", null, null, stats.streamDisconnectsTotal());
        appendGauge(sb, "vigil_stream_published_total", "Entries handed to the stream fan-out", null, null, stats.streamPublishedTotal());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
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
