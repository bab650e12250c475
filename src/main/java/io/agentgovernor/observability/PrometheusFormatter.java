package io.agentgovernor.observability;

import io.agentgovernor.runtime.GovernorRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(GovernorRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "governor_tasks_total", "Tracked tasks grouped by status", "status", stats.taskStatus());
        appendMapGauge(sb, "governor_circuits_total", "Circuits grouped by state", "state", stats.circuitState());
        appendMapGauge(sb, "governor_events_rejected_total", "Events dropped by the dampener grouped by reason", "reason", stats.eventsRejected());

        appendGauge(sb, "governor_admissions_total", "Admission decisions grouped by outcome", "outcome", "admitted", stats.admittedTotal());
        appendGauge(sb, "governor_admissions_total", "Admission decisions grouped by outcome", "outcome", "deduplicated", stats.deduplicatedTotal());
        appendGauge(sb, "governor_admissions_total", "Admission decisions grouped by outcome", "outcome", "arbitration_rejected", stats.arbitrationRejectedTotal());
        appendGauge(sb, "governor_admissions_total", "Admission decisions grouped by outcome", "outcome", "circuit_open", stats.circuitBlockedTotal());
        appendGauge(sb, "governor_admissions_total", "Admission decisions grouped by outcome", "outcome", "budget_denied", stats.budgetDeniedTotal());
        appendGauge(sb, "governor_completions_total", "Task completions grouped by result", "result", "completed", stats.completedTotal());
        appendGauge(sb, "governor_completions_total", "Task completions grouped by result", "result", "failed", stats.failedTotal());
        appendGauge(sb, "governor_circuit_trips_total", "Agent circuits tripped by task failures", null, null, stats.circuitTripTotal());
        appendGauge(sb, "governor_budget_allocations", "Actors with a budget allocation", null, null, stats.budgetAllocations());
        appendGauge(sb, "governor_budget_reservations", "Outstanding budget reservations", null, null, stats.activeReservations());
        appendGauge(sb, "governor_causality_chains", "Tracked causality chains", null, null, stats.trackedChains());
        appendGauge(sb, "governor_events_published_total", "Events accepted by the bus", null, null, stats.eventsPublishedTotal());
        appendGauge(sb, "governor_event_deliveries_total", "Successful subscriber deliveries", null, null, stats.eventDeliveriesTotal());
        appendGauge(sb, "governor_event_handler_failures_total", "Subscriber deliveries that threw", null, null, stats.eventHandlerFailuresTotal());
        appendGauge(sb, "governor_event_correlations", "Correlation ids with live cascade counters", null, null, stats.activeCorrelations());
        appendGauge(sb, "governor_maintenance_runs_total", "Completed maintenance passes", null, null, stats.maintenanceRunsTotal());
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
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
