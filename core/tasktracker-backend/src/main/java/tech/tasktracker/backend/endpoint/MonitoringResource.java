package tech.tasktracker.backend.endpoint;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.tasktracker.backend.metrics.ApplicationMetrics;
import tech.tasktracker.backend.metrics.MetricsSnapshot;
import tech.tasktracker.backend.metrics.MetricsStore;
import tech.tasktracker.backend.metrics.PrometheusFormatter;
import tech.tasktracker.backend.metrics.SystemMetrics;

import java.util.Map;

@Path("/metrics")
@Tag(name = "Monitoring", description = "Application and process metrics")
public class MonitoringResource {

    @Inject
    MetricsStore metricsStore;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get all metrics", description = "Application counters, process figures and health status")
    public MetricsSnapshot getMetrics() {
        return metricsStore.snapshotAll();
    }

    @GET
    @Path("/application")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get application metrics")
    public ApplicationMetrics getApplicationMetrics() {
        return metricsStore.snapshotApplication();
    }

    @GET
    @Path("/system")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get process metrics")
    public SystemMetrics getSystemMetrics() {
        return metricsStore.snapshotSystem();
    }

    @GET
    @Path("/prometheus")
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(summary = "Get metrics in Prometheus text format")
    public String getPrometheusMetrics() {
        return PrometheusFormatter.format(metricsStore.snapshotApplication(), metricsStore.snapshotSystem());
    }

    @POST
    @Path("/reset")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Reset metrics", description = "Zeroes every counter and the response time accumulator")
    public Map<String, String> resetMetrics() {
        metricsStore.reset();
        return Map.of("message", "Metrics reset");
    }
}
