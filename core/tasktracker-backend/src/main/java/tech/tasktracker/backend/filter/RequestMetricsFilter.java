package tech.tasktracker.backend.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.ext.Provider;
import tech.tasktracker.backend.metrics.MetricsStore;

/**
 * Counts every HTTP request, classifies it by status and records its duration.
 *
 * <p>Adds {@code X-Response-Time} (seconds) and {@code X-Request-Id} (request start,
 * epoch millis) to each response. Runs before resource matching so unmatched routes
 * are counted too.
 */
@Provider
@PreMatching
public class RequestMetricsFilter implements ContainerRequestFilter, ContainerResponseFilter {

    public static final String RESPONSE_TIME_HEADER = "X-Response-Time";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final String START_NANOS = RequestMetricsFilter.class.getName() + ".startNanos";
    private static final String START_MILLIS = RequestMetricsFilter.class.getName() + ".startMillis";

    @Inject
    MetricsStore metrics;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        requestContext.setProperty(START_NANOS, System.nanoTime());
        requestContext.setProperty(START_MILLIS, System.currentTimeMillis());
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        Object startNanos = requestContext.getProperty(START_NANOS);
        if (!(startNanos instanceof Long start)) {
            // Request was aborted before the request filter ran
            return;
        }
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;

        int status = responseContext.getStatus();
        metrics.recordRequest(status >= 200 && status < 400, seconds);

        responseContext.getHeaders().putSingle(RESPONSE_TIME_HEADER, Double.toString(seconds));
        responseContext.getHeaders().putSingle(REQUEST_ID_HEADER, String.valueOf(requestContext.getProperty(START_MILLIS)));
    }
}
