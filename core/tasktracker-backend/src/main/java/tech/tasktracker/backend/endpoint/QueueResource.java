package tech.tasktracker.backend.endpoint;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.tasktracker.backend.config.QueueSettings;
import tech.tasktracker.backend.consumer.QueueConsumer;
import tech.tasktracker.backend.consumer.QueueConsumerManager;
import tech.tasktracker.backend.metrics.MetricNames;
import tech.tasktracker.backend.metrics.MetricsStore;
import tech.tasktracker.queue.QueueClient;
import tech.tasktracker.queue.QueueStats;

import java.util.Map;
import java.util.Optional;

@Path("/queue")
@Tag(name = "Queue", description = "Manual queue operations and consumer status")
public class QueueResource {

    private static final Logger LOG = Logger.getLogger(QueueResource.class);

    @Inject
    QueueClient queueClient;

    @Inject
    QueueSettings queueSettings;

    @Inject
    QueueConsumerManager consumerManager;

    @Inject
    MetricsStore metrics;

    @POST
    @Path("/send")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Send a message", description = "Sends the body to the queue as JSON")
    @APIResponse(responseCode = "200", description = "Message accepted by the queue")
    @APIResponse(responseCode = "400", description = "Body missing")
    @APIResponse(responseCode = "502", description = "Queue backend failure")
    @APIResponse(responseCode = "503", description = "Queue not configured")
    public Response send(SendMessageRequest request) {
        if (request == null || request.body() == null || request.body().isNull()) {
            return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorResponse("Message body is required"))
                .build();
        }

        String queueName = resolveQueue(request.queueName());
        int delaySeconds = request.delaySeconds() != null ? request.delaySeconds() : 0;
        Map<String, Object> attributes = request.attributes() != null ? request.attributes() : Map.of();

        String messageId = queueClient.send(queueName, request.body(), delaySeconds, attributes);
        metrics.increment(MetricNames.QUEUE_MESSAGES_SENT);
        LOG.debugf("Manual send to queue [%s] accepted, ID: %s", queueName, messageId);
        return Response.ok(new SendMessageResponse(messageId, queueName)).build();
    }

    @GET
    @Path("/stats")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get queue statistics")
    public QueueStats stats(@QueryParam("queueName") String queueName) {
        return queueClient.stats(resolveQueue(queueName));
    }

    @GET
    @Path("/status")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Get queue client and consumer status")
    public QueueStatus status() {
        Optional<QueueConsumer> consumer = consumerManager.getConsumer();
        return new QueueStatus(
            queueClient.isEnabled(),
            queueClient.getMode(),
            consumer.map(QueueConsumer::getQueueIdentifier).orElse(queueSettings.defaultQueue()),
            consumerManager.getState(),
            consumer.map(QueueConsumer::isHealthy).orElse(false),
            consumer.map(QueueConsumer::getLastPollTime).orElse(0L)
        );
    }

    private String resolveQueue(String queueName) {
        return queueName == null || queueName.isBlank() ? queueSettings.defaultQueue() : queueName;
    }
}
