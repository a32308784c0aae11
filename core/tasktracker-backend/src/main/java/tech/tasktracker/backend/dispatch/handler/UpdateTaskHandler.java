package tech.tasktracker.backend.dispatch.handler;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tasktracker.backend.dispatch.MessageHandler;
import tech.tasktracker.backend.dispatch.TaskEnvelope;
import tech.tasktracker.backend.task.TaskNotFoundException;
import tech.tasktracker.backend.task.TaskService;

/**
 * {@code update_task}: {@code data.id} required; {@code title}, {@code description}
 * and {@code status} applied when present.
 */
@ApplicationScoped
public class UpdateTaskHandler implements MessageHandler {

    public static final String TYPE = "update_task";

    private static final Logger LOG = Logger.getLogger(UpdateTaskHandler.class);

    @Inject
    TaskService taskService;

    public UpdateTaskHandler() {
        // CDI will inject dependencies
    }

    public UpdateTaskHandler(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void handle(TaskEnvelope envelope) {
        JsonNode data = Payloads.object(envelope.data());
        long id = Payloads.requiredId(data);
        taskService.update(
                id,
                Payloads.optionalText(data, "title"),
                Payloads.optionalText(data, "description"),
                Payloads.optionalStatus(data))
            .orElseThrow(() -> new TaskNotFoundException(id));
        LOG.infof("Task [%d] updated from queue message", id);
    }
}
