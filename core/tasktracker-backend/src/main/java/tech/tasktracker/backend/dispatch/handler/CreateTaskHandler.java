package tech.tasktracker.backend.dispatch.handler;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tasktracker.backend.dispatch.MessageHandler;
import tech.tasktracker.backend.dispatch.TaskEnvelope;
import tech.tasktracker.backend.task.Task;
import tech.tasktracker.backend.task.TaskService;

/**
 * {@code create_task}: {@code data.title} required, {@code data.description} optional.
 */
@ApplicationScoped
public class CreateTaskHandler implements MessageHandler {

    public static final String TYPE = "create_task";

    private static final Logger LOG = Logger.getLogger(CreateTaskHandler.class);

    @Inject
    TaskService taskService;

    public CreateTaskHandler() {
        // CDI will inject dependencies
    }

    public CreateTaskHandler(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void handle(TaskEnvelope envelope) {
        JsonNode data = Payloads.object(envelope.data());
        Task task = taskService.create(
            Payloads.requiredText(data, "title"),
            Payloads.optionalText(data, "description"));
        LOG.infof("Task [%d] created from queue message", task.id());
    }
}
