package tech.tasktracker.backend.dispatch.handler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tasktracker.backend.dispatch.MessageHandler;
import tech.tasktracker.backend.dispatch.TaskEnvelope;
import tech.tasktracker.backend.task.TaskNotFoundException;
import tech.tasktracker.backend.task.TaskService;

/**
 * {@code delete_task}: {@code data.id} required.
 */
@ApplicationScoped
public class DeleteTaskHandler implements MessageHandler {

    public static final String TYPE = "delete_task";

    private static final Logger LOG = Logger.getLogger(DeleteTaskHandler.class);

    @Inject
    TaskService taskService;

    public DeleteTaskHandler() {
        // CDI will inject dependencies
    }

    public DeleteTaskHandler(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void handle(TaskEnvelope envelope) {
        long id = Payloads.requiredId(Payloads.object(envelope.data()));
        taskService.delete(id).orElseThrow(() -> new TaskNotFoundException(id));
        LOG.infof("Task [%d] deleted from queue message", id);
    }
}
