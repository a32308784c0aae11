package tech.tasktracker.backend.dispatch;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.tasktracker.queue.QueueMessage;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes a received message to the handler registered for its type tag.
 */
@ApplicationScoped
public class MessageDispatcher {

    private static final Logger LOG = Logger.getLogger(MessageDispatcher.class);

    @Inject
    Instance<MessageHandler> handlerBeans;

    private final Map<String, MessageHandler> handlers = new HashMap<>();

    /**
     * Default constructor for CDI
     */
    public MessageDispatcher() {
        // CDI will inject dependencies
    }

    public MessageDispatcher(Collection<? extends MessageHandler> handlers) {
        handlers.forEach(this::register);
    }

    @PostConstruct
    void init() {
        handlerBeans.forEach(this::register);
        LOG.infof("Message dispatcher ready with handlers for types %s", handlers.keySet());
    }

    private void register(MessageHandler handler) {
        MessageHandler previous = handlers.putIfAbsent(handler.type(), handler);
        if (previous != null) {
            throw new IllegalStateException("Duplicate handlers for message type [" + handler.type() + "]: "
                + previous.getClass().getName() + " and " + handler.getClass().getName());
        }
    }

    /**
     * Dispatch one message.
     *
     * @return {@link DispatchResult#DROPPED} when no handler accepts the type
     * @throws MessageHandlingException if the handler fails
     */
    public DispatchResult dispatch(QueueMessage message) {
        TaskEnvelope envelope = TaskEnvelope.from(message.body());
        MessageHandler handler = handlers.get(envelope.type());

        if (handler == null) {
            LOG.warnf("No handler for message type [%s], dropping message [%s]", envelope.type(), message.id());
            return DispatchResult.DROPPED;
        }

        try {
            handler.handle(envelope);
        } catch (Exception e) {
            throw new MessageHandlingException(message.id(), envelope.type(), e);
        }
        LOG.debugf("Message [%s] of type [%s] handled", message.id(), envelope.type());
        return DispatchResult.HANDLED;
    }

    public Set<String> supportedTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
