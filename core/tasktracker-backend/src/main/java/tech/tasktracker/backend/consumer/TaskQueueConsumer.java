package tech.tasktracker.backend.consumer;

import org.jboss.logging.Logger;
import tech.tasktracker.backend.dispatch.DispatchResult;
import tech.tasktracker.backend.dispatch.MessageDispatcher;
import tech.tasktracker.backend.metrics.MetricNames;
import tech.tasktracker.backend.metrics.MetricsStore;
import tech.tasktracker.queue.QueueClient;
import tech.tasktracker.queue.QueueMessage;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Polls one queue on a dedicated thread: receive a batch, dispatch each message,
 * delete it when handling succeeded, then pause before the next poll.
 *
 * <p>A failing handler only affects its own message: the failure counter is
 * incremented and the message is left for redelivery. Anything else escaping a
 * cycle is logged and followed by the longer error backoff; the loop never ends
 * on its own. Cancellation is cooperative and observed between cycles; both
 * pauses wake up immediately when it is requested.
 */
public class TaskQueueConsumer implements QueueConsumer {

    private static final Logger LOG = Logger.getLogger(TaskQueueConsumer.class);
    private static final String THREAD_NAME = "task-queue-consumer";
    private static final long HEALTH_MARGIN_SECONDS = 40;

    private final QueueClient queueClient;
    private final MessageDispatcher dispatcher;
    private final MetricsStore metrics;
    private final String queueName;
    private final int maxMessages;
    private final int waitTimeSeconds;
    private final Duration idleBackoff;
    private final Duration errorBackoff;

    private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.STOPPED);
    private volatile CountDownLatch cancelSignal = new CountDownLatch(0);
    private volatile CountDownLatch exited = new CountDownLatch(0);
    private volatile Thread worker;
    private volatile long lastPollTime;

    public TaskQueueConsumer(
            QueueClient queueClient,
            MessageDispatcher dispatcher,
            MetricsStore metrics,
            String queueName,
            int maxMessages,
            int waitTimeSeconds,
            Duration idleBackoff,
            Duration errorBackoff) {
        this.queueClient = queueClient;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.queueName = queueName;
        this.maxMessages = maxMessages;
        this.waitTimeSeconds = waitTimeSeconds;
        this.idleBackoff = idleBackoff;
        this.errorBackoff = errorBackoff;

        LOG.infof("Queue consumer created: queue=%s, maxMessages=%d, waitTime=%ds, idleBackoff=%s, errorBackoff=%s",
            queueName, maxMessages, waitTimeSeconds, idleBackoff, errorBackoff);
    }

    @Override
    public boolean start() {
        if (!queueClient.isEnabled()) {
            LOG.warnf("Queue client is disabled - consumer for queue [%s] not started", queueName);
            return false;
        }
        if (!state.compareAndSet(ConsumerState.STOPPED, ConsumerState.RUNNING)) {
            LOG.debugf("Consumer for queue [%s] is already %s", queueName, state.get());
            return false;
        }

        cancelSignal = new CountDownLatch(1);
        CountDownLatch runExited = new CountDownLatch(1);
        exited = runExited;
        Thread thread = new Thread(() -> consumeMessages(runExited), THREAD_NAME);
        thread.setDaemon(true);
        worker = thread;
        thread.start();
        LOG.infof("Consumer for queue [%s] started (mode=%s)", queueName, queueClient.getMode());
        return true;
    }

    @Override
    public boolean stop(Duration grace) {
        if (!state.compareAndSet(ConsumerState.RUNNING, ConsumerState.CANCELLING)
                && state.get() == ConsumerState.STOPPED) {
            return true;
        }
        LOG.infof("Stopping consumer for queue [%s]", queueName);
        cancelSignal.countDown();

        try {
            if (exited.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.infof("Consumer for queue [%s] stopped", queueName);
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        LOG.warnf("Consumer for queue [%s] did not finish its cycle within %s - interrupting", queueName, grace);
        Thread thread = worker;
        if (thread != null) {
            thread.interrupt();
        }
        return false;
    }

    @Override
    public String getQueueIdentifier() {
        return queueName;
    }

    @Override
    public ConsumerState getState() {
        return state.get();
    }

    @Override
    public boolean isFullyStopped() {
        Thread thread = worker;
        return state.get() == ConsumerState.STOPPED && (thread == null || !thread.isAlive());
    }

    @Override
    public long getLastPollTime() {
        return lastPollTime;
    }

    @Override
    public boolean isHealthy() {
        if (state.get() != ConsumerState.RUNNING) {
            return false;
        }
        long sinceLastPoll = System.currentTimeMillis() - lastPollTime;
        return lastPollTime > 0
            && sinceLastPoll < TimeUnit.SECONDS.toMillis(waitTimeSeconds + HEALTH_MARGIN_SECONDS);
    }

    private void consumeMessages(CountDownLatch runExited) {
        long loopCount = 0;
        LOG.infof("Polling started for queue [%s] on thread [%s]", queueName, Thread.currentThread().getName());
        try {
            while (!isCancelRequested()) {
                try {
                    loopCount++;
                    pollOnce();

                    // Finish the batch, then check before pausing
                    if (isCancelRequested()) {
                        break;
                    }
                    pause(idleBackoff);

                } catch (Exception e) {
                    if (isCancelRequested()) {
                        LOG.debug("Exception during shutdown, exiting cleanly");
                        break;
                    }
                    LOG.errorf(e, "Error polling queue [%s], backing off for %s", queueName, errorBackoff);
                    pause(errorBackoff);
                }
            }
        } finally {
            state.set(ConsumerState.STOPPED);
            // This run's latch; a start() after STOPPED installs its own
            runExited.countDown();
            LOG.infof("Consumer for queue [%s] polling loop exited after %d loops", queueName, loopCount);
        }
    }

    /**
     * Run one receive/dispatch/delete cycle.
     *
     * @return number of messages received
     */
    int pollOnce() {
        lastPollTime = System.currentTimeMillis();
        List<QueueMessage> messages = queueClient.receive(queueName, maxMessages, waitTimeSeconds);
        for (QueueMessage message : messages) {
            processMessage(message);
        }
        return messages.size();
    }

    private void processMessage(QueueMessage message) {
        DispatchResult result;
        try {
            result = dispatcher.dispatch(message);
        } catch (Exception e) {
            metrics.increment(MetricNames.QUEUE_MESSAGES_FAILED);
            LOG.warnf(e, "Message [%s] failed - leaving it on queue [%s] for redelivery", message.id(), queueName);
            return;
        }

        if (!queueClient.delete(queueName, message.receipt())) {
            LOG.warnf("Message [%s] was handled but could not be deleted from queue [%s] - it may be redelivered",
                message.id(), queueName);
        }
        if (result == DispatchResult.DROPPED) {
            metrics.increment(MetricNames.QUEUE_MESSAGES_DROPPED);
        }
        metrics.increment(MetricNames.QUEUE_MESSAGES_PROCESSED);
    }

    private boolean isCancelRequested() {
        return cancelSignal.getCount() == 0 || Thread.currentThread().isInterrupted();
    }

    private void pause(Duration duration) {
        try {
            cancelSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debugf("Consumer thread interrupted while paused for queue [%s]", queueName);
        }
    }
}
