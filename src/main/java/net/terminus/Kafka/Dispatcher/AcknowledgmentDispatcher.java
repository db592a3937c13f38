package net.terminus.Kafka.Dispatcher;

import net.terminus.Kafka.Config.BackoffCalculator;
import net.terminus.Kafka.CustomObject.CancellationToken;
import net.terminus.Kafka.CustomObject.ConsumerSettings;
import net.terminus.Kafka.CustomObject.DLQPolicy;
import net.terminus.Kafka.CustomObject.DeadLetterReason;
import net.terminus.Kafka.CustomObject.DeliveryState;
import net.terminus.Kafka.CustomObject.MessageId;
import net.terminus.Kafka.CustomObject.MessageRecord;
import net.terminus.Kafka.CustomObject.TrackedMessage;
import net.terminus.Kafka.DeadLetter.DeadLetterRouter;
import net.terminus.Kafka.Errors.AlreadyFinalizedException;
import net.terminus.Kafka.Errors.InvalidConfigurationException;
import net.terminus.Kafka.Metrics.MetricsRecorder;
import net.terminus.Kafka.Policy.RedeliveryDecision;
import net.terminus.Kafka.Policy.RedeliveryPolicy;
import net.terminus.Kafka.Tracker.DeliveryTracker;
import net.terminus.Kafka.Tracker.TransitionEvent;
import net.terminus.Kafka.Transport.DeliveryTransport;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns ack, nack and term calls into tracker transitions and transport calls.
 *
 * Each call first claims the delivery attempt with a single tracker
 * transition; the loser of a race gets {@link AckOutcome#ALREADY_FINALIZED}
 * and sends nothing. Produce, ack and scheduling happen after the transition,
 * never inside it.
 */
public class AcknowledgmentDispatcher implements MessageConsumer {

    private static final Logger logger = LoggerFactory.getLogger(AcknowledgmentDispatcher.class);

    private final ConsumerSettings settings;
    private final DeliveryTracker tracker;
    private final RedeliveryPolicy redeliveryPolicy;
    private final DeadLetterRouter router;
    private final DeliveryTransport transport;
    private final BackoffCalculator backoffCalculator;
    private final MetricsRecorder metricsRecorder;

    public AcknowledgmentDispatcher(ConsumerSettings settings,
                                    DeliveryTracker tracker,
                                    RedeliveryPolicy redeliveryPolicy,
                                    DeadLetterRouter router,
                                    DeliveryTransport transport,
                                    BackoffCalculator backoffCalculator,
                                    MetricsRecorder metricsRecorder) {
        this.settings = settings;
        this.tracker = tracker;
        this.redeliveryPolicy = redeliveryPolicy;
        this.router = router;
        this.transport = transport;
        this.backoffCalculator = backoffCalculator;
        this.metricsRecorder = metricsRecorder;
    }

    @Override
    public Optional<TrackedMessage> receive(ConsumerRecord<?, ?> record, @Nullable Acknowledgment acknowledgment) {
        TrackedMessage message = transport.receive(record, acknowledgment);
        return receive(message).map(current -> message);
    }

    @Override
    public Optional<MessageRecord> receive(TrackedMessage message) {
        MessageId messageId = message.getMessageId();
        try {
            MessageRecord record = tracker.transition(messageId, TransitionEvent.DELIVER,
                    message.getBrokerRedeliveryCount());
            logger.debug("delivery of message {} on topic: {} (redeliveries: {})",
                    messageId, message.getTopic(), record.getRedeliveryCount());
            return Optional.of(record);
        } catch (AlreadyFinalizedException e) {
            logger.info("duplicate delivery of message {} ({}), acknowledging it again",
                    messageId, e.getCurrentState());
            transport.sendAck(message);
            return Optional.empty();
        }
    }

    @Override
    public AckOutcome ack(TrackedMessage message) {
        MessageId messageId = message.getMessageId();
        try {
            tracker.transition(messageId, TransitionEvent.FINALIZE);
        } catch (AlreadyFinalizedException e) {
            return alreadyFinalized(e);
        }

        transport.sendAck(message);
        metricsRecorder.recordAck(settings);
        return AckOutcome.ACKNOWLEDGED;
    }

    @Override
    public AckOutcome nack(TrackedMessage message, CancellationToken token) {
        MessageId messageId = message.getMessageId();
        DLQPolicy dlqPolicy = settings.getDlqPolicy();

        MessageRecord record;
        try {
            record = tracker.transition(messageId, current ->
                    redeliveryPolicy.decide(current, dlqPolicy) == RedeliveryDecision.ROUTE_TO_DLQ
                            ? TransitionEvent.ROUTE_TO_DLQ
                            : TransitionEvent.REDELIVER);
        } catch (AlreadyFinalizedException e) {
            return alreadyFinalized(e);
        }

        if (record.getState() == DeliveryState.DEAD_LETTERING) {
            logger.info("message {} exhausted {} redeliveries, routing to dlq",
                    messageId, record.getRedeliveryCount());
            return deadLetter(message, record, DeadLetterReason.MAX_REDELIVERIES_EXCEEDED, token);
        }

        int redeliveryCount = record.getRedeliveryCount();
        try {
            transport.sendNack(message, redeliveryCount, nackDelay(redeliveryCount));
        } catch (RuntimeException e) {
            // nothing was scheduled, so the message must stay claimable
            tracker.transition(messageId, TransitionEvent.REDELIVER_FAILED);
            logger.warn("could not schedule redelivery of message {}, it is pending again: {}",
                    messageId, e.getMessage());
            throw e;
        }
        metricsRecorder.recordRedelivery(settings, redeliveryCount);
        return AckOutcome.REDELIVERY_SCHEDULED;
    }

    @Override
    public AckOutcome term(TrackedMessage message, CancellationToken token) {
        MessageId messageId = message.getMessageId();
        if (!settings.hasDeadLetterTopic()) {
            logger.warn("term called for message {} but consumer of topic: {} has no dead letter topic",
                    messageId, settings.getTopic());
            throw new InvalidConfigurationException(messageId,
                    "term requires a dead letter topic, consumer of topic " + settings.getTopic() + " has none");
        }

        MessageRecord record;
        try {
            record = tracker.transition(messageId, TransitionEvent.ROUTE_TO_DLQ);
        } catch (AlreadyFinalizedException e) {
            return alreadyFinalized(e);
        }

        AckOutcome outcome = deadLetter(message, record, DeadLetterReason.TERM, token);
        metricsRecorder.recordTerm(settings);
        return outcome;
    }

    @Override
    public ConsumerSettings getSettings() {
        return settings;
    }

    private AckOutcome deadLetter(TrackedMessage message,
                                  MessageRecord record,
                                  DeadLetterReason reason,
                                  CancellationToken token) {
        MessageId messageId = message.getMessageId();
        try {
            router.route(message, settings.getDlqPolicy(), reason, record.getRedeliveryCount(), token);
        } catch (RuntimeException e) {
            handBack(message, record, e);
            throw e;
        }

        tracker.transition(messageId, TransitionEvent.DEAD_LETTERED);
        return AckOutcome.DEAD_LETTERED;
    }

    /**
     * Routing failed: the record goes back to pending and the message is
     * redelivered without spending one of its redeliveries.
     */
    private void handBack(TrackedMessage message, MessageRecord record, RuntimeException failure) {
        MessageId messageId = message.getMessageId();
        tracker.transition(messageId, TransitionEvent.ROUTE_FAILED);
        metricsRecorder.recordRoutingFailure(settings, failure);

        logger.warn("dlq routing of message {} failed, handing it back for redelivery: {}",
                messageId, failure.getMessage());
        try {
            transport.sendNack(message, record.getRedeliveryCount(), nackDelay(record.getRedeliveryCount()));
        } catch (RuntimeException e) {
            logger.error("could not hand message {} back for redelivery: {}", messageId, e.getMessage());
            failure.addSuppressed(e);
        }
    }

    private Duration nackDelay(int redeliveryCount) {
        return backoffCalculator.delayFor(settings.getDelayMethod(), settings.getNackDelay(),
                settings.getMaxNackDelay(), redeliveryCount);
    }

    private AckOutcome alreadyFinalized(AlreadyFinalizedException e) {
        logger.debug("ignoring {} for message {}: already {}", e.getRejectedEvent(), e.getMessageId(),
                e.getCurrentState());
        return AckOutcome.ALREADY_FINALIZED;
    }
}
