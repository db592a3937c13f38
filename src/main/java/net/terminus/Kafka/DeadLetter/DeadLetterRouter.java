package net.terminus.Kafka.DeadLetter;

import net.terminus.Kafka.Config.BackoffCalculator;
import net.terminus.Kafka.Config.DeadLetterProperties;
import net.terminus.Kafka.CustomObject.CancellationToken;
import net.terminus.Kafka.CustomObject.ConsumerSettings;
import net.terminus.Kafka.CustomObject.DLQPolicy;
import net.terminus.Kafka.CustomObject.DeadLetterEnvelope;
import net.terminus.Kafka.CustomObject.DeadLetterMetadata;
import net.terminus.Kafka.CustomObject.DeadLetterReason;
import net.terminus.Kafka.CustomObject.MessageId;
import net.terminus.Kafka.CustomObject.TrackedMessage;
import net.terminus.Kafka.Errors.InvalidConfigurationException;
import net.terminus.Kafka.Errors.RoutingCancelledException;
import net.terminus.Kafka.Errors.TransientDeliveryException;
import net.terminus.Kafka.Metrics.MetricsRecorder;
import net.terminus.Kafka.Tracing.TracingService;
import net.terminus.Kafka.Tracing.TracingSpan;
import net.terminus.Kafka.Transport.DeliveryTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;

/**
 * Moves one message to its consumer's dead-letter topic.
 *
 * The copy is produced first and the original is acknowledged only once the
 * produce succeeded, so a failure anywhere leaves the original redeliverable.
 * The router keeps no state of its own; the caller owns the message's record.
 */
public class DeadLetterRouter {

    private static final Logger logger = LoggerFactory.getLogger(DeadLetterRouter.class);

    private final ConsumerSettings settings;
    private final DeadLetterProducer producer;
    private final DeliveryTransport transport;
    private final BackoffCalculator backoffCalculator;
    private final DeadLetterProperties properties;
    private final TracingService tracingService;
    private final MetricsRecorder metricsRecorder;
    private final Clock clock;

    public DeadLetterRouter(ConsumerSettings settings,
                            DeadLetterProducer producer,
                            DeliveryTransport transport,
                            BackoffCalculator backoffCalculator,
                            DeadLetterProperties properties,
                            TracingService tracingService,
                            MetricsRecorder metricsRecorder) {
        this(settings, producer, transport, backoffCalculator, properties, tracingService, metricsRecorder,
                Clock.systemUTC());
    }

    public DeadLetterRouter(ConsumerSettings settings,
                     DeadLetterProducer producer,
                     DeliveryTransport transport,
                     BackoffCalculator backoffCalculator,
                     DeadLetterProperties properties,
                     TracingService tracingService,
                     MetricsRecorder metricsRecorder,
                     Clock clock) {
        this.settings = settings;
        this.producer = producer;
        this.transport = transport;
        this.backoffCalculator = backoffCalculator;
        this.properties = properties;
        this.tracingService = tracingService;
        this.metricsRecorder = metricsRecorder;
        this.clock = clock;
    }

    /**
     * Produces the message to the dead-letter topic, then acknowledges the original.
     *
     * @param message         the message to route
     * @param dlqPolicy       the consumer's dead-letter policy
     * @param reason          why the message is being dead-lettered
     * @param redeliveryCount the tracked redelivery count, written to the envelope
     * @param token           bounds the produce and ack calls
     * @throws InvalidConfigurationException if there is no dead-letter topic, before any network call
     * @throws TransientDeliveryException    if every produce attempt failed, or the ack after a successful produce failed
     * @throws RoutingCancelledException     if the token was cancelled or the thread interrupted before the produce succeeded
     */
    public void route(TrackedMessage message,
                      @Nullable DLQPolicy dlqPolicy,
                      DeadLetterReason reason,
                      int redeliveryCount,
                      CancellationToken token) {
        MessageId messageId = message.getMessageId();
        if (dlqPolicy == null || !dlqPolicy.hasDeadLetterTopic()) {
            throw new InvalidConfigurationException(messageId,
                    "no dead letter topic configured for consumer of topic: " + message.getTopic());
        }
        String deadLetterTopic = dlqPolicy.getDeadLetterTopic();

        TracingSpan span = tracingService.startDLQSpan(message.getTopic(), deadLetterTopic, messageId.value(),
                redeliveryCount, reason.name());
        try {
            DeadLetterEnvelope<Object> envelope = new DeadLetterEnvelope<>(message.getValue(),
                    buildMetadata(message, dlqPolicy, deadLetterTopic, reason, redeliveryCount));

            int attempts = produceWithRetry(message, deadLetterTopic, envelope, token);
            span.setProduceAttempts(attempts);
            // the copy is durable from here on, an ack failure can only duplicate it
            acknowledgeOriginal(message, deadLetterTopic);

            metricsRecorder.recordDeadLetter(settings, reason);
            span.setSuccess();
            logger.info("routed message {} from topic: {} to dlq topic: {} (reason: {}, redeliveries: {})",
                    messageId, message.getTopic(), deadLetterTopic, reason, redeliveryCount);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private int produceWithRetry(TrackedMessage message,
                                 String deadLetterTopic,
                                 DeadLetterEnvelope<?> envelope,
                                 CancellationToken token) {
        MessageId messageId = message.getMessageId();
        int maxAttempts = properties.getMaxProduceAttempts();

        for (int attempt = 1; ; attempt++) {
            token.throwIfCancelled(messageId, "dead letter produce");
            Duration timeout = token.remaining(properties.getProduceTimeout());
            try {
                producer.produce(deadLetterTopic, message, envelope, timeout);
                return attempt;
            } catch (TransientDeliveryException e) {
                if (attempt >= maxAttempts) {
                    logger.error("giving up on dlq topic: {} for message {} after {} attempts: {}",
                            deadLetterTopic, messageId, attempt, e.getMessage());
                    throw e;
                }
                Duration backoff = backoffCalculator.delayFor(properties.getBackoffMethod(),
                        properties.getBackoffBase(), properties.getBackoffMax(), attempt);
                logger.warn("dlq produce attempt {}/{} for message {} failed, retrying in {} ms: {}",
                        attempt, maxAttempts, messageId, backoff.toMillis(), e.getMessage());
                pause(messageId, token.remaining(backoff));
            }
        }
    }

    private void acknowledgeOriginal(TrackedMessage message, String deadLetterTopic) {
        try {
            transport.sendAck(message);
        } catch (TransientDeliveryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransientDeliveryException(message.getMessageId(),
                    "message " + message.getMessageId() + " reached dlq topic: " + deadLetterTopic
                            + " but the original could not be acknowledged", e);
        }
    }

    private void pause(MessageId messageId, Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingCancelledException(messageId, "interrupted between dlq produce attempts", e);
        }
    }

    private DeadLetterMetadata buildMetadata(TrackedMessage message,
                                             DLQPolicy dlqPolicy,
                                             String deadLetterTopic,
                                             DeadLetterReason reason,
                                             int redeliveryCount) {
        return DeadLetterMetadata.builder()
                .messageId(message.getMessageId().value())
                .originalTopic(message.getTopic())
                .originalPartition(message.getPartition())
                .originalOffset(message.getOffset())
                .deadLetterTopic(deadLetterTopic)
                .reason(reason)
                .redeliveryCount(redeliveryCount)
                .maxRedeliveries(dlqPolicy.isUnbounded() ? null : dlqPolicy.getMaxRedeliveries())
                .clientId(settings.getClientId())
                .deadLetteredAt(clock.instant())
                .build();
    }
}
