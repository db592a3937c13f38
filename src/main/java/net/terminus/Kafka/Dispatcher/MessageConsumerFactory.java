package net.terminus.Kafka.Dispatcher;

import net.terminus.Kafka.Config.BackoffCalculator;
import net.terminus.Kafka.Config.TrackerProperties;
import net.terminus.Kafka.Config.DeadLetterProperties;
import net.terminus.Kafka.CustomObject.ConsumerSettings;
import net.terminus.Kafka.DeadLetter.DeadLetterProducer;
import net.terminus.Kafka.DeadLetter.DeadLetterRouter;
import net.terminus.Kafka.Metrics.MetricsRecorder;
import net.terminus.Kafka.Policy.RedeliveryPolicy;
import net.terminus.Kafka.Tracing.TracingService;
import net.terminus.Kafka.Tracker.DeliveryTracker;
import net.terminus.Kafka.Transport.DeliveryTransport;
import net.terminus.Kafka.Transport.KafkaDeliveryTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.TaskScheduler;

/**
 * Wires a {@link MessageConsumer} for one set of consumer settings. Consumers
 * share the scheduler and the producer. Tracker, router and transport are per
 * consumer, so two consumers reading the same topic never see each other's
 * records.
 */
public class MessageConsumerFactory {

    private static final Logger logger = LoggerFactory.getLogger(MessageConsumerFactory.class);

    private final TrackerProperties trackerProperties;
    private final RedeliveryPolicy redeliveryPolicy;
    private final BackoffCalculator backoffCalculator;
    private final DeadLetterProducer deadLetterProducer;
    private final DeadLetterProperties deadLetterProperties;
    private final KafkaTemplate<?, ?> kafkaTemplate;
    private final TaskScheduler redeliveryScheduler;
    private final TracingService tracingService;
    private final MetricsRecorder metricsRecorder;

    public MessageConsumerFactory(TrackerProperties trackerProperties,
                                  RedeliveryPolicy redeliveryPolicy,
                                  BackoffCalculator backoffCalculator,
                                  DeadLetterProducer deadLetterProducer,
                                  DeadLetterProperties deadLetterProperties,
                                  KafkaTemplate<?, ?> kafkaTemplate,
                                  TaskScheduler redeliveryScheduler,
                                  TracingService tracingService,
                                  MetricsRecorder metricsRecorder) {
        this.trackerProperties = trackerProperties;
        this.redeliveryPolicy = redeliveryPolicy;
        this.backoffCalculator = backoffCalculator;
        this.deadLetterProducer = deadLetterProducer;
        this.deadLetterProperties = deadLetterProperties;
        this.kafkaTemplate = kafkaTemplate;
        this.redeliveryScheduler = redeliveryScheduler;
        this.tracingService = tracingService;
        this.metricsRecorder = metricsRecorder;
    }

    public MessageConsumer create(ConsumerSettings settings) {
        DeliveryTracker tracker = new DeliveryTracker(trackerProperties.getPendingRetention(),
                trackerProperties.getFinalizedRetention(), trackerProperties.getMaximumSize());
        DeliveryTransport transport = new KafkaDeliveryTransport(settings, kafkaTemplate, redeliveryScheduler,
                tracingService);
        DeadLetterRouter router = new DeadLetterRouter(settings, deadLetterProducer, transport, backoffCalculator,
                deadLetterProperties, tracingService, metricsRecorder);

        logger.info("created consumer for topic: {} ({})", settings.getTopic(), settings);
        return new AcknowledgmentDispatcher(settings, tracker, redeliveryPolicy, router, transport,
                backoffCalculator, metricsRecorder);
    }
}
