package net.terminus.Kafka.Config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import net.terminus.Kafka.DeadLetter.DeadLetterProducer;
import net.terminus.Kafka.DeadLetter.KafkaDeadLetterProducer;
import net.terminus.Kafka.Dispatcher.MessageConsumerFactory;
import net.terminus.Kafka.Dispatcher.MessageConsumerRegistry;
import net.terminus.Kafka.Metrics.MetricsRecorder;
import net.terminus.Kafka.Metrics.MicrometerMetricsRecorder;
import net.terminus.Kafka.Metrics.NoOpMetricsRecorder;
import net.terminus.Kafka.Policy.RedeliveryPolicy;
import net.terminus.Kafka.Tracing.NoOpTracingService;
import net.terminus.Kafka.Tracing.OpenTelemetryTracingService;
import net.terminus.Kafka.Tracing.TracingService;
import net.terminus.Kafka.Transport.RecordSerializers;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.HashMap;
import java.util.Map;

/**
 * Auto-configuration for the terminus library.
 * Provides default beans that users can override if needed.
 *
 * Can be disabled by setting: terminus.kafka.auto-config.enabled=false
 */
@AutoConfiguration(after = KafkaAutoConfiguration.class)
@EnableConfigurationProperties({TerminusKafkaProperties.class, TrackerProperties.class, DeadLetterProperties.class})
@ConditionalOnProperty(
        prefix = "terminus.kafka.auto-config",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class TerminusKafkaAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(TerminusKafkaAutoConfiguration.class);

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Bean
    @ConditionalOnMissingBean
    public RedeliveryPolicy redeliveryPolicy() {
        return new RedeliveryPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator();
    }

    /**
     * OpenTelemetry spans when tracing is enabled; the application's OpenTelemetry
     * bean is preferred over the global instance.
     */
    @Bean
    @ConditionalOnMissingBean
    public TracingService terminusTracingService(TerminusKafkaProperties properties,
                                                 ObjectProvider<OpenTelemetry> openTelemetry) {
        if (!properties.isTracingEnabled()) {
            return new NoOpTracingService();
        }
        logger.info("tracing enabled for terminus kafka consumers");
        return new OpenTelemetryTracingService(openTelemetry.getIfAvailable(GlobalOpenTelemetry::get));
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRecorder terminusMetricsRecorder(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            logger.info("no MeterRegistry found, consumer metrics are disabled");
            return new NoOpMetricsRecorder();
        }
        return new MicrometerMetricsRecorder(registry);
    }

    /**
     * ObjectMapper for dead-letter envelopes and redelivered values.
     */
    @Bean(name = "terminusObjectMapper")
    @ConditionalOnMissingBean(name = "terminusObjectMapper")
    public ObjectMapper terminusObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    /**
     * KafkaTemplate used for redelivery republishing and dead-letter produces.
     * Keys and values keep the type they were consumed with.
     */
    @Bean(name = "terminusKafkaTemplate")
    @ConditionalOnMissingBean(name = "terminusKafkaTemplate")
    public KafkaTemplate<Object, Object> terminusKafkaTemplate(
            @Qualifier("terminusObjectMapper") ObjectMapper terminusObjectMapper) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");

        DefaultKafkaProducerFactory<Object, Object> factory = new DefaultKafkaProducerFactory<>(props,
                RecordSerializers.keySerializer(terminusObjectMapper),
                RecordSerializers.valueSerializer(terminusObjectMapper));

        return new KafkaTemplate<>(factory);
    }

    /*
     * TaskScheduler for delayed redeliveries
     */
    @Bean(name = "terminusRedeliveryScheduler")
    @ConditionalOnMissingBean(name = "terminusRedeliveryScheduler")
    public TaskScheduler terminusRedeliveryScheduler(TerminusKafkaProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("terminus-redelivery-");
        // pending redeliveries are not awaited, their source records stay unacked and come back after a restart
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(1);
        scheduler.setErrorHandler(t ->
                LoggerFactory.getLogger("terminus-redelivery-scheduler")
                        .error("scheduler error: {}", t.getMessage(), t)
        );
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterProducer deadLetterProducer(@Qualifier("terminusKafkaTemplate") KafkaTemplate<?, ?> terminusKafkaTemplate,
                                                 TracingService tracingService) {
        return new KafkaDeadLetterProducer(terminusKafkaTemplate, tracingService);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageConsumerFactory messageConsumerFactory(TrackerProperties trackerProperties,
                                                         RedeliveryPolicy redeliveryPolicy,
                                                         BackoffCalculator backoffCalculator,
                                                         DeadLetterProducer deadLetterProducer,
                                                         DeadLetterProperties deadLetterProperties,
                                                         @Qualifier("terminusKafkaTemplate") KafkaTemplate<?, ?> terminusKafkaTemplate,
                                                         @Qualifier("terminusRedeliveryScheduler") TaskScheduler terminusRedeliveryScheduler,
                                                         TracingService tracingService,
                                                         MetricsRecorder metricsRecorder) {
        return new MessageConsumerFactory(trackerProperties, redeliveryPolicy, backoffCalculator,
                deadLetterProducer, deadLetterProperties, terminusKafkaTemplate, terminusRedeliveryScheduler,
                tracingService, metricsRecorder);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageConsumerRegistry messageConsumerRegistry(MessageConsumerFactory messageConsumerFactory,
                                                           TerminusKafkaProperties properties) {
        return new MessageConsumerRegistry(messageConsumerFactory, properties);
    }
}
