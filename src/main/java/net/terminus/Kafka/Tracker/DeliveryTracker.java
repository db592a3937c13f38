package net.terminus.Kafka.Tracker;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import net.terminus.Kafka.CustomObject.DeliveryState;
import net.terminus.Kafka.CustomObject.MessageId;
import net.terminus.Kafka.CustomObject.MessageRecord;
import net.terminus.Kafka.Errors.AlreadyFinalizedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Holds one {@link MessageRecord} per in-flight message.
 *
 * All mutations go through {@link #transition}, which runs inside the map's
 * per-key compute: calls for the same message id are serialized, calls for
 * different ids never wait on each other. Callers must not do I/O while a
 * transition is running.
 *
 * Terminal records stay behind as tombstones for {@code finalizedRetention} so
 * duplicate deliveries and late calls observe {@link AlreadyFinalizedException}
 * instead of starting a second finalization.
 */
public class DeliveryTracker {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryTracker.class);

    private final Cache<MessageId, MessageRecord> records;
    private final Clock clock;

    public DeliveryTracker(Duration pendingRetention, Duration finalizedRetention, long maximumSize) {
        this(pendingRetention, finalizedRetention, maximumSize, Clock.systemUTC(), Ticker.systemTicker());
    }

    public DeliveryTracker(Duration pendingRetention,
                    Duration finalizedRetention,
                    long maximumSize,
                    Clock clock,
                    Ticker ticker) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.clock = clock;
        this.records = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new RecordExpiry(pendingRetention, finalizedRetention))
                .ticker(ticker)
                .build();

        logger.info("DeliveryTracker initialized (pending retention: {}, finalized retention: {}, max size: {})",
                pendingRetention, finalizedRetention, maximumSize);
    }

    /**
     * Returns the record for the message, creating a pending one on first access.
     */
    public MessageRecord get(MessageId messageId) {
        return records.get(messageId, id -> MessageRecord.pending(id, clock.instant()));
    }

    /**
     * Returns the record if one is tracked, without creating it.
     */
    public Optional<MessageRecord> peek(MessageId messageId) {
        return Optional.ofNullable(records.getIfPresent(messageId));
    }

    public MessageRecord transition(MessageId messageId, TransitionEvent event) {
        return transition(messageId, event, 0);
    }

    /**
     * Applies an event atomically for this message id.
     *
     * @param messageId             the message
     * @param event                 the event to apply
     * @param observedRedeliveries  broker-reported redelivery count, only read for {@link TransitionEvent#DELIVER}
     * @return the record after the transition
     * @throws AlreadyFinalizedException if the delivery attempt was already resolved
     */
    public MessageRecord transition(MessageId messageId, TransitionEvent event, int observedRedeliveries) {
        MessageRecord updated = records.asMap().compute(messageId, (id, current) -> {
            Instant now = clock.instant();
            MessageRecord record = current != null ? current : MessageRecord.pending(id, now);
            return apply(record, event, observedRedeliveries, now);
        });

        logger.debug("message {} -> {} after {}", messageId, updated.getState(), event);
        return updated;
    }

    /**
     * Picks the event from the current record and applies it under the same
     * per-key lock, so the choice cannot go stale before it is applied.
     * The selector must be side-effect free.
     */
    public MessageRecord transition(MessageId messageId, Function<MessageRecord, TransitionEvent> eventSelector) {
        MessageRecord updated = records.asMap().compute(messageId, (id, current) -> {
            Instant now = clock.instant();
            MessageRecord record = current != null ? current : MessageRecord.pending(id, now);
            return apply(record, eventSelector.apply(record), 0, now);
        });

        logger.debug("message {} -> {}", messageId, updated.getState());
        return updated;
    }

    public void evict(MessageId messageId) {
        records.invalidate(messageId);
        logger.debug("evicted record for message {}", messageId);
    }

    public long size() {
        records.cleanUp();
        return records.estimatedSize();
    }

    private MessageRecord apply(MessageRecord record, TransitionEvent event, int observedRedeliveries, Instant now) {
        DeliveryState state = record.getState();

        return switch (event) {
            case DELIVER -> {
                if (state == DeliveryState.TERMINAL || state == DeliveryState.DEAD_LETTERING) {
                    throw new AlreadyFinalizedException(record.getMessageId(), state, event);
                }
                int count = Math.max(record.getRedeliveryCount(), observedRedeliveries);
                yield record.withRedeliveryCount(count).withState(DeliveryState.PENDING, now);
            }
            case REDELIVER -> {
                requirePending(record, event);
                yield record.withRedeliveryCount(record.getRedeliveryCount() + 1)
                        .withState(DeliveryState.REDELIVERING, now);
            }
            case REDELIVER_FAILED -> {
                // pending here means the record was evicted and recreated meanwhile
                if (state == DeliveryState.PENDING) {
                    yield record;
                }
                requireState(record, event, DeliveryState.REDELIVERING);
                yield record.withRedeliveryCount(Math.max(0, record.getRedeliveryCount() - 1))
                        .withState(DeliveryState.PENDING, now);
            }
            case ROUTE_TO_DLQ -> {
                requirePending(record, event);
                yield record.markDlqEligible().withState(DeliveryState.DEAD_LETTERING, now);
            }
            case ROUTE_FAILED -> {
                if (state == DeliveryState.PENDING) {
                    yield record;
                }
                requireState(record, event, DeliveryState.DEAD_LETTERING);
                yield record.withState(DeliveryState.PENDING, now);
            }
            case DEAD_LETTERED -> {
                if (state == DeliveryState.TERMINAL) {
                    yield record;
                }
                if (state != DeliveryState.DEAD_LETTERING) {
                    logger.warn("message {} was {} when its dlq route completed, finalizing it anyway",
                            record.getMessageId(), state);
                }
                yield record.finalizedBy(event, now);
            }
            case FINALIZE -> {
                requirePending(record, event);
                yield record.finalizedBy(event, now);
            }
        };
    }

    private static void requirePending(MessageRecord record, TransitionEvent event) {
        if (record.getState() != DeliveryState.PENDING) {
            throw new AlreadyFinalizedException(record.getMessageId(), record.getState(), event);
        }
    }

    private static void requireState(MessageRecord record, TransitionEvent event, DeliveryState expected) {
        if (record.getState() != expected) {
            throw new IllegalStateException("cannot apply " + event + " to message " + record.getMessageId()
                    + " in state " + record.getState());
        }
    }

    /**
     * Terminal tombstones and pending records age out on separate clocks.
     */
    private static final class RecordExpiry implements Expiry<MessageId, MessageRecord> {

        private final long pendingNanos;
        private final long finalizedNanos;

        private RecordExpiry(Duration pendingRetention, Duration finalizedRetention) {
            this.pendingNanos = pendingRetention.toNanos();
            this.finalizedNanos = finalizedRetention.toNanos();
        }

        @Override
        public long expireAfterCreate(MessageId key, MessageRecord value, long currentTime) {
            return retentionOf(value);
        }

        @Override
        public long expireAfterUpdate(MessageId key, MessageRecord value, long currentTime, long currentDuration) {
            return retentionOf(value);
        }

        @Override
        public long expireAfterRead(MessageId key, MessageRecord value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long retentionOf(MessageRecord record) {
            return record.getState() == DeliveryState.TERMINAL ? finalizedNanos : pendingNanos;
        }
    }
}
