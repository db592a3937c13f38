package net.terminus.Kafka.Policy;

import net.terminus.Kafka.CustomObject.DLQPolicy;
import net.terminus.Kafka.CustomObject.MessageRecord;
import org.springframework.lang.Nullable;

/**
 * Decides what a nack does. Holds no state: the answer depends only on the
 * record's redelivery count and the consumer's dead-letter policy.
 *
 * Without a dead-letter topic there is nowhere to send an exhausted message,
 * so the maximum is advisory and every nack redelivers.
 */
public class RedeliveryPolicy {

    public RedeliveryDecision decide(MessageRecord record, @Nullable DLQPolicy policy) {
        if (policy == null || !policy.hasDeadLetterTopic() || policy.isUnbounded()) {
            return RedeliveryDecision.REDELIVER;
        }
        return record.getRedeliveryCount() + 1 > policy.getMaxRedeliveries()
                ? RedeliveryDecision.ROUTE_TO_DLQ
                : RedeliveryDecision.REDELIVER;
    }
}
