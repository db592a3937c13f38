package net.terminus.Kafka.Transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.ByteBufferSerializer;
import org.apache.kafka.common.serialization.BytesSerializer;
import org.apache.kafka.common.serialization.IntegerSerializer;
import org.apache.kafka.common.serialization.LongSerializer;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.apache.kafka.common.serialization.UUIDSerializer;
import org.apache.kafka.common.utils.Bytes;
import org.springframework.kafka.support.serializer.DelegatingByTypeSerializer;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Serializers for republished and dead-lettered records. Keys and values go
 * out in the form the consumer received them: raw bytes and strings are
 * written unchanged, numbers and UUIDs with Kafka's own serializers, and
 * anything else as JSON.
 */
public final class RecordSerializers {

    private RecordSerializers() {
    }

    public static Serializer<Object> keySerializer(ObjectMapper objectMapper) {
        return new DelegatingByTypeSerializer(passThrough(new JsonSerializer<>(objectMapper).noTypeInfo()), true);
    }

    /**
     * JSON values carry type headers so a {@code JsonDeserializer} on the
     * receiving topic can restore them.
     */
    public static Serializer<Object> valueSerializer(ObjectMapper objectMapper) {
        JsonSerializer<Object> json = new JsonSerializer<>(objectMapper);
        json.setAddTypeInfo(true);
        return new DelegatingByTypeSerializer(passThrough(json), true);
    }

    // most specific types first, Object must stay last
    private static Map<Class<?>, Serializer<?>> passThrough(JsonSerializer<Object> fallback) {
        Map<Class<?>, Serializer<?>> delegates = new LinkedHashMap<>();
        delegates.put(byte[].class, new ByteArraySerializer());
        delegates.put(Bytes.class, new BytesSerializer());
        delegates.put(ByteBuffer.class, new ByteBufferSerializer());
        delegates.put(String.class, new StringSerializer());
        delegates.put(Long.class, new LongSerializer());
        delegates.put(Integer.class, new IntegerSerializer());
        delegates.put(UUID.class, new UUIDSerializer());
        delegates.put(Object.class, fallback);
        return delegates;
    }
}
