package com.whereq.orbit.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The connection factory is never started; only the serialization setup is checked
 */
@DisplayName("RedisConfig Tests")
class RedisConfigTest {

    private final ReactiveRedisTemplate<String, String> template =
        new RedisConfig().reactiveRedisTemplate(new LettuceConnectionFactory());

    @Test
    @DisplayName("Resource documents are stored as the JSON text the store wrote")
    void testDocumentsStoredVerbatim() {
        RedisSerializationContext<String, String> context = template.getSerializationContext();
        String document = "{\"id\":\"res-1\",\"status\":{\"phase\":\"RUNNING\"}}";

        ByteBuffer written = context.getValueSerializationPair().write(document);

        assertEquals(document, StandardCharsets.UTF_8.decode(written).toString());
    }

    @Test
    @DisplayName("Keys and name-hash entries are plain UTF-8 strings")
    void testKeysAndHashEntries() {
        RedisSerializationContext<String, String> context = template.getSerializationContext();

        assertEquals("orbit:resource:res-1",
            StandardCharsets.UTF_8.decode(context.getKeySerializationPair().write("orbit:resource:res-1")).toString());
        assertEquals("default/trainer", context.getHashKeySerializationPair()
            .read(ByteBuffer.wrap("default/trainer".getBytes(StandardCharsets.UTF_8))));
        assertEquals("res-1", context.getHashValueSerializationPair()
            .read(ByteBuffer.wrap("res-1".getBytes(StandardCharsets.UTF_8))));
    }
}
