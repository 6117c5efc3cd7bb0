package com.scoutim.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

public class JacksonConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(JacksonConfig.class);

    @Test
    void idLongFieldsSerializedAsStringButCountsRemainNumber() {
        contextRunner.run(ctx -> {
            ObjectMapper objectMapper = ctx.getBean(ObjectMapper.class);

            String json = objectMapper.writeValueAsString(
                    new Payload(123L, 2004874454540382209L, 9007199254740992L, 3L, 1_700_000_000_000L));
            JsonNode node = objectMapper.readTree(json);

            assertThat(node.get("id").isTextual()).isTrue();
            assertThat(node.get("threadId").isTextual()).isTrue();
            assertThat(node.get("threadId").asText()).isEqualTo("2004874454540382209");
            assertThat(node.get("counterpartId").isTextual()).isTrue();
            assertThat(node.get("unreadCount").isNumber()).isTrue();
            assertThat(node.get("ts").isNumber()).isTrue();
        });
    }

    @Test
    void isIdFieldName_MatchesIdSuffixes() {
        assertThat(IdLongJsonSerializer.isIdFieldName("id")).isTrue();
        assertThat(IdLongJsonSerializer.isIdFieldName("senderId")).isTrue();
        assertThat(IdLongJsonSerializer.isIdFieldName("thread_id")).isTrue();
        assertThat(IdLongJsonSerializer.isIdFieldName("paid")).isFalse();
        assertThat(IdLongJsonSerializer.isIdFieldName("unreadCount")).isFalse();
    }

    record Payload(long id, long threadId, Long counterpartId, long unreadCount, long ts) {
    }
}
