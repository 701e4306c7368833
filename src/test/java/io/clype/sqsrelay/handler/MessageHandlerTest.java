package io.clype.sqsrelay.handler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.clype.sqsrelay.model.DeliveryContext;
import io.clype.sqsrelay.model.TopicMultiRoute;
import io.clype.sqsrelay.model.TopicRoute;

import static org.assertj.core.api.Assertions.assertThat;

class MessageHandlerTest {

    private final DeliveryContext single = DeliveryContext.of(TopicRoute.of("orders", "created"))
            .withAttributes(Map.of("tenant", "acme"));
    private final DeliveryContext multi = DeliveryContext.of(TopicMultiRoute.of("orders", List.of("created", "paid")))
            .withAttributes(Map.of("tenant", "acme"));

    @Test
    void singleKeyHandlerReceivesRoutingKeyAndAttributes() {
        List<Object> seen = new ArrayList<>();
        MessageHandler.SingleKey<String> handler = (payload, key, attributes) -> {
            seen.add(payload);
            seen.add(key);
            seen.add(attributes);
            return true;
        };

        assertThat(handler.dispatch("p", single)).isTrue();
        assertThat(seen).containsExactly("p", "created", Map.of("tenant", "acme"));
    }

    @Test
    void multiKeyHandlerReceivesKeyList() {
        List<Object> seen = new ArrayList<>();
        MessageHandler.MultiKey<String> handler = (payload, keys, attributes) -> seen.add(keys);

        assertThat(handler.dispatch("p", multi)).isTrue();
        assertThat(seen).containsExactly(List.of("created", "paid"));
    }

    @Test
    void originTopicHandlersReceiveTopic() {
        List<Object> seen = new ArrayList<>();
        MessageHandler.SingleKeyWithOriginTopic<String> singleHandler = (payload, topic, key, attributes) -> {
            seen.add(topic + "/" + key);
            return false;
        };
        MessageHandler.MultiKeyWithOriginTopic<String> multiHandler = (payload, topic, keys, attributes) -> {
            seen.add(topic + "/" + keys);
            return true;
        };

        assertThat(singleHandler.dispatch("p", single)).isFalse();
        assertThat(multiHandler.dispatch("p", multi)).isTrue();
        assertThat(seen).containsExactly("orders/created", "orders/[created, paid]");
    }

    @Test
    void directDeliveryHasNoTopicOrKey() {
        List<Object> seen = new ArrayList<>();
        MessageHandler.SingleKey<String> handler = (payload, key, attributes) -> seen.add(String.valueOf(key));

        handler.dispatch("p", DeliveryContext.direct());

        assertThat(seen).containsExactly("null");
    }
}
