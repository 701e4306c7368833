package io.clype.sqsrelay.codec;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.clype.sqsrelay.model.DecodedEnvelope;
import io.clype.sqsrelay.model.RedrivePolicy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    record Dummy(String property1, int count) {}

    @Test
    void typedPayloadSurvivesEncoding() {
        Dummy original = new Dummy("x", 3);

        String json = codec.encodeTyped(original);

        assertEquals(original, codec.decodeTyped(json, Dummy.class));
    }

    @Test
    void unknownPropertiesAreIgnored() {
        Dummy decoded = codec.decodeTyped("{\"property1\":\"x\",\"count\":1,\"extra\":true}", Dummy.class);

        assertEquals(new Dummy("x", 1), decoded);
    }

    @Test
    void invalidJsonFailsWithCodecException() {
        assertThrows(CodecException.class, () -> codec.decodeTyped("not json", Dummy.class));
    }

    @Test
    void rawTextSurvivesEncodingIncludingUnicode() {
        for (String text : new String[] {"hello", "", "päyload ✓ with\nnewline", "{\"json\":1}"}) {
            assertEquals(text, codec.decodeRaw(codec.encodeRaw(text)));
        }
    }

    @Test
    void rawEncodingIsBase64() {
        assertEquals("aGVsbG8=", codec.encodeRaw("hello"));
    }

    @Test
    void textThatIsNotBase64PassesThroughUnchanged() {
        assertEquals("hello world", codec.decodeRaw("hello world"));
        assertEquals("abc", codec.decodeRaw("abc"));
        assertEquals("a=bc", codec.decodeRaw("a=bc"));
    }

    @Test
    void detectsBase64Syntax() {
        assertThat(MessageCodec.isBase64("aGVsbG8=")).isTrue();
        assertThat(MessageCodec.isBase64("")).isTrue();
        assertThat(MessageCodec.isBase64("aGVsbG8")).isFalse();
        assertThat(MessageCodec.isBase64("aGV$bG8=")).isFalse();
        assertThat(MessageCodec.isBase64(null)).isFalse();
    }

    @Test
    void unwrapsTopicNotificationAndReadsAttributes() {
        String body = "{\"Type\":\"Notification\",\"MessageId\":\"m-1\",\"TopicArn\":\"arn:t\","
                + "\"Message\":\"{\\\"property1\\\":\\\"x\\\",\\\"count\\\":2}\","
                + "\"MessageAttributes\":{\"routingKey\":{\"Type\":\"String\",\"Value\":\"k\"},"
                + "\"tenant\":{\"Type\":\"String\",\"Value\":\"acme\"}}}";

        DecodedEnvelope envelope = codec.decodeEnvelope(body, true);

        assertEquals(new Dummy("x", 2), codec.decodeTyped(envelope.payload(), Dummy.class));
        assertEquals(Map.of("routingKey", "k", "tenant", "acme"), envelope.attributes());
    }

    @Test
    void missingNotificationMessageFails() {
        assertThrows(CodecException.class, () -> codec.decodeEnvelope("{\"Type\":\"Notification\"}", true));
        assertThrows(CodecException.class, () -> codec.decodeEnvelope("aGVsbG8=", true));
    }

    @Test
    void directBodyIsItsOwnPayload() {
        DecodedEnvelope envelope = codec.decodeEnvelope("aGVsbG8=", false);

        assertEquals("aGVsbG8=", envelope.payload());
        assertThat(envelope.attributes()).isEmpty();
    }

    @Test
    void directJsonBodyWithoutAttributesHasNone() {
        DecodedEnvelope envelope = codec.decodeEnvelope("{\"property1\":\"x\"}", false);

        assertThat(envelope.attributes()).isEmpty();
    }

    @Test
    void redrivePolicyUsesTransportShape() {
        assertEquals("{\"maxReceiveCount\":\"3\",\"deadLetterTargetArn\":\"arn:aws:sqs:r:1:q-dl\"}",
                codec.toJson(RedrivePolicy.forDeadLetterQueue("arn:aws:sqs:r:1:q-dl")));
    }

    @Test
    void payloadReadersDecode() {
        assertEquals("hello", PayloadReader.raw(codec).read("aGVsbG8="));
        assertEquals(new Dummy("y", 0), PayloadReader.typed(codec, Dummy.class).read("{\"property1\":\"y\"}"));
    }
}
