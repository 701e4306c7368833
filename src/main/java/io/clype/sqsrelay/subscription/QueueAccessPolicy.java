package io.clype.sqsrelay.subscription;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.clype.sqsrelay.codec.MessageCodec;

/**
 * Builds the queue {@code Policy} attribute that lets a topic deliver into a queue.
 *
 * <p>The granting statement allows {@code sqs:SendMessage} on the queue for the topic service
 * principal, restricted to messages whose {@code aws:SourceArn} is the topic. It is appended to
 * whatever statements the queue policy already holds and is not added twice.</p>
 */
public class QueueAccessPolicy {

    static final String POLICY_VERSION = "2012-10-17";
    static final String TOPIC_SERVICE_PRINCIPAL = "sns.amazonaws.com";
    static final String SEND_MESSAGE_ACTION = "sqs:SendMessage";
    static final String SOURCE_ARN_CONDITION_KEY = "aws:SourceArn";

    private final MessageCodec codec;

    public QueueAccessPolicy(MessageCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    }

    /**
     * Merges a statement granting {@code topicArn} send access to {@code queueArn} into an
     * existing policy document.
     *
     * @param existingPolicy the queue's current policy JSON, or null/blank when it has none
     * @return the merged policy JSON, or {@code null} when the grant is already present
     */
    public String grantTopicAccess(String existingPolicy, String queueArn, String topicArn) {
        Objects.requireNonNull(queueArn, "queueArn cannot be null");
        Objects.requireNonNull(topicArn, "topicArn cannot be null");

        ObjectNode policy = parseOrCreate(existingPolicy);
        ArrayNode statements = statements(policy);
        for (JsonNode statement : statements) {
            if (grants(statement, queueArn, topicArn)) {
                return null;
            }
        }
        statements.add(statement(queueArn, topicArn));
        return codec.toJson(policy);
    }

    private ObjectNode parseOrCreate(String existingPolicy) {
        if (existingPolicy != null && !existingPolicy.isBlank()) {
            JsonNode parsed = codec.readTree(existingPolicy);
            if (parsed instanceof ObjectNode) {
                return (ObjectNode) parsed;
            }
        }
        ObjectNode policy = codec.getObjectMapper().createObjectNode();
        policy.put("Version", POLICY_VERSION);
        return policy;
    }

    private ArrayNode statements(ObjectNode policy) {
        JsonNode current = policy.get("Statement");
        if (current instanceof ArrayNode) {
            return (ArrayNode) current;
        }
        ArrayNode statements = policy.putArray("Statement");
        // a single statement may be written as an object
        if (current instanceof ObjectNode) {
            statements.add(current);
        }
        return statements;
    }

    private ObjectNode statement(String queueArn, String topicArn) {
        ObjectNode statement = codec.getObjectMapper().createObjectNode();
        statement.put("Sid", "topic-" + Integer.toHexString(topicArn.hashCode()));
        statement.put("Effect", "Allow");
        statement.putObject("Principal").put("Service", TOPIC_SERVICE_PRINCIPAL);
        statement.put("Action", SEND_MESSAGE_ACTION);
        statement.put("Resource", queueArn);
        statement.putObject("Condition").putObject("ArnEquals").put(SOURCE_ARN_CONDITION_KEY, topicArn);
        return statement;
    }

    private static boolean grants(JsonNode statement, String queueArn, String topicArn) {
        if (!"Allow".equals(statement.path("Effect").asText())) {
            return false;
        }
        if (!queueArn.equals(statement.path("Resource").asText())) {
            return false;
        }
        JsonNode condition = statement.path("Condition");
        String sourceArn = condition.path("ArnEquals").path(SOURCE_ARN_CONDITION_KEY).asText(
                condition.path("ArnLike").path(SOURCE_ARN_CONDITION_KEY).asText());
        return topicArn.equals(sourceArn);
    }
}
