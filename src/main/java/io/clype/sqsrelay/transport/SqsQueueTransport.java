package io.clype.sqsrelay.transport;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.sqsrelay.model.OutboundMessage;
import io.clype.sqsrelay.model.QueueNotFoundException;
import io.clype.sqsrelay.model.ReceivedMessage;

import reactor.core.publisher.Mono;

import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.DeleteQueueRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SetQueueAttributesRequest;

/**
 * {@link QueueTransport} backed by the AWS SQS async client.
 *
 * <p>The client is owned by this transport and closed with it.</p>
 */
public class SqsQueueTransport implements QueueTransport {

    private static final Logger log = LoggerFactory.getLogger(SqsQueueTransport.class);

    private static final String ALL_ATTRIBUTES = "All";
    private static final String STRING_DATA_TYPE = "String";

    private final SqsAsyncClient sqsClient;
    private final AtomicBoolean closed = new AtomicBoolean();

    public SqsQueueTransport(SqsAsyncClient sqsClient) {
        this.sqsClient = Objects.requireNonNull(sqsClient, "sqsClient cannot be null");
    }

    @Override
    public Mono<String> createQueue(String queueName, Map<String, String> attributes) {
        CreateQueueRequest request = CreateQueueRequest.builder()
                .queueName(queueName)
                .attributesWithStrings(attributes)
                .build();
        return Mono.fromFuture(() -> sqsClient.createQueue(request))
                .map(response -> TransportResponses.ensureSuccess("CreateQueue", response).queueUrl());
    }

    @Override
    public Mono<Void> deleteQueue(String queueUrl) {
        DeleteQueueRequest request = DeleteQueueRequest.builder().queueUrl(queueUrl).build();
        return Mono.fromFuture(() -> sqsClient.deleteQueue(request))
                .doOnNext(response -> TransportResponses.ensureSuccess("DeleteQueue", response))
                .then();
    }

    @Override
    public Mono<String> getQueueUrl(String queueName) {
        GetQueueUrlRequest request = GetQueueUrlRequest.builder().queueName(queueName).build();
        return Mono.fromFuture(() -> sqsClient.getQueueUrl(request))
                .map(response -> TransportResponses.ensureSuccess("GetQueueUrl", response).queueUrl())
                .onErrorMap(QueueDoesNotExistException.class, e -> new QueueNotFoundException(queueName, e));
    }

    @Override
    public Mono<Map<String, String>> getQueueAttributes(String queueUrl, List<String> attributeNames) {
        GetQueueAttributesRequest request = GetQueueAttributesRequest.builder()
                .queueUrl(queueUrl)
                .attributeNamesWithStrings(attributeNames)
                .build();
        return Mono.fromFuture(() -> sqsClient.getQueueAttributes(request))
                .map(response -> TransportResponses.ensureSuccess("GetQueueAttributes", response)
                        .attributesAsStrings());
    }

    @Override
    public Mono<Void> setQueueAttributes(String queueUrl, Map<String, String> attributes) {
        SetQueueAttributesRequest request = SetQueueAttributesRequest.builder()
                .queueUrl(queueUrl)
                .attributesWithStrings(attributes)
                .build();
        return Mono.fromFuture(() -> sqsClient.setQueueAttributes(request))
                .doOnNext(response -> TransportResponses.ensureSuccess("SetQueueAttributes", response))
                .then();
    }

    @Override
    public Mono<List<ReceivedMessage>> receiveMessages(String queueUrl, int maxMessages, Duration waitTime) {
        ReceiveMessageRequest.Builder builder = ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(maxMessages)
                .messageAttributeNames(ALL_ATTRIBUTES);
        if (waitTime != null) {
            builder.waitTimeSeconds((int) waitTime.toSeconds());
        }
        ReceiveMessageRequest request = builder.build();

        return Mono.fromFuture(() -> sqsClient.receiveMessage(request))
                .map(response -> TransportResponses.ensureSuccess("ReceiveMessage", response)
                        .messages().stream()
                        .map(SqsQueueTransport::toReceivedMessage)
                        .toList());
    }

    @Override
    public Mono<Void> deleteMessage(String queueUrl, String receiptHandle) {
        DeleteMessageRequest request = DeleteMessageRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(receiptHandle)
                .build();
        return Mono.fromFuture(() -> sqsClient.deleteMessage(request))
                .doOnNext(response -> TransportResponses.ensureSuccess("DeleteMessage", response))
                .then();
    }

    @Override
    public Mono<String> sendMessage(OutboundMessage message) {
        SendMessageRequest.Builder builder = SendMessageRequest.builder()
                .queueUrl(message.destination())
                .messageBody(message.body());

        if (!message.attributes().isEmpty()) {
            Map<String, MessageAttributeValue> attributes = new LinkedHashMap<>();
            message.attributes().forEach((name, value) -> attributes.put(name, MessageAttributeValue.builder()
                    .dataType(STRING_DATA_TYPE)
                    .stringValue(value)
                    .build()));
            builder.messageAttributes(attributes);
        }
        if (message.isOrdered()) {
            builder.messageGroupId(message.messageGroupId())
                    .messageDeduplicationId(message.messageDeduplicationId());
        }
        SendMessageRequest request = builder.build();

        return Mono.fromFuture(() -> sqsClient.sendMessage(request))
                .map(response -> TransportResponses.ensureSuccess("SendMessage", response).messageId());
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            sqsClient.close();
            log.debug("SQS client closed");
        }
    }

    private static ReceivedMessage toReceivedMessage(Message message) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (message.hasMessageAttributes()) {
            message.messageAttributes().forEach((name, value) -> {
                if (value.stringValue() != null) {
                    attributes.put(name, value.stringValue());
                }
            });
        }
        return new ReceivedMessage(message.messageId(), message.receiptHandle(), message.body(), attributes);
    }
}
