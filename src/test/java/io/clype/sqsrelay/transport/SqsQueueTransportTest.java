package io.clype.sqsrelay.transport;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.clype.sqsrelay.model.OutboundMessage;
import io.clype.sqsrelay.model.QueueNotFoundException;
import io.clype.sqsrelay.model.ReceivedMessage;
import io.clype.sqsrelay.model.TransportException;

import reactor.test.StepVerifier;

import software.amazon.awssdk.http.SdkHttpResponse;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;
import software.amazon.awssdk.services.sqs.model.CreateQueueResponse;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SqsQueueTransportTest {

    private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123456789012/orders";

    private SqsAsyncClient sqsClient;
    private SqsQueueTransport transport;

    @BeforeEach
    void setUp() {
        sqsClient = mock(SqsAsyncClient.class);
        transport = new SqsQueueTransport(sqsClient);
    }

    @Test
    void createQueuePassesAttributesAndReturnsUrl() {
        when(sqsClient.createQueue(any(CreateQueueRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(CreateQueueResponse.builder().queueUrl(QUEUE_URL).build()));

        StepVerifier.create(transport.createQueue("orders.fifo", Map.of("FifoQueue", "true")))
            .expectNext(QUEUE_URL)
            .verifyComplete();

        ArgumentCaptor<CreateQueueRequest> captor = ArgumentCaptor.forClass(CreateQueueRequest.class);
        verify(sqsClient).createQueue(captor.capture());
        assertEquals("orders.fifo", captor.getValue().queueName());
        assertEquals(Map.of("FifoQueue", "true"), captor.getValue().attributesAsStrings());
    }

    @Test
    void errorStatusBecomesTransportException() {
        CreateQueueResponse failed = (CreateQueueResponse) CreateQueueResponse.builder()
            .queueUrl(QUEUE_URL)
            .sdkHttpResponse(SdkHttpResponse.builder().statusCode(500).build())
            .build();
        when(sqsClient.createQueue(any(CreateQueueRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(failed));

        StepVerifier.create(transport.createQueue("orders", Map.of()))
            .expectErrorSatisfies(e -> {
                assertThat(e).isInstanceOf(TransportException.class);
                assertEquals(500, ((TransportException) e).getStatusCode());
            })
            .verify();
    }

    @Test
    void missingQueueBecomesQueueNotFound() {
        when(sqsClient.getQueueUrl(any(GetQueueUrlRequest.class)))
            .thenReturn(CompletableFuture.failedFuture(QueueDoesNotExistException.builder().message("nope").build()));

        StepVerifier.create(transport.getQueueUrl("orders"))
            .expectErrorSatisfies(e -> {
                assertThat(e).isInstanceOf(QueueNotFoundException.class);
                assertEquals("orders", ((QueueNotFoundException) e).getQueueName());
            })
            .verify();
    }

    @Test
    void receiveRequestsAllAttributesAndMapsMessages() {
        Message message = Message.builder()
            .messageId("m-1")
            .receiptHandle("r-1")
            .body("{}")
            .messageAttributes(Map.of(
                "routingKey", MessageAttributeValue.builder().dataType("String").stringValue("created").build(),
                "blob", MessageAttributeValue.builder().dataType("Binary").build()))
            .build();
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(ReceiveMessageResponse.builder().messages(message).build()));

        List<ReceivedMessage> received = transport.receiveMessages(QUEUE_URL, 10, Duration.ofSeconds(10)).block();

        assertThat(received).containsExactly(
            new ReceivedMessage("m-1", "r-1", "{}", Map.of("routingKey", "created")));

        ArgumentCaptor<ReceiveMessageRequest> captor = ArgumentCaptor.forClass(ReceiveMessageRequest.class);
        verify(sqsClient).receiveMessage(captor.capture());
        assertEquals(10, captor.getValue().maxNumberOfMessages());
        assertEquals(10, captor.getValue().waitTimeSeconds());
        assertEquals(List.of("All"), captor.getValue().messageAttributeNames());
    }

    @Test
    void receiveWithoutWaitTimeOmitsLongPoll() {
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(ReceiveMessageResponse.builder().build()));

        StepVerifier.create(transport.receiveMessages(QUEUE_URL, 1, null))
            .expectNext(List.of())
            .verifyComplete();

        ArgumentCaptor<ReceiveMessageRequest> captor = ArgumentCaptor.forClass(ReceiveMessageRequest.class);
        verify(sqsClient).receiveMessage(captor.capture());
        assertNull(captor.getValue().waitTimeSeconds());
    }

    @Test
    void orderedSendCarriesGroupAndDeduplicationIds() {
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(SendMessageResponse.builder().messageId("id-1").build()));

        OutboundMessage message = new OutboundMessage(QUEUE_URL, "body", Map.of("routingKey", "k"), "group-1", "dedup-1");
        StepVerifier.create(transport.sendMessage(message))
            .expectNext("id-1")
            .verifyComplete();

        ArgumentCaptor<SendMessageRequest> captor = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsClient).sendMessage(captor.capture());
        SendMessageRequest request = captor.getValue();
        assertEquals("group-1", request.messageGroupId());
        assertEquals("dedup-1", request.messageDeduplicationId());
        assertEquals("String", request.messageAttributes().get("routingKey").dataType());
        assertEquals("k", request.messageAttributes().get("routingKey").stringValue());
    }

    @Test
    void standardSendOmitsFifoFieldsAndEmptyAttributes() {
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(SendMessageResponse.builder().messageId("id-2").build()));

        transport.sendMessage(OutboundMessage.standard(QUEUE_URL, "body", Map.of())).block();

        ArgumentCaptor<SendMessageRequest> captor = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsClient).sendMessage(captor.capture());
        assertNull(captor.getValue().messageGroupId());
        assertFalse(captor.getValue().hasMessageAttributes());
    }

    @Test
    void closeIsIdempotent() {
        transport.close();
        transport.close();

        verify(sqsClient, times(1)).close();
    }
}
