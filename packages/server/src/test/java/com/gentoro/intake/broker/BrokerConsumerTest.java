package com.gentoro.intake.broker;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.gentoro.intake.exception.BrokerException;
import com.gentoro.intake.queue.Job;
import com.gentoro.intake.queue.TaskQueue;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class BrokerConsumerTest {

  private ConnectionFactory factory;
  private Connection connection;
  private Channel channel;
  private TaskQueue queue;
  private BrokerConsumer consumer;
  private Thread runner;
  private final AtomicReference<Throwable> failure = new AtomicReference<>();

  @BeforeEach
  void setUp() throws Exception {
    factory = mock(ConnectionFactory.class);
    connection = mock(Connection.class);
    channel = mock(Channel.class);
    when(factory.newConnection(anyString())).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);
    when(connection.isOpen()).thenReturn(true);
    when(channel.isOpen()).thenReturn(true);
    when(channel.basicConsume(
            anyString(), anyBoolean(), any(DeliverCallback.class), any(CancelCallback.class)))
        .thenReturn("ctag-1");
  }

  @AfterEach
  void tearDown() throws Exception {
    if (consumer != null) consumer.stop();
    if (runner != null) runner.join(5_000);
  }

  private static BrokerSettings settings(boolean requeueOnFull) {
    return new BrokerSettings(
        "localhost", 5672, "/", "guest", "guest", "file_queue", false, true, 10, requeueOnFull,
        1_000, 60);
  }

  private DeliverCallback start(int capacity, boolean requeueOnFull) throws Exception {
    queue = new TaskQueue(capacity);
    consumer = new BrokerConsumer(settings(requeueOnFull), queue, factory);
    runner =
        new Thread(
            () -> {
              try {
                consumer.run();
              } catch (Throwable t) {
                failure.set(t);
              }
            },
            "broker-consumer-test");
    runner.start();

    ArgumentCaptor<DeliverCallback> deliver = ArgumentCaptor.forClass(DeliverCallback.class);
    verify(channel, timeout(2_000))
        .basicConsume(eq("file_queue"), eq(false), deliver.capture(), any(CancelCallback.class));
    return deliver.getValue();
  }

  private static Delivery delivery(long tag, String body) {
    return new Delivery(
        new Envelope(tag, false, "", "file_queue"), null, body.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void declaresQueueAndLimitsPrefetch() throws Exception {
    start(4, false);

    verify(channel).basicQos(10);
    verify(channel).queueDeclare("file_queue", false, false, true, null);
  }

  @Test
  void acknowledgesAfterEnqueue() throws Exception {
    DeliverCallback deliver = start(4, false);

    deliver.handle("ctag-1", delivery(5L, "/data/in/a.zip\n"));

    assertEquals(1, queue.size());
    Job job = queue.dequeue();
    assertEquals("/data/in/a.zip", job.sourcePath());
    assertEquals(5L, job.deliveryTag());
    verify(channel).basicAck(5L, false);
    assertEquals(1, consumer.acceptedCount());
  }

  @Test
  void acceptsJsonEnvelope() throws Exception {
    DeliverCallback deliver = start(4, false);

    deliver.handle("ctag-1", delivery(9L, "{\"file_path\": \"/data/in/x.tar\", \"size\": 12}"));

    assertEquals("/data/in/x.tar", queue.dequeue().sourcePath());
    verify(channel).basicAck(9L, false);
  }

  @Test
  void rejectsWithoutRequeueWhenQueueIsFull() throws Exception {
    DeliverCallback deliver = start(1, false);

    deliver.handle("ctag-1", delivery(1L, "/data/in/1.zip"));
    deliver.handle("ctag-1", delivery(2L, "/data/in/2.zip"));

    verify(channel).basicAck(1L, false);
    verify(channel).basicReject(2L, false);
    verify(channel, never()).basicAck(eq(2L), anyBoolean());
    assertEquals(1, queue.size());
    assertEquals(1, consumer.rejectedCount());
  }

  @Test
  void requeuesOnFullWhenConfigured() throws Exception {
    DeliverCallback deliver = start(1, true);

    deliver.handle("ctag-1", delivery(1L, "/data/in/1.zip"));
    deliver.handle("ctag-1", delivery(2L, "/data/in/2.zip"));

    verify(channel).basicReject(2L, true);
  }

  @Test
  void discardsBlankPayload() throws Exception {
    DeliverCallback deliver = start(4, false);

    deliver.handle("ctag-1", delivery(3L, "   "));

    verify(channel).basicReject(3L, false);
    verify(channel, never()).basicAck(anyLong(), anyBoolean());
    assertEquals(0, queue.size());
  }

  @Test
  void returnsDeliveryWhenQueueIsClosed() throws Exception {
    DeliverCallback deliver = start(4, false);
    queue.close();

    deliver.handle("ctag-1", delivery(4L, "/data/in/late.zip"));

    verify(channel).basicReject(4L, true);
  }

  @Test
  void stopEndsRunCleanly() throws Exception {
    start(4, false);

    consumer.stop();
    runner.join(5_000);

    assertFalse(runner.isAlive());
    assertNull(failure.get());
    verify(channel).basicCancel("ctag-1");
    verify(channel).close();
    verify(connection).close();
  }

  @Test
  void connectFailureIsFatal() throws Exception {
    when(factory.newConnection(anyString())).thenThrow(new ConnectException("Connection refused"));
    BrokerConsumer direct = new BrokerConsumer(settings(false), new TaskQueue(1), factory);

    BrokerException ex = assertThrows(BrokerException.class, direct::run);
    assertTrue(ex.getMessage().contains("localhost:5672"));
  }

  @Test
  void channelSetupFailureIsFatal() throws Exception {
    when(channel.queueDeclare(anyString(), anyBoolean(), anyBoolean(), anyBoolean(), any()))
        .thenThrow(new IOException("PRECONDITION_FAILED - inequivalent arg 'durable'"));
    BrokerConsumer direct = new BrokerConsumer(settings(false), new TaskQueue(1), factory);

    assertThrows(BrokerException.class, direct::run);
    verify(connection).close();
  }

  @Test
  void lostConnectionTerminatesRun() throws Exception {
    start(4, false);
    ArgumentCaptor<ShutdownListener> listener = ArgumentCaptor.forClass(ShutdownListener.class);
    verify(connection).addShutdownListener(listener.capture());

    listener.getValue().shutdownCompleted(new ShutdownSignalException(true, false, null, connection));
    runner.join(5_000);

    assertInstanceOf(BrokerException.class, failure.get());
  }

  @Test
  void brokerCancelTerminatesRun() throws Exception {
    start(4, false);
    ArgumentCaptor<CancelCallback> cancel = ArgumentCaptor.forClass(CancelCallback.class);
    verify(channel).basicConsume(eq("file_queue"), eq(false), any(DeliverCallback.class), cancel.capture());

    cancel.getValue().handle("ctag-1");
    runner.join(5_000);

    assertInstanceOf(BrokerException.class, failure.get());
    assertTrue(failure.get().getMessage().contains("cancelled"));
  }
}
