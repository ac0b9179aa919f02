// Copyright (c) 2025 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// This software, the RabbitMQ Buffered Producer Java client library, is dual-licensed under the
// Mozilla Public License 2.0 ("MPL"), and the Apache License version 2 ("ASL").
// For the MPL, please see LICENSE-MPL-RabbitMQ. For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.buffered.impl;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.buffered.BackOffDelayPolicy;
import com.rabbitmq.buffered.BufferedProducer;
import com.rabbitmq.buffered.Constants;
import com.rabbitmq.buffered.DeliveryFailedException;
import com.rabbitmq.buffered.DeliveryFailedException.FailedMessage;
import com.rabbitmq.buffered.DeliveryReport;
import com.rabbitmq.buffered.Message;
import com.rabbitmq.buffered.OutboundMessage;
import com.rabbitmq.buffered.ProducerException;
import com.rabbitmq.buffered.metrics.MicrometerMetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.HashSet;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class DefaultBufferedProducerTest {

  ScriptedTransport transport;

  @BeforeEach
  void init() {
    transport = new ScriptedTransport();
  }

  DefaultBufferedProducer producer() {
    return (DefaultBufferedProducer) BufferedProducer.builder().transportFactory(transport).build();
  }

  static byte[] b(String value) {
    return value.getBytes(UTF_8);
  }

  @Test
  void addMessageShouldOnlyBuffer() {
    DefaultBufferedProducer producer = producer();
    producer.addMessage("t", b("key"), b("payload"));
    producer.addMessage("t", 2, null, b("payload"));
    assertThat(producer.pendingMessageCount()).isEqualTo(2);
    assertThat(transport.submitCalls).isZero();
    assertThat(transport.pollCalls).isZero();
  }

  @Test
  void flushShouldReturnOnceAllMessagesAreAcknowledged() {
    DefaultBufferedProducer producer = producer();
    producer.addMessage("t", null, b("one"));
    producer.addMessage("t", null, b("two"));
    producer.addMessage("t", null, b("three"));

    producer.flush();

    assertThat(producer.pendingMessageCount()).isZero();
    assertThat(transport.submitted).hasSize(3);
    assertThat(transport.submitted)
        .extracting(OutboundMessage::getCorrelationId)
        .containsExactly(0L, 1L, 2L);
    assertThat(transport.submitted)
        .extracting(m -> new String(m.getPayload(), UTF_8))
        .containsExactly("one", "two", "three");
    assertThat(transport.acknowledged).containsExactly(0L, 1L, 2L);
    assertThat(transport.pollCalls).isEqualTo(1);
  }

  @Test
  void outboundMessageShouldCarryMessageFields() {
    DefaultBufferedProducer producer = producer();
    byte[] key = b("key");
    byte[] payload = b("payload");
    producer.addMessage(producer.messageBuilder("t").partition(3).key(key).payload(payload).build());

    producer.flush();

    OutboundMessage outboundMessage = transport.submitted.get(0);
    assertThat(outboundMessage.getTopic().getName()).isEqualTo("t");
    assertThat(outboundMessage.getPartition()).isEqualTo(3);
    assertThat(outboundMessage.getKey()).isEqualTo(key).isNotSameAs(key);
    assertThat(outboundMessage.getPayload()).isEqualTo(payload).isNotSameAs(payload);
  }

  @Test
  void changesToCallerArraysAfterAddMessageShouldNotBeSubmitted() {
    transport.deliveryOutcomes(Constants.RESPONSE_CODE_MESSAGE_TIMED_OUT);
    DefaultBufferedProducer producer = producer();
    byte[] key = b("key");
    byte[] payload = b("hello");
    producer.addMessage("t", key, payload);
    key[0] = 'X';
    payload[0] = 'J';

    producer.flush();

    assertThat(transport.submitted).hasSize(2);
    assertThat(transport.submitted)
        .extracting(m -> new String(m.getKey(), UTF_8))
        .containsExactly("key", "key");
    assertThat(transport.submitted)
        .extracting(m -> new String(m.getPayload(), UTF_8))
        .containsExactly("hello", "hello");
  }

  @Test
  void flushOnEmptyBufferShouldNotCallTransport() {
    DefaultBufferedProducer producer = producer();
    producer.flush();
    assertThat(transport.submitCalls).isZero();
    assertThat(transport.pollCalls).isZero();

    producer.addMessage("t", null, b("hello"));
    producer.flush();
    int submitCalls = transport.submitCalls;
    int pollCalls = transport.pollCalls;
    producer.flush();
    assertThat(transport.submitCalls).isEqualTo(submitCalls);
    assertThat(transport.pollCalls).isEqualTo(pollCalls);
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3, 10})
  void queueFullShouldBeRetriedTransparently(int queueFullCount) {
    short[] outcomes = new short[queueFullCount];
    for (int i = 0; i < queueFullCount; i++) {
      outcomes[i] = Constants.CODE_QUEUE_FULL;
    }
    transport.submitOutcomes(outcomes);
    DefaultBufferedProducer producer = producer();
    producer.addMessage("t", null, b("hello"));

    producer.flush();

    assertThat(transport.submitCalls).isEqualTo(queueFullCount + 1);
    assertThat(transport.submitted).hasSize(1);
    assertThat(transport.acknowledged).containsExactly(0L);
    // one poll per full queue, then one to get the delivery report
    assertThat(transport.pollCalls).isEqualTo(queueFullCount + 1);
    assertThat(producer.pendingMessageCount()).isZero();
  }

  @Test
  void deliveryErrorShouldResubmitSameContentWithSameCorrelationId() {
    transport.deliveryOutcomes(Constants.RESPONSE_CODE_NOT_LEADER_FOR_PARTITION);
    DefaultBufferedProducer producer = producer();
    byte[] payload = b("hello");
    producer.addMessage("t", b("key"), payload);

    producer.flush();

    assertThat(transport.submitted).hasSize(2);
    assertThat(transport.submitted)
        .extracting(OutboundMessage::getCorrelationId)
        .containsExactly(0L, 0L);
    assertThat(transport.submitted.get(1).getPayload())
        .isEqualTo(payload)
        .isSameAs(transport.submitted.get(0).getPayload());
    assertThat(transport.submitted.get(1).getTopic())
        .isSameAs(transport.submitted.get(0).getTopic());
    assertThat(transport.acknowledged).containsExactly(0L);
    assertThat(producer.pendingMessageCount()).isZero();
  }

  @Test
  void topicShouldBeResolvedOnlyOnce() {
    DefaultBufferedProducer producer = producer();
    producer.addMessage("a", null, b("1"));
    producer.addMessage("a", null, b("2"));
    producer.addMessage("b", null, b("3"));
    producer.flush();
    producer.addMessage("a", null, b("4"));
    assertThat(transport.resolveCalls).isEqualTo(2);
    assertThat(producer.cachedTopicCount()).isEqualTo(2);
  }

  @Test
  void correlationIdsShouldNotBeReusedAfterRemoval() {
    transport.submitOutcomes(Constants.RESPONSE_CODE_OK, Constants.RESPONSE_CODE_INTERNAL_ERROR);
    DefaultBufferedProducer producer = producer();
    producer.addMessage("t", null, b("a"));
    producer.addMessage("t", null, b("b"));

    assertThatThrownBy(producer::flush)
        .isInstanceOf(ProducerException.class)
        .extracting(e -> ((ProducerException) e).getCode())
        .isEqualTo(Constants.RESPONSE_CODE_INTERNAL_ERROR);
    assertThat(producer.pendingMessageCount()).isEqualTo(2);

    // "a" gets acknowledged, only "b" (ID 1) is left
    producer.transport().poll();
    assertThat(producer.pendingMessageCount()).isEqualTo(1);

    // a size-based ID would be 1 again
    producer.addMessage("t", null, b("c"));
    assertThat(producer.pendingMessageCount()).isEqualTo(2);

    producer.flush();

    assertThat(producer.pendingMessageCount()).isZero();
    assertThat(transport.submitted)
        .extracting(OutboundMessage::getCorrelationId)
        .containsExactly(0L, 1L, 2L);
    assertThat(transport.submitted)
        .extracting(m -> new String(m.getPayload(), UTF_8))
        .containsExactly("a", "b", "c");
    assertThat(transport.acknowledged).containsExactly(0L, 1L, 2L);
  }

  @Test
  void submissionErrorShouldPropagateAndKeepMessagesBuffered() {
    transport.submitOutcomes(Constants.RESPONSE_CODE_ACCESS_REFUSED);
    DefaultBufferedProducer producer = producer();
    producer.addMessage("t", null, b("a"));
    producer.addMessage("t", null, b("b"));

    assertThatThrownBy(producer::flush)
        .isInstanceOf(ProducerException.class)
        .hasMessageContaining("Submission failed");
    assertThat(producer.pendingMessageCount()).isEqualTo(2);
    assertThat(transport.submitted).isEmpty();

    producer.flush();
    assertThat(producer.pendingMessageCount()).isZero();
    assertThat(transport.acknowledged).containsExactly(0L, 1L);
  }

  @Test
  void deliveryReportForUnknownMessageShouldBeIgnored() {
    DefaultBufferedProducer producer = producer();
    producer.addMessage("t", null, b("a"));

    producer.handleDeliveryReport(new DeliveryReport(42, Constants.RESPONSE_CODE_OK));
    producer.handleDeliveryReport(new DeliveryReport(43, Constants.RESPONSE_CODE_INTERNAL_ERROR));
    assertThat(producer.pendingMessageCount()).isEqualTo(1);

    producer.flush();
    assertThat(transport.submitted).hasSize(1);
    assertThat(producer.pendingMessageCount()).isZero();
  }

  @Test
  void staleErrorReportsShouldNotResubmitAcknowledgedMessage() {
    DefaultBufferedProducer producer = producer();
    producer.addMessage("t", null, b("a"));
    producer.handleDeliveryReport(new DeliveryReport(0, Constants.RESPONSE_CODE_INTERNAL_ERROR));
    producer.handleDeliveryReport(new DeliveryReport(0, Constants.RESPONSE_CODE_INTERNAL_ERROR));

    producer.flush();

    // acknowledged in the first poll, before the failed IDs are drained
    assertThat(transport.submitted).hasSize(1);
    assertThat(producer.pendingMessageCount()).isZero();
  }

  @Test
  void deliveryReportsDispatchedWhileQueueIsFullShouldBeHandled() {
    // "a" is accepted, "b" hits a full queue, the poll reports "a" as failed
    transport
        .submitOutcomes(Constants.RESPONSE_CODE_OK, Constants.CODE_QUEUE_FULL)
        .deliveryOutcomes(Constants.RESPONSE_CODE_MESSAGE_TIMED_OUT);
    DefaultBufferedProducer producer = producer();
    producer.addMessage("t", null, b("a"));
    producer.addMessage("t", null, b("b"));

    producer.flush();

    assertThat(producer.pendingMessageCount()).isZero();
    assertThat(transport.submitted)
        .extracting(OutboundMessage::getCorrelationId)
        .containsExactly(0L, 1L, 0L);
    assertThat(transport.acknowledged).containsExactly(1L, 0L);
    assertThat(transport.inFlightCount()).isZero();
  }

  @Test
  void messageShouldBeGivenUpOnWhenMaxDeliveryAttemptsIsReached() {
    transport.failTopic("dead");
    DefaultBufferedProducer producer =
        (DefaultBufferedProducer)
            BufferedProducer.builder().transportFactory(transport).maxDeliveryAttempts(3).build();
    Message deadMessage = producer.messageBuilder("dead").payload(b("a")).build();
    producer.addMessage(deadMessage);
    producer.addMessage("t", null, b("b"));

    assertThatThrownBy(producer::flush)
        .isInstanceOf(DeliveryFailedException.class)
        .satisfies(
            e -> {
              DeliveryFailedException exception = (DeliveryFailedException) e;
              assertThat(exception.getCode()).isEqualTo(Constants.CODE_DELIVERY_ATTEMPTS_EXHAUSTED);
              assertThat(exception.getFailedMessages()).hasSize(1);
              FailedMessage failedMessage = exception.getFailedMessages().get(0);
              assertThat(failedMessage.getMessage()).isSameAs(deadMessage);
              assertThat(failedMessage.getCode())
                  .isEqualTo(Constants.RESPONSE_CODE_MESSAGE_TIMED_OUT);
              assertThat(failedMessage.getDeliveryAttempts()).isEqualTo(3);
            });

    assertThat(producer.pendingMessageCount()).isZero();
    assertThat(transport.acknowledged).containsExactly(1L);
    assertThat(transport.submitted.stream().filter(m -> m.getCorrelationId() == 0)).hasSize(3);

    // the failure is reported once
    producer.flush();
  }

  @Test
  void messagesGivenUpOnShouldBeReportedWithSubmissionFailure() {
    short error = Constants.RESPONSE_CODE_NOT_LEADER_FOR_PARTITION;
    short fatal = Constants.RESPONSE_CODE_INTERNAL_ERROR;
    transport
        .submitOutcomes(
            Constants.RESPONSE_CODE_OK,
            fatal,
            Constants.RESPONSE_CODE_OK,
            Constants.RESPONSE_CODE_OK,
            fatal)
        .deliveryOutcomes(error, error, error);
    DefaultBufferedProducer producer =
        (DefaultBufferedProducer)
            BufferedProducer.builder().transportFactory(transport).maxDeliveryAttempts(2).build();
    Message first = producer.messageBuilder("t").payload(b("a")).build();
    producer.addMessage(first);
    producer.addMessage("t", null, b("b"));

    // first message submitted once, the second one fails
    assertThatThrownBy(producer::flush)
        .isInstanceOf(ProducerException.class)
        .hasNoSuppressedExceptions();
    assertThat(producer.pendingMessageCount()).isEqualTo(2);

    // first message reaches 2 attempts and is given up on, the second fails on its retry
    assertThatThrownBy(producer::flush)
        .isInstanceOf(ProducerException.class)
        .isNotInstanceOf(DeliveryFailedException.class)
        .satisfies(
            e -> {
              assertThat(((ProducerException) e).getCode()).isEqualTo(fatal);
              assertThat(e.getSuppressed()).hasSize(1);
              assertThat(e.getSuppressed()[0]).isInstanceOf(DeliveryFailedException.class);
              DeliveryFailedException failure = (DeliveryFailedException) e.getSuppressed()[0];
              assertThat(failure.getFailedMessages())
                  .extracting(FailedMessage::getMessage)
                  .containsExactly(first);
            });
    assertThat(producer.pendingMessageCount()).isEqualTo(1);

    // the failure is not reported again
    producer.flush();
    assertThat(producer.pendingMessageCount()).isZero();
    producer.flush();
  }

  @Test
  void backOffPolicyTimeoutShouldStopRetries() {
    transport.failTopic("dead");
    DefaultBufferedProducer producer =
        (DefaultBufferedProducer)
            BufferedProducer.builder()
                .transportFactory(transport)
                .retryBackOffDelayPolicy(
                    attempt -> attempt < 2 ? Duration.ZERO : BackOffDelayPolicy.TIMEOUT)
                .build();
    producer.addMessage("dead", null, b("a"));

    assertThatThrownBy(producer::flush)
        .isInstanceOf(DeliveryFailedException.class)
        .satisfies(
            e ->
                assertThat(
                        ((DeliveryFailedException) e)
                            .getFailedMessages()
                            .get(0)
                            .getDeliveryAttempts())
                    .isEqualTo(3));
    assertThat(transport.submitted).hasSize(3);
  }

  @Test
  void backOffPolicyDelayShouldBeAppliedBeforeResubmission() {
    transport.deliveryOutcomes(Constants.RESPONSE_CODE_INTERNAL_ERROR);
    DefaultBufferedProducer producer =
        (DefaultBufferedProducer)
            BufferedProducer.builder()
                .transportFactory(transport)
                .retryBackOffDelayPolicy(BackOffDelayPolicy.fixed(Duration.ofMillis(100)))
                .build();
    producer.addMessage("t", null, b("a"));

    long start = System.nanoTime();
    producer.flush();
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

    assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(100));
    assertThat(transport.submitted).hasSize(2);
    assertThat(producer.pendingMessageCount()).isZero();
  }

  @Test
  void interruptionDuringBackOffShouldKeepMessageBuffered() {
    transport.deliveryOutcomes(Constants.RESPONSE_CODE_INTERNAL_ERROR);
    DefaultBufferedProducer producer =
        (DefaultBufferedProducer)
            BufferedProducer.builder()
                .transportFactory(transport)
                .retryBackOffDelayPolicy(BackOffDelayPolicy.fixed(Duration.ofSeconds(10)))
                .build();
    producer.addMessage("t", null, b("a"));

    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(producer::flush)
          .isInstanceOf(ProducerException.class)
          .hasCauseInstanceOf(InterruptedException.class)
          .extracting(e -> ((ProducerException) e).getCode())
          .isEqualTo(Constants.CODE_INTERRUPTED);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
    assertThat(producer.pendingMessageCount()).isEqualTo(1);

    producer.flush();
    assertThat(producer.pendingMessageCount()).isZero();
    assertThat(transport.acknowledged).containsExactly(0L);
  }

  @Test
  void flushShouldDrainBufferWithRandomFailures() {
    Random random = new Random(42);
    int messageCount = 100;
    for (int i = 0; i < messageCount * 3; i++) {
      transport.submitOutcomes(
          random.nextInt(5) == 0 ? Constants.CODE_QUEUE_FULL : Constants.RESPONSE_CODE_OK);
      transport.deliveryOutcomes(
          random.nextInt(4) == 0
              ? Constants.RESPONSE_CODE_NOT_ENOUGH_REPLICAS
              : Constants.RESPONSE_CODE_OK);
    }
    DefaultBufferedProducer producer = producer();
    for (int i = 0; i < messageCount; i++) {
      producer.addMessage("t", i % 3, null, b(String.valueOf(i)));
    }

    producer.flush();

    assertThat(producer.pendingMessageCount()).isZero();
    assertThat(transport.acknowledged).hasSize(messageCount);
    assertThat(new HashSet<>(transport.acknowledged))
        .isEqualTo(
            LongStream.range(0, messageCount).boxed().collect(Collectors.toSet()));
  }

  @Test
  void metricsShouldBeCollected() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    transport
        .submitOutcomes(Constants.CODE_QUEUE_FULL)
        .deliveryOutcomes(Constants.RESPONSE_CODE_INTERNAL_ERROR);
    BufferedProducer producer =
        BufferedProducer.builder()
            .transportFactory(transport)
            .metricsCollector(new MicrometerMetricsCollector(registry))
            .build();
    producer.addMessage("t", null, b("a"));

    assertThat(registry.get("rabbitmq.buffered.pending").gauge().value()).isEqualTo(1);
    producer.flush();

    assertThat(registry.get("rabbitmq.buffered.buffered").counter().count()).isEqualTo(1);
    assertThat(registry.get("rabbitmq.buffered.queue_full").counter().count()).isEqualTo(1);
    assertThat(registry.get("rabbitmq.buffered.published").counter().count()).isEqualTo(2);
    assertThat(registry.get("rabbitmq.buffered.errored").counter().count()).isEqualTo(1);
    assertThat(registry.get("rabbitmq.buffered.retried").counter().count()).isEqualTo(1);
    assertThat(registry.get("rabbitmq.buffered.confirmed").counter().count()).isEqualTo(1);
    assertThat(registry.get("rabbitmq.buffered.pending").gauge().value()).isZero();
    assertThat(registry.get("rabbitmq.buffered.outstanding_publish_confirm").gauge().value())
        .isZero();
  }

  @Test
  void transportAccessorShouldReturnCreatedTransport() {
    assertThat(producer().transport()).isSameAs(transport);
  }
}
