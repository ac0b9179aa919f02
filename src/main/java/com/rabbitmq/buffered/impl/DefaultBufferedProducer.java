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

import static com.rabbitmq.buffered.impl.Utils.formatConstant;

import com.rabbitmq.buffered.BackOffDelayPolicy;
import com.rabbitmq.buffered.BufferedProducer;
import com.rabbitmq.buffered.ConfigurationException;
import com.rabbitmq.buffered.Constants;
import com.rabbitmq.buffered.DeliveryFailedException;
import com.rabbitmq.buffered.DeliveryFailedException.FailedMessage;
import com.rabbitmq.buffered.DeliveryReport;
import com.rabbitmq.buffered.Message;
import com.rabbitmq.buffered.MessageBuilder;
import com.rabbitmq.buffered.OutboundMessage;
import com.rabbitmq.buffered.ProducerException;
import com.rabbitmq.buffered.TopicHandle;
import com.rabbitmq.buffered.Transport;
import com.rabbitmq.buffered.TransportFactory;
import com.rabbitmq.buffered.metrics.MetricsCollector;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class DefaultBufferedProducer implements BufferedProducer {

  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultBufferedProducer.class);

  private final long id;
  private final Transport transport;
  private final TopicCache topics;
  private final PendingMessages pendingMessages = new PendingMessages();
  private final int maxDeliveryAttempts;
  private final BackOffDelayPolicy retryBackOffDelayPolicy;
  private final MetricsCollector metricsCollector;
  // messages given up on, reported when the flush returns or aborts
  private final List<FailedMessage> failedMessages = new ArrayList<>();

  @SuppressFBWarnings("CT_CONSTRUCTOR_THROW")
  DefaultBufferedProducer(
      TransportFactory transportFactory,
      int maxDeliveryAttempts,
      BackOffDelayPolicy retryBackOffDelayPolicy,
      MetricsCollector metricsCollector) {
    this.id = ID_SEQUENCE.getAndIncrement();
    this.maxDeliveryAttempts = maxDeliveryAttempts;
    this.retryBackOffDelayPolicy = retryBackOffDelayPolicy;
    this.metricsCollector = metricsCollector;
    Transport createdTransport;
    try {
      createdTransport = transportFactory.create(this::handleDeliveryReport);
    } catch (ConfigurationException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigurationException(
          "Error while creating transport of buffered producer " + this.id, e);
    }
    if (createdTransport == null) {
      throw new ConfigurationException(
          "Transport factory returned no transport for buffered producer " + this.id);
    }
    this.transport = createdTransport;
    this.topics = new TopicCache(this.transport);
    LOGGER.debug(
        "Created buffered producer {} (max delivery attempts {}, retry back-off {})",
        this.id,
        this.maxDeliveryAttempts == 0 ? "unlimited" : this.maxDeliveryAttempts,
        this.retryBackOffDelayPolicy);
  }

  @Override
  public MessageBuilder messageBuilder(String topic) {
    return new MessageBuilder(topic);
  }

  @Override
  public void addMessage(Message message) {
    TopicHandle topic = this.topics.resolve(message.getTopic());
    long correlationId = this.pendingMessages.add(new BufferedMessage(message, topic));
    this.metricsCollector.buffer(1);
    LOGGER.trace("Buffered message {} for topic '{}'", correlationId, topic.getName());
  }

  @Override
  public void flush() {
    try {
      drain();
    } catch (RuntimeException e) {
      // messages given up on before the abort are reported with it, not by the next flush
      if (!this.failedMessages.isEmpty()) {
        e.addSuppressed(takeFailures());
      }
      throw e;
    }
    if (!this.failedMessages.isEmpty()) {
      throw takeFailures();
    }
  }

  private void drain() {
    SortedMap<Long, BufferedMessage> messages = this.pendingMessages.snapshot();
    if (!messages.isEmpty()) {
      LOGGER.debug("Flushing {} message(s) of buffered producer {}", messages.size(), this.id);
    }
    for (Entry<Long, BufferedMessage> message : messages.entrySet()) {
      // a delivery report dispatched during a previous submission may have settled it
      if (this.pendingMessages.contains(message.getKey())) {
        publish(message.getKey(), message.getValue());
      }
    }

    int retryWaves = 0;
    while (!this.pendingMessages.isEmpty()) {
      this.transport.poll();
      List<Long> failed = this.pendingMessages.drainFailed();
      if (!failed.isEmpty()) {
        retry(failed);
        retryWaves++;
      }
    }
    if (retryWaves > 0) {
      LOGGER.debug("Buffered producer {} flushed after {} retry wave(s)", this.id, retryWaves);
    }
  }

  private DeliveryFailedException takeFailures() {
    List<FailedMessage> failures = new ArrayList<>(this.failedMessages);
    this.failedMessages.clear();
    return new DeliveryFailedException(failures);
  }

  private void retry(List<Long> failed) {
    SortedMap<Long, BufferedMessage> toRetry = new TreeMap<>();
    int highestRetryAttempt = 0;
    for (Long correlationId : failed) {
      BufferedMessage message = this.pendingMessages.get(correlationId);
      if (message == null) {
        continue;
      }
      int retryAttempt = Math.max(message.deliveryAttempts() - 1, 0);
      if (exhausted(message, retryAttempt)) {
        giveUp(correlationId, message);
      } else {
        toRetry.put(correlationId, message);
        highestRetryAttempt = Math.max(highestRetryAttempt, retryAttempt);
      }
    }
    if (toRetry.isEmpty()) {
      return;
    }
    Duration delay = this.retryBackOffDelayPolicy.delay(highestRetryAttempt);
    if (!delay.isZero() && !delay.isNegative()) {
      LOGGER.trace(
          "Waiting {} ms before re-submitting {} message(s)", delay.toMillis(), toRetry.size());
      try {
        Thread.sleep(delay.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        // the messages stay pending, the next flush submits them again
        throw new ProducerException(
            "Interrupted while waiting to re-submit failed messages",
            Constants.CODE_INTERRUPTED,
            e);
      }
    }
    this.metricsCollector.retry(toRetry.size());
    for (Entry<Long, BufferedMessage> message : toRetry.entrySet()) {
      if (this.pendingMessages.contains(message.getKey())) {
        publish(message.getKey(), message.getValue());
      }
    }
  }

  private boolean exhausted(BufferedMessage message, int retryAttempt) {
    if (this.maxDeliveryAttempts > 0 && message.deliveryAttempts() >= this.maxDeliveryAttempts) {
      return true;
    }
    return BackOffDelayPolicy.TIMEOUT.equals(this.retryBackOffDelayPolicy.delay(retryAttempt));
  }

  private void giveUp(long correlationId, BufferedMessage message) {
    this.pendingMessages.remove(correlationId);
    this.failedMessages.add(
        new FailedMessage(message.message(), message.lastErrorCode(), message.deliveryAttempts()));
    this.metricsCollector.deliveryFailure(1);
    LOGGER.info(
        "Giving up on message {} of buffered producer {} for topic '{}' "
            + "after {} delivery attempt(s), last error {}",
        correlationId,
        this.id,
        message.topic().getName(),
        message.deliveryAttempts(),
        formatConstant(message.lastErrorCode()));
  }

  // visible for testing
  void publish(long correlationId, BufferedMessage message) {
    OutboundMessage outboundMessage =
        new OutboundMessage(
            message.topic(), message.partition(), message.key(), message.payload(), correlationId);
    boolean sent = false;
    while (!sent) {
      try {
        this.transport.submit(outboundMessage);
        sent = true;
      } catch (ProducerException e) {
        if (e.getCode() == Constants.CODE_QUEUE_FULL) {
          // serving delivery reports frees up room in the queue
          LOGGER.trace("Outbound queue full when submitting message {}, polling", correlationId);
          this.metricsCollector.queueFull();
          this.transport.poll();
        } else {
          throw e;
        }
      }
    }
    message.submitted();
    this.metricsCollector.publish(1);
  }

  // visible for testing
  void handleDeliveryReport(DeliveryReport deliveryReport) {
    long correlationId = deliveryReport.getCorrelationId();
    BufferedMessage message = this.pendingMessages.get(correlationId);
    if (message == null) {
      LOGGER.trace("Ignoring delivery report for unknown message {}", correlationId);
      return;
    }
    if (deliveryReport.isOk()) {
      this.pendingMessages.remove(correlationId);
      this.metricsCollector.publishConfirm(1);
    } else {
      LOGGER.trace(
          "Message {} failed with {}, it will be submitted again",
          correlationId,
          formatConstant(deliveryReport.getCode()));
      message.failed(deliveryReport.getCode());
      this.pendingMessages.markFailed(correlationId);
      this.metricsCollector.publishError(1);
    }
  }

  @Override
  public int pendingMessageCount() {
    return this.pendingMessages.size();
  }

  @Override
  public Transport transport() {
    return this.transport;
  }

  // for testing
  int cachedTopicCount() {
    return this.topics.size();
  }

  @Override
  public String toString() {
    return "{ "
        + "\"id\" : "
        + id
        + ","
        + "\"pending_messages\" : "
        + this.pendingMessages.size()
        + ","
        + "\"topics\" : "
        + this.topics.size()
        + "}";
  }
}
