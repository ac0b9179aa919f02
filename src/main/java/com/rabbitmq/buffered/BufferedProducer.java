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
package com.rabbitmq.buffered;

/**
 * API to buffer messages and send them reliably.
 *
 * <p>Messages are only added to an in-memory buffer by {@link #addMessage(Message)}, they are not
 * sent until {@link #flush()} is called. {@link #flush()} blocks until the broker has accepted
 * every buffered message, submitting them again when the transport reports a delivery error.
 *
 * <p>Instances are not thread-safe: a given instance must be used from one thread at a time.
 *
 * <p>Instances are created and configured with a {@link BufferedProducerBuilder}.
 *
 * @see BufferedProducerBuilder
 */
public interface BufferedProducer {

  /**
   * Create a builder to configure and create a {@link BufferedProducer}
   *
   * @return this builder instance
   */
  static BufferedProducerBuilder builder() {
    try {
      return (BufferedProducerBuilder)
          Class.forName("com.rabbitmq.buffered.impl.DefaultBufferedProducerBuilder")
              .getConstructor()
              .newInstance();
    } catch (Exception e) {
      throw new ProducerException("Error while creating buffered producer builder", e);
    }
  }

  /**
   * Return a {@link MessageBuilder} to create a {@link Message} for the given topic.
   *
   * @param topic the topic name
   * @return a single-usage {@link MessageBuilder}
   */
  MessageBuilder messageBuilder(String topic);

  /**
   * Add a message to the buffer.
   *
   * <p>The message is not sent until {@link #flush()} is called. This method does not perform
   * any I/O, except the resolution of the topic the first time it is used.
   *
   * @param message the message
   * @throws ProducerException if the topic of the message cannot be resolved
   */
  void addMessage(Message message);

  /**
   * Add a message to the buffer.
   *
   * @param topic the topic name
   * @param partition the partition, {@link Message#UNASSIGNED_PARTITION} to let the transport
   *     choose
   * @param key the key, can be null
   * @param payload the payload, can be null
   * @see #addMessage(Message)
   */
  default void addMessage(String topic, int partition, byte[] key, byte[] payload) {
    addMessage(messageBuilder(topic).partition(partition).key(key).payload(payload).build());
  }

  /**
   * Add a message to the buffer, letting the transport choose the partition.
   *
   * @param topic the topic name
   * @param key the key, can be null
   * @param payload the payload, can be null
   * @see #addMessage(Message)
   */
  default void addMessage(String topic, byte[] key, byte[] payload) {
    addMessage(topic, Message.UNASSIGNED_PARTITION, key, payload);
  }

  /**
   * Send the buffered messages and wait until all of them are acknowledged.
   *
   * <p>Messages failed by the broker are sent again. With the default configuration there is no
   * limit to the number of delivery attempts, so this method does not return as long as the
   * broker keeps rejecting a message.
   *
   * @throws ProducerException if the transport fails to submit a message for a reason other than
   *     a full queue. The buffer is left as is and can be flushed again. Messages given up on
   *     before the failure are attached as a suppressed {@link DeliveryFailedException}.
   * @throws DeliveryFailedException if some messages reached the maximum number of delivery
   *     attempts
   */
  void flush();

  /**
   * The number of messages not acknowledged yet.
   *
   * @return the number of buffered messages
   */
  int pendingMessageCount();

  /**
   * The underlying transport.
   *
   * <p>Meant for advanced configuration and statistics, messages submitted directly to the
   * transport are not tracked by the buffered producer.
   *
   * @return the transport
   */
  Transport transport();
}
