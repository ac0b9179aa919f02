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
 * Asynchronous publish/acknowledge transport the {@link BufferedProducer} sits on.
 *
 * <p>Framing, network I/O, partition assignment and serialization are the responsibility of the
 * transport. Delivery reports must be dispatched to the {@link DeliveryReportHandler} given at
 * creation time, synchronously, from {@link #poll()}.
 *
 * <p>Implementations do not need to be thread-safe, a buffered producer calls its transport from
 * a single thread.
 *
 * @see TransportFactory
 */
public interface Transport {

  /**
   * Hand a message over for asynchronous delivery.
   *
   * <p>Returning does not mean the message is delivered, its outcome comes later in a {@link
   * DeliveryReport}.
   *
   * @param message the message to send
   * @throws QueueFullException if the local outbound queue is full
   * @throws ProducerException if the message cannot be submitted
   */
  void submit(OutboundMessage message);

  /** Serve events, dispatching delivery reports of completed messages, if any. */
  void poll();

  /**
   * Look up a topic.
   *
   * @param name the topic name
   * @return the topic handle
   * @throws ProducerException if the topic cannot be resolved
   */
  TopicHandle resolveTopic(String name);
}
