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
 * A message handed to the {@link Transport}.
 *
 * <p>The correlation ID is opaque to the transport, which must return it unchanged in the {@link
 * DeliveryReport} of the message.
 *
 * @see Transport#submit(OutboundMessage)
 */
public final class OutboundMessage {

  private final TopicHandle topic;
  private final int partition;
  private final byte[] key;
  private final byte[] payload;
  private final long correlationId;

  public OutboundMessage(
      TopicHandle topic, int partition, byte[] key, byte[] payload, long correlationId) {
    this.topic = topic;
    this.partition = partition;
    this.key = key;
    this.payload = payload;
    this.correlationId = correlationId;
  }

  public TopicHandle getTopic() {
    return topic;
  }

  /**
   * The target partition.
   *
   * @return the partition, {@link Message#UNASSIGNED_PARTITION} if the transport chooses
   */
  public int getPartition() {
    return partition;
  }

  public byte[] getKey() {
    return key;
  }

  public byte[] getPayload() {
    return payload;
  }

  public long getCorrelationId() {
    return correlationId;
  }

  @Override
  public String toString() {
    return "OutboundMessage{"
        + "topic="
        + topic.getName()
        + ", partition="
        + partition
        + ", correlationId="
        + correlationId
        + '}';
  }
}
