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

import java.util.Arrays;

/**
 * A message to buffer in a {@link BufferedProducer}.
 *
 * <p>Instances are created with a {@link MessageBuilder}. The key and payload arrays are not
 * copied, they must not be modified once the message is built.
 *
 * @see BufferedProducer#messageBuilder(String)
 */
public final class Message {

  /** Partition value when the transport is left to choose the partition. */
  public static final int UNASSIGNED_PARTITION = -1;

  private final String topic;
  private final int partition;
  private final byte[] key;
  private final byte[] payload;

  Message(String topic, int partition, byte[] key, byte[] payload) {
    this.topic = topic;
    this.partition = partition;
    this.key = key;
    this.payload = payload;
  }

  public String getTopic() {
    return topic;
  }

  /**
   * The target partition.
   *
   * @return the partition, {@link #UNASSIGNED_PARTITION} if not set
   */
  public int getPartition() {
    return partition;
  }

  public boolean hasPartition() {
    return this.partition != UNASSIGNED_PARTITION;
  }

  public byte[] getKey() {
    return key;
  }

  public byte[] getPayload() {
    return payload;
  }

  @Override
  public String toString() {
    return "Message{"
        + "topic='"
        + topic
        + '\''
        + ", partition="
        + partition
        + ", key="
        + (key == null ? "null" : key.length + " byte(s)")
        + ", payload="
        + (payload == null ? "null" : payload.length + " byte(s)")
        + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Message that = (Message) o;
    return partition == that.partition
        && topic.equals(that.topic)
        && Arrays.equals(key, that.key)
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = topic.hashCode();
    result = 31 * result + partition;
    result = 31 * result + Arrays.hashCode(key);
    result = 31 * result + Arrays.hashCode(payload);
    return result;
  }
}
