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
 * API to configure and create a {@link Message}.
 *
 * <p>A builder is meant to create only one message instance.
 *
 * @see BufferedProducer#messageBuilder(String)
 */
public class MessageBuilder {

  private final String topic;
  private int partition = Message.UNASSIGNED_PARTITION;
  private byte[] key;
  private byte[] payload;

  public MessageBuilder(String topic) {
    if (topic == null || topic.isEmpty()) {
      throw new IllegalArgumentException("A topic must be specified");
    }
    this.topic = topic;
  }

  /**
   * The partition to send the message to.
   *
   * <p>Default is {@link Message#UNASSIGNED_PARTITION}, the transport chooses the partition.
   *
   * @param partition
   * @return this builder instance
   */
  public MessageBuilder partition(int partition) {
    if (partition < 0 && partition != Message.UNASSIGNED_PARTITION) {
      throw new IllegalArgumentException("Invalid partition: " + partition);
    }
    this.partition = partition;
    return this;
  }

  public MessageBuilder key(byte[] key) {
    this.key = key;
    return this;
  }

  public MessageBuilder payload(byte[] payload) {
    this.payload = payload;
    return this;
  }

  public String topic() {
    return this.topic;
  }

  public Message build() {
    return new Message(this.topic, this.partition, this.key, this.payload);
  }
}
