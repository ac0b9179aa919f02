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

import com.rabbitmq.buffered.Message;
import com.rabbitmq.buffered.TopicHandle;
import java.util.Arrays;

final class BufferedMessage {

  private final Message message;
  private final TopicHandle topic;
  private final byte[] key;
  private final byte[] payload;
  // bookkeeping for the retry policy, the content above never changes
  private int deliveryAttempts = 0;
  private short lastErrorCode = -1;

  BufferedMessage(Message message, TopicHandle topic) {
    this.message = message;
    this.topic = topic;
    // own copies, every submission must send the content seen when buffering
    this.key = copy(message.getKey());
    this.payload = copy(message.getPayload());
  }

  private static byte[] copy(byte[] bytes) {
    return bytes == null ? null : Arrays.copyOf(bytes, bytes.length);
  }

  Message message() {
    return this.message;
  }

  TopicHandle topic() {
    return this.topic;
  }

  int partition() {
    return this.message.getPartition();
  }

  byte[] key() {
    return this.key;
  }

  byte[] payload() {
    return this.payload;
  }

  int deliveryAttempts() {
    return this.deliveryAttempts;
  }

  void submitted() {
    this.deliveryAttempts++;
  }

  short lastErrorCode() {
    return this.lastErrorCode;
  }

  void failed(short code) {
    this.lastErrorCode = code;
  }
}
