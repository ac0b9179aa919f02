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

import com.rabbitmq.buffered.Constants;
import com.rabbitmq.buffered.ProducerException;
import com.rabbitmq.buffered.TopicHandle;
import com.rabbitmq.buffered.Transport;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Resolves topic names with the transport, once per name. Entries are never evicted. */
final class TopicCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(TopicCache.class);

  private final Transport transport;
  private final Map<String, TopicHandle> topics = new ConcurrentHashMap<>();

  TopicCache(Transport transport) {
    this.transport = transport;
  }

  TopicHandle resolve(String name) {
    TopicHandle topic = this.topics.get(name);
    if (topic == null) {
      topic = this.transport.resolveTopic(name);
      if (topic == null) {
        throw new ProducerException(
            "Transport could not resolve topic '" + name + "'",
            Constants.CODE_TOPIC_RESOLUTION_FAILED);
      }
      this.topics.put(name, topic);
      LOGGER.debug("Resolved topic '{}' ({} topic(s) in cache)", name, this.topics.size());
    }
    return topic;
  }

  int size() {
    return this.topics.size();
  }
}
