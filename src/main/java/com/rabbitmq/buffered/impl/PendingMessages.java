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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffered messages not acknowledged yet, indexed by correlation ID.
 *
 * <p>Correlation IDs come from a sequence that only moves forward, so an ID is never handed out
 * twice, whatever the number of entries removed in the meantime.
 *
 * <p>Delivery reports can arrive while the flush code iterates over the entries (the transport
 * dispatches them from {@code poll()}, which is called when the outbound queue is full). Callers
 * iterate over {@link #snapshot()} and {@link #drainFailed()}, never over the live structures.
 */
final class PendingMessages {

  private final AtomicLong sequence = new AtomicLong(0);
  private final SortedMap<Long, BufferedMessage> messages = new TreeMap<>();
  private final Set<Long> failed = new LinkedHashSet<>();

  long add(BufferedMessage message) {
    long correlationId = this.sequence.getAndIncrement();
    this.messages.put(correlationId, message);
    return correlationId;
  }

  BufferedMessage get(long correlationId) {
    return this.messages.get(correlationId);
  }

  boolean contains(long correlationId) {
    return this.messages.containsKey(correlationId);
  }

  BufferedMessage remove(long correlationId) {
    this.failed.remove(correlationId);
    return this.messages.remove(correlationId);
  }

  int size() {
    return this.messages.size();
  }

  boolean isEmpty() {
    return this.messages.isEmpty();
  }

  SortedMap<Long, BufferedMessage> snapshot() {
    return new TreeMap<>(this.messages);
  }

  void markFailed(long correlationId) {
    this.failed.add(correlationId);
  }

  int failedCount() {
    return this.failed.size();
  }

  List<Long> drainFailed() {
    if (this.failed.isEmpty()) {
      return Collections.emptyList();
    }
    List<Long> drained = new ArrayList<>(this.failed);
    this.failed.clear();
    return drained;
  }
}
