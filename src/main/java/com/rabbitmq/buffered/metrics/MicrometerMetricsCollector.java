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
package com.rabbitmq.buffered.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

public class MicrometerMetricsCollector implements MetricsCollector {

  private final Counter buffered;
  private final Counter publish;
  private final Counter publishConfirm;
  private final Counter publishError;
  private final Counter queueFull;
  private final Counter retry;
  private final Counter deliveryFailure;

  private final AtomicLong pending;
  private final AtomicLong outstandingPublishConfirm;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "rabbitmq.buffered");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.buffered = registry.counter(prefix + ".buffered", tags);
    this.publish = registry.counter(prefix + ".published", tags);
    this.publishConfirm = registry.counter(prefix + ".confirmed", tags);
    this.publishError = registry.counter(prefix + ".errored", tags);
    this.queueFull = registry.counter(prefix + ".queue_full", tags);
    this.retry = registry.counter(prefix + ".retried", tags);
    this.deliveryFailure = registry.counter(prefix + ".failed", tags);
    this.pending = registry.gauge(prefix + ".pending", tags, new AtomicLong(0));
    this.outstandingPublishConfirm =
        registry.gauge(prefix + ".outstanding_publish_confirm", tags, new AtomicLong(0));
  }

  @Override
  public void buffer(int count) {
    buffered.increment(count);
    pending.addAndGet(count);
  }

  @Override
  public void publish(int count) {
    publish.increment(count);
    outstandingPublishConfirm.addAndGet(count);
  }

  @Override
  public void publishConfirm(int count) {
    publishConfirm.increment(count);
    outstandingPublishConfirm.addAndGet(-count);
    pending.addAndGet(-count);
  }

  @Override
  public void publishError(int count) {
    publishError.increment(count);
    outstandingPublishConfirm.addAndGet(-count);
  }

  @Override
  public void queueFull() {
    queueFull.increment();
  }

  @Override
  public void retry(int count) {
    retry.increment(count);
  }

  @Override
  public void deliveryFailure(int count) {
    deliveryFailure.increment(count);
    pending.addAndGet(-count);
  }
}
