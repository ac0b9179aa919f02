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

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

public class DropwizardMetricsCollector implements MetricsCollector {

  private final Meter buffered;
  private final Meter publish;
  private final Meter publishConfirm;
  private final Meter publishError;
  private final Meter queueFull;
  private final Meter retry;
  private final Meter deliveryFailure;

  private final Counter pending;
  private final Counter outstandingPublishConfirm;

  public DropwizardMetricsCollector(MetricRegistry registry, String metricsPrefix) {
    this.buffered = registry.meter(metricsPrefix + ".buffered");
    this.publish = registry.meter(metricsPrefix + ".published");
    this.publishConfirm = registry.meter(metricsPrefix + ".confirmed");
    this.publishError = registry.meter(metricsPrefix + ".errored");
    this.queueFull = registry.meter(metricsPrefix + ".queue_full");
    this.retry = registry.meter(metricsPrefix + ".retried");
    this.deliveryFailure = registry.meter(metricsPrefix + ".failed");
    this.pending = registry.counter(metricsPrefix + ".pending");
    this.outstandingPublishConfirm =
        registry.counter(metricsPrefix + ".outstanding_publish_confirm");
  }

  public DropwizardMetricsCollector() {
    this(new MetricRegistry());
  }

  public DropwizardMetricsCollector(MetricRegistry metricRegistry) {
    this(metricRegistry, "rabbitmq.buffered");
  }

  @Override
  public void buffer(int count) {
    buffered.mark(count);
    pending.inc(count);
  }

  @Override
  public void publish(int count) {
    publish.mark(count);
    outstandingPublishConfirm.inc(count);
  }

  @Override
  public void publishConfirm(int count) {
    publishConfirm.mark(count);
    outstandingPublishConfirm.dec(count);
    pending.dec(count);
  }

  @Override
  public void publishError(int count) {
    publishError.mark(count);
    outstandingPublishConfirm.dec(count);
  }

  @Override
  public void queueFull() {
    queueFull.mark();
  }

  @Override
  public void retry(int count) {
    retry.mark(count);
  }

  @Override
  public void deliveryFailure(int count) {
    deliveryFailure.mark(count);
    pending.dec(count);
  }
}
