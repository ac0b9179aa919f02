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

import com.rabbitmq.buffered.BackOffDelayPolicy;
import com.rabbitmq.buffered.BufferedProducer;
import com.rabbitmq.buffered.BufferedProducerBuilder;
import com.rabbitmq.buffered.TransportFactory;
import com.rabbitmq.buffered.metrics.MetricsCollector;
import com.rabbitmq.buffered.metrics.NoOpMetricsCollector;

public class DefaultBufferedProducerBuilder implements BufferedProducerBuilder {

  static final int DEFAULT_MAX_DELIVERY_ATTEMPTS =
      Utils.intProperty("rabbitmq.buffered.producer.max.delivery.attempts", 0);

  private TransportFactory transportFactory;

  private int maxDeliveryAttempts = Math.max(DEFAULT_MAX_DELIVERY_ATTEMPTS, 0);

  private BackOffDelayPolicy retryBackOffDelayPolicy = BackOffDelayPolicy.immediate();

  private MetricsCollector metricsCollector = NoOpMetricsCollector.SINGLETON;

  public DefaultBufferedProducerBuilder() {}

  @Override
  public DefaultBufferedProducerBuilder transportFactory(TransportFactory transportFactory) {
    this.transportFactory = transportFactory;
    return this;
  }

  @Override
  public DefaultBufferedProducerBuilder maxDeliveryAttempts(int maxDeliveryAttempts) {
    if (maxDeliveryAttempts < 0) {
      throw new IllegalArgumentException(
          "the maximum number of delivery attempts cannot be negative");
    }
    this.maxDeliveryAttempts = maxDeliveryAttempts;
    return this;
  }

  @Override
  public DefaultBufferedProducerBuilder retryBackOffDelayPolicy(
      BackOffDelayPolicy retryBackOffDelayPolicy) {
    if (retryBackOffDelayPolicy == null) {
      throw new IllegalArgumentException("the retry back-off delay policy cannot be null");
    }
    this.retryBackOffDelayPolicy = retryBackOffDelayPolicy;
    return this;
  }

  @Override
  public DefaultBufferedProducerBuilder metricsCollector(MetricsCollector metricsCollector) {
    if (metricsCollector == null) {
      throw new IllegalArgumentException("the metrics collector cannot be null");
    }
    this.metricsCollector = metricsCollector;
    return this;
  }

  @Override
  public BufferedProducer build() {
    if (this.transportFactory == null) {
      throw new IllegalArgumentException("A transport factory must be specified");
    }
    return new DefaultBufferedProducer(
        this.transportFactory,
        this.maxDeliveryAttempts,
        this.retryBackOffDelayPolicy,
        this.metricsCollector);
  }
}
