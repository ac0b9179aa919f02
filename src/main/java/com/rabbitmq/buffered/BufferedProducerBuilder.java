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

import com.rabbitmq.buffered.metrics.MetricsCollector;

/** API to configure and create a {@link BufferedProducer}. */
public interface BufferedProducerBuilder {

  /**
   * The factory of the underlying transport.
   *
   * <p>Mandatory.
   *
   * @param transportFactory
   * @return this builder instance
   */
  BufferedProducerBuilder transportFactory(TransportFactory transportFactory);

  /**
   * The maximum number of delivery attempts for a message.
   *
   * <p>A message still failed after this number of attempts is removed from the buffer and
   * reported with a {@link DeliveryFailedException} at the end of {@link BufferedProducer#flush()}.
   *
   * <p>Default is 0, which means no limit: failed messages are submitted again until the broker
   * accepts them.
   *
   * @param maxDeliveryAttempts
   * @return this builder instance
   */
  BufferedProducerBuilder maxDeliveryAttempts(int maxDeliveryAttempts);

  /**
   * Delay policy to wait before submitting failed messages again.
   *
   * <p>The policy is called with the retry attempt (0 for the first retry). Returning {@link
   * BackOffDelayPolicy#TIMEOUT} stops the retries for the message, which ends up in a {@link
   * DeliveryFailedException}.
   *
   * <p>Default is no delay.
   *
   * @param retryBackOffDelayPolicy
   * @return this builder instance
   */
  BufferedProducerBuilder retryBackOffDelayPolicy(BackOffDelayPolicy retryBackOffDelayPolicy);

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector
   * @return this builder instance
   */
  BufferedProducerBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Create the {@link BufferedProducer} instance.
   *
   * @return the configured buffered producer
   * @throws ConfigurationException if the transport cannot be created
   */
  BufferedProducer build();
}
