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

/**
 * Callbacks to record buffered producer activity.
 *
 * <p>Calls happen on the thread driving the producer, implementations must be fast.
 */
public interface MetricsCollector {

  void buffer(int count);

  void publish(int count);

  void publishConfirm(int count);

  void publishError(int count);

  void queueFull();

  void retry(int count);

  void deliveryFailure(int count);
}
