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
 * Signals the transport local outbound queue is full.
 *
 * <p>This is a transient condition, not a delivery failure. The buffered producer polls the
 * transport and submits the same message again, the exception never reaches the application.
 */
public class QueueFullException extends ProducerException {

  private static final long serialVersionUID = 3119204411683254110L;

  public QueueFullException() {
    this("Local outbound queue is full");
  }

  public QueueFullException(String message) {
    super(message, Constants.CODE_QUEUE_FULL);
  }
}
