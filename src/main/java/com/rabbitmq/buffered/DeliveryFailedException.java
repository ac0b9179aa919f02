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

import java.util.Collections;
import java.util.List;

/**
 * Thrown by {@link BufferedProducer#flush()} when some messages ran out of delivery attempts.
 *
 * <p>This can happen only when a bounded retry policy is configured, see {@link
 * BufferedProducerBuilder#maxDeliveryAttempts(int)} and {@link
 * BufferedProducerBuilder#retryBackOffDelayPolicy(BackOffDelayPolicy)}. The failed messages are
 * no longer buffered, the application can add them again.
 */
public class DeliveryFailedException extends ProducerException {

  private static final long serialVersionUID = -1832554930017263715L;

  private final transient List<FailedMessage> failedMessages;

  public DeliveryFailedException(List<FailedMessage> failedMessages) {
    super(
        failedMessages.size() + " message(s) could not be delivered",
        Constants.CODE_DELIVERY_ATTEMPTS_EXHAUSTED);
    this.failedMessages = Collections.unmodifiableList(failedMessages);
  }

  /**
   * The messages that could not be delivered, in buffering order.
   *
   * @return the failed messages
   */
  public List<FailedMessage> getFailedMessages() {
    return failedMessages;
  }

  /** A message given up on, with the code of its last delivery report. */
  public static class FailedMessage {

    private final Message message;
    private final short code;
    private final int deliveryAttempts;

    public FailedMessage(Message message, short code, int deliveryAttempts) {
      this.message = message;
      this.code = code;
      this.deliveryAttempts = deliveryAttempts;
    }

    public Message getMessage() {
      return message;
    }

    /**
     * The error code of the last delivery report.
     *
     * @return the code
     * @see Constants
     */
    public short getCode() {
      return code;
    }

    public int getDeliveryAttempts() {
      return deliveryAttempts;
    }
  }
}
