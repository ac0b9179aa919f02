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
 * The outcome of a delivery attempt, as reported by the broker.
 *
 * @see DeliveryReportHandler
 */
public class DeliveryReport {

  private final long correlationId;

  private final short code;

  public DeliveryReport(long correlationId, short code) {
    this.correlationId = correlationId;
    this.code = code;
  }

  /**
   * The correlation ID of the {@link OutboundMessage} this report is about.
   *
   * @return the correlation ID
   */
  public long getCorrelationId() {
    return correlationId;
  }

  /**
   * Whether the message has been accepted by the broker.
   *
   * @return true if the delivery succeeded, false otherwise
   */
  public boolean isOk() {
    return this.code == Constants.RESPONSE_CODE_OK;
  }

  /**
   * The status code.
   *
   * @return status code
   * @see Constants
   */
  public short getCode() {
    return code;
  }

  @Override
  public String toString() {
    return "DeliveryReport{" + "correlationId=" + correlationId + ", code=" + code + '}';
  }
}
