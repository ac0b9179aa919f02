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
 * Generic buffered producer exception.
 *
 * <p>Transports signal submission failures with this exception (or a subclass), the code tells
 * the producer whether the failure is transient.
 *
 * @see Constants
 */
public class ProducerException extends RuntimeException {

  private static final long serialVersionUID = -4265783930265092384L;

  private final short code;

  public ProducerException(String message) {
    super(message);
    this.code = -1;
  }

  public ProducerException(String message, short code) {
    super(message);
    this.code = code;
  }

  public ProducerException(Throwable cause) {
    super(null, cause);
    this.code = -1;
  }

  public ProducerException(String message, Throwable cause) {
    super(message, cause);
    this.code = -1;
  }

  public ProducerException(String message, short code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public short getCode() {
    return code;
  }
}
