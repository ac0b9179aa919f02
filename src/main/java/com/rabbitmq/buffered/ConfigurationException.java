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

/** Thrown when a buffered producer cannot initialize its transport. */
public class ConfigurationException extends ProducerException {

  private static final long serialVersionUID = 7745012235867402661L;

  public ConfigurationException(String message) {
    super(message, Constants.CODE_TRANSPORT_INITIALIZATION_FAILED);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, Constants.CODE_TRANSPORT_INITIALIZATION_FAILED, cause);
  }
}
