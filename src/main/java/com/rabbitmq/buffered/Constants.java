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
 * Various constants (response codes, errors, etc)
 */
public final class Constants {

  public static final short RESPONSE_CODE_OK = 1;
  public static final short RESPONSE_CODE_UNKNOWN_TOPIC = 2;
  public static final short RESPONSE_CODE_UNKNOWN_PARTITION = 3;
  public static final short RESPONSE_CODE_MESSAGE_TIMED_OUT = 4;
  public static final short RESPONSE_CODE_MESSAGE_TOO_LARGE = 5;
  public static final short RESPONSE_CODE_NOT_LEADER_FOR_PARTITION = 6;
  public static final short RESPONSE_CODE_NOT_ENOUGH_REPLICAS = 7;
  public static final short RESPONSE_CODE_ACCESS_REFUSED = 16;
  public static final short RESPONSE_CODE_INTERNAL_ERROR = 15;

  public static final short CODE_QUEUE_FULL = 10_001;
  public static final short CODE_TRANSPORT_INITIALIZATION_FAILED = 10_002;
  public static final short CODE_TOPIC_RESOLUTION_FAILED = 10_003;
  public static final short CODE_DELIVERY_ATTEMPTS_EXHAUSTED = 10_004;
  public static final short CODE_INTERRUPTED = 10_005;

  private Constants() {}
}
