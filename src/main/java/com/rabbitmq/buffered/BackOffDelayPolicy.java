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

import java.time.Duration;

/**
 * Contract to determine a delay between attempts of some task.
 *
 * <p>The task is the re-submission of messages the broker failed.
 *
 * @see BufferedProducerBuilder#retryBackOffDelayPolicy(BackOffDelayPolicy)
 */
public interface BackOffDelayPolicy {

  Duration TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

  /**
   * A policy with no delay and no limit.
   *
   * @return the policy
   */
  static BackOffDelayPolicy immediate() {
    return fixed(Duration.ZERO);
  }

  /**
   * A policy with a constant delay.
   *
   * @param delay
   * @return the constant delay policy
   */
  static BackOffDelayPolicy fixed(Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(delay, delay);
  }

  /**
   * A policy with a first delay and then a constant delay.
   *
   * @param initialDelay
   * @param delay
   * @return the policy with an initial delay
   */
  static BackOffDelayPolicy fixedWithInitialDelay(Duration initialDelay, Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(initialDelay, delay);
  }

  /**
   * A policy with a first delay, then a constant delay until a timeout is reached.
   *
   * @param initialDelay
   * @param delay
   * @param timeout
   * @return the policy with an initial delay
   */
  static BackOffDelayPolicy fixedWithInitialDelay(
      Duration initialDelay, Duration delay, Duration timeout) {
    return new FixedWithInitialDelayAndTimeoutBackOffPolicy(initialDelay, delay, timeout);
  }

  /**
   * A policy doubling the delay on each attempt, up to a maximum.
   *
   * @param initialDelay
   * @param maxDelay
   * @return the exponential policy
   */
  static BackOffDelayPolicy exponential(Duration initialDelay, Duration maxDelay) {
    return new ExponentialBackOffPolicy(initialDelay, maxDelay);
  }

  /**
   * Returns the delay to use for a given attempt.
   *
   * <p>The policy can return the TIMEOUT constant to indicate that the task has reached a timeout.
   *
   * @param attempt
   * @return the delay, TIMEOUT if the task should stop being retried
   */
  Duration delay(int attempt);

  class FixedWithInitialDelayBackOffPolicy implements BackOffDelayPolicy {

    private final Duration initialDelay;
    private final Duration delay;

    private FixedWithInitialDelayBackOffPolicy(Duration initialDelay, Duration delay) {
      if (initialDelay.isNegative() || delay.isNegative()) {
        throw new IllegalArgumentException("Delays cannot be negative");
      }
      this.initialDelay = initialDelay;
      this.delay = delay;
    }

    @Override
    public Duration delay(int attempt) {
      return attempt == 0 ? initialDelay : delay;
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayBackOffPolicy{"
          + "initialDelay="
          + initialDelay
          + ", delay="
          + delay
          + '}';
    }
  }

  class FixedWithInitialDelayAndTimeoutBackOffPolicy implements BackOffDelayPolicy {

    private final int attemptLimitBeforeTimeout;
    private final BackOffDelayPolicy delegate;

    private FixedWithInitialDelayAndTimeoutBackOffPolicy(
        Duration initialDelay, Duration delay, Duration timeout) {
      if (timeout.toMillis() < initialDelay.toMillis()) {
        throw new IllegalArgumentException("Timeout must be longer than initial delay");
      }
      if (delay.isZero()) {
        throw new IllegalArgumentException("Delay must be positive when a timeout is set");
      }
      this.delegate = fixedWithInitialDelay(initialDelay, delay);
      long timeoutWithInitialDelay = timeout.toMillis() - initialDelay.toMillis();
      this.attemptLimitBeforeTimeout = (int) (timeoutWithInitialDelay / delay.toMillis()) + 1;
    }

    @Override
    public Duration delay(int attempt) {
      if (attempt >= attemptLimitBeforeTimeout) {
        return TIMEOUT;
      } else {
        return delegate.delay(attempt);
      }
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayAndTimeoutBackOffPolicy{"
          + "attemptLimitBeforeTimeout="
          + attemptLimitBeforeTimeout
          + ", delegate="
          + delegate
          + '}';
    }
  }

  class ExponentialBackOffPolicy implements BackOffDelayPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;

    private ExponentialBackOffPolicy(Duration initialDelay, Duration maxDelay) {
      if (initialDelay.toMillis() <= 0) {
        throw new IllegalArgumentException("Initial delay must be at least 1 millisecond");
      }
      if (maxDelay.compareTo(initialDelay) < 0) {
        throw new IllegalArgumentException("Maximum delay must be longer than initial delay");
      }
      this.initialDelay = initialDelay;
      this.maxDelay = maxDelay;
    }

    @Override
    public Duration delay(int attempt) {
      // 2^30 is already far beyond any sensible maximum
      int shift = Math.min(attempt, 30);
      long initialMillis = initialDelay.toMillis();
      // compared before shifting, the shift itself could overflow
      if (initialMillis > (maxDelay.toMillis() >> shift)) {
        return maxDelay;
      }
      return Duration.ofMillis(initialMillis << shift);
    }

    @Override
    public String toString() {
      return "ExponentialBackOffPolicy{"
          + "initialDelay="
          + initialDelay
          + ", maxDelay="
          + maxDelay
          + '}';
    }
  }
}
