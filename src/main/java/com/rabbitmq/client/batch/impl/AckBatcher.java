// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.client.batch.impl;

import static com.rabbitmq.client.batch.metrics.MetricsCollector.ConsumeDisposition.ACKED;
import static com.rabbitmq.client.batch.metrics.MetricsCollector.ConsumeDisposition.DISCARDED;
import static com.rabbitmq.client.batch.metrics.MetricsCollector.ConsumeDisposition.REQUEUED;

import com.rabbitmq.client.batch.Consumer;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Block of accepted but not yet acknowledged deliveries.
 *
 * <p>The block is settled with one cumulative acknowledgment (or negative acknowledgment) on its
 * last delivery tag.
 *
 * <p>Not thread-safe: only the consume loop thread touches the state.
 */
final class AckBatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(AckBatcher.class);

  private final QueueCursor queues;
  private final int blockSize;
  private final long idleTimeoutInNanos;
  private final Clock clock;
  private final Consumer.FlushDeferredHandler flushDeferredHandler;
  private final Consumer.ExceptionListener flushDeferredExceptionListener;
  private final Consumer.AckListener ackListener;
  private final MetricsCollector metricsCollector;

  private long consumedCount = 0;
  private int unackedCount = 0;
  // null iff unackedCount == 0
  private Long lastDeliveryTag;
  private boolean redeliverySeen = false;
  private long timestampLastAck;
  private long timestampLastMessage;

  AckBatcher(
      QueueCursor queues,
      int blockSize,
      Duration idleTimeout,
      Clock clock,
      Consumer.FlushDeferredHandler flushDeferredHandler,
      Consumer.ExceptionListener flushDeferredExceptionListener,
      Consumer.AckListener ackListener,
      MetricsCollector metricsCollector) {
    this.queues = queues;
    this.blockSize = blockSize;
    this.idleTimeoutInNanos = idleTimeout.toNanos();
    this.clock = clock;
    this.flushDeferredHandler = flushDeferredHandler;
    this.flushDeferredExceptionListener = flushDeferredExceptionListener;
    this.ackListener = ackListener;
    this.metricsCollector = metricsCollector;
    this.timestampLastAck = clock.time();
  }

  /** Start the idle timeout from now. */
  void start() {
    this.timestampLastAck = this.clock.time();
  }

  void recordAccepted(long deliveryTag, boolean redelivery) {
    this.consumedCount++;
    this.unackedCount++;
    this.lastDeliveryTag = deliveryTag;
    this.timestampLastMessage = this.clock.time();
    if (redelivery) {
      this.redeliverySeen = true;
    }
  }

  boolean shouldFlush(long now) {
    return this.unackedCount > 0
        && (this.unackedCount == this.blockSize
            || (now - this.timestampLastAck) > this.idleTimeoutInNanos);
  }

  /**
   * Commit the deferred work with the flush handler, then acknowledge the block if the commit
   * succeeded, or negatively acknowledge it otherwise.
   *
   * <p>The block is requeued on failure, unless it contains a redelivered message.
   */
  void flush() {
    if (this.lastDeliveryTag == null) {
      return;
    }
    boolean flushed;
    try {
      flushed = this.flushDeferredHandler.flush();
    } catch (Exception e) {
      flushed = false;
      LOGGER.debug("Error while flushing deferred messages: {}", e.getMessage());
      notifyFlushDeferredException(e);
    }

    if (flushed) {
      ack();
    } else {
      nack(!this.redeliverySeen);
    }
  }

  /** Acknowledge the block, without calling the flush handler. */
  void ack() {
    if (this.lastDeliveryTag == null) {
      return;
    }
    long deliveryTag = this.lastDeliveryTag;
    int messageCount = this.unackedCount;
    this.queues.current().ack(deliveryTag, true);
    LOGGER.debug("Acked {} message(s) up to delivery tag {}", messageCount, deliveryTag);
    this.metricsCollector.consumeDisposition(ACKED, messageCount);
    Consumer.AckContext context =
        new DefaultAckContext(this.timestampLastMessage, this.timestampLastAck, messageCount);
    this.timestampLastAck = this.clock.time();
    reset();
    try {
      this.ackListener.handle(context);
    } catch (Exception e) {
      LOGGER.warn("Error in ack listener: {}", e.getMessage());
    }
  }

  private void nack(boolean requeue) {
    long deliveryTag = this.lastDeliveryTag;
    int messageCount = this.unackedCount;
    this.queues.current().nack(deliveryTag, true, requeue);
    LOGGER.debug(
        "Nacked {} message(s) up to delivery tag {} (requeue: {})",
        messageCount,
        deliveryTag,
        requeue);
    this.metricsCollector.consumeDisposition(requeue ? REQUEUED : DISCARDED, messageCount);
    reset();
  }

  private void reset() {
    this.unackedCount = 0;
    this.lastDeliveryTag = null;
    this.redeliverySeen = false;
  }

  private void notifyFlushDeferredException(Exception exception) {
    try {
      this.flushDeferredExceptionListener.handle(exception);
    } catch (Exception e) {
      LOGGER.warn("Error in flush deferred exception listener: {}", e.getMessage());
    }
  }

  long consumedCount() {
    return this.consumedCount;
  }

  int unackedCount() {
    return this.unackedCount;
  }

  Long lastDeliveryTag() {
    return this.lastDeliveryTag;
  }

  boolean redeliverySeen() {
    return this.redeliverySeen;
  }

  long timestampLastAck() {
    return this.timestampLastAck;
  }

  long timestampLastMessage() {
    return this.timestampLastMessage;
  }

  int blockSize() {
    return this.blockSize;
  }

  private static final class DefaultAckContext implements Consumer.AckContext {

    private final long timestampLastMessage;
    private final long timestampLastAck;
    private final int messageCount;

    private DefaultAckContext(long timestampLastMessage, long timestampLastAck, int messageCount) {
      this.timestampLastMessage = timestampLastMessage;
      this.timestampLastAck = timestampLastAck;
      this.messageCount = messageCount;
    }

    @Override
    public long timestampLastMessage() {
      return this.timestampLastMessage;
    }

    @Override
    public long timestampLastAck() {
      return this.timestampLastAck;
    }

    @Override
    public int messageCount() {
      return this.messageCount;
    }
  }
}
