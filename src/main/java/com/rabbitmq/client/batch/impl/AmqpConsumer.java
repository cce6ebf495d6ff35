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

import com.rabbitmq.client.batch.AmqpException;
import com.rabbitmq.client.batch.Consumer;
import com.rabbitmq.client.batch.Delivery;
import com.rabbitmq.client.batch.ProcessingFlag;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class AmqpConsumer implements Consumer, DeliveryDispatcher.Target {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpConsumer.class);

  private final QueueCursor queues;
  private final AckBatcher batcher;
  private final Duration waitTimeout;
  private final DeliveryHandler deliveryHandler;
  private final ExceptionListener deliveryExceptionListener;
  private final BooleanSupplier cancellationCheck;
  private final Clock clock;
  private final MetricsCollector metricsCollector;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile boolean keepAlive = true;
  private volatile boolean messageInProgress = false;
  private volatile DeliveryDispatcher dispatcher;
  private long target = 0;

  AmqpConsumer(AmqpConsumerBuilder builder) {
    this.queues = new QueueCursor(builder.queues());
    this.waitTimeout = builder.waitTimeout();
    this.deliveryHandler = builder.deliveryHandler();
    this.deliveryExceptionListener = builder.deliveryExceptionListener();
    this.cancellationCheck = builder.cancellationCheck();
    this.clock = builder.environment().clock();
    this.metricsCollector = builder.environment().metricsCollector();
    int blockSize = this.queues.current().prefetchCount();
    this.batcher =
        new AckBatcher(
            this.queues,
            blockSize,
            builder.idleTimeout(),
            this.clock,
            builder.flushDeferredHandler(),
            builder.flushDeferredExceptionListener(),
            builder.ackListener(),
            this.metricsCollector);
    this.metricsCollector.openConsumer();
    LOGGER.debug(
        "Created consumer on {} queue(s), block size {}, idle timeout {}",
        this.queues.size(),
        blockSize,
        builder.idleTimeout());
  }

  @Override
  public void consume() {
    this.consume(0);
  }

  @Override
  public void consume(int messageAmount) {
    checkOpen();
    if (messageAmount < 0) {
      throw new IllegalArgumentException("Message amount cannot be negative");
    }
    this.target = messageAmount == 0 ? 0 : this.batcher.consumedCount() + messageAmount;
    // single-queue consumption, the cursor moves once and stays on the first queue
    Queue queue = this.queues.advance();
    this.batcher.start();
    this.dispatcher =
        new DeliveryDispatcher(queue, this.batcher, this, this.clock, this.metricsCollector);
    LOGGER.debug("Start consuming from queue '{}'", queue.name());
    queue.consume(this.dispatcher, this.waitTimeout);
    LOGGER.debug("Stopped consuming from queue '{}'", queue.name());
  }

  @Override
  public ProcessingFlag handleDelivery(Delivery delivery, Queue queue) throws Exception {
    return this.deliveryHandler.handle(delivery, queue);
  }

  @Override
  public void handleDeliveryException(Exception exception) {
    try {
      this.deliveryExceptionListener.handle(exception);
    } catch (Exception e) {
      LOGGER.warn("Error in delivery exception listener: {}", e.getMessage());
    }
  }

  @Override
  public void handleProcessFlag(Delivery delivery, ProcessingFlag flag) {
    this.dispatcher.applyFlag(delivery, flag);
  }

  @Override
  public void markMessageInProgress(boolean inProgress) {
    this.messageInProgress = inProgress;
  }

  @Override
  public boolean keepAlive() {
    if (this.keepAlive && this.cancellationCheck.getAsBoolean()) {
      LOGGER.debug("Cancellation requested, stopping consume loop");
      this.keepAlive = false;
    }
    if (this.target > 0 && this.batcher.consumedCount() >= this.target) {
      return false;
    }
    return this.keepAlive;
  }

  @Override
  public void stop() {
    this.keepAlive = false;
    if (this.messageInProgress) {
      LOGGER.debug("Stop requested, waiting for in-flight message");
    }
  }

  @Override
  public boolean messageInProgress() {
    return this.messageInProgress;
  }

  @Override
  public Queue queue() {
    return this.queues.current();
  }

  @Override
  public List<Queue> queues() {
    return this.queues.queues();
  }

  @Override
  public long consumedMessageCount() {
    return this.batcher.consumedCount();
  }

  @Override
  public int unackedMessageCount() {
    return this.batcher.unackedCount();
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.stop();
      int unacked = this.batcher.unackedCount();
      if (unacked > 0) {
        LOGGER.info("Closing consumer with {} unacknowledged message(s)", unacked);
      }
      this.metricsCollector.closeConsumer();
    }
  }

  AckBatcher batcher() {
    return this.batcher;
  }

  private void checkOpen() {
    if (this.closed.get()) {
      throw new AmqpException.AmqpResourceClosedException("Consumer is closed");
    }
  }
}
