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

import static com.rabbitmq.client.batch.metrics.MetricsCollector.ConsumeDisposition.DISCARDED;
import static com.rabbitmq.client.batch.metrics.MetricsCollector.ConsumeDisposition.REQUEUED;

import com.rabbitmq.client.batch.Delivery;
import com.rabbitmq.client.batch.ProcessingFlag;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Callback of the consume loop: runs the handler on each delivery, applies the processing flag,
 * and flushes the block when it is full or idle.
 */
final class DeliveryDispatcher implements Queue.DeliveryCallback {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryDispatcher.class);

  private final Queue queue;
  private final AckBatcher batcher;
  private final Target target;
  private final Clock clock;
  private final MetricsCollector metricsCollector;

  DeliveryDispatcher(
      Queue queue,
      AckBatcher batcher,
      Target target,
      Clock clock,
      MetricsCollector metricsCollector) {
    this.queue = queue;
    this.batcher = batcher;
    this.target = target;
    this.clock = clock;
    this.metricsCollector = metricsCollector;
  }

  @Override
  public boolean handle(Delivery delivery) {
    this.target.markMessageInProgress(true);
    try {
      this.metricsCollector.consume();
      ProcessingFlag flag;
      try {
        flag = this.target.handleDelivery(delivery, this.queue);
      } catch (Exception e) {
        LOGGER.debug(
            "Error while processing delivery {}: {}", delivery.deliveryTag(), e.getMessage());
        this.target.handleDeliveryException(e);
        flag = ProcessingFlag.REJECT;
      }
      this.target.handleProcessFlag(delivery, flag == null ? ProcessingFlag.DEFER : flag);
    } finally {
      this.target.markMessageInProgress(false);
    }
    return this.target.keepAlive();
  }

  @Override
  public boolean idle() {
    this.maybeFlush();
    return this.target.keepAlive();
  }

  void applyFlag(Delivery delivery, ProcessingFlag flag) {
    long deliveryTag = delivery.deliveryTag();
    switch (flag) {
      case REJECT:
        this.batcher.flush();
        this.queue.reject(deliveryTag, false);
        this.metricsCollector.consumeDisposition(DISCARDED, 1);
        break;
      case REJECT_REQUEUE:
        this.batcher.flush();
        this.queue.reject(deliveryTag, true);
        this.metricsCollector.consumeDisposition(REQUEUED, 1);
        break;
      case ACK:
        this.batcher.recordAccepted(deliveryTag, delivery.isRedelivery());
        this.batcher.ack();
        break;
      case DEFER:
      default:
        this.batcher.recordAccepted(deliveryTag, delivery.isRedelivery());
        this.maybeFlush();
        break;
    }
  }

  private void maybeFlush() {
    if (this.batcher.shouldFlush(this.clock.time())) {
      this.batcher.flush();
    }
  }

  /** The consumer the dispatcher works for. */
  interface Target {

    ProcessingFlag handleDelivery(Delivery delivery, Queue queue) throws Exception;

    void handleDeliveryException(Exception exception);

    void handleProcessFlag(Delivery delivery, ProcessingFlag flag);

    void markMessageInProgress(boolean inProgress);

    /**
     * Whether the consume loop should go on, called once per iteration.
     *
     * @return true to keep consuming
     */
    boolean keepAlive();
  }
}
