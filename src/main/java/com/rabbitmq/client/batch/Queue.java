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
package com.rabbitmq.client.batch;

import java.time.Duration;

/**
 * Handle on a broker queue and the channel it is bound to.
 *
 * <p>Consumers and RPC clients borrow a queue, they do not own it: closing them does not close
 * the underlying channel.
 *
 * <p>Instances are not thread-safe, they must be used from one thread at a time.
 *
 * @see com.rabbitmq.client.batch.transport.ChannelQueue
 */
public interface Queue {

  /**
   * The name of the queue.
   *
   * @return queue name
   */
  String name();

  /**
   * The prefetch count of the channel, that is the maximum number of unacknowledged deliveries.
   *
   * @return the prefetch count
   */
  int prefetchCount();

  /**
   * Subscribe to the queue and dispatch deliveries to the callback until the callback asks to
   * stop.
   *
   * <p>The call blocks. The callback is called from the calling thread, one delivery at a time.
   * Deliveries must be settled explicitly.
   *
   * @param callback delivery callback
   * @param waitTimeout time to wait for a delivery before calling {@link DeliveryCallback#idle()}
   */
  void consume(DeliveryCallback callback, Duration waitTimeout);

  /**
   * Fetch a message without waiting.
   *
   * @param autoAck whether the broker considers the message acknowledged once sent
   * @return the message, or null if the queue is empty
   */
  Delivery get(boolean autoAck);

  /**
   * Acknowledge a delivery.
   *
   * @param deliveryTag the delivery tag
   * @param multiple whether to acknowledge all unacknowledged deliveries up to and including the
   *     tag
   */
  void ack(long deliveryTag, boolean multiple);

  /**
   * Negatively acknowledge a delivery.
   *
   * @param deliveryTag the delivery tag
   * @param multiple whether to cover all unacknowledged deliveries up to and including the tag
   * @param requeue whether the broker should requeue the messages or drop (dead-letter) them
   */
  void nack(long deliveryTag, boolean multiple, boolean requeue);

  /**
   * Reject a single delivery.
   *
   * @param deliveryTag the delivery tag
   * @param requeue whether the broker should requeue the message or drop (dead-letter) it
   */
  void reject(long deliveryTag, boolean requeue);

  /**
   * A direct exchange on the same channel as the queue.
   *
   * <p>The exchange is not declared, it must exist. The empty name stands for the default
   * exchange.
   *
   * @param name exchange name
   * @return the exchange
   */
  Exchange exchange(String name);

  /** Callback for {@link #consume(DeliveryCallback, Duration)}. */
  interface DeliveryCallback {

    /**
     * Process a delivery.
     *
     * @param delivery the delivery
     * @return true to keep consuming, false to stop
     */
    boolean handle(Delivery delivery);

    /**
     * Called when no message arrived within the wait timeout.
     *
     * @return true to keep consuming, false to stop
     */
    default boolean idle() {
      return true;
    }
  }
}
