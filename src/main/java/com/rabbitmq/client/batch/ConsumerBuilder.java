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
import java.util.List;
import java.util.function.BooleanSupplier;

/** API to configure and create a {@link Consumer}. */
public interface ConsumerBuilder {

  /**
   * The queue to consume from.
   *
   * @param queue queue
   * @return this builder instance
   */
  ConsumerBuilder queue(Queue queue);

  /**
   * The queues of the consumer.
   *
   * <p>The block size is the prefetch count of the first queue. Only the first queue is consumed
   * from at the moment.
   *
   * @param queues queues
   * @return this builder instance
   */
  ConsumerBuilder queues(List<Queue> queues);

  /**
   * Time after the last acknowledgment a non-full block is flushed.
   *
   * <p>Default is 10 seconds.
   *
   * @param idleTimeout idle timeout
   * @return this builder instance
   */
  ConsumerBuilder idleTimeout(Duration idleTimeout);

  /**
   * Time the consume loop waits for a delivery before checking the idle timeout and the
   * cancellation check.
   *
   * <p>Default is 100 milliseconds.
   *
   * @param waitTimeout wait timeout
   * @return this builder instance
   */
  ConsumerBuilder waitTimeout(Duration waitTimeout);

  /**
   * The logic to process deliveries.
   *
   * @param handler delivery handler
   * @return this builder instance
   */
  ConsumerBuilder deliveryHandler(Consumer.DeliveryHandler handler);

  /**
   * Listener for exceptions thrown by the delivery handler.
   *
   * @param listener exception listener
   * @return this builder instance
   */
  ConsumerBuilder deliveryExceptionListener(Consumer.ExceptionListener listener);

  /**
   * The logic to commit deferred work before a block is acknowledged.
   *
   * <p>The default handler returns true.
   *
   * @param handler flush handler
   * @return this builder instance
   */
  ConsumerBuilder flushDeferredHandler(Consumer.FlushDeferredHandler handler);

  /**
   * Listener for exceptions thrown by the flush handler.
   *
   * @param listener exception listener
   * @return this builder instance
   */
  ConsumerBuilder flushDeferredExceptionListener(Consumer.ExceptionListener listener);

  /**
   * Listener called after each block acknowledgment.
   *
   * @param listener acknowledgment listener
   * @return this builder instance
   */
  ConsumerBuilder ackListener(Consumer.AckListener listener);

  /**
   * Check called once per iteration of the consume loop. The loop stops when the check returns
   * true.
   *
   * @param cancellationCheck cancellation check
   * @return this builder instance
   */
  ConsumerBuilder cancellationCheck(BooleanSupplier cancellationCheck);

  /**
   * Build the configured instance.
   *
   * @return the configured instance
   */
  Consumer build();
}
