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

import java.util.List;

/**
 * Consumer that acknowledges deliveries in blocks.
 *
 * <p>Deliveries the {@link DeliveryHandler} defers are acknowledged together, with one cumulative
 * acknowledgment, once the block is full or once the idle timeout elapsed since the last
 * acknowledgment. The block size is the prefetch count of the queue's channel.
 *
 * <p>Before a block is acknowledged the {@link FlushDeferredHandler} is called: if it fails, the
 * whole block is negatively acknowledged. The block is requeued unless one of its deliveries was
 * already a redelivery, in which case the broker drops (or dead-letters) it.
 *
 * <p>Instances are configured and created with a {@link ConsumerBuilder}.
 *
 * @see BatchEnvironment#consumerBuilder()
 */
public interface Consumer extends AutoCloseable {

  /**
   * Start consuming. The call blocks until the consumer is stopped.
   *
   * @see #stop()
   */
  void consume();

  /**
   * Start consuming and stop once the given number of messages has been accepted.
   *
   * @param messageAmount number of messages to accept, 0 for no limit
   */
  void consume(int messageAmount);

  /**
   * Ask the consume loop to stop.
   *
   * <p>The in-flight message, if any, is processed completely before the loop returns.
   */
  void stop();

  /**
   * Whether a message is being processed at the moment.
   *
   * @return true if the handler is processing a message
   */
  boolean messageInProgress();

  /**
   * The queue under the cursor, the one the consumer consumes from.
   *
   * @return the current queue
   */
  Queue queue();

  /**
   * All the configured queues.
   *
   * @return the queues
   */
  List<Queue> queues();

  /**
   * Number of messages accepted (acknowledged or deferred) since the creation of the consumer.
   *
   * @return accepted message count
   */
  long consumedMessageCount();

  /**
   * Number of deferred messages in the current block.
   *
   * @return unacknowledged message count
   */
  int unackedMessageCount();

  /** Stop the consumer. The queues and their channels are left open. */
  @Override
  void close();

  /** Contract to process a delivery. */
  @FunctionalInterface
  interface DeliveryHandler {

    /**
     * Process a delivery.
     *
     * <p>An exception is reported to the delivery exception listener and counts as {@link
     * ProcessingFlag#REJECT}.
     *
     * @param delivery the delivery
     * @param queue the queue the delivery comes from
     * @return the processing flag, null is the same as {@link ProcessingFlag#DEFER}
     * @throws Exception if the processing fails
     */
    ProcessingFlag handle(Delivery delivery, Queue queue) throws Exception;
  }

  /**
   * Contract to commit the work of deferred deliveries before their block is acknowledged.
   *
   * <p>A typical implementation flushes a buffer of database writes.
   */
  @FunctionalInterface
  interface FlushDeferredHandler {

    /**
     * Commit deferred work.
     *
     * @return true to acknowledge the block, false to negatively acknowledge it
     * @throws Exception if the commit fails, same as returning false
     */
    boolean flush() throws Exception;
  }

  /** Listener for exceptions raised by handlers. */
  @FunctionalInterface
  interface ExceptionListener {

    void handle(Exception exception);
  }

  /** Listener called after a block has been acknowledged. */
  @FunctionalInterface
  interface AckListener {

    void handle(AckContext context);
  }

  /** Information on an acknowledged block. */
  interface AckContext {

    /**
     * Time of the last accepted message of the block, from a monotonic clock, in nanoseconds.
     *
     * @return time of the last message
     */
    long timestampLastMessage();

    /**
     * Time of the previous acknowledgment, from a monotonic clock, in nanoseconds.
     *
     * @return time of the previous acknowledgment
     */
    long timestampLastAck();

    /**
     * Number of messages the acknowledgment covers.
     *
     * @return message count
     */
    int messageCount();
  }
}
