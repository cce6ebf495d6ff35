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
package com.rabbitmq.client.batch.metrics;

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a new {@link com.rabbitmq.client.batch.Consumer} is created. */
  void openConsumer();

  /** Called when a {@link com.rabbitmq.client.batch.Consumer} is closed. */
  void closeConsumer();

  /** Called when a message is published (RPC request or RPC reply). */
  void publish();

  /** Called when a message is dispatched to a {@link com.rabbitmq.client.batch.Consumer}. */
  void consume();

  /**
   * Called when messages are settled by a {@link com.rabbitmq.client.batch.Consumer}.
   *
   * @param disposition disposition (outcome)
   * @param messageCount number of messages the settlement covers
   */
  void consumeDisposition(ConsumeDisposition disposition, int messageCount);

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** Positive acknowledgment. */
    ACKED,
    /** Negative acknowledgment or rejection with requeue. */
    REQUEUED,
    /** Negative acknowledgment or rejection without requeue. */
    DISCARDED
  }
}
