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
import java.util.function.BooleanSupplier;

/** API to configure and create a {@link RpcServer}. */
public interface RpcServerBuilder {

  /**
   * The queue requests arrive on.
   *
   * @param queue request queue
   * @return this builder instance
   */
  RpcServerBuilder queue(Queue queue);

  /**
   * The logic to process requests.
   *
   * @param handler request handler
   * @return this builder instance
   */
  RpcServerBuilder handler(RpcServer.Handler handler);

  /**
   * The exchange to publish replies to.
   *
   * <p>Default is the default exchange of the request queue's channel, which routes replies
   * directly to the reply-to queue.
   *
   * @param exchange reply exchange
   * @return this builder instance
   */
  RpcServerBuilder replyExchange(Exchange exchange);

  /**
   * Time the consume loop waits for a request before checking the cancellation check.
   *
   * <p>Default is 100 milliseconds.
   *
   * @param waitTimeout wait timeout
   * @return this builder instance
   */
  RpcServerBuilder waitTimeout(Duration waitTimeout);

  /**
   * Listener for exceptions raised while processing a request and sending its reply.
   *
   * @param listener exception listener
   * @return this builder instance
   */
  RpcServerBuilder deliveryExceptionListener(Consumer.ExceptionListener listener);

  /**
   * Listener called after each acknowledgment.
   *
   * @param listener acknowledgment listener
   * @return this builder instance
   */
  RpcServerBuilder ackListener(Consumer.AckListener listener);

  /**
   * Check called once per iteration of the consume loop. The loop stops when the check returns
   * true.
   *
   * @param cancellationCheck cancellation check
   * @return this builder instance
   */
  RpcServerBuilder cancellationCheck(BooleanSupplier cancellationCheck);

  /**
   * Build the configured instance.
   *
   * @return the configured instance
   */
  RpcServer build();
}
