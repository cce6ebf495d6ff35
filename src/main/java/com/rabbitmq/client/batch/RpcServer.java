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

/**
 * Server side of RPC.
 *
 * <p>Each request is acknowledged as soon as it is delivered, then processed by the {@link
 * Handler}. The outcome goes back to the requester in a JSON reply, published to the request
 * reply-to queue with the request correlation ID: <code>{"success": true, "result": ...}</code> or
 * <code>{"success": false, "error": "..."}</code>.
 *
 * @see RpcServerBuilder
 */
public interface RpcServer extends Consumer {

  /**
   * The exchange replies are published to.
   *
   * @return the reply exchange
   */
  Exchange replyExchange();

  /**
   * Set the exchange replies are published to.
   *
   * @param exchange reply exchange
   */
  void replyExchange(Exchange exchange);

  /** Contract to process a request. */
  @FunctionalInterface
  interface Handler {

    /**
     * Process a request.
     *
     * @param request the request
     * @param queue the queue the request comes from
     * @return the result, serialized in the reply
     * @throws Exception if the processing fails, the message ends up in the reply
     */
    Object handle(Delivery request, Queue queue) throws Exception;
  }
}
