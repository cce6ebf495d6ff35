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

/** API to configure and create a {@link RpcClient}. */
public interface RpcClientBuilder {

  /**
   * The queue the client expects replies on. Its name is the reply-to of the requests.
   *
   * @param replyQueue reply queue
   * @return this builder instance
   */
  RpcClientBuilder replyQueue(Queue replyQueue);

  /**
   * A callback before publishing a request.
   *
   * @param requestPostProcessor logic to post-process requests
   * @return this builder instance
   */
  RpcClientBuilder requestPostProcessor(RpcClient.RequestPostProcessor requestPostProcessor);

  /**
   * Time to wait between two fetches of the reply queue when no matching reply came.
   *
   * <p>Default is 1 millisecond.
   *
   * @param pollInterval poll interval
   * @return this builder instance
   */
  RpcClientBuilder pollInterval(Duration pollInterval);

  /**
   * Time {@link RpcClient#getReplies()} waits when no request of the batch has an expiration.
   *
   * <p>Default is {@link Duration#ZERO}: no time limit, the collection lasts until all the
   * requests got a reply.
   *
   * @param replyTimeout reply timeout
   * @return this builder instance
   */
  RpcClientBuilder replyTimeout(Duration replyTimeout);

  /**
   * Build the configured instance.
   *
   * @return the configured instance
   */
  RpcClient build();
}
