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

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outstanding requests of the current RPC batch and the time to wait for their replies.
 *
 * <p>Not thread-safe.
 */
final class RpcRequestTracker {

  private final Set<String> outstandingRequests = new LinkedHashSet<>();
  private int timeoutInSeconds = 0;

  /**
   * Register a request. A request ID already registered in the batch is only counted once.
   *
   * @param requestId request ID
   * @param expirationInSeconds expiration of the request, 0 for none
   */
  void add(String requestId, int expirationInSeconds) {
    this.outstandingRequests.add(requestId);
    if (expirationInSeconds > this.timeoutInSeconds) {
      this.timeoutInSeconds = expirationInSeconds;
    }
  }

  boolean isOutstanding(String correlationId) {
    return correlationId != null && this.outstandingRequests.contains(correlationId);
  }

  int outstandingCount() {
    return this.outstandingRequests.size();
  }

  /**
   * The longest expiration of the batch, zero if no request has an expiration.
   *
   * @return the reply timeout
   */
  Duration timeout() {
    return Duration.ofSeconds(this.timeoutInSeconds);
  }

  void clear() {
    this.outstandingRequests.clear();
    this.timeoutInSeconds = 0;
  }
}
