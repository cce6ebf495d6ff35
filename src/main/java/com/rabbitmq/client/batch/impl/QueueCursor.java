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

import com.rabbitmq.client.batch.Queue;
import java.util.List;

/**
 * Endless cyclic sequence over the queues of a consumer.
 *
 * <p>The cursor starts before the first queue, {@link #current()} returns the first queue until
 * the first {@link #advance()}.
 */
final class QueueCursor {

  private final List<Queue> queues;
  private int index = -1;

  QueueCursor(List<Queue> queues) {
    if (queues == null || queues.isEmpty()) {
      throw new IllegalArgumentException("No queues given");
    }
    for (Queue queue : queues) {
      if (queue == null) {
        throw new IllegalArgumentException("Queue cannot be null");
      }
    }
    this.queues = List.copyOf(queues);
  }

  Queue advance() {
    this.index = (this.index + 1) % this.queues.size();
    return this.queues.get(this.index);
  }

  Queue current() {
    return this.queues.get(Math.max(this.index, 0));
  }

  List<Queue> queues() {
    return this.queues;
  }

  int size() {
    return this.queues.size();
  }
}
