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
 * Outcome of the processing of a delivery, as returned by a {@link Consumer.DeliveryHandler}.
 *
 * <p>A handler returning <code>null</code> is the same as returning {@link #DEFER}.
 */
public enum ProcessingFlag {

  /**
   * The delivery has been processed. It is acknowledged right away, together with the deferred
   * deliveries of the current block.
   */
  ACK,

  /**
   * The delivery cannot be processed. The current block is flushed, then the delivery is rejected
   * without requeueing (the broker drops or dead-letters it).
   */
  REJECT,

  /**
   * The delivery cannot be processed now. The current block is flushed, then the delivery is
   * rejected and requeued.
   */
  REJECT_REQUEUE,

  /**
   * The delivery is added to the current block. The block is acknowledged once it is full or the
   * idle timeout elapses.
   */
  DEFER;

  /**
   * Boolean shorthand: <code>true</code> is {@link #ACK}, <code>false</code> is {@link #REJECT},
   * <code>null</code> is {@link #DEFER}.
   *
   * @param flag boolean flag, can be null
   * @return the corresponding processing flag
   */
  public static ProcessingFlag of(Boolean flag) {
    if (flag == null) {
      return DEFER;
    } else {
      return flag ? ACK : REJECT;
    }
  }
}
