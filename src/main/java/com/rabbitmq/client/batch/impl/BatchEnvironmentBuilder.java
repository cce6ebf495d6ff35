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

import com.rabbitmq.client.batch.BatchEnvironment;
import com.rabbitmq.client.batch.metrics.MetricsCollector;
import com.rabbitmq.client.batch.metrics.NoOpMetricsCollector;

/**
 * Builder for {@link BatchEnvironment} instances.
 *
 * <pre>{@code
 * BatchEnvironment environment = new BatchEnvironmentBuilder()
 *     .metricsCollector(new MicrometerMetricsCollector(registry))
 *     .build();
 * }</pre>
 */
public class BatchEnvironmentBuilder {

  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private Clock clock = new Clock();

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector metrics collector
   * @return this builder instance
   * @see com.rabbitmq.client.batch.metrics.MicrometerMetricsCollector
   */
  public BatchEnvironmentBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  BatchEnvironmentBuilder clock(Clock clock) {
    this.clock = clock;
    return this;
  }

  /**
   * Create the environment instance.
   *
   * @return the configured environment
   */
  public BatchEnvironment build() {
    return new AmqpBatchEnvironment(this.metricsCollector, this.clock);
  }
}
