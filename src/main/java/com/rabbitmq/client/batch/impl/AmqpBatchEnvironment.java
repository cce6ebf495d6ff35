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
import com.rabbitmq.client.batch.ConsumerBuilder;
import com.rabbitmq.client.batch.RpcClientBuilder;
import com.rabbitmq.client.batch.RpcServerBuilder;
import com.rabbitmq.client.batch.metrics.MetricsCollector;

class AmqpBatchEnvironment implements BatchEnvironment {

  private final MetricsCollector metricsCollector;
  private final Clock clock;

  AmqpBatchEnvironment(MetricsCollector metricsCollector, Clock clock) {
    this.metricsCollector = metricsCollector;
    this.clock = clock;
  }

  @Override
  public ConsumerBuilder consumerBuilder() {
    return new AmqpConsumerBuilder(this);
  }

  @Override
  public RpcServerBuilder rpcServerBuilder() {
    return new RpcSupport.AmqpRpcServerBuilder(this);
  }

  @Override
  public RpcClientBuilder rpcClientBuilder() {
    return new RpcSupport.AmqpRpcClientBuilder(this);
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  Clock clock() {
    return this.clock;
  }
}
