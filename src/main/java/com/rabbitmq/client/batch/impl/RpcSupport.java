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

import com.rabbitmq.client.batch.Consumer;
import com.rabbitmq.client.batch.Exchange;
import com.rabbitmq.client.batch.Queue;
import com.rabbitmq.client.batch.RpcClient;
import com.rabbitmq.client.batch.RpcClientBuilder;
import com.rabbitmq.client.batch.RpcServer;
import com.rabbitmq.client.batch.RpcServerBuilder;
import java.time.Duration;
import java.util.function.BooleanSupplier;

abstract class RpcSupport {

  private RpcSupport() {}

  static class AmqpRpcClientBuilder implements RpcClientBuilder {

    static final RpcClient.RequestPostProcessor NO_OP_REQUEST_POST_PROCESSOR = request -> null;
    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(1);

    private final AmqpBatchEnvironment environment;
    private Queue replyQueue;
    private RpcClient.RequestPostProcessor requestPostProcessor = NO_OP_REQUEST_POST_PROCESSOR;
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;
    private Duration replyTimeout = Duration.ZERO;

    AmqpRpcClientBuilder(AmqpBatchEnvironment environment) {
      this.environment = environment;
    }

    @Override
    public RpcClientBuilder replyQueue(Queue replyQueue) {
      this.replyQueue = replyQueue;
      return this;
    }

    @Override
    public RpcClientBuilder requestPostProcessor(
        RpcClient.RequestPostProcessor requestPostProcessor) {
      this.requestPostProcessor =
          requestPostProcessor == null ? NO_OP_REQUEST_POST_PROCESSOR : requestPostProcessor;
      return this;
    }

    @Override
    public RpcClientBuilder pollInterval(Duration pollInterval) {
      if (pollInterval == null || pollInterval.isNegative()) {
        throw new IllegalArgumentException("Poll interval must be positive or zero");
      }
      this.pollInterval = pollInterval;
      return this;
    }

    @Override
    public RpcClientBuilder replyTimeout(Duration replyTimeout) {
      if (replyTimeout == null || replyTimeout.isNegative()) {
        throw new IllegalArgumentException("Reply timeout must be positive or zero");
      }
      this.replyTimeout = replyTimeout;
      return this;
    }

    @Override
    public RpcClient build() {
      if (this.replyQueue == null) {
        throw new IllegalArgumentException("A reply queue must be specified");
      }
      return new AmqpRpcClient(this);
    }

    AmqpBatchEnvironment environment() {
      return this.environment;
    }

    Queue replyQueue() {
      return this.replyQueue;
    }

    RpcClient.RequestPostProcessor requestPostProcessor() {
      return this.requestPostProcessor;
    }

    Duration pollInterval() {
      return this.pollInterval;
    }

    Duration replyTimeout() {
      return this.replyTimeout;
    }
  }

  static class AmqpRpcServerBuilder implements RpcServerBuilder {

    private final AmqpConsumerBuilder consumerBuilder;
    private Queue queue;
    private RpcServer.Handler handler;
    private Exchange replyExchange;

    AmqpRpcServerBuilder(AmqpBatchEnvironment environment) {
      this.consumerBuilder = new AmqpConsumerBuilder(environment);
    }

    @Override
    public RpcServerBuilder queue(Queue queue) {
      this.queue = queue;
      this.consumerBuilder.queue(queue);
      return this;
    }

    @Override
    public RpcServerBuilder handler(RpcServer.Handler handler) {
      this.handler = handler;
      return this;
    }

    @Override
    public RpcServerBuilder replyExchange(Exchange exchange) {
      this.replyExchange = exchange;
      return this;
    }

    @Override
    public RpcServerBuilder waitTimeout(Duration waitTimeout) {
      this.consumerBuilder.waitTimeout(waitTimeout);
      return this;
    }

    @Override
    public RpcServerBuilder deliveryExceptionListener(Consumer.ExceptionListener listener) {
      this.consumerBuilder.deliveryExceptionListener(listener);
      return this;
    }

    @Override
    public RpcServerBuilder ackListener(Consumer.AckListener listener) {
      this.consumerBuilder.ackListener(listener);
      return this;
    }

    @Override
    public RpcServerBuilder cancellationCheck(BooleanSupplier cancellationCheck) {
      this.consumerBuilder.cancellationCheck(cancellationCheck);
      return this;
    }

    @Override
    public RpcServer build() {
      if (this.queue == null) {
        throw new IllegalArgumentException("A request queue must be specified");
      }
      if (this.handler == null) {
        throw new IllegalArgumentException("Handler cannot be null");
      }
      return new AmqpRpcServer(this);
    }

    AmqpConsumerBuilder consumerBuilder() {
      return this.consumerBuilder;
    }

    RpcServer.Handler handler() {
      return this.handler;
    }

    Exchange replyExchange() {
      return this.replyExchange;
    }
  }
}
