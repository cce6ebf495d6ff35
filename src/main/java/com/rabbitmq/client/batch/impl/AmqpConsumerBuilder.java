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
import com.rabbitmq.client.batch.ConsumerBuilder;
import com.rabbitmq.client.batch.Queue;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

class AmqpConsumerBuilder implements ConsumerBuilder {

  static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(10);
  static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofMillis(100);

  static final Consumer.ExceptionListener NO_OP_EXCEPTION_LISTENER = e -> {};
  static final Consumer.AckListener NO_OP_ACK_LISTENER = ctx -> {};
  static final Consumer.FlushDeferredHandler ACCEPT_FLUSH_DEFERRED_HANDLER = () -> true;
  static final BooleanSupplier NO_CANCELLATION = () -> false;

  private final AmqpBatchEnvironment environment;
  private final List<Queue> queues = new ArrayList<>();
  private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
  private Duration waitTimeout = DEFAULT_WAIT_TIMEOUT;
  private Consumer.DeliveryHandler deliveryHandler;
  private Consumer.ExceptionListener deliveryExceptionListener = NO_OP_EXCEPTION_LISTENER;
  private Consumer.FlushDeferredHandler flushDeferredHandler = ACCEPT_FLUSH_DEFERRED_HANDLER;
  private Consumer.ExceptionListener flushDeferredExceptionListener = NO_OP_EXCEPTION_LISTENER;
  private Consumer.AckListener ackListener = NO_OP_ACK_LISTENER;
  private BooleanSupplier cancellationCheck = NO_CANCELLATION;

  AmqpConsumerBuilder(AmqpBatchEnvironment environment) {
    this.environment = environment;
  }

  @Override
  public ConsumerBuilder queue(Queue queue) {
    this.queues.clear();
    this.queues.add(queue);
    return this;
  }

  @Override
  public ConsumerBuilder queues(List<Queue> queues) {
    this.queues.clear();
    if (queues != null) {
      this.queues.addAll(queues);
    }
    return this;
  }

  @Override
  public ConsumerBuilder idleTimeout(Duration idleTimeout) {
    if (idleTimeout == null || idleTimeout.isNegative()) {
      throw new IllegalArgumentException("Idle timeout must be positive or zero");
    }
    this.idleTimeout = idleTimeout;
    return this;
  }

  @Override
  public ConsumerBuilder waitTimeout(Duration waitTimeout) {
    if (waitTimeout == null || waitTimeout.isNegative() || waitTimeout.isZero()) {
      throw new IllegalArgumentException("Wait timeout must be positive");
    }
    this.waitTimeout = waitTimeout;
    return this;
  }

  @Override
  public ConsumerBuilder deliveryHandler(Consumer.DeliveryHandler handler) {
    this.deliveryHandler = handler;
    return this;
  }

  @Override
  public ConsumerBuilder deliveryExceptionListener(Consumer.ExceptionListener listener) {
    this.deliveryExceptionListener = listener == null ? NO_OP_EXCEPTION_LISTENER : listener;
    return this;
  }

  @Override
  public ConsumerBuilder flushDeferredHandler(Consumer.FlushDeferredHandler handler) {
    this.flushDeferredHandler = handler == null ? ACCEPT_FLUSH_DEFERRED_HANDLER : handler;
    return this;
  }

  @Override
  public ConsumerBuilder flushDeferredExceptionListener(Consumer.ExceptionListener listener) {
    this.flushDeferredExceptionListener = listener == null ? NO_OP_EXCEPTION_LISTENER : listener;
    return this;
  }

  @Override
  public ConsumerBuilder ackListener(Consumer.AckListener listener) {
    this.ackListener = listener == null ? NO_OP_ACK_LISTENER : listener;
    return this;
  }

  @Override
  public ConsumerBuilder cancellationCheck(BooleanSupplier cancellationCheck) {
    this.cancellationCheck = cancellationCheck == null ? NO_CANCELLATION : cancellationCheck;
    return this;
  }

  AmqpBatchEnvironment environment() {
    return this.environment;
  }

  List<Queue> queues() {
    return this.queues;
  }

  Duration idleTimeout() {
    return this.idleTimeout;
  }

  Duration waitTimeout() {
    return this.waitTimeout;
  }

  Consumer.DeliveryHandler deliveryHandler() {
    return this.deliveryHandler;
  }

  Consumer.ExceptionListener deliveryExceptionListener() {
    return this.deliveryExceptionListener;
  }

  Consumer.FlushDeferredHandler flushDeferredHandler() {
    return this.flushDeferredHandler;
  }

  Consumer.ExceptionListener flushDeferredExceptionListener() {
    return this.flushDeferredExceptionListener;
  }

  Consumer.AckListener ackListener() {
    return this.ackListener;
  }

  BooleanSupplier cancellationCheck() {
    return this.cancellationCheck;
  }

  @Override
  public Consumer build() {
    if (this.deliveryHandler == null) {
      throw new IllegalArgumentException("Delivery handler cannot be null");
    }
    return new AmqpConsumer(this);
  }
}
