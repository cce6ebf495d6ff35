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
package com.rabbitmq.client.batch.transport;

import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.batch.AmqpException;
import java.io.IOException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static AmqpException convert(Exception e, String format, Object... args) {
    String message = format != null ? String.format(format, args) : null;
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    } else if (e instanceof ShutdownSignalException) {
      return new AmqpException.AmqpResourceClosedException(message, e);
    } else if (e instanceof IOException) {
      if (e.getCause() instanceof ShutdownSignalException) {
        return new AmqpException.AmqpResourceClosedException(message, e.getCause());
      }
      return new AmqpException.AmqpIoException(message, e);
    } else {
      return new AmqpException(message, e);
    }
  }
}
