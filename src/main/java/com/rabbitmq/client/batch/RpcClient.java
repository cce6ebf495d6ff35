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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client side of RPC.
 *
 * <p>Requests are added one by one with {@link #addRequest(String, String, String)} and its
 * overloads, then {@link #getReplies()} collects the replies of the whole batch.
 *
 * <p>Example:
 *
 * <pre>{@code
 * client.addRequest("ping", "server-a", "request-1");
 * client.addRequest("ping", "server-b", "request-2", "", 2);
 * Map<String, String> replies = client.getReplies();
 * // replies may miss requests that did not reply in time
 * }</pre>
 *
 * <p>Instances are not thread-safe.
 *
 * @see RpcClientBuilder
 */
public interface RpcClient extends AutoCloseable {

  /**
   * Publish a request to the server exchange, with an empty routing key and no expiration.
   *
   * @param body request body
   * @param server server name, used as the exchange name
   * @param requestId request ID, used as correlation ID
   */
  void addRequest(String body, String server, String requestId);

  /**
   * Publish a request to the server exchange, with no expiration.
   *
   * @param body request body
   * @param server server name, used as the exchange name
   * @param requestId request ID, used as correlation ID
   * @param routingKey routing key
   */
  void addRequest(String body, String server, String requestId, String routingKey);

  /**
   * Publish a request to the server exchange.
   *
   * @param body request body
   * @param server server name, used as the exchange name
   * @param requestId request ID, used as correlation ID
   * @param routingKey routing key
   * @param expiration expiration of the request in seconds, 0 for none
   */
  void addRequest(String body, String server, String requestId, String routingKey, int expiration);

  /**
   * Publish a request to the server exchange.
   *
   * <p>The longest expiration of the batch is also the time {@link #getReplies()} waits for
   * replies.
   *
   * @param body request body
   * @param server server name, used as the exchange name
   * @param requestId request ID, used as correlation ID, must not be empty
   * @param routingKey routing key
   * @param expiration expiration of the request in seconds, 0 for none
   * @param headers message headers
   */
  void addRequest(
      String body,
      String server,
      String requestId,
      String routingKey,
      int expiration,
      Map<String, Object> headers);

  /**
   * Wait for the replies of the requests added since the last call.
   *
   * <p>The call returns when all the requests got a reply or when the longest expiration elapsed.
   * Requests without reply are absent from the returned map. Replies with an unknown correlation
   * ID are discarded.
   *
   * @return replies by request ID
   */
  Map<String, String> getReplies();

  /** Close the client. The reply queue and its channel are left open. */
  @Override
  void close();

  /**
   * Callback to change a request before it is published.
   *
   * <p>It can return a new {@link Request} to replace the request, or null to keep it.
   */
  @FunctionalInterface
  interface RequestPostProcessor {

    Request process(Request request);
  }

  /** The parameters of a request. */
  final class Request {

    private final String body;
    private final String server;
    private final String requestId;
    private final String routingKey;
    private final int expiration;
    private final Map<String, Object> headers;

    public Request(
        String body,
        String server,
        String requestId,
        String routingKey,
        int expiration,
        Map<String, Object> headers) {
      this.body = body;
      this.server = server;
      this.requestId = requestId;
      this.routingKey = routingKey;
      this.expiration = expiration;
      this.headers =
          headers == null
              ? Collections.emptyMap()
              : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public String body() {
      return this.body;
    }

    public String server() {
      return this.server;
    }

    public String requestId() {
      return this.requestId;
    }

    public String routingKey() {
      return this.routingKey;
    }

    /**
     * Expiration in seconds, 0 for none.
     *
     * @return expiration
     */
    public int expiration() {
      return this.expiration;
    }

    public Map<String, Object> headers() {
      return this.headers;
    }

    @Override
    public String toString() {
      return "Request{"
          + "server='"
          + server
          + '\''
          + ", requestId='"
          + requestId
          + '\''
          + ", routingKey='"
          + routingKey
          + '\''
          + ", expiration="
          + expiration
          + '}';
    }
  }
}
