// Copyright 2025 The Enzonix DNS Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package enzonix.dns.client;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.ByteStreams;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import enzonix.dns.client.EnzonixException.ApiException;
import enzonix.dns.client.EnzonixException.DecodeException;
import enzonix.dns.client.EnzonixException.TransportException;
import enzonix.dns.json.GsonUtils;
import enzonix.dns.util.StopwatchLogger;
import enzonix.dns.zone.ZoneRecordsClient;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * A client for the Enzonix DNS API.
 *
 * <p>This class owns the request and response plumbing shared by the resource clients returned
 * from {@link #domains()}, {@link #records()}, {@link #account()} and {@link #zoneRecords()}: it
 * resolves request paths against the configured base URL, attaches the bearer credential, encodes
 * JSON bodies and turns responses into decoded values or {@link EnzonixException}s.
 *
 * <p>Instances hold nothing but an immutable {@link ClientConfig} and can be shared freely between
 * threads. Every call is a single synchronous round trip on the calling thread.
 */
public class EnzonixClient {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Ceiling on JSON response bodies; anything beyond it is not read. */
  public static final long MAX_JSON_BODY_BYTES = 1L << 20;

  /** Ceiling on raw BIND zone exports. */
  public static final long MAX_ZONE_EXPORT_BYTES = 4L << 20;

  static final String APPLICATION_JSON = "application/json";

  private static final MediaType JSON_MEDIA_TYPE = MediaType.get(APPLICATION_JSON);
  private static final Duration SLOW_CALL_THRESHOLD = Duration.ofSeconds(2);

  // OkHttp refuses to build requests with these methods unless they carry a body.
  private static final ImmutableSet<String> METHODS_REQUIRING_BODY =
      ImmutableSet.of("POST", "PUT", "PATCH", "PROPPATCH", "REPORT");

  private final ClientConfig config;
  private final Gson gson;
  @Nullable private final CancellationHandle cancellation;

  private EnzonixClient(
      ClientConfig config, Gson gson, @Nullable CancellationHandle cancellation) {
    this.config = checkNotNull(config, "config");
    this.gson = gson;
    this.cancellation = cancellation;
  }

  /**
   * Creates a client with the production defaults.
   *
   * @throws IllegalArgumentException if the credential is blank
   */
  public static EnzonixClient create(String apiKey) {
    return create(ClientConfig.builder(apiKey).build());
  }

  public static EnzonixClient create(ClientConfig config) {
    return new EnzonixClient(config, GsonUtils.provideGson(), null);
  }

  /**
   * Returns a view of this client whose calls can be aborted through {@code handle}.
   *
   * <p>The view shares the configuration and transport of this client. Resource clients obtained
   * from it, e.g. {@code client.withCancellation(handle).domains()}, route every call through the
   * handle.
   *
   * @throws NullPointerException if {@code handle} is null
   */
  public EnzonixClient withCancellation(CancellationHandle handle) {
    return new EnzonixClient(config, gson, checkNotNull(handle, "cancellation handle"));
  }

  public ClientConfig getConfig() {
    return config;
  }

  public DomainsClient domains() {
    return new DomainsClient(this);
  }

  public RecordsClient records() {
    return new RecordsClient(this);
  }

  public AccountClient account() {
    return new AccountClient(this);
  }

  /** Client for the zone-scoped record endpoints ({@code /zones/{zone}/records}). */
  public ZoneRecordsClient zoneRecords() {
    return new ZoneRecordsClient(this);
  }

  /**
   * Builds an authenticated request without sending it.
   *
   * <p>{@code path} is resolved against the base URL as a relative reference, so an absolute path
   * such as {@code /zones/example.com/records} replaces the base URL's path rather than being
   * appended to it. If {@code query} is non-null it replaces any query in {@code path}.
   *
   * @param method HTTP method, e.g. {@code "GET"}
   * @param path path relative to the base URL
   * @param query query parameters, encoded in iteration order
   * @param body value serialized to JSON as the request body, or null for no body
   * @throws EnzonixException if the body cannot be serialized
   */
  public Request newRequest(
      String method, String path, @Nullable Map<String, String> query, @Nullable Object body)
      throws EnzonixException {
    checkNotNull(method, "method");
    checkNotNull(path, "path");

    HttpUrl url = config.baseUrl().resolve(path);
    checkArgument(
        url != null, "enzonix: cannot resolve path %s against %s", path, config.baseUrl());
    if (query != null) {
      HttpUrl.Builder urlBuilder = url.newBuilder().query(null);
      query.forEach(urlBuilder::addQueryParameter);
      url = urlBuilder.build();
    }

    RequestBody requestBody = null;
    if (body != null) {
      String json;
      try {
        json = gson.toJson(body);
      } catch (RuntimeException e) {
        throw new EnzonixException("enzonix: encode request body", e);
      }
      requestBody = RequestBody.create(json, JSON_MEDIA_TYPE);
    } else if (METHODS_REQUIRING_BODY.contains(method)) {
      requestBody = RequestBody.create(new byte[0], (MediaType) null);
    }

    Request.Builder requestBuilder =
        new Request.Builder()
            .url(url)
            .method(method, requestBody)
            .header("Authorization", "Bearer " + config.apiKey())
            .header("Accept", APPLICATION_JSON);
    if (body != null) {
      requestBuilder.header("Content-Type", APPLICATION_JSON);
    }
    if (!config.userAgent().isEmpty()) {
      requestBuilder.header("User-Agent", config.userAgent());
    }
    return requestBuilder.build();
  }

  /**
   * Sends a request and decodes the JSON response.
   *
   * @param request a request built by {@link #newRequest}
   * @param type the expected shape of the response, or null if the body should be ignored
   * @return the decoded body, or null if {@code type} is null or the body is empty
   * @throws TransportException if the request could not be completed
   * @throws ApiException if the server answered with a status of 400 or above
   * @throws DecodeException if a successful response cannot be decoded as {@code type}
   */
  @Nullable
  public <T> T execute(Request request, @Nullable Type type) throws EnzonixException {
    Call call = newCall(request);
    try (Response response = send(call, request)) {
      byte[] body = readBody(response, MAX_JSON_BODY_BYTES);
      if (response.code() >= 400) {
        throw parseErrorResponse(response, body);
      }
      if (type == null || body.length == 0) {
        return null;
      }
      try {
        return gson.fromJson(new String(body, UTF_8), type);
      } catch (RuntimeException e) {
        // Malformed JSON, or a model constructor rejecting the decoded values.
        throw new DecodeException(
            String.format(
                "enzonix: decode response of %s %s", request.method(), request.url().encodedPath()),
            e);
      }
    } finally {
      release(call);
    }
  }

  /**
   * Like {@link #execute}, for operations that always answer with a resource.
   *
   * @throws DecodeException if the response body is empty
   */
  public <T> T executeForValue(Request request, Type type) throws EnzonixException {
    T value = execute(request, checkNotNull(type, "type"));
    if (value == null) {
      throw new DecodeException(
          String.format(
              "enzonix: %s %s returned an empty body",
              request.method(), request.url().encodedPath()));
    }
    return value;
  }

  /**
   * Sends a request and returns the raw response body, bypassing JSON decoding.
   *
   * <p>Error responses are still turned into {@link ApiException}s.
   *
   * @param limit maximum number of body bytes to read
   */
  public byte[] executeForBytes(Request request, long limit) throws EnzonixException {
    Call call = newCall(request);
    try (Response response = send(call, request)) {
      if (response.code() >= 400) {
        throw parseErrorResponse(response, readBody(response, MAX_JSON_BODY_BYTES));
      }
      return readBody(response, limit);
    } finally {
      release(call);
    }
  }

  private Call newCall(Request request) {
    Call call = config.httpClient().newCall(request);
    if (cancellation != null) {
      cancellation.register(call);
    }
    return call;
  }

  private void release(Call call) {
    if (cancellation != null) {
      cancellation.release(call);
    }
  }

  private Response send(Call call, Request request) throws TransportException {
    logger.atFine().log("Executing Enzonix request: %s %s", request.method(), request.url());
    StopwatchLogger stopwatch = new StopwatchLogger(SLOW_CALL_THRESHOLD);
    Response response;
    try {
      response = call.execute();
    } catch (IOException e) {
      logger.atFine().withCause(e).log(
          "Enzonix request failed: %s %s", request.method(), request.url());
      throw new TransportException(
          String.format("enzonix: request failed: %s %s", request.method(), request.url()), e);
    }
    Duration elapsed =
        stopwatch.tick(
            String.format("Slow Enzonix request %s %s", request.method(), request.url()));
    logger.atFine().log(
        "Completed Enzonix request in %d ms, response code: %d",
        elapsed.toMillis(), response.code());
    return response;
  }

  @VisibleForTesting
  static byte[] readBody(Response response, long limit) throws TransportException {
    ResponseBody body = response.body();
    if (body == null) {
      return new byte[0];
    }
    try (InputStream in = ByteStreams.limit(body.byteStream(), limit)) {
      return ByteStreams.toByteArray(in);
    } catch (IOException e) {
      throw new TransportException("enzonix: read response", e);
    }
  }

  /** Turns an error response into an {@link ApiException}, tolerating non-JSON bodies. */
  private ApiException parseErrorResponse(Response response, byte[] body) {
    String text = new String(body, UTF_8);
    Optional<ApiErrorResponse> error =
        text.isBlank() ? Optional.empty() : parseErrorBody(text, response.code());
    return new ApiException(
        response.code(), response.message(), error.orElse(null), text.trim(), body);
  }

  private Optional<ApiErrorResponse> parseErrorBody(String text, int statusCode) {
    try {
      JsonElement element = JsonParser.parseString(text);
      if (!element.isJsonObject()) {
        return Optional.empty();
      }
      return Optional.ofNullable(gson.fromJson(element, ApiErrorResponse.class));
    } catch (JsonParseException e) {
      logger.atFine().log("Enzonix error body (%d) is not JSON: %s", statusCode, e.getMessage());
      return Optional.empty();
    }
  }
}
