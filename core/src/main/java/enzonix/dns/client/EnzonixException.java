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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Strings;
import java.io.IOException;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Base exception for failed Enzonix API calls.
 *
 * <p>Callers that need to tell failures apart catch one of the subclasses:
 *
 * <ul>
 *   <li>{@link TransportException}: the request never produced a response (connection refused,
 *       timeout, cancellation, or the body could not be read).
 *   <li>{@link ApiException}: the server answered with a 4xx or 5xx status.
 *   <li>{@link DecodeException}: the server answered successfully but the body was not the
 *       expected JSON.
 * </ul>
 *
 * <p>Invalid arguments are rejected with {@link IllegalArgumentException} before any request is
 * sent, and are not represented here.
 */
public class EnzonixException extends IOException {

  public EnzonixException(String message) {
    super(message);
  }

  public EnzonixException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }

  /** Thrown when the HTTP exchange itself fails. */
  public static class TransportException extends EnzonixException {
    public TransportException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Thrown when a successful response carries a body that cannot be decoded. */
  public static class DecodeException extends EnzonixException {
    public DecodeException(String message) {
      super(message);
    }

    public DecodeException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Thrown when the Enzonix API answers with an error status. */
  public static class ApiException extends EnzonixException {

    private final int statusCode;
    @Nullable private final ApiErrorResponse errorResponse;
    private final String apiMessage;
    private final byte[] rawBody;

    /**
     * Creates an exception from a parsed error body.
     *
     * @param statusCode HTTP status of the response
     * @param reasonPhrase HTTP reason phrase, used when the body carries no message
     * @param errorResponse the decoded body, or null if it was not a JSON object
     * @param fallbackMessage message to report when the body could not be decoded
     * @param rawBody the undecoded body, kept for diagnostics
     */
    public ApiException(
        int statusCode,
        @Nullable String reasonPhrase,
        @Nullable ApiErrorResponse errorResponse,
        String fallbackMessage,
        byte[] rawBody) {
      super(
          formatMessage(
              statusCode, reasonPhrase, apiMessage(errorResponse, fallbackMessage), errorResponse));
      this.statusCode = statusCode;
      this.errorResponse = errorResponse;
      this.apiMessage = apiMessage(errorResponse, fallbackMessage);
      this.rawBody = rawBody.clone();
    }

    public int getStatusCode() {
      return statusCode;
    }

    /** The decoded error body, present only if the server sent a JSON object. */
    public Optional<ApiErrorResponse> getErrorResponse() {
      return Optional.ofNullable(errorResponse);
    }

    /** The message sent by the server, or the trimmed body text if it was not JSON. */
    public String getApiMessage() {
      return apiMessage;
    }

    /** The machine readable error code, if the server sent one. */
    public Optional<String> getApiCode() {
      return getErrorResponse().map(ApiErrorResponse::code).filter(code -> !code.isEmpty());
    }

    public byte[] getRawBody() {
      return rawBody.clone();
    }

    public String getRawBodyAsString() {
      return new String(rawBody, UTF_8);
    }

    private static String apiMessage(
        @Nullable ApiErrorResponse errorResponse, String fallbackMessage) {
      return errorResponse == null ? fallbackMessage : Strings.nullToEmpty(errorResponse.message());
    }

    private static String formatMessage(
        int statusCode,
        @Nullable String reasonPhrase,
        String apiMessage,
        @Nullable ApiErrorResponse errorResponse) {
      String message = apiMessage;
      if (message.isEmpty()) {
        message = Strings.isNullOrEmpty(reasonPhrase) ? "HTTP " + statusCode : reasonPhrase;
      }
      String code = errorResponse == null ? null : errorResponse.code();
      if (!Strings.isNullOrEmpty(code)) {
        return String.format("enzonix: %s (status=%d, code=%s)", message, statusCode, code);
      }
      return String.format("enzonix: %s (status=%d)", message, statusCode);
    }
  }
}
