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

package enzonix.dns.util;

import com.google.common.flogger.FluentLogger;
import java.time.Duration;

/**
 * Measures the time between successive {@link #tick} calls and logs the intervals that are slower
 * than a threshold. Not thread-safe; use one instance per call.
 */
public final class StopwatchLogger {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final long thresholdNanos;
  private long lastTickNanos;

  public StopwatchLogger(Duration threshold) {
    this.thresholdNanos = threshold.toNanos();
    this.lastTickNanos = System.nanoTime();
  }

  /**
   * Logs {@code message} at INFO if the time since the previous tick exceeds the threshold.
   *
   * @return the elapsed time since the previous tick
   */
  public Duration tick(String message) {
    long currentNanos = System.nanoTime();
    long elapsedNanos = currentNanos - lastTickNanos;

    if (elapsedNanos > thresholdNanos) {
      logger.atInfo().log("%s (took %d ms)", message, Duration.ofNanos(elapsedNanos).toMillis());
    }

    this.lastTickNanos = currentNanos;
    return Duration.ofNanos(elapsedNanos);
  }
}
