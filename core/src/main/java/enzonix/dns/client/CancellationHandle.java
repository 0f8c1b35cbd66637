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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.flogger.FluentLogger;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.Call;

/**
 * Lets a caller abort the calls made through one {@link EnzonixClient#withCancellation} view.
 *
 * <p>{@link #cancel()} may be invoked from any thread. It cancels every OkHttp {@link Call} that is
 * in flight through the handle, and any call started afterwards fails as soon as it is executed.
 * Cancelled calls surface as {@link EnzonixException.TransportException}. Calls made through other
 * clients sharing the same transport are not affected.
 */
public final class CancellationHandle {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Set<Call> liveCalls = ConcurrentHashMap.newKeySet();
  private volatile boolean cancelled;

  private CancellationHandle() {}

  public static CancellationHandle create() {
    return new CancellationHandle();
  }

  /** Aborts the calls in flight through this handle and every call started after it. */
  public void cancel() {
    cancelled = true;
    for (Call call : liveCalls) {
      call.cancel();
    }
    logger.atFine().log("Cancelled %d in-flight Enzonix call(s)", liveCalls.size());
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /** Tracks {@code call} until {@link #release}; cancels it straight away if already cancelled. */
  void register(Call call) {
    liveCalls.add(checkNotNull(call, "call"));
    // Re-checked after adding, so a concurrent cancel() can't miss the call.
    if (cancelled) {
      call.cancel();
    }
  }

  void release(Call call) {
    liveCalls.remove(call);
  }
}
