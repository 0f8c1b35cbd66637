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

import static com.google.common.base.Preconditions.checkArgument;

import javax.annotation.Nullable;

/** Argument checks shared by the resource clients. */
public final class PreconditionsUtils {

  /**
   * Checks that {@code value} contains something other than whitespace.
   *
   * @param value the caller supplied value
   * @param label human readable name of the value, used in the error message
   * @return the value with surrounding whitespace removed
   * @throws IllegalArgumentException if the value is null or blank
   */
  public static String checkArgumentNotBlank(@Nullable String value, String label) {
    checkArgument(value != null && !value.isBlank(), "enzonix: %s must not be empty", label);
    return value.trim();
  }

  private PreconditionsUtils() {}
}
