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

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import javax.annotation.Nullable;

/** Utility methods related to collections. */
public final class CollectionUtils {

  /** Defensive copy helper for decoded lists, turning a missing JSON array into an empty one. */
  public static <V> ImmutableList<V> nullToEmptyImmutableCopy(@Nullable Collection<V> data) {
    return data == null ? ImmutableList.of() : ImmutableList.copyOf(data);
  }

  private CollectionUtils() {}
}
