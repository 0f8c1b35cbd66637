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

package enzonix.dns.model;

import com.google.gson.annotations.Expose;
import javax.annotation.Nullable;

/**
 * Result of asking the API to re-check the delegation of a domain to the Enzonix nameservers.
 *
 * <p>{@link #check()} is null if the server answered without check details.
 */
public record NameserverCheckResponse(@Expose Domain domain, @Expose @Nullable Check check) {

  /** Outcome of the delegation check itself. */
  public record Check(@Expose boolean valid, @Expose String status) {}
}
