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
import org.joda.time.DateTime;

/** The API client account, returned after rotating its API token. */
public record ClientProfile(
    @Expose String id,
    @Expose String name,
    @Expose String email,
    @Expose String apiToken,
    @Expose int domainLimit,
    @Expose @Nullable DateTime createdAt,
    @Expose @Nullable DateTime updatedAt) {

  @Override
  public String toString() {
    return String.format(
        "ClientProfile{id=%s, name=%s, email=%s, apiToken=<redacted>, domainLimit=%d}",
        id, name, email, domainLimit);
  }
}
