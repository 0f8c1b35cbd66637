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

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.Expose;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Partial update of a record.
 *
 * <p>Every attribute is optional and only the non-null ones are serialized, so the server only
 * changes what the caller set. An empty {@code countryCodes} list is sent as-is and clears the
 * codes, which is different from leaving the list null.
 */
public record UpdateRecordRequest(
    @Expose @Nullable String name,
    @Expose @Nullable String type,
    @Expose @Nullable String value,
    @Expose @Nullable Integer ttl,
    @Expose @Nullable Integer priority,
    @Expose @Nullable List<String> countryCodes) {

  public UpdateRecordRequest {
    countryCodes = countryCodes == null ? null : ImmutableList.copyOf(countryCodes);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link UpdateRecordRequest}. */
  public static final class Builder {
    @Nullable private String name;
    @Nullable private String type;
    @Nullable private String value;
    @Nullable private Integer ttl;
    @Nullable private Integer priority;
    @Nullable private List<String> countryCodes;

    private Builder() {}

    public Builder setName(@Nullable String name) {
      this.name = name;
      return this;
    }

    public Builder setType(@Nullable String type) {
      this.type = type;
      return this;
    }

    public Builder setValue(@Nullable String value) {
      this.value = value;
      return this;
    }

    public Builder setTtl(@Nullable Integer ttl) {
      this.ttl = ttl;
      return this;
    }

    public Builder setPriority(@Nullable Integer priority) {
      this.priority = priority;
      return this;
    }

    public Builder setCountryCodes(@Nullable List<String> countryCodes) {
      this.countryCodes = countryCodes;
      return this;
    }

    public UpdateRecordRequest build() {
      return new UpdateRecordRequest(name, type, value, ttl, priority, countryCodes);
    }
  }
}
