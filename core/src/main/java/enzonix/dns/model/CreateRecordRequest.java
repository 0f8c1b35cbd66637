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
 * Payload used to create a record.
 *
 * <p>The domain ID, name, type and value are required. Optional attributes left null are not sent,
 * so the server applies its own defaults for them.
 */
public record CreateRecordRequest(
    @Expose String domainId,
    @Expose String name,
    @Expose String type,
    @Expose String value,
    @Expose @Nullable Integer ttl,
    @Expose @Nullable Integer priority,
    @Expose @Nullable List<String> countryCodes) {

  public CreateRecordRequest {
    countryCodes = countryCodes == null ? null : ImmutableList.copyOf(countryCodes);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link CreateRecordRequest}. */
  public static final class Builder {
    private String domainId;
    private String name;
    private String type;
    private String value;
    @Nullable private Integer ttl;
    @Nullable private Integer priority;
    @Nullable private List<String> countryCodes;

    private Builder() {}

    public Builder setDomainId(String domainId) {
      this.domainId = domainId;
      return this;
    }

    public Builder setName(String name) {
      this.name = name;
      return this;
    }

    public Builder setType(String type) {
      this.type = type;
      return this;
    }

    public Builder setValue(String value) {
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

    public CreateRecordRequest build() {
      return new CreateRecordRequest(domainId, name, type, value, ttl, priority, countryCodes);
    }
  }
}
