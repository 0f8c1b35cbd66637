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

package enzonix.dns.zone;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Optional filters and paging for {@link ZoneRecordsClient#listRecords}.
 *
 * <p>Each set option becomes one query parameter. Fetching further pages is left to the caller.
 */
public final class ListZoneRecordsOptions {

  private static final ListZoneRecordsOptions NONE = new Builder().build();

  private final Optional<String> name;
  private final Optional<String> type;
  private final Optional<Integer> page;
  private final Optional<Integer> perPage;

  private ListZoneRecordsOptions(Builder builder) {
    this.name = Optional.ofNullable(builder.name);
    this.type = Optional.ofNullable(builder.type);
    this.page = Optional.ofNullable(builder.page);
    this.perPage = Optional.ofNullable(builder.perPage);
  }

  public static ListZoneRecordsOptions none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the query parameters for these options, in a stable order. */
  ImmutableMap<String, String> toQueryParameters() {
    ImmutableMap.Builder<String, String> params = new ImmutableMap.Builder<>();
    name.ifPresent(value -> params.put("name", value));
    type.ifPresent(value -> params.put("type", value));
    page.ifPresent(value -> params.put("page", String.valueOf(value)));
    perPage.ifPresent(value -> params.put("per_page", String.valueOf(value)));
    return params.buildOrThrow();
  }

  /** Builder for {@link ListZoneRecordsOptions}. */
  public static final class Builder {
    @Nullable private String name;
    @Nullable private String type;
    @Nullable private Integer page;
    @Nullable private Integer perPage;

    private Builder() {}

    public Builder setName(@Nullable String name) {
      this.name = name == null || name.isBlank() ? null : name.trim();
      return this;
    }

    public Builder setType(@Nullable String type) {
      this.type = type == null || type.isBlank() ? null : type.trim();
      return this;
    }

    public Builder setPage(int page) {
      checkArgument(page > 0, "enzonix: page must be positive, got %s", page);
      this.page = page;
      return this;
    }

    public Builder setPerPage(int perPage) {
      checkArgument(perPage > 0, "enzonix: per page must be positive, got %s", perPage);
      this.perPage = perPage;
      return this;
    }

    public ListZoneRecordsOptions build() {
      return new ListZoneRecordsOptions(this);
    }
  }
}
