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

import static enzonix.dns.util.CollectionUtils.nullToEmptyImmutableCopy;

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.Expose;
import java.util.List;
import javax.annotation.Nullable;
import org.joda.time.DateTime;

/**
 * Data models for the zone-scoped record endpoints.
 *
 * <p>These records are addressed by zone name instead of domain ID and carry their value in {@code
 * content}. They are deliberately separate from {@link enzonix.dns.model.DnsRecord}.
 */
public final class ZoneModels {

  private ZoneModels() {}

  /** A record in a zone. */
  public record ZoneRecord(
      @Expose String id,
      @Expose String zone,
      @Expose String name,
      @Expose String type,
      @Expose String content,
      @Expose int ttl,
      @Expose @Nullable Integer priority,

      // Relative weight among records with the same name and type, used for weighted answers.
      @Expose @Nullable Integer weight,
      @Expose List<String> countryCodes,
      @Expose @Nullable DateTime createdAt,
      @Expose @Nullable DateTime updatedAt) {

    public ZoneRecord {
      countryCodes = nullToEmptyImmutableCopy(countryCodes);
    }
  }

  /** Envelope returned by the list endpoint. */
  public record ZoneRecordList(@Expose List<ZoneRecord> records) {

    public ZoneRecordList {
      records = nullToEmptyImmutableCopy(records);
    }
  }

  /** Payload used to create a record in a zone; name, type and content are required. */
  public record CreateZoneRecordRequest(
      @Expose String name,
      @Expose String type,
      @Expose String content,
      @Expose @Nullable Integer ttl,
      @Expose @Nullable Integer priority,
      @Expose @Nullable Integer weight,
      @Expose @Nullable List<String> countryCodes) {

    public CreateZoneRecordRequest {
      countryCodes = countryCodes == null ? null : ImmutableList.copyOf(countryCodes);
    }

    /** Shorthand for a record that relies on the server defaults for everything optional. */
    public static CreateZoneRecordRequest of(String name, String type, String content) {
      return new CreateZoneRecordRequest(name, type, content, null, null, null, null);
    }
  }

  /** Partial update of a zone record; only the non-null attributes are sent. */
  public record UpdateZoneRecordRequest(
      @Expose @Nullable String name,
      @Expose @Nullable String type,
      @Expose @Nullable String content,
      @Expose @Nullable Integer ttl,
      @Expose @Nullable Integer priority,
      @Expose @Nullable Integer weight,
      @Expose @Nullable List<String> countryCodes) {

    public UpdateZoneRecordRequest {
      countryCodes = countryCodes == null ? null : ImmutableList.copyOf(countryCodes);
    }

    public static UpdateZoneRecordRequest content(String content) {
      return new UpdateZoneRecordRequest(null, null, content, null, null, null, null);
    }

    public static UpdateZoneRecordRequest ttl(int ttl) {
      return new UpdateZoneRecordRequest(null, null, null, ttl, null, null, null);
    }
  }
}
