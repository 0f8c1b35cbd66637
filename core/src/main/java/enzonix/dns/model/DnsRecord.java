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

import static enzonix.dns.util.CollectionUtils.nullToEmptyImmutableCopy;

import com.google.gson.annotations.Expose;
import java.util.List;
import javax.annotation.Nullable;
import org.joda.time.DateTime;

/** A DNS record belonging to a domain, as returned by the domain-scoped client API. */
public record DnsRecord(
    @Expose String id,
    @Expose String domainId,
    @Expose String name,
    @Expose String type,
    @Expose int ttl,

    // ISO 3166 country codes used for geo-steered answers; empty means the record answers globally.
    @Expose List<String> countryCodes,
    @Expose int priority,
    @Expose String value,
    @Expose @Nullable DateTime createdAt,
    @Expose @Nullable DateTime updatedAt) {

  public DnsRecord {
    countryCodes = nullToEmptyImmutableCopy(countryCodes);
  }
}
