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

/**
 * A domain owned by the authenticated client.
 *
 * <p>Domains are only ever produced by decoding server responses. Creating one sends nothing but
 * the name, see {@link enzonix.dns.client.DomainsClient#createDomain(String)}.
 */
public record Domain(
    @Expose String id,
    @Expose String clientId,
    @Expose String name,
    @Expose boolean active,
    @Expose @Nullable DateTime createdAt,
    @Expose @Nullable DateTime updatedAt,
    @Expose @Nullable DateTime nameserverLastCheckedAt,
    @Expose @Nullable DateTime nameserverVerifiedAt,

    // Free-form status of the last nameserver delegation check, e.g. "pending" or "valid".
    @Expose @Nullable String nameserverCheckStatus) {}
