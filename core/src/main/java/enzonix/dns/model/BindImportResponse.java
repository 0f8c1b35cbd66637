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

/**
 * Result of importing a BIND zone file.
 *
 * <p>An import can partially succeed: {@link #partialSuccess()} is set and {@link #errors()} holds
 * one message per line the server rejected, while {@link #records()} lists what was created.
 */
public record BindImportResponse(
    @Expose Domain domain,
    @Expose int recordsCreated,
    @Expose List<DnsRecord> records,
    @Expose boolean partialSuccess,
    @Expose List<String> errors) {

  public BindImportResponse {
    records = nullToEmptyImmutableCopy(records);
    errors = nullToEmptyImmutableCopy(errors);
  }
}
