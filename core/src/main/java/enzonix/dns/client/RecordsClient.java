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

package enzonix.dns.client;

import static com.google.common.base.Preconditions.checkNotNull;
import static enzonix.dns.client.DomainsClient.CLIENT_API_PREFIX;
import static enzonix.dns.util.DomainNames.escapePathSegment;
import static enzonix.dns.util.PreconditionsUtils.checkArgumentNotBlank;

import enzonix.dns.model.CreateRecordRequest;
import enzonix.dns.model.DnsRecord;
import enzonix.dns.model.UpdateRecordRequest;
import jakarta.inject.Inject;
import okhttp3.Request;

/** Record endpoints of the Enzonix client API. */
public class RecordsClient {

  private final EnzonixClient client;

  @Inject
  public RecordsClient(EnzonixClient client) {
    this.client = client;
  }

  /**
   * Creates a record and returns it as stored by the server.
   *
   * @throws IllegalArgumentException if the domain ID, name, type or value is blank
   */
  public DnsRecord createRecord(CreateRecordRequest payload) throws EnzonixException {
    checkNotNull(payload, "payload");
    checkArgumentNotBlank(payload.domainId(), "domain id");
    checkArgumentNotBlank(payload.name(), "record name");
    checkArgumentNotBlank(payload.type(), "record type");
    checkArgumentNotBlank(payload.value(), "record value");

    Request request = client.newRequest("POST", CLIENT_API_PREFIX + "/records", null, payload);
    return client.executeForValue(request, DnsRecord.class);
  }

  /** Sends the non-null attributes of {@code payload} and returns the updated record. */
  public DnsRecord updateRecord(String recordId, UpdateRecordRequest payload)
      throws EnzonixException {
    String path = recordPath(recordId);
    checkNotNull(payload, "payload");
    Request request = client.newRequest("PUT", path, null, payload);
    return client.executeForValue(request, DnsRecord.class);
  }

  public void deleteRecord(String recordId) throws EnzonixException {
    Request request = client.newRequest("DELETE", recordPath(recordId), null, null);
    client.execute(request, null);
  }

  private static String recordPath(String recordId) {
    String id = checkArgumentNotBlank(recordId, "record id");
    return String.format("%s/records/%s", CLIENT_API_PREFIX, escapePathSegment(id));
  }
}
