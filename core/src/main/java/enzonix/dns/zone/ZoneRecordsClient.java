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

import static com.google.common.base.Preconditions.checkNotNull;
import static enzonix.dns.util.DomainNames.canonicalizeZoneName;
import static enzonix.dns.util.DomainNames.escapePathSegment;
import static enzonix.dns.util.PreconditionsUtils.checkArgumentNotBlank;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import enzonix.dns.client.EnzonixClient;
import enzonix.dns.client.EnzonixException;
import enzonix.dns.zone.ZoneModels.CreateZoneRecordRequest;
import enzonix.dns.zone.ZoneModels.UpdateZoneRecordRequest;
import enzonix.dns.zone.ZoneModels.ZoneRecord;
import enzonix.dns.zone.ZoneModels.ZoneRecordList;
import jakarta.inject.Inject;
import okhttp3.Request;

/**
 * Client for the zone-scoped record endpoints.
 *
 * <p>Zones are addressed by name. Names are trimmed and trailing dots removed before they go into
 * the path, so {@code "example.com."} and {@code "example.com"} are the same zone. Updates use
 * {@code PATCH} and only send the attributes the caller set.
 */
public class ZoneRecordsClient {

  private final EnzonixClient client;

  @Inject
  public ZoneRecordsClient(EnzonixClient client) {
    this.client = client;
  }

  public ImmutableList<ZoneRecord> listRecords(String zone) throws EnzonixException {
    return listRecords(zone, ListZoneRecordsOptions.none());
  }

  /** Lists one page of records in a zone, filtered by {@code options}. */
  public ImmutableList<ZoneRecord> listRecords(String zone, ListZoneRecordsOptions options)
      throws EnzonixException {
    String path = recordsPath(zone);
    ImmutableMap<String, String> query = checkNotNull(options, "options").toQueryParameters();
    Request request = client.newRequest("GET", path, query.isEmpty() ? null : query, null);
    ZoneRecordList list = client.execute(request, ZoneRecordList.class);
    return list == null ? ImmutableList.of() : ImmutableList.copyOf(list.records());
  }

  /**
   * Creates a record in a zone.
   *
   * @throws IllegalArgumentException if the zone, name, type or content is blank
   */
  public ZoneRecord createRecord(String zone, CreateZoneRecordRequest payload)
      throws EnzonixException {
    String path = recordsPath(zone);
    checkNotNull(payload, "payload");
    checkArgumentNotBlank(payload.name(), "record name");
    checkArgumentNotBlank(payload.type(), "record type");
    checkArgumentNotBlank(payload.content(), "record content");
    Request request = client.newRequest("POST", path, null, payload);
    return client.executeForValue(request, ZoneRecord.class);
  }

  public ZoneRecord updateRecord(String zone, String recordId, UpdateZoneRecordRequest payload)
      throws EnzonixException {
    String path = recordPath(zone, recordId);
    checkNotNull(payload, "payload");
    Request request = client.newRequest("PATCH", path, null, payload);
    return client.executeForValue(request, ZoneRecord.class);
  }

  public void deleteRecord(String zone, String recordId) throws EnzonixException {
    Request request = client.newRequest("DELETE", recordPath(zone, recordId), null, null);
    client.execute(request, null);
  }

  private static String recordsPath(String zone) {
    return String.format("/zones/%s/records", escapePathSegment(canonicalizeZoneName(zone)));
  }

  private static String recordPath(String zone, String recordId) {
    String id = checkArgumentNotBlank(recordId, "record id");
    return recordsPath(zone) + "/" + escapePathSegment(id);
  }
}
