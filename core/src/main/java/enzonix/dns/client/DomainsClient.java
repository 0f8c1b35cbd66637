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

import static com.google.common.base.Preconditions.checkArgument;
import static enzonix.dns.util.CollectionUtils.nullToEmptyImmutableCopy;
import static enzonix.dns.util.DomainNames.escapePathSegment;
import static enzonix.dns.util.PreconditionsUtils.checkArgumentNotBlank;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.reflect.TypeToken;
import enzonix.dns.model.BindImportResponse;
import enzonix.dns.model.DnsRecord;
import enzonix.dns.model.Domain;
import enzonix.dns.model.NameserverCheckResponse;
import jakarta.inject.Inject;
import java.lang.reflect.Type;
import java.util.List;
import javax.annotation.Nullable;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;

/** Domain endpoints of the Enzonix client API, including BIND zone import and export. */
public class DomainsClient {

  static final String CLIENT_API_PREFIX = "/api/client";
  static final String DEFAULT_IMPORT_CONTENT_TYPE = "text/plain";

  private static final Type DOMAIN_LIST_TYPE = new TypeToken<List<Domain>>() {}.getType();
  private static final Type RECORD_LIST_TYPE = new TypeToken<List<DnsRecord>>() {}.getType();

  private final EnzonixClient client;

  @Inject
  public DomainsClient(EnzonixClient client) {
    this.client = client;
  }

  /** Lists every domain owned by the authenticated client. */
  public ImmutableList<Domain> listDomains() throws EnzonixException {
    Request request = client.newRequest("GET", CLIENT_API_PREFIX + "/domains", null, null);
    List<Domain> domains = client.execute(request, DOMAIN_LIST_TYPE);
    return nullToEmptyImmutableCopy(domains);
  }

  /**
   * Creates a domain. Only the name is sent; the server fills in everything else.
   *
   * @param name domain name, surrounding whitespace is removed
   */
  public Domain createDomain(String name) throws EnzonixException {
    String trimmedName = checkArgumentNotBlank(name, "domain name");
    Request request =
        client.newRequest(
            "POST", CLIENT_API_PREFIX + "/domains", null, ImmutableMap.of("name", trimmedName));
    return client.executeForValue(request, Domain.class);
  }

  public void deleteDomain(String domainId) throws EnzonixException {
    Request request = client.newRequest("DELETE", domainPath(domainId, ""), null, null);
    client.execute(request, null);
  }

  /** Asks the server to verify that the domain is delegated to the Enzonix nameservers. */
  public NameserverCheckResponse checkNameserver(String domainId) throws EnzonixException {
    Request request =
        client.newRequest("POST", domainPath(domainId, "/check-nameserver"), null, null);
    return client.executeForValue(request, NameserverCheckResponse.class);
  }

  public ImmutableList<DnsRecord> listDomainRecords(String domainId) throws EnzonixException {
    Request request = client.newRequest("GET", domainPath(domainId, "/records"), null, null);
    List<DnsRecord> records = client.execute(request, RECORD_LIST_TYPE);
    return nullToEmptyImmutableCopy(records);
  }

  /**
   * Downloads the records of a domain as a BIND zone file.
   *
   * <p>The bytes are returned exactly as served, up to {@link EnzonixClient#MAX_ZONE_EXPORT_BYTES}.
   */
  public byte[] exportBindZone(String domainId) throws EnzonixException {
    Request request =
        client
            .newRequest("GET", domainPath(domainId, "/export/bind"), null, null)
            .newBuilder()
            .header("Accept", "text/plain")
            .build();
    return client.executeForBytes(request, EnzonixClient.MAX_ZONE_EXPORT_BYTES);
  }

  /**
   * Imports records from a BIND zone file.
   *
   * <p>The server works out the domain from the zone's origin.
   *
   * @param zoneData the zone file, sent as the raw request body
   * @param contentType content type of {@code zoneData}; {@code text/plain} if null or blank
   */
  public BindImportResponse importBindZone(byte[] zoneData, @Nullable String contentType)
      throws EnzonixException {
    checkArgument(
        zoneData != null && zoneData.length > 0, "enzonix: zone data must not be empty");
    String effectiveContentType =
        contentType == null || contentType.isBlank()
            ? DEFAULT_IMPORT_CONTENT_TYPE
            : contentType.trim();

    Request request =
        client
            .newRequest("POST", CLIENT_API_PREFIX + "/import/bind", null, null)
            .newBuilder()
            .post(RequestBody.create(zoneData, MediaType.parse(effectiveContentType)))
            .header("Content-Type", effectiveContentType)
            .build();
    return client.executeForValue(request, BindImportResponse.class);
  }

  private static String domainPath(String domainId, String suffix) {
    String id = checkArgumentNotBlank(domainId, "domain id");
    return String.format("%s/domains/%s%s", CLIENT_API_PREFIX, escapePathSegment(id), suffix);
  }
}
