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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verifyNoInteractions;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParser;
import enzonix.dns.client.EnzonixException.ApiException;
import enzonix.dns.model.CreateRecordRequest;
import enzonix.dns.model.DnsRecord;
import enzonix.dns.model.UpdateRecordRequest;
import enzonix.dns.testing.MockTransport;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RecordsClientTest {

  private static final String RECORD_JSON =
      """
      {
        "id": "rec_1",
        "domain_id": "dom_1",
        "name": "www",
        "type": "A",
        "ttl": 300,
        "priority": 0,
        "value": "192.0.2.1",
        "created_at": "2024-05-01T10:00:00Z"
      }
      """;

  private final MockTransport transport = new MockTransport();
  private RecordsClient records;

  @BeforeEach
  void beforeEach() {
    records = transport.newClient().records();
  }

  private static CreateRecordRequest.Builder validCreateRequest() {
    return CreateRecordRequest.builder()
        .setDomainId("dom_1")
        .setName("www")
        .setType("A")
        .setValue("192.0.2.1");
  }

  @Test
  void testCreateRecord_omitsUnsetOptionalFields() throws Exception {
    transport.respondWith(201, RECORD_JSON);

    DnsRecord record = records.createRecord(validCreateRequest().build());

    assertThat(record.id()).isEqualTo("rec_1");
    assertThat(record.ttl()).isEqualTo(300);
    Request request = transport.capturedRequest();
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.url().encodedPath()).isEqualTo("/api/client/records");
    assertThat(MockTransport.readJsonBody(request))
        .isEqualTo(
            JsonParser.parseString(
                """
                {"domain_id": "dom_1", "name": "www", "type": "A", "value": "192.0.2.1"}
                """));
  }

  @Test
  void testCreateRecord_sendsOptionalFields() throws Exception {
    transport.respondWith(201, RECORD_JSON);

    records.createRecord(
        validCreateRequest()
            .setTtl(60)
            .setPriority(5)
            .setCountryCodes(ImmutableList.of("DE"))
            .build());

    assertThat(MockTransport.readJsonBody(transport.capturedRequest()))
        .isEqualTo(
            JsonParser.parseString(
                """
                {
                  "domain_id": "dom_1",
                  "name": "www",
                  "type": "A",
                  "value": "192.0.2.1",
                  "ttl": 60,
                  "priority": 5,
                  "country_codes": ["DE"]
                }
                """));
  }

  @Test
  void testCreateRecord_rejectsMissingFieldsWithoutSending() {
    assertThrows(
        IllegalArgumentException.class,
        () -> records.createRecord(validCreateRequest().setDomainId(" ").build()));
    assertThrows(
        IllegalArgumentException.class,
        () -> records.createRecord(validCreateRequest().setName(null).build()));
    assertThrows(
        IllegalArgumentException.class,
        () -> records.createRecord(validCreateRequest().setType("").build()));
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () -> records.createRecord(validCreateRequest().setValue("  ").build()));

    assertThat(thrown).hasMessageThat().isEqualTo("enzonix: record value must not be empty");
    verifyNoInteractions(transport.httpClient());
  }

  @Test
  void testCreateRecord_validationError() throws Exception {
    transport.respondWith(
        422, "{\"message\":\"invalid IPv4 address\",\"code\":\"validation_error\"}");

    ApiException thrown =
        assertThrows(
            ApiException.class, () -> records.createRecord(validCreateRequest().build()));

    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo("enzonix: invalid IPv4 address (status=422, code=validation_error)");
  }

  @Test
  void testUpdateRecord_sendsOnlySetFields() throws Exception {
    transport.respondWith(200, RECORD_JSON);

    records.updateRecord("rec_1", UpdateRecordRequest.builder().setValue("192.0.2.2").build());

    Request request = transport.capturedRequest();
    assertThat(request.method()).isEqualTo("PUT");
    assertThat(request.url().encodedPath()).isEqualTo("/api/client/records/rec_1");
    assertThat(MockTransport.readBody(request)).isEqualTo("{\"value\":\"192.0.2.2\"}");
  }

  @Test
  void testUpdateRecord_emptyCountryCodesAreSent() throws Exception {
    transport.respondWith(200, RECORD_JSON);

    records.updateRecord(
        "rec_1", UpdateRecordRequest.builder().setCountryCodes(ImmutableList.of()).build());

    assertThat(MockTransport.readBody(transport.capturedRequest()))
        .isEqualTo("{\"country_codes\":[]}");
  }

  @Test
  void testUpdateRecord_rejectsBlankIdWithoutSending() {
    assertThrows(
        IllegalArgumentException.class,
        () -> records.updateRecord(" ", UpdateRecordRequest.builder().setTtl(60).build()));
    verifyNoInteractions(transport.httpClient());
  }

  @Test
  void testDeleteRecord_success() throws Exception {
    transport.respondWith(204, "");

    records.deleteRecord("rec_1");

    Request request = transport.capturedRequest();
    assertThat(request.method()).isEqualTo("DELETE");
    assertThat(request.url().encodedPath()).isEqualTo("/api/client/records/rec_1");
    assertThat(request.body()).isNull();
  }

  @Test
  void testDeleteRecord_rejectsBlankIdWithoutSending() {
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> records.deleteRecord(" "));

    assertThat(thrown).hasMessageThat().isEqualTo("enzonix: record id must not be empty");
    verifyNoInteractions(transport.httpClient());
  }
}
