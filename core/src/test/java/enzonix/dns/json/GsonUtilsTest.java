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

package enzonix.dns.json;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import enzonix.dns.model.DnsRecord;
import enzonix.dns.model.UpdateRecordRequest;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.jupiter.api.Test;

public class GsonUtilsTest {

  private final Gson gson = GsonUtils.provideGson();

  @Test
  void testDecode_snakeCaseFieldsAndOffsets() {
    DnsRecord record =
        gson.fromJson(
            """
            {
              "id": "rec_1",
              "domain_id": "dom_1",
              "name": "www",
              "type": "A",
              "ttl": 300,
              "value": "192.0.2.1",
              "created_at": "2024-05-01T12:00:00.250+02:00",
              "unknown_field": "ignored"
            }
            """,
            DnsRecord.class);

    assertThat(record.domainId()).isEqualTo("dom_1");
    assertThat(record.countryCodes()).isEmpty();
    assertThat(record.priority()).isEqualTo(0);
    assertThat(record.createdAt().getMillis())
        .isEqualTo(new DateTime(2024, 5, 1, 10, 0, 0, 250, DateTimeZone.UTC).getMillis());
    assertThat(record.createdAt().getZone()).isEqualTo(DateTimeZone.forOffsetHours(2));
    assertThat(record.updatedAt()).isNull();
  }

  @Test
  void testDecode_invalidTimestamp() {
    assertThrows(
        JsonParseException.class,
        () -> gson.fromJson("{\"id\":\"r\",\"created_at\":\"yesterday\"}", DnsRecord.class));
  }

  @Test
  void testEncode_omitsNullsAndKeepsHtmlCharacters() {
    UpdateRecordRequest request =
        UpdateRecordRequest.builder()
            .setValue("v=spf1 include:<mail>&more")
            .setCountryCodes(ImmutableList.of("US"))
            .build();

    String json = gson.toJson(request);

    assertThat(json).contains("include:<mail>&more");
    assertThat(JsonParser.parseString(json))
        .isEqualTo(
            JsonParser.parseString(
                """
                {"value": "v=spf1 include:<mail>&more", "country_codes": ["US"]}
                """));
  }

  @Test
  void testEncode_timestampsInIsoFormat() {
    DateTime time = new DateTime(2024, 5, 1, 10, 0, 0, 0, DateTimeZone.UTC);

    assertThat(gson.toJson(time, DateTime.class)).isEqualTo("\"2024-05-01T10:00:00.000Z\"");
  }
}
