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

import enzonix.dns.client.EnzonixException.ApiException;
import enzonix.dns.model.ClientProfile;
import enzonix.dns.testing.MockTransport;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class AccountClientTest {

  private final MockTransport transport = new MockTransport();
  private AccountClient account;

  @BeforeEach
  void beforeEach() {
    account = transport.newClient().account();
  }

  @Test
  void testRotateApiKey_success() throws Exception {
    transport.respondWith(
        200,
        """
        {
          "id": "cl_1",
          "name": "Acme",
          "email": "ops@acme.test",
          "api_token": "new-token",
          "domain_limit": 25,
          "created_at": "2024-01-01T00:00:00Z",
          "updated_at": "2024-06-01T00:00:00Z"
        }
        """);

    ClientProfile profile = account.rotateApiKey();

    assertThat(profile.id()).isEqualTo("cl_1");
    assertThat(profile.email()).isEqualTo("ops@acme.test");
    assertThat(profile.apiToken()).isEqualTo("new-token");
    assertThat(profile.domainLimit()).isEqualTo(25);
    assertThat(profile.toString()).doesNotContain("new-token");

    Request request = transport.capturedRequest();
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.url().encodedPath()).isEqualTo("/api/client/rotate-api-key");
    assertThat(request.header("Authorization")).isEqualTo("Bearer " + MockTransport.API_KEY);
  }

  @Test
  void testRotateApiKey_unauthorized() throws Exception {
    transport.respondWith(401, "{\"message\":\"invalid token\",\"code\":\"unauthorized\"}");

    ApiException thrown = assertThrows(ApiException.class, () -> account.rotateApiKey());

    assertThat(thrown.getStatusCode()).isEqualTo(401);
    assertThat(thrown.getApiMessage()).isEqualTo("invalid token");
  }
}
