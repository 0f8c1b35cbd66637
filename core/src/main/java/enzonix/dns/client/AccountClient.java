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

import static enzonix.dns.client.DomainsClient.CLIENT_API_PREFIX;

import com.google.common.flogger.FluentLogger;
import enzonix.dns.model.ClientProfile;
import jakarta.inject.Inject;
import okhttp3.Request;

/** Account endpoints of the Enzonix client API. */
public class AccountClient {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EnzonixClient client;

  @Inject
  public AccountClient(EnzonixClient client) {
    this.client = client;
  }

  /**
   * Rotates the API token.
   *
   * <p>The old token stops working once this returns; the returned profile carries the new one in
   * {@link ClientProfile#apiToken()}. The {@link EnzonixClient} that made this call keeps using
   * the old token, so callers need a new client built with the new one.
   */
  public ClientProfile rotateApiKey() throws EnzonixException {
    Request request = client.newRequest("POST", CLIENT_API_PREFIX + "/rotate-api-key", null, null);
    ClientProfile profile = client.executeForValue(request, ClientProfile.class);
    logger.atInfo().log("Rotated Enzonix API token for client %s", profile.id());
    return profile;
  }
}
