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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.joda.time.DateTime;

/** Provides the {@link Gson} instance used for every Enzonix request and response body. */
public final class GsonUtils {

  private static final Gson GSON =
      new GsonBuilder()
          .excludeFieldsWithoutExposeAnnotation()
          .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
          .registerTypeAdapter(DateTime.class, new DateTimeTypeAdapter())
          .disableHtmlEscaping()
          .create();

  /**
   * Returns the shared Gson instance.
   *
   * <p>Only {@code @Expose}d fields take part in serialization, Java field names map to
   * snake_case JSON names and null fields are left out of the output.
   */
  public static Gson provideGson() {
    return GSON;
  }

  private GsonUtils() {}
}
