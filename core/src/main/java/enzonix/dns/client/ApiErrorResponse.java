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

import com.google.gson.annotations.Expose;
import javax.annotation.Nullable;

/**
 * The JSON body the Enzonix API sends with a failed request.
 *
 * <p>The HTTP status code is not part of the body; it is carried by {@link
 * EnzonixException.ApiException} alongside this response.
 */
public record ApiErrorResponse(@Expose @Nullable String message, @Expose @Nullable String code) {}
