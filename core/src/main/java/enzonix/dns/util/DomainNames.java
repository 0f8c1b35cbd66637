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

package enzonix.dns.util;

import static enzonix.dns.util.PreconditionsUtils.checkArgumentNotBlank;

import com.google.common.base.CharMatcher;
import com.google.common.net.UrlEscapers;

/** Helpers for turning zone names and identifiers into URL path segments. */
public final class DomainNames {

  private static final CharMatcher DOT = CharMatcher.is('.');

  /**
   * Normalizes a zone name for use in a request path.
   *
   * <p>Surrounding whitespace and trailing dots are removed, so {@code "example.com."} and {@code
   * "example.com"} address the same zone.
   *
   * @throws IllegalArgumentException if nothing is left after normalization
   */
  public static String canonicalizeZoneName(String zone) {
    String trimmed = checkArgumentNotBlank(zone, "zone");
    return checkArgumentNotBlank(DOT.trimTrailingFrom(trimmed), "zone");
  }

  /** Escapes a single path segment, so identifiers can never introduce extra path components. */
  public static String escapePathSegment(String segment) {
    return UrlEscapers.urlPathSegmentEscaper().escape(segment);
  }

  private DomainNames() {}
}
