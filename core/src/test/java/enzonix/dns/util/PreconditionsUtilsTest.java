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

import static com.google.common.truth.Truth.assertThat;
import static enzonix.dns.util.PreconditionsUtils.checkArgumentNotBlank;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class PreconditionsUtilsTest {

  @Test
  void testCheckArgumentNotBlank_returnsTrimmedValue() {
    assertThat(checkArgumentNotBlank("  dom_1\t", "domain id")).isEqualTo("dom_1");
  }

  @Test
  void testCheckArgumentNotBlank_throwsWithLabel() {
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> checkArgumentNotBlank("\n", "zone"));
    assertThat(thrown).hasMessageThat().isEqualTo("enzonix: zone must not be empty");
    assertThrows(IllegalArgumentException.class, () -> checkArgumentNotBlank(null, "zone"));
  }
}
