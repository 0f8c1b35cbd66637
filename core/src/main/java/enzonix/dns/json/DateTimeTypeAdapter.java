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

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

/** Gson adapter for RFC 3339 timestamps as sent by the Enzonix API. */
public class DateTimeTypeAdapter extends TypeAdapter<DateTime> {

  private static final DateTimeFormatter PARSER =
      ISODateTimeFormat.dateTimeParser().withOffsetParsed();

  @Override
  public void write(JsonWriter out, DateTime value) throws IOException {
    if (value == null) {
      out.nullValue();
      return;
    }
    out.value(ISODateTimeFormat.dateTime().print(value));
  }

  @Override
  public DateTime read(JsonReader in) throws IOException {
    if (in.peek() == JsonToken.NULL) {
      in.nextNull();
      return null;
    }
    String text = in.nextString();
    try {
      return PARSER.parseDateTime(text);
    } catch (IllegalArgumentException e) {
      throw new JsonParseException("Invalid timestamp: " + text, e);
    }
  }
}
