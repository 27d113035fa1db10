// This file is part of OpenGraphite.
// Copyright (C) 2024  The OpenGraphite Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.opengraphite.utils;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Static initialization and configuration of the Jackson ObjectMapper for 
 * use throughout OpenGraphite. The mapper is thread safe and expensive to 
 * build so there is one per app.
 * <p>
 * For streaming, access the factory directly via {@link #getFactory()}.
 * @since 1.0
 */
public final class JSON {
  /**
   * Jackson de/serializer initialized, configured and shared
   */
  private static final ObjectMapper jsonMapper = new ObjectMapper();
  static {
    // series values may be NaN or infinite
    jsonMapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
  }
  
  /** Don't instantiate me! */
  private JSON() { }

  /**
   * Parses a JSON formatted byte array into a tree.
   * @param json The byte array to deserialize
   * @return The root node.
   * @throws IllegalArgumentException if the data was null or malformed
   * @throws JSONException if the data could not be read
   */
  public static final JsonNode parseToNode(final byte[] json) {
    if (json == null) {
      throw new IllegalArgumentException("Incoming data was null");
    }
    try {
      return jsonMapper.readTree(json);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }
  
  /**
   * Serializes the given object to a JSON byte array
   * @param object The object to serialize
   * @return A JSON formatted byte array
   * @throws IllegalArgumentException if the object was null
   * @throws JSONException if the object could not be serialized
   */
  public static final byte[] serializeToBytes(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return jsonMapper.writeValueAsBytes(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }
  
  /** @return The mapper's factory for streaming. */
  public static final JsonFactory getFactory() {
    return jsonMapper.getFactory();
  }
}
