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
package net.opengraphite.query;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestMetricRequest {

  @Test
  public void ctor() throws Exception {
    final MetricRequest request = new MetricRequest("sys.*.cpu", 60, 120);
    assertEquals("sys.*.cpu", request.pattern());
    assertEquals(60, request.from());
    assertEquals(120, request.until());
    
    try {
      new MetricRequest(null, 60, 120);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new MetricRequest("", 60, 120);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void equalsAndHashCode() throws Exception {
    final MetricRequest request = new MetricRequest("a.b", 60, 120);
    assertEquals(request, new MetricRequest("a.b", 60, 120));
    assertEquals(request.hashCode(), 
        new MetricRequest("a.b", 60, 120).hashCode());
    assertNotEquals(request, new MetricRequest("a.c", 60, 120));
    assertNotEquals(request, new MetricRequest("a.b", 0, 120));
    assertNotEquals(request, new MetricRequest("a.b", 60, 180));
    assertNotEquals(request, null);
  }
}
