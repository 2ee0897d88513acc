/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.pregel.reducers;

import java.util.Random;

import org.apache.pregel.reducers.impl.CountReduce;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class TestReducers {
  private static final double[] SAMPLES = {
    0, 1, -1, 0.5, 1e300, -1e300, Double.MAX_VALUE, -Double.MAX_VALUE, 42
  };

  @Test
  public void testIdentityLaw() {
    for (ReducerType type : new ReducerType[] {
      ReducerType.SUM, ReducerType.MIN, ReducerType.MAX}) {
      MessageReducer reducer = type.newReducer();
      for (double x : SAMPLES) {
        assertEquals(type + " " + x, x,
            reducer.reduce(reducer.identity(), x), 0);
      }
    }
  }

  @Test
  public void testOrderIndependence() {
    Random random = new Random(17);
    double[] messages = new double[64];
    for (int i = 0; i < messages.length; ++i) {
      // small integers keep the sum exact in any order
      messages[i] = random.nextInt(1000) - 500;
    }
    for (ReducerType type : ReducerType.values()) {
      MessageReducer reducer = type.newReducer();
      double forward = reducer.identity();
      for (double message : messages) {
        forward = reducer.reduce(forward, message);
      }
      double backward = reducer.identity();
      for (int i = messages.length - 1; i >= 0; --i) {
        backward = reducer.reduce(backward, messages[i]);
      }
      assertEquals(type.toString(), forward, backward, 0);
      if (type != ReducerType.COUNT) {
        // pairwise tree fold
        double[] level = messages.clone();
        for (int size = level.length; size > 1; size /= 2) {
          for (int i = 0; i < size / 2; ++i) {
            level[i] = reducer.reduce(level[2 * i], level[2 * i + 1]);
          }
        }
        assertEquals(type.toString(), forward, level[0], 0);
      }
    }
  }

  @Test
  public void testCount() {
    MessageReducer count = CountReduce.INSTANCE;
    double value = count.identity();
    for (double message : SAMPLES) {
      value = count.reduce(value, message);
    }
    assertEquals(SAMPLES.length, value, 0);
  }

  @Test
  public void testParse() {
    assertSame(ReducerType.MIN, ReducerType.parse(" min"));
    assertSame(ReducerType.SUM, ReducerType.parse("Sum"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testParseUnknown() {
    ReducerType.parse("avg");
  }
}
