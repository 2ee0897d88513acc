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
package org.apache.pregel.conf;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestPregelConfig {
  @Test
  public void testDefaults() {
    PregelConfig config = PregelConfig.builder().build();
    assertEquals(PregelConstants.DEFAULT_CONCURRENCY, config.getConcurrency());
    assertEquals(20, config.getMaxIterations());
    assertFalse(config.getTolerance().isPresent());
    assertFalse(config.isAsynchronous());
    assertEquals(Partitioning.RANGE, config.getPartitioning());
    assertFalse(config.trackSender());
    assertFalse(config.useForkJoin());
  }

  @Test
  public void testOptionDescribesItself() {
    assertEquals("  pregel.concurrency => 4 (integer) - Number of threads " +
        "computing vertices in a superstep",
        PregelConstants.CONCURRENCY.toString());
    assertTrue(PregelConstants.PARTITIONING.toString().startsWith(
        "  pregel.partitioning => RANGE (enum) - "));
  }

  @Test
  public void testInvalidValuesRejected() {
    assertInvalid(PregelConfig.builder().concurrency(0));
    assertInvalid(PregelConfig.builder().maxIterations(0));
    assertInvalid(PregelConfig.builder().tolerance(0));
    assertInvalid(PregelConfig.builder().tolerance(-0.5));
    assertInvalid(PregelConfig.builder().tolerance(Double.NaN));
  }

  private static void assertInvalid(PregelConfig.Builder builder) {
    try {
      builder.build();
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().startsWith("build: "));
    }
  }

  @Test
  public void testPartitioningParse() {
    assertEquals(Partitioning.AUTO, Partitioning.parse("auto"));
    assertEquals(Partitioning.DEGREE, Partitioning.parse("Degree"));
    assertEquals("RANGE", Partitioning.RANGE.toString());
    assertTrue(Partitioning.AUTO.useForkJoin());
    assertEquals(Partitioning.DEGREE,
        PregelConfig.builder().partitioning("degree").build()
            .getPartitioning());
    try {
      Partitioning.parse("random");
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("random"));
    }
  }

  @Test
  public void testFromConfiguration() {
    PregelConfiguration conf = new PregelConfiguration();
    conf.setInt("pregel.concurrency", 8);
    conf.set("pregel.partitioning", "auto");
    conf.setBoolean("pregel.isAsynchronous", true);
    conf.set("pregel.tolerance", "0.001");
    PregelConfig config = PregelConfig.fromConfiguration(conf);
    assertEquals(8, config.getConcurrency());
    assertEquals(Partitioning.AUTO, config.getPartitioning());
    assertTrue(config.isAsynchronous());
    assertEquals(0.001, config.getTolerance().getAsDouble(), 0);
    assertEquals(20, config.getMaxIterations());
  }

  @Test
  public void testConfigurationRoundTrip() {
    PregelConfig config = PregelConfig.builder()
        .concurrency(2)
        .maxIterations(7)
        .partitioning(Partitioning.DEGREE)
        .trackSender(true)
        .build();
    PregelConfig copy = PregelConfig.fromConfiguration(
        config.toConfiguration());
    assertEquals(2, copy.getConcurrency());
    assertEquals(7, copy.getMaxIterations());
    assertEquals(Partitioning.DEGREE, copy.getPartitioning());
    assertTrue(copy.trackSender());
    assertFalse(copy.getTolerance().isPresent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidConfigurationRejected() {
    PregelConfiguration conf = new PregelConfiguration();
    conf.setMaxIterations(-1);
    PregelConfig.fromConfiguration(conf);
  }
}
