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
package org.apache.pregel.utils;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TestTerminationFlag {
  @Test
  public void testStopIsPermanent() {
    TerminationMonitor monitor = mock(TerminationMonitor.class);
    when(monitor.isTerminated()).thenReturn(false, true, false);
    TerminationFlag flag = TerminationFlag.wrap(monitor, 0);
    assertTrue(flag.running());
    assertFalse(flag.running());
    assertFalse(flag.running());
    verify(monitor, times(2)).isTerminated();
  }

  @Test
  public void testMonitorCheckedOncePerInterval() {
    TerminationMonitor monitor = mock(TerminationMonitor.class);
    TerminationFlag flag = TerminationFlag.wrap(monitor, 60000);
    for (int i = 0; i < 100; ++i) {
      assertTrue(flag.running());
    }
    verify(monitor, times(1)).isTerminated();
  }

  @Test
  public void testRunningTrue() {
    assertTrue(TerminationFlag.RUNNING_TRUE.running());
  }
}
