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
package org.apache.pregel.comm.messages;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestAsyncQueueMessenger {
  private static DoubleArrayList read(AsyncQueueMessenger messenger,
      long nodeId) {
    AsyncQueueMessenger.Iterator iterator = messenger.messageIterator();
    messenger.initMessageIterator(iterator, nodeId, false);
    DoubleArrayList values = new DoubleArrayList();
    while (iterator.hasNext()) {
      values.add(iterator.nextDouble());
    }
    return values;
  }

  @Test
  public void testMessageVisibleInSameSuperstep() {
    AsyncQueueMessenger messenger = new AsyncQueueMessenger(2);
    messenger.initIteration(0);
    messenger.sendTo(0, 1, 3.0);
    assertEquals(DoubleArrayList.wrap(new double[] {3.0}),
        read(messenger, 1));
  }

  @Test
  public void testReadingDrains() {
    AsyncQueueMessenger messenger = new AsyncQueueMessenger(2);
    messenger.initIteration(0);
    messenger.sendTo(0, 1, 1.0);
    messenger.sendTo(0, 1, 2.0);
    assertEquals(2, read(messenger, 1).size());
    assertTrue(read(messenger, 1).isEmpty());
    messenger.sendTo(0, 1, 5.0);
    messenger.initIteration(1);
    assertEquals(DoubleArrayList.wrap(new double[] {5.0}),
        read(messenger, 1));
  }

  @Test
  public void testUnreadMessagesSurviveCompaction() {
    AsyncQueueMessenger messenger = new AsyncQueueMessenger(1);
    messenger.initIteration(0);
    for (int i = 0; i < 10; ++i) {
      messenger.sendTo(0, 0, i);
    }
    assertEquals(10, read(messenger, 0).size());
    messenger.sendTo(0, 0, 10.0);
    messenger.sendTo(0, 0, 11.0);
    messenger.initIteration(1);
    messenger.initIteration(2);
    assertEquals(DoubleArrayList.wrap(new double[] {10.0, 11.0}),
        read(messenger, 0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNaNRejected() {
    AsyncQueueMessenger messenger = new AsyncQueueMessenger(1);
    messenger.initIteration(0);
    messenger.sendTo(0, 0, Double.NaN);
  }

  @Test(expected = IllegalStateException.class)
  public void testReleased() {
    AsyncQueueMessenger messenger = new AsyncQueueMessenger(1);
    messenger.release();
    messenger.initIteration(0);
  }
}
