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

import java.util.concurrent.atomic.AtomicLongArray;

import javax.annotation.concurrent.ThreadSafe;

import com.google.common.base.Preconditions;

/**
 * Fixed size bit set with lock-free updates. Used for the vote-to-halt
 * bits, one per vertex.
 */
@ThreadSafe
public class AtomicBitSet {
  /** Bits per word */
  private static final int WORD_BITS = 64;

  /** Backing words */
  private final AtomicLongArray words;
  /** Number of bits */
  private final long size;

  /**
   * Constructor, all bits clear.
   *
   * @param size Number of bits
   */
  public AtomicBitSet(long size) {
    Preconditions.checkArgument(size >= 0 &&
        (size + WORD_BITS - 1) / WORD_BITS < Integer.MAX_VALUE,
        "AtomicBitSet: Invalid size %s", size);
    this.size = size;
    this.words = new AtomicLongArray((int) ((size + WORD_BITS - 1) /
        WORD_BITS));
  }

  public long size() {
    return size;
  }

  /**
   * @param index Bit index
   * @return True if the bit is set
   */
  public boolean get(long index) {
    checkIndex(index);
    return (words.get(wordIndex(index)) & mask(index)) != 0;
  }

  /**
   * Set a bit.
   *
   * @param index Bit index
   */
  public void set(long index) {
    checkIndex(index);
    int word = wordIndex(index);
    long mask = mask(index);
    long current;
    do {
      current = words.get(word);
      if ((current & mask) != 0) {
        return;
      }
    } while (!words.compareAndSet(word, current, current | mask));
  }

  /**
   * Clear a bit.
   *
   * @param index Bit index
   */
  public void clear(long index) {
    checkIndex(index);
    int word = wordIndex(index);
    long mask = mask(index);
    long current;
    do {
      current = words.get(word);
      if ((current & mask) == 0) {
        return;
      }
    } while (!words.compareAndSet(word, current, current & ~mask));
  }

  /**
   * Clear every bit. Not atomic with respect to concurrent updates.
   */
  public void clearAll() {
    for (int i = 0; i < words.length(); ++i) {
      words.set(i, 0);
    }
  }

  /**
   * @return Number of set bits
   */
  public long cardinality() {
    long count = 0;
    for (int i = 0; i < words.length(); ++i) {
      count += Long.bitCount(words.get(i));
    }
    return count;
  }

  /**
   * @return True if every bit is set, also for an empty set
   */
  public boolean allSet() {
    int fullWords = (int) (size / WORD_BITS);
    for (int i = 0; i < fullWords; ++i) {
      if (words.get(i) != -1L) {
        return false;
      }
    }
    int remainder = (int) (size % WORD_BITS);
    if (remainder == 0) {
      return true;
    }
    long lastMask = (1L << remainder) - 1;
    return (words.get(fullWords) & lastMask) == lastMask;
  }

  /**
   * @param index Bit index
   * @return Word holding the bit
   */
  private static int wordIndex(long index) {
    return (int) (index / WORD_BITS);
  }

  /**
   * @param index Bit index
   * @return Mask of the bit within its word
   */
  private static long mask(long index) {
    return 1L << (index % WORD_BITS);
  }

  /**
   * @param index Bit index to verify
   */
  private void checkIndex(long index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("checkIndex: Bit " + index +
          " outside of [0, " + size + ")");
    }
  }
}
