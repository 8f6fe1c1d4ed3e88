/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.trypticon.termautomaton.util;

import java.util.Arrays;

/**
 * Growth helpers for the append buffers used throughout the automaton code.
 * Each {@code grow} returns {@code array} itself when it already holds
 * {@code minSize} elements, and a larger copy otherwise.
 */
public final class ArrayUtil {

  /** Largest array length the JVM reliably allocates. */
  public static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

  private ArrayUtil() {}

  /**
   * Capacity to allocate for at least {@code minSize} elements: one eighth
   * more (at least 3 elements), rounded up to whole 8-byte words.
   */
  public static int oversize(int minSize, int bytesPerElement) {
    if (minSize < 0) {
      throw new IllegalArgumentException("invalid array size " + minSize);
    }
    if (minSize > MAX_ARRAY_LENGTH) {
      throw new IllegalArgumentException("array size " + minSize + " exceeds the maximum of " + MAX_ARRAY_LENGTH);
    }
    if (minSize == 0) {
      return 0;
    }
    int elementsPerWord = Math.max(1, 8 / bytesPerElement);
    long padded = minSize + Math.max(3L, minSize >> 3);
    long words = (padded + elementsPerWord - 1) / elementsPerWord;
    return (int) Math.min(words * elementsPerWord, MAX_ARRAY_LENGTH);
  }

  public static int[] grow(int[] array, int minSize) {
    return array.length >= minSize ? array : Arrays.copyOf(array, capacity(minSize, Integer.BYTES));
  }

  public static long[] grow(long[] array, int minSize) {
    return array.length >= minSize ? array : Arrays.copyOf(array, capacity(minSize, Long.BYTES));
  }

  public static byte[] grow(byte[] array, int minSize) {
    return array.length >= minSize ? array : Arrays.copyOf(array, capacity(minSize, Byte.BYTES));
  }

  /** Object arrays are sized as if references took 4 bytes. */
  public static <T> T[] grow(T[] array, int minSize) {
    return array.length >= minSize ? array : Arrays.copyOf(array, capacity(minSize, 4));
  }

  private static int capacity(int minSize, int bytesPerElement) {
    assert minSize >= 0 : "negative size " + minSize + ", probably an int overflow";
    return oversize(minSize, bytesPerElement);
  }
}
