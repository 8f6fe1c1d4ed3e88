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
 * A slice {@code ints[offset, offset+length)} of an int array: a string of
 * code points (or byte labels) as automata see it. Ordered element by
 * element, which is code point order.
 */
public final class IntsRef implements Comparable<IntsRef> {

  public int[] ints;

  public int offset;

  public int length;

  /** An empty slice. */
  public IntsRef() {
    this(new int[0], 0, 0);
  }

  public IntsRef(int[] ints, int offset, int length) {
    assert offset >= 0 && length >= 0 && offset + length <= ints.length;
    this.ints = ints;
    this.offset = offset;
    this.length = length;
  }

  /** Returns a slice over a fresh array holding the same values as {@code other}. */
  public static IntsRef deepCopyOf(IntsRef other) {
    return new IntsRef(Arrays.copyOfRange(other.ints, other.offset, other.offset + other.length), 0, other.length);
  }

  @Override
  public int compareTo(IntsRef other) {
    int common = Math.min(length, other.length);
    for (int i = 0; i < common; i++) {
      int cmp = Integer.compare(ints[offset + i], other.ints[other.offset + i]);
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(length, other.length);
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof IntsRef)) {
      return false;
    }
    IntsRef that = (IntsRef) other;
    return length == that.length && compareTo(that) == 0;
  }

  @Override
  public int hashCode() {
    int hash = 0;
    for (int i = offset, end = offset + length; i < end; i++) {
      hash = 31 * hash + ints[i];
    }
    return hash;
  }

  /** The values in hex, e.g. {@code [61 1f600]}. */
  @Override
  public String toString() {
    StringBuilder b = new StringBuilder("[");
    for (int i = 0; i < length; i++) {
      if (i > 0) {
        b.append(' ');
      }
      b.append(Integer.toHexString(ints[offset + i]));
    }
    return b.append(']').toString();
  }
}
