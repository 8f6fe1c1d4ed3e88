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

package org.trypticon.termautomaton.automaton;

import java.util.Arrays;

import com.carrotsearch.hppc.BitMixer;

/**
 * A subset that became a DFA state. Hashes like {@link StateSet}, so the
 * two can be compared as keys of the same table.
 */
final class FrozenIntSet extends IntSet {
  final int[] values;
  final int state;
  private final long hash;

  /** {@code values} must be sorted and distinct; the array is not copied. */
  FrozenIntSet(int[] values, int state) {
    this.values = values;
    this.state = state;
    long mixed = values.length;
    for (int v : values) {
      mixed += BitMixer.mix(v);
    }
    this.hash = mixed;
  }

  @Override
  int[] getArray() {
    return values;
  }

  @Override
  int size() {
    return values.length;
  }

  @Override
  long longHashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return state + ":" + Arrays.toString(values);
  }
}
