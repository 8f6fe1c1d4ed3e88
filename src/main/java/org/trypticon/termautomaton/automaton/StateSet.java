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
import com.carrotsearch.hppc.IntIntHashMap;

/**
 * The target subset while the subset construction sweeps a state's label
 * points. Each NFA state is counted once per transition currently covering
 * the point and is a member while its count is positive. Membership changes
 * update the hash in place, so looking the set up in the memo table costs
 * no rehash.
 */
final class StateSet extends IntSet {

  private final IntIntHashMap counts = new IntIntHashMap();
  // sum of the mixed members; the hash adds the size
  private long mixedSum;
  // sorted members, null after a membership change
  private int[] sorted = new int[0];

  void incr(int state) {
    if (counts.addTo(state, 1) == 1) {
      mixedSum += BitMixer.mix(state);
      sorted = null;
    }
  }

  void decr(int state) {
    assert counts.containsKey(state) : "state " + state + " is not a member";
    if (counts.addTo(state, -1) == 0) {
      counts.remove(state);
      mixedSum -= BitMixer.mix(state);
      sorted = null;
    }
  }

  /** Copies the current members into a set that represents DFA state {@code state}. */
  FrozenIntSet freeze(int state) {
    return new FrozenIntSet(getArray(), state);
  }

  @Override
  int[] getArray() {
    if (sorted == null) {
      sorted = counts.keys().toArray();
      Arrays.sort(sorted);
    }
    return sorted;
  }

  @Override
  int size() {
    return counts.size();
  }

  @Override
  long longHashCode() {
    return counts.size() + mixedSum;
  }

  @Override
  public String toString() {
    return "StateSet" + counts;
  }
}
