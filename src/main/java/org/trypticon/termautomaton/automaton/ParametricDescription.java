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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.trypticon.termautomaton.util.ArrayUtil;

/**
 * Parametric description of the Levenshtein automata of distance {@code n},
 * independent of the word being matched.
 * <p>
 * A parametric state holds the edit distances of the {@code 2n+1} word
 * positions following the current offset, each capped at {@code n+1}. With
 * transpositions it also holds the {@code 2n} pending costs of transpositions
 * started by the previous character. The table maps a state, the number of
 * word characters left in the window and the characteristic vector of the
 * input character over that window to the next state and the number of
 * positions the window moves forward.
 * <p>
 * Instances are immutable and shared between threads.
 */
final class ParametricDescription {

  private static final Map<Integer,ParametricDescription> CACHE = new ConcurrentHashMap<>();

  static ParametricDescription get(int n, boolean transpositions) {
    if (n < 1 || n > LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE) {
      throw new IllegalArgumentException("unsupported distance: " + n);
    }
    return CACHE.computeIfAbsent(n * 2 + (transpositions ? 1 : 0),
        k -> new ParametricDescription(n, transpositions));
  }

  private final int n;
  private final boolean transpositions;
  private final int windowSize;
  /** Table entries per state: one per (length, vector) with length in 0..windowSize. */
  private final int rowLength;
  private final int numStates;
  /** Next parametric state per entry, -1 if every position is beyond n edits. */
  private final int[] nextStates;
  private final byte[] shifts;
  /** Capped distances of the window, windowSize values per state. */
  private final byte[] distances;

  private ParametricDescription(int n, boolean transpositions) {
    this.n = n;
    this.transpositions = transpositions;
    this.windowSize = 2 * n + 1;
    this.rowLength = (1 << (windowSize + 1)) - 1;

    final int limit = n + 1;
    final int width = windowSize + (transpositions ? 2 * n : 0);
    byte[] initial = new byte[width];
    for (int i = 0; i < width; i++) {
      initial[i] = (byte) (i < windowSize ? Math.min(i, limit) : limit);
    }

    Map<Long,Integer> ids = new HashMap<>();
    List<byte[]> states = new ArrayList<>();
    ids.put(key(initial), 0);
    states.add(initial);

    int[] next = new int[0];
    byte[] shift = new byte[0];
    byte[] target = new byte[width];
    int[] costs = new int[windowSize + 1];
    for (int s = 0; s < states.size(); s++) {
      byte[] state = states.get(s);
      next = ArrayUtil.grow(next, (s + 1) * rowLength);
      shift = ArrayUtil.grow(shift, (s + 1) * rowLength);
      for (int length = 0; length <= windowSize; length++) {
        for (int vector = 0; vector < (1 << length); vector++) {
          int index = s * rowLength + (1 << length) - 1 + vector;
          int moved = step(state, length, vector, costs, target);
          if (moved == -1) {
            next[index] = -1;
            continue;
          }
          long key = key(target);
          Integer id = ids.get(key);
          if (id == null) {
            id = states.size();
            ids.put(key, id);
            states.add(target.clone());
          }
          next[index] = id;
          shift[index] = (byte) moved;
        }
      }
    }

    numStates = states.size();
    nextStates = Arrays.copyOf(next, numStates * rowLength);
    shifts = Arrays.copyOf(shift, numStates * rowLength);
    distances = new byte[numStates * windowSize];
    for (int s = 0; s < numStates; s++) {
      System.arraycopy(states.get(s), 0, distances, s * windowSize, windowSize);
    }
  }

  /**
   * Computes the successor of {@code state} into {@code target}; returns the
   * shift of the window, or -1 if the successor is dead.
   */
  private int step(byte[] state, int length, int vector, int[] costs, byte[] target) {
    final int limit = n + 1;
    for (int j = 0; j <= windowSize; j++) {
      int best = limit;
      if (j <= length) {
        if (j >= 1) {
          best = Math.min(best, state[j - 1] + (bit(length, vector, j - 1) ? 0 : 1));
          best = Math.min(best, costs[j - 1] + 1);
        }
        if (j < windowSize) {
          best = Math.min(best, state[j] + 1);
        }
        if (transpositions && j >= 2 && bit(length, vector, j - 2)) {
          best = Math.min(best, state[windowSize + j - 2]);
        }
      }
      costs[j] = Math.min(best, limit);
    }

    int shift = -1;
    for (int j = 0; j <= windowSize; j++) {
      if (costs[j] <= n) {
        shift = j;
        break;
      }
    }
    if (shift == -1) {
      return -1;
    }

    for (int k = 0; k < windowSize; k++) {
      target[k] = (byte) (shift + k <= windowSize ? costs[shift + k] : limit);
    }
    if (transpositions) {
      Arrays.fill(target, windowSize, target.length, (byte) limit);
      // a match of position i+1 may later be swapped with a match of position i
      for (int i = 0; i < 2 * n; i++) {
        if (i + 1 < length && bit(length, vector, i + 1) && state[i] + 1 <= n) {
          int relative = i + 2 - shift;
          if (relative >= 2 && relative <= 2 * n + 1) {
            int slot = windowSize + relative - 2;
            target[slot] = (byte) Math.min(target[slot], state[i] + 1);
          }
        }
      }
    }
    return shift;
  }

  private static boolean bit(int length, int vector, int position) {
    return ((vector >>> (length - 1 - position)) & 1) != 0;
  }

  private static long key(byte[] values) {
    long key = 0;
    for (byte value : values) {
      key = (key << 3) | value;
    }
    return key;
  }

  int getWindowSize() {
    return windowSize;
  }

  int getNumStates() {
    return numStates;
  }

  /** Next parametric state, or -1 if no string with this prefix is within distance. */
  int nextState(int state, int length, int vector) {
    return nextStates[state * rowLength + (1 << length) - 1 + vector];
  }

  int shift(int state, int length, int vector) {
    return shifts[state * rowLength + (1 << length) - 1 + vector];
  }

  boolean isAccept(int state, int distanceToEnd) {
    return distanceToEnd < windowSize && distances[state * windowSize + distanceToEnd] <= n;
  }
}
