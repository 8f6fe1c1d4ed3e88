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
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import org.trypticon.termautomaton.util.ArrayUtil;
import org.trypticon.termautomaton.util.UnicodeUtil;

/**
 * Builds deterministic automata accepting every string within a fixed
 * Levenshtein distance of a word, in time linear in the word length.
 * <p>
 * With transpositions enabled, swapping two adjacent characters counts as a
 * single edit (restricted Damerau-Levenshtein distance).
 */
public class LevenshteinAutomata {
  /** Largest edit distance {@link #toAutomaton(int)} accepts. */
  public static final int MAXIMUM_SUPPORTED_DISTANCE = 3;
  /* input word */
  final int[] word;
  /* the automata alphabet. */
  final int[] alphabet;
  /* the maximum symbol in the alphabet (e.g. 255 for UTF-8 or 10FFFF for UTF-32) */
  final int alphaMax;
  final boolean withTranspositions;

  /* the ranges outside of alphabet */
  final int[] rangeLower;
  final int[] rangeUpper;
  int numRanges = 0;

  public LevenshteinAutomata(String input, boolean withTranspositions) {
    this(codePoints(input), Character.MAX_CODE_POINT, withTranspositions);
  }

  /**
   * @param word the word as code points (or bytes)
   * @param alphaMax largest label the automaton may carry
   */
  public LevenshteinAutomata(int[] word, int alphaMax, boolean withTranspositions) {
    this.word = word;
    this.alphaMax = alphaMax;
    this.withTranspositions = withTranspositions;

    // calculate the alphabet
    SortedSet<Integer> set = new TreeSet<>();
    for (int v : word) {
      if (v > alphaMax) {
        throw new IllegalArgumentException("alphaMax exceeded by symbol " + v + " in word");
      }
      if (v < 0) {
        throw new IllegalArgumentException("negative symbol " + v + " in word");
      }
      set.add(v);
    }
    alphabet = new int[set.size()];
    int upto = 0;
    for (int v : set) {
      alphabet[upto++] = v;
    }

    rangeLower = new int[alphabet.length + 2];
    rangeUpper = new int[alphabet.length + 2];
    // the label intervals that exclude the alphabet
    int lower = 0;
    for (int higher : alphabet) {
      if (higher > lower) {
        rangeLower[numRanges] = lower;
        rangeUpper[numRanges] = higher - 1;
        numRanges++;
      }
      lower = higher + 1;
    }
    /* add the final endpoint */
    if (lower <= alphaMax) {
      rangeLower[numRanges] = lower;
      rangeUpper[numRanges] = alphaMax;
      numRanges++;
    }
  }

  private static int[] codePoints(String input) {
    int length = Character.codePointCount(input, 0, input.length());
    int[] word = new int[length];
    for (int i = 0, j = 0, cp = 0; i < input.length(); i += Character.charCount(cp)) {
      word[j++] = cp = input.codePointAt(i);
    }
    return word;
  }

  public Automaton toAutomaton(int n) {
    return toAutomaton(n, "");
  }

  /**
   * Returns an automaton accepting {@code prefix} followed by any string
   * within {@code n} edits of the word. The prefix itself must match
   * exactly.
   *
   * @throws IllegalArgumentException if {@code n} is negative or above
   *     {@link #MAXIMUM_SUPPORTED_DISTANCE}
   */
  public Automaton toAutomaton(int n, String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (n < 0 || n > MAXIMUM_SUPPORTED_DISTANCE) {
      throw new IllegalArgumentException("maxEdits must be between 0 and "
          + MAXIMUM_SUPPORTED_DISTANCE + ", got " + n);
    }
    if (n == 0) {
      return Automata.makeString(prefix + UnicodeUtil.newString(word, 0, word.length));
    }

    final ParametricDescription description = ParametricDescription.get(n, withTranspositions);
    final int range = description.getWindowSize();
    final int w = word.length;

    Automaton a = new Automaton();
    int lastState = a.createState();
    for (int i = 0, cp; i < prefix.length(); i += Character.charCount(cp)) {
      int state = a.createState();
      cp = prefix.codePointAt(i);
      a.addTransition(lastState, state, cp, cp);
      lastState = state;
    }

    // automaton state of each reachable (parametric state, offset) pair,
    // assigned in the order the pairs are discovered
    final int[] ids = new int[description.getNumStates() * (w + 1)];
    Arrays.fill(ids, -1);
    int[] pending = new int[8];
    int numPending = 0;
    ids[0] = lastState;
    pending[numPending++] = 0;

    for (int upto = 0; upto < numPending; upto++) {
      final int pair = pending[upto];
      final int state = lastState + upto;
      final int param = pair / (w + 1);
      final int xpos = pair % (w + 1);
      a.setAccept(state, description.isAccept(param, w - xpos));

      final int length = Math.min(w - xpos, range);
      final int end = xpos + length;
      for (int ch : alphabet) {
        // get the characteristic vector at this position wrt ch
        final int cvec = getVector(ch, xpos, end);
        int next = description.nextState(param, length, cvec);
        if (next >= 0) {
          int target = next * (w + 1) + xpos + description.shift(param, length, cvec);
          if (ids[target] == -1) {
            ids[target] = a.createState();
            pending = ArrayUtil.grow(pending, numPending + 1);
            pending[numPending++] = target;
          }
          a.addTransition(state, ids[target], ch, ch);
        }
      }
      // every other label has an all-zero characteristic vector
      int next = description.nextState(param, length, 0);
      if (next >= 0) {
        int target = next * (w + 1) + xpos + description.shift(param, length, 0);
        if (ids[target] == -1) {
          ids[target] = a.createState();
          pending = ArrayUtil.grow(pending, numPending + 1);
          pending[numPending++] = target;
        }
        for (int r = 0; r < numRanges; r++) {
          a.addTransition(state, ids[target], rangeLower[r], rangeUpper[r]);
        }
      }
    }

    a.finishState();
    assert a.isDeterministic();
    return a;
  }

  int getVector(int x, int pos, int end) {
    int vector = 0;
    for (int i = pos; i < end; i++) {
      vector <<= 1;
      if (word[i] == x) {
        vector |= 1;
      }
    }
    return vector;
  }
}
