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

import java.util.List;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class LevenshteinAutomataTests {

  private static final List<String> CANDIDATES = AutomatonTestUtil.allStrings("abc", 5);

  @Test
  public void testTranspositionCountsAsOneEdit() {
    Automaton plain = new LevenshteinAutomata("abcd", false).toAutomaton(1);
    Automaton withTranspositions = new LevenshteinAutomata("abcd", true).toAutomaton(1);
    assertFalse(Operations.run(plain, "bacd"));
    assertTrue(Operations.run(withTranspositions, "bacd"));
    assertTrue(Operations.run(withTranspositions, "abdc"));
    assertFalse(Operations.run(withTranspositions, "badc"));
  }

  @Test
  public void testLongerWord() {
    String word = "levenshtein";
    for (int n = 1; n <= 3; n++) {
      Automaton a = new LevenshteinAutomata(word, true).toAutomaton(n);
      assertTrue(Operations.run(a, word));
      assertTrue(Operations.run(a, "levenstein"));
      assertTrue(Operations.run(a, "lveenshtein"));
      assertTrue(Operations.run(a, "levenshteins"));
      assertEquals(n >= 2, Operations.run(a, "lvenstein"));
      assertEquals(n >= 3, Operations.run(a, "xvenstein"));
      assertFalse(Operations.run(a, "shtein"));
    }
  }

  @Test
  public void testPrefix() {
    Automaton a = new LevenshteinAutomata("ab", false).toAutomaton(1, "pre");
    assertTrue(a.isDeterministic());
    for (String candidate : CANDIDATES) {
      boolean expected = AutomatonTestUtil.editDistance("ab", candidate, false) <= 1;
      assertEquals(candidate, expected, Operations.run(a, "pre" + candidate));
      assertFalse(candidate, Operations.run(a, "prx" + candidate));
      assertFalse(candidate, Operations.run(a, candidate.isEmpty() ? "pr" : candidate));
    }
  }

  @Test
  public void testPrefixWithExactMatch() {
    Automaton a = new LevenshteinAutomata("ab", false).toAutomaton(0, "pre");
    assertTrue(Operations.run(a, "preab"));
    assertFalse(Operations.run(a, "prea"));
    assertThat(Operations.getSingleton(a).length, is(5));
  }

  @Test
  public void testDistancesAreNested() {
    for (String word : new String[] {"", "a", "abba", "banana"}) {
      for (boolean transpositions : new boolean[] {false, true}) {
        LevenshteinAutomata builder = new LevenshteinAutomata(word, transpositions);
        for (int n = 0; n < LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE; n++) {
          assertTrue(word + " n=" + n,
              Operations.subsetOf(builder.toAutomaton(n), builder.toAutomaton(n + 1)));
        }
      }
    }
  }

  @Test
  public void testZeroEditsIsSingleton() {
    Automaton a = new LevenshteinAutomata("foo", true).toAutomaton(0);
    assertTrue(a.isSingleton());
    assertTrue(Operations.run(a, "foo"));
    assertFalse(Operations.run(a, "fo"));
  }

  @Test
  public void testEmptyWord() {
    Automaton a = new LevenshteinAutomata("", false).toAutomaton(2);
    assertTrue(Operations.run(a, ""));
    assertTrue(Operations.run(a, "x"));
    assertTrue(Operations.run(a, "xy"));
    assertFalse(Operations.run(a, "xyz"));
  }

  @Test
  public void testSupplementaryCharacters() {
    String clef = new String(Character.toChars(0x1D11E));
    Automaton a = new LevenshteinAutomata(clef + "a", false).toAutomaton(1);
    assertTrue(Operations.run(a, clef + "a"));
    assertTrue(Operations.run(a, "a"));
    assertTrue(Operations.run(a, clef));
    assertTrue(Operations.run(a, "xa"));
    assertTrue(Operations.run(a, clef + "ab"));
    assertFalse(Operations.run(a, "xb"));
  }

  @Test
  public void testUnsupportedDistance() {
    LevenshteinAutomata builder = new LevenshteinAutomata("foo", false);
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> builder.toAutomaton(4));
    assertThat(e.getMessage(), containsString("got 4"));
    assertThrows(IllegalArgumentException.class, () -> builder.toAutomaton(-1));
  }

  @Test
  public void testSymbolAboveAlphabet() {
    assertThrows(IllegalArgumentException.class,
        () -> new LevenshteinAutomata(new int[] {'a', 300}, 255, false));
  }

  @Test
  public void testByteAlphabet() {
    Automaton a = new LevenshteinAutomata(new int[] {'a', 'b'}, 255, false).toAutomaton(1);
    Transition t = new Transition();
    for (int state = 0; state < a.getNumStates(); state++) {
      int count = a.initTransition(state, t);
      for (int i = 0; i < count; i++) {
        a.getNextTransition(t);
        assertTrue(t.max <= 255);
      }
    }
    assertTrue(Operations.run(a, "ab"));
    assertTrue(Operations.run(a, "\u00ffb"));
  }

  @Test
  public void testTranspositionsOnlyAddStrings() {
    for (String word : new String[] {"ab", "abc", "abba"}) {
      for (int n = 1; n <= LevenshteinAutomata.MAXIMUM_SUPPORTED_DISTANCE; n++) {
        Automaton plain = new LevenshteinAutomata(word, false).toAutomaton(n);
        Automaton withTranspositions = new LevenshteinAutomata(word, true).toAutomaton(n);
        assertTrue(word + " n=" + n, Operations.subsetOf(plain, withTranspositions));
      }
    }
  }
}
