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
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import org.junit.Test;
import org.trypticon.termautomaton.util.BytesRef;
import org.trypticon.termautomaton.util.IntsRef;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class DaciukMihovAutomatonBuilderTests {

  private static List<BytesRef> sorted(String... terms) {
    TreeSet<BytesRef> set = new TreeSet<>();
    for (String term : terms) {
      set.add(new BytesRef(term));
    }
    return new ArrayList<>(set);
  }

  private static Automaton minimalUnion(List<BytesRef> terms) {
    List<Automaton> automata = new ArrayList<>();
    for (BytesRef term : terms) {
      automata.add(Automata.makeString(term.utf8ToString()));
    }
    return MinimizationOperations.minimize(Operations.union(automata), Operations.DEFAULT_MAX_DETERMINIZED_STATES);
  }

  @Test
  public void testSmallDictionary() {
    List<BytesRef> terms = sorted("stop", "stops", "tap", "taps", "top", "tops");
    Automaton a = DaciukMihovAutomatonBuilder.build(terms);
    assertTrue(a.isDeterministic());
    assertFalse(Operations.hasDeadStates(a));
    for (BytesRef term : terms) {
      assertTrue(term.utf8ToString(), Operations.run(a, term.utf8ToString()));
    }
    assertFalse(Operations.run(a, "sto"));
    assertFalse(Operations.run(a, "ta"));

    Automaton minimal = minimalUnion(terms);
    assertTrue(Operations.sameLanguage(a, minimal));
    assertEquals(minimal.getNumStates(), a.getNumStates());
    assertEquals(minimal.getNumTransitions(), a.getNumTransitions());
  }

  @Test
  public void testRandomDictionariesAreMinimal() {
    Random random = new Random(5);
    String[] pieces = {"a", "b", "c", "é", "中", "😀"};
    for (int iter = 0; iter < 100; iter++) {
      String[] terms = new String[1 + random.nextInt(20)];
      for (int i = 0; i < terms.length; i++) {
        StringBuilder b = new StringBuilder();
        int length = random.nextInt(6);
        for (int j = 0; j < length; j++) {
          b.append(pieces[random.nextInt(pieces.length)]);
        }
        terms[i] = b.toString();
      }
      List<BytesRef> sortedTerms = sorted(terms);
      Automaton a = DaciukMihovAutomatonBuilder.build(sortedTerms);
      Automaton minimal = minimalUnion(sortedTerms);
      assertTrue(Arrays.toString(terms), Operations.sameLanguage(a, minimal));
      assertEquals(Arrays.toString(terms), minimal.getNumStates(), a.getNumStates());

      Set<String> expected = new HashSet<>(Arrays.asList(terms));
      Set<String> actual = new HashSet<>();
      for (IntsRef string : AutomatonTestUtil.getFiniteStrings(a)) {
        actual.add(new String(string.ints, string.offset, string.length));
      }
      assertEquals(expected, actual);
    }
  }

  @Test
  public void testUnsortedInput() {
    List<BytesRef> terms = Arrays.asList(new BytesRef("b"), new BytesRef("a"));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> DaciukMihovAutomatonBuilder.build(terms));
    assertThat(e.getMessage(), containsString("sorted"));
  }

  @Test
  public void testDuplicatesAreIgnored() {
    List<BytesRef> terms = Arrays.asList(new BytesRef("a"), new BytesRef("a"), new BytesRef("b"));
    Automaton a = DaciukMihovAutomatonBuilder.build(terms);
    assertThat(AutomatonTestUtil.getFiniteStrings(a).size(), is(2));
  }

  @Test
  public void testEmptyTerm() {
    Automaton a = DaciukMihovAutomatonBuilder.build(sorted("", "a"));
    assertTrue(a.isAccept(0));
    assertTrue(Operations.run(a, ""));
    assertTrue(Operations.run(a, "a"));
    assertFalse(Operations.run(a, "b"));

    Automaton onlyEmpty = DaciukMihovAutomatonBuilder.build(sorted(""));
    assertTrue(Operations.isEmptyString(onlyEmpty));
  }

  @Test
  public void testSupplementaryCharactersUseCodePointLabels() {
    String clef = new String(Character.toChars(0x1D11E));
    Automaton a = DaciukMihovAutomatonBuilder.build(sorted(clef));
    assertEquals(2, a.getNumStates());
    Transition t = new Transition();
    a.getTransition(0, 0, t);
    assertEquals(0x1D11E, t.min);
  }

  @Test
  public void testBinary() {
    List<BytesRef> terms = Arrays.asList(
        new BytesRef(new byte[] {1, 2}),
        new BytesRef(new byte[] {1, (byte) 0xFF}));
    Automaton a = DaciukMihovAutomatonBuilder.buildBinary(terms);
    assertEquals(3, a.getNumStates());
    ByteRunAutomaton run = new ByteRunAutomaton(a, true, Operations.DEFAULT_MAX_DETERMINIZED_STATES);
    assertTrue(run.run(new byte[] {1, (byte) 0xFF}, 0, 2));
    assertTrue(run.run(new byte[] {1, 2}, 0, 2));
    assertFalse(run.run(new byte[] {1}, 0, 1));
  }

  @Test
  public void testStringUnionOfNothing() {
    assertEquals(0, Automata.makeStringUnion(new ArrayList<>()).getNumStates());
  }
}
