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
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

import org.junit.Test;
import org.trypticon.termautomaton.util.BytesRef;
import org.trypticon.termautomaton.util.BytesRefBuilder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class CompiledAutomatonTests {

  private static CompiledAutomaton build(String... terms) {
    TreeSet<BytesRef> sorted = new TreeSet<>();
    for (String term : terms) {
      sorted.add(new BytesRef(term));
    }
    return new CompiledAutomaton(Automata.makeStringUnion(sorted), true, false);
  }

  private static String floor(CompiledAutomaton c, String input) {
    BytesRef result = c.floor(new BytesRef(input), new BytesRefBuilder());
    return result == null ? null : result.utf8ToString();
  }

  @Test
  public void testEmptyLanguageIsNone() {
    CompiledAutomaton c = new CompiledAutomaton(Automata.makeEmpty());
    assertThat(c.type, is(CompiledAutomaton.AUTOMATON_TYPE.NONE));
    assertFalse(c.run(""));
    assertFalse(c.run("foo"));
    assertNull(c.floor(new BytesRef("foo"), new BytesRefBuilder()));
    assertThat(c.toString(), is("CompiledAutomaton(NONE)"));
  }

  @Test
  public void testIntersectionOfDisjointIsNone() {
    Automaton a = Operations.intersection(Automata.makeString("foo"), Automata.makeString("bar"));
    assertThat(new CompiledAutomaton(a).type, is(CompiledAutomaton.AUTOMATON_TYPE.NONE));
  }

  @Test
  public void testAnyStringIsAll() {
    CompiledAutomaton c = new CompiledAutomaton(Automata.makeAnyString());
    assertThat(c.type, is(CompiledAutomaton.AUTOMATON_TYPE.ALL));
    assertTrue(c.run(""));
    assertTrue(c.run("anything"));
    assertThat(floor(c, "xyz"), is("xyz"));
  }

  @Test
  public void testAnyBinaryIsAll() {
    CompiledAutomaton c = new CompiledAutomaton(Automata.makeAnyBinary(), null, true,
        Operations.DEFAULT_MAX_DETERMINIZED_STATES, true);
    assertThat(c.type, is(CompiledAutomaton.AUTOMATON_TYPE.ALL));
    assertTrue(c.run(new BytesRef(new byte[] {(byte) 0xFF, 0})));
  }

  @Test
  public void testLiteralIsSingle() {
    CompiledAutomaton c = new CompiledAutomaton(Automata.makeString("foo"));
    assertThat(c.type, is(CompiledAutomaton.AUTOMATON_TYPE.SINGLE));
    assertThat(c.term.utf8ToString(), is("foo"));
    assertTrue(c.run("foo"));
    assertFalse(c.run("fo"));
    assertThat(floor(c, "fop"), is("foo"));
    assertThat(floor(c, "foo"), is("foo"));
    assertThat(floor(c, "fon"), nullValue());
    assertThat(c.toString(), is("CompiledAutomaton(SINGLE foo)"));
  }

  @Test
  public void testUnionOfSameTermIsSingle() {
    Automaton a = Operations.union(Automata.makeString("foo"), Automata.makeString("foo"));
    CompiledAutomaton c = new CompiledAutomaton(a);
    assertThat(c.type, is(CompiledAutomaton.AUTOMATON_TYPE.SINGLE));
    assertThat(c.term.utf8ToString(), is("foo"));
  }

  @Test
  public void testBinarySingle() {
    BytesRef bytes = new BytesRef(new byte[] {(byte) 0xFF, 1});
    CompiledAutomaton c = new CompiledAutomaton(Automata.makeBinary(bytes), null, true,
        Operations.DEFAULT_MAX_DETERMINIZED_STATES, true);
    assertThat(c.type, is(CompiledAutomaton.AUTOMATON_TYPE.SINGLE));
    assertEquals(bytes, c.term);
    assertTrue(c.run(bytes));
    assertThat(c.toString(), is("CompiledAutomaton(SINGLE [ff 1])"));
  }

  @Test
  public void testFuzzyIsNormal() {
    CompiledAutomaton c = new CompiledAutomaton(new LevenshteinAutomata("foo", false).toAutomaton(1));
    assertThat(c.type, is(CompiledAutomaton.AUTOMATON_TYPE.NORMAL));
    assertTrue(c.finite);
    assertNull(c.commonSuffixRef);
    assertTrue(c.run("foo"));
    assertTrue(c.run("fo"));
    assertTrue(c.run("fooo"));
    assertTrue(c.run("féo"));
    assertFalse(c.run("f"));
    assertFalse(c.run("bar"));
    assertThat(c.toString(), is("CompiledAutomaton(NORMAL states=" + c.automaton.getNumStates()
        + " transitions=" + c.automaton.getNumTransitions() + " finite=true)"));
  }

  @Test
  public void testNoSimplifyAlwaysNormal() {
    CompiledAutomaton c = new CompiledAutomaton(Automata.makeString("foo"), null, false);
    assertThat(c.type, is(CompiledAutomaton.AUTOMATON_TYPE.NORMAL));
    assertTrue(c.run("foo"));
    assertFalse(c.run("foobar"));
    assertThat(c.automaton.getNumStates(), is(4));
  }

  @Test
  public void testInfiniteLanguage() {
    Automaton a = Operations.concatenate(Operations.repeat(Automata.makeAnyChar()), Automata.makeString("ing"));
    CompiledAutomaton c = new CompiledAutomaton(a);
    assertThat(c.type, is(CompiledAutomaton.AUTOMATON_TYPE.NORMAL));
    assertFalse(c.finite);
    assertThat(c.commonSuffixRef.utf8ToString(), is("ing"));
    assertTrue(c.run("testing"));
    assertTrue(c.run("ing"));
    assertFalse(c.run("tested"));
    assertThrows(IllegalStateException.class, () -> c.floor(new BytesRef("x"), new BytesRefBuilder()));
  }

  @Test
  public void testSinkState() {
    Automaton prefix = Operations.concatenate(Automata.makeBinary(new BytesRef("foo")), Automata.makeAnyBinary());
    CompiledAutomaton binary = new CompiledAutomaton(prefix, null, true,
        Operations.DEFAULT_MAX_DETERMINIZED_STATES, true);
    assertThat(binary.type, is(CompiledAutomaton.AUTOMATON_TYPE.NORMAL));
    assertTrue(binary.sinkState >= 0);
    assertTrue(binary.automaton.isAccept(binary.sinkState));
    assertTrue(binary.run(new BytesRef(new byte[] {'f', 'o', 'o', (byte) 0xFE})));

    // valid UTF-8 never loops on every byte
    CompiledAutomaton text = new CompiledAutomaton(
        Operations.concatenate(Automata.makeString("foo"), Automata.makeAnyString()));
    assertEquals(-1, text.sinkState);
    assertTrue(text.run("fooé"));
  }

  @Test
  public void testFloor() {
    CompiledAutomaton c = build("fob", "foo", "goo");
    assertThat(c.type, is(CompiledAutomaton.AUTOMATON_TYPE.NORMAL));
    assertThat(floor(c, "goo"), is("goo"));
    assertThat(floor(c, "ga"), is("foo"));
    assertThat(floor(c, "foc"), is("fob"));
    assertThat(floor(c, "f"), nullValue());
    assertThat(floor(c, ""), nullValue());
    assertThat(floor(c, "zzz"), is("goo"));
    assertThat(floor(c, "fooz"), is("foo"));
    assertThat(floor(c, "fo"), nullValue());
  }

  @Test
  public void testFloorWithEmptyTerm() {
    CompiledAutomaton c = build("", "b");
    assertThat(floor(c, ""), is(""));
    assertThat(floor(c, "a"), is(""));
    assertThat(floor(c, "c"), is("b"));
  }

  @Test
  public void testFloorMatchesSortedSet() {
    Random random = new Random(17);
    String[] pieces = {"a", "b", "z", "é", "ÿ", "Ā", "中", "😀"};
    for (int iter = 0; iter < 50; iter++) {
      TreeSet<BytesRef> terms = new TreeSet<>();
      int numTerms = 1 + random.nextInt(10);
      for (int i = 0; i < numTerms; i++) {
        terms.add(new BytesRef(randomString(random, pieces)));
      }
      // more than one term keeps the automaton NORMAL
      terms.add(new BytesRef("m"));
      terms.add(new BytesRef("mm"));
      CompiledAutomaton c = new CompiledAutomaton(Automata.makeStringUnion(terms), true, false);
      for (int i = 0; i < 100; i++) {
        BytesRef input = new BytesRef(randomString(random, pieces));
        BytesRef expected = terms.floor(input);
        BytesRef actual = c.floor(input, new BytesRefBuilder());
        assertEquals(terms + " floor " + input, expected, actual == null ? null : BytesRef.deepCopyOf(actual));
      }
    }
  }

  private static String randomString(Random random, String[] pieces) {
    StringBuilder b = new StringBuilder();
    int length = random.nextInt(5);
    for (int i = 0; i < length; i++) {
      b.append(pieces[random.nextInt(pieces.length)]);
    }
    return b.toString();
  }

  @Test
  public void testMaxDeterminizedStates() {
    List<Automaton> options = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      options.add(Automata.makeString("a" + (char) ('a' + i)));
    }
    Automaton a = Operations.union(options);
    assertThrows(TooComplexToDeterminizeException.class,
        () -> new CompiledAutomaton(a, null, true, 1, false));
  }

  @Test
  public void testEquals() {
    assertEquals(new CompiledAutomaton(Automata.makeString("foo")),
        new CompiledAutomaton(Operations.union(Automata.makeString("foo"), Automata.makeString("foo"))));
    assertNotEquals(new CompiledAutomaton(Automata.makeString("foo")),
        new CompiledAutomaton(Automata.makeString("bar")));
    assertEquals(build("a", "b"), build("a", "b"));
  }

  @Test
  public void testMinimalInputIsNotMinimizedAgain() {
    int max = Operations.DEFAULT_MAX_DETERMINIZED_STATES;
    Automaton minimal = MinimizationOperations.minimize(
        Operations.concatenate(Automata.makeBinary(new BytesRef("foo")), Automata.makeAnyBinary()), max);
    CompiledAutomaton trusted = new CompiledAutomaton(minimal, null, true, max, true, true);
    assertThat(trusted.automaton, is(sameInstance(minimal)));

    CompiledAutomaton checked = new CompiledAutomaton(minimal, null, true, max, true);
    assertThat(checked.automaton, is(not(sameInstance(minimal))));
    assertEquals(checked, trusted);
  }
}
