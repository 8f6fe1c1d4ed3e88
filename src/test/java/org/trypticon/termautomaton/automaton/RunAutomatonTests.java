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

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

import org.junit.Test;
import org.trypticon.termautomaton.util.BytesRef;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class RunAutomatonTests {

  @Test
  public void testCharacterRunMatchesAutomaton() {
    Random random = new Random(7);
    List<String> strings = AutomatonTestUtil.allStrings("abcde", 4);
    for (int iter = 0; iter < 100; iter++) {
      Automaton a = AutomatonTestUtil.randomAutomaton(random, 6);
      Automaton det = Operations.determinize(a, Operations.DEFAULT_MAX_DETERMINIZED_STATES);
      CharacterRunAutomaton run = new CharacterRunAutomaton(a);
      for (String s : strings) {
        boolean expected = Operations.run(det, s);
        assertEquals(s, expected, run.run(s));
        char[] chars = ("x" + s + "y").toCharArray();
        assertEquals(s, expected, run.run(chars, 1, s.length()));
      }
    }
  }

  @Test
  public void testByteRunMatchesCharacterRun() {
    Random random = new Random(11);
    List<String> strings = AutomatonTestUtil.allStrings("abcde", 4);
    for (int iter = 0; iter < 100; iter++) {
      Automaton a = AutomatonTestUtil.randomAutomaton(random, 6);
      CharacterRunAutomaton chars = new CharacterRunAutomaton(a);
      ByteRunAutomaton bytes = new ByteRunAutomaton(a);
      for (String s : strings) {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        assertEquals(s, chars.run(s), bytes.run(utf8, 0, utf8.length));
      }
    }
  }

  @Test
  public void testStep() {
    CharacterRunAutomaton run = new CharacterRunAutomaton(Automata.makeString("ab"));
    int state = run.getInitialState();
    assertFalse(run.isAccept(state));
    state = run.step(state, 'a');
    assertTrue(state >= 0);
    state = run.step(state, 'b');
    assertTrue(run.isAccept(state));
    assertEquals(-1, run.step(state, 'c'));
    assertEquals(-1, run.step(run.getInitialState(), 'b'));
  }

  @Test
  public void testCharIntervals() {
    CharacterRunAutomaton run = new CharacterRunAutomaton(Automata.makeCharRange('b', 'd'));
    assertArrayEquals(new int[] {0, 'b', 'e'}, run.getCharIntervals());
  }

  @Test
  public void testSupplementaryCodePoints() {
    String clef = new String(Character.toChars(0x1D11E));
    CharacterRunAutomaton run = new CharacterRunAutomaton(Automata.makeString("a" + clef));
    assertTrue(run.run("a" + clef));
    assertFalse(run.run("a" + clef.charAt(0)));
    ByteRunAutomaton bytes = new ByteRunAutomaton(Automata.makeString("a" + clef));
    byte[] utf8 = ("a" + clef).getBytes(StandardCharsets.UTF_8);
    assertThat(utf8.length, is(5));
    assertTrue(bytes.run(utf8, 0, utf8.length));
    assertFalse(bytes.run(utf8, 0, 4));
  }

  @Test
  public void testEmptyLanguage() {
    CharacterRunAutomaton run = new CharacterRunAutomaton(Automata.makeEmpty());
    assertEquals(1, run.getSize());
    assertFalse(run.run(""));
    assertFalse(run.run("a"));
  }

  @Test
  public void testBinaryRun() {
    Automaton a = Automata.makeBinary(new BytesRef(new byte[] {(byte) 0xFF, 0}));
    ByteRunAutomaton bytes = new ByteRunAutomaton(a, true, Operations.DEFAULT_MAX_DETERMINIZED_STATES);
    assertTrue(bytes.run(new byte[] {(byte) 0xFF, 0}, 0, 2));
    assertFalse(bytes.run(new byte[] {(byte) 0xFF}, 0, 1));
  }

  @Test
  public void testTooComplexToDeterminize() {
    Automaton nfa = Operations.union(Automata.makeString("ab"), Automata.makeString("ac"));
    assertFalse(nfa.isDeterministic());
    assertThrows(TooComplexToDeterminizeException.class, () -> new CharacterRunAutomaton(nfa, 1));
    assertEquals(4, new CharacterRunAutomaton(nfa).getSize());
  }

  @Test
  public void testEquality() {
    CharacterRunAutomaton run1 = new CharacterRunAutomaton(Automata.makeString("foo"));
    CharacterRunAutomaton run2 = new CharacterRunAutomaton(Automata.makeString("foo"));
    CharacterRunAutomaton run3 = new CharacterRunAutomaton(Automata.makeString("bar"));
    assertEquals(run1, run2);
    assertEquals(run1.hashCode(), run2.hashCode());
    assertNotEquals(run1, run3);
  }
}
