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
import java.util.Random;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.trypticon.termautomaton.automaton.AutomatonTestUtil.accepts;
import static org.trypticon.termautomaton.automaton.AutomatonTestUtil.randomAutomaton;

/**
 * Tests for {@link MinimizationOperations}: Hopcroft against Brzozowski.
 */
public class MinimizationOperationsTests {
  private static final int MAX = Operations.DEFAULT_MAX_DETERMINIZED_STATES;

  @Test
  public void testAgainstBrzozowski() {
    Random random = new Random(20);
    List<String> strings = AutomatonTestUtil.allStrings("abcd", 4);
    for (int iter = 0; iter < 200; iter++) {
      Automaton a = randomAutomaton(random, 8);
      Automaton hopcroft = MinimizationOperations.minimize(a, MAX);
      Automaton brzozowski = MinimizationOperations.minimizeBrzozowski(a, MAX);

      assertThat(hopcroft.isDeterministic(), is(true));
      assertThat(hopcroft.getNumStates(), is(brzozowski.getNumStates()));
      assertThat(hopcroft.getNumTransitions(), is(brzozowski.getNumTransitions()));
      assertThat(Operations.hasDeadStates(hopcroft), is(false));
      assertThat(Operations.sameLanguage(hopcroft, brzozowski), is(true));
      for (String s : strings) {
        assertThat(s, Operations.run(hopcroft, s), is(accepts(a, s)));
      }
    }
  }

  @Test
  public void testIdempotent() {
    Random random = new Random(21);
    for (int iter = 0; iter < 100; iter++) {
      Automaton once = MinimizationOperations.minimize(randomAutomaton(random, 8), MAX);
      Automaton twice = MinimizationOperations.minimize(once, MAX);
      assertThat(twice.getNumStates(), is(once.getNumStates()));
      assertThat(twice.getNumTransitions(), is(once.getNumTransitions()));
    }
  }

  @Test
  public void testEmptyLanguage() {
    assertThat(MinimizationOperations.minimize(Automata.makeEmpty(), MAX).getNumStates(), is(0));
    assertThat(MinimizationOperations.minimizeBrzozowski(Automata.makeEmpty(), MAX).getNumStates(), is(0));

    Automaton noAccept = new Automaton();
    noAccept.createState();
    noAccept.createState();
    noAccept.addTransition(0, 1, 'a');
    noAccept.finishState();
    assertThat(MinimizationOperations.minimize(noAccept, MAX).getNumStates(), is(0));
  }

  @Test
  public void testEmptyString() {
    Automaton min = MinimizationOperations.minimize(Automata.makeEmptyString(), MAX);
    assertThat(min.getNumStates(), is(1));
    assertThat(min.getNumTransitions(), is(0));
    assertThat(min.isAccept(0), is(true));
  }

  @Test
  public void testLiteral() {
    Automaton min = MinimizationOperations.minimize(Automata.makeString("abc"), MAX);
    assertThat(min.getNumStates(), is(4));
    assertThat(min.getNumTransitions(), is(3));
  }

  @Test
  public void testMergesEquivalentSuffixes() {
    Automaton a = Operations.union(Automata.makeString("ab"), Automata.makeString("cb"));
    Automaton min = MinimizationOperations.minimize(a, MAX);
    assertThat(min.getNumStates(), is(3));
    assertThat(min.getNumTransitions(), is(3));
  }

  @Test
  public void testAnyString() {
    Automaton min = MinimizationOperations.minimize(Operations.repeat(Automata.makeAnyChar()), MAX);
    assertThat(min.getNumStates(), is(1));
    assertThat(Operations.isTotal(min), is(true));
  }

  @Test
  public void testEquivalentAutomataMinimizeToSameSize() {
    Random random = new Random(22);
    for (int iter = 0; iter < 100; iter++) {
      Automaton a = randomAutomaton(random, 6);
      // same language, different shape
      Automaton b = Operations.union(Operations.reverse(Operations.reverse(a)), Automata.makeEmpty());
      Automaton minA = MinimizationOperations.minimize(a, MAX);
      Automaton minB = MinimizationOperations.minimize(b, MAX);
      assertThat(minB.getNumStates(), is(minA.getNumStates()));
      assertThat(minB.getNumTransitions(), is(minA.getNumTransitions()));
    }
  }

  @Test
  public void testBrzozowskiAddsNoStartState() {
    Automaton min = MinimizationOperations.minimizeBrzozowski(Automata.makeString("abc"), MAX);
    assertThat(min.getNumStates(), is(4));
    assertThat(min.getNumTransitions(), is(3));

    Automaton suffixes = Operations.union(Automata.makeString("ab"), Automata.makeString("cb"));
    Automaton brzozowski = MinimizationOperations.minimizeBrzozowski(suffixes, MAX);
    assertThat(brzozowski.getNumStates(), is(3));
    assertThat(brzozowski.getNumTransitions(), is(3));
  }
}
