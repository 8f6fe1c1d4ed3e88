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

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

public class StatePairTests {

  @Test
  public void testEqualityIgnoresProductState() {
    StatePair assigned = new StatePair(7, 1, 2);
    StatePair key = new StatePair(1, 2);
    assertThat(key, is(assigned));
    assertThat(key.hashCode(), is(assigned.hashCode()));
    assertThat(key.s, is(-1));
    assertThat(new StatePair(2, 1), is(not(assigned)));
  }

  @Test
  public void testLookupFindsAssignedPair() {
    Map<StatePair, StatePair> pairs = new HashMap<>();
    StatePair assigned = new StatePair(3, 4, 5);
    pairs.put(assigned, assigned);
    assertThat(pairs.get(new StatePair(4, 5)), is(sameInstance(assigned)));
    assertThat(pairs.get(new StatePair(4, 5)).s, is(3));
  }
}
