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

/**
 * A pair of states, one from each operand of a product construction.
 * Equality only looks at the two operand states, so a pair built for a
 * lookup finds the memoized one that already carries its result state.
 */
final class StatePair {
  /** State of the product automaton, or -1 until one is assigned. */
  int s;

  final int s1;

  final int s2;

  StatePair(int s, int s1, int s2) {
    this.s = s;
    this.s1 = s1;
    this.s2 = s2;
  }

  StatePair(int s1, int s2) {
    this(-1, s1, s2);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StatePair)) {
      return false;
    }
    StatePair other = (StatePair) obj;
    return s1 == other.s1 && s2 == other.s2;
  }

  @Override
  public int hashCode() {
    return s1 * 31 + s2;
  }

  @Override
  public String toString() {
    return "StatePair(s=" + s + ", s1=" + s1 + ", s2=" + s2 + ")";
  }
}
