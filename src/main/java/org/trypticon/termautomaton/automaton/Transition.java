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
 * Cursor over the transitions of an {@link Automaton}. Reusable: set it up
 * with {@link Automaton#initTransition} and advance it with
 * {@link Automaton#getNextTransition}.
 */
public class Transition {

  public int source;

  public int dest;

  /** Minimum accepted label (inclusive). */
  public int min;

  /** Maximum accepted label (inclusive). */
  public int max;

  /** Index of the next transition {@link Automaton#getNextTransition} reads. */
  int transitionUpto = -1;

  public Transition() {
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    b.append(source).append(" --> ").append(dest).append(' ');
    Automaton.appendCharString(min, b);
    if (max != min) {
      b.append('-');
      Automaton.appendCharString(max, b);
    }
    return b.toString();
  }
}
