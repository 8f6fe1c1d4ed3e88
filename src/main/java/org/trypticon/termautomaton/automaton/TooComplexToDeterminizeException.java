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
 * Signals that the subset construction gave up: the automaton being
 * determinized needed more states than the caller's limit. Callers that
 * accept user patterns catch this to reject overly complex input.
 */
public class TooComplexToDeterminizeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient Automaton automaton;
  private final int maxDeterminizedStates;

  public TooComplexToDeterminizeException(Automaton automaton, int maxDeterminizedStates) {
    super(String.format("automaton with %d states and %d transitions needs more than %d states once determinized",
        automaton.getNumStates(), automaton.getNumTransitions(), maxDeterminizedStates));
    this.automaton = automaton;
    this.maxDeterminizedStates = maxDeterminizedStates;
  }

  /** The input of the failed determinization. Not kept across serialization. */
  public Automaton getAutomaton() {
    return automaton;
  }

  /** The state limit that was exceeded. */
  public int getMaxDeterminizedStates() {
    return maxDeterminizedStates;
  }
}
