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
 * {@link RunAutomaton} over Unicode code points.
 */
public class CharacterRunAutomaton extends RunAutomaton {

  public CharacterRunAutomaton(Automaton a) {
    this(a, Operations.DEFAULT_MAX_DETERMINIZED_STATES);
  }

  public CharacterRunAutomaton(Automaton a, int maxDeterminizedStates) {
    super(a, Character.MAX_CODE_POINT + 1, maxDeterminizedStates);
  }

  /** Returns true if the code points of {@code s} are accepted. */
  public boolean run(String s) {
    int state = getInitialState();
    for (int i = 0; i < s.length() && state != -1; ) {
      int cp = s.codePointAt(i);
      state = step(state, cp);
      i += Character.charCount(cp);
    }
    return state != -1 && isAccept(state);
  }

  /** Returns true if the code points of {@code s[offset, offset+length)} are accepted. */
  public boolean run(char[] s, int offset, int length) {
    int state = getInitialState();
    int end = offset + length;
    for (int i = offset; i < end && state != -1; ) {
      int cp = Character.codePointAt(s, i, end);
      state = step(state, cp);
      i += Character.charCount(cp);
    }
    return state != -1 && isAccept(state);
  }
}
