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
 * {@link RunAutomaton} over bytes.
 */
public class ByteRunAutomaton extends RunAutomaton {

  /** Converts {@code a} from code points to UTF-8 first. */
  public ByteRunAutomaton(Automaton a) {
    this(a, false, Operations.DEFAULT_MAX_DETERMINIZED_STATES);
  }

  /**
   * @param isBinary true if {@code a} already has byte labels, false to
   *     convert it from code points to UTF-8
   */
  public ByteRunAutomaton(Automaton a, boolean isBinary, int maxDeterminizedStates) {
    super(isBinary ? a : new UTF32ToUTF8().convert(a), 256, maxDeterminizedStates);
  }

  /** Returns true if the bytes {@code s[offset, offset+length)} are accepted. */
  public boolean run(byte[] s, int offset, int length) {
    int state = getInitialState();
    for (int i = offset, end = offset + length; i < end && state != -1; i++) {
      state = step(state, s[i] & 0xFF);
    }
    return state != -1 && isAccept(state);
  }
}
