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

import java.util.BitSet;

import org.trypticon.termautomaton.util.ArrayUtil;
import org.trypticon.termautomaton.util.IntsRef;
import org.trypticon.termautomaton.util.IntsRefBuilder;

/**
 * Iterates the strings accepted by an acyclic automaton, depth first. For a
 * deterministic automaton every string is returned once, in label order
 * (a string before its extensions).
 * <p>
 * The returned {@link IntsRef} is reused by the next call to {@link #next()};
 * copy it to keep it.
 */
public class FiniteStringsIterator {
  private final Automaton a;

  // one frame per state on the current path: the state, the index of the
  // transition being walked and the next label of that transition to emit
  private int[] frameState = new int[16];
  private int[] frameTransition = new int[16];
  private int[] frameLabel = new int[16];
  private int depth;

  private final BitSet onPath;
  private final IntsRefBuilder labels = new IntsRefBuilder();
  private final Transition t = new Transition();

  private boolean emptyStringPending;

  // accept state the last returned string ended in; its extensions come next
  private int resumeState = -1;

  public FiniteStringsIterator(Automaton a) {
    this.a = a;
    int numStates = a.getNumStates();
    onPath = new BitSet(numStates);
    emptyStringPending = numStates > 0 && a.isAccept(0);
    if (numStates > 0 && a.getNumTransitions(0) > 0) {
      push(0);
    }
  }

  /**
   * Returns the next accepted string, or null once all were returned.
   *
   * @throws IllegalArgumentException if the automaton has a cycle
   */
  public IntsRef next() {
    if (emptyStringPending) {
      emptyStringPending = false;
      return new IntsRef();
    }
    if (resumeState != -1) {
      push(resumeState);
      resumeState = -1;
    }

    while (depth > 0) {
      int top = depth - 1;
      int state = frameState[top];
      int numTransitions = a.getNumTransitions(state);
      if (frameTransition[top] == numTransitions) {
        onPath.clear(state);
        depth--;
        labels.setLength(depth);
        continue;
      }
      a.getTransition(state, frameTransition[top], t);
      if (frameLabel[top] > t.max) {
        if (++frameTransition[top] < numTransitions) {
          a.getTransition(state, frameTransition[top], t);
          frameLabel[top] = t.min;
        }
        continue;
      }

      labels.put(top, frameLabel[top]++);
      int to = t.dest;
      if (a.getNumTransitions(to) == 0) {
        if (a.isAccept(to)) {
          return labels.get();
        }
      } else if (onPath.get(to)) {
        throw new IllegalArgumentException("automaton has cycles");
      } else if (a.isAccept(to)) {
        resumeState = to;
        return labels.get();
      } else {
        push(to);
      }
    }
    return null;
  }

  private void push(int state) {
    assert a.getNumTransitions(state) > 0;
    if (depth == frameState.length) {
      frameState = ArrayUtil.grow(frameState, depth + 1);
      frameTransition = ArrayUtil.grow(frameTransition, depth + 1);
      frameLabel = ArrayUtil.grow(frameLabel, depth + 1);
    }
    onPath.set(state);
    a.getTransition(state, 0, t);
    frameState[depth] = state;
    frameTransition[depth] = 0;
    frameLabel[depth] = t.min;
    depth++;
  }
}
