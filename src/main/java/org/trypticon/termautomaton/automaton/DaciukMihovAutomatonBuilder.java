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

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.IdentityHashMap;

import org.trypticon.termautomaton.util.BytesRef;
import org.trypticon.termautomaton.util.BytesRefBuilder;
import org.trypticon.termautomaton.util.IntsRef;
import org.trypticon.termautomaton.util.IntsRefBuilder;

/**
 * Builds the minimal deterministic automaton accepting a sorted list of
 * strings, in one pass and without determinizing or minimizing (Daciuk,
 * Mihov, Watson and Watson, "Incremental construction of minimal acyclic
 * finite-state automata", 2000).
 *
 * <p>The trie is built along the last added string. When the next string
 * leaves that path, the finished suffix is either replaced by an equivalent
 * state from the register or registered itself.
 */
public final class DaciukMihovAutomatonBuilder {

  private static final class State {
    private static final int[] NO_LABELS = new int[0];
    private static final State[] NO_STATES = new State[0];

    /** Sorted transition labels. */
    int[] labels = NO_LABELS;

    /** Targets, parallel to {@link #labels}. */
    State[] targets = NO_STATES;

    boolean accepting;

    // Registered states are compared by the identity of their targets,
    // which are registered before them (post order).
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof State)) {
        return false;
      }
      final State other = (State) obj;
      if (accepting != other.accepting || !Arrays.equals(labels, other.labels) || targets.length != other.targets.length) {
        return false;
      }
      for (int i = 0; i < targets.length; i++) {
        if (targets[i] != other.targets[i]) {
          return false;
        }
      }
      return true;
    }

    @Override
    public int hashCode() {
      int hash = accepting ? 1 : 0;
      hash = hash * 31 + Arrays.hashCode(labels);
      for (State s : targets) {
        hash = hash * 31 + System.identityHashCode(s);
      }
      return hash;
    }

    boolean hasChildren() {
      return labels.length > 0;
    }

    State newState(int label) {
      assert labels.length == 0 || labels[labels.length - 1] < label : "labels out of order at " + label;
      labels = Arrays.copyOf(labels, labels.length + 1);
      targets = Arrays.copyOf(targets, targets.length + 1);
      labels[labels.length - 1] = label;
      return targets[targets.length - 1] = new State();
    }

    State lastChild() {
      assert hasChildren() : "No outgoing transitions.";
      return targets[targets.length - 1];
    }

    /** The last child if it is reached by {@code label}, otherwise null. */
    State lastChild(int label) {
      final int index = labels.length - 1;
      if (index >= 0 && labels[index] == label) {
        return targets[index];
      }
      return null;
    }

    void replaceLastChild(State state) {
      assert hasChildren() : "No outgoing transitions.";
      targets[targets.length - 1] = state;
    }
  }

  private HashMap<State, State> register = new HashMap<>();

  private final State root = new State();

  private final BytesRefBuilder previous = new BytesRefBuilder();
  private boolean hasPrevious;

  private DaciukMihovAutomatonBuilder() {
  }

  /**
   * Adds the next string. {@code term} is the original term, used to check
   * the order; {@code labels} are its code points or bytes.
   */
  private void add(BytesRef term, IntsRef labels) {
    if (register == null) {
      throw new IllegalStateException("Automaton already built.");
    }
    if (hasPrevious) {
      int cmp = previous.get().compareTo(term);
      if (cmp > 0) {
        throw new IllegalArgumentException("Input must be sorted: " + previous.get().utf8ToString() + " > " + term.utf8ToString());
      }
      if (cmp == 0) {
        return;
      }
    }
    previous.copyBytes(term);
    hasPrevious = true;

    // Descend along the common prefix with the previous string
    int pos = 0;
    State next;
    State state = root;
    while (pos < labels.length && (next = state.lastChild(labels.ints[labels.offset + pos])) != null) {
      state = next;
      pos++;
    }

    if (state.hasChildren()) {
      replaceOrRegister(state);
    }

    addSuffix(state, labels, pos);
  }

  private State complete() {
    if (register == null) {
      throw new IllegalStateException("Automaton already built.");
    }
    if (root.hasChildren()) {
      replaceOrRegister(root);
    }
    register = null;
    return root;
  }

  private static int convert(Automaton.Builder a, State s, IdentityHashMap<State, Integer> visited) {
    Integer converted = visited.get(s);
    if (converted != null) {
      return converted;
    }

    converted = a.createState();
    a.setAccept(converted, s.accepting);
    visited.put(s, converted);

    for (int i = 0; i < s.labels.length; i++) {
      a.addTransition(converted, convert(a, s.targets[i], visited), s.labels[i]);
    }
    return converted;
  }

  /**
   * Builds the minimal automaton over code points accepting the given UTF-8
   * encoded strings, which must be sorted. Duplicates are ignored.
   *
   * @throws IllegalArgumentException if the input is not sorted
   */
  public static Automaton build(Collection<BytesRef> input) {
    return build(input, false);
  }

  /**
   * Builds the minimal automaton over bytes accepting the given strings,
   * which must be sorted. Duplicates are ignored.
   *
   * @throws IllegalArgumentException if the input is not sorted
   */
  public static Automaton buildBinary(Collection<BytesRef> input) {
    return build(input, true);
  }

  private static Automaton build(Collection<BytesRef> input, boolean binary) {
    final DaciukMihovAutomatonBuilder builder = new DaciukMihovAutomatonBuilder();

    IntsRefBuilder labels = new IntsRefBuilder();
    for (BytesRef b : input) {
      if (binary) {
        labels.clear();
        for (int i = 0; i < b.length; i++) {
          labels.append(b.bytes[b.offset + i] & 0xff);
        }
      } else {
        labels.copyUTF8Bytes(b);
      }
      builder.add(b, labels.get());
    }

    Automaton.Builder a = new Automaton.Builder();
    convert(a, builder.complete(), new IdentityHashMap<>());
    return a.finish();
  }

  private void replaceOrRegister(State state) {
    final State child = state.lastChild();

    if (child.hasChildren()) {
      replaceOrRegister(child);
    }

    final State registered = register.get(child);
    if (registered != null) {
      state.replaceLastChild(registered);
    } else {
      register.put(child, child);
    }
  }

  private static void addSuffix(State state, IntsRef labels, int fromIndex) {
    for (int i = fromIndex; i < labels.length; i++) {
      state = state.newState(labels.ints[labels.offset + i]);
    }
    state.accepting = true;
  }
}
