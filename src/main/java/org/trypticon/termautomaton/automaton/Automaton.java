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
import java.util.BitSet;

import org.trypticon.termautomaton.util.ArrayUtil;
import org.trypticon.termautomaton.util.InPlaceMergeSorter;

/**
 * Finite-state automaton over int labels: Unicode code points
 * ({@code 0..0x10FFFF}) or, after {@link UTF32ToUTF8}, bytes ({@code 0..255}).
 *
 * <p>States are dense ints and state 0 is the initial state. Every
 * transition carries an inclusive label range and the id of its target
 * state. Transitions are added one source state at a time: the state being
 * filled is "open", and opening another one (or calling
 * {@link #finishState}) closes it for good. Closing sorts the state's
 * transitions by label and merges ranges that touch and lead to the same
 * target. Use {@link Builder} when transitions arrive in arbitrary order.
 *
 * <p>An automaton returned by {@link Automata#makeString(String)} only
 * records its literal until something reads its graph. The first read
 * materializes the states ({@link #expandSingleton()}), so a literal
 * automaton must not be shared between threads before it has been expanded
 * or passed through {@link #cloneExpanded()}.
 */
public class Automaton {

  private int numStates;

  /** Index of each state's first transition, -1 while it has none. */
  private int[] firstTransition;

  /** Number of transitions leaving each state. */
  private int[] outDegree;

  private final BitSet accept;

  private int numTransitions;

  // one entry per transition; a state's transitions are contiguous
  private int[] dests;
  private int[] mins;
  private int[] maxes;

  private int openState = -1;

  private boolean deterministic = true;

  /** Literal accepted by this automaton while its graph has not been built yet. */
  private String literal;

  public Automaton() {
    this(2, 2);
  }

  /** Pre-sizes the storage for the expected number of states and transitions. */
  public Automaton(int numStates, int numTransitions) {
    firstTransition = new int[numStates];
    outDegree = new int[numStates];
    accept = new BitSet(numStates);
    dests = new int[numTransitions];
    mins = new int[numTransitions];
    maxes = new int[numTransitions];
  }

  /** Creates the unexpanded form of {@link Automata#makeString(String)}. */
  Automaton(String literal) {
    this();
    this.literal = literal;
  }

  /** True if this automaton is still the unexpanded form of a literal. */
  public boolean isSingleton() {
    return literal != null;
  }

  /** The literal this automaton accepts, or null once the graph exists. */
  public String getSingleton() {
    return literal;
  }

  /**
   * Builds the chain of states for the literal. Does nothing if this
   * automaton is not in literal form.
   */
  public void expandSingleton() {
    if (literal == null) {
      return;
    }
    String s = literal;
    literal = null;
    int last = createState();
    int i = 0;
    while (i < s.length()) {
      int cp = s.codePointAt(i);
      int next = createState();
      addTransition(last, next, cp);
      last = next;
      i += Character.charCount(cp);
    }
    setAccept(last, true);
    finishState();
  }

  /** Returns an independent deep copy with its graph materialized. Leaves this automaton untouched. */
  public Automaton cloneExpanded() {
    Automaton copy;
    if (literal != null) {
      copy = new Automaton(literal);
      copy.expandSingleton();
    } else {
      copy = new Automaton(Math.max(2, numStates), Math.max(2, numTransitions));
      copy.copy(this);
    }
    return copy;
  }

  public int createState() {
    expandSingleton();
    if (numStates == firstTransition.length) {
      firstTransition = ArrayUtil.grow(firstTransition, numStates + 1);
      outDegree = ArrayUtil.grow(outDegree, numStates + 1);
    }
    firstTransition[numStates] = -1;
    outDegree[numStates] = 0;
    return numStates++;
  }

  public void setAccept(int state, boolean isAccept) {
    expandSingleton();
    checkState("state", state);
    accept.set(state, isAccept);
  }

  public boolean isAccept(int state) {
    expandSingleton();
    return accept.get(state);
  }

  /** Live view of the accept flags; callers must not modify it. */
  BitSet getAcceptStates() {
    expandSingleton();
    return accept;
  }

  /** Returns every state's transitions as separate objects, in label order. */
  public Transition[][] getSortedTransitions() {
    expandSingleton();
    Transition[][] result = new Transition[numStates][];
    for (int s = 0; s < numStates; s++) {
      result[s] = new Transition[outDegree[s]];
      for (int i = 0; i < outDegree[s]; i++) {
        Transition t = new Transition();
        getTransition(s, i, t);
        result[s][i] = t;
      }
    }
    return result;
  }

  public void addTransition(int source, int dest, int label) {
    addTransition(source, dest, label, label);
  }

  /**
   * Adds a transition on the labels {@code [min, max]}. {@code source}
   * becomes the open state; a state that was closed cannot be reopened.
   *
   * @throws IllegalArgumentException on unknown states or an invalid range
   * @throws IllegalStateException if {@code source} was already closed
   */
  public void addTransition(int source, int dest, int min, int max) {
    expandSingleton();
    checkState("source", source);
    checkState("dest", dest);
    if (min < 0 || min > max) {
      throw new IllegalArgumentException("invalid label range " + min + "-" + max);
    }
    if (source != openState) {
      if (firstTransition[source] != -1) {
        throw new IllegalStateException("state " + source + " is already finished");
      }
      if (openState != -1) {
        closeOpenState();
      }
      openState = source;
      firstTransition[source] = numTransitions;
    }
    if (numTransitions == dests.length) {
      dests = ArrayUtil.grow(dests, numTransitions + 1);
      mins = ArrayUtil.grow(mins, numTransitions + 1);
      maxes = ArrayUtil.grow(maxes, numTransitions + 1);
    }
    dests[numTransitions] = dest;
    mins[numTransitions] = min;
    maxes[numTransitions] = max;
    numTransitions++;
    outDegree[source]++;
  }

  private void checkState(String what, int state) {
    if (state < 0 || state >= numStates) {
      throw new IllegalArgumentException(what + "=" + state + " is out of bounds (numStates=" + numStates + ")");
    }
  }

  /**
   * Adds an epsilon transition from {@code source} to {@code dest}: copies
   * the current transitions of {@code dest} onto {@code source} and makes
   * {@code source} accepting if {@code dest} is.
   */
  public void addEpsilon(int source, int dest) {
    expandSingleton();
    int from = firstTransition[dest];
    int count = outDegree[dest];
    for (int i = 0; i < count; i++) {
      addTransition(source, dests[from + i], mins[from + i], maxes[from + i]);
    }
    if (accept.get(dest)) {
      setAccept(source, true);
    }
  }

  /**
   * Appends all states and transitions of {@code other} to this automaton,
   * renumbering them by the current state count. {@code other} must be
   * finished.
   */
  public void copy(Automaton other) {
    expandSingleton();
    other.expandSingleton();
    if (other.openState != -1) {
      throw new IllegalStateException("call finishState() on the automaton being copied first");
    }
    finishState();

    int stateBase = numStates;
    int transitionBase = numTransitions;
    int newNumStates = numStates + other.numStates;
    int newNumTransitions = numTransitions + other.numTransitions;

    firstTransition = ArrayUtil.grow(firstTransition, newNumStates);
    outDegree = ArrayUtil.grow(outDegree, newNumStates);
    for (int s = 0; s < other.numStates; s++) {
      int first = other.firstTransition[s];
      firstTransition[stateBase + s] = first == -1 ? -1 : transitionBase + first;
      outDegree[stateBase + s] = other.outDegree[s];
      if (other.accept.get(s)) {
        accept.set(stateBase + s);
      }
    }

    dests = ArrayUtil.grow(dests, newNumTransitions);
    mins = ArrayUtil.grow(mins, newNumTransitions);
    maxes = ArrayUtil.grow(maxes, newNumTransitions);
    for (int i = 0; i < other.numTransitions; i++) {
      dests[transitionBase + i] = stateBase + other.dests[i];
    }
    System.arraycopy(other.mins, 0, mins, transitionBase, other.numTransitions);
    System.arraycopy(other.maxes, 0, maxes, transitionBase, other.numTransitions);

    numStates = newNumStates;
    numTransitions = newNumTransitions;
    deterministic &= other.deterministic;
  }

  private void closeOpenState() {
    int from = firstTransition[openState];
    int to = from + outDegree[openState];

    sorter.destFirst = true;
    sorter.sort(from, to);

    // merge ranges to the same dest that overlap or touch
    int kept = from;
    for (int i = from + 1; i < to; i++) {
      if (dests[i] == dests[kept] && mins[i] <= maxes[kept] + 1) {
        maxes[kept] = Math.max(maxes[kept], maxes[i]);
      } else {
        kept++;
        dests[kept] = dests[i];
        mins[kept] = mins[i];
        maxes[kept] = maxes[i];
      }
    }
    int merged = kept + 1 - from;
    numTransitions -= outDegree[openState] - merged;
    outDegree[openState] = merged;

    sorter.destFirst = false;
    sorter.sort(from, from + merged);

    for (int i = from + 1; deterministic && i < from + merged; i++) {
      if (mins[i] <= maxes[i - 1]) {
        deterministic = false;
      }
    }
  }

  /**
   * True if no state has two transitions with overlapping ranges. Only
   * exact once every state is finished.
   */
  public boolean isDeterministic() {
    return deterministic;
  }

  /** Closes the open state, if any. */
  public void finishState() {
    expandSingleton();
    if (openState != -1) {
      closeOpenState();
      openState = -1;
    }
  }

  public int getNumStates() {
    expandSingleton();
    return numStates;
  }

  public int getNumTransitions() {
    expandSingleton();
    return numTransitions;
  }

  public int getNumTransitions(int state) {
    expandSingleton();
    assert state >= 0 && state < numStates : "state=" + state;
    return outDegree[state];
  }

  private final TransitionSorter sorter = new TransitionSorter();

  /** Orders a slice of the transition arrays by (dest, min) or by (min, max, dest). */
  private final class TransitionSorter extends InPlaceMergeSorter {
    boolean destFirst;

    @Override
    protected void swap(int i, int j) {
      swapEntries(dests, i, j);
      swapEntries(mins, i, j);
      swapEntries(maxes, i, j);
    }

    @Override
    protected int compare(int i, int j) {
      if (destFirst) {
        int cmp = Integer.compare(dests[i], dests[j]);
        return cmp != 0 ? cmp : Integer.compare(mins[i], mins[j]);
      }
      int cmp = Integer.compare(mins[i], mins[j]);
      if (cmp == 0) {
        cmp = Integer.compare(maxes[i], maxes[j]);
      }
      return cmp != 0 ? cmp : Integer.compare(dests[i], dests[j]);
    }
  }

  private static void swapEntries(int[] array, int i, int j) {
    int tmp = array[i];
    array[i] = array[j];
    array[j] = tmp;
  }

  /**
   * Points {@code t} at the first transition of {@code state}.
   *
   * @return the number of transitions leaving {@code state}
   */
  public int initTransition(int state, Transition t) {
    expandSingleton();
    assert state < numStates : "state=" + state + " numStates=" + numStates;
    t.source = state;
    t.transitionUpto = firstTransition[state];
    return outDegree[state];
  }

  /** Advances {@code t}, set up by {@link #initTransition}, to the next transition. */
  public void getNextTransition(Transition t) {
    int i = t.transitionUpto++;
    assert i < firstTransition[t.source] + outDegree[t.source];
    t.dest = dests[i];
    t.min = mins[i];
    t.max = maxes[i];
  }

  /** Fills {@code t} with the {@code index}-th transition of {@code state}. */
  public void getTransition(int state, int index, Transition t) {
    expandSingleton();
    int i = firstTransition[state] + index;
    t.source = state;
    t.dest = dests[i];
    t.min = mins[i];
    t.max = maxes[i];
  }

  /** Printable labels as themselves, anything else as an escaped 8-digit hex code. */
  static void appendCharString(int c, StringBuilder b) {
    boolean printable = c > ' ' && c < 0x7f && c != '\\' && c != '"';
    if (printable) {
      b.append((char) c);
      return;
    }
    String hex = Integer.toHexString(c);
    b.append("\\\\U");
    for (int pad = 8 - hex.length(); pad > 0; pad--) {
      b.append('0');
    }
    b.append(hex);
  }

  private static void appendLabelRange(int min, int max, StringBuilder b) {
    appendCharString(min, b);
    if (max != min) {
      b.append('-');
      appendCharString(max, b);
    }
  }

  /** Renders the automaton in Graphviz dot format. */
  public String toDot() {
    expandSingleton();
    StringBuilder b = new StringBuilder("digraph Automaton {\n  rankdir = LR\n");
    if (numStates > 0) {
      b.append("  initial [shape=plaintext,label=\"0\"]\n  initial -> 0\n");
    }
    for (int s = 0; s < numStates; s++) {
      String shape = accept.get(s) ? "doublecircle" : "circle";
      b.append("  ").append(s).append(" [shape=").append(shape).append(",label=\"").append(s).append("\"]\n");
      for (int i = firstTransition[s], end = i + outDegree[s]; i < end; i++) {
        b.append("  ").append(s).append(" -> ").append(dests[i]).append(" [label=\"");
        appendLabelRange(mins[i], maxes[i], b);
        b.append("\"]\n");
      }
    }
    return b.append('}').toString();
  }

  @Override
  public String toString() {
    if (literal != null) {
      return "literal: " + literal;
    }
    StringBuilder b = new StringBuilder();
    for (int s = 0; s < numStates; s++) {
      b.append("state ").append(s).append(accept.get(s) ? " [accept]\n" : "\n");
      for (int i = firstTransition[s], end = i + outDegree[s]; i < end; i++) {
        b.append("  -> ").append(dests[i]).append(' ');
        appendLabelRange(mins[i], maxes[i], b);
        b.append('\n');
      }
    }
    return b.toString();
  }

  /**
   * Returns the sorted, distinct label values at which the set of enabled
   * transitions can change: 0, every transition's min, and every max + 1.
   */
  int[] getStartPoints() {
    expandSingleton();
    int[] points = new int[1 + 2 * numTransitions];
    int count = 0;
    points[count++] = 0;
    for (int i = 0; i < numTransitions; i++) {
      points[count++] = mins[i];
      if (maxes[i] < Character.MAX_CODE_POINT) {
        points[count++] = maxes[i] + 1;
      }
    }
    Arrays.sort(points, 0, count);
    int distinct = 0;
    for (int i = 0; i < count; i++) {
      if (distinct == 0 || points[i] != points[distinct - 1]) {
        points[distinct++] = points[i];
      }
    }
    return Arrays.copyOf(points, distinct);
  }

  /**
   * Returns the target of the first transition of {@code state} whose range
   * contains {@code label}, or -1. Meant for deterministic automata.
   */
  public int step(int state, int label) {
    expandSingleton();
    assert state >= 0 && label >= 0;
    for (int i = firstTransition[state], end = i + outDegree[state]; i < end && mins[i] <= label; i++) {
      if (label <= maxes[i]) {
        return dests[i];
      }
    }
    return -1;
  }

  /**
   * Collects transitions in any order and produces a finished
   * {@link Automaton}.
   */
  public static class Builder {
    private int numStates;
    private final BitSet accept = new BitSet();

    private int numTransitions;
    private int[] sources;
    private int[] dests;
    private int[] mins;
    private int[] maxes;

    private boolean finished;

    public Builder() {
      this(16);
    }

    public Builder(int numTransitions) {
      sources = new int[numTransitions];
      dests = new int[numTransitions];
      mins = new int[numTransitions];
      maxes = new int[numTransitions];
    }

    public void addTransition(int source, int dest, int label) {
      addTransition(source, dest, label, label);
    }

    public void addTransition(int source, int dest, int min, int max) {
      if (numTransitions == sources.length) {
        sources = ArrayUtil.grow(sources, numTransitions + 1);
        dests = ArrayUtil.grow(dests, numTransitions + 1);
        mins = ArrayUtil.grow(mins, numTransitions + 1);
        maxes = ArrayUtil.grow(maxes, numTransitions + 1);
      }
      sources[numTransitions] = source;
      dests[numTransitions] = dest;
      mins[numTransitions] = min;
      maxes[numTransitions] = max;
      numTransitions++;
    }

    /** Copies the transitions added so far from {@code dest} onto {@code source}, along with its accept flag. */
    public void addEpsilon(int source, int dest) {
      for (int i = 0, end = numTransitions; i < end; i++) {
        if (sources[i] == dest) {
          addTransition(source, dests[i], mins[i], maxes[i]);
        }
      }
      if (accept.get(dest)) {
        setAccept(source, true);
      }
    }

    /**
     * Builds the automaton: transitions are bucketed by source state and
     * each state is closed in turn. The builder cannot be used afterwards.
     */
    public Automaton finish() {
      if (finished) {
        throw new IllegalStateException("finish() was already called");
      }
      finished = true;

      Automaton a = new Automaton(Math.max(2, numStates), Math.max(2, numTransitions));
      for (int s = 0; s < numStates; s++) {
        a.createState();
      }
      a.accept.or(accept);

      // counting sort of transition indices by source
      int[] bucketStart = new int[numStates + 1];
      for (int i = 0; i < numTransitions; i++) {
        bucketStart[sources[i] + 1]++;
      }
      for (int s = 0; s < numStates; s++) {
        bucketStart[s + 1] += bucketStart[s];
      }
      int[] order = new int[numTransitions];
      int[] fill = Arrays.copyOf(bucketStart, numStates);
      for (int i = 0; i < numTransitions; i++) {
        order[fill[sources[i]]++] = i;
      }

      for (int s = 0; s < numStates; s++) {
        for (int k = bucketStart[s]; k < bucketStart[s + 1]; k++) {
          int i = order[k];
          a.addTransition(s, dests[i], mins[i], maxes[i]);
        }
      }
      a.finishState();
      return a;
    }

    public int createState() {
      return numStates++;
    }

    public void setAccept(int state, boolean isAccept) {
      if (state < 0 || state >= numStates) {
        throw new IllegalArgumentException("state=" + state + " is out of bounds (numStates=" + numStates + ")");
      }
      accept.set(state, isAccept);
    }

    public boolean isAccept(int state) {
      return accept.get(state);
    }

    public int getNumStates() {
      return numStates;
    }

    /** Appends all states and transitions of {@code other}, renumbered by the current state count. */
    public void copy(Automaton other) {
      int base = numStates;
      int otherStates = other.getNumStates();
      for (int s = 0; s < otherStates; s++) {
        setAccept(createState(), other.isAccept(s));
      }
      Transition t = new Transition();
      for (int s = 0; s < otherStates; s++) {
        int count = other.initTransition(s, t);
        while (count-- > 0) {
          other.getNextTransition(t);
          addTransition(base + s, base + t.dest, t.min, t.max);
        }
      }
    }
  }
}
