/*
 * dk.brics.automaton
 * 
 * Copyright (c) 2001-2009 Anders Moeller
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions
 * are met:
 * 1. Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 * 3. The name of the author may not be used to endorse or promote products
 *    derived from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE AUTHOR ``AS IS'' AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES
 * OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED.
 * IN NO EVENT SHALL THE AUTHOR BE LIABLE FOR ANY DIRECT, INDIRECT,
 * INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT
 * NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF
 * THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package org.trypticon.termautomaton.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.trypticon.termautomaton.util.ArrayUtil;
import org.trypticon.termautomaton.util.BytesRef;
import org.trypticon.termautomaton.util.BytesRefBuilder;
import org.trypticon.termautomaton.util.IntsRef;
import org.trypticon.termautomaton.util.IntsRefBuilder;
import org.trypticon.termautomaton.util.UnicodeUtil;

/**
 * Automata operations. Every operation returns a new automaton and leaves
 * its arguments unchanged, apart from materializing the graph of literal
 * automata built by {@link Automata#makeString(String)}. The exception is
 * {@link #determinize}, which hands back deterministic input as is.
 */
public final class Operations {
  /** Default limit on the number of states determinization may create. */
  public static final int DEFAULT_MAX_DETERMINIZED_STATES = 10000;

  /** Depth limit of the recursive graph walks ({@link #isFinite}, {@link #topoSortStates}). */
  public static final int MAX_RECURSION_LEVEL = 1000;

  private Operations() {}

  /**
   * Returns an automaton accepting the concatenation of the languages of
   * {@code a1} and {@code a2}.
   */
  public static Automaton concatenate(Automaton a1, Automaton a2) {
    return concatenate(Arrays.asList(a1, a2));
  }

  /**
   * Returns an automaton accepting the concatenation of the languages of
   * the given automata, in order. An empty list yields the empty string.
   * Literals stay literals; a literal followed by a deterministic automaton
   * gives a deterministic result.
   */
  public static Automaton concatenate(List<Automaton> l) {
    StringBuilder joined = new StringBuilder();
    for (Automaton a : l) {
      if (!a.isSingleton()) {
        joined = null;
        break;
      }
      joined.append(a.getSingleton());
    }
    if (joined != null) {
      return Automata.makeString(joined.toString());
    }

    List<Automaton> operands = new ArrayList<>(l.size());
    for (Automaton a : l) {
      if (isEmpty(a)) {
        return Automata.makeEmpty();
      }
      if (!isEmptyString(a)) {
        operands.add(a);
      }
    }
    switch (operands.size()) {
      case 0:
        return Automata.makeEmptyString();
      case 1:
        return copyOf(operands.get(0));
      default:
        break;
    }

    Automaton head = operands.get(0);
    if (head.isSingleton()) {
      List<Automaton> rest = operands.subList(1, operands.size());
      Automaton tail = rest.size() == 1 ? rest.get(0) : concatenate(rest);
      if (tail.isDeterministic()) {
        return prependLiteral(head.getSingleton(), tail);
      }
    }
    return chain(operands);
  }

  /** Returns a fresh automaton with the language of {@code a}. */
  private static Automaton copyOf(Automaton a) {
    return a.isSingleton() ? Automata.makeString(a.getSingleton()) : a.cloneExpanded();
  }

  /** A chain of states spelling {@code literal} whose last state is the initial state of a copy of {@code tail}. */
  private static Automaton prependLiteral(String literal, Automaton tail) {
    int[] labels = literal.codePoints().toArray();
    Automaton result = new Automaton(labels.length + tail.getNumStates(), labels.length + tail.getNumTransitions());
    for (int i = 0; i < labels.length; i++) {
      result.createState();
    }
    result.copy(tail);
    for (int i = 0; i < labels.length; i++) {
      result.addTransition(i, i + 1, labels[i]);
    }
    result.finishState();
    return result;
  }

  /**
   * General concatenation: operands are copied side by side and, working
   * back from the last one, every accept state of an operand takes over the
   * initial transitions (and acceptance) of the next operand's initial state.
   */
  private static Automaton chain(List<Automaton> operands) {
    Automaton.Builder builder = new Automaton.Builder();
    int[] base = new int[operands.size()];
    for (int i = 0; i < operands.size(); i++) {
      base[i] = builder.getNumStates();
      builder.copy(operands.get(i));
    }
    for (int i = operands.size() - 2; i >= 0; i--) {
      BitSet accepting = operands.get(i).getAcceptStates();
      for (int s = accepting.nextSetBit(0); s >= 0; s = accepting.nextSetBit(s + 1)) {
        builder.setAccept(base[i] + s, false);
        builder.addEpsilon(base[i] + s, base[i + 1]);
      }
    }
    return builder.finish();
  }

  /** Returns an automaton accepting the language of {@code a} plus the empty string. */
  public static Automaton optional(Automaton a) {
    Automaton.Builder builder = new Automaton.Builder();
    int start = builder.createState();
    builder.setAccept(start, true);
    if (a.getNumStates() > 0) {
      int base = builder.getNumStates();
      builder.copy(a);
      builder.addEpsilon(start, base);
    }
    return builder.finish();
  }

  /** Kleene star: zero or more repetitions of the language of {@code a}. */
  public static Automaton repeat(Automaton a) {
    if (a.getNumStates() == 0) {
      return Automata.makeEmptyString();
    }
    Automaton.Builder builder = new Automaton.Builder();
    int start = builder.createState();
    builder.setAccept(start, true);
    int base = builder.getNumStates();
    builder.copy(a);
    builder.addEpsilon(start, base);
    // every accept state may start another round
    BitSet accepting = a.getAcceptStates();
    for (int s = accepting.nextSetBit(0); s >= 0; s = accepting.nextSetBit(s + 1)) {
      builder.addEpsilon(base + s, base);
    }
    return builder.finish();
  }

  /** At least {@code min} repetitions of the language of {@code a}. */
  public static Automaton repeat(Automaton a, int min) {
    checkMin(min);
    if (min == 0) {
      return repeat(a);
    }
    List<Automaton> parts = new ArrayList<>(Collections.nCopies(min, a));
    parts.add(repeat(a));
    return concatenate(parts);
  }

  /**
   * Between {@code min} and {@code max} (inclusive) repetitions of the
   * language of {@code a}. Empty if {@code min > max}.
   */
  public static Automaton repeat(Automaton a, int min, int max) {
    checkMin(min);
    if (min > max) {
      return Automata.makeEmpty();
    }
    Automaton required = concatenate(Collections.nCopies(min, a));
    // a{0,k} nests as (a(a(...)?)?)?
    Automaton optionalPart = null;
    for (int i = min; i < max; i++) {
      optionalPart = optional(optionalPart == null ? a : concatenate(a, optionalPart));
    }
    return optionalPart == null ? required : concatenate(required, optionalPart);
  }

  private static void checkMin(int min) {
    if (min < 0) {
      throw new IllegalArgumentException("min must be >= 0, got " + min);
    }
  }

  /**
   * Returns an automaton accepting every string {@code a} rejects.
   * Nondeterministic input is determinized first.
   *
   * @throws TooComplexToDeterminizeException if determinizing {@code a}
   *     needs more than {@code maxDeterminizedStates} states
   */
  public static Automaton complement(Automaton a, int maxDeterminizedStates) {
    Automaton total = totalize(determinize(a, maxDeterminizedStates));
    for (int s = 0; s < total.getNumStates(); s++) {
      total.setAccept(s, !total.isAccept(s));
    }
    return removeDeadStates(total);
  }

  /** Returns an automaton accepting the strings {@code a1} accepts and {@code a2} rejects. */
  public static Automaton minus(Automaton a1, Automaton a2, int maxDeterminizedStates) {
    if (a1 == a2 || isEmpty(a1)) {
      return Automata.makeEmpty();
    }
    if (isEmpty(a2)) {
      return copyOf(a1);
    }
    return intersection(a1, complement(a2, maxDeterminizedStates));
  }

  /**
   * Product construction over the reachable state pairs. Accepts NFAs; the
   * result is deterministic when both arguments are.
   */
  public static Automaton intersection(Automaton a1, Automaton a2) {
    if (a1 == a2) {
      return copyOf(a1);
    }
    if (a1.isSingleton() && a2.isDeterministic()) {
      return literalIfAccepted(a2, a1.getSingleton());
    }
    if (a2.isSingleton() && a1.isDeterministic()) {
      return literalIfAccepted(a1, a2.getSingleton());
    }
    if (a1.getNumStates() == 0 || a2.getNumStates() == 0) {
      return Automata.makeEmpty();
    }

    Transition[][] out1 = a1.getSortedTransitions();
    Transition[][] out2 = a2.getSortedTransitions();
    Automaton product = new Automaton();
    Map<StatePair, StatePair> pairs = new HashMap<>();
    ArrayDeque<StatePair> pending = new ArrayDeque<>();
    StatePair initial = new StatePair(product.createState(), 0, 0);
    pairs.put(initial, initial);
    pending.add(initial);

    while (!pending.isEmpty()) {
      StatePair p = pending.removeFirst();
      product.setAccept(p.s, a1.isAccept(p.s1) && a2.isAccept(p.s2));
      Transition[] ts2 = out2[p.s2];
      int lowest = 0;
      for (Transition t1 : out1[p.s1]) {
        // ts2 is sorted by min; skip the ranges that end before t1 starts
        while (lowest < ts2.length && ts2[lowest].max < t1.min) {
          lowest++;
        }
        for (int i = lowest; i < ts2.length && ts2[i].min <= t1.max; i++) {
          Transition t2 = ts2[i];
          if (t2.max < t1.min) {
            continue;
          }
          StatePair key = new StatePair(t1.dest, t2.dest);
          StatePair target = pairs.get(key);
          if (target == null) {
            key.s = product.createState();
            pairs.put(key, key);
            pending.add(key);
            target = key;
          }
          product.addTransition(p.s, target.s, Math.max(t1.min, t2.min), Math.min(t1.max, t2.max));
        }
      }
    }
    product.finishState();
    return removeDeadStates(product);
  }

  private static Automaton literalIfAccepted(Automaton a, String literal) {
    return run(a, literal) ? Automata.makeString(literal) : Automata.makeEmpty();
  }

  /**
   * True if both deterministic automata accept the same language.
   *
   * @throws IllegalArgumentException if either automaton is not deterministic
   */
  public static boolean sameLanguage(Automaton a1, Automaton a2) {
    return a1 == a2 || (subsetOf(a1, a2) && subsetOf(a2, a1));
  }

  /** True if some state is unreachable from the initial state or cannot reach an accept state. */
  public static boolean hasDeadStates(Automaton a) {
    BitSet live = reachableFromInitial(a);
    live.and(reachingAccept(a));
    return live.cardinality() < a.getNumStates();
  }

  /** True if some state reachable from the initial state cannot reach an accept state. */
  public static boolean hasDeadStatesFromInitial(Automaton a) {
    BitSet stuck = reachableFromInitial(a);
    stuck.andNot(reachingAccept(a));
    return !stuck.isEmpty();
  }

  /** True if some state that reaches an accept state is unreachable from the initial state. */
  public static boolean hasDeadStatesToAccept(Automaton a) {
    BitSet orphans = reachingAccept(a);
    orphans.andNot(reachableFromInitial(a));
    return !orphans.isEmpty();
  }

  /**
   * True if the language of {@code a1} is a subset of the language of
   * {@code a2}. States of {@code a1} that cannot reach an accept state are
   * ignored.
   *
   * @throws IllegalArgumentException if either automaton is not deterministic
   */
  public static boolean subsetOf(Automaton a1, Automaton a2) {
    if (!a1.isDeterministic()) {
      throw new IllegalArgumentException("a1 must be deterministic");
    }
    if (!a2.isDeterministic()) {
      throw new IllegalArgumentException("a2 must be deterministic");
    }
    if (hasDeadStatesFromInitial(a1)) {
      a1 = removeDeadStates(a1);
    }
    if (a1.getNumStates() == 0) {
      // the empty language is a subset of every language
      return true;
    }
    if (a2.getNumStates() == 0) {
      return false;
    }

    Transition[][] out1 = a1.getSortedTransitions();
    Transition[][] out2 = a2.getSortedTransitions();
    ArrayDeque<StatePair> pending = new ArrayDeque<>();
    java.util.Set<StatePair> seen = new java.util.HashSet<>();
    StatePair initial = new StatePair(0, 0);
    pending.add(initial);
    seen.add(initial);
    while (!pending.isEmpty()) {
      StatePair p = pending.removeFirst();
      if (a1.isAccept(p.s1) && !a2.isAccept(p.s2)) {
        return false;
      }
      for (Transition t1 : out1[p.s1]) {
        // a2's ranges must cover t1 without gaps; next is the first label not yet covered
        int next = t1.min;
        boolean covered = false;
        for (Transition t2 : out2[p.s2]) {
          if (t2.max < next) {
            continue;
          }
          if (t2.min > next) {
            break;
          }
          StatePair pair = new StatePair(t1.dest, t2.dest);
          if (seen.add(pair)) {
            pending.add(pair);
          }
          if (t2.max >= t1.max) {
            covered = true;
            break;
          }
          next = t2.max + 1;
        }
        if (!covered) {
          return false;
        }
      }
    }
    return true;
  }

  /** Returns an automaton accepting the union of the languages of {@code a1} and {@code a2}. */
  public static Automaton union(Automaton a1, Automaton a2) {
    return union(Arrays.asList(a1, a2));
  }

  /**
   * Returns an automaton accepting the union of the languages. A new initial
   * state receives copies of every operand's initial transitions; the result
   * is usually nondeterministic.
   */
  public static Automaton union(Collection<Automaton> l) {
    Automaton.Builder builder = new Automaton.Builder();
    int start = builder.createState();
    for (Automaton a : l) {
      if (a.getNumStates() == 0) {
        continue;
      }
      int base = builder.getNumStates();
      builder.copy(a);
      builder.addEpsilon(start, base);
    }
    return removeDeadStates(builder.finish());
  }

  /**
   * Subset construction. Returns {@code a} itself if it is already
   * deterministic.
   *
   * @throws TooComplexToDeterminizeException if the result would have more
   *     than {@code maxDeterminizedStates} states
   */
  public static Automaton determinize(Automaton a, int maxDeterminizedStates) {
    if (a.isDeterministic()) {
      return a;
    }
    return determinize(a, new int[] {0}, maxDeterminizedStates);
  }

  /**
   * Subset construction starting from the set {@code startStates} (sorted,
   * distinct), run even when {@code a} is deterministic. Only reachable
   * subsets become states and the empty subset never does, so the result has
   * no transitions into a dead state.
   *
   * <p>Per subset, every member transition contributes two events, "starts
   * at min" and "ends at max + 1". Sweeping the sorted events keeps the
   * current target subset in a {@link StateSet}; each stretch between two
   * event points becomes one transition.
   */
  static Automaton determinize(Automaton a, int[] startStates, int maxDeterminizedStates) {
    Automaton.Builder builder = new Automaton.Builder();
    Map<IntSet, Integer> subsets = new HashMap<>();
    ArrayDeque<FrozenIntSet> pending = new ArrayDeque<>();

    FrozenIntSet start = new FrozenIntSet(startStates, builder.createState());
    boolean startAccepts = false;
    for (int s : startStates) {
      startAccepts |= a.isAccept(s);
    }
    builder.setAccept(start.state, startAccepts);
    subsets.put(start, start.state);
    pending.add(start);

    StateSet targets = new StateSet();
    Transition t = new Transition();
    long[] events = new long[8];

    while (!pending.isEmpty()) {
      FrozenIntSet subset = pending.removeFirst();

      int numEvents = 0;
      for (int s : subset.values) {
        int count = a.initTransition(s, t);
        events = ArrayUtil.grow(events, numEvents + 2 * count);
        while (count-- > 0) {
          a.getNextTransition(t);
          events[numEvents++] = event(t.min, t.dest, true);
          events[numEvents++] = event(t.max + 1L, t.dest, false);
        }
      }
      Arrays.sort(events, 0, numEvents);

      int acceptingTargets = 0;
      long from = -1;
      int i = 0;
      while (i < numEvents) {
        long point = events[i] >>> 32;
        if (targets.size() > 0) {
          Integer target = subsets.get(targets);
          if (target == null) {
            target = builder.createState();
            if (target >= maxDeterminizedStates) {
              throw new TooComplexToDeterminizeException(a, maxDeterminizedStates);
            }
            FrozenIntSet frozen = targets.freeze(target);
            subsets.put(frozen, target);
            pending.add(frozen);
            builder.setAccept(target, acceptingTargets > 0);
          }
          builder.addTransition(subset.state, target, (int) from, (int) (point - 1));
        }
        for (; i < numEvents && (events[i] >>> 32) == point; i++) {
          int dest = (int) ((events[i] & 0xFFFFFFFFL) >>> 1);
          int delta = a.isAccept(dest) ? 1 : 0;
          if ((events[i] & 1) != 0) {
            targets.incr(dest);
            acceptingTargets += delta;
          } else {
            targets.decr(dest);
            acceptingTargets -= delta;
          }
        }
        from = point;
      }
      assert targets.size() == 0 : "unbalanced events: " + targets;
    }

    Automaton result = builder.finish();
    assert result.isDeterministic();
    return result;
  }

  // point in the high half, then dest, then 1 for a range start; sorts by point
  private static long event(long point, int dest, boolean isStart) {
    return (point << 32) | ((long) dest << 1) | (isStart ? 1 : 0);
  }

  /** True if no accept state is reachable from the initial state. */
  public static boolean isEmpty(Automaton a) {
    if (a.isSingleton()) {
      return false;
    }
    if (a.getNumStates() == 0) {
      return true;
    }
    return !reachableFromInitial(a).intersects(a.getAcceptStates());
  }

  /** True if the empty string is the only string {@code a} accepts. */
  public static boolean isEmptyString(Automaton a) {
    if (a.isSingleton()) {
      return a.getSingleton().isEmpty();
    }
    if (a.getNumStates() == 0 || !a.isAccept(0)) {
      return false;
    }
    // any transition left after trimming leads to a longer accepted string
    return a.getNumTransitions(0) == 0 || removeDeadStates(a).getNumTransitions(0) == 0;
  }

  /** True if {@code a} is the single-state automaton accepting every code point string. */
  public static boolean isTotal(Automaton a) {
    return isTotal(a, Character.MIN_CODE_POINT, Character.MAX_CODE_POINT);
  }

  /**
   * True if {@code a} is a single accepting state looping on the whole
   * alphabet {@code [minAlphabet, maxAlphabet]}. Exact for minimal automata.
   */
  public static boolean isTotal(Automaton a, int minAlphabet, int maxAlphabet) {
    if (a.isSingleton() || a.getNumStates() == 0 || !a.isAccept(0) || a.getNumTransitions(0) != 1) {
      return false;
    }
    Transition loop = new Transition();
    a.getTransition(0, 0, loop);
    return loop.dest == 0 && loop.min == minAlphabet && loop.max == maxAlphabet;
  }

  /**
   * Runs a deterministic automaton over the code points of {@code s}.
   *
   * @throws IllegalArgumentException if {@code a} is not deterministic
   */
  public static boolean run(Automaton a, String s) {
    if (a.isSingleton()) {
      return a.getSingleton().equals(s);
    }
    checkDeterministic(a);
    int state = a.getNumStates() == 0 ? -1 : 0;
    for (int i = 0; i < s.length() && state != -1; ) {
      int cp = s.codePointAt(i);
      state = a.step(state, cp);
      i += Character.charCount(cp);
    }
    return state != -1 && a.isAccept(state);
  }

  /**
   * Runs a deterministic automaton over the labels in {@code s}.
   *
   * @throws IllegalArgumentException if {@code a} is not deterministic
   */
  public static boolean run(Automaton a, IntsRef s) {
    checkDeterministic(a);
    int state = a.getNumStates() == 0 ? -1 : 0;
    for (int i = 0; i < s.length && state != -1; i++) {
      state = a.step(state, s.ints[s.offset + i]);
    }
    return state != -1 && a.isAccept(state);
  }

  private static void checkDeterministic(Automaton a) {
    if (!a.isDeterministic()) {
      throw new IllegalArgumentException("input automaton must be deterministic");
    }
  }

  private static BitSet reachableFromInitial(Automaton a) {
    BitSet reached = new BitSet(a.getNumStates());
    if (a.getNumStates() == 0) {
      return reached;
    }
    ArrayDeque<Integer> pending = new ArrayDeque<>();
    reached.set(0);
    pending.add(0);
    Transition t = new Transition();
    while (!pending.isEmpty()) {
      int count = a.initTransition(pending.removeFirst(), t);
      while (count-- > 0) {
        a.getNextTransition(t);
        if (!reached.get(t.dest)) {
          reached.set(t.dest);
          pending.add(t.dest);
        }
      }
    }
    return reached;
  }

  /** States from which some accept state can be reached, found by walking the edges backwards. */
  private static BitSet reachingAccept(Automaton a) {
    int numStates = a.getNumStates();

    // predecessor lists in compressed form: preds[predStart[s] .. predStart[s + 1])
    int[] predStart = new int[numStates + 1];
    Transition t = new Transition();
    for (int s = 0; s < numStates; s++) {
      int count = a.initTransition(s, t);
      while (count-- > 0) {
        a.getNextTransition(t);
        predStart[t.dest + 1]++;
      }
    }
    for (int s = 0; s < numStates; s++) {
      predStart[s + 1] += predStart[s];
    }
    int[] preds = new int[predStart[numStates]];
    int[] fill = Arrays.copyOf(predStart, numStates);
    for (int s = 0; s < numStates; s++) {
      int count = a.initTransition(s, t);
      while (count-- > 0) {
        a.getNextTransition(t);
        preds[fill[t.dest]++] = s;
      }
    }

    BitSet reaching = new BitSet(numStates);
    reaching.or(a.getAcceptStates());
    ArrayDeque<Integer> pending = new ArrayDeque<>();
    for (int s = reaching.nextSetBit(0); s >= 0; s = reaching.nextSetBit(s + 1)) {
      pending.add(s);
    }
    while (!pending.isEmpty()) {
      int s = pending.removeFirst();
      for (int i = predStart[s]; i < predStart[s + 1]; i++) {
        if (!reaching.get(preds[i])) {
          reaching.set(preds[i]);
          pending.add(preds[i]);
        }
      }
    }
    return reaching;
  }

  /**
   * Removes states that are unreachable from the initial state or cannot
   * reach an accept state. An automaton with an empty language comes back
   * with zero states.
   */
  public static Automaton removeDeadStates(Automaton a) {
    int numStates = a.getNumStates();
    BitSet live = reachableFromInitial(a);
    live.and(reachingAccept(a));

    Automaton result = new Automaton();
    int[] renumbered = new int[numStates];
    for (int s = live.nextSetBit(0); s >= 0; s = live.nextSetBit(s + 1)) {
      renumbered[s] = result.createState();
      result.setAccept(renumbered[s], a.isAccept(s));
    }
    Transition t = new Transition();
    for (int s = live.nextSetBit(0); s >= 0; s = live.nextSetBit(s + 1)) {
      int count = a.initTransition(s, t);
      while (count-- > 0) {
        a.getNextTransition(t);
        if (live.get(t.dest)) {
          result.addTransition(renumbered[s], renumbered[t.dest], t.min, t.max);
        }
      }
    }
    result.finishState();
    assert !hasDeadStates(result);
    return result;
  }

  /**
   * True if the language is finite, i.e. no cycle is reachable from the
   * initial state.
   *
   * @throws IllegalArgumentException if a path is longer than {@link #MAX_RECURSION_LEVEL}
   */
  public static boolean isFinite(Automaton a) {
    if (a.isSingleton() || a.getNumStates() == 0) {
      return true;
    }
    return !hasCycleFrom(a, 0, new byte[a.getNumStates()], 0);
  }

  private static final byte ON_PATH = 1;
  private static final byte DONE = 2;

  private static boolean hasCycleFrom(Automaton a, int state, byte[] marks, int depth) {
    if (depth > MAX_RECURSION_LEVEL) {
      throw new IllegalArgumentException("input automaton is too large: " + depth);
    }
    marks[state] = ON_PATH;
    Transition t = new Transition();
    int count = a.initTransition(state, t);
    while (count-- > 0) {
      a.getNextTransition(t);
      if (marks[t.dest] == ON_PATH || (marks[t.dest] == 0 && hasCycleFrom(a, t.dest, marks, depth + 1))) {
        return true;
      }
    }
    marks[state] = DONE;
    return false;
  }

  /**
   * Returns the longest string that is a prefix of every accepted string.
   *
   * @throws IllegalArgumentException if {@code a} is not deterministic
   */
  public static String getCommonPrefix(Automaton a) {
    if (a.isSingleton()) {
      return a.getSingleton();
    }
    IntsRef labels = forcedLabels(a, false);
    return UnicodeUtil.newString(labels.ints, labels.offset, labels.length);
  }

  /**
   * Byte variant of {@link #getCommonPrefix} for automata over bytes.
   *
   * @throws IllegalArgumentException if {@code a} is not deterministic
   */
  public static BytesRef getCommonPrefixBytesRef(Automaton a) {
    IntsRef labels = forcedLabels(a, false);
    BytesRefBuilder prefix = new BytesRefBuilder();
    for (int i = 0; i < labels.length; i++) {
      prefix.append((byte) labels.ints[labels.offset + i]);
    }
    return prefix.get();
  }

  /**
   * Returns the only string a deterministic automaton accepts, or null if it
   * accepts none or more than one.
   *
   * @throws IllegalArgumentException if {@code a} is not deterministic
   */
  public static IntsRef getSingleton(Automaton a) {
    if (a.isSingleton()) {
      IntsRefBuilder labels = new IntsRefBuilder();
      UnicodeUtil.UTF16toUTF32(a.getSingleton(), labels);
      return labels.get();
    }
    return forcedLabels(a, true);
  }

  /**
   * Follows the path from the initial state while it is forced: the state
   * does not accept and has exactly one single-label transition to a state
   * not seen yet. Returns the labels of that path. With {@code wholeString},
   * returns null unless the path ends in an accept state without transitions.
   */
  private static IntsRef forcedLabels(Automaton a, boolean wholeString) {
    checkDeterministic(a);
    IntsRefBuilder labels = new IntsRefBuilder();
    if (a.getNumStates() == 0) {
      return wholeString ? null : labels.get();
    }
    BitSet seen = new BitSet(a.getNumStates());
    Transition t = new Transition();
    int s = 0;
    while (true) {
      seen.set(s);
      if (a.isAccept(s) || a.getNumTransitions(s) != 1) {
        break;
      }
      a.getTransition(s, 0, t);
      if (t.min != t.max || seen.get(t.dest)) {
        break;
      }
      labels.append(t.min);
      s = t.dest;
    }
    if (wholeString && !(a.isAccept(s) && a.getNumTransitions(s) == 0)) {
      return null;
    }
    return labels.get();
  }

  /** Returns the longest byte string that is a suffix of every accepted string of a byte automaton. */
  public static BytesRef getCommonSuffixBytesRef(Automaton a, int maxDeterminizedStates) {
    BytesRef prefix = getCommonPrefixBytesRef(determinize(reverse(a), maxDeterminizedStates));
    byte[] suffix = new byte[prefix.length];
    for (int i = 0; i < prefix.length; i++) {
      suffix[i] = prefix.bytes[prefix.offset + prefix.length - 1 - i];
    }
    return new BytesRef(suffix);
  }

  /** Returns an automaton accepting the reverse of every string {@code a} accepts. */
  public static Automaton reverse(Automaton a) {
    if (isEmpty(a)) {
      return Automata.makeEmpty();
    }
    int numStates = a.getNumStates();
    Automaton.Builder builder = new Automaton.Builder();
    int start = builder.createState();
    for (int s = 0; s < numStates; s++) {
      builder.createState();
    }
    // state s of a is state s + 1 here; the old initial state accepts
    builder.setAccept(1, true);
    addReversedEdges(a, builder, 1);
    BitSet accepting = a.getAcceptStates();
    for (int s = accepting.nextSetBit(0); s >= 0; s = accepting.nextSetBit(s + 1)) {
      builder.addEpsilon(start, s + 1);
    }
    return builder.finish();
  }

  /**
   * Returns {@code a} with every edge turned around and the old initial
   * state as the only accept state, keeping the state numbers. State 0 is
   * not a meaningful initial state of the result; run it through
   * {@link #determinize(Automaton, int[], int)} from the old accept states.
   */
  static Automaton reverseEdges(Automaton a) {
    Automaton.Builder builder = new Automaton.Builder();
    for (int s = 0; s < a.getNumStates(); s++) {
      builder.createState();
    }
    builder.setAccept(0, true);
    addReversedEdges(a, builder, 0);
    return builder.finish();
  }

  private static void addReversedEdges(Automaton a, Automaton.Builder builder, int offset) {
    Transition t = new Transition();
    for (int s = 0; s < a.getNumStates(); s++) {
      int count = a.initTransition(s, t);
      while (count-- > 0) {
        a.getNextTransition(t);
        builder.addTransition(t.dest + offset, s + offset, t.min, t.max);
      }
    }
  }

  /**
   * Adds a dead state and transitions into it so that every state has a
   * transition for every code point.
   *
   * @throws IllegalArgumentException if {@code a} is not deterministic
   */
  public static Automaton totalize(Automaton a) {
    return totalize(a, Character.MIN_CODE_POINT, Character.MAX_CODE_POINT);
  }

  static Automaton totalize(Automaton a, int minAlphabet, int maxAlphabet) {
    checkDeterministic(a);
    int numStates = a.getNumStates();
    Automaton result = new Automaton(numStates + 1, a.getNumTransitions() + numStates + 1);
    for (int s = 0; s < numStates; s++) {
      result.setAccept(result.createState(), a.isAccept(s));
    }
    int sink = result.createState();

    Transition t = new Transition();
    for (int s = 0; s < numStates; s++) {
      // first label no transition seen so far covers
      int gapStart = minAlphabet;
      int count = a.initTransition(s, t);
      while (count-- > 0) {
        a.getNextTransition(t);
        if (t.min > gapStart) {
          result.addTransition(s, sink, gapStart, t.min - 1);
        }
        result.addTransition(s, t.dest, t.min, t.max);
        gapStart = Math.max(gapStart, t.max + 1);
      }
      if (gapStart <= maxAlphabet) {
        result.addTransition(s, sink, gapStart, maxAlphabet);
      }
    }
    result.addTransition(sink, sink, minAlphabet, maxAlphabet);
    result.finishState();
    return result;
  }

  /**
   * Returns the states reachable from the initial state in topological
   * order. The automaton must be acyclic.
   *
   * @throws IllegalArgumentException if a path is longer than {@link #MAX_RECURSION_LEVEL}
   */
  public static int[] topoSortStates(Automaton a) {
    int numStates = a.getNumStates();
    if (numStates == 0) {
      return new int[0];
    }
    int[] postOrder = new int[numStates];
    BitSet visited = new BitSet(numStates);
    visited.set(0);
    int count = visitPostOrder(a, 0, visited, postOrder, 0, 0);

    int[] order = new int[count];
    for (int i = 0; i < count; i++) {
      order[i] = postOrder[count - 1 - i];
    }
    return order;
  }

  private static int visitPostOrder(Automaton a, int state, BitSet visited, int[] postOrder, int count, int depth) {
    if (depth > MAX_RECURSION_LEVEL) {
      throw new IllegalArgumentException("input automaton is too large: " + depth);
    }
    Transition t = new Transition();
    int numTransitions = a.initTransition(state, t);
    while (numTransitions-- > 0) {
      a.getNextTransition(t);
      if (!visited.get(t.dest)) {
        visited.set(t.dest);
        count = visitPostOrder(a, t.dest, visited, postOrder, count, depth + 1);
      }
    }
    postOrder[count] = state;
    return count + 1;
  }
}
