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

import java.util.Objects;

import org.trypticon.termautomaton.util.BytesRef;
import org.trypticon.termautomaton.util.BytesRefBuilder;
import org.trypticon.termautomaton.util.IntsRef;
import org.trypticon.termautomaton.util.UnicodeUtil;

/**
 * Immutable class holding a byte-level automaton ready for matching terms,
 * classified into the simple cases a term dictionary can handle without
 * running the automaton at all.
 */
public class CompiledAutomaton {
  /** Classification of the accepted language. */
  public enum AUTOMATON_TYPE {
    /** Accepts nothing. */
    NONE,
    /** Accepts every term. */
    ALL,
    /** Accepts exactly {@link #term}. */
    SINGLE,
    /** Anything else; use {@link #runAutomaton}. */
    NORMAL
  }

  public final AUTOMATON_TYPE type;

  /** The only accepted term, for {@link AUTOMATON_TYPE#SINGLE}. */
  public final BytesRef term;

  /** Matcher over UTF-8 (or binary) bytes, for {@link AUTOMATON_TYPE#NORMAL}. */
  public final ByteRunAutomaton runAutomaton;

  /** The determinized, minimized byte automaton backing {@link #runAutomaton}. */
  public final Automaton automaton;

  /** Suffix shared by every accepted term of an infinite language, or null. */
  public final BytesRef commonSuffixRef;

  /** Whether the language is finite, for {@link AUTOMATON_TYPE#NORMAL}. */
  public final Boolean finite;

  /** An accepting state looping on every byte, or -1. */
  public final int sinkState;

  private final boolean isBinary;

  public CompiledAutomaton(Automaton automaton) {
    this(automaton, null, true);
  }

  public CompiledAutomaton(Automaton automaton, Boolean finite, boolean simplify) {
    this(automaton, finite, simplify, Operations.DEFAULT_MAX_DETERMINIZED_STATES, false);
  }

  public CompiledAutomaton(Automaton automaton, Boolean finite, boolean simplify,
                           int maxDeterminizedStates, boolean isBinary) {
    this(automaton, finite, simplify, maxDeterminizedStates, isBinary, false);
  }

  /**
   * @param finite whether the language is known to be finite, or null to
   *     compute it
   * @param simplify true to classify the language, false to always build
   *     a {@link AUTOMATON_TYPE#NORMAL} automaton
   * @param isBinary true if the labels are already bytes rather than code
   *     points
   * @param isMinimal true if {@code automaton} came out of
   *     {@link MinimizationOperations#minimize}, so it is not minimized again
   * @throws TooComplexToDeterminizeException if determinizing needs more
   *     than {@code maxDeterminizedStates} states
   */
  public CompiledAutomaton(Automaton automaton, Boolean finite, boolean simplify,
                           int maxDeterminizedStates, boolean isBinary, boolean isMinimal) {
    this.isBinary = isBinary;

    AUTOMATON_TYPE kind = AUTOMATON_TYPE.NORMAL;
    BytesRef single = null;
    if (simplify) {
      if (automaton.isSingleton() && !isBinary) {
        // a literal classifies without building its graph
        kind = AUTOMATON_TYPE.SINGLE;
        single = new BytesRef(automaton.getSingleton());
      } else {
        // the structural tests below are exact on minimal automata only
        if (!isMinimal) {
          automaton = MinimizationOperations.minimize(automaton, maxDeterminizedStates);
          isMinimal = true;
        }
        IntsRef labels;
        if (automaton.getNumStates() == 0) {
          kind = AUTOMATON_TYPE.NONE;
        } else if (isBinary ? Operations.isTotal(automaton, 0, 0xff) : Operations.isTotal(automaton)) {
          kind = AUTOMATON_TYPE.ALL;
        } else if ((labels = Operations.getSingleton(automaton)) != null) {
          kind = AUTOMATON_TYPE.SINGLE;
          single = isBinary ? bytesOf(labels) : new BytesRef(UnicodeUtil.newString(labels.ints, labels.offset, labels.length));
        }
      }
    }
    type = kind;
    term = single;

    if (kind != AUTOMATON_TYPE.NORMAL) {
      this.finite = null;
      commonSuffixRef = null;
      runAutomaton = null;
      this.automaton = null;
      sinkState = -1;
      return;
    }

    this.finite = finite != null ? finite : Operations.isFinite(automaton);

    Automaton bytes;
    if (isBinary) {
      // the caller's byte labels need not be UTF-8
      bytes = isMinimal ? automaton : MinimizationOperations.minimize(automaton, maxDeterminizedStates);
    } else {
      bytes = MinimizationOperations.minimize(new UTF32ToUTF8().convert(automaton), maxDeterminizedStates);
    }

    BytesRef suffix = this.finite ? null : Operations.getCommonSuffixBytesRef(bytes, maxDeterminizedStates);
    commonSuffixRef = suffix == null || suffix.length == 0 ? null : suffix;

    runAutomaton = new ByteRunAutomaton(bytes, true, maxDeterminizedStates);
    this.automaton = runAutomaton.automaton;
    sinkState = acceptingByteLoop(this.automaton);
  }

  private static BytesRef bytesOf(IntsRef labels) {
    byte[] bytes = new byte[labels.length];
    for (int i = 0; i < labels.length; i++) {
      int label = labels.ints[labels.offset + i];
      if (label < 0 || label > 0xff) {
        throw new IllegalArgumentException("label " + label + " at position " + i + " is not a byte");
      }
      bytes[i] = (byte) label;
    }
    return new BytesRef(bytes);
  }

  /** First accept state with a transition to itself on every byte, or -1. */
  private static int acceptingByteLoop(Automaton a) {
    Transition t = new Transition();
    for (int s = 0; s < a.getNumStates(); s++) {
      if (!a.isAccept(s)) {
        continue;
      }
      int count = a.initTransition(s, t);
      while (count-- > 0) {
        a.getNextTransition(t);
        if (t.dest == s && t.min == 0 && t.max == 0xff) {
          return s;
        }
      }
    }
    return -1;
  }

  /** Returns true if the term, given as UTF-8 (or binary) bytes, is accepted. */
  public boolean run(BytesRef input) {
    switch (type) {
      case NONE:
        return false;
      case ALL:
        return true;
      case SINGLE:
        return term.equals(input);
      case NORMAL:
        return runAutomaton.run(input.bytes, input.offset, input.length);
      default:
        throw new AssertionError("unhandled case: " + type);
    }
  }

  /** Returns true if the UTF-8 encoding of {@code input} is accepted. */
  public boolean run(String input) {
    return run(new BytesRef(input));
  }

  /**
   * Finds the largest accepted term that is less than or equal to
   * {@code input} in unsigned byte order.
   *
   * @param output receives the result; the returned reference may share
   *     its bytes
   * @return the floor term, or null if every accepted term is greater
   * @throws IllegalStateException if a {@link AUTOMATON_TYPE#NORMAL}
   *     automaton accepts infinitely many terms
   */
  public BytesRef floor(BytesRef input, BytesRefBuilder output) {
    switch (type) {
      case NONE:
        return null;
      case ALL:
        output.copyBytes(input);
        return output.get();
      case SINGLE:
        if (term.compareTo(input) > 0) {
          return null;
        }
        output.copyBytes(term);
        return output.get();
      case NORMAL:
        if (!finite) {
          throw new IllegalStateException("floor requires a finite automaton");
        }
        return floorNormal(input, output);
      default:
        throw new AssertionError("unhandled case: " + type);
    }
  }

  /*
   * With path[i] the state after the first i bytes of the input, the
   * candidates sharing exactly i bytes with the input are:
   *   - input[0, i) + b + the largest completion, for the largest b < input[i]
   *     leaving path[i], and
   *   - input[0, i) itself, if path[i] accepts.
   * The first beats the second, and both beat every candidate sharing fewer
   * bytes, so the answer is the first candidate found from the deepest i up.
   */
  private BytesRef floorNormal(BytesRef input, BytesRefBuilder output) {
    if (automaton.getNumStates() == 0) {
      return null;
    }
    int[] path = new int[input.length + 1];
    int depth = 0;
    while (depth < input.length) {
      int next = runAutomaton.step(path[depth], input.bytes[input.offset + depth] & 0xff);
      if (next == -1) {
        break;
      }
      path[++depth] = next;
    }
    if (depth == input.length && runAutomaton.isAccept(path[depth])) {
      output.copyBytes(input);
      return output.get();
    }

    // scratch transition per call so concurrent callers don't collide
    Transition t = new Transition();
    for (int i = Math.min(depth, input.length - 1); i >= 0; i--) {
      int label = input.bytes[input.offset + i] & 0xff;
      if (lastTransitionBelow(path[i], label, t)) {
        output.copyBytes(input);
        output.setLength(i);
        output.append((byte) Math.min(t.max, label - 1));
        appendLargestCompletion(t.dest, output, t);
        return output.get();
      }
      if (runAutomaton.isAccept(path[i])) {
        output.copyBytes(input);
        output.setLength(i);
        return output.get();
      }
    }
    return null;
  }

  /** Loads into {@code t} the last transition of {@code state} starting below {@code label}. */
  private boolean lastTransitionBelow(int state, int label, Transition t) {
    int count = automaton.getNumTransitions(state);
    // transitions are sorted by min
    for (int i = count - 1; i >= 0; i--) {
      automaton.getTransition(state, i, t);
      if (t.min < label) {
        return true;
      }
    }
    return false;
  }

  /** Follows the largest label out of each state until a state without transitions. */
  private void appendLargestCompletion(int state, BytesRefBuilder output, Transition t) {
    int count;
    while ((count = automaton.getNumTransitions(state)) > 0) {
      automaton.getTransition(state, count - 1, t);
      output.append((byte) t.max);
      state = t.dest;
    }
    assert runAutomaton.isAccept(state) : "state " + state + " is a dead end";
  }

  /** Returns the Graphviz rendering of the byte automaton, or a one-line description of the simple cases. */
  public String toDot() {
    return type == AUTOMATON_TYPE.NORMAL ? automaton.toDot() : toString();
  }

  @Override
  public String toString() {
    switch (type) {
      case SINGLE:
        return "CompiledAutomaton(SINGLE " + (isBinary ? term.toString() : term.utf8ToString()) + ")";
      case NORMAL:
        return "CompiledAutomaton(NORMAL states=" + automaton.getNumStates()
            + " transitions=" + automaton.getNumTransitions()
            + " finite=" + finite + ")";
      default:
        return "CompiledAutomaton(" + type + ")";
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, term, runAutomaton);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    CompiledAutomaton other = (CompiledAutomaton) obj;
    return type == other.type
        && Objects.equals(term, other.term)
        && Objects.equals(runAutomaton, other.runAutomaton);
  }
}
