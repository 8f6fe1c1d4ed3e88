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

import java.util.Arrays;

/**
 * A deterministic automaton flattened into a table for matching. Labels are
 * grouped into classes, the intervals between consecutive start points of
 * the automaton's transitions; the table holds one row per state and one
 * column per class. Read-only once constructed.
 */
public abstract class RunAutomaton {
  final Automaton automaton;
  final int alphabetSize;
  final int size;
  // class i covers labels points[i] up to points[i + 1] - 1 (or the end of the alphabet)
  final int[] points;
  // row-major, -1 where no transition exists
  private final int[] table;
  private final boolean[] accept;
  // direct label to class lookup, built for byte-sized alphabets only
  private final int[] classOfLabel;

  /**
   * @param a the automaton, determinized here if needed
   * @param alphabetSize one more than the largest label
   * @param maxDeterminizedStates limit passed to {@link Operations#determinize}
   */
  protected RunAutomaton(Automaton a, int alphabetSize, int maxDeterminizedStates) {
    this.alphabetSize = alphabetSize;
    this.automaton = Operations.determinize(a, maxDeterminizedStates);
    this.points = automaton.getStartPoints();

    int numStates = automaton.getNumStates();
    // the empty language still gets one (rejecting) row
    size = Math.max(1, numStates);
    accept = new boolean[size];
    table = new int[size * points.length];
    Arrays.fill(table, -1);
    Transition t = new Transition();
    for (int s = 0; s < numStates; s++) {
      accept[s] = automaton.isAccept(s);
      int count = automaton.initTransition(s, t);
      while (count-- > 0) {
        automaton.getNextTransition(t);
        // a transition covers whole classes: from the one holding its min up to the one holding its max
        for (int c = classOf(t.min); c < points.length && points[c] <= t.max; c++) {
          table[s * points.length + c] = t.dest;
        }
      }
    }

    if (alphabetSize <= 256) {
      classOfLabel = new int[alphabetSize];
      for (int c = 0; c < points.length; c++) {
        int end = c + 1 < points.length ? Math.min(points[c + 1], alphabetSize) : alphabetSize;
        Arrays.fill(classOfLabel, Math.min(points[c], alphabetSize), end, c);
      }
    } else {
      classOfLabel = null;
    }
  }

  /** Class of {@code label}: index of the last start point not above it. */
  private int classOf(int label) {
    int index = Arrays.binarySearch(points, label);
    return index >= 0 ? index : -index - 2;
  }

  /** Number of states. */
  public final int getSize() {
    return size;
  }

  public final boolean isAccept(int state) {
    return accept[state];
  }

  public final int getInitialState() {
    return 0;
  }

  /** Start points of the label classes. */
  public final int[] getCharIntervals() {
    return points.clone();
  }

  /** Returns the state reached from {@code state} on {@code label}, or -1. */
  public final int step(int state, int label) {
    assert label < alphabetSize;
    int c = classOfLabel != null ? classOfLabel[label] : classOf(label);
    return c < 0 ? -1 : table[state * points.length + c];
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder("initial state: 0\n");
    for (int s = 0; s < size; s++) {
      b.append("state ").append(s).append(accept[s] ? " [accept]:\n" : " [reject]:\n");
      for (int c = 0; c < points.length; c++) {
        int dest = table[s * points.length + c];
        if (dest == -1) {
          continue;
        }
        int last = c + 1 < points.length ? points[c + 1] - 1 : alphabetSize - 1;
        b.append(' ');
        Automaton.appendCharString(points[c], b);
        if (last != points[c]) {
          b.append('-');
          Automaton.appendCharString(last, b);
        }
        b.append(" -> ").append(dest).append('\n');
      }
    }
    return b.toString();
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(new int[] {alphabetSize, size, points.length});
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    RunAutomaton other = (RunAutomaton) obj;
    return alphabetSize == other.alphabetSize
        && size == other.size
        && Arrays.equals(points, other.points)
        && Arrays.equals(accept, other.accept)
        && Arrays.equals(table, other.table);
  }
}
