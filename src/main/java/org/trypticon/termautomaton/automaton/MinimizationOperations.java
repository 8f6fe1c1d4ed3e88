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
import java.util.Arrays;
import java.util.BitSet;

/**
 * Automaton minimization.
 */
public final class MinimizationOperations {

  private MinimizationOperations() {}

  /**
   * Minimizes {@code a} with Hopcroft's partition refinement. The result is
   * deterministic and has no dead or unreachable states: the empty language
   * comes back with zero states, the empty string as a single accepting
   * state without transitions.
   *
   * @throws TooComplexToDeterminizeException if determinizing {@code a}
   *     needs more than {@code maxDeterminizedStates} states
   */
  public static Automaton minimize(Automaton a, int maxDeterminizedStates) {
    if (Operations.isEmpty(a)) {
      return Automata.makeEmpty();
    }
    a = Operations.determinize(a, maxDeterminizedStates);
    if (Operations.isTotal(a)) {
      return Operations.removeDeadStates(a);
    }
    a = Operations.totalize(a);

    int[] sigma = a.getStartPoints();
    int numSymbols = sigma.length;
    int numStates = a.getNumStates();

    // predecessors on symbol x of state q: preds[predStart[x][q] .. predStart[x][q + 1])
    int[][] predStart = new int[numSymbols][numStates + 1];
    int[][] preds = new int[numSymbols][numStates];
    for (int x = 0; x < numSymbols; x++) {
      int[] succ = new int[numStates];
      for (int q = 0; q < numStates; q++) {
        succ[q] = a.step(q, sigma[x]);
        predStart[x][succ[q] + 1]++;
      }
      for (int q = 0; q < numStates; q++) {
        predStart[x][q + 1] += predStart[x][q];
      }
      int[] fill = predStart[x].clone();
      for (int q = 0; q < numStates; q++) {
        preds[x][fill[succ[q]]++] = q;
      }
    }

    Partition partition = new Partition(a);
    // pending splitters as (block, symbol), with a bit per pair to avoid duplicates
    ArrayDeque<int[]> pending = new ArrayDeque<>();
    BitSet isPending = new BitSet();
    if (partition.numBlocks == 2) {
      int smaller = partition.size(0) <= partition.size(1) ? 0 : 1;
      for (int x = 0; x < numSymbols; x++) {
        pending.add(new int[] {smaller, x});
        isPending.set(smaller * numSymbols + x);
      }
    }

    int[] touchedBlocks = new int[numStates];
    while (!pending.isEmpty()) {
      int[] splitter = pending.removeFirst();
      int block = splitter[0];
      int x = splitter[1];
      isPending.clear(block * numSymbols + x);

      // marking reorders members, so take a copy of the splitter first
      int[] members = partition.members(block);
      int numTouched = 0;
      for (int q : members) {
        for (int i = predStart[x][q]; i < predStart[x][q + 1]; i++) {
          int touched = partition.mark(preds[x][i]);
          if (touched != -1) {
            touchedBlocks[numTouched++] = touched;
          }
        }
      }

      for (int i = 0; i < numTouched; i++) {
        int old = touchedBlocks[i];
        int created = partition.splitMarked(old);
        if (created == -1) {
          continue;
        }
        for (int y = 0; y < numSymbols; y++) {
          int add;
          if (isPending.get(old * numSymbols + y)) {
            add = created;
          } else {
            add = partition.size(old) <= partition.size(created) ? old : created;
          }
          isPending.set(add * numSymbols + y);
          pending.add(new int[] {add, y});
        }
      }
    }

    // one state per block; q = 0 comes first, so its block becomes the initial state
    int[] newState = new int[partition.numBlocks];
    Arrays.fill(newState, -1);
    int[] representative = new int[partition.numBlocks];
    Automaton result = new Automaton();
    for (int q = 0; q < numStates; q++) {
      int b = partition.blockOf[q];
      if (newState[b] == -1) {
        newState[b] = result.createState();
        representative[newState[b]] = q;
        result.setAccept(newState[b], a.isAccept(q));
      }
    }
    Transition t = new Transition();
    for (int s = 0; s < result.getNumStates(); s++) {
      int count = a.initTransition(representative[s], t);
      while (count-- > 0) {
        a.getNextTransition(t);
        result.addTransition(s, newState[partition.blockOf[t.dest]], t.min, t.max);
      }
    }
    result.finishState();

    // drops the sink totalize added
    return Operations.removeDeadStates(result);
  }

  /**
   * Minimizes {@code a} as det(rev(det(rev(a)))). Much slower than
   * {@link #minimize}; gives the same states and transitions up to
   * renumbering, so tests use it as a reference.
   *
   * <p>Each reversal keeps the state numbers and is determinized from the
   * set of old accept states, so no extra initial state ends up in the
   * result.
   */
  public static Automaton minimizeBrzozowski(Automaton a, int maxDeterminizedStates) {
    if (Operations.isEmpty(a)) {
      return Automata.makeEmpty();
    }
    Automaton once = determinizeReversed(a, maxDeterminizedStates);
    return determinizeReversed(once, maxDeterminizedStates);
  }

  private static Automaton determinizeReversed(Automaton a, int maxDeterminizedStates) {
    int[] acceptStates = a.getAcceptStates().stream().toArray();
    return Operations.determinize(Operations.reverseEdges(a), acceptStates, maxDeterminizedStates);
  }

  /**
   * Blocks of states as contiguous runs of one array, so that a block splits
   * by moving its marked members to the front of its run.
   */
  private static final class Partition {
    final int[] blockOf;
    private final int[] elements;
    private final int[] position;
    // block b owns elements[start[b] .. end[b]); the first marked[b] of them are marked
    private final int[] start;
    private final int[] end;
    private final int[] marked;
    int numBlocks;

    /** Starts from two blocks: accepting states and the rest. */
    Partition(Automaton a) {
      int numStates = a.getNumStates();
      blockOf = new int[numStates];
      elements = new int[numStates];
      position = new int[numStates];
      start = new int[numStates];
      end = new int[numStates];
      marked = new int[numStates];

      int upto = 0;
      for (int pass = 0; pass < 2; pass++) {
        boolean accepting = pass == 0;
        int first = upto;
        for (int q = 0; q < numStates; q++) {
          if (a.isAccept(q) == accepting) {
            blockOf[q] = numBlocks;
            position[q] = upto;
            elements[upto++] = q;
          }
        }
        if (upto > first) {
          start[numBlocks] = first;
          end[numBlocks] = upto;
          numBlocks++;
        }
      }
    }

    int size(int block) {
      return end[block] - start[block];
    }

    int[] members(int block) {
      return Arrays.copyOfRange(elements, start[block], end[block]);
    }

    /** Marks {@code q}. Returns its block if no other member was marked yet, else -1. */
    int mark(int q) {
      int b = blockOf[q];
      int firstUnmarked = start[b] + marked[b];
      int pos = position[q];
      if (pos < firstUnmarked) {
        return -1;
      }
      int other = elements[firstUnmarked];
      elements[firstUnmarked] = q;
      position[q] = firstUnmarked;
      elements[pos] = other;
      position[other] = pos;
      return marked[b]++ == 0 ? b : -1;
    }

    /**
     * Moves the marked members of {@code block} into a new block and clears
     * the marks. Returns the new block, or -1 if every member was marked.
     */
    int splitMarked(int block) {
      int count = marked[block];
      marked[block] = 0;
      if (count == size(block)) {
        return -1;
      }
      int created = numBlocks++;
      start[created] = start[block];
      end[created] = start[block] + count;
      start[block] = end[created];
      for (int i = start[created]; i < end[created]; i++) {
        blockOf[elements[i]] = created;
      }
      return created;
    }
  }
}
