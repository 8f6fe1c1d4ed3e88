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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts an automaton over Unicode code points into an equivalent
 * automaton over the bytes of their UTF-8 encoding.
 *
 * <p>Every code point range is first cut at the UTF-8 length boundaries
 * (0x7F, 0x7FF, 0xFFFF) and around the surrogate block 0xD800-0xDFFF, which
 * has no UTF-8 encoding and is dropped. Each piece then has start and end
 * sequences of the same length and becomes a small tree of byte ranges that
 * accepts exactly the well-formed encodings of the piece.
 *
 * <p>Instances keep per-conversion scratch state and are not thread safe.
 */
public final class UTF32ToUTF8 {

  // first and last code point of each UTF-8 length
  private static final int[] startCodes = new int[] {0, 0x80, 0x800, 0x10000};
  private static final int[] endCodes = new int[] {0x7F, 0x7FF, 0xFFFF, Character.MAX_CODE_POINT};

  private static final int SURROGATE_START = 0xD800;
  private static final int SURROGATE_END = 0xDFFF;

  // MASKS[n] has the low n+1 bits set
  static final int[] MASKS = new int[32];
  static {
    int v = 2;
    for (int i = 0; i < 32; i++) {
      MASKS[i] = v - 1;
      v *= 2;
    }
  }

  private static final class UTF8Byte {
    int value;
    // number of payload bits in this byte
    byte bits;
  }

  // The UTF-8 bytes of one code point
  private static final class UTF8Sequence {
    private final UTF8Byte[] bytes;
    private int len;

    UTF8Sequence() {
      bytes = new UTF8Byte[4];
      for (int i = 0; i < 4; i++) {
        bytes[i] = new UTF8Byte();
      }
    }

    int byteAt(int idx) {
      return bytes[idx].value;
    }

    int numBits(int idx) {
      return bytes[idx].bits;
    }

    void set(int code) {
      if (code < 0x80) {
        bytes[0].value = code;
        bytes[0].bits = 7;
        len = 1;
      } else if (code < 0x800) {
        bytes[0].value = (6 << 5) | (code >> 6);
        bytes[0].bits = 5;
        setRest(code, 1);
        len = 2;
      } else if (code < 0x10000) {
        bytes[0].value = (14 << 4) | (code >> 12);
        bytes[0].bits = 4;
        setRest(code, 2);
        len = 3;
      } else {
        bytes[0].value = (30 << 3) | (code >> 18);
        bytes[0].bits = 3;
        setRest(code, 3);
        len = 4;
      }
    }

    private void setRest(int code, int numBytes) {
      for (int i = 0; i < numBytes; i++) {
        bytes[numBytes - i].value = 0x80 | (code & MASKS[5]);
        bytes[numBytes - i].bits = 6;
        code = code >> 6;
      }
    }

    @Override
    public String toString() {
      StringBuilder b = new StringBuilder();
      for (int i = 0; i < len; i++) {
        if (i > 0) {
          b.append(' ');
        }
        b.append(Integer.toBinaryString(bytes[i].value));
      }
      return b.toString();
    }
  }

  private final UTF8Sequence startUTF8 = new UTF8Sequence();
  private final UTF8Sequence endUTF8 = new UTF8Sequence();

  private Automaton.Builder utf8;

  public UTF32ToUTF8() {
  }

  /**
   * Returns a byte automaton accepting the UTF-8 encoding of every string
   * {@code utf32} accepts. The result is generally nondeterministic.
   *
   * @throws IllegalArgumentException if a transition label is not a code point
   */
  public Automaton convert(Automaton utf32) {
    if (utf32.getNumStates() == 0) {
      return utf32;
    }

    int[] map = new int[utf32.getNumStates()];
    Arrays.fill(map, -1);

    List<Integer> pending = new ArrayList<>();
    int utf32State = 0;
    pending.add(utf32State);
    utf8 = new Automaton.Builder();

    int utf8State = utf8.createState();
    utf8.setAccept(utf8State, utf32.isAccept(utf32State));
    map[utf32State] = utf8State;

    Transition scratch = new Transition();
    while (!pending.isEmpty()) {
      utf32State = pending.remove(pending.size() - 1);
      utf8State = map[utf32State];
      assert utf8State != -1;

      int numTransitions = utf32.initTransition(utf32State, scratch);
      for (int i = 0; i < numTransitions; i++) {
        utf32.getNextTransition(scratch);
        int destUTF32 = scratch.dest;
        int destUTF8 = map[destUTF32];
        if (destUTF8 == -1) {
          destUTF8 = utf8.createState();
          utf8.setAccept(destUTF8, utf32.isAccept(destUTF32));
          map[destUTF32] = destUTF8;
          pending.add(destUTF32);
        }
        convertRange(utf8State, destUTF8, scratch.min, scratch.max);
      }
    }

    Automaton result = utf8.finish();
    utf8 = null;
    return result;
  }

  private void convertRange(int start, int end, int min, int max) {
    if (min < 0 || max > Character.MAX_CODE_POINT || min > max) {
      throw new IllegalArgumentException("invalid code point range " + min + "-" + max);
    }
    for (int i = 0; i < startCodes.length; i++) {
      int lo = Math.max(min, startCodes[i]);
      int hi = Math.min(max, endCodes[i]);
      if (lo > hi) {
        continue;
      }
      if (i == 2) {
        // the three byte codes hold the surrogates
        if (lo < SURROGATE_START) {
          convertOneEdge(start, end, lo, Math.min(hi, SURROGATE_START - 1));
        }
        if (hi > SURROGATE_END) {
          convertOneEdge(start, end, Math.max(lo, SURROGATE_END + 1), hi);
        }
      } else {
        convertOneEdge(start, end, lo, hi);
      }
    }
  }

  private void convertOneEdge(int start, int end, int startCodePoint, int endCodePoint) {
    startUTF8.set(startCodePoint);
    endUTF8.set(endCodePoint);
    assert startUTF8.len == endUTF8.len;
    build(start, end, 0);
  }

  private void build(int start, int end, int upto) {
    if (startUTF8.byteAt(upto) == endUTF8.byteAt(upto)) {
      if (upto == startUTF8.len - 1) {
        utf8.addTransition(start, end, startUTF8.byteAt(upto));
      } else {
        // same leading byte: one edge, then the rest
        int n = utf8.createState();
        utf8.addTransition(start, n, startUTF8.byteAt(upto));
        build(n, end, 1 + upto);
      }
    } else if (upto == startUTF8.len - 1) {
      utf8.addTransition(start, end, startUTF8.byteAt(upto), endUTF8.byteAt(upto));
    } else {
      start(start, end, upto, false);
      if (endUTF8.byteAt(upto) - startUTF8.byteAt(upto) > 1) {
        // every byte between the two leading bytes may be followed by any continuation
        all(start, end, startUTF8.byteAt(upto) + 1, endUTF8.byteAt(upto) - 1, startUTF8.len - upto - 1);
      }
      end(start, end, upto, false);
    }
  }

  // the sequences from startUTF8 to the largest one sharing its bytes before upto
  private void start(int start, int end, int upto, boolean doAll) {
    if (upto == startUTF8.len - 1) {
      utf8.addTransition(start, end, startUTF8.byteAt(upto), startUTF8.byteAt(upto) | MASKS[startUTF8.numBits(upto) - 1]);
    } else {
      int n = utf8.createState();
      utf8.addTransition(start, n, startUTF8.byteAt(upto));
      start(n, end, 1 + upto, true);
      int endCode = startUTF8.byteAt(upto) | MASKS[startUTF8.numBits(upto) - 1];
      if (doAll && startUTF8.byteAt(upto) != endCode) {
        all(start, end, startUTF8.byteAt(upto) + 1, endCode, startUTF8.len - upto - 1);
      }
    }
  }

  // the sequences from the smallest one sharing endUTF8's bytes before upto, to endUTF8
  private void end(int start, int end, int upto, boolean doAll) {
    if (upto == endUTF8.len - 1) {
      utf8.addTransition(start, end, endUTF8.byteAt(upto) & (~MASKS[endUTF8.numBits(upto) - 1]), endUTF8.byteAt(upto));
    } else {
      final int startCode = endUTF8.byteAt(upto) & (~MASKS[endUTF8.numBits(upto) - 1]);
      if (doAll && endUTF8.byteAt(upto) != startCode) {
        all(start, end, startCode, endUTF8.byteAt(upto) - 1, endUTF8.len - upto - 1);
      }
      int n = utf8.createState();
      utf8.addTransition(start, n, endUTF8.byteAt(upto));
      end(n, end, 1 + upto, true);
    }
  }

  // [startCode, endCode] followed by left continuation bytes
  private void all(int start, int end, int startCode, int endCode, int left) {
    if (left == 0) {
      utf8.addTransition(start, end, startCode, endCode);
    } else {
      int lastN = utf8.createState();
      utf8.addTransition(start, lastN, startCode, endCode);
      while (left > 1) {
        int n = utf8.createState();
        utf8.addTransition(lastN, n, 0x80, 0xBF);
        left--;
        lastN = n;
      }
      utf8.addTransition(lastN, end, 0x80, 0xBF);
    }
  }
}
