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

import java.util.Collection;

import org.trypticon.termautomaton.util.BytesRef;

/**
 * Factories for primitive automata.
 */
public final class Automata {

  private Automata() {}

  /** Returns a new automaton that accepts nothing. It has no states. */
  public static Automaton makeEmpty() {
    Automaton a = new Automaton();
    a.finishState();
    return a;
  }

  /** Returns a new automaton that accepts only the empty string: one accepting state. */
  public static Automaton makeEmptyString() {
    Automaton a = new Automaton();
    a.createState();
    a.setAccept(0, true);
    return a;
  }

  /** Returns a new automaton that accepts every string of code points. */
  public static Automaton makeAnyString() {
    Automaton a = new Automaton();
    int s = a.createState();
    a.setAccept(s, true);
    a.addTransition(s, s, Character.MIN_CODE_POINT, Character.MAX_CODE_POINT);
    a.finishState();
    return a;
  }

  /** Returns a new automaton that accepts every string of bytes. */
  public static Automaton makeAnyBinary() {
    Automaton a = new Automaton();
    int s = a.createState();
    a.setAccept(s, true);
    a.addTransition(s, s, 0, 255);
    a.finishState();
    return a;
  }

  /** Returns a new automaton that accepts any single code point. */
  public static Automaton makeAnyChar() {
    return makeCharRange(Character.MIN_CODE_POINT, Character.MAX_CODE_POINT);
  }

  /** Returns a new automaton that accepts the single code point {@code c}. */
  public static Automaton makeChar(int c) {
    return makeCharRange(c, c);
  }

  /**
   * Returns a new automaton that accepts any single code point in
   * {@code [min, max]}, or nothing if {@code min > max}.
   *
   * @throws IllegalArgumentException if a bound is not a code point
   */
  public static Automaton makeCharRange(int min, int max) {
    if (min > max) {
      return makeEmpty();
    }
    if (min < Character.MIN_CODE_POINT || max > Character.MAX_CODE_POINT) {
      throw new IllegalArgumentException("invalid code point range " + min + "-" + max);
    }
    Automaton a = new Automaton();
    int s1 = a.createState();
    int s2 = a.createState();
    a.setAccept(s2, true);
    a.addTransition(s1, s2, min, max);
    a.finishState();
    return a;
  }

  /**
   * Returns an automaton accepting only {@code s}. It stays in literal form
   * until its graph is first needed.
   */
  public static Automaton makeString(String s) {
    if (s == null) {
      throw new NullPointerException("s");
    }
    return new Automaton(s);
  }

  /**
   * Returns a new automaton accepting only the given code points. Unlike
   * {@link #makeString(String)}, unpaired surrogate code points are kept as
   * single labels.
   */
  public static Automaton makeString(int[] word, int offset, int length) {
    Automaton a = new Automaton(length + 1, length);
    a.createState();
    int s = 0;
    for (int i = offset; i < offset + length; i++) {
      int s2 = a.createState();
      a.addTransition(s, s2, word[i]);
      s = s2;
    }
    a.setAccept(s, true);
    a.finishState();
    return a;
  }

  /** Returns a new automaton over bytes accepting only {@code term}. */
  public static Automaton makeBinary(BytesRef term) {
    Automaton a = new Automaton(term.length + 1, term.length);
    int s = a.createState();
    for (int i = 0; i < term.length; i++) {
      int s2 = a.createState();
      a.addTransition(s, s2, term.bytes[term.offset + i] & 0xff);
      s = s2;
    }
    a.setAccept(s, true);
    a.finishState();
    return a;
  }

  /**
   * Returns the minimal automaton over code points accepting exactly the
   * given UTF-8 terms, which must be sorted.
   *
   * @throws IllegalArgumentException if the terms are not sorted
   */
  public static Automaton makeStringUnion(Collection<BytesRef> utf8Strings) {
    if (utf8Strings.isEmpty()) {
      return makeEmpty();
    }
    return DaciukMihovAutomatonBuilder.build(utf8Strings);
  }

  /** Byte variant of {@link #makeStringUnion}. */
  public static Automaton makeBinaryStringUnion(Collection<BytesRef> terms) {
    if (terms.isEmpty()) {
      return makeEmpty();
    }
    return DaciukMihovAutomatonBuilder.buildBinary(terms);
  }
}
