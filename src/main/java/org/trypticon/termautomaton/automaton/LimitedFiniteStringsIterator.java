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

import org.trypticon.termautomaton.util.IntsRef;

/**
 * {@link FiniteStringsIterator} that stops after a fixed number of strings.
 */
public class LimitedFiniteStringsIterator extends FiniteStringsIterator {
  private final int limit;
  private int returned;

  /**
   * @param limit maximum number of strings to return, or -1 for no limit
   */
  public LimitedFiniteStringsIterator(Automaton a, int limit) {
    super(a);
    if (limit == -1) {
      this.limit = Integer.MAX_VALUE;
    } else if (limit > 0) {
      this.limit = limit;
    } else {
      throw new IllegalArgumentException("limit must be positive or -1 for no limit, got " + limit);
    }
  }

  @Override
  public IntsRef next() {
    IntsRef string = returned < limit ? super.next() : null;
    if (string != null) {
      returned++;
    }
    return string;
  }

  /** Number of strings returned so far. */
  public int size() {
    return returned;
  }
}
