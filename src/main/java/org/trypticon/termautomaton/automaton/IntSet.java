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

/**
 * A set of NFA state ids, compared by value. Used as the key of the
 * subset construction's memo table.
 */
abstract class IntSet {

  /** Sorted members. Callers must not modify the array. */
  abstract int[] getArray();

  abstract int size();

  abstract long longHashCode();

  @Override
  public int hashCode() {
    long hash = longHashCode();
    return (int) (hash ^ (hash >>> 32));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IntSet)) {
      return false;
    }
    IntSet that = (IntSet) o;
    return longHashCode() == that.longHashCode() && Arrays.equals(getArray(), that.getArray());
  }
}
