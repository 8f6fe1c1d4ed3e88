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
package org.trypticon.termautomaton.util;

/**
 * Base class for sorting algorithms that work on an abstract indexed
 * sequence through {@link #compare(int, int)} and {@link #swap(int, int)}.
 */
public abstract class Sorter {

  static final int INSERTION_SORT_THRESHOLD = 16;

  protected Sorter() {}

  /** Compares the entries at {@code i} and {@code j}. */
  protected abstract int compare(int i, int j);

  /** Swaps the entries at {@code i} and {@code j}. */
  protected abstract void swap(int i, int j);

  /** Sorts the slice {@code [from, to)}. */
  public abstract void sort(int from, int to);

  void checkRange(int from, int to) {
    if (to < from) {
      throw new IllegalArgumentException("'to' must be >= 'from', got from=" + from + " and to=" + to);
    }
  }

  void mergeInPlace(int from, int mid, int to) {
    if (from == mid || mid == to || compare(mid - 1, mid) <= 0) {
      return;
    } else if (to - from == 2) {
      swap(mid - 1, mid);
      return;
    }
    final int firstCut;
    final int secondCut;
    final int len11;
    final int len22;
    if (mid - from > to - mid) {
      len11 = (mid - from) >>> 1;
      firstCut = from + len11;
      secondCut = lower(mid, to, firstCut);
      len22 = secondCut - mid;
    } else {
      len22 = (to - mid) >>> 1;
      secondCut = mid + len22;
      firstCut = upper(from, mid, secondCut);
      len11 = firstCut - from;
    }
    rotate(firstCut, mid, secondCut);
    final int newMid = firstCut + len22;
    mergeInPlace(from, firstCut, newMid);
    mergeInPlace(newMid, secondCut, to);
  }

  int lower(int from, int to, int val) {
    int len = to - from;
    while (len > 0) {
      final int half = len >>> 1;
      final int mid = from + half;
      if (compare(mid, val) < 0) {
        from = mid + 1;
        len = len - half - 1;
      } else {
        len = half;
      }
    }
    return from;
  }

  int upper(int from, int to, int val) {
    int len = to - from;
    while (len > 0) {
      final int half = len >>> 1;
      final int mid = from + half;
      if (compare(val, mid) < 0) {
        len = half;
      } else {
        from = mid + 1;
        len = len - half - 1;
      }
    }
    return from;
  }

  final void reverse(int from, int to) {
    for (--to; from < to; ++from, --to) {
      swap(from, to);
    }
  }

  final void rotate(int lo, int mid, int hi) {
    assert lo <= mid && mid <= hi;
    if (lo == mid || mid == hi) {
      return;
    }
    if (mid - lo == hi - mid) {
      while (mid < hi) {
        swap(lo++, mid++);
      }
    } else {
      reverse(lo, mid);
      reverse(mid, hi);
      reverse(lo, hi);
    }
  }

  void insertionSort(int from, int to) {
    for (int i = from + 1; i < to; ++i) {
      for (int j = i; j > from; --j) {
        if (compare(j - 1, j) > 0) {
          swap(j - 1, j);
        } else {
          break;
        }
      }
    }
  }
}
