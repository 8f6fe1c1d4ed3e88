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
 * Growable int buffer for assembling label strings.
 */
public class IntsRefBuilder {

  private int[] buffer = new int[0];

  private int length;

  /** Truncates the content, or extends it over values already in the buffer. */
  public void setLength(int length) {
    assert length >= 0 && length <= buffer.length : "length=" + length;
    this.length = length;
  }

  public void clear() {
    length = 0;
  }

  public void append(int value) {
    buffer = ArrayUtil.grow(buffer, length + 1);
    buffer[length++] = value;
  }

  /** Sets the value at {@code index}, extending the content to {@code index + 1} values if needed. */
  public void put(int index, int value) {
    buffer = ArrayUtil.grow(buffer, index + 1);
    buffer[index] = value;
    length = Math.max(length, index + 1);
  }

  /** Replaces the content with the code points of the UTF-8 encoded {@code utf8}. */
  public void copyUTF8Bytes(BytesRef utf8) {
    buffer = ArrayUtil.grow(buffer, utf8.length);
    length = UnicodeUtil.UTF8toUTF32(utf8, buffer);
  }

  /**
   * Returns a view of the current content. The view shares the backing
   * array until the next write grows it.
   */
  public IntsRef get() {
    return new IntsRef(buffer, 0, length);
  }
}
