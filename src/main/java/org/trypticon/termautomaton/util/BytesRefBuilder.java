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
 * Growable byte buffer for assembling terms.
 */
public class BytesRefBuilder {

  private byte[] buffer = new byte[0];

  private int length;

  /** Truncates the content, or extends it over bytes already written. */
  public void setLength(int length) {
    assert length >= 0 && length <= buffer.length : "length=" + length;
    this.length = length;
  }

  public void append(byte b) {
    buffer = ArrayUtil.grow(buffer, length + 1);
    buffer[length++] = b;
  }

  /** Replaces the content with the bytes of {@code ref}. */
  public void copyBytes(BytesRef ref) {
    buffer = ArrayUtil.grow(buffer, ref.length);
    System.arraycopy(ref.bytes, ref.offset, buffer, 0, ref.length);
    length = ref.length;
  }

  /**
   * Returns a view of the current content. The view shares the backing
   * array until the next write grows it.
   */
  public BytesRef get() {
    return new BytesRef(buffer, 0, length);
  }
}
