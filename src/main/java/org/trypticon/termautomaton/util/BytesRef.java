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

import java.util.Arrays;

/**
 * A slice {@code bytes[offset, offset+length)} of a byte array, typically
 * the UTF-8 encoding of a term. Equality and hashing look at the slice
 * contents only; ordering is unsigned byte order, which for UTF-8 is code
 * point order.
 */
public final class BytesRef implements Comparable<BytesRef> {

  private static final byte[] NO_BYTES = new byte[0];

  public byte[] bytes;

  public int offset;

  public int length;

  /** An empty slice. */
  public BytesRef() {
    this(NO_BYTES);
  }

  public BytesRef(byte[] bytes) {
    this(bytes, 0, bytes.length);
  }

  public BytesRef(byte[] bytes, int offset, int length) {
    this.bytes = bytes;
    this.offset = offset;
    this.length = length;
    assert isValid();
  }

  /** Encodes the text as UTF-8. Unpaired surrogates become U+FFFD. */
  public BytesRef(CharSequence text) {
    bytes = new byte[UnicodeUtil.maxUTF8Length(text.length())];
    length = UnicodeUtil.UTF16toUTF8(text, 0, text.length(), bytes);
  }

  /** Returns a slice over a fresh array holding the same bytes as {@code other}. */
  public static BytesRef deepCopyOf(BytesRef other) {
    return new BytesRef(Arrays.copyOfRange(other.bytes, other.offset, other.offset + other.length));
  }

  /** Decodes the bytes as UTF-8. */
  public String utf8ToString() {
    char[] chars = new char[length];
    return new String(chars, 0, UnicodeUtil.UTF8toUTF16(bytes, offset, length, chars));
  }

  /**
   * Checks the slice bounds.
   *
   * @return true, so it can be used in an assert
   * @throws IllegalStateException if the slice does not fit the array
   */
  public boolean isValid() {
    if (bytes == null) {
      throw new IllegalStateException("bytes is null");
    }
    if (offset < 0 || length < 0 || (long) offset + length > bytes.length) {
      throw new IllegalStateException("slice [" + offset + ", " + offset + "+" + length + ") does not fit "
          + bytes.length + " bytes");
    }
    return true;
  }

  @Override
  public int compareTo(BytesRef other) {
    int common = Math.min(length, other.length);
    for (int i = 0; i < common; i++) {
      int diff = (bytes[offset + i] & 0xff) - (other.bytes[other.offset + i] & 0xff);
      if (diff != 0) {
        return diff;
      }
    }
    return length - other.length;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof BytesRef)) {
      return false;
    }
    BytesRef that = (BytesRef) other;
    return length == that.length && compareTo(that) == 0;
  }

  @Override
  public int hashCode() {
    int hash = 1;
    for (int i = offset, end = offset + length; i < end; i++) {
      hash = 31 * hash + bytes[i];
    }
    return hash;
  }

  /** The bytes in hex, e.g. {@code [ff a]}. */
  @Override
  public String toString() {
    StringBuilder b = new StringBuilder("[");
    for (int i = 0; i < length; i++) {
      if (i > 0) {
        b.append(' ');
      }
      b.append(Integer.toHexString(bytes[offset + i] & 0xff));
    }
    return b.append(']').toString();
  }
}
