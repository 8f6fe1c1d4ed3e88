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
 * Conversions between UTF-16, UTF-8 and UTF-32 (code point arrays).
 */
public final class UnicodeUtil {

  /** Maximum number of UTF-8 bytes a single UTF-16 code unit needs. */
  public static final int MAX_UTF8_BYTES_PER_CHAR = 3;

  public static final int UNI_SUR_HIGH_START = 0xD800;
  public static final int UNI_SUR_HIGH_END = 0xDBFF;
  public static final int UNI_SUR_LOW_START = 0xDC00;
  public static final int UNI_SUR_LOW_END = 0xDFFF;
  public static final int UNI_REPLACEMENT_CHAR = 0xFFFD;

  private static final int SURROGATE_OFFSET =
      Character.MIN_SUPPLEMENTARY_CODE_POINT - (UNI_SUR_HIGH_START << 10) - UNI_SUR_LOW_START;

  private UnicodeUtil() {}

  public static int maxUTF8Length(int utf16Length) {
    return Math.multiplyExact(utf16Length, MAX_UTF8_BYTES_PER_CHAR);
  }

  /**
   * Encodes {@code s[offset, offset+length)} as UTF-8 into {@code out}, which
   * must hold at least {@code maxUTF8Length(length)} bytes. Unpaired
   * surrogates are written as U+FFFD.
   *
   * @return the number of bytes written
   */
  public static int UTF16toUTF8(CharSequence s, int offset, int length, byte[] out) {
    final int end = offset + length;
    int upto = 0;
    for (int i = offset; i < end; i++) {
      final int code = s.charAt(i);

      if (code < 0x80) {
        out[upto++] = (byte) code;
      } else if (code < 0x800) {
        out[upto++] = (byte) (0xC0 | (code >> 6));
        out[upto++] = (byte) (0x80 | (code & 0x3F));
      } else if (code < UNI_SUR_HIGH_START || code > UNI_SUR_LOW_END) {
        out[upto++] = (byte) (0xE0 | (code >> 12));
        out[upto++] = (byte) (0x80 | ((code >> 6) & 0x3F));
        out[upto++] = (byte) (0x80 | (code & 0x3F));
      } else {
        // surrogate pair, if well formed
        if (code <= UNI_SUR_HIGH_END && i < end - 1) {
          int utf32 = s.charAt(i + 1);
          if (utf32 >= UNI_SUR_LOW_START && utf32 <= UNI_SUR_LOW_END) {
            utf32 = (code << 10) + utf32 + SURROGATE_OFFSET;
            i++;
            out[upto++] = (byte) (0xF0 | (utf32 >> 18));
            out[upto++] = (byte) (0x80 | ((utf32 >> 12) & 0x3F));
            out[upto++] = (byte) (0x80 | ((utf32 >> 6) & 0x3F));
            out[upto++] = (byte) (0x80 | (utf32 & 0x3F));
            continue;
          }
        }
        out[upto++] = (byte) 0xEF;
        out[upto++] = (byte) 0xBF;
        out[upto++] = (byte) 0xBD;
      }
    }
    return upto;
  }

  /**
   * Decodes well-formed UTF-8 into UTF-16 code units.
   *
   * @return the number of chars written
   */
  public static int UTF8toUTF16(byte[] utf8, int offset, int length, char[] out) {
    int outUpto = 0;
    int upto = offset;
    final int limit = offset + length;
    while (upto < limit) {
      int cp = decode(utf8, upto);
      upto += sequenceLength(utf8[upto]);
      outUpto += Character.toChars(cp, out, outUpto);
    }
    return outUpto;
  }

  /**
   * Decodes well-formed UTF-8 into code points. {@code ints} must hold at
   * least {@code utf8.length} entries.
   *
   * @return the number of code points written
   */
  public static int UTF8toUTF32(BytesRef utf8, int[] ints) {
    int utf32Count = 0;
    int upto = utf8.offset;
    final int limit = utf8.offset + utf8.length;
    while (upto < limit) {
      ints[utf32Count++] = decode(utf8.bytes, upto);
      upto += sequenceLength(utf8.bytes[upto]);
    }
    return utf32Count;
  }

  private static int sequenceLength(byte lead) {
    int b = lead & 0xff;
    if (b < 0xc0) {
      return 1;
    } else if (b < 0xe0) {
      return 2;
    } else if (b < 0xf0) {
      return 3;
    } else {
      return 4;
    }
  }

  private static int decode(byte[] bytes, int upto) {
    int b = bytes[upto] & 0xff;
    if (b < 0xc0) {
      assert b < 0x80 : "stray continuation byte " + b;
      return b;
    } else if (b < 0xe0) {
      return ((b & 0x1f) << 6) | (bytes[upto + 1] & 0x3f);
    } else if (b < 0xf0) {
      return ((b & 0xf) << 12) | ((bytes[upto + 1] & 0x3f) << 6) | (bytes[upto + 2] & 0x3f);
    } else {
      assert b < 0xf8 : "bad utf-8 lead byte " + b;
      return ((b & 0x7) << 18) | ((bytes[upto + 1] & 0x3f) << 12) | ((bytes[upto + 2] & 0x3f) << 6) | (bytes[upto + 3] & 0x3f);
    }
  }

  /** Converts UTF-16 text to code points, pairing surrogates where possible. */
  public static void UTF16toUTF32(CharSequence s, IntsRefBuilder out) {
    out.clear();
    for (int i = 0, cp; i < s.length(); i += Character.charCount(cp)) {
      cp = Character.codePointAt(s, i);
      out.append(cp);
    }
  }

  /** Builds a string from code points; each must be a valid code point. */
  public static String newString(int[] codePoints, int offset, int count) {
    return new String(codePoints, offset, count);
  }
}
