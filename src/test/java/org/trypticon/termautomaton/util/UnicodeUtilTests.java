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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class UnicodeUtilTests {

  private static String randomString(Random random) {
    StringBuilder b = new StringBuilder();
    int length = random.nextInt(8);
    for (int i = 0; i < length; i++) {
      int cp;
      do {
        cp = random.nextInt(Character.MAX_CODE_POINT + 1);
      } while (cp >= UnicodeUtil.UNI_SUR_HIGH_START && cp <= UnicodeUtil.UNI_SUR_LOW_END);
      b.appendCodePoint(cp);
    }
    return b.toString();
  }

  @Test
  public void testUTF16toUTF8MatchesJdk() {
    Random random = new Random(1);
    for (int i = 0; i < 1000; i++) {
      String s = randomString(random);
      byte[] out = new byte[UnicodeUtil.maxUTF8Length(s.length())];
      int length = UnicodeUtil.UTF16toUTF8(s, 0, s.length(), out);
      byte[] expected = s.getBytes(StandardCharsets.UTF_8);
      assertEquals(expected.length, length);
      for (int j = 0; j < length; j++) {
        assertEquals(s, expected[j], out[j]);
      }
    }
  }

  @Test
  public void testUTF8toUTF16() {
    Random random = new Random(2);
    for (int i = 0; i < 1000; i++) {
      String s = randomString(random);
      byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
      char[] out = new char[utf8.length];
      int length = UnicodeUtil.UTF8toUTF16(utf8, 0, utf8.length, out);
      assertThat(new String(out, 0, length), is(s));
    }
  }

  @Test
  public void testUTF8toUTF32() {
    Random random = new Random(3);
    for (int i = 0; i < 1000; i++) {
      String s = randomString(random);
      BytesRef utf8 = new BytesRef(s);
      int[] ints = new int[utf8.length];
      int count = UnicodeUtil.UTF8toUTF32(utf8, ints);
      assertArrayEquals(s.codePoints().toArray(), Arrays.copyOf(ints, count));
    }
  }

  @Test
  public void testUnpairedSurrogateBecomesReplacement() {
    String s = "a\ud800b";
    byte[] out = new byte[UnicodeUtil.maxUTF8Length(s.length())];
    int length = UnicodeUtil.UTF16toUTF8(s, 0, s.length(), out);
    assertThat(length, is(5));
    assertThat(new BytesRef(out, 0, length).utf8ToString(), is("a\ufffdb"));
  }

  @Test
  public void testUTF16toUTF32() {
    IntsRefBuilder builder = new IntsRefBuilder();
    builder.append(42);
    UnicodeUtil.UTF16toUTF32("a\ud834\udd1e", builder);
    IntsRef ref = builder.get();
    assertThat(ref.length, is(2));
    assertThat(ref.ints[0], is((int) 'a'));
    assertThat(ref.ints[1], is(0x1D11E));
    assertThat(UnicodeUtil.newString(ref.ints, ref.offset, ref.length), is("a\ud834\udd1e"));
  }

  @Test
  public void testOffsetSlice() {
    byte[] out = new byte[16];
    int length = UnicodeUtil.UTF16toUTF8("xxabc", 2, 2, out);
    assertThat(length, is(2));
    assertThat(new String(out, 0, length, StandardCharsets.UTF_8), is("ab"));
  }
}
