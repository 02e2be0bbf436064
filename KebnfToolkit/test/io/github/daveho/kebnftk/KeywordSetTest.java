// KebnfToolkit - Convert KEBNF grammars to ANTLR 4 grammars
// Copyright (C) 2013,2017,2026 David H. Hovemeyer <david.hovemeyer@gmail.com>
//
// Permission is hereby granted, free of charge, to any person obtaining
// a copy of this software and associated documentation files (the
// "Software"), to deal in the Software without restriction, including
// without limitation the rights to use, copy, modify, merge, publish,
// distribute, sublicense, and/or sell copies of the Software, and to
// permit persons to whom the Software is furnished to do so, subject to
// the following conditions:
// 
// The above copyright notice and this permission notice shall be included
// in all copies or substantial portions of the Software.
// 
// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
// EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
// MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT.
// IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY
// CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT,
// TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE
// SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.

package io.github.daveho.kebnftk;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

public class KeywordSetTest {
	@Test
	public void testBaseTokenNames() throws Exception {
		assertEquals("PACKAGE", KeywordSet.baseTokenName("package"));
		assertEquals("COLON_GT_GT", KeywordSet.baseTokenName(":>>"));
		assertEquals("COLON_COLON", KeywordSet.baseTokenName("::"));
		assertEquals("EQ_EQ", KeywordSet.baseTokenName("=="));
		assertEquals("STAR_STAR", KeywordSet.baseTokenName("**"));
		assertEquals("A_DOT_B", KeywordSet.baseTokenName("a.b"));
		assertEquals("T_1ST", KeywordSet.baseTokenName("1st"));
	}

	@Test
	public void testOperatorOverrides() throws Exception {
		assertEquals("ARROW", KeywordSet.baseTokenName("->"));
		assertEquals("FAT_ARROW", KeywordSet.baseTokenName("=>"));
		assertEquals("LE", KeywordSet.baseTokenName("<="));
		assertEquals("GE", KeywordSet.baseTokenName(">="));
		assertEquals("AT_SIGN", KeywordSet.baseTokenName("@"));
	}

	@Test
	public void testInternIsStable() throws Exception {
		KeywordSet ks = new KeywordSet();
		Set<String> taken = Collections.emptySet();
		assertEquals("PLUS", ks.intern("+", taken));
		assertEquals("PLUS", ks.intern("+", taken));
		assertEquals(1, ks.size());
		assertEquals("+", ks.getText("PLUS"));
		assertEquals("PLUS", ks.getTokenName("+"));
		assertTrue(ks.isTokenName("PLUS"));
		assertFalse(ks.isTokenName("MINUS"));
		assertNull(ks.getTokenName("-"));
	}

	@Test
	public void testCollisionSuffixes() throws Exception {
		KeywordSet ks = new KeywordSet();
		Set<String> taken = new HashSet<String>(Arrays.asList("PACKAGE", "PACKAGE_KW"));
		assertEquals("PACKAGE_KW2", ks.intern("package", taken));
	}

	@Test
	public void testReservedNames() throws Exception {
		KeywordSet ks = new KeywordSet();
		Set<String> taken = Collections.emptySet();
		assertEquals("EOF_KW", ks.intern("eof", taken));
		assertEquals("KEYWORDS_KW", ks.intern("keywords", taken));
	}

	@Test
	public void testDistinctTextsWithSameBaseName() throws Exception {
		KeywordSet ks = new KeywordSet();
		Set<String> taken = Collections.emptySet();
		assertEquals("ABC", ks.intern("abc", taken));
		assertEquals("ABC_KW", ks.intern("ABC", taken));
	}

	@Test
	public void testEntryOrder() throws Exception {
		KeywordSet ks = new KeywordSet();
		Set<String> taken = Collections.emptySet();
		ks.intern("do", taken);
		ks.intern("}", taken);
		ks.intern("double", taken);
		ks.intern("{", taken);
		ks.intern("as", taken);
		StringBuilder buf = new StringBuilder();
		for (KeywordSet.Entry e : ks.getEntries())
			buf.append(e.getText()).append(' ');
		assertEquals("double as do { } ", buf.toString());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyKeyword() throws Exception {
		new KeywordSet().intern("", Collections.<String>emptySet());
	}
}
