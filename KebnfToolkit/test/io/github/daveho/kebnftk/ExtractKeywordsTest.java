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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class ExtractKeywordsTest {
	private static Grammar prepare(String text) {
		Grammar g = ConvertKebnfToGrammar.parse("test", text);
		new ClassifyRules(g).execute();
		return g;
	}

	private static List<String> labels(Grammar g) {
		List<String> result = new ArrayList<String>();
		for (Alternative alt : g.getRule(KeywordSet.RULE_NAME).getAlternatives())
			result.add(alt.getLabel());
		return result;
	}

	@Test
	public void testLiteralsReplaced() throws Exception {
		Grammar g = prepare("Decl = 'do' Body | 'double' Body\nBody = '{' '}'\n");
		assertEquals(4, new ExtractKeywords(g).execute());
		assertEquals("DO Body", g.getRule("Decl").getAlternatives().get(0).toString());
		assertEquals("DOUBLE Body", g.getRule("Decl").getAlternatives().get(1).toString());
		assertEquals("LBRACE RBRACE", g.getRule("Body").getAlternatives().get(0).toString());
	}

	@Test
	public void testKeywordRuleOrder() throws Exception {
		Grammar g = prepare("Decl = 'do' Body | 'double' Body\nBody = '{' '}'\n");
		new ExtractKeywords(g).execute();
		Rule keywords = g.getRules().iterator().next();
		assertEquals(KeywordSet.RULE_NAME, keywords.getName());
		assertTrue(keywords.isLexical());
		assertEquals("[DOUBLE, DO, LBRACE, RBRACE]", labels(g).toString());
		assertEquals("'double'", keywords.getAlternatives().get(0).toString());
	}

	@Test
	public void testIdempotent() throws Exception {
		Grammar g = prepare("Decl = 'do' ( ',' Decl )* | 'x'?\n");
		new ExtractKeywords(g).execute();
		String before = g.getRule("Decl").toString();
		int keywords = g.getKeywordSet().size();
		assertEquals(0, new ExtractKeywords(g).execute());
		assertEquals(before, g.getRule("Decl").toString());
		assertEquals(keywords, g.getKeywordSet().size());
	}

	@Test
	public void testNestedLiterals() throws Exception {
		Grammar g = prepare("A = ( 'x' | 'y' )? 'z'*\n");
		assertEquals(3, new ExtractKeywords(g).execute());
		assertEquals("( X | Y )? Z*", g.getRule("A").getAlternatives().get(0).toString());
	}

	@Test
	public void testCollisionWithRuleName() throws Exception {
		Grammar g = prepare("Package = 'package' PACKAGE 'eof'\nPACKAGE = [a-z]+\n");
		new ExtractKeywords(g).execute();
		assertEquals("PACKAGE_KW PACKAGE EOF_KW", g.getRule("Package").getAlternatives().get(0).toString());
		assertEquals("package", g.getKeywordSet().getText("PACKAGE_KW"));
	}

	@Test
	public void testLexicalLiteralsKept() throws Exception {
		Grammar g = prepare("NAME = 'a'..'z' | '_'\nA = NAME\n");
		assertEquals(0, new ExtractKeywords(g).execute());
		assertEquals("'_'", g.getRule("NAME").getAlternatives().get(1).toString());
		assertNull(g.getRule(KeywordSet.RULE_NAME));
	}

	@Test
	public void testReservedKeywordRule() throws Exception {
		Grammar g = prepare("RESERVED_KEYWORD = 'about' | 'abstract'\nA = 'x'\n");
		new ExtractKeywords(g, Collections.singleton("RESERVED_KEYWORD")).execute();
		assertEquals("[ABSTRACT, ABOUT, X]", labels(g).toString());
		assertEquals("'about'", g.getRule("RESERVED_KEYWORD").getAlternatives().get(0).toString());
	}

	@Test(expected = IllegalStateException.class)
	public void testUnclassifiedGrammar() throws Exception {
		Grammar g = ConvertKebnfToGrammar.parse("test", "A = 'x'\n");
		new ExtractKeywords(g).execute();
	}
}
