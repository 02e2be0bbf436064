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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class ClassifyRulesTest {
	private static Grammar classify(String text) {
		Grammar g = ConvertKebnfToGrammar.parse("test", text);
		new ClassifyRules(g).execute();
		return g;
	}

	@Test
	public void testLexicalNames() throws Exception {
		assertTrue(ClassifyRules.isLexicalName("NAME"));
		assertTrue(ClassifyRules.isLexicalName("STRING_VALUE"));
		assertTrue(ClassifyRules.isLexicalName("X1"));
		assertFalse(ClassifyRules.isLexicalName("E"));
		assertFalse(ClassifyRules.isLexicalName("Name"));
		assertFalse(ClassifyRules.isLexicalName("OwnedExpression"));
	}

	@Test
	public void testClassification() throws Exception {
		Grammar g = classify(
				"Package = 'package' NAME\n" +
				"NAME = [a-z]+\n" +
				"Visibility = 'public' | 'private'\n" +
				"Digit = '0'..'9'\n");
		assertEquals(RuleKind.SYNTACTIC, g.getRule("Package").getKind());
		assertEquals(RuleKind.LEXICAL, g.getRule("NAME").getKind());
		assertEquals(RuleKind.SYNTACTIC, g.getRule("Visibility").getKind());
		assertEquals(RuleKind.LEXICAL, g.getRule("Digit").getKind());
	}

	@Test
	public void testEmptyLexicalRule() throws Exception {
		Grammar g = classify("NAME = any letters\n");
		assertTrue(g.getRule("NAME").isLexical());
		assertFalse(g.isDefined("NAME"));
	}

	@Test
	public void testClassificationIsStable() throws Exception {
		Grammar g = classify("A = B\nB = C 'x'\nC = [a-z]\n");
		new ClassifyRules(g).execute();
		assertEquals(RuleKind.SYNTACTIC, g.getRule("A").getKind());
		assertEquals(RuleKind.SYNTACTIC, g.getRule("B").getKind());
		assertEquals(RuleKind.LEXICAL, g.getRule("C").getKind());
	}

	@Test(expected = MixedRuleException.class)
	public void testLexicalNameReferencesSyntacticRule() throws Exception {
		classify("NAME = Package\nPackage = 'p'\n");
	}

	@Test
	public void testCharacterClassRuleReferencesSyntacticRule() throws Exception {
		try {
			classify("Word = [a-z] Package\nPackage = 'p'\n");
			fail();
		} catch (MixedRuleException e) {
			assertEquals("Word", e.getRuleName());
			assertTrue(e.getMessage().contains("Package"));
		}
	}
}
