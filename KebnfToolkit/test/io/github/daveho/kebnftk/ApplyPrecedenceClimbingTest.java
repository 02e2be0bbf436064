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

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class ApplyPrecedenceClimbingTest {
	private static Grammar prepare(String text) {
		Grammar g = ConvertKebnfToGrammar.parse("test", text);
		new ClassifyRules(g).execute();
		new ExtractKeywords(g).execute();
		return g;
	}

	private static Grammar transform(String text) {
		Grammar g = prepare(text);
		new ApplyPrecedenceClimbing(g).execute(new FindLeftRecursion(g).execute());
		return g;
	}

	private static PrecedenceMarker marker(Grammar g, String ruleName, int index) {
		return (PrecedenceMarker) g.getRule(ruleName).getAlternatives().get(index).get(0);
	}

	private static List<String> alternatives(Grammar g, String ruleName) {
		List<String> result = new ArrayList<String>();
		for (Alternative alt : g.getRule(ruleName).getAlternatives())
			result.add(alt.toString());
		return result;
	}

	@Test
	public void testFirstAlternativeBindsTightest() throws Exception {
		Grammar g = transform("Expr = Expr '*' Expr | Expr '+' Expr | Atom\nAtom = 'n'\n");
		List<Alternative> alts = g.getRule("Expr").getAlternatives();
		assertEquals(3, alts.size());
		assertTrue(alts.get(0).get(2).isReferenceTo("STAR"));
		assertTrue(alts.get(1).get(2).isReferenceTo("PLUS"));
		assertTrue(alts.get(2).isSingleReferenceTo("Atom"));
		assertTrue(marker(g, "Expr", 0).getLevel() > marker(g, "Expr", 1).getLevel());
		assertEquals(Associativity.LEFT, marker(g, "Expr", 0).getAssociativity());
		assertEquals(Associativity.LEFT, marker(g, "Expr", 1).getAssociativity());
	}

	@Test
	public void testRightAssociativeOperators() throws Exception {
		Grammar g = transform("Expr = Expr '**' Expr | Expr '+' Expr | Expr '?' Expr ':' Expr | 'n'\n");
		assertEquals(Associativity.RIGHT, marker(g, "Expr", 0).getAssociativity());
		assertEquals(Associativity.LEFT, marker(g, "Expr", 1).getAssociativity());
		assertEquals(Associativity.RIGHT, marker(g, "Expr", 2).getAssociativity());
	}

	@Test
	public void testOperatorGroupAssociativity() throws Exception {
		Grammar g = transform("Expr = Expr ( '=' | ':=' ) Expr | Expr ( '+' | '=' ) Expr | 'n'\n");
		assertEquals(Associativity.RIGHT, marker(g, "Expr", 0).getAssociativity());
		assertEquals(Associativity.LEFT, marker(g, "Expr", 1).getAssociativity());
	}

	@Test
	public void testPrefixAndSuffixOperators() throws Exception {
		Grammar g = transform("Expr = '-' Expr | Expr '!' | Expr '+' Expr | 'n'\n");
		assertEquals(3, marker(g, "Expr", 0).getLevel());
		assertEquals(Associativity.NONE, marker(g, "Expr", 0).getAssociativity());
		assertEquals(2, marker(g, "Expr", 1).getLevel());
		assertEquals(Associativity.NONE, marker(g, "Expr", 1).getAssociativity());
		assertEquals(1, marker(g, "Expr", 2).getLevel());
		assertEquals("N", alternatives(g, "Expr").get(3));
	}

	@Test
	public void testPrimariesMovedLast() throws Exception {
		Grammar g = transform("Expr = 'n' | '(' Expr ')' | Expr '+' Expr\n");
		List<String> alts = alternatives(g, "Expr");
		assertEquals(3, alts.size());
		assertEquals("<prec=1,left> Expr PLUS Expr", alts.get(0));
		assertEquals("N", alts.get(1));
		assertEquals("LPAREN Expr RPAREN", alts.get(2));
	}

	@Test
	public void testAlreadyTransformedRuleIsSkipped() throws Exception {
		Grammar g = transform("Expr = Expr '+' Expr | 'n'\n");
		List<String> before = alternatives(g, "Expr");
		ApplyPrecedenceClimbing climbing = new ApplyPrecedenceClimbing(g);
		assertFalse(climbing.transform(g.getRule("Expr")));
		assertEquals(0, climbing.execute(new FindLeftRecursion(g).execute()));
		assertEquals(before, alternatives(g, "Expr"));
	}

	@Test
	public void testTransformedRuleStillDirectlyRecursive() throws Exception {
		Grammar g = transform("Expr = Expr '+' Expr | 'n'\n");
		List<LeftRecursionCycle> cycles = new FindLeftRecursion(g).execute();
		assertEquals(1, cycles.size());
		assertTrue(cycles.get(0).isDirect());
	}

	@Test
	public void testIndirectRecursionRejected() throws Exception {
		try {
			transform("A = B 'x' | 'y'\nB = A 'z'\n");
			fail();
		} catch (UnresolvedIndirectRecursionException e) {
			assertEquals("A", e.getRuleName());
			assertTrue(e.getMessage().contains("A -> B -> A"));
		}
	}

	@Test(expected = UnsupportedRecursionShapeException.class)
	public void testHiddenLeftRecursion() throws Exception {
		transform("Expr = ( Expr '+' ) 'x' | 'n'\n");
	}

	@Test(expected = UnsupportedRecursionShapeException.class)
	public void testNoPrimaryAlternative() throws Exception {
		transform("Expr = Expr '+' Expr\n");
	}

	@Test(expected = UnsupportedRecursionShapeException.class)
	public void testAdjacentOperands() throws Exception {
		transform("Expr = Expr Expr | 'n'\n");
	}

	@Test(expected = UnsupportedRecursionShapeException.class)
	public void testRuleDerivingItself() throws Exception {
		transform("Expr = Expr | 'n'\n");
	}

	@Test(expected = UnsupportedRecursionShapeException.class)
	public void testLexicalRecursion() throws Exception {
		transform("DIGITS = DIGITS [0-9] | [0-9]\n");
	}
}
