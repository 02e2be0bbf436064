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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class TranspileGrammarTest {
	private static final String EXPRESSIONS =
			"OwnedExpression = ConditionalExpression | BinaryOperatorExpression\n" +
			"    | UnaryOperatorExpression | PrimaryExpression\n" +
			"ConditionalExpression = 'if' ArgumentMember '?' ArgumentMember 'else' ArgumentMember EmptyResultMember\n" +
			"BinaryOperatorExpression = ArgumentMember BinaryOperator ArgumentMember EmptyResultMember\n" +
			"BinaryOperator = '+' | '*' | 'or' | '**'\n" +
			"UnaryOperatorExpression = UnaryOperator ArgumentMember\n" +
			"UnaryOperator = '-' | 'not'\n" +
			"ArgumentMember = Argument\n" +
			"Argument = OwnedExpression\n" +
			"EmptyResultMember = EmptyResultParameter\n" +
			"EmptyResultParameter = { }\n" +
			"PrimaryExpression = NAME | '(' OwnedExpression ')'\n" +
			"NAME = [a-z]+\n" +
			"WHITE_SPACE = [ \\t\\r\\n]+\n";

	private GrammarOptions options;

	@Before
	public void setUp() {
		options = new GrammarOptions();
		options.setGrammarName("Test");
		options.setStrict(false);
	}

	private TranspileResult transpile(String text) {
		return new TranspileGrammar(options).execute(Collections.singletonList(new GrammarSource("test.kebnf", text)));
	}

	@Test
	public void testOperatorPrecedence() throws Exception {
		options.setPatchCatalog(Collections.<Patch>emptyList());
		TranspileResult result = transpile("Expr = Expr '*' Expr | Expr '+' Expr | NUM\nNUM = [0-9]+\n");
		assertTrue(result.isSuccess());
		assertEquals(0, result.getStatus());
		assertTrue(result.getParserGrammar().contains("\nexpr\n    : expr STAR expr\n    | expr PLUS expr\n    | NUM\n    ;\n"));
	}

	@Test
	public void testOwnedExpressionEndToEnd() throws Exception {
		TranspileResult result = transpile(EXPRESSIONS);
		assertTrue(result.isSuccess());
		String parser = result.getParserGrammar();
		assertTrue(parser.contains("\nroot\n    : ownedExpression EOF\n    ;\n"));
		assertTrue(parser.contains("\nownedExpression\n" +
				"    : ( MINUS | NOT ) ownedExpression\n" +
				"    | <assoc=right> ownedExpression STAR_STAR ownedExpression\n" +
				"    | ownedExpression STAR ownedExpression\n" +
				"    | ownedExpression PLUS ownedExpression\n" +
				"    | ownedExpression OR ownedExpression\n" +
				"    | IF ownedExpression QUESTION ownedExpression ELSE ownedExpression\n" +
				"    | primaryExpression\n" +
				"    ;\n"));
		assertFalse(parser.contains("binaryOperatorExpression"));
		assertFalse(parser.contains("argumentMember"));

		// patches with no counterpart in this grammar only warn
		boolean mismatchWarning = false;
		for (Diagnostic d : result.getWarnings())
			if (d.getMessage().contains("flow-end"))
				mismatchWarning = true;
		assertTrue(mismatchWarning);
	}

	@Test
	public void testDeterministic() throws Exception {
		TranspileResult first = transpile(EXPRESSIONS);
		TranspileResult second = transpile(EXPRESSIONS);
		assertEquals(first.getLexerGrammar(), second.getLexerGrammar());
		assertEquals(first.getParserGrammar(), second.getParserGrammar());
	}

	@Test
	public void testStrictModeFailsOnMismatch() throws Exception {
		options.setStrict(true);
		TranspileResult result = transpile(EXPRESSIONS);
		assertFalse(result.isSuccess());
		assertEquals(1, result.getStatus());
		assertNull(result.getLexerGrammar());
		assertNull(result.getParserGrammar());
		assertTrue(result.getFatal().getMessage().contains("filter-package-import"));
	}

	@Test
	public void testIndirectRecursionIsFatal() throws Exception {
		options.setPatchCatalog(Collections.<Patch>emptyList());
		TranspileResult result = transpile("A = B 'x' | 'y'\nB = A 'z'\n");
		assertFalse(result.isSuccess());
		Diagnostic fatal = result.getFatal();
		assertEquals(Severity.FATAL, fatal.getSeverity());
		assertEquals("A", fatal.getRuleName());
		assertEquals(1, fatal.getLine());
	}

	@Test
	public void testSyntaxErrorIsFatal() throws Exception {
		TranspileResult result = transpile("A = 'x'\nB = ( 'y' ;\n");
		assertFalse(result.isSuccess());
		assertEquals(2, result.getFatal().getLine());
		assertEquals("test.kebnf", result.getFatal().getSpan().getSourceName());
	}

	@Test
	public void testMultipleSources() throws Exception {
		options.setPatchCatalog(Collections.<Patch>emptyList());
		List<GrammarSource> sources = Arrays.asList(
				new GrammarSource("syntax.kebnf", "Model = Item*\nItem = 'item' NAME\nNAME = letters\n"),
				new GrammarSource("lexical.kebnf", "NAME = [a-z]+\n"));
		TranspileResult result = new TranspileGrammar(options).execute(sources);
		assertTrue(result.isSuccess());
		assertTrue(result.getLexerGrammar().contains("from: syntax.kebnf, lexical.kebnf\n"));
		assertTrue(result.getLexerGrammar().contains("\nNAME\n    : [a-z]+\n    ;\n"));
	}

	@Test
	public void testOutputIsNotKebnf() throws Exception {
		options.setPatchCatalog(Collections.<Patch>emptyList());
		TranspileResult result = transpile("Model = Item*\nItem = 'item' NAME\nNAME = [a-z]+\n");
		assertTrue(result.isSuccess());
		for (String output : new String[] { result.getLexerGrammar(), result.getParserGrammar() }) {
			try {
				ConvertKebnfToGrammar.parse("output.g4", output);
				fail();
			} catch (GrammarSyntaxException e) {
				assertNotNull(e.getMessage());
			}
		}
	}

	@Test
	public void testReusable() throws Exception {
		options.setPatchCatalog(Collections.<Patch>emptyList());
		TranspileGrammar transpiler = new TranspileGrammar(options);
		List<GrammarSource> sources = Collections.singletonList(new GrammarSource("a", "A = 'x'\n"));
		assertEquals(transpiler.execute(sources).getParserGrammar(), transpiler.execute(sources).getParserGrammar());
	}
}
