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

import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

public class GenerateAntlrGrammarTest {
	private static final String MODEL =
			"Model = Element*\n" +
			"Element = 'package' NAME '{' Element* '}' | 'part' NAME ';'\n" +
			"NAME = LETTER ( LETTER | DIGIT )*\n" +
			"LETTER = [a-zA-Z_]\n" +
			"DIGIT = '0'..'9'\n" +
			"WHITE_SPACE = [ \\t\\r\\n]+\n";

	private GrammarOptions options;

	@Before
	public void setUp() {
		options = new GrammarOptions();
		options.setGrammarName("Test");
		options.setPatchCatalog(Collections.<Patch>emptyList());
	}

	private GenerateAntlrGrammar generator(String text) {
		Grammar g = new TranspileGrammar(options).buildGrammar(
				Collections.singletonList(new GrammarSource("test.kebnf", text)), new Diagnostics());
		GenerateAntlrGrammar generator = new GenerateAntlrGrammar(g, options);
		generator.setSourceNames(Collections.singletonList("test.kebnf"));
		return generator;
	}

	@Test
	public void testParserRuleNames() throws Exception {
		assertEquals("ownedExpression", GenerateAntlrGrammar.toParserRuleName("OwnedExpression"));
		assertEquals("importRule", GenerateAntlrGrammar.toParserRuleName("Import"));
		assertEquals("fragmentRule", GenerateAntlrGrammar.toParserRuleName("Fragment"));
		assertEquals("a", GenerateAntlrGrammar.toParserRuleName("A"));
	}

	@Test
	public void testLexerGrammar() throws Exception {
		String lexer = generator(MODEL).generateLexerGrammar();
		assertTrue(lexer.startsWith("/*\n * TestLexer\n * Generated by KebnfToolkit from: test.kebnf\n"));
		assertTrue(lexer.contains("\nlexer grammar TestLexer;\n"));
		assertTrue(lexer.contains("\n// Keywords and operators\nPACKAGE : 'package' ;\nPART : 'part' ;\n"
				+ "SEMI : ';' ;\nLBRACE : '{' ;\nRBRACE : '}' ;\n"));
		assertTrue(lexer.contains("\nNAME\n    : LETTER ( LETTER | DIGIT )*\n    ;\n"));
		assertTrue(lexer.contains("\nfragment LETTER\n    : [A-Z_a-z]\n    ;\n"));
		assertTrue(lexer.contains("\nfragment DIGIT\n    : [0-9]\n    ;\n"));
		assertTrue(lexer.contains("\nWHITE_SPACE\n    : [\\t\\n\\r ]+ -> skip\n    ;\n"));
		assertFalse(lexer.contains("fragment NAME"));
		assertFalse(lexer.contains("\r"));
	}

	@Test
	public void testKeywordsPrecedeLexicalRules() throws Exception {
		String lexer = generator(MODEL).generateLexerGrammar();
		assertTrue(lexer.indexOf("PACKAGE :") < lexer.indexOf("\nNAME\n"));
		assertTrue(lexer.indexOf("PACKAGE :") < lexer.indexOf("PART :"));
	}

	@Test
	public void testParserGrammar() throws Exception {
		String parser = generator(MODEL).generateParserGrammar();
		assertTrue(parser.startsWith("/*\n * TestParser\n"));
		assertTrue(parser.contains("\nparser grammar TestParser;\n\noptions {\n    tokenVocab = TestLexer;\n}\n"));
		assertTrue(parser.contains("\nroot\n    : model EOF\n    ;\n"));
		assertTrue(parser.contains("\nmodel\n    : element*\n    ;\n"));
		assertTrue(parser.contains("\nelement\n    : PACKAGE NAME LBRACE element* RBRACE\n    | PART NAME SEMI\n    ;\n"));
		assertFalse(parser.contains("LETTER"));
	}

	@Test
	public void testRootRuleOption() throws Exception {
		options.setRootRule("Element");
		String parser = generator(MODEL).generateParserGrammar();
		assertTrue(parser.contains("\nroot\n    : element EOF\n    ;\n"));
	}

	@Test
	public void testInvalidRootRule() throws Exception {
		options.setRootRule("NAME");
		try {
			generator(MODEL).generateParserGrammar();
			fail();
		} catch (UnresolvedReferenceException e) {
			assertEquals("NAME", e.getRuleName());
		}
	}

	@Test
	public void testRootMarkerCollision() throws Exception {
		String parser = generator("Root = 'x'\n").generateParserGrammar();
		assertTrue(parser.contains("\nrootRule\n    : root EOF\n    ;\n"));
		assertTrue(parser.contains("\nroot\n    : X\n    ;\n"));
	}

	@Test
	public void testReservedRuleName() throws Exception {
		String parser = generator("Model = Import*\nImport = 'import' NAME\nNAME = [a-z]+\n").generateParserGrammar();
		assertTrue(parser.contains("\nmodel\n    : importRule*\n    ;\n"));
		assertTrue(parser.contains("\nimportRule\n    : IMPORT NAME\n    ;\n"));
	}

	@Test
	public void testEpsilonAlternative() throws Exception {
		String parser = generator("A = B |\nB = 'b'\n").generateParserGrammar();
		assertTrue(parser.contains("\na\n    : b\n    | /* epsilon */\n    ;\n"));
	}

	@Test
	public void testPrecedenceAlternatives() throws Exception {
		String parser = generator("Expr = Expr '^' Expr | Expr '+' Expr | NUM\nNUM = [0-9]+\n").generateParserGrammar();
		assertTrue(parser.contains("\nexpr\n    : <assoc=right> expr CARET expr\n    | expr PLUS expr\n    | NUM\n    ;\n"));
	}

	@Test
	public void testMultipleSkipAlternatives() throws Exception {
		String lexer = generator("A = NAME\nNAME = [a-z]+\nWHITE_SPACE = ' ' | '\\t'\n").generateLexerGrammar();
		assertTrue(lexer.contains("\nWHITE_SPACE\n    : ( ' ' | '\\t' ) -> skip\n    ;\n"));
	}

	@Test
	public void testEmptyLexicalRuleOmitted() throws Exception {
		String lexer = generator("A = NAME\nNAME = [a-z]+\nUNUSED = described elsewhere\n").generateLexerGrammar();
		assertFalse(lexer.contains("UNUSED"));
	}

	@Test
	public void testUndefinedReference() throws Exception {
		try {
			generator("A = Missing 'x'\n").generateParserGrammar();
			fail();
		} catch (UnresolvedReferenceException e) {
			assertEquals("A", e.getRuleName());
			assertTrue(e.getMessage().contains("Missing"));
		}
	}

	@Test(expected = UnresolvedReferenceException.class)
	public void testReferenceToEmptyLexicalRule() throws Exception {
		generator("A = NAME\nNAME = some letters\n").checkReferences();
	}

	@Test(expected = UnresolvedReferenceException.class)
	public void testNoSyntacticRules() throws Exception {
		generator("NAME = [a-z]+\n").generateParserGrammar();
	}
}
