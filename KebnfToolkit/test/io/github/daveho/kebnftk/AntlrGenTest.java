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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AntlrGenTest {
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private File write(String name, String text) throws IOException {
		File file = new File(tmp.getRoot(), name);
		Files.write(file.toPath(), text.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	private static String read(File file) throws IOException {
		return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
	}

	@Test
	public void testGenerate() throws Exception {
		File source = write("model.kebnf", "Model = Item*\nItem = 'item' NAME ';'\nNAME = [a-z]+\n");
		File out = new File(tmp.getRoot(), "out");
		int status = new AntlrGen().execute(new String[] { "--name", "Model", out.getPath(), source.getPath() });
		assertEquals(0, status);
		String lexer = read(new File(out, "ModelLexer.g4"));
		String parser = read(new File(out, "ModelParser.g4"));
		assertTrue(lexer.contains("lexer grammar ModelLexer;"));
		assertTrue(lexer.contains("from: model.kebnf\n"));
		assertTrue(parser.contains("parser grammar ModelParser;"));
		assertTrue(parser.contains("tokenVocab = ModelLexer;"));
	}

	@Test
	public void testLexicalOverride() throws Exception {
		File source = write("model.kebnf", "Model = Item*\nItem = 'item' NAME\nNAME = [a-z]+\n");
		File lexical = write("lexical.kebnf", "NAME = [a-zA-Z]+\n");
		File out = new File(tmp.getRoot(), "out");
		int status = new AntlrGen().execute(new String[] {
				"--lexical", lexical.getPath(), "--root", "Item", out.getPath(), source.getPath() });
		assertEquals(0, status);
		String lexer = read(new File(out, "GrammarLexer.g4"));
		assertTrue(lexer.contains("\nNAME\n    : [A-Za-z]+\n    ;\n"));
		assertTrue(read(new File(out, "GrammarParser.g4")).contains("\nroot\n    : item EOF\n"));
	}

	@Test
	public void testStrictFailure() throws Exception {
		File source = write("model.kebnf", "Model = 'x'\n");
		File out = new File(tmp.getRoot(), "out");
		assertEquals(1, new AntlrGen().execute(new String[] { "--strict", out.getPath(), source.getPath() }));
		assertFalse(out.exists());
	}

	@Test
	public void testSyntaxErrorFailure() throws Exception {
		File source = write("model.kebnf", "Model = ( 'x'\n");
		File out = new File(tmp.getRoot(), "out");
		assertEquals(1, new AntlrGen().execute(new String[] { out.getPath(), source.getPath() }));
		assertFalse(out.exists());
	}

	@Test
	public void testUsage() throws Exception {
		assertEquals(1, new AntlrGen().execute(new String[0]));
		assertEquals(1, new AntlrGen().execute(new String[] { "out" }));
		assertEquals(1, new AntlrGen().execute(new String[] { "--bogus", "out", "a.kebnf" }));
		assertEquals(1, new AntlrGen().execute(new String[] { "out", "a.kebnf", "--name" }));
	}
}
