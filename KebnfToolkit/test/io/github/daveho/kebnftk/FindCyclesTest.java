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

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FindCyclesTest {
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@Test
	public void testReportsCycles() throws Exception {
		File source = tmp.newFile("cycles.kebnf");
		Files.write(source.toPath(), "E = E '+' T | T\nT = A\nA = T 'x' | 'y'\n".getBytes(StandardCharsets.UTF_8));
		assertEquals(0, new FindCycles().execute(new String[] { source.getPath() }));
	}

	@Test
	public void testSyntaxError() throws Exception {
		File source = tmp.newFile("bad.kebnf");
		Files.write(source.toPath(), "E = ( T\n".getBytes(StandardCharsets.UTF_8));
		assertEquals(1, new FindCycles().execute(new String[] { source.getPath() }));
	}

	@Test
	public void testUsage() throws Exception {
		assertEquals(1, new FindCycles().execute(new String[0]));
	}
}
