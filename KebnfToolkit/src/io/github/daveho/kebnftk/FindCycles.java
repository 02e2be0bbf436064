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

import java.io.IOException;
import java.util.List;

/**
 * Report the left-recursion cycles of KEBNF grammars, before any
 * patches or transformations are applied.
 */
public class FindCycles {
	public int execute(String[] args) throws IOException {
		if (args.length < 1) {
			System.err.println("Usage: java -jar kebnftk.jar cycles <source.kebnf>...");
			return 1;
		}

		Diagnostics diagnostics = new Diagnostics();
		ConvertKebnfToGrammar converter = new ConvertKebnfToGrammar(diagnostics);
		List<LeftRecursionCycle> cycles;
		try {
			for (String file : args)
				converter.addSource(AntlrGen.readSource(file, false));
			Grammar grammar = converter.getGrammar();
			new ClassifyRules(grammar).execute();
			cycles = new FindLeftRecursion(grammar).execute();
			System.out.printf("Total rules: %d%n", grammar.size());
		} catch (GrammarException e) {
			System.err.println(e);
			return 1;
		}

		int direct = 0;
		for (LeftRecursionCycle cycle : cycles)
			if (cycle.isDirect())
				++direct;
		System.out.printf("Found %d cycles (%d direct, %d indirect)%n", cycles.size(), direct, cycles.size() - direct);
		for (LeftRecursionCycle cycle : cycles)
			System.out.printf("  %s: %s%n", cycle.isDirect() ? "direct" : "indirect", cycle);
		return 0;
	}

	public static void main(String[] args) throws Exception {
		FindCycles findCycles = new FindCycles();
		System.exit(findCycles.execute(args));
	}
}
