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

import java.util.ArrayList;
import java.util.List;

/**
 * Convert KEBNF sources to ANTLR 4 lexer and parser grammars:
 * parse, classify rules, extract keywords, apply pre-transform patches,
 * remove left recursion, apply post-transform patches (removing any
 * left recursion they introduce), and generate the grammars.
 * 
 * <p>Each call to {@link #execute(List)} works on a fresh grammar,
 * so a TranspileGrammar object may be reused.</p>
 */
public class TranspileGrammar {
	private static final boolean DEBUG = Boolean.getBoolean("kebnftk.debug");

	/** Bound on post-transform patch / left-recursion removal rounds. */
	private static final int MAX_ROUNDS = 10;

	private final GrammarOptions options;

	/**
	 * Constructor.
	 * 
	 * @param options the conversion options
	 */
	public TranspileGrammar(GrammarOptions options) {
		this.options = options;
	}

	/**
	 * Convert sources to grammars. Problems with the input are reported as
	 * diagnostics in the result rather than thrown.
	 * 
	 * @param sources the KEBNF sources, in order (later sources extend earlier ones)
	 * @return the result
	 */
	public TranspileResult execute(List<GrammarSource> sources) {
		Diagnostics diagnostics = new Diagnostics();
		try {
			Grammar grammar = buildGrammar(sources, diagnostics);

			GenerateAntlrGrammar generator = new GenerateAntlrGrammar(grammar, options);
			List<String> names = new ArrayList<String>();
			for (GrammarSource source : sources)
				names.add(source.getName());
			generator.setSourceNames(names);
			String lexer = generator.generateLexerGrammar();
			String parser = generator.generateParserGrammar();
			return new TranspileResult(lexer, parser, diagnostics.getDiagnostics());
		} catch (GrammarException e) {
			diagnostics.add(e.toDiagnostic());
			return new TranspileResult(null, null, diagnostics.getDiagnostics());
		}
	}

	/**
	 * Run every stage except grammar generation.
	 * 
	 * @param sources     the KEBNF sources
	 * @param diagnostics collects warnings
	 * @return the transformed grammar
	 * @throws GrammarException if the input can't be converted
	 */
	public Grammar buildGrammar(List<GrammarSource> sources, Diagnostics diagnostics) {
		ConvertKebnfToGrammar converter = new ConvertKebnfToGrammar(diagnostics);
		for (GrammarSource source : sources)
			converter.addSource(source);
		Grammar grammar = converter.getGrammar();

		new ClassifyRules(grammar).execute();
		new ExtractKeywords(grammar, options.getReservedKeywordRules()).execute();

		ApplyPatches patches = new ApplyPatches(grammar, options.getPatchCatalog(), options.isStrict(), diagnostics);
		patches.execute(PatchPhase.PRE_TRANSFORM);
		removeLeftRecursion(grammar);

		// Post-transform patches may create new left recursion, which must be
		// removed, after which the (idempotent) patches are checked again
		int round = 0;
		for (;;) {
			patches.execute(PatchPhase.POST_TRANSFORM);
			if (removeLeftRecursion(grammar) == 0)
				break;
			if (++round >= MAX_ROUNDS)
				throw new IllegalStateException("Post-transform patches did not converge");
		}

		if (DEBUG)
			System.err.printf("%d rules, %d keywords%n", grammar.size(), grammar.getKeywordSet().size());
		return grammar;
	}

	private int removeLeftRecursion(Grammar grammar) {
		List<LeftRecursionCycle> cycles = new FindLeftRecursion(grammar).execute();
		return new ApplyPrecedenceClimbing(grammar).execute(cycles);
	}
}
