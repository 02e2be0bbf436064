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
import java.util.Collections;
import java.util.List;

/**
 * Result of {@link TranspileGrammar}: the generated grammars, or
 * nothing if a fatal error occurred, plus all diagnostics.
 */
public class TranspileResult {
	private final String lexerGrammar;
	private final String parserGrammar;
	private final List<Diagnostic> diagnostics;

	/**
	 * Constructor.
	 * 
	 * @param lexerGrammar  the lexer grammar text, or null on failure
	 * @param parserGrammar the parser grammar text, or null on failure
	 * @param diagnostics   the diagnostics
	 */
	public TranspileResult(String lexerGrammar, String parserGrammar, List<Diagnostic> diagnostics) {
		this.lexerGrammar = lexerGrammar;
		this.parserGrammar = parserGrammar;
		this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
	}

	/**
	 * @return the lexer grammar text, or null if the conversion failed
	 */
	public String getLexerGrammar() {
		return lexerGrammar;
	}

	/**
	 * @return the parser grammar text, or null if the conversion failed
	 */
	public String getParserGrammar() {
		return parserGrammar;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	public List<Diagnostic> getWarnings() {
		List<Diagnostic> result = new ArrayList<Diagnostic>();
		for (Diagnostic d : diagnostics)
			if (d.getSeverity() == Severity.WARNING)
				result.add(d);
		return result;
	}

	/**
	 * @return the fatal diagnostic, or null if the conversion succeeded
	 */
	public Diagnostic getFatal() {
		for (Diagnostic d : diagnostics)
			if (d.isFatal())
				return d;
		return null;
	}

	public boolean isSuccess() {
		return getFatal() == null;
	}

	/**
	 * @return process exit status: 0 on success, 1 on failure
	 */
	public int getStatus() {
		return isSuccess() ? 0 : 1;
	}
}
