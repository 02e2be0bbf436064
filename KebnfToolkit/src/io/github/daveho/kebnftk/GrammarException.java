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

/**
 * Base class of exceptions reporting a problem with an input grammar.
 * Converted to a fatal {@link Diagnostic} at the pipeline boundary.
 */
public class GrammarException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	private final String ruleName;
	private final SourceSpan span;

	/**
	 * Constructor.
	 * 
	 * @param ruleName the rule the problem is about, or null
	 * @param span     the source position, or null
	 * @param message  the message
	 */
	public GrammarException(String ruleName, SourceSpan span, String message) {
		super(message);
		this.ruleName = ruleName;
		this.span = span;
	}

	public String getRuleName() {
		return ruleName;
	}

	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * @return a fatal diagnostic describing this exception
	 */
	public Diagnostic toDiagnostic() {
		return new Diagnostic(Severity.FATAL, ruleName, span, getMessage());
	}

	@Override
	public String toString() {
		return toDiagnostic().toString();
	}
}
