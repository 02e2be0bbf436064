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
 * A warning or fatal error found while converting a grammar.
 */
public class Diagnostic {
	private final Severity severity;
	private final String ruleName;
	private final SourceSpan span;
	private final String message;

	/**
	 * Constructor.
	 * 
	 * @param severity the severity
	 * @param ruleName the rule the diagnostic is about, or null
	 * @param span     the source position, or null
	 * @param message  the message
	 */
	public Diagnostic(Severity severity, String ruleName, SourceSpan span, String message) {
		this.severity = severity;
		this.ruleName = ruleName;
		this.span = span;
		this.message = message;
	}

	public Severity getSeverity() {
		return severity;
	}

	public String getRuleName() {
		return ruleName;
	}

	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * @return the line number, or 0 if unknown
	 */
	public int getLine() {
		return span != null ? span.getLine() : 0;
	}

	/**
	 * @return the column number, or 0 if unknown
	 */
	public int getColumn() {
		return span != null ? span.getColumn() : 0;
	}

	public String getMessage() {
		return message;
	}

	public boolean isFatal() {
		return severity == Severity.FATAL;
	}

	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder();
		if (span != null)
			buf.append(span).append(": ");
		buf.append(severity == Severity.FATAL ? "error: " : "warning: ");
		if (ruleName != null)
			buf.append("rule ").append(ruleName).append(": ");
		buf.append(message);
		return buf.toString();
	}
}
