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
 * Collects {@link Diagnostic}s produced during one conversion.
 */
public class Diagnostics {
	private static final boolean DEBUG = Boolean.getBoolean("kebnftk.debug");

	private final List<Diagnostic> diagnostics;

	public Diagnostics() {
		this.diagnostics = new ArrayList<Diagnostic>();
	}

	/**
	 * Record a warning.
	 * 
	 * @param ruleName the rule the warning is about, or null
	 * @param span     the source position, or null
	 * @param message  the message
	 */
	public void warning(String ruleName, SourceSpan span, String message) {
		Diagnostic warning = new Diagnostic(Severity.WARNING, ruleName, span, message);
		// re-applied patches report the same mismatch again
		for (Diagnostic d : diagnostics)
			if (d.toString().equals(warning.toString()))
				return;
		add(warning);
	}

	public void add(Diagnostic diagnostic) {
		if (DEBUG)
			System.err.println(diagnostic);
		diagnostics.add(diagnostic);
	}

	/**
	 * @return all diagnostics, in the order they were recorded
	 */
	public List<Diagnostic> getDiagnostics() {
		return Collections.unmodifiableList(diagnostics);
	}

	/**
	 * @return the warnings
	 */
	public List<Diagnostic> getWarnings() {
		List<Diagnostic> result = new ArrayList<Diagnostic>();
		for (Diagnostic d : diagnostics)
			if (!d.isFatal())
				result.add(d);
		return result;
	}

	public boolean hasFatal() {
		for (Diagnostic d : diagnostics)
			if (d.isFatal())
				return true;
		return false;
	}
}
