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
 * A named KEBNF source text.
 */
public class GrammarSource {
	private final String name;
	private final String text;
	private final boolean override;

	/**
	 * Constructor.
	 * 
	 * @param name the source name, used in diagnostics
	 * @param text the KEBNF text
	 */
	public GrammarSource(String name, String text) {
		this(name, text, false);
	}

	/**
	 * Constructor.
	 * 
	 * @param name     the source name, used in diagnostics
	 * @param text     the KEBNF text
	 * @param override if true, rules in this source replace earlier rules
	 *                 of the same name rather than extending them
	 */
	public GrammarSource(String name, String text, boolean override) {
		this.name = name;
		this.text = text;
		this.override = override;
	}

	public String getName() {
		return name;
	}

	public String getText() {
		return text;
	}

	public boolean isOverride() {
		return override;
	}
}
