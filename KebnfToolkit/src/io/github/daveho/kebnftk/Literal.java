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
 * Literal text, e.g. a keyword or an operator.
 * In syntactic rules, literals are replaced by references to
 * keyword tokens by {@link ExtractKeywords}.
 */
public class Literal extends Term {
	private final String text;

	public Literal(String text) {
		super(TermType.LITERAL);
		this.text = text;
	}

	/**
	 * @return the literal text (escapes already decoded)
	 */
	public String getText() {
		return text;
	}

	@Override
	public Term copy() {
		return new Literal(text);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Literal))
			return false;
		return text.equals(((Literal) obj).text);
	}

	@Override
	public int hashCode() {
		return text.hashCode() * 31 + 1;
	}

	@Override
	public String toString() {
		return quote(text);
	}

	/**
	 * Quote text as a single-quoted literal, escaping quotes,
	 * backslashes and control characters.
	 * 
	 * @param text the text
	 * @return the quoted literal
	 */
	public static String quote(String text) {
		StringBuilder buf = new StringBuilder();
		buf.append('\'');
		for (int i = 0; i < text.length(); ++i) {
			char c = text.charAt(i);
			switch (c) {
			case '\'':
				buf.append("\\'");
				break;
			case '\\':
				buf.append("\\\\");
				break;
			case '\n':
				buf.append("\\n");
				break;
			case '\r':
				buf.append("\\r");
				break;
			case '\t':
				buf.append("\\t");
				break;
			case '\f':
				buf.append("\\f");
				break;
			default:
				if (c < 32 || c > 126)
					buf.append(String.format("\\u%04X", (int) c));
				else
					buf.append(c);
			}
		}
		buf.append('\'');
		return buf.toString();
	}
}
