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
 * An element of an {@link Alternative}.
 * Terms are a tagged variant: {@link #getType()} identifies
 * which subclass a term is. All terms support deep copying and
 * structural equality, so that rewrites can match and replace
 * grammar fragments by shape.
 */
public abstract class Term {
	private final TermType type;

	/**
	 * Constructor.
	 * 
	 * @param type the variant tag
	 */
	protected Term(TermType type) {
		this.type = type;
	}

	/**
	 * @return the variant tag of this term
	 */
	public TermType getType() {
		return type;
	}

	/**
	 * Return a deep copy of this term.
	 * 
	 * @return the copy
	 */
	public abstract Term copy();

	/**
	 * Check whether this term is a reference to the named rule or token.
	 * 
	 * @param name a rule or token name
	 * @return true if this term is a {@link RuleReference} to the name
	 */
	public boolean isReferenceTo(String name) {
		return false;
	}
}
