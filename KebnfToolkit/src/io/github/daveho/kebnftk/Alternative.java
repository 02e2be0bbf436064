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
 * One alternative of a {@link Rule} or {@link Group}: an ordered
 * sequence of {@link Term}s. An alternative with no terms matches
 * the empty string.
 */
public class Alternative {
	private final List<Term> terms;
	private String label;

	/**
	 * Constructor: an empty alternative.
	 */
	public Alternative() {
		this.terms = new ArrayList<Term>();
	}

	/**
	 * Constructor.
	 * 
	 * @param terms the terms (the list is copied, the terms are not)
	 */
	public Alternative(List<Term> terms) {
		this.terms = new ArrayList<Term>(terms);
	}

	/**
	 * Convenience factory.
	 * 
	 * @param terms the terms
	 * @return an alternative containing the terms
	 */
	public static Alternative of(Term... terms) {
		Alternative alt = new Alternative();
		for (Term t : terms)
			alt.add(t);
		return alt;
	}

	public void add(Term term) {
		terms.add(term);
	}

	/**
	 * @return the mutable list of terms
	 */
	public List<Term> getTerms() {
		return terms;
	}

	public boolean isEmpty() {
		return terms.isEmpty();
	}

	public int size() {
		return terms.size();
	}

	public Term get(int index) {
		return terms.get(index);
	}

	/**
	 * @return the label (keyword token name), or null
	 */
	public String getLabel() {
		return label;
	}

	public void setLabel(String label) {
		this.label = label;
	}

	/**
	 * @return true if this alternative is exactly one reference to the named rule
	 */
	public boolean isSingleReferenceTo(String name) {
		return terms.size() == 1 && terms.get(0).isReferenceTo(name);
	}

	/**
	 * Return a deep copy.
	 * 
	 * @return the copy
	 */
	public Alternative copy() {
		Alternative dup = new Alternative();
		for (Term t : terms)
			dup.terms.add(t.copy());
		dup.label = label;
		return dup;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Alternative))
			return false;
		Alternative other = (Alternative) obj;
		return terms.equals(other.terms)
				&& (label == null ? other.label == null : label.equals(other.label));
	}

	@Override
	public int hashCode() {
		return terms.hashCode();
	}

	@Override
	public String toString() {
		if (terms.isEmpty())
			return "/* epsilon */";
		StringBuilder buf = new StringBuilder();
		for (Term t : terms) {
			if (buf.length() > 0)
				buf.append(' ');
			buf.append(t);
		}
		return buf.toString();
	}
}
