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
 * Parenthesized group of alternatives.
 */
public class Group extends Term {
	private final List<Alternative> alternatives;

	public Group() {
		super(TermType.GROUP);
		this.alternatives = new ArrayList<Alternative>();
	}

	/**
	 * Convenience factory.
	 * 
	 * @param alternatives the alternatives
	 * @return a group containing the alternatives
	 */
	public static Group of(Alternative... alternatives) {
		Group group = new Group();
		for (Alternative alt : alternatives)
			group.alternatives.add(alt);
		return group;
	}

	/**
	 * @return the mutable list of alternatives
	 */
	public List<Alternative> getAlternatives() {
		return alternatives;
	}

	@Override
	public Term copy() {
		Group dup = new Group();
		for (Alternative alt : alternatives)
			dup.alternatives.add(alt.copy());
		return dup;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Group))
			return false;
		return alternatives.equals(((Group) obj).alternatives);
	}

	@Override
	public int hashCode() {
		return alternatives.hashCode() * 31 + 2;
	}

	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder();
		buf.append("( ");
		for (int i = 0; i < alternatives.size(); ++i) {
			if (i > 0)
				buf.append(" | ");
			buf.append(alternatives.get(i));
		}
		buf.append(" )");
		return buf.toString();
	}
}
