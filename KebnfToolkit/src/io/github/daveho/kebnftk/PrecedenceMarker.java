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
 * Marker placed first in an operator alternative of a
 * precedence-transformed rule. A higher level binds tighter.
 */
public class PrecedenceMarker extends Term {
	private final int level;
	private final Associativity associativity;

	public PrecedenceMarker(int level, Associativity associativity) {
		super(TermType.PRECEDENCE_MARKER);
		this.level = level;
		this.associativity = associativity;
	}

	public int getLevel() {
		return level;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	@Override
	public Term copy() {
		return new PrecedenceMarker(level, associativity);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof PrecedenceMarker))
			return false;
		PrecedenceMarker other = (PrecedenceMarker) obj;
		return level == other.level && associativity == other.associativity;
	}

	@Override
	public int hashCode() {
		return level * 3 + associativity.ordinal();
	}

	@Override
	public String toString() {
		return "<prec=" + level + "," + associativity.name().toLowerCase() + ">";
	}
}
