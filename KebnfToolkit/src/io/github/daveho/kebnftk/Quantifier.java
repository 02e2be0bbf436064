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
 * A repeated or optional term: one of {@link TermType#OPTIONAL},
 * {@link TermType#ZERO_OR_MORE} or {@link TermType#ONE_OR_MORE}.
 */
public class Quantifier extends Term {
	private Term body;

	/**
	 * Constructor.
	 * 
	 * @param type the quantifier kind
	 * @param body the quantified term
	 */
	public Quantifier(TermType type, Term body) {
		super(type);
		if (type != TermType.OPTIONAL && type != TermType.ZERO_OR_MORE && type != TermType.ONE_OR_MORE)
			throw new IllegalArgumentException("Not a quantifier: " + type);
		this.body = body;
	}

	public static Quantifier optional(Term body) {
		return new Quantifier(TermType.OPTIONAL, body);
	}

	public static Quantifier zeroOrMore(Term body) {
		return new Quantifier(TermType.ZERO_OR_MORE, body);
	}

	public static Quantifier oneOrMore(Term body) {
		return new Quantifier(TermType.ONE_OR_MORE, body);
	}

	public Term getBody() {
		return body;
	}

	public void setBody(Term body) {
		this.body = body;
	}

	/**
	 * @return true if the quantified term may match the empty string
	 *         regardless of its body
	 */
	public boolean isNullable() {
		return getType() != TermType.ONE_OR_MORE;
	}

	/**
	 * @return the postfix operator character for this quantifier
	 */
	public char getOperator() {
		switch (getType()) {
		case OPTIONAL:
			return '?';
		case ZERO_OR_MORE:
			return '*';
		default:
			return '+';
		}
	}

	@Override
	public Term copy() {
		return new Quantifier(getType(), body.copy());
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Quantifier))
			return false;
		Quantifier other = (Quantifier) obj;
		return getType() == other.getType() && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return body.hashCode() * 7 + getType().ordinal();
	}

	@Override
	public String toString() {
		return body.toString() + getOperator();
	}
}
