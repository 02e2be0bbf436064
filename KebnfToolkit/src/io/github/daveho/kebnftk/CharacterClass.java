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

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A set of characters, made of single characters and inclusive
 * character ranges, optionally negated. Character classes only
 * occur in lexical rules.
 */
public class CharacterClass extends Term {
	/** Range start mapped to (inclusive) range end, in ascending order. */
	private final SortedMap<Character, Character> ranges;
	private boolean negated;

	/**
	 * Constructor: an empty, non-negated character class.
	 */
	public CharacterClass() {
		super(TermType.CHARACTER_CLASS);
		this.ranges = new TreeMap<Character, Character>();
		this.negated = false;
	}

	/**
	 * Add a single character.
	 * 
	 * @param ch the character
	 */
	public void addChar(char ch) {
		addRange(ch, ch);
	}

	/**
	 * Add an inclusive range of characters.
	 * 
	 * @param first first character of the range
	 * @param last  last character of the range
	 */
	public void addRange(char first, char last) {
		if (last < first)
			throw new IllegalArgumentException("Empty character range " + first + ".." + last);
		Character prev = ranges.get(first);
		if (prev == null || prev.charValue() < last)
			ranges.put(first, last);
	}

	/**
	 * Add all members of another character class (which must not be negated).
	 * 
	 * @param other the other character class
	 */
	public void addAll(CharacterClass other) {
		if (other.negated)
			throw new IllegalArgumentException("Cannot form the union with a negated character class");
		for (Map.Entry<Character, Character> e : other.ranges.entrySet())
			addRange(e.getKey(), e.getValue());
	}

	public void setNegated(boolean negated) {
		this.negated = negated;
	}

	public boolean isNegated() {
		return negated;
	}

	/**
	 * @return the ranges, as a map of range start to inclusive range end
	 */
	public SortedMap<Character, Character> getRanges() {
		return Collections.unmodifiableSortedMap(ranges);
	}

	/**
	 * Render the members as the body of an ANTLR set, e.g. <code>a-zA-Z_</code>.
	 * 
	 * @return the set body (without brackets)
	 */
	public String membersAsString() {
		StringBuilder buf = new StringBuilder();
		for (Map.Entry<Character, Character> e : ranges.entrySet()) {
			appendSetChar(buf, e.getKey().charValue());
			if (e.getValue().charValue() != e.getKey().charValue()) {
				buf.append('-');
				appendSetChar(buf, e.getValue().charValue());
			}
		}
		return buf.toString();
	}

	private static void appendSetChar(StringBuilder buf, char c) {
		switch (c) {
		case ']': case '\\': case '-':
			buf.append('\\').append(c);
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

	@Override
	public Term copy() {
		CharacterClass dup = new CharacterClass();
		dup.ranges.putAll(ranges);
		dup.negated = negated;
		return dup;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof CharacterClass))
			return false;
		CharacterClass other = (CharacterClass) obj;
		return negated == other.negated && ranges.equals(other.ranges);
	}

	@Override
	public int hashCode() {
		return ranges.hashCode() * 2 + (negated ? 1 : 0);
	}

	@Override
	public String toString() {
		return (negated ? "~[" : "[") + membersAsString() + "]";
	}
}
