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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduplicated set of literal texts (keywords and operators) found in
 * syntactic rules, each with a generated token name. Names are a pure
 * function of the literal text, except when they collide with a rule
 * name or an earlier token name, in which case a <code>_KW</code> suffix
 * is added.
 */
public class KeywordSet {
	/** Name of the lexical rule that materializes the keyword set. */
	public static final String RULE_NAME = "KEYWORDS";

	/** Token name which ANTLR reserves. */
	private static final String EOF_TOKEN = "EOF";

	private static final Map<String, String> OPERATOR_NAMES = new HashMap<String, String>();
	private static final Map<Character, String> CHAR_NAMES = new HashMap<Character, String>();

	static {
		OPERATOR_NAMES.put("->", "ARROW");
		OPERATOR_NAMES.put("=>", "FAT_ARROW");
		OPERATOR_NAMES.put("<=", "LE");
		OPERATOR_NAMES.put(">=", "GE");
		OPERATOR_NAMES.put("@", "AT_SIGN");

		CHAR_NAMES.put(':', "COLON");
		CHAR_NAMES.put(';', "SEMI");
		CHAR_NAMES.put(',', "COMMA");
		CHAR_NAMES.put('.', "DOT");
		CHAR_NAMES.put('(', "LPAREN");
		CHAR_NAMES.put(')', "RPAREN");
		CHAR_NAMES.put('{', "LBRACE");
		CHAR_NAMES.put('}', "RBRACE");
		CHAR_NAMES.put('[', "LBRACK");
		CHAR_NAMES.put(']', "RBRACK");
		CHAR_NAMES.put('<', "LT");
		CHAR_NAMES.put('>', "GT");
		CHAR_NAMES.put('=', "EQ");
		CHAR_NAMES.put('!', "BANG");
		CHAR_NAMES.put('+', "PLUS");
		CHAR_NAMES.put('-', "MINUS");
		CHAR_NAMES.put('*', "STAR");
		CHAR_NAMES.put('/', "SLASH");
		CHAR_NAMES.put('%', "PERCENT");
		CHAR_NAMES.put('^', "CARET");
		CHAR_NAMES.put('~', "TILDE");
		CHAR_NAMES.put('#', "HASH");
		CHAR_NAMES.put('$', "DOLLAR");
		CHAR_NAMES.put('|', "PIPE");
		CHAR_NAMES.put('&', "AMP");
		CHAR_NAMES.put('?', "QUESTION");
		CHAR_NAMES.put('@', "AT");
		CHAR_NAMES.put('\'', "QUOTE");
		CHAR_NAMES.put('"', "DQUOTE");
		CHAR_NAMES.put('\\', "BACKSLASH");
		CHAR_NAMES.put('`', "BACKTICK");
		CHAR_NAMES.put(' ', "SPACE");
	}

	/**
	 * A keyword: literal text and its token name.
	 * Entries sort longest text first, so that the generated lexer
	 * prefers <code>double</code> over <code>do</code>.
	 */
	public static class Entry implements Comparable<Entry> {
		private final String text;
		private final String tokenName;

		public Entry(String text, String tokenName) {
			this.text = text;
			this.tokenName = tokenName;
		}

		public String getText() {
			return text;
		}

		public String getTokenName() {
			return tokenName;
		}

		@Override
		public int compareTo(Entry o) {
			// Sort descending by length
			int lenDiff = text.length() - o.text.length();
			if (lenDiff != 0)
				return -lenDiff;

			// Use the text as tie-breaker
			return text.compareTo(o.text);
		}

		@Override
		public String toString() {
			return tokenName + " : " + Literal.quote(text);
		}
	}

	/** Literal text to token name, in order of first interning. */
	private final Map<String, String> textToName;

	/** Token name to literal text. */
	private final Map<String, String> nameToText;

	public KeywordSet() {
		this.textToName = new LinkedHashMap<String, String>();
		this.nameToText = new HashMap<String, String>();
	}

	/**
	 * Get the token name for literal text, creating it if necessary.
	 * 
	 * @param text       the literal text
	 * @param takenNames names that a new token name must not collide with
	 *                   (i.e., rule names)
	 * @return the token name
	 */
	public String intern(String text, Set<String> takenNames) {
		if (text.isEmpty())
			throw new IllegalArgumentException("Empty keyword");
		String name = textToName.get(text);
		if (name != null)
			return name;

		String base = baseTokenName(text);
		name = base;
		int suffix = 1;
		while (isTaken(name, takenNames)) {
			name = base + "_KW" + (suffix == 1 ? "" : String.valueOf(suffix));
			++suffix;
		}
		textToName.put(text, name);
		nameToText.put(name, text);
		return name;
	}

	private boolean isTaken(String name, Set<String> takenNames) {
		return name.equals(EOF_TOKEN) || name.equals(RULE_NAME)
				|| nameToText.containsKey(name) || takenNames.contains(name);
	}

	/**
	 * Get the token name for literal text.
	 * 
	 * @param text the literal text
	 * @return the token name, or null if the text is not a keyword
	 */
	public String getTokenName(String text) {
		return textToName.get(text);
	}

	/**
	 * Get the literal text for a token name.
	 * 
	 * @param tokenName the token name
	 * @return the literal text, or null if the name is not a keyword token
	 */
	public String getText(String tokenName) {
		return nameToText.get(tokenName);
	}

	public boolean isTokenName(String name) {
		return nameToText.containsKey(name);
	}

	public int size() {
		return textToName.size();
	}

	/**
	 * @return the keywords, longest text first
	 */
	public List<Entry> getEntries() {
		List<Entry> result = new ArrayList<Entry>();
		for (Map.Entry<String, String> e : textToName.entrySet())
			result.add(new Entry(e.getKey(), e.getValue()));
		Collections.sort(result);
		return result;
	}

	/**
	 * Compute the token name for literal text, before collision handling.
	 * Identifier-like text is upper-cased; operators are named
	 * after their characters, e.g. <code>:&gt;&gt;</code> becomes <code>COLON_GT_GT</code>.
	 * 
	 * @param text the literal text
	 * @return the token name
	 */
	public static String baseTokenName(String text) {
		String op = OPERATOR_NAMES.get(text);
		if (op != null)
			return op;

		StringBuilder buf = new StringBuilder();
		boolean inWord = false;
		for (int i = 0; i < text.length(); ++i) {
			char c = text.charAt(i);
			boolean wordChar = c < 128 && (Character.isLetterOrDigit(c) || c == '_');
			if (wordChar) {
				if (!inWord && buf.length() > 0)
					buf.append('_');
				buf.append(Character.toUpperCase(c));
			} else {
				if (buf.length() > 0)
					buf.append('_');
				String charName = CHAR_NAMES.get(c);
				buf.append(charName != null ? charName : String.format("U%04X", (int) c));
			}
			inWord = wordChar;
		}
		if (Character.isDigit(buf.charAt(0)))
			buf.insert(0, "T_");
		return buf.toString();
	}
}
