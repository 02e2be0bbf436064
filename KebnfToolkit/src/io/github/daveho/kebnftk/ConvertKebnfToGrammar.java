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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parse KEBNF source texts and convert them to a {@link Grammar}.
 */
public class ConvertKebnfToGrammar {
	/*
	Grammar for KEBNF:

	file := rule*
	rule := Name (':' Type)? '=' alts (';' | <next rule header> | <end of input>)
	alts := seq ('|' seq)*
	seq := elem*
	elem := name ('=' | '+=' | '?=') item     property assignment, only item is kept
	elem := item
	item := prim ('?' | '*' | '+')*
	prim := Name                              rule reference
	prim := 'true' | 'false'                  literal
	prim := word                              descriptive text, ignored
	prim := '...' | "..."                     literal
	prim := lit ('..' | '-') lit              character range
	prim := [Name]                            cross reference, same as Name
	prim := ~[Name]                           conjugated cross reference, same as Name
	prim := [<char set>]                      character class, e.g. [a-zA-Z_]
	prim := ~prim                             negated character class
	prim := (alts)                            grouping

	A rule header is a capitalized name followed by '=' or ':',
	in column 1 or after a ';'. Line comments start with // and
	block comments are slash-star delimited. Non-parsing blocks
	{ ... } are ignored.
	 */

	private static final boolean DEBUG = Boolean.getBoolean("kebnftk.debug");

	private enum TokenType {
		NAME,
		LITERAL,
		CROSS_REFERENCE,
		CHARACTER_SET,
		EQ,
		PLUS_EQ,
		QUESTION_EQ,
		COLON,
		SEMI,
		BAR,
		LPAREN,
		RPAREN,
		QUESTION,
		STAR,
		PLUS,
		TILDE,
		DOT_DOT,
		MINUS,
		EOF,
	}

	private static class Token {
		final TokenType type;
		final String text;
		final SourceSpan span;

		Token(TokenType type, String text, SourceSpan span) {
			this.type = type;
			this.text = text;
			this.span = span;
		}

		@Override
		public String toString() {
			switch (type) {
			case EOF:
				return "end of input";
			case LITERAL:
				return Literal.quote(text);
			case CROSS_REFERENCE: case CHARACTER_SET:
				return "[" + text + "]";
			default:
				return "'" + text + "'";
			}
		}
	}

	/**
	 * Converts source text to tokens, dropping whitespace,
	 * comments, and non-parsing blocks.
	 */
	private static class Tokenizer {
		private final String sourceName;
		private final String text;
		private int pos;
		private int line;
		private int column;

		Tokenizer(String sourceName, String text) {
			this.sourceName = sourceName;
			this.text = text;
			this.pos = 0;
			this.line = 1;
			this.column = 1;
		}

		List<Token> tokenize() {
			List<Token> result = new ArrayList<Token>();
			for (;;) {
				skipWhitespaceAndComments();
				SourceSpan span = span();
				if (pos >= text.length()) {
					result.add(new Token(TokenType.EOF, "", span));
					return result;
				}
				result.add(scanToken(span));
			}
		}

		private SourceSpan span() {
			return new SourceSpan(sourceName, line, column);
		}

		private int peek() {
			return pos < text.length() ? text.charAt(pos) : -1;
		}

		private int peek(int offset) {
			return pos + offset < text.length() ? text.charAt(pos + offset) : -1;
		}

		private char next() {
			char c = text.charAt(pos++);
			if (c == '\n') {
				++line;
				column = 1;
			} else {
				++column;
			}
			return c;
		}

		private void skipWhitespaceAndComments() {
			for (;;) {
				int c = peek();
				if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
					next();
				} else if (c == '/' && peek(1) == '/') {
					while (peek() >= 0 && peek() != '\n')
						next();
				} else if (c == '/' && peek(1) == '*') {
					SourceSpan start = span();
					next();
					next();
					while (!(peek() == '*' && peek(1) == '/')) {
						if (peek() < 0)
							throw new GrammarSyntaxException(start, "Unterminated comment");
						next();
					}
					next();
					next();
				} else if (c == '{') {
					skipBlock();
				} else {
					return;
				}
			}
		}

		private void skipBlock() {
			SourceSpan start = span();
			int depth = 0;
			do {
				int c = peek();
				if (c < 0)
					throw new GrammarSyntaxException(start, "Unterminated non-parsing block");
				if (c == '\'' || c == '"') {
					scanLiteral(span(), true);
					continue;
				}
				next();
				if (c == '{')
					++depth;
				else if (c == '}')
					--depth;
			} while (depth > 0);
		}

		private Token scanToken(SourceSpan span) {
			int c = peek();

			if (isNameStart(c)) {
				StringBuilder buf = new StringBuilder();
				while (isNamePart(peek()))
					buf.append(next());
				return new Token(TokenType.NAME, buf.toString(), span);
			}

			switch (c) {
			case '\'': case '"':
				return new Token(TokenType.LITERAL, scanLiteral(span, false), span);
			case '[':
				return scanBracket(span);
			case '=':
				next();
				return new Token(TokenType.EQ, "=", span);
			case ':':
				next();
				return new Token(TokenType.COLON, ":", span);
			case ';':
				next();
				return new Token(TokenType.SEMI, ";", span);
			case '|':
				next();
				return new Token(TokenType.BAR, "|", span);
			case '(':
				next();
				return new Token(TokenType.LPAREN, "(", span);
			case ')':
				next();
				return new Token(TokenType.RPAREN, ")", span);
			case '*':
				next();
				return new Token(TokenType.STAR, "*", span);
			case '~':
				next();
				return new Token(TokenType.TILDE, "~", span);
			case '-':
				next();
				return new Token(TokenType.MINUS, "-", span);
			case '+':
				next();
				if (peek() == '=') {
					next();
					return new Token(TokenType.PLUS_EQ, "+=", span);
				}
				return new Token(TokenType.PLUS, "+", span);
			case '?':
				next();
				if (peek() == '=') {
					next();
					return new Token(TokenType.QUESTION_EQ, "?=", span);
				}
				return new Token(TokenType.QUESTION, "?", span);
			case '.':
				if (peek(1) == '.') {
					next();
					next();
					return new Token(TokenType.DOT_DOT, "..", span);
				}
				break;
			default:
				break;
			}

			throw new GrammarSyntaxException(span, "Unexpected character '" + (char) c + "'");
		}

		private String scanLiteral(SourceSpan span, boolean allowEmpty) {
			char quote = next();
			StringBuilder buf = new StringBuilder();
			for (;;) {
				int c = peek();
				if (c < 0 || c == '\n')
					throw new GrammarSyntaxException(span, "Unterminated literal");
				next();
				if (c == quote)
					break;
				if (c == '\\')
					buf.append(scanEscape(span));
				else
					buf.append((char) c);
			}
			if (buf.length() == 0 && !allowEmpty)
				throw new GrammarSyntaxException(span, "Empty literal");
			return buf.toString();
		}

		private char scanEscape(SourceSpan span) {
			if (peek() < 0)
				throw new GrammarSyntaxException(span, "Unterminated escape sequence");
			char c = next();
			switch (c) {
			case 'n':
				return '\n';
			case 't':
				return '\t';
			case 'r':
				return '\r';
			case 'f':
				return '\f';
			case 'b':
				return '\b';
			case 'u':
				if (pos + 4 > text.length())
					throw new GrammarSyntaxException(span, "Invalid unicode escape");
				String hex = text.substring(pos, pos + 4);
				for (int i = 0; i < 4; ++i)
					next();
				try {
					return (char) Integer.parseInt(hex, 16);
				} catch (NumberFormatException e) {
					throw new GrammarSyntaxException(span, "Invalid unicode escape \\u" + hex);
				}
			default:
				// any other escaped character stands for itself
				return c;
			}
		}

		private Token scanBracket(SourceSpan span) {
			next(); // consume the '['
			StringBuilder buf = new StringBuilder();
			for (;;) {
				int c = peek();
				if (c < 0 || c == '\n')
					throw new GrammarSyntaxException(span, "Unterminated '['");
				next();
				if (c == ']')
					break;
				buf.append((char) c);
				if (c == '\\' && peek() >= 0)
					buf.append(next());
			}
			String content = buf.toString();
			String trimmed = content.trim();
			if (!trimmed.isEmpty() && Character.isUpperCase(trimmed.charAt(0)) && isName(trimmed))
				return new Token(TokenType.CROSS_REFERENCE, trimmed, span);
			return new Token(TokenType.CHARACTER_SET, content, span);
		}

		private static boolean isNameStart(int c) {
			return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
		}

		private static boolean isNamePart(int c) {
			return isNameStart(c) || (c >= '0' && c <= '9');
		}

		private static boolean isName(String s) {
			for (int i = 0; i < s.length(); ++i)
				if (i == 0 ? !isNameStart(s.charAt(i)) : !isNamePart(s.charAt(i)))
					return false;
			return true;
		}
	}

	private final Grammar grammar;
	private final Diagnostics diagnostics;

	// per-source parsing state
	private List<Token> tokens;
	private int pos;
	private boolean sawProse;

	/**
	 * Constructor.
	 *
	 * @param diagnostics collects warnings
	 */
	public ConvertKebnfToGrammar(Diagnostics diagnostics) {
		this.grammar = new Grammar();
		this.diagnostics = diagnostics;
	}

	/**
	 * Convenience method to parse a single source text.
	 *
	 * @param sourceName the source name
	 * @param text       the KEBNF text
	 * @return the grammar
	 */
	public static Grammar parse(String sourceName, String text) {
		ConvertKebnfToGrammar converter = new ConvertKebnfToGrammar(new Diagnostics());
		converter.addSource(new GrammarSource(sourceName, text));
		return converter.getGrammar();
	}

	/**
	 * Parse a source text and add its rules to the grammar.
	 * A rule already defined by an earlier source is extended with
	 * the new alternatives, unless the earlier definition is empty
	 * or the source is an override source, in which case it is replaced.
	 *
	 * @param source the source
	 * @throws GrammarSyntaxException if the source cannot be parsed
	 * @throws DuplicateRuleException if the source defines a rule twice
	 */
	public void addSource(GrammarSource source) {
		this.tokens = new Tokenizer(source.getName(), source.getText()).tokenize();
		this.pos = 0;

		Set<String> definedHere = new HashSet<String>();
		int count = 0;
		while (peek().type != TokenType.EOF) {
			Rule rule = parseRule();
			if (!definedHere.add(rule.getName()))
				throw new DuplicateRuleException(rule.getName(), rule.getSpan(),
						"Rule " + rule.getName() + " is defined more than once");
			register(rule, source.isOverride());
			++count;
		}

		if (DEBUG)
			System.err.printf("%s: %d rules%n", source.getName(), count);
	}

	/**
	 * @return the grammar built from all sources added so far
	 */
	public Grammar getGrammar() {
		return grammar;
	}

	private void register(Rule rule, boolean override) {
		Rule existing = grammar.getRule(rule.getName());
		if (existing == null) {
			grammar.addRule(rule);
		} else if (override || existing.isEmpty()) {
			grammar.replaceRule(rule);
		} else if (!rule.isEmpty()) {
			existing.getAlternatives().addAll(rule.getAlternatives());
		}
	}

	private Rule parseRule() {
		if (!isRuleStart(pos))
			throw new GrammarSyntaxException(peek().span, "Expected rule definition, found " + peek());

		Token name = next();
		Rule rule = new Rule(name.text, name.span);
		if (peek().type == TokenType.COLON) {
			next();
			rule.setResultType(expect(TokenType.NAME).text);
		}
		expect(TokenType.EQ);

		sawProse = false;
		rule.getAlternatives().addAll(parseAlternatives());

		Token t = peek();
		if (t.type == TokenType.SEMI)
			next();
		else if (t.type != TokenType.EOF && !isRuleHeader(pos))
			throw new GrammarSyntaxException(t.span, "Unexpected " + t + " in rule " + rule.getName());

		if (sawProse)
			diagnostics.warning(rule.getName(), rule.getSpan(), "descriptive text ignored");
		if (rule.isEmpty()) {
			rule.getAlternatives().clear();
			rule.getAlternatives().add(new Alternative());
			diagnostics.warning(rule.getName(), rule.getSpan(), "rule has no parsable content, treated as empty");
		}
		return rule;
	}

	private List<Alternative> parseAlternatives() {
		List<Alternative> result = new ArrayList<Alternative>();
		result.add(parseSequence());
		while (peek().type == TokenType.BAR) {
			next();
			result.add(parseSequence());
		}
		return result;
	}

	private Alternative parseSequence() {
		Alternative alt = new Alternative();
		while (!atSequenceEnd()) {
			Term t = parseElement();
			if (t != null)
				alt.add(t);
		}
		return alt;
	}

	private boolean atSequenceEnd() {
		switch (peek().type) {
		case EOF: case SEMI: case BAR: case RPAREN:
			return true;
		default:
			return isRuleHeader(pos);
		}
	}

	private Term parseElement() {
		if (peek().type == TokenType.NAME && isAssignment(peek(1).type)) {
			// property assignment: keep only the assigned element
			next();
			Token op = next();
			if (atSequenceEnd())
				throw new GrammarSyntaxException(op.span, "Missing element after " + op);
		}

		Term t = parsePrimary();
		for (;;) {
			TokenType type = peek().type;
			if (type == TokenType.QUESTION) {
				next();
				t = t != null ? Quantifier.optional(t) : null;
			} else if (type == TokenType.STAR) {
				next();
				t = t != null ? Quantifier.zeroOrMore(t) : null;
			} else if (type == TokenType.PLUS) {
				next();
				t = t != null ? Quantifier.oneOrMore(t) : null;
			} else {
				return t;
			}
		}
	}

	private Term parsePrimary() {
		Token t = next();
		switch (t.type) {
		case NAME:
			if (t.text.equals("true") || t.text.equals("false"))
				return new Literal(t.text);
			if (Character.isUpperCase(t.text.charAt(0)))
				return new RuleReference(t.text);
			sawProse = true;
			return null;

		case LITERAL:
			if (peek().type == TokenType.DOT_DOT || peek().type == TokenType.MINUS) {
				Token op = next();
				Token end = expect(TokenType.LITERAL);
				if (t.text.length() != 1 || end.text.length() != 1)
					throw new GrammarSyntaxException(op.span, "Character range bounds must be single characters");
				CharacterClass range = new CharacterClass();
				try {
					range.addRange(t.text.charAt(0), end.text.charAt(0));
				} catch (IllegalArgumentException e) {
					throw new GrammarSyntaxException(op.span, e.getMessage());
				}
				return range;
			}
			return new Literal(t.text);

		case CROSS_REFERENCE:
			return new RuleReference(t.text);

		case CHARACTER_SET:
			return scanCharacterSet(t);

		case TILDE:
			if (peek().type == TokenType.CROSS_REFERENCE)
				return new RuleReference(next().text);
			Term operand = parsePrimary();
			CharacterClass cc = operand != null ? toCharacterClass(operand) : null;
			if (cc == null || cc.isNegated())
				throw new GrammarSyntaxException(t.span, "Only character sets can be negated");
			cc.setNegated(true);
			return cc;

		case LPAREN:
			Group group = new Group();
			group.getAlternatives().addAll(parseAlternatives());
			expect(TokenType.RPAREN);
			return group;

		default:
			throw new GrammarSyntaxException(t.span, "Unexpected " + t);
		}
	}

	/**
	 * Convert a term denoting a set of characters to a (new) character class.
	 *
	 * @param term a single-character literal, a character class, or a group of those
	 * @return the character class, or null if the term doesn't denote a set of characters
	 */
	private static CharacterClass toCharacterClass(Term term) {
		switch (term.getType()) {
		case LITERAL:
			String text = ((Literal) term).getText();
			if (text.length() != 1)
				return null;
			CharacterClass single = new CharacterClass();
			single.addChar(text.charAt(0));
			return single;
		case CHARACTER_CLASS:
			return (CharacterClass) term.copy();
		case GROUP:
			CharacterClass union = new CharacterClass();
			for (Alternative alt : ((Group) term).getAlternatives()) {
				if (alt.size() != 1)
					return null;
				CharacterClass member = toCharacterClass(alt.get(0));
				if (member == null || member.isNegated())
					return null;
				union.addAll(member);
			}
			return union;
		default:
			return null;
		}
	}

	private CharacterClass scanCharacterSet(Token t) {
		CharacterClass cc = new CharacterClass();
		String s = t.text;
		int i = 0;
		if (s.startsWith("^")) {
			cc.setNegated(true);
			++i;
		}
		while (i < s.length()) {
			char first = s.charAt(i++);
			if (first == '\\') {
				if (i >= s.length())
					throw new GrammarSyntaxException(t.span, "Invalid escape in character set");
				first = unescape(s.charAt(i++));
			}
			char last = first;
			if (i + 1 < s.length() && s.charAt(i) == '-') {
				++i;
				last = s.charAt(i++);
				if (last == '\\') {
					if (i >= s.length())
						throw new GrammarSyntaxException(t.span, "Invalid escape in character set");
					last = unescape(s.charAt(i++));
				}
			}
			if (last < first)
				throw new GrammarSyntaxException(t.span, "Empty character range " + first + "-" + last);
			cc.addRange(first, last);
		}
		if (cc.getRanges().isEmpty())
			throw new GrammarSyntaxException(t.span, "Empty character set");
		return cc;
	}

	private static char unescape(char c) {
		switch (c) {
		case 'n':
			return '\n';
		case 't':
			return '\t';
		case 'r':
			return '\r';
		case 'f':
			return '\f';
		default:
			return c;
		}
	}

	// A rule header which ends the previous rule must start in column 1.
	private boolean isRuleHeader(int index) {
		return tokens.get(index).span.getColumn() == 1 && isRuleStart(index);
	}

	private boolean isRuleStart(int index) {
		Token t = tokens.get(index);
		if (t.type != TokenType.NAME || !Character.isUpperCase(t.text.charAt(0)))
			return false;
		TokenType following = tokens.get(Math.min(index + 1, tokens.size() - 1)).type;
		return following == TokenType.EQ || following == TokenType.COLON;
	}

	private static boolean isAssignment(TokenType type) {
		return type == TokenType.EQ || type == TokenType.PLUS_EQ || type == TokenType.QUESTION_EQ;
	}

	private Token peek() {
		return tokens.get(pos);
	}

	private Token peek(int offset) {
		return tokens.get(Math.min(pos + offset, tokens.size() - 1));
	}

	private Token next() {
		Token t = tokens.get(pos);
		if (t.type != TokenType.EOF)
			++pos;
		return t;
	}

	private Token expect(TokenType type) {
		Token t = next();
		if (t.type != type)
			throw new GrammarSyntaxException(t.span, "Expected " + describe(type) + ", found " + t);
		return t;
	}

	private static String describe(TokenType type) {
		switch (type) {
		case NAME:
			return "name";
		case LITERAL:
			return "literal";
		case EQ:
			return "'='";
		case RPAREN:
			return "')'";
		default:
			return type.name().toLowerCase();
		}
	}
}
