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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Generate an ANTLR 4 lexer grammar and parser grammar from a
 * classified, keyword-extracted, precedence-transformed {@link Grammar}.
 * Output depends only on the rule order of the grammar, so the same
 * grammar always produces the same text.
 */
public class GenerateAntlrGrammar {
	private static final boolean DEBUG = Boolean.getBoolean("kebnftk.debug");

	// Values to substitute:
	//   - grammar name
	//   - source names
	private static final String HEADER =
			"/*\n" +
			" * %s\n" +
			" * Generated by KebnfToolkit from: %s\n" +
			" * Do not edit: regenerate from the KEBNF sources instead.\n" +
			" */\n" +
			"\n";

	// Values to substitute:
	//   - lexer grammar name
	private static final String TOKEN_VOCAB =
			"options {\n" +
			"    tokenVocab = %s;\n" +
			"}\n";

	private static final String INDENT = "    ";

	private static final String EPSILON = "/* epsilon */";

	/**
	 * Rule names which ANTLR reserves; parser rules with these
	 * names get a <code>Rule</code> suffix.
	 */
	public static final Set<String> RESERVED_NAMES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"import", "fragment", "lexer", "parser", "grammar", "returns", "locals",
			"throws", "catch", "finally", "mode", "options", "tokens", "channels")));

	private final Grammar grammar;
	private final GrammarOptions options;
	private List<String> sourceNames;

	/**
	 * Constructor.
	 *
	 * @param grammar the grammar
	 * @param options the options (grammar name, root rule, skip tokens)
	 */
	public GenerateAntlrGrammar(Grammar grammar, GrammarOptions options) {
		this.grammar = grammar;
		this.options = options;
		this.sourceNames = Collections.emptyList();
	}

	/**
	 * Set the names of the sources the grammar was read from,
	 * for the header comment.
	 *
	 * @param sourceNames the source names
	 */
	public void setSourceNames(List<String> sourceNames) {
		this.sourceNames = new ArrayList<String>(sourceNames);
	}

	/**
	 * Convert a syntactic rule name to an ANTLR parser rule name.
	 *
	 * @param ruleName the rule name, e.g. <code>OwnedExpression</code>
	 * @return the parser rule name, e.g. <code>ownedExpression</code>
	 */
	public static String toParserRuleName(String ruleName) {
		String name = Character.toLowerCase(ruleName.charAt(0)) + ruleName.substring(1);
		if (RESERVED_NAMES.contains(name))
			name = name + "Rule";
		return name;
	}

	/**
	 * Check that every reference resolves to a rule or keyword token.
	 *
	 * @throws UnresolvedReferenceException if a reference is undefined
	 */
	public void checkReferences() {
		for (Rule rule : grammar.getRules()) {
			if (rule.isLexical() && rule.isEmpty())
				continue;
			for (String ref : rule.getReferences()) {
				if (!grammar.isDefined(ref))
					throw new UnresolvedReferenceException(rule.getName(), rule.getSpan(),
							"Reference to undefined rule " + ref + (grammar.hasRule(ref) ? " (empty lexical rule)" : ""));
			}
		}
	}

	/**
	 * @return the lexer grammar text
	 */
	public String generateLexerGrammar() {
		StringWriter sw = new StringWriter();
		try (PrintWriter writer = new PrintWriter(sw)) {
			generateLexerGrammar(writer);
		}
		return sw.toString();
	}

	/**
	 * @return the parser grammar text
	 */
	public String generateParserGrammar() {
		StringWriter sw = new StringWriter();
		try (PrintWriter writer = new PrintWriter(sw)) {
			generateParserGrammar(writer);
		}
		return sw.toString();
	}

	/**
	 * Write the lexer grammar.
	 *
	 * @param writer the writer
	 */
	public void generateLexerGrammar(PrintWriter writer) {
		checkReferences();

		String name = options.getLexerGrammarName();
		writer.print(String.format(HEADER, name, describeSources()));
		writer.print("lexer grammar " + name + ";\n");

		Set<String> referencedBySyntax = new HashSet<String>();
		for (Rule rule : grammar.getRules(RuleKind.SYNTACTIC))
			referencedBySyntax.addAll(rule.getReferences());

		Rule keywordRule = grammar.getRule(KeywordSet.RULE_NAME);
		if (keywordRule != null && !keywordRule.getAlternatives().isEmpty()) {
			writer.print("\n// Keywords and operators\n");
			for (Alternative alt : keywordRule.getAlternatives())
				writer.print(alt.getLabel() + " : " + renderAlternative(alt) + " ;\n");
		}

		int count = 0;
		for (Rule rule : grammar.getRules(RuleKind.LEXICAL)) {
			if (rule == keywordRule || rule.isEmpty())
				continue;
			if (count++ == 0)
				writer.print("\n// Lexical rules\n");
			boolean skip = options.getSkipTokens().contains(rule.getName());
			boolean fragment = !skip && !referencedBySyntax.contains(rule.getName());
			writer.print("\n");
			writer.print((fragment ? "fragment " : "") + rule.getName() + "\n");
			if (skip) {
				String body = rule.getAlternatives().size() == 1
						? renderAlternative(rule.getAlternatives().get(0))
						: renderGroup(rule.getAlternatives());
				writer.print(INDENT + ": " + body + " -> skip\n");
			} else {
				writeAlternatives(writer, rule);
			}
			writer.print(INDENT + ";\n");
		}

		if (DEBUG)
			System.err.printf("%s: %d keywords, %d lexical rules%n", name,
					grammar.getKeywordSet().size(), count);
	}

	/**
	 * Write the parser grammar.
	 *
	 * @param writer the writer
	 */
	public void generateParserGrammar(PrintWriter writer) {
		checkReferences();

		List<Rule> rules = grammar.getRules(RuleKind.SYNTACTIC);
		Rule root = findRootRule(rules);

		Set<String> parserNames = new HashSet<String>();
		for (Rule rule : rules)
			parserNames.add(toParserRuleName(rule.getName()));
		String rootMarker = options.getRootMarkerName();
		while (parserNames.contains(rootMarker))
			rootMarker = rootMarker + "Rule";

		String name = options.getParserGrammarName();
		writer.print(String.format(HEADER, name, describeSources()));
		writer.print("parser grammar " + name + ";\n");
		writer.print("\n");
		writer.print(String.format(TOKEN_VOCAB, options.getLexerGrammarName()));

		writer.print("\n");
		writer.print(rootMarker + "\n");
		writer.print(INDENT + ": " + toParserRuleName(root.getName()) + " EOF\n");
		writer.print(INDENT + ";\n");

		for (Rule rule : rules) {
			writer.print("\n");
			writer.print(toParserRuleName(rule.getName()) + "\n");
			writeAlternatives(writer, rule);
			writer.print(INDENT + ";\n");
		}

		if (DEBUG)
			System.err.printf("%s: %d parser rules, root %s%n", name, rules.size(), root.getName());
	}

	private Rule findRootRule(List<Rule> rules) {
		String rootName = options.getRootRule();
		if (rootName == null) {
			if (rules.isEmpty())
				throw new UnresolvedReferenceException(null, null, "Grammar has no syntactic rules");
			return rules.get(0);
		}
		Rule root = grammar.getRule(rootName);
		if (root == null || !root.isSyntactic())
			throw new UnresolvedReferenceException(rootName, null, "Root rule " + rootName + " is not a syntactic rule");
		return root;
	}

	private String describeSources() {
		if (sourceNames.isEmpty())
			return "(unnamed)";
		StringBuilder buf = new StringBuilder();
		for (String s : sourceNames) {
			if (buf.length() > 0)
				buf.append(", ");
			buf.append(s);
		}
		return buf.toString();
	}

	private void writeAlternatives(PrintWriter writer, Rule rule) {
		List<Alternative> alts = rule.getAlternatives();
		for (int i = 0; i < alts.size(); ++i)
			writer.print(INDENT + (i == 0 ? ": " : "| ") + renderAlternative(alts.get(i)) + "\n");
	}

	private String renderAlternative(Alternative alt) {
		StringBuilder buf = new StringBuilder();
		for (Term t : alt.getTerms()) {
			if (t.getType() == TermType.PRECEDENCE_MARKER) {
				if (((PrecedenceMarker) t).getAssociativity() == Associativity.RIGHT)
					buf.append("<assoc=right>");
				else
					continue;
			} else {
				buf.append(renderTerm(t));
			}
			buf.append(' ');
		}
		if (buf.length() == 0)
			return EPSILON;
		if (alt.getTerms().size() == 1 && alt.get(0).getType() == TermType.PRECEDENCE_MARKER)
			buf.append(EPSILON).append(' ');
		return buf.substring(0, buf.length() - 1);
	}

	private String renderGroup(List<Alternative> alternatives) {
		StringBuilder buf = new StringBuilder();
		buf.append("( ");
		for (int i = 0; i < alternatives.size(); ++i) {
			if (i > 0)
				buf.append(" | ");
			buf.append(renderAlternative(alternatives.get(i)));
		}
		buf.append(" )");
		return buf.toString();
	}

	private String renderTerm(Term t) {
		switch (t.getType()) {
		case RULE_REFERENCE:
			return renderReference(((RuleReference) t).getName());
		case LITERAL:
			return Literal.quote(((Literal) t).getText());
		case CHARACTER_CLASS:
			return t.toString();
		case GROUP:
			return renderGroup(((Group) t).getAlternatives());
		case OPTIONAL: case ZERO_OR_MORE: case ONE_OR_MORE:
			Quantifier q = (Quantifier) t;
			Term body = q.getBody();
			String rendered = renderTerm(body);
			if (body instanceof Quantifier)
				rendered = "( " + rendered + " )";
			return rendered + q.getOperator();
		default:
			throw new IllegalStateException("Unexpected term " + t);
		}
	}

	private String renderReference(String name) {
		if (grammar.getKeywordSet().isTokenName(name))
			return name;
		Rule rule = grammar.getRule(name);
		if (rule == null)
			throw new IllegalStateException("Unresolved reference " + name);
		return rule.isSyntactic() ? toParserRuleName(name) : name;
	}
}
