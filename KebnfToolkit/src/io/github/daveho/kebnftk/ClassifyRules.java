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

import java.util.regex.Pattern;

/**
 * Classify each rule of a {@link Grammar} as lexical or syntactic.
 * 
 * <p>A rule is lexical if its name follows the lexical naming convention
 * (upper case letters, digits and underscores, at least two characters,
 * e.g. <code>NAME</code>) or if its body contains a character class.
 * All other rules are syntactic, including rules made only of literals
 * (such as <code>VisibilityIndicator = 'public' | 'private'</code>),
 * whose literals then become keyword tokens.</p>
 * 
 * <p>Classification is idempotent.</p>
 */
public class ClassifyRules {
	private static final Pattern LEXICAL_NAME = Pattern.compile("[A-Z][A-Z0-9_]+");

	private final Grammar grammar;

	/**
	 * Constructor.
	 * 
	 * @param grammar the grammar whose rules should be classified
	 */
	public ClassifyRules(Grammar grammar) {
		this.grammar = grammar;
	}

	/**
	 * Check whether a rule name follows the lexical naming convention.
	 * 
	 * @param name a rule name
	 * @return true if the name is a lexical rule name
	 */
	public static boolean isLexicalName(String name) {
		return LEXICAL_NAME.matcher(name).matches();
	}

	/**
	 * Assign a {@link RuleKind} to every rule.
	 * 
	 * @throws MixedRuleException if a lexical rule references a syntactic rule
	 */
	public void execute() {
		for (Rule rule : grammar.getRules()) {
			boolean lexical = rule.getName().equals(KeywordSet.RULE_NAME)
					|| isLexicalName(rule.getName())
					|| Terms.contains(rule.getAlternatives(), TermType.CHARACTER_CLASS);
			rule.setKind(lexical ? RuleKind.LEXICAL : RuleKind.SYNTACTIC);
		}

		for (Rule rule : grammar.getRules()) {
			if (!rule.isLexical())
				continue;
			for (String ref : rule.getReferences()) {
				Rule target = grammar.getRule(ref);
				if (target != null && target.isSyntactic())
					throw new MixedRuleException(rule.getName(), rule.getSpan(),
							"Lexical rule " + rule.getName() + " references syntactic rule " + ref);
			}
		}
	}
}
