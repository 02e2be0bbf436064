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
import java.util.List;
import java.util.Set;

/**
 * Replace every literal in every syntactic rule with a reference to a
 * keyword token, collecting the literals in the grammar's {@link KeywordSet}.
 * Running it again on its own output changes nothing.
 */
public class ExtractKeywords {
	private static final boolean DEBUG = Boolean.getBoolean("kebnftk.debug");

	private final Grammar grammar;

	/**
	 * Lexical rules whose literals are reserved words; they
	 * become keyword tokens too.
	 */
	private final Set<String> reservedKeywordRules;

	/**
	 * Constructor.
	 * 
	 * @param grammar the (classified) grammar
	 */
	public ExtractKeywords(Grammar grammar) {
		this(grammar, Collections.<String>emptySet());
	}

	/**
	 * Constructor.
	 * 
	 * @param grammar              the (classified) grammar
	 * @param reservedKeywordRules names of lexical rules listing reserved words
	 */
	public ExtractKeywords(Grammar grammar, Set<String> reservedKeywordRules) {
		this.grammar = grammar;
		this.reservedKeywordRules = reservedKeywordRules;
	}

	/**
	 * Extract keywords.
	 * 
	 * @return the number of literals replaced by keyword token references
	 */
	public int execute() {
		int count = 0;
		// interning a keyword may add the keyword rule, so iterate over a copy
		List<Rule> rules = new ArrayList<Rule>(grammar.getRules());
		for (Rule rule : rules) {
			switch (rule.getKind()) {
			case SYNTACTIC:
				count += rewrite(rule.getAlternatives());
				break;
			case LEXICAL:
				if (reservedKeywordRules.contains(rule.getName()))
					internAll(rule.getAlternatives());
				break;
			default:
				throw new IllegalStateException("Rule " + rule.getName() + " has not been classified");
			}
		}

		if (DEBUG)
			System.err.printf("Replaced %d literals, %d keywords%n", count, grammar.getKeywordSet().size());
		return count;
	}

	private int rewrite(List<Alternative> alternatives) {
		int count = 0;
		for (Alternative alt : alternatives) {
			List<Term> terms = alt.getTerms();
			for (int i = 0; i < terms.size(); ++i) {
				Term t = terms.get(i);
				if (t.getType() == TermType.LITERAL) {
					terms.set(i, toKeywordReference((Literal) t));
					++count;
				} else {
					count += rewriteNested(t);
				}
			}
		}
		return count;
	}

	private int rewriteNested(Term t) {
		switch (t.getType()) {
		case GROUP:
			return rewrite(((Group) t).getAlternatives());
		case OPTIONAL: case ZERO_OR_MORE: case ONE_OR_MORE:
			Quantifier q = (Quantifier) t;
			if (q.getBody().getType() == TermType.LITERAL) {
				q.setBody(toKeywordReference((Literal) q.getBody()));
				return 1;
			}
			return rewriteNested(q.getBody());
		default:
			return 0;
		}
	}

	private RuleReference toKeywordReference(Literal literal) {
		return new RuleReference(grammar.internKeyword(literal.getText()));
	}

	private void internAll(List<Alternative> alternatives) {
		for (Alternative alt : alternatives) {
			for (Term t : alt.getTerms()) {
				if (t.getType() == TermType.LITERAL)
					grammar.internKeyword(((Literal) t).getText());
				else if (t.getType() == TermType.GROUP)
					internAll(((Group) t).getAlternatives());
			}
		}
	}
}
