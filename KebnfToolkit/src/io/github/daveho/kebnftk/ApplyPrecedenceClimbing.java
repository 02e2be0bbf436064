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
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rewrite direct-left-recursive rules into the precedence form which
 * ANTLR 4 accepts: operator alternatives first, each with a
 * {@link PrecedenceMarker}, followed by the primary (non-recursive)
 * alternatives.
 * 
 * <p>In a left-recursive ANTLR rule, the alternative declared first binds
 * tightest. Operator alternatives keep their declaration order, so the
 * first declared operator gets the highest precedence level.</p>
 */
public class ApplyPrecedenceClimbing {
	private static final boolean DEBUG = Boolean.getBoolean("kebnftk.debug");

	/**
	 * Operators which associate to the right.
	 */
	public static final Set<String> RIGHT_ASSOCIATIVE_OPERATORS = new HashSet<String>(Arrays.asList(
			"**", "^", "=", ":=", "+=", "-=", "*=", "/=", "%=", "?"));

	private enum Shape {
		/** <code>self op self</code> */
		BINARY,
		/** <code>op self</code> */
		PREFIX,
		/** <code>self op</code> */
		SUFFIX,
		/** no leftmost or trailing self reference */
		PRIMARY,
	}

	private final Grammar grammar;

	/**
	 * Constructor.
	 * 
	 * @param grammar the grammar
	 */
	public ApplyPrecedenceClimbing(Grammar grammar) {
		this.grammar = grammar;
	}

	/**
	 * Transform every rule that forms a direct cycle and has not been
	 * transformed yet.
	 * 
	 * @param cycles the cycles found by {@link FindLeftRecursion}
	 * @return the number of rules transformed
	 * @throws UnresolvedIndirectRecursionException if any cycle is indirect
	 * @throws UnsupportedRecursionShapeException if a rule can't be put in precedence form
	 */
	public int execute(Collection<LeftRecursionCycle> cycles) {
		for (LeftRecursionCycle cycle : cycles) {
			if (!cycle.isDirect()) {
				Rule entry = grammar.getRule(cycle.getEntryRule());
				throw new UnresolvedIndirectRecursionException(entry.getName(), entry.getSpan(),
						"Indirect left recursion: " + cycle);
			}
		}

		int count = 0;
		for (LeftRecursionCycle cycle : cycles) {
			if (transform(grammar.getRule(cycle.getEntryRule())))
				++count;
		}
		return count;
	}

	/**
	 * Transform one direct-left-recursive rule.
	 * 
	 * @param rule the rule
	 * @return true if the rule was transformed, false if it was already in precedence form
	 */
	public boolean transform(Rule rule) {
		if (rule.hasPrecedenceMarkers())
			return false;
		String name = rule.getName();
		if (rule.isLexical())
			throw new UnsupportedRecursionShapeException(name, rule.getSpan(), "Lexical rule is left-recursive");

		List<Alternative> operators = new ArrayList<Alternative>();
		List<Shape> shapes = new ArrayList<Shape>();
		List<Alternative> primaries = new ArrayList<Alternative>();
		int index = 0;
		for (Alternative alt : rule.getAlternatives()) {
			++index;
			Shape shape = classify(rule, alt, index);
			if (shape == Shape.PRIMARY) {
				primaries.add(alt);
			} else {
				operators.add(alt);
				shapes.add(shape);
			}
		}

		if (primaries.isEmpty())
			throw new UnsupportedRecursionShapeException(name, rule.getSpan(),
					"Left-recursive rule has no non-recursive alternative");

		List<Alternative> result = new ArrayList<Alternative>();
		int level = operators.size();
		for (int i = 0; i < operators.size(); ++i) {
			Alternative alt = operators.get(i);
			Associativity assoc;
			if (shapes.get(i) == Shape.BINARY)
				assoc = isRightAssociative(alt.get(1)) ? Associativity.RIGHT : Associativity.LEFT;
			else
				assoc = Associativity.NONE;
			alt.getTerms().add(0, new PrecedenceMarker(level, assoc));
			--level;
			result.add(alt);
		}
		result.addAll(primaries);

		rule.getAlternatives().clear();
		rule.getAlternatives().addAll(result);

		if (DEBUG)
			System.err.printf("%s: %d operator alternatives, %d primary alternatives%n",
					name, operators.size(), primaries.size());
		return true;
	}

	private Shape classify(Rule rule, Alternative alt, int index) {
		String name = rule.getName();
		if (alt.isEmpty())
			return Shape.PRIMARY;

		boolean leftSelf = alt.get(0).isReferenceTo(name);
		if (!leftSelf && FindLeftRecursion.leftmostReferences(alt).contains(name))
			throw new UnsupportedRecursionShapeException(name, rule.getSpan(),
					"Alternative " + index + " (" + alt + ") is left-recursive only through a group or optional element");

		boolean rightSelf = alt.size() > 1 && alt.get(alt.size() - 1).isReferenceTo(name);
		if (leftSelf && rightSelf) {
			if (alt.size() < 3)
				throw new UnsupportedRecursionShapeException(name, rule.getSpan(),
						"Alternative " + index + " (" + alt + ") has no operator");
			return Shape.BINARY;
		}
		if (leftSelf) {
			if (alt.size() == 1)
				throw new UnsupportedRecursionShapeException(name, rule.getSpan(),
						"Alternative " + index + " derives only itself");
			return Shape.SUFFIX;
		}
		return rightSelf ? Shape.PREFIX : Shape.PRIMARY;
	}

	// The operator is the term following the left operand: either a
	// keyword token or a group of keyword tokens.
	private boolean isRightAssociative(Term operator) {
		if (operator.getType() == TermType.RULE_REFERENCE)
			return isRightAssociativeToken(((RuleReference) operator).getName());
		if (operator.getType() != TermType.GROUP)
			return false;
		for (Alternative alt : ((Group) operator).getAlternatives()) {
			if (alt.size() != 1 || alt.get(0).getType() != TermType.RULE_REFERENCE)
				return false;
			if (!isRightAssociativeToken(((RuleReference) alt.get(0)).getName()))
				return false;
		}
		return true;
	}

	private boolean isRightAssociativeToken(String tokenName) {
		String text = grammar.getKeywordSet().getText(tokenName);
		return text != null && RIGHT_ASSOCIATIVE_OPERATORS.contains(text);
	}
}
