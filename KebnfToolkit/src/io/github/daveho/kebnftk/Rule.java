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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A named grammar rule: an ordered list of {@link Alternative}s.
 */
public class Rule {
	/** The rule name, unique within a {@link Grammar}. */
	private final String name;

	/** Whether the rule is lexical or syntactic. */
	private RuleKind kind;

	/** The alternatives, in declaration order. */
	private final List<Alternative> alternatives;

	/** Where the rule was defined. */
	private final SourceSpan span;

	/**
	 * The declared result type (the <code>: Type</code> part of a KEBNF rule header),
	 * or null. Informational only.
	 */
	private String resultType;

	/**
	 * Constructor.
	 * 
	 * @param name the rule name
	 * @param span where the rule is defined
	 */
	public Rule(String name, SourceSpan span) {
		this.name = name;
		this.kind = RuleKind.UNCLASSIFIED;
		this.alternatives = new ArrayList<Alternative>();
		this.span = span;
	}

	/**
	 * Constructor for rules created by rewrites.
	 * 
	 * @param name         the rule name
	 * @param kind         the rule kind
	 * @param span         where the rule (or the rule it derives from) is defined
	 * @param alternatives the alternatives
	 */
	public Rule(String name, RuleKind kind, SourceSpan span, Alternative... alternatives) {
		this(name, span);
		this.kind = kind;
		for (Alternative alt : alternatives)
			this.alternatives.add(alt);
	}

	public String getName() {
		return name;
	}

	public RuleKind getKind() {
		return kind;
	}

	public void setKind(RuleKind kind) {
		this.kind = kind;
	}

	public boolean isLexical() {
		return kind == RuleKind.LEXICAL;
	}

	public boolean isSyntactic() {
		return kind == RuleKind.SYNTACTIC;
	}

	/**
	 * @return the mutable list of alternatives
	 */
	public List<Alternative> getAlternatives() {
		return alternatives;
	}

	public SourceSpan getSpan() {
		return span;
	}

	public String getResultType() {
		return resultType;
	}

	public void setResultType(String resultType) {
		this.resultType = resultType;
	}

	/**
	 * A rule is empty if no alternative has any terms, i.e.,
	 * its body was only prose or non-parsing blocks.
	 * 
	 * @return true if the rule is empty
	 */
	public boolean isEmpty() {
		for (Alternative alt : alternatives)
			if (!alt.isEmpty())
				return false;
		return true;
	}

	/**
	 * @return true if the rule has already been transformed by {@link ApplyPrecedenceClimbing}
	 */
	public boolean hasPrecedenceMarkers() {
		return Terms.contains(alternatives, TermType.PRECEDENCE_MARKER);
	}

	/**
	 * @return names of all rules referenced by this rule, in order of first appearance
	 */
	public Set<String> getReferences() {
		Set<String> result = new LinkedHashSet<String>();
		Terms.collectReferences(alternatives, result);
		return result;
	}

	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder();
		buf.append(name).append(" =");
		for (int i = 0; i < alternatives.size(); ++i) {
			buf.append(i == 0 ? " " : " | ");
			buf.append(alternatives.get(i));
		}
		return buf.toString();
	}
}
