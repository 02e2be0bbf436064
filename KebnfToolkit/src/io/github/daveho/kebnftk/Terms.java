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

import java.util.List;
import java.util.Set;

/**
 * Static helpers for traversing and querying {@link Term} structures.
 */
public class Terms {
	private Terms() {
	}

	/**
	 * Add the names of all rule references, at any nesting depth, to a set.
	 * 
	 * @param alternatives the alternatives to scan
	 * @param names        set to add names to
	 */
	public static void collectReferences(List<Alternative> alternatives, Set<String> names) {
		for (Alternative alt : alternatives)
			for (Term t : alt.getTerms())
				collectReferences(t, names);
	}

	/**
	 * Add the names of all rule references in a term to a set.
	 * 
	 * @param term  the term
	 * @param names set to add names to
	 */
	public static void collectReferences(Term term, Set<String> names) {
		switch (term.getType()) {
		case RULE_REFERENCE:
			names.add(((RuleReference) term).getName());
			break;
		case GROUP:
			collectReferences(((Group) term).getAlternatives(), names);
			break;
		case OPTIONAL: case ZERO_OR_MORE: case ONE_OR_MORE:
			collectReferences(((Quantifier) term).getBody(), names);
			break;
		default:
			break;
		}
	}

	/**
	 * Check whether any term of the given type occurs, at any nesting depth.
	 * 
	 * @param alternatives the alternatives to scan
	 * @param type         the term type
	 * @return true if a term of the given type occurs
	 */
	public static boolean contains(List<Alternative> alternatives, TermType type) {
		for (Alternative alt : alternatives)
			for (Term t : alt.getTerms())
				if (contains(t, type))
					return true;
		return false;
	}

	private static boolean contains(Term term, TermType type) {
		if (term.getType() == type)
			return true;
		switch (term.getType()) {
		case GROUP:
			return contains(((Group) term).getAlternatives(), type);
		case OPTIONAL: case ZERO_OR_MORE: case ONE_OR_MORE:
			return contains(((Quantifier) term).getBody(), type);
		default:
			return false;
		}
	}

	/**
	 * Check whether a term is, or contains, a reference to the named rule.
	 * 
	 * @param term the term
	 * @param name the rule name
	 * @return true if the term references the rule
	 */
	public static boolean references(Term term, String name) {
		switch (term.getType()) {
		case RULE_REFERENCE:
			return term.isReferenceTo(name);
		case GROUP:
			for (Alternative alt : ((Group) term).getAlternatives())
				if (references(alt, name))
					return true;
			return false;
		case OPTIONAL: case ZERO_OR_MORE: case ONE_OR_MORE:
			return references(((Quantifier) term).getBody(), name);
		default:
			return false;
		}
	}

	/**
	 * Check whether an alternative references the named rule at any depth.
	 * 
	 * @param alt  the alternative
	 * @param name the rule name
	 * @return true if the alternative references the rule
	 */
	public static boolean references(Alternative alt, String name) {
		for (Term t : alt.getTerms())
			if (references(t, name))
				return true;
		return false;
	}

	/**
	 * Replace every reference to one name with a reference to another,
	 * at any nesting depth.
	 * 
	 * @param alternatives the alternatives to rewrite in place
	 * @param from         the name to replace
	 * @param to           the replacement name
	 * @return number of references replaced
	 */
	public static int renameReferences(List<Alternative> alternatives, String from, String to) {
		int count = 0;
		for (Alternative alt : alternatives) {
			List<Term> terms = alt.getTerms();
			for (int i = 0; i < terms.size(); ++i) {
				Term t = terms.get(i);
				if (t.isReferenceTo(from)) {
					terms.set(i, new RuleReference(to));
					++count;
				} else {
					count += renameNested(t, from, to);
				}
			}
		}
		return count;
	}

	private static int renameNested(Term term, String from, String to) {
		switch (term.getType()) {
		case GROUP:
			return renameReferences(((Group) term).getAlternatives(), from, to);
		case OPTIONAL: case ZERO_OR_MORE: case ONE_OR_MORE:
			Quantifier q = (Quantifier) term;
			if (q.getBody().isReferenceTo(from)) {
				q.setBody(new RuleReference(to));
				return 1;
			}
			return renameNested(q.getBody(), from, to);
		default:
			return 0;
		}
	}

	/**
	 * Find the index of a contiguous sequence of terms within a list of terms.
	 * 
	 * @param terms    the list to search
	 * @param sequence the sequence to look for
	 * @return index of the first occurrence, or -1
	 */
	public static int indexOfSequence(List<Term> terms, List<Term> sequence) {
		for (int i = 0; i + sequence.size() <= terms.size(); ++i) {
			if (terms.subList(i, i + sequence.size()).equals(sequence))
				return i;
		}
		return -1;
	}
}
