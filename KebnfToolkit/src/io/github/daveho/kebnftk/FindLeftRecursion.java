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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Find left-recursion cycles in a {@link Grammar}.
 * 
 * <p>The dependency graph has an edge from rule A to rule B if B can be the
 * leftmost element of one of A's alternatives: the first term, looking
 * into groups and past leading terms that may match nothing (optional
 * and zero-or-more terms). References to undefined rules and to keyword
 * tokens are ignored.</p>
 * 
 * <p>Every elementary cycle is reported once, starting at its earliest
 * declared rule. Cycles are listed in declaration order of their entry
 * points. The graph is recomputed on every call; the grammar is not
 * modified.</p>
 */
public class FindLeftRecursion {
	private final Grammar grammar;

	/** Edges of the dependency graph, in order of first appearance. */
	private Map<String, Set<String>> edges;

	/** Declaration index of each rule. */
	private Map<String, Integer> order;

	/** Strongly connected component index of each rule. */
	private Map<String, Integer> component;

	/** Number of rules in each component. */
	private List<Integer> componentSize;

	private List<LeftRecursionCycle> cycles;

	// Tarjan bookkeeping
	private Map<String, Integer> index;
	private Map<String, Integer> lowLink;
	private List<String> stack;
	private Set<String> onStack;

	/**
	 * Constructor.
	 * 
	 * @param grammar the grammar
	 */
	public FindLeftRecursion(Grammar grammar) {
		this.grammar = grammar;
	}

	/**
	 * Find all left-recursion cycles.
	 * 
	 * @return the cycles
	 */
	public List<LeftRecursionCycle> execute() {
		buildGraph();
		findComponents();
		cycles = new ArrayList<LeftRecursionCycle>();
		for (String start : edges.keySet()) {
			if (!isCyclic(start))
				continue;
			List<String> path = new ArrayList<String>();
			path.add(start);
			search(start, start, path);
		}
		return cycles;
	}

	/**
	 * Get the names of rules that are direct-left-recursive.
	 * 
	 * @return the direct-left-recursive rule names, in declaration order
	 */
	public Set<String> getDirectlyRecursiveRules() {
		Set<String> result = new LinkedHashSet<String>();
		for (LeftRecursionCycle cycle : execute())
			if (cycle.isDirect())
				result.add(cycle.getEntryRule());
		return result;
	}

	private void buildGraph() {
		edges = new LinkedHashMap<String, Set<String>>();
		order = new HashMap<String, Integer>();
		for (Rule rule : grammar.getRules()) {
			order.put(rule.getName(), order.size());
			Set<String> succ = new LinkedHashSet<String>();
			for (String ref : leftmostReferences(rule.getAlternatives()))
				if (grammar.hasRule(ref))
					succ.add(ref);
			edges.put(rule.getName(), succ);
		}
	}

	private void search(String start, String node, List<String> path) {
		int startIndex = order.get(start);
		for (String succ : edges.get(node)) {
			if (succ.equals(start)) {
				cycles.add(new LeftRecursionCycle(path));
			} else if (order.get(succ) > startIndex
					&& component.get(succ).equals(component.get(start))
					&& !path.contains(succ)) {
				// only visit rules declared after the start rule, so that
				// each cycle is found exactly once (from its earliest rule);
				// a cycle through start never leaves start's component
				path.add(succ);
				search(start, succ, path);
				path.remove(path.size() - 1);
			}
		}
	}

	// A rule is on a cycle if its component has more than one rule,
	// or if it references itself.
	private boolean isCyclic(String name) {
		if (edges.get(name).contains(name))
			return true;
		return componentSize.get(component.get(name)) > 1;
	}

	private void findComponents() {
		component = new HashMap<String, Integer>();
		componentSize = new ArrayList<Integer>();
		index = new HashMap<String, Integer>();
		lowLink = new HashMap<String, Integer>();
		stack = new ArrayList<String>();
		onStack = new HashSet<String>();
		for (String name : edges.keySet())
			if (!index.containsKey(name))
				strongConnect(name);
	}

	private void strongConnect(String node) {
		index.put(node, index.size());
		lowLink.put(node, index.get(node));
		stack.add(node);
		onStack.add(node);

		for (String succ : edges.get(node)) {
			if (!index.containsKey(succ)) {
				strongConnect(succ);
				lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(succ)));
			} else if (onStack.contains(succ)) {
				lowLink.put(node, Math.min(lowLink.get(node), index.get(succ)));
			}
		}

		if (lowLink.get(node).equals(index.get(node))) {
			// node is the root of a component: pop it
			int c = componentSize.size();
			int size = 0;
			String member;
			do {
				member = stack.remove(stack.size() - 1);
				onStack.remove(member);
				component.put(member, c);
				size++;
			} while (!member.equals(node));
			componentSize.add(size);
		}
	}

	/**
	 * Get the rules that can be referenced in the leftmost position of
	 * any of the given alternatives.
	 * 
	 * @param alternatives the alternatives
	 * @return the leftmost referenced names, in order of appearance
	 */
	public static Set<String> leftmostReferences(List<Alternative> alternatives) {
		Set<String> result = new LinkedHashSet<String>();
		for (Alternative alt : alternatives)
			addLeftmost(alt.getTerms(), result);
		return result;
	}

	/**
	 * Get the rules that can be referenced in the leftmost position
	 * of an alternative.
	 * 
	 * @param alt the alternative
	 * @return the leftmost referenced names, in order of appearance
	 */
	public static Set<String> leftmostReferences(Alternative alt) {
		Set<String> result = new LinkedHashSet<String>();
		addLeftmost(alt.getTerms(), result);
		return result;
	}

	// Returns true if the whole sequence may match nothing.
	private static boolean addLeftmost(List<Term> terms, Set<String> result) {
		for (Term t : terms)
			if (!addLeftmost(t, result))
				return false;
		return true;
	}

	// Returns true if the term may match nothing.
	private static boolean addLeftmost(Term t, Set<String> result) {
		switch (t.getType()) {
		case RULE_REFERENCE:
			result.add(((RuleReference) t).getName());
			return false;
		case GROUP:
			boolean nullable = false;
			for (Alternative alt : ((Group) t).getAlternatives())
				if (addLeftmost(alt.getTerms(), result))
					nullable = true;
			return nullable;
		case OPTIONAL: case ZERO_OR_MORE:
			addLeftmost(((Quantifier) t).getBody(), result);
			return true;
		case ONE_OR_MORE:
			return addLeftmost(((Quantifier) t).getBody(), result);
		case PRECEDENCE_MARKER:
			return true;
		default:
			return false;
		}
	}
}
