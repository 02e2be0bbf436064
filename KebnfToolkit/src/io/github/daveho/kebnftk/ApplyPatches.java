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

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Apply the {@link Patch}es of one {@link PatchPhase}, in catalog order.
 * A patch that matches neither its input nor its output shape produces
 * a warning, or fails the conversion in strict mode.
 */
public class ApplyPatches {
	private static final boolean DEBUG = Boolean.getBoolean("kebnftk.debug");

	private final Grammar grammar;
	private final List<Patch> catalog;
	private final boolean strict;
	private final Diagnostics diagnostics;

	/**
	 * Constructor.
	 * 
	 * @param grammar     the grammar to patch
	 * @param catalog     the patches, in application order
	 * @param strict      true if a patch that doesn't match should be fatal
	 * @param diagnostics collects warnings
	 */
	public ApplyPatches(Grammar grammar, List<Patch> catalog, boolean strict, Diagnostics diagnostics) {
		this.grammar = grammar;
		this.catalog = catalog;
		this.strict = strict;
		this.diagnostics = diagnostics;
	}

	/**
	 * Apply all patches of a phase.
	 * 
	 * @param phase the phase
	 * @return the outcome of each applied patch, keyed by patch id, in catalog order
	 * @throws PatchMismatchException in strict mode, if a patch doesn't match
	 */
	public Map<String, PatchOutcome> execute(PatchPhase phase) {
		Map<String, PatchOutcome> outcomes = new LinkedHashMap<String, PatchOutcome>();
		for (Patch patch : catalog) {
			if (patch.getPhase() != phase)
				continue;
			PatchOutcome outcome = apply(patch);
			outcomes.put(patch.getId(), outcome);
			if (DEBUG)
				System.err.printf("Patch %s: %s%n", patch, outcome);
		}
		return outcomes;
	}

	private PatchOutcome apply(Patch patch) {
		Rule target = grammar.getRule(patch.getTargetRule());
		RuleKind kindBefore = target != null ? target.getKind() : null;
		Set<String> undefinedBefore = undefinedReferences();
		Map<String, RuleKind> kindsBefore = new HashMap<String, RuleKind>();
		for (Rule rule : grammar.getRules())
			kindsBefore.put(rule.getName(), rule.getKind());

		PatchOutcome outcome = patch.apply(grammar);

		if (outcome == PatchOutcome.NO_MATCH) {
			String message = "patch " + patch.getId() + " did not match: " + patch.getDescription();
			SourceSpan span = target != null ? target.getSpan() : null;
			if (strict)
				throw new PatchMismatchException(patch.getTargetRule(), span, message);
			diagnostics.warning(patch.getTargetRule(), span, message);
			return outcome;
		}

		// Sanity checks: a patch must preserve rule kinds and must not
		// introduce references to undefined rules
		Rule after = grammar.getRule(patch.getTargetRule());
		if (kindBefore != null && after != null && after.getKind() != kindBefore)
			throw new IllegalStateException("Patch " + patch.getId() + " changed the kind of rule " + after.getName());
		for (Rule rule : grammar.getRules()) {
			RuleKind before = kindsBefore.get(rule.getName());
			if ((before != null && before != rule.getKind()) || rule.getKind() == RuleKind.UNCLASSIFIED)
				throw new IllegalStateException("Patch " + patch.getId() + " left rule " + rule.getName()
						+ " with kind " + rule.getKind());
		}
		Set<String> undefinedAfter = undefinedReferences();
		undefinedAfter.removeAll(undefinedBefore);
		if (!undefinedAfter.isEmpty())
			throw new IllegalStateException("Patch " + patch.getId() + " introduced undefined references " + undefinedAfter);

		return outcome;
	}

	private Set<String> undefinedReferences() {
		Set<String> result = new LinkedHashSet<String>();
		for (Rule rule : grammar.getRules())
			for (String ref : rule.getReferences())
				if (!grammar.isDefined(ref))
					result.add(ref);
		return result;
	}
}
