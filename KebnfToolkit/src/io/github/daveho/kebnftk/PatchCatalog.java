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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The catalog of {@link Patch}es for known defects of the KerML and
 * SysML v2 grammars. The order of {@link #standard()} is the order
 * in which patches are applied.
 *
 * <p>Patches never insert literals: tokens are looked up (or, when a
 * patch introduces a new token, interned) in the grammar's
 * {@link KeywordSet}.</p>
 */
public class PatchCatalog {
	/**
	 * Rules which build operator expressions from operands and operators.
	 * Inlined into <code>OwnedExpression</code>.
	 */
	public static final List<String> OPERATOR_EXPRESSION_RULES = Arrays.asList(
			"ConditionalExpression",
			"ConditionalBinaryOperatorExpression",
			"BinaryOperatorExpression",
			"UnaryOperatorExpression",
			"ClassificationExpression",
			"MetaclassificationExpression",
			"ExtentExpression");

	/**
	 * Wrapper rules which (directly or indirectly) stand for an
	 * <code>OwnedExpression</code> operand.
	 */
	public static final List<String> OPERAND_RULES = Arrays.asList(
			"ArgumentMember",
			"Argument",
			"ArgumentValue",
			"ArgumentExpressionMember",
			"ArgumentExpression",
			"ArgumentExpressionValue",
			"OwnedExpressionReference",
			"OwnedExpressionMember");

	/**
	 * Rules listing operator tokens.
	 */
	public static final List<String> OPERATOR_RULES = Arrays.asList(
			"ConditionalBinaryOperator",
			"BinaryOperator",
			"UnaryOperator",
			"ClassificationTestOperator",
			"MetaClassificationTestOperator",
			"CastOperator",
			"MetaCastOperator");

	/**
	 * Binary operators grouped by precedence, tightest first.
	 */
	public static final List<List<String>> BINARY_PRECEDENCE = Collections.unmodifiableList(Arrays.asList(
			Arrays.asList("**", "^"),
			Arrays.asList("*", "/", "%"),
			Arrays.asList("+", "-"),
			Arrays.asList(".."),
			Arrays.asList("<", ">", "<=", ">="),
			Arrays.asList("==", "!=", "===", "!=="),
			Arrays.asList("&"),
			Arrays.asList("|"),
			Arrays.asList("xor"),
			Arrays.asList("and"),
			Arrays.asList("or"),
			Arrays.asList("implies"),
			Arrays.asList("??")));

	/** Classification operators bind looser than relational operators, tighter than equality. */
	private static final int CLASSIFICATION_LEVEL = 5;

	private static final String OWNED_EXPRESSION = "OwnedExpression";
	private static final String QUALIFIED_NAME = "QualifiedName";

	private static final List<Patch> STANDARD = Collections.unmodifiableList(Arrays.asList(
			patch("filter-package-import", "FilterPackage", PatchPhase.PRE_TRANSFORM,
					"Break the FilterPackage -> ImportDeclaration -> NamespaceImport -> FilterPackage cycle"),
			patch("owned-expression-operators", OWNED_EXPRESSION, PatchPhase.PRE_TRANSFORM,
					"Inline operator expressions into OwnedExpression, one alternative per precedence level"),
			patch("entry-transition-target", "EntryTransitionMember", PatchPhase.POST_TRANSFORM,
					"'then' TargetSuccession -> 'then' TransitionSuccessionMember"),
			patch("satisfy-optional-not", "SatisfyRequirementUsage", PatchPhase.POST_TRANSFORM,
					"'assert' ( 'not' ) 'satisfy' -> 'assert' ( 'not' )? 'satisfy'"),
			patch("library-optional-standard", "LibraryPackage", PatchPhase.POST_TRANSFORM,
					"( 'standard' ) 'library' -> ( 'standard' )? 'library'"),
			patch("import-optional-visibility", "Import", PatchPhase.POST_TRANSFORM,
					"VisibilityIndicator 'import' -> VisibilityIndicator? 'import'"),
			patch("definition-element-allocation", "DefinitionElement", PatchPhase.POST_TRANSFORM,
					"Add AllocationDefinition after MetadataDefinition"),
			patch("satisfy-optional-assert", "SatisfyRequirementUsage", PatchPhase.POST_TRANSFORM,
					"'assert' ( 'not' )? 'satisfy' -> ( 'assert' ( 'not' )? )? 'satisfy'"),
			patch("send-node-declaration", "SendNode", PatchPhase.POST_TRANSFORM,
					"ActionUsageDeclaration? 'send' -> ( ActionNodeUsageDeclaration | ActionUsageDeclaration )? 'send'"),
			patch("case-body-return", "CaseBodyItem", PatchPhase.POST_TRANSFORM,
					"Add ReturnParameterMember after ActionBodyItem"),
			patch("calculation-usage-declaration", "CalculationUsageDeclaration", PatchPhase.POST_TRANSFORM,
					"Define CalculationUsageDeclaration = UsageDeclaration ValuePart?"),
			featureChain("owned-subsetting-chain", "OwnedSubsetting",
					"GeneralType", QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("owned-reference-subsetting-chain", "OwnedReferenceSubsetting",
					"GeneralType", QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("owned-cross-subsetting-chain", "OwnedCrossSubsetting",
					"GeneralType", QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("owned-redefinition-chain", "OwnedRedefinition",
					"GeneralType", QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("owned-feature-typing-chain", "OwnedFeatureTyping",
					"GeneralType", QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("general-type-chain", "GeneralType",
					QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("specific-type-chain", "SpecificType",
					QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("unioning-chain", "Unioning",
					QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("intersecting-chain", "Intersecting",
					QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("differencing-chain", "Differencing",
					QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("owned-feature-inverting-chain", "OwnedFeatureInverting",
					QUALIFIED_NAME, "OwnedFeatureChain"),
			featureChain("owned-conjugation-chain", "OwnedConjugation",
					QUALIFIED_NAME, "FeatureChain"),
			featureChain("owned-disjoining-chain", "OwnedDisjoining",
					QUALIFIED_NAME, "FeatureChain"),
			featureChain("feature-chain-member", "FeatureChainMember",
					"FeatureReferenceMember", "OwnedFeatureChainMember", QUALIFIED_NAME),
			featureChain("instantiated-type-member", "InstantiatedTypeMember",
					"InstantiatedTypeReference", "OwnedFeatureChainMember"),
			patch("flow-end", "FlowEnd", PatchPhase.POST_TRANSFORM,
					"FlowEnd -> QualifiedName ( '.' QualifiedName )*")));

	private PatchCatalog() {
	}

	/**
	 * @return the standard patch catalog, in application order
	 */
	public static List<Patch> standard() {
		return STANDARD;
	}

	/**
	 * Find a patch in the standard catalog.
	 *
	 * @param id the patch id
	 * @return the patch
	 */
	public static Patch get(String id) {
		for (Patch patch : STANDARD)
			if (patch.getId().equals(id))
				return patch;
		throw new IllegalArgumentException("No such patch: " + id);
	}

	//
	// Pre-transform patches
	//

	static PatchOutcome filterPackageImport(Grammar grammar) {
		Rule filterPackage = grammar.getRule("FilterPackage");
		if (filterPackage == null)
			return PatchOutcome.NO_MATCH;
		if (filterPackage.getReferences().contains("FilterPackageImportDeclaration"))
			return PatchOutcome.ALREADY_APPLIED;
		Rule namespaceImport = grammar.getRule("NamespaceImport");
		if (!filterPackage.getReferences().contains("ImportDeclaration")
				|| namespaceImport == null || !grammar.isDefined("MembershipImport"))
			return PatchOutcome.NO_MATCH;

		List<Alternative> direct = withoutReferencesTo(namespaceImport.getAlternatives(), "FilterPackage");
		if (direct.isEmpty())
			return PatchOutcome.NO_MATCH;

		Rule namespaceImportDirect = new Rule("NamespaceImportDirect", RuleKind.SYNTACTIC, namespaceImport.getSpan());
		namespaceImportDirect.getAlternatives().addAll(direct);
		grammar.addRuleAfter(namespaceImport.getName(), namespaceImportDirect);

		Rule importDeclaration = new Rule("FilterPackageImportDeclaration", RuleKind.SYNTACTIC, filterPackage.getSpan(),
				Alternative.of(new RuleReference("MembershipImport")),
				Alternative.of(new RuleReference("NamespaceImportDirect")));
		grammar.addRuleAfter(filterPackage.getName(), importDeclaration);

		Terms.renameReferences(filterPackage.getAlternatives(), "ImportDeclaration", "FilterPackageImportDeclaration");
		return PatchOutcome.APPLIED;
	}

	static PatchOutcome ownedExpressionOperators(Grammar grammar) {
		Rule ownedExpression = grammar.getRule(OWNED_EXPRESSION);
		if (ownedExpression == null)
			return PatchOutcome.NO_MATCH;

		boolean inlinable = false;
		for (Alternative alt : ownedExpression.getAlternatives())
			if (isInlinableOperatorExpression(grammar, alt))
				inlinable = true;
		if (!inlinable) {
			if (FindLeftRecursion.leftmostReferences(ownedExpression.getAlternatives()).contains(OWNED_EXPRESSION))
				return PatchOutcome.ALREADY_APPLIED;
			return PatchOutcome.NO_MATCH;
		}

		List<Alternative> unary = new ArrayList<Alternative>();
		List<List<Alternative>> binary = new ArrayList<List<Alternative>>();
		for (int i = 0; i < BINARY_PRECEDENCE.size(); ++i)
			binary.add(new ArrayList<Alternative>());
		List<Alternative> classification = new ArrayList<Alternative>();
		List<Alternative> conditional = new ArrayList<Alternative>();
		List<Alternative> other = new ArrayList<Alternative>();
		List<Alternative> kept = new ArrayList<Alternative>();
		Set<String> removable = new LinkedHashSet<String>();

		for (Alternative alt : ownedExpression.getAlternatives()) {
			if (!isInlinableOperatorExpression(grammar, alt)) {
				kept.add(alt);
				continue;
			}
			String ruleName = ((RuleReference) alt.get(0)).getName();
			removable.add(ruleName);
			for (Alternative ruleAlt : grammar.getRule(ruleName).getAlternatives()) {
				Alternative inlined = toOperandForm(grammar, ruleAlt);
				int opIndex = indexOfOperatorRule(inlined);
				if (ruleName.startsWith("Classification") || ruleName.startsWith("Metaclassification")) {
					classification.add(inlined);
				} else if (ruleName.equals("ConditionalExpression")) {
					conditional.add(inlined);
				} else if (opIndex == 0) {
					unary.add(expandOperator(grammar, inlined, 0, null));
					removable.add(((RuleReference) inlined.get(0)).getName());
				} else if (opIndex > 0) {
					String opRule = ((RuleReference) inlined.get(opIndex)).getName();
					removable.add(opRule);
					splitByPrecedence(grammar, inlined, opIndex, binary, other);
				} else {
					other.add(inlined);
				}
			}
		}

		List<Alternative> result = new ArrayList<Alternative>();
		result.addAll(unary);
		for (int i = 0; i < binary.size(); ++i) {
			if (i == CLASSIFICATION_LEVEL)
				result.addAll(classification);
			result.addAll(binary.get(i));
		}
		result.addAll(conditional);
		result.addAll(other);
		result.addAll(kept);
		ownedExpression.getAlternatives().clear();
		ownedExpression.getAlternatives().addAll(result);

		removable.addAll(OPERAND_RULES);
		removeUnreferenced(grammar, removable);
		return PatchOutcome.APPLIED;
	}

	private static boolean isInlinableOperatorExpression(Grammar grammar, Alternative alt) {
		if (alt.size() != 1 || alt.get(0).getType() != TermType.RULE_REFERENCE)
			return false;
		String name = ((RuleReference) alt.get(0)).getName();
		return OPERATOR_EXPRESSION_RULES.contains(name) && grammar.hasRule(name);
	}

	// Copy an alternative, replacing operand wrappers by OwnedExpression and
	// dropping references to rules that only match the empty string.
	private static Alternative toOperandForm(Grammar grammar, Alternative alt) {
		Alternative result = alt.copy();
		List<Alternative> wrapper = Collections.singletonList(result);
		for (String operand : OPERAND_RULES)
			Terms.renameReferences(wrapper, operand, OWNED_EXPRESSION);
		List<Term> terms = result.getTerms();
		for (int i = terms.size() - 1; i >= 0; --i) {
			Term t = terms.get(i);
			if (t.getType() == TermType.RULE_REFERENCE
					&& matchesOnlyEmpty(grammar, ((RuleReference) t).getName(), new HashSet<String>()))
				terms.remove(i);
		}
		return result;
	}

	private static boolean matchesOnlyEmpty(Grammar grammar, String name, Set<String> visiting) {
		Rule rule = grammar.getRule(name);
		if (rule == null || rule.isLexical() || !visiting.add(name))
			return false;
		boolean result = true;
		for (Alternative alt : rule.getAlternatives()) {
			for (Term t : alt.getTerms()) {
				if (t.getType() != TermType.RULE_REFERENCE
						|| !matchesOnlyEmpty(grammar, ((RuleReference) t).getName(), visiting))
					result = false;
			}
		}
		visiting.remove(name);
		return result;
	}

	private static int indexOfOperatorRule(Alternative alt) {
		for (int i = 0; i < alt.size(); ++i) {
			Term t = alt.get(i);
			if (t.getType() == TermType.RULE_REFERENCE && OPERATOR_RULES.contains(((RuleReference) t).getName()))
				return i;
		}
		return -1;
	}

	// Texts of the keyword tokens listed by an operator rule, or null if the
	// operator rule isn't a plain list of keyword tokens.
	private static List<String> operatorTexts(Grammar grammar, String opRule) {
		Rule rule = grammar.getRule(opRule);
		if (rule == null)
			return null;
		List<String> texts = new ArrayList<String>();
		for (Alternative alt : rule.getAlternatives()) {
			if (alt.size() != 1 || alt.get(0).getType() != TermType.RULE_REFERENCE)
				return null;
			String text = grammar.getKeywordSet().getText(((RuleReference) alt.get(0)).getName());
			if (text == null)
				return null;
			texts.add(text);
		}
		return texts;
	}

	// Replace the operator rule reference at opIndex with the given operators
	// (all of the operator rule's operators if null).
	private static Alternative expandOperator(Grammar grammar, Alternative alt, int opIndex, List<String> texts) {
		String opRule = ((RuleReference) alt.get(opIndex)).getName();
		if (texts == null)
			texts = operatorTexts(grammar, opRule);
		if (texts == null)
			return alt;
		Alternative result = alt.copy();
		result.getTerms().set(opIndex, tokenChoice(grammar, texts));
		return result;
	}

	private static void splitByPrecedence(Grammar grammar, Alternative alt, int opIndex,
			List<List<Alternative>> binary, List<Alternative> other) {
		List<String> texts = operatorTexts(grammar, ((RuleReference) alt.get(opIndex)).getName());
		if (texts == null) {
			other.add(alt);
			return;
		}
		List<String> unplaced = new ArrayList<String>(texts);
		for (int level = 0; level < BINARY_PRECEDENCE.size(); ++level) {
			List<String> present = new ArrayList<String>();
			for (String op : BINARY_PRECEDENCE.get(level))
				if (texts.contains(op))
					present.add(op);
			if (!present.isEmpty()) {
				binary.get(level).add(expandOperator(grammar, alt, opIndex, present));
				unplaced.removeAll(present);
			}
		}
		if (!unplaced.isEmpty())
			other.add(expandOperator(grammar, alt, opIndex, unplaced));
	}

	private static Term tokenChoice(Grammar grammar, List<String> texts) {
		if (texts.size() == 1)
			return new RuleReference(grammar.internKeyword(texts.get(0)));
		Group group = new Group();
		for (String text : texts)
			group.getAlternatives().add(Alternative.of(new RuleReference(grammar.internKeyword(text))));
		return group;
	}

	private static void removeUnreferenced(Grammar grammar, Set<String> candidates) {
		boolean changed = true;
		while (changed) {
			changed = false;
			Set<String> referenced = new HashSet<String>();
			for (Rule rule : grammar.getRules())
				referenced.addAll(rule.getReferences());
			for (String name : candidates) {
				if (grammar.hasRule(name) && !referenced.contains(name)) {
					grammar.removeRule(name);
					changed = true;
				}
			}
		}
	}

	//
	// Post-transform patches
	//

	static PatchOutcome entryTransitionTarget(Grammar grammar) {
		Rule rule = grammar.getRule("EntryTransitionMember");
		RuleReference then = keyword(grammar, "then");
		if (rule == null || then == null || !grammar.isDefined("TransitionSuccessionMember"))
			return PatchOutcome.NO_MATCH;
		return replaceSequence(rule,
				Arrays.<Term>asList(then, new RuleReference("TargetSuccession")),
				Arrays.<Term>asList(then.copy(), new RuleReference("TransitionSuccessionMember")));
	}

	static PatchOutcome satisfyOptionalNot(Grammar grammar) {
		Rule rule = grammar.getRule("SatisfyRequirementUsage");
		RuleReference assertKw = keyword(grammar, "assert");
		RuleReference notKw = keyword(grammar, "not");
		RuleReference satisfyKw = keyword(grammar, "satisfy");
		if (rule == null || assertKw == null || notKw == null || satisfyKw == null)
			return PatchOutcome.NO_MATCH;
		Term optionalNot = Quantifier.optional(Group.of(Alternative.of(notKw)));
		PatchOutcome outcome = replaceSequence(rule,
				Arrays.<Term>asList(assertKw, Group.of(Alternative.of(notKw)), satisfyKw),
				Arrays.<Term>asList(assertKw, optionalNot, satisfyKw));
		// satisfy-optional-assert moves the optional 'not' into a group
		if (outcome == PatchOutcome.NO_MATCH
				&& containsSequence(rule.getAlternatives(), Arrays.<Term>asList(assertKw, optionalNot)))
			return PatchOutcome.ALREADY_APPLIED;
		return outcome;
	}

	static PatchOutcome libraryOptionalStandard(Grammar grammar) {
		Rule rule = grammar.getRule("LibraryPackage");
		RuleReference standardKw = keyword(grammar, "standard");
		RuleReference libraryKw = keyword(grammar, "library");
		if (rule == null || standardKw == null || libraryKw == null)
			return PatchOutcome.NO_MATCH;
		return replaceSequence(rule,
				Arrays.<Term>asList(Group.of(Alternative.of(standardKw)), libraryKw),
				Arrays.<Term>asList(Quantifier.optional(Group.of(Alternative.of(standardKw))), libraryKw));
	}

	static PatchOutcome importOptionalVisibility(Grammar grammar) {
		Rule rule = grammar.getRule("Import");
		RuleReference importKw = keyword(grammar, "import");
		if (rule == null || importKw == null)
			return PatchOutcome.NO_MATCH;
		RuleReference visibility = new RuleReference("VisibilityIndicator");
		return replaceSequence(rule,
				Arrays.<Term>asList(visibility, importKw),
				Arrays.<Term>asList(Quantifier.optional(visibility), importKw));
	}

	static PatchOutcome definitionElementAllocation(Grammar grammar) {
		return insertAlternativeAfter(grammar, "DefinitionElement", "MetadataDefinition", "AllocationDefinition");
	}

	static PatchOutcome satisfyOptionalAssert(Grammar grammar) {
		Rule rule = grammar.getRule("SatisfyRequirementUsage");
		RuleReference assertKw = keyword(grammar, "assert");
		RuleReference notKw = keyword(grammar, "not");
		RuleReference satisfyKw = keyword(grammar, "satisfy");
		if (rule == null || assertKw == null || notKw == null || satisfyKw == null)
			return PatchOutcome.NO_MATCH;
		Term optionalNot = Quantifier.optional(Group.of(Alternative.of(notKw)));
		return replaceSequence(rule,
				Arrays.<Term>asList(assertKw, optionalNot, satisfyKw),
				Arrays.<Term>asList(Quantifier.optional(Group.of(Alternative.of(assertKw, optionalNot))), satisfyKw));
	}

	static PatchOutcome sendNodeDeclaration(Grammar grammar) {
		Rule rule = grammar.getRule("SendNode");
		RuleReference sendKw = keyword(grammar, "send");
		if (rule == null || sendKw == null || !grammar.isDefined("ActionNodeUsageDeclaration"))
			return PatchOutcome.NO_MATCH;
		Term declarations = Group.of(
				Alternative.of(new RuleReference("ActionNodeUsageDeclaration")),
				Alternative.of(new RuleReference("ActionUsageDeclaration")));
		return replaceSequence(rule,
				Arrays.<Term>asList(Quantifier.optional(new RuleReference("ActionUsageDeclaration")), sendKw),
				Arrays.<Term>asList(Quantifier.optional(declarations), sendKw));
	}

	static PatchOutcome caseBodyReturn(Grammar grammar) {
		return insertAlternativeAfter(grammar, "CaseBodyItem", "ActionBodyItem", "ReturnParameterMember");
	}

	static PatchOutcome calculationUsageDeclaration(Grammar grammar) {
		String name = "CalculationUsageDeclaration";
		if (grammar.hasRule(name))
			return PatchOutcome.ALREADY_APPLIED;
		Rule referrer = null;
		for (Rule rule : grammar.getRules()) {
			if (rule.getReferences().contains(name)) {
				referrer = rule;
				break;
			}
		}
		if (referrer == null || !grammar.isDefined("UsageDeclaration") || !grammar.isDefined("ValuePart"))
			return PatchOutcome.NO_MATCH;
		grammar.addRule(new Rule(name, RuleKind.SYNTACTIC, referrer.getSpan(),
				Alternative.of(new RuleReference("UsageDeclaration"), Quantifier.optional(new RuleReference("ValuePart")))));
		return PatchOutcome.APPLIED;
	}

	private static Patch patch(String id, String targetRule, PatchPhase phase, String description) {
		return new Patch(id, targetRule, phase, description, new CatalogRewrite(id, targetRule, null));
	}

	/**
	 * Rewrite function of a catalog patch: dispatches on the patch id,
	 * or merges a feature chain if alternatives are given.
	 */
	private static class CatalogRewrite implements Patch.Rewrite {
		private final String id;
		private final String ruleName;
		private final String[] alternatives;

		public CatalogRewrite(String id, String ruleName, String[] alternatives) {
			this.id = id;
			this.ruleName = ruleName;
			this.alternatives = alternatives;
		}

		@Override
		public PatchOutcome apply(Grammar grammar) {
			if (alternatives != null)
				return mergeFeatureChain(grammar, ruleName, alternatives);
			switch (id) {
			case "filter-package-import":
				return filterPackageImport(grammar);
			case "owned-expression-operators":
				return ownedExpressionOperators(grammar);
			case "entry-transition-target":
				return entryTransitionTarget(grammar);
			case "satisfy-optional-not":
				return satisfyOptionalNot(grammar);
			case "library-optional-standard":
				return libraryOptionalStandard(grammar);
			case "import-optional-visibility":
				return importOptionalVisibility(grammar);
			case "definition-element-allocation":
				return definitionElementAllocation(grammar);
			case "satisfy-optional-assert":
				return satisfyOptionalAssert(grammar);
			case "send-node-declaration":
				return sendNodeDeclaration(grammar);
			case "case-body-return":
				return caseBodyReturn(grammar);
			case "calculation-usage-declaration":
				return calculationUsageDeclaration(grammar);
			case "flow-end":
				return flowEnd(grammar);
			default:
				throw new IllegalStateException("No rewrite for patch " + id);
			}
		}
	}

	private static Patch featureChain(String id, String ruleName, String... alternatives) {
		StringBuilder desc = new StringBuilder();
		for (String alt : alternatives)
			desc.append(desc.length() == 0 ? "" : " | ").append(alt);
		desc.append(" -> QualifiedName ( '.' QualifiedName )*");
		return new Patch(id, ruleName, PatchPhase.POST_TRANSFORM, desc.toString(),
				new CatalogRewrite(id, ruleName, alternatives));
	}

	// The alternatives are single references to the given rules, in any order.
	static PatchOutcome mergeFeatureChain(Grammar grammar, String ruleName, String... alternatives) {
		Rule rule = grammar.getRule(ruleName);
		if (rule == null || !grammar.isDefined(QUALIFIED_NAME))
			return PatchOutcome.NO_MATCH;
		if (isQualifiedNameChain(grammar, rule))
			return PatchOutcome.ALREADY_APPLIED;

		Set<String> expected = new HashSet<String>(Arrays.asList(alternatives));
		Set<String> actual = new HashSet<String>();
		for (Alternative alt : rule.getAlternatives()) {
			if (alt.size() != 1 || alt.get(0).getType() != TermType.RULE_REFERENCE)
				return PatchOutcome.NO_MATCH;
			actual.add(((RuleReference) alt.get(0)).getName());
		}
		if (!actual.equals(expected) || actual.size() != rule.getAlternatives().size())
			return PatchOutcome.NO_MATCH;

		setQualifiedNameChain(grammar, rule);
		return PatchOutcome.APPLIED;
	}

	static PatchOutcome flowEnd(Grammar grammar) {
		Rule rule = grammar.getRule("FlowEnd");
		if (rule == null || !grammar.isDefined(QUALIFIED_NAME))
			return PatchOutcome.NO_MATCH;
		if (isQualifiedNameChain(grammar, rule))
			return PatchOutcome.ALREADY_APPLIED;
		if (!rule.getReferences().contains("FlowFeatureMember"))
			return PatchOutcome.NO_MATCH;
		setQualifiedNameChain(grammar, rule);
		return PatchOutcome.APPLIED;
	}

	//
	// Helpers
	//

	private static RuleReference keyword(Grammar grammar, String text) {
		String name = grammar.getKeywordSet().getTokenName(text);
		return name != null ? new RuleReference(name) : null;
	}

	private static Alternative qualifiedNameChain(String dotToken) {
		return Alternative.of(
				new RuleReference(QUALIFIED_NAME),
				Quantifier.zeroOrMore(Group.of(Alternative.of(new RuleReference(dotToken), new RuleReference(QUALIFIED_NAME)))));
	}

	private static boolean isQualifiedNameChain(Grammar grammar, Rule rule) {
		String dot = grammar.getKeywordSet().getTokenName(".");
		return dot != null && rule.getAlternatives().size() == 1
				&& rule.getAlternatives().get(0).equals(qualifiedNameChain(dot));
	}

	private static void setQualifiedNameChain(Grammar grammar, Rule rule) {
		String dot = grammar.internKeyword(".");
		rule.getAlternatives().clear();
		rule.getAlternatives().add(qualifiedNameChain(dot));
	}

	private static PatchOutcome insertAlternativeAfter(Grammar grammar, String ruleName, String after, String added) {
		Rule rule = grammar.getRule(ruleName);
		if (rule == null)
			return PatchOutcome.NO_MATCH;
		List<Alternative> alts = rule.getAlternatives();
		for (Alternative alt : alts)
			if (alt.isSingleReferenceTo(added))
				return PatchOutcome.ALREADY_APPLIED;
		if (!grammar.isDefined(added))
			return PatchOutcome.NO_MATCH;
		for (int i = 0; i < alts.size(); ++i) {
			if (alts.get(i).isSingleReferenceTo(after)) {
				alts.add(i + 1, Alternative.of(new RuleReference(added)));
				return PatchOutcome.APPLIED;
			}
		}
		return PatchOutcome.NO_MATCH;
	}

	/**
	 * Replace every occurrence of a sequence of terms (at any nesting depth)
	 * with another sequence.
	 *
	 * @param rule        the rule
	 * @param oldSequence the sequence to replace
	 * @param newSequence the replacement, which must not contain the old sequence
	 * @return APPLIED if the old sequence was found, ALREADY_APPLIED if only
	 *         the new sequence was found, NO_MATCH otherwise
	 */
	static PatchOutcome replaceSequence(Rule rule, List<Term> oldSequence, List<Term> newSequence) {
		if (replaceSequence(rule.getAlternatives(), oldSequence, newSequence) > 0)
			return PatchOutcome.APPLIED;
		if (containsSequence(rule.getAlternatives(), newSequence))
			return PatchOutcome.ALREADY_APPLIED;
		return PatchOutcome.NO_MATCH;
	}

	private static int replaceSequence(List<Alternative> alternatives, List<Term> oldSequence, List<Term> newSequence) {
		int count = 0;
		for (Alternative alt : alternatives) {
			List<Term> terms = alt.getTerms();
			int index;
			while ((index = Terms.indexOfSequence(terms, oldSequence)) >= 0) {
				terms.subList(index, index + oldSequence.size()).clear();
				for (int i = newSequence.size() - 1; i >= 0; --i)
					terms.add(index, newSequence.get(i).copy());
				++count;
			}
			for (Term t : terms)
				for (List<Alternative> nested : nestedAlternatives(t))
					count += replaceSequence(nested, oldSequence, newSequence);
		}
		return count;
	}

	private static boolean containsSequence(List<Alternative> alternatives, List<Term> sequence) {
		for (Alternative alt : alternatives) {
			if (Terms.indexOfSequence(alt.getTerms(), sequence) >= 0)
				return true;
			for (Term t : alt.getTerms())
				for (List<Alternative> nested : nestedAlternatives(t))
					if (containsSequence(nested, sequence))
						return true;
		}
		return false;
	}

	// Alternative lists directly nested in a term.
	private static List<List<Alternative>> nestedAlternatives(Term t) {
		switch (t.getType()) {
		case GROUP:
			return Collections.singletonList(((Group) t).getAlternatives());
		case OPTIONAL: case ZERO_OR_MORE: case ONE_OR_MORE:
			return nestedAlternatives(((Quantifier) t).getBody());
		default:
			return Collections.emptyList();
		}
	}

	/**
	 * Copy alternatives, leaving out every alternative (at any nesting
	 * depth) which references the named rule. Optional and zero-or-more
	 * terms whose contents all reference the rule are dropped.
	 *
	 * @param alternatives the alternatives
	 * @param name         the rule name
	 * @return the remaining alternatives
	 */
	static List<Alternative> withoutReferencesTo(List<Alternative> alternatives, String name) {
		List<Alternative> result = new ArrayList<Alternative>();
		for (Alternative alt : alternatives) {
			Alternative filtered = new Alternative();
			boolean keep = true;
			for (Term t : alt.getTerms()) {
				if (!Terms.references(t, name)) {
					filtered.add(t.copy());
					continue;
				}
				Term replacement = withoutReferencesTo(t, name);
				if (replacement != null) {
					filtered.add(replacement);
				} else if (!(t instanceof Quantifier && ((Quantifier) t).isNullable())) {
					keep = false;
					break;
				}
			}
			if (keep)
				result.add(filtered);
		}
		return result;
	}

	// Returns null if nothing of the term remains.
	private static Term withoutReferencesTo(Term t, String name) {
		switch (t.getType()) {
		case GROUP:
			List<Alternative> remaining = withoutReferencesTo(((Group) t).getAlternatives(), name);
			if (remaining.isEmpty())
				return null;
			Group group = new Group();
			group.getAlternatives().addAll(remaining);
			return group;
		case OPTIONAL: case ZERO_OR_MORE: case ONE_OR_MORE:
			Term body = withoutReferencesTo(((Quantifier) t).getBody(), name);
			return body != null ? new Quantifier(t.getType(), body) : null;
		default:
			return null;
		}
	}
}
