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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A grammar: rules keyed by name, in declaration order, plus the
 * {@link KeywordSet} of literal tokens. Rules refer to each other
 * by name.
 */
public class Grammar {
	private Map<String, Rule> rules;
	private final KeywordSet keywordSet;

	public Grammar() {
		this.rules = new LinkedHashMap<String, Rule>();
		this.keywordSet = new KeywordSet();
	}

	/**
	 * Add a rule at the end of the rule order.
	 * 
	 * @param rule the rule
	 */
	public void addRule(Rule rule) {
		if (rules.containsKey(rule.getName()))
			throw new IllegalStateException("Rule " + rule.getName() + " already exists");
		rules.put(rule.getName(), rule);
	}

	/**
	 * Add a rule at the beginning of the rule order.
	 * 
	 * @param rule the rule
	 */
	public void addRuleFirst(Rule rule) {
		if (rules.containsKey(rule.getName()))
			throw new IllegalStateException("Rule " + rule.getName() + " already exists");
		Map<String, Rule> reordered = new LinkedHashMap<String, Rule>();
		reordered.put(rule.getName(), rule);
		reordered.putAll(rules);
		rules = reordered;
	}

	/**
	 * Add a rule immediately after an existing rule.
	 * 
	 * @param existingName name of the existing rule
	 * @param rule         the rule to add
	 */
	public void addRuleAfter(String existingName, Rule rule) {
		if (!rules.containsKey(existingName))
			throw new IllegalStateException("Rule " + existingName + " does not exist");
		if (rules.containsKey(rule.getName()))
			throw new IllegalStateException("Rule " + rule.getName() + " already exists");
		Map<String, Rule> reordered = new LinkedHashMap<String, Rule>();
		for (Map.Entry<String, Rule> e : rules.entrySet()) {
			reordered.put(e.getKey(), e.getValue());
			if (e.getKey().equals(existingName))
				reordered.put(rule.getName(), rule);
		}
		rules = reordered;
	}

	/**
	 * Replace a rule with a new rule of the same name, keeping its position.
	 * 
	 * @param rule the replacement rule
	 */
	public void replaceRule(Rule rule) {
		if (!rules.containsKey(rule.getName()))
			throw new IllegalStateException("Rule " + rule.getName() + " does not exist");
		rules.put(rule.getName(), rule);
	}

	/**
	 * Remove a rule.
	 * 
	 * @param name the rule name
	 * @return the removed rule, or null if there was no such rule
	 */
	public Rule removeRule(String name) {
		return rules.remove(name);
	}

	/**
	 * @param name a rule name
	 * @return the rule, or null if there is no such rule
	 */
	public Rule getRule(String name) {
		return rules.get(name);
	}

	public boolean hasRule(String name) {
		return rules.containsKey(name);
	}

	/**
	 * @return the rules, in declaration order
	 */
	public Collection<Rule> getRules() {
		return Collections.unmodifiableCollection(rules.values());
	}

	/**
	 * @return the rules of the given kind, in declaration order
	 */
	public List<Rule> getRules(RuleKind kind) {
		List<Rule> result = new ArrayList<Rule>();
		for (Rule rule : rules.values())
			if (rule.getKind() == kind)
				result.add(rule);
		return result;
	}

	public int size() {
		return rules.size();
	}

	public KeywordSet getKeywordSet() {
		return keywordSet;
	}

	/**
	 * Check whether a name can be referenced: either a rule with
	 * content (an empty lexical rule matches nothing and cannot be
	 * referenced), or a keyword token.
	 * 
	 * @param name a rule or token name
	 * @return true if the name is defined
	 */
	public boolean isDefined(String name) {
		if (keywordSet.isTokenName(name))
			return true;
		Rule rule = rules.get(name);
		return rule != null && !(rule.isLexical() && rule.isEmpty());
	}

	/**
	 * Get the token name for literal text, adding it to the keyword set
	 * (and to the keyword rule) if necessary.
	 * 
	 * @param text the literal text
	 * @return the token name
	 */
	public String internKeyword(String text) {
		int before = keywordSet.size();
		String name = keywordSet.intern(text, rules.keySet());
		if (keywordSet.size() != before)
			syncKeywordRule();
		return name;
	}

	/**
	 * Make the keyword rule reflect the keyword set: one labeled
	 * alternative per keyword, longest literal first. The keyword
	 * rule is created (as the first rule) if it doesn't exist yet.
	 */
	public void syncKeywordRule() {
		Rule keywordRule = rules.get(KeywordSet.RULE_NAME);
		if (keywordRule == null) {
			if (keywordSet.size() == 0)
				return;
			keywordRule = new Rule(KeywordSet.RULE_NAME, RuleKind.LEXICAL, null);
			addRuleFirst(keywordRule);
		}
		keywordRule.getAlternatives().clear();
		for (KeywordSet.Entry entry : keywordSet.getEntries()) {
			Alternative alt = Alternative.of(new Literal(entry.getText()));
			alt.setLabel(entry.getTokenName());
			keywordRule.getAlternatives().add(alt);
		}
	}
}
