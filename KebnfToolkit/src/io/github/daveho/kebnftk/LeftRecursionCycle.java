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

/**
 * A cycle of leftmost rule references, e.g. <code>A -&gt; B -&gt; A</code>.
 * The rules are listed from the entry point (the earliest declared rule
 * in the cycle) to the rule whose leftmost reference closes the cycle.
 */
public class LeftRecursionCycle {
	private final List<String> ruleNames;

	/**
	 * Constructor.
	 * 
	 * @param ruleNames the rules forming the cycle, starting at the entry point
	 */
	public LeftRecursionCycle(List<String> ruleNames) {
		if (ruleNames.isEmpty())
			throw new IllegalArgumentException("Empty cycle");
		this.ruleNames = Collections.unmodifiableList(new ArrayList<String>(ruleNames));
	}

	/**
	 * @return the rule names, starting at the entry point
	 */
	public List<String> getRuleNames() {
		return ruleNames;
	}

	/**
	 * @return the entry point rule
	 */
	public String getEntryRule() {
		return ruleNames.get(0);
	}

	/**
	 * A cycle is direct if a rule's leftmost reference is the rule itself.
	 * 
	 * @return true if the cycle is direct
	 */
	public boolean isDirect() {
		return ruleNames.size() == 1;
	}

	public boolean contains(String ruleName) {
		return ruleNames.contains(ruleName);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof LeftRecursionCycle))
			return false;
		return ruleNames.equals(((LeftRecursionCycle) obj).ruleNames);
	}

	@Override
	public int hashCode() {
		return ruleNames.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder();
		for (String name : ruleNames)
			buf.append(name).append(" -> ");
		buf.append(ruleNames.get(0));
		return buf.toString();
	}
}
