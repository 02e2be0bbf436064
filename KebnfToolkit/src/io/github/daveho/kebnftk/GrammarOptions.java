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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Options controlling a grammar conversion.
 */
public class GrammarOptions {
	/** Default names of lexical rules whose tokens the lexer skips. */
	public static final List<String> DEFAULT_SKIP_TOKENS =
			Collections.unmodifiableList(Arrays.asList("WHITE_SPACE", "SINGLE_LINE_NOTE", "MULTI_LINE_NOTE"));

	/** Default names of lexical rules listing reserved words. */
	public static final List<String> DEFAULT_RESERVED_KEYWORD_RULES =
			Collections.unmodifiableList(Arrays.asList("RESERVED_KEYWORD"));

	/**
	 * Prefix of the generated grammar names: the lexer grammar is
	 * <i>name</i>Lexer, the parser grammar is <i>name</i>Parser.
	 */
	private String grammarName;

	/** The rule matched by the root rule, or null for the first syntactic rule. */
	private String rootRule;

	/** Name of the generated root rule, which matches the root rule followed by EOF. */
	private String rootMarkerName;

	/** If true, a patch that doesn't match is an error rather than a warning. */
	private boolean strict;

	private Set<String> skipTokens;
	private Set<String> reservedKeywordRules;
	private List<Patch> patchCatalog;

	public GrammarOptions() {
		this.grammarName = "Grammar";
		this.rootRule = null;
		this.rootMarkerName = "root";
		this.strict = Boolean.getBoolean("kebnftk.strict");
		this.skipTokens = new LinkedHashSet<String>(DEFAULT_SKIP_TOKENS);
		this.reservedKeywordRules = new LinkedHashSet<String>(DEFAULT_RESERVED_KEYWORD_RULES);
		this.patchCatalog = PatchCatalog.standard();
	}

	public String getGrammarName() {
		return grammarName;
	}

	public void setGrammarName(String grammarName) {
		this.grammarName = grammarName;
	}

	public String getLexerGrammarName() {
		return grammarName + "Lexer";
	}

	public String getParserGrammarName() {
		return grammarName + "Parser";
	}

	public String getRootRule() {
		return rootRule;
	}

	public void setRootRule(String rootRule) {
		this.rootRule = rootRule;
	}

	public String getRootMarkerName() {
		return rootMarkerName;
	}

	public void setRootMarkerName(String rootMarkerName) {
		this.rootMarkerName = rootMarkerName;
	}

	public boolean isStrict() {
		return strict;
	}

	public void setStrict(boolean strict) {
		this.strict = strict;
	}

	public Set<String> getSkipTokens() {
		return skipTokens;
	}

	public void setSkipTokens(Set<String> skipTokens) {
		this.skipTokens = new LinkedHashSet<String>(skipTokens);
	}

	public Set<String> getReservedKeywordRules() {
		return reservedKeywordRules;
	}

	public void setReservedKeywordRules(Set<String> reservedKeywordRules) {
		this.reservedKeywordRules = new LinkedHashSet<String>(reservedKeywordRules);
	}

	public List<Patch> getPatchCatalog() {
		return patchCatalog;
	}

	/**
	 * Set the patches to apply.
	 * 
	 * @param patchCatalog the patches, in application order
	 */
	public void setPatchCatalog(List<Patch> patchCatalog) {
		this.patchCatalog = Collections.unmodifiableList(new ArrayList<Patch>(patchCatalog));
	}
}
