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

/**
 * A targeted rewrite correcting a known defect of the upstream grammar.
 * Patches are applied in catalog order by {@link ApplyPatches}.
 * A patch must recognize its own output, so that applying it twice
 * has the same effect as applying it once.
 */
public class Patch {
	/**
	 * The rewrite function of a patch.
	 */
	public interface Rewrite {
		/**
		 * Apply the rewrite.
		 * 
		 * @param grammar the grammar, modified in place
		 * @return the outcome
		 */
		public PatchOutcome apply(Grammar grammar);
	}

	private final String id;
	private final String targetRule;
	private final PatchPhase phase;
	private final String description;
	private final Rewrite rewrite;

	/**
	 * Constructor.
	 * 
	 * @param id          unique identifier of the patch
	 * @param targetRule  name of the rule the patch rewrites
	 * @param phase       when the patch is applied
	 * @param description what the patch does
	 * @param rewrite     the rewrite function
	 */
	public Patch(String id, String targetRule, PatchPhase phase, String description, Rewrite rewrite) {
		this.id = id;
		this.targetRule = targetRule;
		this.phase = phase;
		this.description = description;
		this.rewrite = rewrite;
	}

	public String getId() {
		return id;
	}

	public String getTargetRule() {
		return targetRule;
	}

	public PatchPhase getPhase() {
		return phase;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * Apply the patch.
	 * 
	 * @param grammar the grammar
	 * @return the outcome
	 */
	public PatchOutcome apply(Grammar grammar) {
		return rewrite.apply(grammar);
	}

	@Override
	public String toString() {
		return id + " (" + targetRule + ")";
	}
}
