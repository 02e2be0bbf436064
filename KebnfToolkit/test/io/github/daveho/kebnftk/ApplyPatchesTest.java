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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class ApplyPatchesTest {
	private static final String FLOW_END =
			"FlowEnd = ( OwnedReferenceSubsetting '.' )? FlowFeatureMember\n" +
			"OwnedReferenceSubsetting = QualifiedName\n" +
			"FlowFeatureMember = NAME\n" +
			"QualifiedName = NAME\n" +
			"NAME = [a-z]+\n";

	private static Grammar prepare(String text) {
		Grammar g = ConvertKebnfToGrammar.parse("test", text);
		new ClassifyRules(g).execute();
		new ExtractKeywords(g).execute();
		return g;
	}

	@Test
	public void testOutcomesInCatalogOrder() throws Exception {
		Grammar g = prepare(FLOW_END);
		Diagnostics diagnostics = new Diagnostics();
		List<Patch> catalog = Arrays.asList(PatchCatalog.get("flow-end"), PatchCatalog.get("import-optional-visibility"));
		Map<String, PatchOutcome> outcomes = new ApplyPatches(g, catalog, false, diagnostics).execute(PatchPhase.POST_TRANSFORM);
		assertEquals("[flow-end, import-optional-visibility]", outcomes.keySet().toString());
		assertEquals(PatchOutcome.APPLIED, outcomes.get("flow-end"));
		assertEquals(PatchOutcome.NO_MATCH, outcomes.get("import-optional-visibility"));
		assertEquals(1, diagnostics.getWarnings().size());
	}

	@Test
	public void testOnlyRequestedPhase() throws Exception {
		Grammar g = prepare(FLOW_END);
		Map<String, PatchOutcome> outcomes = new ApplyPatches(g, PatchCatalog.standard(), false, new Diagnostics())
				.execute(PatchPhase.PRE_TRANSFORM);
		assertEquals("[filter-package-import, owned-expression-operators]", outcomes.keySet().toString());
		assertEquals(1, g.getRule("FlowEnd").getAlternatives().size());
		assertTrue(g.getRule("FlowEnd").getReferences().contains("FlowFeatureMember"));
	}

	@Test
	public void testReapplyProducesNoWarnings() throws Exception {
		Grammar g = prepare(FLOW_END);
		Diagnostics diagnostics = new Diagnostics();
		ApplyPatches patches = new ApplyPatches(g, Collections.singletonList(PatchCatalog.get("flow-end")), false, diagnostics);
		patches.execute(PatchPhase.POST_TRANSFORM);
		Map<String, PatchOutcome> outcomes = patches.execute(PatchPhase.POST_TRANSFORM);
		assertEquals(PatchOutcome.ALREADY_APPLIED, outcomes.get("flow-end"));
		assertTrue(diagnostics.getDiagnostics().isEmpty());
	}

	@Test
	public void testMismatchIsWarningWhenLenient() throws Exception {
		Grammar g = prepare("A = 'x'\n");
		Diagnostics diagnostics = new Diagnostics();
		new ApplyPatches(g, Collections.singletonList(PatchCatalog.get("flow-end")), false, diagnostics)
				.execute(PatchPhase.POST_TRANSFORM);
		assertEquals(1, diagnostics.getWarnings().size());
		Diagnostic warning = diagnostics.getWarnings().get(0);
		assertEquals("FlowEnd", warning.getRuleName());
		assertTrue(warning.getMessage().contains("flow-end"));
		assertTrue(!diagnostics.hasFatal());
	}

	@Test
	public void testMismatchIsFatalWhenStrict() throws Exception {
		Grammar g = prepare("A = 'x'\n");
		try {
			new ApplyPatches(g, Collections.singletonList(PatchCatalog.get("flow-end")), true, new Diagnostics())
					.execute(PatchPhase.POST_TRANSFORM);
			fail();
		} catch (PatchMismatchException e) {
			assertEquals("FlowEnd", e.getRuleName());
			assertNull(e.getSpan());
			assertTrue(e.getMessage().contains("flow-end"));
		}
	}

	@Test(expected = IllegalStateException.class)
	public void testPatchIntroducingUndefinedReference() throws Exception {
		Grammar g = prepare("A = 'x'\n");
		Patch broken = new Patch("broken", "A", PatchPhase.POST_TRANSFORM, "Reference a missing rule", new Patch.Rewrite() {
			@Override
			public PatchOutcome apply(Grammar grammar) {
				grammar.getRule("A").getAlternatives().add(Alternative.of(new RuleReference("Missing")));
				return PatchOutcome.APPLIED;
			}
		});
		new ApplyPatches(g, Collections.singletonList(broken), false, new Diagnostics()).execute(PatchPhase.POST_TRANSFORM);
	}

	@Test(expected = IllegalStateException.class)
	public void testPatchChangingRuleKind() throws Exception {
		Grammar g = prepare("A = 'x'\n");
		Patch broken = new Patch("broken", "A", PatchPhase.POST_TRANSFORM, "Make A lexical", new Patch.Rewrite() {
			@Override
			public PatchOutcome apply(Grammar grammar) {
				grammar.getRule("A").setKind(RuleKind.LEXICAL);
				return PatchOutcome.APPLIED;
			}
		});
		new ApplyPatches(g, Collections.singletonList(broken), false, new Diagnostics()).execute(PatchPhase.POST_TRANSFORM);
	}
}
