// Copyright 2026 The PureSMT Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package puresmt.tasks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.core.SoundnessError;
import puresmt.io.PureFileParser;
import puresmt.prover.ProofResult;
import puresmt.prover.ProofSolver;
import puresmt.registry.DefinitionRegistry;

public class ProveTaskTests {
	/**
	 * Solver timeout (in milliseconds) for each proof attempt.
	 */
	private static final int TIMEOUT = 5000;

	private static final String ADDITION = "def c(x: isint, y: isint):\n    return isint(x + y)\n";

	private static final String NOT_BOOL = "def c(x: isint):\n    return isbool(x)\n";

	private static PureFile parse(String text) {
		return new PureFileParser("test", text).read();
	}

	private static Decl.FunctionDef conclusion(String text) {
		return parse(text).getDeclarations().get(0);
	}

	private static ProveTask task(DefinitionRegistry registry) {
		return new ProveTask(registry).setTimeout(TIMEOUT).setRepro(false);
	}

	@Test
	public void testProveAddition() {
		ProofResult result = task(DefinitionRegistry.standard()).check(conclusion(ADDITION));
		assertEquals(ProofResult.Status.PROVEN, result.getStatus());
		assertTrue(result.getCore().contains(ProofSolver.CONCLUSION));
	}

	@Test
	public void testProveLiteral() {
		ProofResult result = task(DefinitionRegistry.standard()).check(conclusion("def c():\n    return isint(3)\n"));
		assertTrue(result.isProven());
	}

	@Test
	public void testProveWithUnrelatedUserDefinition() {
		String goal = "def c(p: isint, q: isint):\n    return isint(p + q)\n";
		// x is also a parameter name of the prelude assertions
		DefinitionRegistry registry = DefinitionRegistry.of(parse("def x():\n    return 1\n"));
		ProofResult result = task(registry).check(conclusion(goal));
		assertEquals(ProofResult.Status.PROVEN, result.getStatus());
	}

	@Test
	public void testCannotProve() {
		// Without model-based instantiation the solver gives up rather than
		// producing a model
		ProofResult result = task(DefinitionRegistry.standard()).check(conclusion(NOT_BOOL));
		assertEquals(ProofResult.Status.UNKNOWN, result.getStatus());
		assertNotNull(result.getReason());
		assertNull(result.getModel());
	}

	@Test
	public void testInconsistentAxioms() {
		DefinitionRegistry registry = DefinitionRegistry.of(parse("def _assert_():\n    return False\n"));
		assertThrows(SoundnessError.class, () -> task(registry).check(conclusion(NOT_BOOL)));
	}

	@Test
	public void testCounterexampleConflictsWithProof() {
		ProveTask task = task(DefinitionRegistry.standard());
		SoundnessError e = assertThrows(SoundnessError.class,
				() -> task.check(conclusion(ADDITION), Collections.singletonMap("x", 1)));
		assertEquals("Counterexample conflicts with proof", e.getMessage());
	}

	@Test
	public void testCounterexample() {
		ProofResult result = task(DefinitionRegistry.standard()).check(conclusion(NOT_BOOL),
				Collections.singletonMap("x", 1));
		assertEquals(ProofResult.Status.REFUTED, result.getStatus());
		assertEquals("{x=1}", result.getModel());
	}

	@Test
	public void testCheckAll() {
		PureFile module = parse("def inc(x: isint) -> isint:\n    return x + 1\n\n"
				+ "def _assert_inc(x: isint):\n    return isint(inc(x))\n\n"
				+ "def _assert_inc(x: isint):\n    return isint(inc(inc(x)))\n");
		List<ProofResult> results = task(DefinitionRegistry.standard()).checkAll(module);
		assertEquals(2, results.size());
		for (ProofResult r : results) {
			assertTrue(r.isProven(), r.toString());
		}
	}

	@Test
	public void testRepro(@TempDir Path dir) {
		Path file = dir.resolve("repro.smt2");
		ProofResult result = task(DefinitionRegistry.standard()).setRepro(true).setReproFile(file)
				.check(conclusion(ADDITION));
		assertTrue(result.isProven());
		assertTrue(Files.exists(file));
	}

	@Test
	public void testReproRequested() {
		assertTrue(ProveTask.isReproRequested("1"));
		assertTrue(ProveTask.isReproRequested("true"));
		assertFalse(ProveTask.isReproRequested("yes"));
		assertFalse(ProveTask.isReproRequested(null));
	}

	@Test
	public void testInvalidSettings() {
		assertThrows(IllegalArgumentException.class, () -> new ProveTask(null));
		ProveTask task = new ProveTask(DefinitionRegistry.standard());
		assertThrows(IllegalArgumentException.class, () -> task.setTimeout(0));
		assertThrows(IllegalArgumentException.class, () -> task.setMaxAxioms(-1));
		assertThrows(IllegalArgumentException.class, () -> task.setMaxDepth(-1));
		assertThrows(IllegalArgumentException.class, () -> task.setOracle(null));
		assertThrows(IllegalArgumentException.class, () -> task.setReproFile(null));
	}
}
