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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;

import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.core.SoundnessError;
import puresmt.logic.BindingEnv;
import puresmt.logic.LogicCompiler;
import puresmt.logic.LogicSort;
import puresmt.logic.Scope;
import puresmt.logic.ScopeResolver;
import puresmt.prover.AssertionCompiler;
import puresmt.prover.KnowledgeExpansion;
import puresmt.prover.ProofOracle;
import puresmt.prover.ProofResult;
import puresmt.prover.ProofSolver;
import puresmt.prover.Statement;
import puresmt.prover.TrivialProofOracle;
import puresmt.registry.DefinitionRegistry;
import puresmt.registry.ModuleInfo;

/**
 * Proves assertions against a registry of pure definitions. Each proof attempt
 * has its own solver context and binding environment, so attempts share
 * nothing but the registry.
 *
 * @author The PureSMT Project Developers
 */
public class ProveTask {
	private static final Logger logger = LoggerFactory.getLogger(ProveTask.class);

	/**
	 * Environment variable selecting reproduction mode when set to
	 * <code>1</code> or <code>true</code>.
	 */
	public static final String REPRO_VARIABLE = "PURESMT_REPRO";

	private final DefinitionRegistry registry;
	/**
	 * Solver timeout in milliseconds.
	 */
	private int timeout = ProofSolver.DEFAULT_TIMEOUT;
	private int maxAxioms = ProofSolver.DEFAULT_MAX_AXIOMS;
	private int maxDepth = KnowledgeExpansion.DEFAULT_MAX_ROUNDS;
	private boolean repro = isReproRequested(System.getenv(REPRO_VARIABLE));
	private Path reproFile = Paths.get(ProofSolver.DEFAULT_REPRO_FILE);
	private ProofOracle oracle = new TrivialProofOracle();
	/**
	 * The solver of the attempt in progress, if any.
	 */
	private volatile ProofSolver current;

	public ProveTask(DefinitionRegistry registry) {
		if (registry == null) {
			throw new IllegalArgumentException("invalid registry");
		}
		this.registry = registry;
	}

	public DefinitionRegistry getRegistry() {
		return registry;
	}

	public ProveTask setTimeout(int timeout) {
		if (timeout <= 0) {
			throw new IllegalArgumentException("invalid timeout");
		}
		this.timeout = timeout;
		return this;
	}

	public ProveTask setMaxAxioms(int maxAxioms) {
		if (maxAxioms < 0) {
			throw new IllegalArgumentException("invalid axiom limit");
		}
		this.maxAxioms = maxAxioms;
		return this;
	}

	/**
	 * Set the maximum number of knowledge expansion rounds.
	 *
	 * @param maxDepth
	 * @return
	 */
	public ProveTask setMaxDepth(int maxDepth) {
		if (maxDepth < 0) {
			throw new IllegalArgumentException("invalid depth");
		}
		this.maxDepth = maxDepth;
		return this;
	}

	public ProveTask setRepro(boolean repro) {
		this.repro = repro;
		return this;
	}

	public ProveTask setReproFile(Path reproFile) {
		if (reproFile == null) {
			throw new IllegalArgumentException("invalid repro file");
		}
		this.reproFile = reproFile;
		return this;
	}

	public ProveTask setOracle(ProofOracle oracle) {
		if (oracle == null) {
			throw new IllegalArgumentException("invalid oracle");
		}
		this.oracle = oracle;
		return this;
	}

	/**
	 * Cancel the proof attempt in progress, if any.
	 */
	public void cancel() {
		ProofSolver solver = current;
		if (solver != null) {
			solver.cancel();
		}
	}

	public ProofResult check(Decl.FunctionDef conclusion) {
		return check(conclusion, null);
	}

	/**
	 * Check an assertion, cross-checking the outcome against a counterexample
	 * found by other means (e.g. by executing the assertion). When there is a
	 * counterexample the assertion is refuted, and it is a fatal error for the
	 * proof to have succeeded regardless.
	 *
	 * @param conclusion
	 * @param counterexample Argument values falsifying the assertion, or
	 *                       <code>null</code> if none is known
	 * @return
	 */
	public ProofResult check(Decl.FunctionDef conclusion, Map<String, ?> counterexample) {
		ProofResult result = prove(registry, conclusion, registry.getScope(conclusion));
		if (counterexample != null) {
			logger.warn("Counterexample found: {}", counterexample);
			if (result.isProven()) {
				throw new SoundnessError("Counterexample conflicts with proof", conclusion);
			}
			return ProofResult.refuted(counterexample.toString(), result.getReport());
		} else if (result.getStatus() == ProofResult.Status.REFUTED) {
			logger.info("Cannot prove, but cannot find counterexample");
		}
		return result;
	}

	/**
	 * Check every assertion of a module in turn. Each is proved assuming the
	 * definitions of the module, and the assertions before it.
	 *
	 * @param file
	 * @return
	 */
	public List<ProofResult> checkAll(PureFile file) {
		List<Decl.FunctionDef> definitions = new ArrayList<>();
		List<Decl.FunctionDef> assertions = new ArrayList<>();
		for (Decl.FunctionDef d : file.getDeclarations()) {
			(d.getName().startsWith(ModuleInfo.ASSERTION_PREFIX) ? assertions : definitions).add(d);
		}
		List<ProofResult> results = new ArrayList<>();
		for (int i = 0; i != assertions.size(); ++i) {
			List<Decl.FunctionDef> assumed = new ArrayList<>(definitions);
			assumed.addAll(assertions.subList(0, i));
			PureFile module = new PureFile(file.getName(), assumed);
			results.add(prove(registry.extend(module), assertions.get(i), Scope.of(module)));
		}
		return results;
	}

	private ProofResult prove(DefinitionRegistry registry, Decl.FunctionDef conclusion, Scope scope) {
		logger.info("Checking assertion:\n{}", conclusion);
		try (Context context = new Context()) {
			LogicSort sort = new LogicSort(context);
			BindingEnv env = new BindingEnv(sort);
			LogicCompiler compiler = new LogicCompiler(new ScopeResolver(registry), env);
			AssertionCompiler assertions = new AssertionCompiler(compiler);
			BoolExpr goal = assertions.compileConclusion(conclusion, scope);
			List<Statement> axioms = new KnowledgeExpansion(registry, assertions).setMaxRounds(maxDepth).expand();
			oracle.scoreAxioms(axioms, conclusion);
			ProofSolver solver = new ProofSolver(sort).setTimeout(timeout).setMaxAxioms(maxAxioms).setRepro(repro)
					.setReproFile(reproFile);
			current = solver;
			try {
				return solver.solve(axioms, goal);
			} finally {
				current = null;
			}
		}
	}

	static boolean isReproRequested(String value) {
		return "1".equals(value) || "true".equals(value);
	}
}
