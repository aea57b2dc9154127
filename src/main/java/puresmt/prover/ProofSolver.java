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
package puresmt.prover;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;

import puresmt.core.SoundnessError;
import puresmt.logic.LogicSort;

/**
 * Submits axioms and the negation of a conclusion to Z3. In tracked mode every
 * formula is labelled, so that the unsat core of a proof can be checked to
 * contain the conclusion; a proof whose core does not is unsound, since the
 * axioms alone must then be contradictory. In reproduction mode the formulas
 * are asserted without labels and written to a file in SMT-LIB format for
 * replay against the solver itself.
 *
 * @author The PureSMT Project Developers
 */
public class ProofSolver {
	private static final Logger logger = LoggerFactory.getLogger(ProofSolver.class);

	public static final String CONCLUSION = "conclusion";
	public static final String ASSUMPTION = "assumption";
	public static final int DEFAULT_TIMEOUT = 10000;
	public static final int DEFAULT_MAX_AXIOMS = 120;
	public static final String DEFAULT_REPRO_FILE = "repro.smt2";

	private final Context context;
	private int timeout = DEFAULT_TIMEOUT;
	private int maxAxioms = DEFAULT_MAX_AXIOMS;
	private boolean repro = false;
	private Path reproFile = Paths.get(DEFAULT_REPRO_FILE);

	public ProofSolver(LogicSort sort) {
		this.context = sort.getContext();
	}

	/**
	 * Set the solver timeout in milliseconds.
	 *
	 * @param timeout
	 * @return
	 */
	public ProofSolver setTimeout(int timeout) {
		if (timeout <= 0) {
			throw new IllegalArgumentException("invalid timeout");
		}
		this.timeout = timeout;
		return this;
	}

	/**
	 * Set the maximum number of scored axioms passed to the solver.
	 *
	 * @param maxAxioms
	 * @return
	 */
	public ProofSolver setMaxAxioms(int maxAxioms) {
		if (maxAxioms < 0) {
			throw new IllegalArgumentException("invalid axiom limit");
		}
		this.maxAxioms = maxAxioms;
		return this;
	}

	public ProofSolver setRepro(boolean repro) {
		this.repro = repro;
		return this;
	}

	public ProofSolver setReproFile(Path reproFile) {
		this.reproFile = reproFile;
		return this;
	}

	/**
	 * Interrupt a check in progress on another thread. The check then reports
	 * an unknown outcome.
	 */
	public void cancel() {
		context.interrupt();
	}

	/**
	 * Select the statements to use: every required statement, followed by the
	 * best scoring of the others.
	 *
	 * @param statements
	 * @return
	 */
	public List<Statement> select(List<Statement> statements) {
		List<Statement> required = new ArrayList<>();
		List<Statement> scored = new ArrayList<>();
		for (Statement s : statements) {
			(s.isRequired() ? required : scored).add(s);
		}
		scored.sort(Comparator.comparing(Statement::getScore, Comparator.nullsLast(Comparator.naturalOrder())));
		required.addAll(scored.subList(0, Math.min(maxAxioms, scored.size())));
		return required;
	}

	public ProofResult solve(List<Statement> statements, BoolExpr conclusion) {
		Solver solver = context.mkSolver();
		Params params = context.mkParams();
		params.add("timeout", timeout);
		params.add("unsat_core", true);
		params.add("smt.mbqi", false);
		params.add("smt.macro_finder", true);
		params.add("smt.pull_nested_quantifiers", false);
		solver.setParameters(params);
		//
		Map<String, Statement> index = new LinkedHashMap<>();
		BoolExpr negated = context.mkNot(conclusion);
		List<Statement> selected = select(statements);
		if (repro) {
			for (Statement s : selected) {
				solver.add(s.getFormula());
			}
			solver.add(negated);
		} else {
			for (int i = 0; i != selected.size(); ++i) {
				String label = ASSUMPTION + i;
				index.put(label, selected.get(i));
				solver.assertAndTrack(selected.get(i).getFormula(), context.mkBoolConst(label));
			}
			solver.assertAndTrack(negated, context.mkBoolConst(CONCLUSION));
		}
		ProofResult result;
		try {
			Status status = solver.check();
			if (status == Status.UNSATISFIABLE) {
				Set<String> core = new LinkedHashSet<>();
				if (!repro) {
					for (BoolExpr label : solver.getUnsatCore()) {
						core.add(label.toString());
					}
					logCore(core, index);
					if (!core.contains(CONCLUSION)) {
						throw new SoundnessError("Soundness failure; conclusion not required for proof");
					}
				}
				result = ProofResult.proven(core, report(index, core));
			} else if (status == Status.SATISFIABLE) {
				String model = solver.getModel().toString();
				logger.info("Counterexample:\n{}", model);
				result = ProofResult.refuted(model, report(index, new LinkedHashSet<>()));
			} else {
				String reason = solver.getReasonUnknown();
				logger.info("Unknown: {}", reason);
				result = ProofResult.unknown(reason, report(index, new LinkedHashSet<>()));
			}
		} catch (Z3Exception e) {
			if (!"canceled".equals(e.getMessage())) {
				throw e;
			}
			logger.info("Unknown: {}", e.getMessage());
			result = ProofResult.unknown(e.getMessage(), report(index, new LinkedHashSet<>()));
		}
		if (repro) {
			writeRepro(solver);
		}
		return result;
	}

	private void logCore(Set<String> core, Map<String, Statement> index) {
		StringBuilder listing = new StringBuilder();
		for (String label : core) {
			Statement s = index.get(label);
			if (s != null && s.getSource() != null) {
				listing.append(s.getSource()).append('\n');
			}
		}
		logger.info("BEGIN PROOF CORE\n{}END PROOF CORE", listing);
	}

	private static List<ProofResult.Entry> report(Map<String, Statement> index, Set<String> core) {
		List<ProofResult.Entry> report = new ArrayList<>();
		for (Map.Entry<String, Statement> e : index.entrySet()) {
			if (e.getValue().getSource() != null) {
				report.add(new ProofResult.Entry(e.getValue().getSource().toString(), core.contains(e.getKey())));
			}
		}
		return report;
	}

	private void writeRepro(Solver solver) {
		String text = solver.toString() + "\n(check-sat)\n(get-model)\n";
		try {
			Files.write(reproFile, text.getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		logger.warn("Wrote repro smt file {}", reproFile);
	}
}
