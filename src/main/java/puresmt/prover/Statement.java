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

import com.microsoft.z3.BoolExpr;

import puresmt.core.PureFile.Decl;

/**
 * A candidate axiom for a proof. Required statements are always given to the
 * solver; the others carry a score assigned by a {@link ProofOracle}, and only
 * the best scoring of these are used.
 *
 * @author The PureSMT Project Developers
 */
public class Statement {
	private final Decl.FunctionDef source;
	private final BoolExpr formula;
	private final boolean required;
	private Double score;

	private Statement(Decl.FunctionDef source, BoolExpr formula, boolean required) {
		if (formula == null) {
			throw new IllegalArgumentException("invalid formula");
		}
		this.source = source;
		this.formula = formula;
		this.required = required;
	}

	public static Statement required(Decl.FunctionDef source, BoolExpr formula) {
		return new Statement(source, formula, true);
	}

	public static Statement scored(Decl.FunctionDef source, BoolExpr formula) {
		return new Statement(source, formula, false);
	}

	/**
	 * Get the assertion this statement was compiled from, or <code>null</code>
	 * if it was generated.
	 *
	 * @return
	 */
	public Decl.FunctionDef getSource() {
		return source;
	}

	public BoolExpr getFormula() {
		return formula;
	}

	public boolean isRequired() {
		return required;
	}

	/**
	 * Get the score of this statement, where lower is better, or
	 * <code>null</code> if it has not been scored.
	 *
	 * @return
	 */
	public Double getScore() {
		return score;
	}

	public void setScore(double score) {
		if (required) {
			throw new IllegalArgumentException("required statements cannot be scored");
		}
		this.score = score;
	}

	@Override
	public String toString() {
		String src = source != null ? source.getName() : formula.toString();
		return "Statement(score=" + score + ", src=" + src + ")";
	}
}
