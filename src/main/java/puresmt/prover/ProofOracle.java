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

import java.util.List;

import puresmt.core.PureFile.Decl;

/**
 * Decides how relevant each optional axiom is to a given conclusion. Only the
 * most relevant axioms are passed to the solver.
 *
 * @author The PureSMT Project Developers
 */
public interface ProofOracle {

	/**
	 * Assign a score to every statement which is not required, where a lower
	 * score means more relevant. Required statements must be left unscored.
	 *
	 * @param axioms
	 * @param conclusion
	 */
	public void scoreAxioms(List<Statement> axioms, Decl.FunctionDef conclusion);
}
