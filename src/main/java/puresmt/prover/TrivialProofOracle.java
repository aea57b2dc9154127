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
 * Scores axioms in the order they were discovered, so that those about
 * functions referenced directly by the conclusion are preferred.
 */
public class TrivialProofOracle implements ProofOracle {

	@Override
	public void scoreAxioms(List<Statement> axioms, Decl.FunctionDef conclusion) {
		int index = 0;
		for (Statement s : axioms) {
			if (!s.isRequired()) {
				s.setScore(index++);
			}
		}
	}
}
