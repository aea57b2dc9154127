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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BoolExpr;

import puresmt.core.PureFile.Decl;
import puresmt.logic.BindingEnv;
import puresmt.logic.LogicSort;
import puresmt.registry.DefinitionRegistry;
import puresmt.registry.FnInfo;

/**
 * Gathers the axioms relevant to a conclusion. Starting from the definitions
 * referenced by the conclusion, each round adds the assertions about every
 * definition referenced but not yet handled, which may in turn reference
 * further definitions. Expansion stops when a round adds nothing, or after a
 * bounded number of rounds.
 *
 * @author The PureSMT Project Developers
 */
public class KnowledgeExpansion {
	private static final Logger logger = LoggerFactory.getLogger(KnowledgeExpansion.class);

	public static final int DEFAULT_MAX_ROUNDS = 10;

	private final DefinitionRegistry registry;
	private final AssertionCompiler assertions;
	private final BindingEnv env;
	private final LogicSort sort;
	private int maxRounds = DEFAULT_MAX_ROUNDS;

	public KnowledgeExpansion(DefinitionRegistry registry, AssertionCompiler assertions) {
		this.registry = registry;
		this.assertions = assertions;
		this.env = assertions.getCompiler().getEnvironment();
		this.sort = env.getSort();
	}

	public KnowledgeExpansion setMaxRounds(int maxRounds) {
		if (maxRounds < 0) {
			throw new IllegalArgumentException("invalid number of rounds");
		}
		this.maxRounds = maxRounds;
		return this;
	}

	/**
	 * Build the axioms for whatever has been compiled into the binding
	 * environment so far (normally the conclusion).
	 *
	 * @return
	 */
	public List<Statement> expand() {
		List<Statement> statements = new ArrayList<>();
		for (BoolExpr axiom : StructuralAxioms.create(sort)) {
			statements.add(Statement.required(null, axiom));
		}
		for (Decl.FunctionDef global : registry.getGlobalAssertions()) {
			BoolExpr axiom = assertions.compileAxiom(global, registry.getScope(global));
			if (axiom != null) {
				statements.add(Statement.required(global, axiom));
			}
		}
		Set<Decl> handled = Collections.newSetFromMap(new IdentityHashMap<>());
		for (int round = 0; round < maxRounds; ++round) {
			absorbSupport(statements);
			Set<Decl> border = Collections.newSetFromMap(new IdentityHashMap<>());
			for (Decl d : env.getReferences()) {
				if (!handled.contains(d)) {
					border.add(d);
				}
			}
			boolean added = false;
			for (FnInfo fn : registry.getFunctions()) {
				Decl.FunctionDef definition = fn.getDefinition();
				if (!border.contains(definition)) {
					continue;
				}
				added = true;
				handled.add(definition);
				for (Decl.FunctionDef assertion : registry.getAssertions(fn.getName())) {
					add(statements, assertion, assertions.compileAxiom(assertion, registry.getScope(assertion)));
				}
				// Not implied by the datatype when used as a standalone reference
				statements.add(Statement.scored(null, sort.isFunc(env.lookup(definition))));
				Decl.FunctionDef definitional = fn.getDefinitionalAssertion();
				if (definitional != null) {
					add(statements, definitional, assertions.compileAxiom(definitional, registry.getScope(definition)));
				}
			}
			if (!added) {
				logger.info("Completed knowledge expansion after {} iterations: {} functions.", round, handled.size());
				break;
			}
		}
		absorbSupport(statements);
		return statements;
	}

	private void add(List<Statement> statements, Decl.FunctionDef source, BoolExpr axiom) {
		if (axiom != null) {
			statements.add(Statement.scored(source, axiom));
		}
	}

	private void absorbSupport(List<Statement> statements) {
		for (BoolExpr support : env.drainSupport()) {
			statements.add(Statement.required(null, support));
		}
	}
}
