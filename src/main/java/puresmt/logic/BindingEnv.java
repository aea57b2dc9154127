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
package puresmt.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;

import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;

/**
 * The symbolic environment of a single proof attempt. Every declaration
 * referenced while compiling is given exactly one logic constant, named after
 * the declaration, and side constraints emitted during compilation accumulate
 * as support formulas until drained.
 *
 * @author The PureSMT Project Developers
 */
public class BindingEnv {
	private final LogicSort sort;
	/**
	 * Declarations are keyed by identity, in the order they were first
	 * referenced.
	 */
	private final Map<Decl, Expr> references = new LinkedHashMap<>();
	private final Map<PureFile.Expr.Lambda, Expr> lambdas = new IdentityHashMap<>();
	private final Set<String> lambdaNames = new HashSet<>();
	private final List<BoolExpr> support = new ArrayList<>();

	public BindingEnv(LogicSort sort) {
		this.sort = sort;
	}

	public LogicSort getSort() {
		return sort;
	}

	/**
	 * Get the constant standing for a declaration, creating it on first use.
	 *
	 * @param decl
	 * @return
	 */
	public Expr register(Decl decl) {
		Expr constant = references.get(decl);
		if (constant == null) {
			constant = sort.constant(nameOf(decl));
			references.put(decl, constant);
		}
		return constant;
	}

	public boolean isRegistered(Decl decl) {
		return references.containsKey(decl);
	}

	/**
	 * Get the constant already standing for a declaration, or <code>null</code>.
	 *
	 * @param decl
	 * @return
	 */
	public Expr lookup(Decl decl) {
		return references.get(decl);
	}

	/**
	 * Get every declaration referenced so far, in order of first reference.
	 *
	 * @return
	 */
	public List<Decl> getReferences() {
		return new ArrayList<>(references.keySet());
	}

	/**
	 * Get the function handle of a lambda, or <code>null</code> if it has not
	 * been compiled yet.
	 *
	 * @param lambda
	 * @return
	 */
	public Expr getLambda(PureFile.Expr.Lambda lambda) {
		return lambdas.get(lambda);
	}

	/**
	 * Allocate a fresh function handle for a lambda. Handles are named after the
	 * source position of the lambda, made unique where necessary.
	 *
	 * @param lambda
	 * @return
	 */
	public Expr newLambda(PureFile.Expr.Lambda lambda) {
		PureFile.Position p = lambda.getAttribute(PureFile.Position.class);
		String base = p == null ? "lambda" : "lambda_" + p.getLine() + "_" + p.getColumn();
		String name = base;
		for (int i = 1; !lambdaNames.add(name); ++i) {
			name = base + "#" + i;
		}
		Expr handle = sort.function(sort.functionConstant(name));
		lambdas.put(lambda, handle);
		return handle;
	}

	public void addSupport(BoolExpr formula) {
		support.add(formula);
	}

	/**
	 * Remove and return the support formulas accumulated so far.
	 *
	 * @return
	 */
	public List<BoolExpr> drainSupport() {
		if (support.isEmpty()) {
			return Collections.emptyList();
		}
		List<BoolExpr> result = new ArrayList<>(support);
		support.clear();
		return result;
	}

	private static String nameOf(Decl decl) {
		if (decl instanceof Decl.FunctionDef) {
			return ((Decl.FunctionDef) decl).getName();
		} else if (decl instanceof Decl.Parameter) {
			return ((Decl.Parameter) decl).getName();
		}
		throw new IllegalArgumentException("unknown declaration encountered (" + decl.getClass().getName() + ")");
	}
}
