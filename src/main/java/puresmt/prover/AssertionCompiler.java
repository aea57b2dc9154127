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

import static puresmt.core.PureFile.CALL;
import static puresmt.core.PureFile.NAME;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Pattern;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import puresmt.core.DefinitionError;
import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Operator;
import puresmt.logic.BindingEnv;
import puresmt.logic.LogicCompiler;
import puresmt.logic.LogicSort;
import puresmt.logic.Scope;

/**
 * Compiles assertion functions into universally quantified formulas. An
 * assertion <code>def a(x: p, y): return e</code> states that
 * <code>e</code> is truthy for every <code>x</code> and <code>y</code> such
 * that <code>p(x)</code> is truthy. The quantifier carries a weight
 * (<code>@ch_weight(n)</code>) and trigger patterns, which are either declared
 * (<code>@ch_pattern(lambda x, y: term)</code>) or inferred from the shape of
 * the body.
 *
 * @author The PureSMT Project Developers
 */
public class AssertionCompiler {
	private static final Logger logger = LoggerFactory.getLogger(AssertionCompiler.class);

	public static final String WEIGHT = "ch_weight";
	public static final String PATTERN = "ch_pattern";

	/**
	 * Predicates whose triggers are given an <code>isdefined</code> alternative.
	 */
	private static final List<String> TYPE_PREDICATES = Arrays.asList("isbool", "isint", "isnat", "istuple", "isfunc",
			"isnone");

	private final LogicCompiler compiler;
	private final LogicSort sort;
	private final Context context;

	public AssertionCompiler(LogicCompiler compiler) {
		this.compiler = compiler;
		this.sort = compiler.getSort();
		this.context = sort.getContext();
	}

	public LogicCompiler getCompiler() {
		return compiler;
	}

	/**
	 * Compile a conclusion. This is never used as an axiom, so it has no
	 * trigger patterns.
	 *
	 * @param fn
	 * @param scope
	 * @return
	 */
	public BoolExpr compileConclusion(Decl.FunctionDef fn, Scope scope) {
		return compile(fn, scope, 1);
	}

	/**
	 * Compile an assertion for use as an axiom, returning <code>null</code> if
	 * no weight can be determined for it.
	 *
	 * @param fn
	 * @param scope
	 * @return
	 */
	public BoolExpr compileAxiom(Decl.FunctionDef fn, Scope scope) {
		Integer weight = weightOf(fn);
		if (weight == null) {
			logger.debug("skipping {}, which has no valid weight", fn.getName());
			return null;
		}
		BoolExpr formula = compile(fn, scope, null);
		if (logger.isDebugEnabled()) {
			logger.debug("axiom {}: {}", fn.getName(), formula);
		}
		return formula;
	}

	/**
	 * Compile an assertion with a given weight, or with its own weight if none
	 * is given. A forced weight of one disables trigger patterns.
	 *
	 * @param fn
	 * @param scope
	 * @param forcedWeight
	 * @return
	 */
	private BoolExpr compile(Decl.FunctionDef fn, Scope scope, Integer forcedWeight) {
		List<Decl.Parameter> parameters = fn.getParameters();
		Scope inner = scope.enter(parameters);
		Expr body = compiler.compile(fn.getBody(), inner);
		BoolExpr formula = truthOf(body);
		List<BoolExpr> preconditions = new ArrayList<>();
		for (Decl.Parameter p : parameters) {
			if (p.getAnnotation() != null) {
				PureFile.Expr check = CALL(p.getAnnotation(), Collections.singletonList(NAME(p.getName())),
						p.getAttributes());
				preconditions.add(truthOf(compiler.compile(check, inner)));
			}
		}
		if (preconditions.size() == 1) {
			formula = context.mkImplies(preconditions.get(0), formula);
		} else if (!preconditions.isEmpty()) {
			formula = context.mkImplies(context.mkAnd(preconditions.toArray(new BoolExpr[0])), formula);
		}
		Pattern[] patterns = null;
		int weight = 1;
		if (!parameters.isEmpty()) {
			weight = forcedWeight != null ? forcedWeight : weightOf(fn);
			if (forcedWeight == null || forcedWeight != 1) {
				patterns = compilePatterns(fn, inner);
			}
		}
		List<Expr> bound = boundVariables(parameters);
		if (bound.isEmpty()) {
			return formula;
		}
		return context.mkForall(bound.toArray(new Expr[0]), formula, weight, patterns, null, null, null);
	}

	private BoolExpr truthOf(Expr body) {
		if (sort.isBoolConstructor(body)) {
			return (BoolExpr) body.getArgs()[0];
		} else if (body instanceof BoolExpr) {
			return (BoolExpr) body;
		}
		return sort.truthy(body);
	}

	private List<Expr> boundVariables(List<Decl.Parameter> parameters) {
		BindingEnv env = compiler.getEnvironment();
		List<Expr> bound = new ArrayList<>();
		for (Decl.Parameter p : parameters) {
			Expr constant = env.lookup(p);
			if (constant != null) {
				bound.add(constant);
			}
		}
		return bound;
	}

	// =========================================================================
	// Weights
	// =========================================================================

	/**
	 * Determine the weight of an assertion, which defaults to one. A malformed
	 * or out of range weight decorator gives <code>null</code>.
	 *
	 * @param fn
	 * @return
	 */
	public static Integer weightOf(Decl.FunctionDef fn) {
		for (PureFile.Expr decorator : fn.getDecorators()) {
			if (WEIGHT.equals(calledName(decorator))) {
				List<PureFile.Expr> args = ((PureFile.Expr.Call) decorator).getArguments();
				if (args.size() != 1 || !(args.get(0) instanceof PureFile.Expr.Number)) {
					return null;
				}
				try {
					return ((PureFile.Expr.Number) args.get(0)).getValue().intValueExact();
				} catch (ArithmeticException e) {
					logger.warn("weight of {} out of range", fn.getName());
					return null;
				}
			}
		}
		return 1;
	}

	// =========================================================================
	// Patterns
	// =========================================================================

	/**
	 * Find the trigger multi-patterns of an assertion, as syntax. Declared
	 * patterns take priority over inferred ones.
	 *
	 * @param fn
	 * @return
	 */
	public static List<List<PureFile.Expr>> findPatterns(Decl.FunctionDef fn) {
		List<List<PureFile.Expr>> declared = new ArrayList<>();
		for (PureFile.Expr decorator : fn.getDecorators()) {
			if (!PATTERN.equals(calledName(decorator))) {
				continue;
			}
			List<PureFile.Expr> terms = new ArrayList<>();
			for (PureFile.Expr arg : ((PureFile.Expr.Call) decorator).getArguments()) {
				if (!(arg instanceof PureFile.Expr.Lambda)) {
					throw new DefinitionError("pattern must be a lambda", arg);
				}
				PureFile.Expr.Lambda lambda = (PureFile.Expr.Lambda) arg;
				if (!parameterNames(lambda.getParameters()).equals(parameterNames(fn.getParameters()))) {
					throw new DefinitionError("pattern arguments do not match function arguments", arg);
				}
				terms.add(lambda.getBody());
			}
			declared.add(terms);
		}
		if (!declared.isEmpty()) {
			return declared;
		}
		List<List<PureFile.Expr>> inferred = new ArrayList<>();
		inferred.add(Collections.singletonList(inferTrigger(fn.getBody())));
		return inferred;
	}

	/**
	 * Descend through wrappers, implications and equalities to the term which
	 * most likely identifies when an assertion is relevant.
	 *
	 * @param expr
	 * @return
	 */
	private static PureFile.Expr inferTrigger(PureFile.Expr expr) {
		String name = calledName(expr);
		if (name != null) {
			List<PureFile.Expr> args = ((PureFile.Expr.Call) expr).getArguments();
			switch (name) {
			case "_z_wrapbool":
			case "_z_eq":
				if (args.size() >= 1) {
					return inferTrigger(args.get(0));
				}
				break;
			case "implies":
			case "_z_implies":
				if (args.size() == 2) {
					return inferTrigger(args.get(1));
				}
				break;
			}
		} else if (expr instanceof PureFile.Expr.Compare) {
			PureFile.Expr.Compare c = (PureFile.Expr.Compare) expr;
			if (c.getOperators().size() == 1 && c.getOperators().get(0) == Operator.EQ) {
				return inferTrigger(c.getLeftHandSide());
			}
		}
		return expr;
	}

	private Pattern[] compilePatterns(Decl.FunctionDef fn, Scope scope) {
		List<List<PureFile.Expr>> multipatterns = new ArrayList<>(findPatterns(fn));
		// Type predicates can also be triggered by the definedness of their argument
		for (List<PureFile.Expr> terms : new ArrayList<>(multipatterns)) {
			if (terms.size() == 1 && TYPE_PREDICATES.contains(calledName(terms.get(0)))) {
				PureFile.Expr.Call call = (PureFile.Expr.Call) terms.get(0);
				if (call.getArguments().size() == 1) {
					multipatterns.add(Collections.singletonList(CALL("isdefined", call.getArguments().get(0))));
				}
			}
		}
		List<Expr[]> compiled = new ArrayList<>();
		for (List<PureFile.Expr> terms : multipatterns) {
			Expr[] zterms = new Expr[terms.size()];
			for (int i = 0; i != zterms.length; ++i) {
				zterms[i] = compiler.compile(terms.get(i), scope);
			}
			compiled.add(zterms);
		}
		List<Expr> bound = boundVariables(fn.getParameters());
		List<Pattern> patterns = new ArrayList<>();
		for (int i = 0; i != compiled.size(); ++i) {
			Expr[] zterms = compiled.get(i);
			if (isValidTrigger(zterms, bound)) {
				patterns.add(context.mkPattern(zterms));
			} else {
				logger.warn("dropping trigger {} of {}", multipatterns.get(i), fn.getName());
			}
		}
		if (logger.isDebugEnabled()) {
			logger.debug("triggers for {}: {}", fn.getName(), patterns);
		}
		return patterns.isEmpty() ? null : patterns.toArray(new Pattern[0]);
	}

	/**
	 * A trigger must consist of applications of uninterpreted functions which
	 * together mention every bound variable.
	 *
	 * @param terms
	 * @param bound
	 * @return
	 */
	private static boolean isValidTrigger(Expr[] terms, List<Expr> bound) {
		for (Expr term : terms) {
			if (!term.isApp() || term.getNumArgs() == 0
					|| term.getFuncDecl().getDeclKind() != Z3_decl_kind.Z3_OP_UNINTERPRETED) {
				return false;
			}
		}
		for (Expr variable : bound) {
			boolean found = false;
			for (Expr term : terms) {
				found |= mentions(term, variable);
			}
			if (!found) {
				return false;
			}
		}
		return true;
	}

	private static boolean mentions(Expr term, Expr variable) {
		if (term.equals(variable)) {
			return true;
		} else if (term.isApp()) {
			for (Expr arg : term.getArgs()) {
				if (mentions(arg, variable)) {
					return true;
				}
			}
		}
		return false;
	}

	private static List<String> parameterNames(List<Decl.Parameter> parameters) {
		List<String> names = new ArrayList<>();
		for (Decl.Parameter p : parameters) {
			names.add(p.getName());
		}
		return names;
	}

	private static String calledName(PureFile.Expr expr) {
		if (expr instanceof PureFile.Expr.Call) {
			PureFile.Expr callee = ((PureFile.Expr.Call) expr).getCallee();
			if (callee instanceof PureFile.Expr.Name) {
				return ((PureFile.Expr.Name) callee).get();
			}
		}
		return null;
	}
}
