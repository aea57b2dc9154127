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
package puresmt.rewrite;

import static puresmt.core.PureFile.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Expr;
import puresmt.core.UnsupportedConstructError;
import puresmt.util.AbstractExpressionFold;
import puresmt.util.AbstractExpressionTransform;

/**
 * Moves the context surrounding a <code>reduce</code> call inside the
 * reduction, where possible. Given a tree <code>C[reduce(f, L, I)]</code> for
 * some context <code>C</code>, the transform looks for a function
 * <code>g</code> such that <code>C[f(a, b)]</code> simplifies to
 * <code>g(C[a], C[b])</code> and, if one is found, produces
 * <code>reduce(g, map(C, L), C[I])</code>. To find <code>g</code>, each
 * parameter of <code>f</code> is wrapped in an inverse marker and the result
 * simplified with an extra rule that cancels <code>C</code> against the
 * marker. If any marker survives, or the context contains constructs which
 * cannot be matched, then the transform is abandoned.
 *
 * @author The PureSMT Project Developers
 */
public class ReduceTransform {
	private static final Logger logger = LoggerFactory.getLogger(ReduceTransform.class);

	public static final String REDUCE = "reduce";
	public static final String MAP = "map";
	public static final String INVERSE = "inverse*";

	private static final String HOLE = "R";

	private final RewriteEngine rules;
	private final Function<Expr.Name, Decl> resolver;
	private int fresh;

	/**
	 * @param rules    Rules used to simplify the context applied to the reducer
	 * @param resolver Determines what a name refers to, or null if nothing
	 */
	public ReduceTransform(RewriteEngine rules, Function<Expr.Name, Decl> resolver) {
		this.rules = rules;
		this.resolver = resolver;
	}

	/**
	 * Apply the transform to the first suitable <code>reduce</code> call found
	 * strictly inside a tree. The tree is returned unchanged if there is none.
	 *
	 * @param root
	 * @return
	 */
	public Expr apply(Expr root) {
		for (Expr.Call call : findReductions(root)) {
			Expr result = transform(root, call);
			if (result != null) {
				return result;
			}
		}
		return root;
	}

	private Expr transform(Expr root, Expr.Call call) {
		List<Expr> args = call.getArguments();
		Expr.Lambda reducer = toLambda(args.get(0));
		if (reducer == null) {
			return null;
		}
		List<Decl.Parameter> parameters = reducer.getParameters();
		Expr context = replace(root, call, NAME(Patterns.VARIABLE_PREFIX + HOLE));
		// Wrap each parameter of the reducer in an inverse of the context
		Map<String, Expr> inverses = new HashMap<>();
		for (Decl.Parameter p : parameters) {
			if (p.isStarred()) {
				return null;
			}
			inverses.put(p.getName(), CALL(INVERSE, NAME(p.getName())));
		}
		Expr body = new Substitution(inverses).apply(reducer.getBody());
		Expr target = Patterns.substitute(context, Collections.singletonMap(HOLE, body));
		// Rule which cancels the context against its inverse
		Expr inverse = CALL(INVERSE, NAME(Patterns.VARIABLE_PREFIX + "I"));
		RewriteEngine canceller = new LayeredRewriteEngine(rules)
				.add(RewriteRule.tagged(Patterns.substitute(context, Collections.singletonMap(HOLE, inverse)),
						NAME(Patterns.VARIABLE_PREFIX + "I"), RewriteRule.ALWAYS));
		Expr simplified;
		try {
			simplified = canceller.rewrite(target);
		} catch (UnsupportedConstructError e) {
			logger.debug("reduce transform abandoned: {}", e.getMessage());
			return null;
		}
		if (mentions(simplified, INVERSE)) {
			logger.debug("reduce transform abandoned for {}", simplified);
			return null;
		}
		Expr reduction = LAMBDA(parameters, simplified, reducer.getAttributes());
		Expr mapped = CALL(NAME(MAP), Arrays.asList(toFunction(context), args.get(1)));
		Expr initial = Patterns.substitute(context, Collections.singletonMap(HOLE, args.get(2)));
		Expr result = CALL(NAME(REDUCE), Arrays.asList(reduction, mapped, initial), call.getAttributes());
		logger.debug("reduce transform {} => {}", root, result);
		return result;
	}

	/**
	 * Find the function supplied to a reduction, if it is known.
	 *
	 * @param fn
	 * @return
	 */
	private Expr.Lambda toLambda(Expr fn) {
		if (fn instanceof Expr.Lambda) {
			return (Expr.Lambda) fn;
		} else if (fn instanceof Expr.Name) {
			Decl decl = resolver.apply((Expr.Name) fn);
			if (decl instanceof Decl.FunctionDef) {
				Decl.FunctionDef def = (Decl.FunctionDef) decl;
				return LAMBDA(def.getParameters(), def.getBody(), fn.getAttributes());
			}
		}
		return null;
	}

	/**
	 * Turn a context into a function of its hole. A context which simply applies
	 * a named function to the hole becomes that name.
	 *
	 * @param context
	 * @return
	 */
	private Expr toFunction(Expr context) {
		if (context instanceof Expr.Call) {
			Expr.Call c = (Expr.Call) context;
			if (c.getCallee() instanceof Expr.Name && !Patterns.isVariable(c.getCallee())
					&& c.getArguments().size() == 1 && isHole(c.getArguments().get(0))) {
				return c.getCallee();
			}
		}
		String name = HOLE + "#" + (++fresh);
		Expr body = Patterns.substitute(context, Collections.singletonMap(HOLE, NAME(name)));
		return LAMBDA(Collections.singletonList(PARAMETER(name)), body);
	}

	private boolean isHole(Expr e) {
		return e instanceof Expr.Name && ((Expr.Name) e).get().equals(Patterns.VARIABLE_PREFIX + HOLE);
	}

	private List<Expr.Call> findReductions(Expr root) {
		AbstractExpressionFold<List<Expr.Call>> finder = new AbstractExpressionFold<List<Expr.Call>>() {
			@Override
			protected List<Expr.Call> constructCall(Expr.Call expr, List<Expr.Call> callee, List<List<Expr.Call>> arguments) {
				List<Expr.Call> result = super.constructCall(expr, callee, arguments);
				if (expr != root && isReduction(expr)) {
					result.add(0, expr);
				}
				return result;
			}

			@Override
			public List<Expr.Call> join(List<Expr.Call> lhs, List<Expr.Call> rhs) {
				lhs.addAll(rhs);
				return lhs;
			}

			@Override
			public List<Expr.Call> BOTTOM() {
				return new ArrayList<>();
			}
		};
		return finder.visitExpression(root);
	}

	private boolean isReduction(Expr.Call call) {
		if (call.getArguments().size() != 3 || !(call.getCallee() instanceof Expr.Name)) {
			return false;
		}
		Expr.Name callee = (Expr.Name) call.getCallee();
		if (!callee.get().equals(REDUCE)) {
			return false;
		}
		Decl decl = resolver.apply(callee);
		return decl instanceof Decl.FunctionDef && ((Decl.FunctionDef) decl).getName().equals(REDUCE);
	}

	private static Expr replace(Expr root, Expr target, Expr replacement) {
		return new AbstractExpressionTransform() {
			@Override
			public Expr visitExpression(Expr expr) {
				return expr == target ? replacement : super.visitExpression(expr);
			}
		}.visitExpression(root);
	}

	private static boolean mentions(Expr root, String name) {
		return new AbstractExpressionFold<Boolean>() {
			@Override
			protected Boolean constructName(Expr.Name expr) {
				return expr.get().equals(name);
			}

			@Override
			public Boolean join(Boolean lhs, Boolean rhs) {
				return lhs || rhs;
			}

			@Override
			public Boolean BOTTOM() {
				return false;
			}
		}.visitExpression(root);
	}
}
