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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Pattern;
import com.microsoft.z3.Sort;

import puresmt.core.DefinitionError;
import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Operator;
import puresmt.core.PureFile.Slice;
import puresmt.core.QuantifierShapeError;
import puresmt.core.UnsupportedConstructError;
import puresmt.rewrite.BetaReduction;
import puresmt.rewrite.ReduceTransform;
import puresmt.rewrite.RewriteEngine;
import puresmt.rewrite.StandardRules;

/**
 * Translates expressions into terms over the {@link LogicSort}. Every value is
 * a term of the tagged-union sort. Calling a function value is an application
 * of the uninterpreted <code>App</code> function to the callee and an argument
 * list, where the argument list is built by consing arguments onto the empty
 * tuple from the left and splicing starred arguments in with
 * <code>Concat</code>. Tuples are built in exactly the same way. Operators
 * resolve to the pure definitions which give their meaning (e.g.
 * <code>_op_Add</code>) and are applied like any other function. Intrinsics are
 * the exception, since they translate directly into logic.
 *
 * @author The PureSMT Project Developers
 */
public class LogicCompiler {
	private final LogicSort sort;
	private final Context context;
	private final ScopeResolver resolver;
	private final BindingEnv env;
	private final RewriteEngine rules;

	public LogicCompiler(ScopeResolver resolver, BindingEnv env) {
		this(resolver, env, StandardRules.get());
	}

	public LogicCompiler(ScopeResolver resolver, BindingEnv env, RewriteEngine rules) {
		this.sort = env.getSort();
		this.context = sort.getContext();
		this.resolver = resolver;
		this.env = env;
		this.rules = rules;
	}

	public LogicSort getSort() {
		return sort;
	}

	public BindingEnv getEnvironment() {
		return env;
	}

	public ScopeResolver getResolver() {
		return resolver;
	}

	/**
	 * Compile an expression in a given scope. The expression is first
	 * normalised by the rewrite rules. Side constraints arising from the
	 * compilation (e.g. the defining equations of lambdas) are added to the
	 * binding environment as support.
	 *
	 * @param expr
	 * @param scope
	 * @return
	 */
	public Expr compile(PureFile.Expr expr, Scope scope) {
		return translate(normalise(expr, scope), scope);
	}

	/**
	 * Apply the reduce transform and then the rewrite rules to an expression.
	 *
	 * @param expr
	 * @param scope
	 * @return
	 */
	public PureFile.Expr normalise(PureFile.Expr expr, Scope scope) {
		ReduceTransform reducer = new ReduceTransform(rules, name -> resolver.resolve(name, scope).getDeclaration());
		return rules.rewrite(reducer.apply(expr));
	}

	private Expr translate(PureFile.Expr expr, Scope scope) {
		if (expr instanceof PureFile.Expr.Name) {
			return translateName((PureFile.Expr.Name) expr, scope);
		} else if (expr instanceof PureFile.Expr.Number) {
			BigInteger value = ((PureFile.Expr.Number) expr).getValue();
			return sort.integer(value.toString());
		} else if (expr instanceof PureFile.Expr.Constant) {
			return translateConstant((PureFile.Expr.Constant) expr);
		} else if (expr instanceof PureFile.Expr.Call) {
			return translateCall((PureFile.Expr.Call) expr, scope);
		} else if (expr instanceof PureFile.Expr.BinOp) {
			PureFile.Expr.BinOp e = (PureFile.Expr.BinOp) expr;
			return apply(operator(e.getOperator(), e), translateValue(e.getLeftHandSide(), scope),
					translateValue(e.getRightHandSide(), scope));
		} else if (expr instanceof PureFile.Expr.UnaryOp) {
			PureFile.Expr.UnaryOp e = (PureFile.Expr.UnaryOp) expr;
			return apply(operator(e.getOperator(), e), translateValue(e.getOperand(), scope));
		} else if (expr instanceof PureFile.Expr.BoolOp) {
			return translateBoolOp((PureFile.Expr.BoolOp) expr, scope);
		} else if (expr instanceof PureFile.Expr.Compare) {
			return translateCompare((PureFile.Expr.Compare) expr, scope);
		} else if (expr instanceof PureFile.Expr.Subscript) {
			PureFile.Expr.Subscript e = (PureFile.Expr.Subscript) expr;
			return translateSlice(translateValue(e.getSource(), scope), e.getSlice(), scope);
		} else if (expr instanceof PureFile.Expr.Tuple) {
			return merge(translateOperands(((PureFile.Expr.Tuple) expr).getItems(), scope));
		} else if (expr instanceof PureFile.Expr.Lambda) {
			return translateLambda((PureFile.Expr.Lambda) expr, scope);
		} else if (expr instanceof PureFile.Expr.Starred) {
			throw new UnsupportedConstructError("starred expression outside of a tuple or call", expr);
		}
		throw new UnsupportedConstructError("unknown expression encountered (" + expr.getClass().getName() + ")",
				expr);
	}

	private Expr translateName(PureFile.Expr.Name name, Scope scope) {
		Resolution r = resolver.resolve(name, scope);
		switch (r.getKind()) {
		case BUILTIN:
		case DEFINITION:
			return env.register(r.getDeclaration());
		case INTRINSIC:
			if (r.getIntrinsic() == Intrinsic.N) {
				return sort.none();
			}
			throw new UnsupportedConstructError("intrinsic \"" + name.get() + "\" is not a value", name);
		default:
			PureFile.Position p = name.getAttribute(PureFile.Position.class);
			String where = p == null ? "" : " at " + p;
			throw new DefinitionError("Undefined identifier: \"" + name.get() + "\"" + where, name);
		}
	}

	private Expr translateConstant(PureFile.Expr.Constant expr) {
		switch (expr.getKind()) {
		case TRUE:
			return sort.bool(true);
		case FALSE:
			return sort.bool(false);
		default:
			return sort.none();
		}
	}

	private Expr translateBoolOp(PureFile.Expr.BoolOp expr, Scope scope) {
		Expr fn = operator(expr.getOperator(), expr);
		List<PureFile.Expr> operands = expr.getOperands();
		Expr result = translateValue(operands.get(0), scope);
		for (int i = 1; i != operands.size(); ++i) {
			result = apply(fn, result, translateValue(operands.get(i), scope));
		}
		return result;
	}

	/**
	 * A chain <code>a op1 b op2 c</code> becomes the conjunction of
	 * <code>a op1 b</code> and <code>b op2 c</code>. Each operand is translated
	 * once, from right to left.
	 *
	 * @param expr
	 * @param scope
	 * @return
	 */
	private Expr translateCompare(PureFile.Expr.Compare expr, Scope scope) {
		List<Operator> operators = expr.getOperators();
		List<PureFile.Expr> comparators = expr.getComparators();
		Expr last = translateValue(comparators.get(comparators.size() - 1), scope);
		Expr result = null;
		for (int i = operators.size() - 1; i > 0; --i) {
			Expr left = translateValue(comparators.get(i - 1), scope);
			result = conjoin(result, apply(operator(operators.get(i), expr), left, last), expr);
			last = left;
		}
		Expr left = translateValue(expr.getLeftHandSide(), scope);
		return conjoin(result, apply(operator(operators.get(0), expr), left, last), expr);
	}

	private Expr conjoin(Expr conjunction, Expr clause, PureFile.Item node) {
		if (conjunction == null) {
			return clause;
		}
		return apply(operator(Operator.AND, node), clause, conjunction);
	}

	private Expr translateSlice(Expr source, Slice slice, Scope scope) {
		if (slice instanceof Slice.Index) {
			Slice.Index s = (Slice.Index) slice;
			return apply(operator(Operator.GET, slice), source, translateValue(s.getIndex(), scope));
		} else if (slice instanceof Slice.Range) {
			Slice.Range s = (Slice.Range) slice;
			Expr lower = translateBound(s.getLower(), scope);
			Expr upper = translateBound(s.getUpper(), scope);
			if (s.getStep() == null) {
				return apply(operator(Operator.SUBLIST, slice), source, lower, upper);
			}
			return apply(operator(Operator.STEPPEDSUBLIST, slice), source, lower, upper,
					translateBound(s.getStep(), scope));
		} else if (slice instanceof Slice.Extended) {
			// Each dimension is taken independently and the results summed
			Expr result = null;
			for (Slice dimension : ((Slice.Extended) slice).getDimensions()) {
				Expr ith = translateSlice(source, dimension, scope);
				result = result == null ? ith : apply(operator(Operator.ADD, slice), result, ith);
			}
			return result;
		}
		throw new UnsupportedConstructError("unknown slice encountered (" + slice.getClass().getName() + ")", slice);
	}

	private Expr translateBound(PureFile.Expr bound, Scope scope) {
		return bound == null ? sort.none() : translateValue(bound, scope);
	}

	/**
	 * A lambda becomes a fresh function handle, constrained so that applying it
	 * to any arguments gives its body.
	 *
	 * @param lambda
	 * @param scope
	 * @return
	 */
	private Expr translateLambda(PureFile.Expr.Lambda lambda, Scope scope) {
		Expr handle = env.getLambda(lambda);
		if (handle != null) {
			return handle;
		}
		handle = env.newLambda(lambda);
		Scope inner = scope.enter(lambda.getParameters());
		Expr body = translateValue(lambda.getBody(), inner);
		List<Operand> variables = new ArrayList<>();
		Expr[] bound = new Expr[lambda.getParameters().size()];
		for (int i = 0; i != bound.length; ++i) {
			Decl.Parameter p = lambda.getParameters().get(i);
			bound[i] = env.register(p);
			variables.add(new Operand(bound[i], p.isStarred()));
		}
		Expr application = sort.app(handle, merge(variables));
		BoolExpr equation = context.mkEq(application, body);
		if (bound.length == 0) {
			env.addSupport(equation);
		} else {
			Pattern[] patterns = new Pattern[] { context.mkPattern(application) };
			env.addSupport(context.mkForall(bound, equation, 1, patterns, null, null, null));
		}
		env.addSupport(sort.isFunc(handle));
		return handle;
	}

	private Expr translateCall(PureFile.Expr.Call call, Scope scope) {
		PureFile.Expr callee = call.getCallee();
		if (callee instanceof PureFile.Expr.Lambda) {
			PureFile.Expr reduced = BetaReduction.reduce(call);
			if (reduced != call) {
				return translate(reduced, scope);
			}
		} else if (callee instanceof PureFile.Expr.Name) {
			Resolution r = resolver.resolve((PureFile.Expr.Name) callee, scope);
			if (r.getKind() == Resolution.Kind.INTRINSIC) {
				return translateIntrinsic(call, r.getIntrinsic(), scope);
			}
		}
		Expr fn = translateValue(callee, scope);
		return sort.app(fn, merge(translateOperands(call.getArguments(), scope)));
	}

	private Expr translateIntrinsic(PureFile.Expr.Call call, Intrinsic intrinsic, Scope scope) {
		List<PureFile.Expr> arguments = call.getArguments();
		for (PureFile.Expr arg : arguments) {
			if (arg instanceof PureFile.Expr.Starred) {
				throw new UnsupportedConstructError(
						"intrinsic \"" + intrinsic.getReference() + "\" cannot take starred arguments", arg);
			}
		}
		if (intrinsic.isQuantifier()) {
			return translateQuantifier(call, intrinsic, scope);
		}
		int arity = intrinsic.getArity();
		if ((arity >= 0 && arguments.size() != arity) || (arity < 0 && arguments.isEmpty())) {
			throw new UnsupportedConstructError("intrinsic \"" + intrinsic.getReference() + "\" given "
					+ arguments.size() + " argument(s)", call);
		}
		Expr[] args = new Expr[arguments.size()];
		for (int i = 0; i != args.length; ++i) {
			args[i] = translate(arguments.get(i), scope);
		}
		switch (intrinsic) {
		case WRAPBOOL:
			return sort.bool(bool(args[0], call));
		case WRAPINT:
			return sort.integer(arith(args[0], call));
		case WRAPFUNC:
			return sort.function(ofSort(args[0], sort.getFuncSort(), call));
		case BOOL:
			return sort.toBool(value(args[0], call));
		case INT:
			return sort.toInt(value(args[0], call));
		case FUNC:
			return sort.toFunc(value(args[0], call));
		case ISBOOL:
			return sort.isBool(value(args[0], call));
		case ISINT:
			return sort.isInt(value(args[0], call));
		case ISFUNC:
			return sort.isFunc(value(args[0], call));
		case ISTUPLE:
			return sort.isTuple(value(args[0], call));
		case ISNONE:
			return sort.isNone(value(args[0], call));
		case ISDEFINED:
			return sort.isDefined(value(args[0], call));
		case EQ:
			return context.mkEq(args[0], ofSort(args[1], args[0].getSort(), call));
		case NEQ:
			return context.mkNot(context.mkEq(args[0], ofSort(args[1], args[0].getSort(), call)));
		case DISTINCT:
			for (Expr arg : args) {
				ofSort(arg, args[0].getSort(), call);
			}
			return context.mkDistinct(args);
		case T:
			return sort.truthy(value(args[0], call));
		case F:
			return sort.falsy(value(args[0], call));
		case N:
			return sort.none();
		case IMPLIES:
			return context.mkImplies(bool(args[0], call), bool(args[1], call));
		case AND:
			return context.mkAnd(bools(args, call));
		case OR:
			return context.mkOr(bools(args, call));
		case NOT:
			return context.mkNot(bool(args[0], call));
		case LT:
			return context.mkLt(arith(args[0], call), arith(args[1], call));
		case LTE:
			return context.mkLe(arith(args[0], call), arith(args[1], call));
		case GT:
			return context.mkGt(arith(args[0], call), arith(args[1], call));
		case GTE:
			return context.mkGe(arith(args[0], call), arith(args[1], call));
		case ADD:
			return context.mkAdd(arith(args[0], call), arith(args[1], call));
		case SUB:
			return context.mkSub(arith(args[0], call), arith(args[1], call));
		case CONCAT:
			return sort.concat(value(args[0], call), value(args[1], call));
		default:
			throw new UnsupportedConstructError("unknown intrinsic encountered (" + intrinsic + ")", call);
		}
	}

	/**
	 * A quantifier binds the parameters of the lambda it is applied to, whose
	 * body must be truthy.
	 *
	 * @param call
	 * @param quantifier
	 * @param scope
	 * @return
	 */
	private Expr translateQuantifier(PureFile.Expr.Call call, Intrinsic quantifier, Scope scope) {
		List<PureFile.Expr> arguments = call.getArguments();
		if (arguments.size() != 1 || !(arguments.get(0) instanceof PureFile.Expr.Lambda)) {
			throw new QuantifierShapeError("Quantifier argument must be a lambda", call);
		}
		PureFile.Expr.Lambda lambda = (PureFile.Expr.Lambda) arguments.get(0);
		Scope inner = scope.enter(lambda.getParameters());
		BoolExpr body = sort.truthy(translateValue(lambda.getBody(), inner));
		if (lambda.getParameters().isEmpty()) {
			return body;
		}
		Expr[] bound = new Expr[lambda.getParameters().size()];
		for (int i = 0; i != bound.length; ++i) {
			bound[i] = env.register(lambda.getParameters().get(i));
		}
		if (quantifier == Intrinsic.FORALL) {
			return context.mkForall(bound, body, 1, null, null, null, null);
		} else {
			return context.mkExists(bound, body, 1, null, null, null, null);
		}
	}

	// =========================================================================
	// Argument lists
	// =========================================================================

	/**
	 * An item of an argument list or tuple, which is either a single value or a
	 * sequence of values to be spliced in.
	 */
	private static final class Operand {
		private final Expr value;
		private final boolean spliced;

		private Operand(Expr value, boolean spliced) {
			this.value = value;
			this.spliced = spliced;
		}
	}

	private List<Operand> translateOperands(List<PureFile.Expr> items, Scope scope) {
		List<Operand> operands = new ArrayList<>();
		for (PureFile.Expr item : items) {
			if (item instanceof PureFile.Expr.Starred) {
				PureFile.Expr operand = ((PureFile.Expr.Starred) item).getOperand();
				operands.add(new Operand(translateValue(operand, scope), true));
			} else {
				operands.add(new Operand(translateValue(item, scope), false));
			}
		}
		return operands;
	}

	private Expr merge(List<Operand> operands) {
		Expr empty = sort.empty();
		Expr result = empty;
		for (Operand o : operands) {
			if (!o.spliced) {
				result = sort.cons(result, o.value);
			} else if (result.equals(empty)) {
				result = o.value;
			} else {
				result = sort.concat(result, o.value);
			}
		}
		return result;
	}

	private Expr apply(Expr fn, Expr... args) {
		List<Operand> operands = new ArrayList<>();
		for (Expr arg : args) {
			operands.add(new Operand(arg, false));
		}
		return sort.app(fn, merge(operands));
	}

	private Expr operator(Operator op, PureFile.Item node) {
		String name = op.getDefinitionName();
		Decl.FunctionDef definition = resolver.getRegistry().getDefinition(name);
		if (definition == null) {
			throw new DefinitionError("unknown function: " + name, node);
		}
		return env.register(definition);
	}

	// =========================================================================
	// Sort checks
	// =========================================================================

	private Expr translateValue(PureFile.Expr expr, Scope scope) {
		return value(translate(expr, scope), expr);
	}

	private Expr value(Expr e, PureFile.Item node) {
		return ofSort(e, sort.getValueSort(), node);
	}

	private Expr ofSort(Expr e, Sort expected, PureFile.Item node) {
		if (!e.getSort().equals(expected)) {
			throw new UnsupportedConstructError("expected a term of sort " + expected + " but found " + e.getSort(),
					node);
		}
		return e;
	}

	private BoolExpr bool(Expr e, PureFile.Item node) {
		if (e instanceof BoolExpr) {
			return (BoolExpr) e;
		}
		throw new UnsupportedConstructError("expected a boolean term but found " + e.getSort(), node);
	}

	private BoolExpr[] bools(Expr[] es, PureFile.Item node) {
		BoolExpr[] result = new BoolExpr[es.length];
		for (int i = 0; i != es.length; ++i) {
			result[i] = bool(es[i], node);
		}
		return result;
	}

	private ArithExpr arith(Expr e, PureFile.Item node) {
		if (e instanceof ArithExpr) {
			return (ArithExpr) e;
		}
		throw new UnsupportedConstructError("expected an integer term but found " + e.getSort(), node);
	}
}
