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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Expr;
import puresmt.core.UnsupportedConstructError;
import puresmt.util.AbstractExpressionTransform;

/**
 * Pattern variables, structural matching and substitution over syntax trees.
 * In source form a pattern variable is any name written entirely in upper
 * case (e.g. <code>X</code> in <code>0 + X</code>); preprocessing tags it as
 * <code>$X</code> so that it cannot be confused with an ordinary reference.
 *
 * @author The PureSMT Project Developers
 */
public final class Patterns {
	public static final String VARIABLE_PREFIX = "$";

	private Patterns() {
	}

	/**
	 * Tag the pattern variables of one or more trees. The same upper-case name
	 * becomes the same tagged variable across all of the given trees, so that a
	 * pattern and its replacement agree.
	 *
	 * @param nodes
	 * @return
	 */
	public static List<Expr> preprocess(Expr... nodes) {
		Map<String, Expr.Name> variables = new HashMap<>();
		AbstractExpressionTransform tagger = new AbstractExpressionTransform() {
			@Override
			protected Expr constructName(Expr.Name expr) {
				if (!isUpperCase(expr.get())) {
					return expr;
				}
				return variables.computeIfAbsent(expr.get(),
						id -> PureFile.NAME(VARIABLE_PREFIX + id, expr.getAttributes()));
			}
		};
		List<Expr> result = new ArrayList<>();
		for (Expr node : nodes) {
			result.add(tagger.visitExpression(node));
		}
		return result;
	}

	public static boolean isVariable(PureFile.Item item) {
		return item instanceof Expr.Name && ((Expr.Name) item).get().startsWith(VARIABLE_PREFIX);
	}

	/**
	 * Check whether a node matches a pattern, recording the subtree bound to
	 * each pattern variable encountered. A pattern variable matches anything.
	 * Nodes of different kinds never match, in which case the bindings are
	 * cleared. Only calls, names, constants, numbers, binary and boolean
	 * operators and parameters can be compared; any other kind is an error.
	 *
	 * @param node
	 * @param pattern
	 * @param bindings
	 * @return
	 * @throws UnsupportedConstructError when asked to compare nodes of an
	 *                                   unhandled kind
	 */
	public static boolean match(PureFile.Item node, PureFile.Item pattern, Map<String, Expr> bindings) {
		if (isVariable(pattern)) {
			if (!(node instanceof Expr)) {
				bindings.clear();
				return false;
			}
			bindings.put(((Expr.Name) pattern).get().substring(VARIABLE_PREFIX.length()), (Expr) node);
			return true;
		} else if (node == null || pattern == null) {
			return node == pattern;
		} else if (node.getClass() != pattern.getClass()) {
			bindings.clear();
			return false;
		} else if (node instanceof Expr.Call) {
			Expr.Call n = (Expr.Call) node;
			Expr.Call p = (Expr.Call) pattern;
			return match(n.getCallee(), p.getCallee(), bindings)
					&& matchAll(n.getArguments(), p.getArguments(), bindings);
		} else if (node instanceof Expr.Name) {
			return ((Expr.Name) node).get().equals(((Expr.Name) pattern).get());
		} else if (node instanceof Expr.Constant) {
			return ((Expr.Constant) node).getKind() == ((Expr.Constant) pattern).getKind();
		} else if (node instanceof Expr.Number) {
			return ((Expr.Number) node).getValue().equals(((Expr.Number) pattern).getValue());
		} else if (node instanceof Expr.BinOp) {
			Expr.BinOp n = (Expr.BinOp) node;
			Expr.BinOp p = (Expr.BinOp) pattern;
			return n.getOperator() == p.getOperator() && match(n.getLeftHandSide(), p.getLeftHandSide(), bindings)
					&& match(n.getRightHandSide(), p.getRightHandSide(), bindings);
		} else if (node instanceof Expr.BoolOp) {
			Expr.BoolOp n = (Expr.BoolOp) node;
			Expr.BoolOp p = (Expr.BoolOp) pattern;
			return n.getOperator() == p.getOperator() && matchAll(n.getOperands(), p.getOperands(), bindings);
		} else if (node instanceof Decl.Parameter) {
			Decl.Parameter n = (Decl.Parameter) node;
			Decl.Parameter p = (Decl.Parameter) pattern;
			return n.getName().equals(p.getName()) && n.isStarred() == p.isStarred()
					&& match(n.getAnnotation(), p.getAnnotation(), bindings);
		}
		throw new UnsupportedConstructError("unhandled node kind in pattern match (" + node.getClass().getSimpleName() + ")",
				node);
	}

	/**
	 * Match two sequences element by element. Sequences of different lengths
	 * never match.
	 *
	 * @param nodes
	 * @param patterns
	 * @param bindings
	 * @return
	 */
	public static boolean matchAll(List<? extends PureFile.Item> nodes, List<? extends PureFile.Item> patterns,
			Map<String, Expr> bindings) {
		if (nodes.size() != patterns.size()) {
			return false;
		}
		for (int i = 0; i != nodes.size(); ++i) {
			if (!match(nodes.get(i), patterns.get(i), bindings)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Instantiate a template by replacing each pattern variable with the subtree
	 * bound to it.
	 *
	 * @param template
	 * @param bindings
	 * @return
	 * @throws IllegalArgumentException if the template contains an unbound
	 *                                  pattern variable
	 */
	public static Expr substitute(Expr template, Map<String, Expr> bindings) {
		AbstractExpressionTransform replacer = new AbstractExpressionTransform() {
			@Override
			protected Expr constructName(Expr.Name expr) {
				if (!isVariable(expr)) {
					return expr;
				}
				Expr bound = bindings.get(expr.get().substring(VARIABLE_PREFIX.length()));
				if (bound == null) {
					throw new IllegalArgumentException("unbound pattern variable " + expr.get());
				}
				return bound;
			}
		};
		return replacer.visitExpression(template);
	}

	/**
	 * Determine whether a name is written in upper case, meaning it has at least
	 * one cased character and no lower-case ones.
	 *
	 * @param name
	 * @return
	 */
	static boolean isUpperCase(String name) {
		boolean cased = false;
		for (int i = 0; i != name.length(); ++i) {
			char c = name.charAt(i);
			if (Character.isLowerCase(c)) {
				return false;
			} else if (Character.isUpperCase(c)) {
				cased = true;
			}
		}
		return cased;
	}
}
