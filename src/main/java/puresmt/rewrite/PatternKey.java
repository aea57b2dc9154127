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

import java.util.Objects;

import puresmt.core.PureFile.Expr;

/**
 * Coarse classification of a node used to index rewrite rules. Two nodes with
 * different keys can never match one another, though nodes with the same key
 * may still fail to match.
 */
public final class PatternKey {
	private final Class<?> kind;
	private final Object discriminant;

	private PatternKey(Class<?> kind, Object discriminant) {
		this.kind = kind;
		this.discriminant = discriminant;
	}

	/**
	 * Compute the key of a node. Operators are distinguished by their operator,
	 * and calls by the name of their callee (unless that is itself a pattern
	 * variable).
	 *
	 * @param node
	 * @return
	 */
	public static PatternKey of(Expr node) {
		Object discriminant = null;
		if (node instanceof Expr.BinOp) {
			discriminant = ((Expr.BinOp) node).getOperator();
		} else if (node instanceof Expr.BoolOp) {
			discriminant = ((Expr.BoolOp) node).getOperator();
		} else if (node instanceof Expr.Call) {
			Expr callee = ((Expr.Call) node).getCallee();
			if (callee instanceof Expr.Name && !Patterns.isVariable(callee)) {
				discriminant = ((Expr.Name) callee).get();
			}
		}
		return new PatternKey(node.getClass(), discriminant);
	}

	/**
	 * Get the key of a call with an unknown callee, or <code>null</code> if this
	 * key is not that of a call with a named callee.
	 *
	 * @return
	 */
	public PatternKey generalise() {
		if (kind == Expr.Call.class && discriminant != null) {
			return new PatternKey(kind, null);
		}
		return null;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof PatternKey) {
			PatternKey k = (PatternKey) o;
			return kind == k.kind && Objects.equals(discriminant, k.discriminant);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return kind.hashCode() ^ Objects.hashCode(discriminant);
	}

	@Override
	public String toString() {
		return discriminant == null ? kind.getSimpleName() : kind.getSimpleName() + ":" + discriminant;
	}
}
