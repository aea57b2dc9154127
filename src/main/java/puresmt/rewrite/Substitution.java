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

import java.util.HashMap;
import java.util.Map;

import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Expr;
import puresmt.util.AbstractExpressionTransform;

/**
 * Simultaneously replaces free occurrences of names with expressions. A lambda
 * whose parameter has the same name as a substituted variable shadows it
 * within its body. No attempt is made to avoid capture.
 */
public class Substitution extends AbstractExpressionTransform {
	private final Map<String, Expr> mapping;

	public Substitution(Map<String, Expr> mapping) {
		this.mapping = mapping;
	}

	public Expr apply(Expr expr) {
		return visitExpression(expr);
	}

	@Override
	protected Expr constructName(Expr.Name expr) {
		Expr replacement = mapping.get(expr.get());
		return replacement == null ? expr : replacement;
	}

	@Override
	protected Expr visitLambda(Expr.Lambda expr) {
		Map<String, Expr> inner = new HashMap<>(mapping);
		for (Decl.Parameter p : expr.getParameters()) {
			inner.remove(p.getName());
		}
		if (inner.size() == mapping.size()) {
			return super.visitLambda(expr);
		}
		Expr body = new Substitution(inner).apply(expr.getBody());
		return constructLambda(expr, body);
	}
}
