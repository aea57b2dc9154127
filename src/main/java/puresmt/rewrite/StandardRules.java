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

import java.math.BigInteger;
import java.util.Map;

import puresmt.core.PureFile.Expr;

/**
 * The simplifications applied to every expression before it is translated
 * into logic. Quantifiers applied to lambdas become their intrinsic forms,
 * and type predicates are decided outright for literals.
 *
 * @author The PureSMT Project Developers
 */
public final class StandardRules {
	private static final RewriteEngine ENGINE = create().freeze();

	private StandardRules() {
	}

	/**
	 * Get the shared engine holding the standard rules. It is frozen, so
	 * further rules go in a {@link LayeredRewriteEngine} over it.
	 *
	 * @return
	 */
	public static RewriteEngine get() {
		return ENGINE;
	}

	public static RewriteEngine create() {
		RewriteEngine engine = new RewriteEngine();
		engine.add(RewriteRule.of("forall(F)", "_z_wrapbool(_z_forall(F))", b -> b.get("F") instanceof Expr.Lambda));
		engine.add(RewriteRule.of("thereexists(F)", "_z_wrapbool(_z_thereexists(F))",
				b -> b.get("F") instanceof Expr.Lambda));
		engine.add(RewriteRule.of("isint(N)", "True", b -> b.get("N") instanceof Expr.Number));
		engine.add(RewriteRule.of("isnat(N)", "True", StandardRules::isNatural));
		engine.add(RewriteRule.of("isbool(B)", "True", b -> isConstant(b.get("B"), Expr.Constant.Kind.TRUE)
				|| isConstant(b.get("B"), Expr.Constant.Kind.FALSE)));
		engine.add(RewriteRule.of("isnone(N)", "True", b -> isConstant(b.get("N"), Expr.Constant.Kind.NONE)));
		return engine;
	}

	private static boolean isNatural(Map<String, Expr> bindings) {
		Expr n = bindings.get("N");
		return n instanceof Expr.Number && ((Expr.Number) n).getValue().compareTo(BigInteger.ZERO) >= 0;
	}

	private static boolean isConstant(Expr e, Expr.Constant.Kind kind) {
		return e instanceof Expr.Constant && ((Expr.Constant) e).getKind() == kind;
	}
}
