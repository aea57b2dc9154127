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
import java.util.List;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Pattern;

import puresmt.logic.LogicSort;

/**
 * The fixed axioms relating <code>Concat</code> to the empty tuple and to
 * <code>cons</code>. These allow argument lists built with spliced arguments
 * to be equated with those built one argument at a time.
 *
 * @author The PureSMT Project Developers
 */
public final class StructuralAxioms {
	private StructuralAxioms() {
	}

	public static List<BoolExpr> create(LogicSort sort) {
		Context ctx = sort.getContext();
		Expr r = sort.constant("r");
		Expr g = sort.constant("g");
		Expr x = sort.constant("x");
		Expr empty = sort.empty();
		List<BoolExpr> axioms = new ArrayList<>();
		// (*r, *()) == r
		Expr rightIdentity = sort.concat(r, empty);
		axioms.add(forall(ctx, new Expr[] { r }, ctx.mkEq(rightIdentity, r), rightIdentity));
		// (*(), *r) == r
		Expr leftIdentity = sort.concat(empty, r);
		axioms.add(forall(ctx, new Expr[] { r }, ctx.mkEq(leftIdentity, r), leftIdentity));
		// (*g, *(x,)) == (*g, x)
		Expr single = sort.concat(g, sort.cons(empty, x));
		axioms.add(forall(ctx, new Expr[] { x, g }, ctx.mkEq(single, sort.cons(g, x)), single));
		// (*g, *(*r, x)) == (*g, *r, x)
		Expr nested = sort.concat(g, sort.cons(r, x));
		axioms.add(forall(ctx, new Expr[] { x, g, r }, ctx.mkEq(nested, sort.cons(sort.concat(g, r), x)), nested));
		return axioms;
	}

	private static BoolExpr forall(Context ctx, Expr[] bound, BoolExpr body, Expr trigger) {
		Pattern[] patterns = new Pattern[] { ctx.mkPattern(trigger) };
		return ctx.mkForall(bound, body, 1, patterns, null, null, null);
	}
}
