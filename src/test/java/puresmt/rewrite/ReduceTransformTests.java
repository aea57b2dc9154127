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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.function.Function;

import org.junit.jupiter.api.Test;

import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Expr;
import puresmt.io.PureFileParser;

public class ReduceTransformTests {
	private static final Decl.FunctionDef REDUCE = new PureFileParser("t", "def reduce(f, l, i): return i").read()
			.getDeclarations().get(0);

	private static final Decl.FunctionDef ADD = new PureFileParser("t", "def add(a, b): return a + b").read()
			.getDeclarations().get(0);

	private static final Function<Expr.Name, Decl> RESOLVER = name -> {
		switch (name.get()) {
		case "reduce":
			return REDUCE;
		case "add":
			return ADD;
		default:
			return null;
		}
	};

	private static Expr parse(String text) {
		return PureFileParser.parseExpression(text);
	}

	private static RewriteEngine distributive() {
		return new RewriteEngine().add("neg(X + Y)", "neg(X) + neg(Y)");
	}

	@Test
	public void testMovesContextInside() {
		ReduceTransform transform = new ReduceTransform(distributive(), RESOLVER);
		Expr result = transform.apply(parse("neg(reduce(lambda a, b: a + b, l, 0))"));
		assertEquals("reduce((lambda a, b: (a + b)), map(neg, l), neg(0))", result.toString());
	}

	@Test
	public void testNamedReducer() {
		ReduceTransform transform = new ReduceTransform(distributive(), RESOLVER);
		Expr result = transform.apply(parse("neg(reduce(add, l, i))"));
		assertEquals("reduce((lambda a, b: (a + b)), map(neg, l), neg(i))", result.toString());
	}

	@Test
	public void testContextAsLambda() {
		RewriteEngine rules = new RewriteEngine().add("f(X + Y, Z)", "f(X, Z) + f(Y, Z)");
		ReduceTransform transform = new ReduceTransform(rules, RESOLVER);
		Expr result = transform.apply(parse("f(reduce(lambda a, b: a + b, l, 0), k)"));
		assertEquals("reduce((lambda a, b: (a + b)), map((lambda R#1: f(R#1, k)), l), f(0, k))", result.toString());
	}

	@Test
	public void testAbandonedWithoutRule() {
		ReduceTransform transform = new ReduceTransform(new RewriteEngine(), RESOLVER);
		Expr e = parse("neg(reduce(lambda a, b: a + b, l, 0))");
		assertSame(e, transform.apply(e));
	}

	@Test
	public void testAbandonedOnUnmatchableContext() {
		ReduceTransform transform = new ReduceTransform(distributive(), RESOLVER);
		Expr e = parse("neg(reduce(lambda a, b: a + b, l, 0)) < 1");
		assertSame(e, transform.apply(e));
	}

	@Test
	public void testRootReduction() {
		ReduceTransform transform = new ReduceTransform(distributive(), RESOLVER);
		Expr e = parse("reduce(lambda a, b: a + b, l, 0)");
		assertSame(e, transform.apply(e));
	}

	@Test
	public void testUnknownReduce() {
		ReduceTransform transform = new ReduceTransform(distributive(), name -> null);
		Expr e = parse("neg(reduce(lambda a, b: a + b, l, 0))");
		assertSame(e, transform.apply(e));
	}
}
