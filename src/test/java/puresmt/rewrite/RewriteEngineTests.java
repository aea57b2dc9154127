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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import puresmt.core.PureFile.Expr;
import puresmt.io.PureFileParser;

public class RewriteEngineTests {

	private static Expr parse(String text) {
		return PureFileParser.parseExpression(text);
	}

	@Test
	public void testRewritesChildren() {
		RewriteEngine engine = new RewriteEngine().add("0 + X", "X");
		assertEquals("f(a)", engine.rewrite(parse("f(0 + (0 + a))")).toString());
	}

	@Test
	public void testRewritesResult() {
		RewriteEngine engine = new RewriteEngine().add("double(X)", "X + X").add("0 + X", "X");
		assertEquals("a", engine.rewrite(parse("0 + (0 + a)")).toString());
		assertEquals("(0 + 0)", new RewriteEngine().add("double(X)", "X + X").rewrite(parse("double(0)")).toString());
		assertEquals("0", engine.rewrite(parse("double(0)")).toString());
	}

	@Test
	public void testFixpoint() {
		RewriteEngine engine = new RewriteEngine().add("0 + X", "X").add("f(f(X))", "f(X)");
		Expr once = engine.rewrite(parse("f(f(f(0 + f(a))))"));
		assertEquals("f(a)", once.toString());
		assertSame(once, engine.rewrite(once));
	}

	@Test
	public void testUnchanged() {
		RewriteEngine engine = new RewriteEngine().add("0 + X", "X");
		Expr e = parse("g(1 + a, b)");
		assertSame(e, engine.rewrite(e));
	}

	@Test
	public void testFirstRuleWins() {
		RewriteEngine engine = new RewriteEngine().add("f(X)", "a").add("f(X)", "b");
		assertEquals("a", engine.rewrite(parse("f(1)")).toString());
	}

	@Test
	public void testCondition() {
		RewriteEngine engine = new RewriteEngine()
				.add(RewriteRule.of("isint(N)", "True", b -> b.get("N") instanceof Expr.Number));
		assertEquals("True", engine.rewrite(parse("isint(3)")).toString());
		Expr e = parse("isint(x)");
		assertSame(e, engine.rewrite(e));
	}

	@Test
	public void testVariableCallee() {
		RewriteEngine engine = new RewriteEngine().add("F(0)", "F(1)");
		assertEquals("g(1)", engine.rewrite(parse("g(0)")).toString());
	}

	@Test
	public void testLayering() {
		RewriteEngine base = new RewriteEngine().add("f(X)", "b").add("g(X)", "X");
		RewriteEngine layered = new LayeredRewriteEngine(base).add("f(X)", "a");
		assertEquals("a", layered.rewrite(parse("f(1)")).toString());
		assertEquals("1", layered.rewrite(parse("g(1)")).toString());
		// the inner engine does not see the outer rules
		assertEquals("b", base.rewrite(parse("f(1)")).toString());
	}

	@Test
	public void testStandardRules() {
		RewriteEngine rules = StandardRules.get();
		assertEquals("_z_wrapbool(_z_forall((lambda x: True)))",
				rules.rewrite(parse("forall(lambda x: isint(3))")).toString());
		assertEquals("_z_wrapbool(_z_thereexists((lambda x: isbool(x))))",
				rules.rewrite(parse("thereexists(lambda x: isbool(x))")).toString());
		assertEquals("forall(f)", rules.rewrite(parse("forall(f)")).toString());
		assertEquals("True", rules.rewrite(parse("isnat(0)")).toString());
		assertEquals("isnat((-1))", rules.rewrite(parse("isnat(-1)")).toString());
		assertEquals("True", rules.rewrite(parse("isbool(False)")).toString());
		assertEquals("True", rules.rewrite(parse("isnone(None)")).toString());
		assertEquals("isnone(0)", rules.rewrite(parse("isnone(0)")).toString());
	}

	@Test
	public void testStandardRulesFrozen() {
		RewriteEngine rules = StandardRules.get();
		assertTrue(rules.isFrozen());
		assertThrows(IllegalStateException.class, () -> rules.add("isint(X)", "False"));
		RewriteEngine layered = new LayeredRewriteEngine(rules).add("isint(X)", "False");
		assertEquals("False", layered.rewrite(parse("isint(y)")).toString());
		assertEquals("isint(y)", rules.rewrite(parse("isint(y)")).toString());
	}
}
