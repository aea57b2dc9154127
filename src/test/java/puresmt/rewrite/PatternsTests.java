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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import puresmt.core.PureFile;
import puresmt.core.PureFile.Expr;
import puresmt.core.UnsupportedConstructError;
import puresmt.io.PureFileParser;

public class PatternsTests {

	private static Expr parse(String text) {
		return PureFileParser.parseExpression(text);
	}

	private static Expr pattern(String text) {
		return Patterns.preprocess(parse(text)).get(0);
	}

	@Test
	public void testPreprocess() {
		assertEquals("(0 + $X)", pattern("0 + X").toString());
		assertEquals("f($X, y, $Y_1)", pattern("f(X, y, Y_1)").toString());
	}

	@Test
	public void testPreprocessSharesVariables() {
		List<Expr> tagged = Patterns.preprocess(parse("f(X)"), parse("g(X)"));
		Expr lhs = ((Expr.Call) tagged.get(0)).getArguments().get(0);
		Expr rhs = ((Expr.Call) tagged.get(1)).getArguments().get(0);
		assertSame(lhs, rhs);
		assertTrue(Patterns.isVariable(lhs));
	}

	@Test
	public void testUpperCase() {
		assertTrue(Patterns.isUpperCase("X"));
		assertTrue(Patterns.isUpperCase("_X1"));
		assertFalse(Patterns.isUpperCase("Xy"));
		assertFalse(Patterns.isUpperCase("_"));
		assertFalse(Patterns.isUpperCase(""));
	}

	@Test
	public void testMatchBindsVariable() {
		Map<String, Expr> bindings = new HashMap<>();
		assertTrue(Patterns.match(parse("0 + 2"), pattern("0 + X"), bindings));
		assertEquals("2", bindings.get("X").toString());
	}

	@Test
	public void testMatchBindsSubtree() {
		Map<String, Expr> bindings = new HashMap<>();
		assertTrue(Patterns.match(parse("f(a and b, g(1))"), pattern("f(X, g(Y))"), bindings));
		assertEquals("(a and b)", bindings.get("X").toString());
		assertEquals("1", bindings.get("Y").toString());
	}

	@Test
	public void testMismatchedLeaf() {
		assertFalse(Patterns.match(parse("1 + 2"), pattern("0 + X"), new HashMap<>()));
		assertFalse(Patterns.match(parse("a - 2"), pattern("a + X"), new HashMap<>()));
		assertFalse(Patterns.match(parse("True"), pattern("False"), new HashMap<>()));
		assertTrue(Patterns.match(parse("None"), pattern("None"), new HashMap<>()));
	}

	@Test
	public void testMismatchedKindClearsBindings() {
		Map<String, Expr> bindings = new HashMap<>();
		bindings.put("Y", parse("y"));
		assertFalse(Patterns.match(parse("f(1)"), pattern("0 + X"), bindings));
		assertTrue(bindings.isEmpty());
	}

	@Test
	public void testMismatchedArity() {
		assertFalse(Patterns.match(parse("f(1)"), pattern("f(X, Y)"), new HashMap<>()));
	}

	@Test
	public void testUnhandledKind() {
		assertThrows(UnsupportedConstructError.class,
				() -> Patterns.match(parse("a < b"), pattern("a < b"), new HashMap<>()));
	}

	@Test
	public void testSubstitute() {
		Map<String, Expr> bindings = new HashMap<>();
		bindings.put("X", PureFile.NUMBER(2));
		assertEquals("(2 + 1)", Patterns.substitute(pattern("X + 1"), bindings).toString());
	}

	@Test
	public void testSubstituteUnbound() {
		assertThrows(IllegalArgumentException.class, () -> Patterns.substitute(pattern("X + Y"), new HashMap<>()));
	}
}
