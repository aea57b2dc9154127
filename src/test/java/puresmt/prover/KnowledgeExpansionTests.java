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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;

import puresmt.core.DefinitionError;
import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.io.PureFileParser;
import puresmt.logic.BindingEnv;
import puresmt.logic.LogicCompiler;
import puresmt.logic.LogicSort;
import puresmt.logic.Scope;
import puresmt.logic.ScopeResolver;
import puresmt.registry.DefinitionRegistry;

public class KnowledgeExpansionTests {
	private Context context;
	private LogicSort sort;

	@BeforeEach
	public void setup() {
		context = new Context();
		sort = new LogicSort(context);
	}

	@AfterEach
	public void teardown() {
		context.close();
	}

	private static PureFile parse(String text) {
		return new PureFileParser("m", text).read();
	}

	private List<Statement> expand(DefinitionRegistry registry, String conclusion, int rounds) {
		BindingEnv env = new BindingEnv(sort);
		AssertionCompiler assertions = new AssertionCompiler(new LogicCompiler(new ScopeResolver(registry), env));
		assertions.compileConclusion(parse(conclusion).getDeclarations().get(0), Scope.EMPTY);
		return new KnowledgeExpansion(registry, assertions).setMaxRounds(rounds).expand();
	}

	private static List<Decl.FunctionDef> sources(List<Statement> statements) {
		List<Decl.FunctionDef> result = new ArrayList<>();
		for (Statement s : statements) {
			if (s.getSource() != null) {
				result.add(s.getSource());
			}
		}
		return result;
	}

	private static boolean containsSource(List<Statement> statements, Decl.FunctionDef source) {
		for (Statement s : statements) {
			if (s.getSource() == source) {
				return true;
			}
		}
		return false;
	}

	@Test
	public void testRequiredStatementsFirst() {
		DefinitionRegistry registry = DefinitionRegistry.standard();
		List<Statement> statements = expand(registry, "def c(x: isint): return True",
				KnowledgeExpansion.DEFAULT_MAX_ROUNDS);
		List<BoolExpr> structural = StructuralAxioms.create(sort);
		for (int i = 0; i != structural.size(); ++i) {
			assertTrue(statements.get(i).isRequired());
			assertNull(statements.get(i).getSource());
			assertTrue(statements.get(i).getFormula().isQuantifier());
		}
		List<Decl.FunctionDef> globals = registry.getGlobalAssertions();
		for (int i = 0; i != globals.size(); ++i) {
			Statement s = statements.get(structural.size() + i);
			assertTrue(s.isRequired());
			assertSame(globals.get(i), s.getSource());
		}
	}

	@Test
	public void testExpandsTransitively() {
		DefinitionRegistry registry = DefinitionRegistry.standard();
		List<Statement> statements = expand(registry, "def c(x: isint): return True",
				KnowledgeExpansion.DEFAULT_MAX_ROUNDS);
		// isint is referenced directly, isbool only by the annotation of isint
		assertTrue(containsSource(statements, registry.getAssertions("isint").get(0)));
		assertTrue(containsSource(statements, registry.getFn("isint").getDefinitionalAssertion()));
		assertTrue(containsSource(statements, registry.getAssertions("isbool").get(0)));
		assertFalse(containsSource(statements, registry.getAssertions("_op_Add").get(0)));
		for (Statement s : statements) {
			if (s.getSource() == registry.getAssertions("isint").get(0)) {
				assertFalse(s.isRequired());
			}
		}
	}

	@Test
	public void testBoundedRounds() {
		DefinitionRegistry registry = DefinitionRegistry.standard();
		List<Statement> statements = expand(registry, "def c(x: isint): return True", 1);
		assertTrue(containsSource(statements, registry.getAssertions("isint").get(0)));
		assertFalse(containsSource(statements, registry.getAssertions("isbool").get(0)));
	}

	@Test
	public void testNoRounds() {
		List<Statement> statements = expand(DefinitionRegistry.standard(), "def c(x: isint): return True", 0);
		for (Statement s : statements) {
			assertTrue(s.isRequired());
		}
	}

	@Test
	public void testReferencedFunctionIsFunction() {
		List<Statement> statements = expand(DefinitionRegistry.standard(), "def c(x: isint): return True",
				KnowledgeExpansion.DEFAULT_MAX_ROUNDS);
		boolean found = false;
		for (Statement s : statements) {
			found |= !s.isRequired() && s.getFormula().equals(sort.isFunc(sort.constant("isint")));
		}
		assertTrue(found);
	}

	@Test
	public void testLambdaSupportIsRequired() {
		List<Statement> statements = expand(DefinitionRegistry.standard(),
				"def c(): return map(lambda x: x, ()) == ()", KnowledgeExpansion.DEFAULT_MAX_ROUNDS);
		int generated = 0;
		for (Statement s : statements) {
			if (s.getSource() == null && s.isRequired()) {
				generated = generated + 1;
			}
		}
		assertTrue(generated >= StructuralAxioms.create(sort).size() + 2);
	}

	@Test
	public void testUserModule() {
		DefinitionRegistry registry = DefinitionRegistry.of(parse("def inc(x: isint) -> isint:\n    return x + 1\n"
				+ "def _assert_inc(x: isint):\n    return inc(x) > x\n"));
		List<Statement> statements = expand(registry, "def c(y: isint): return inc(y) > 0",
				KnowledgeExpansion.DEFAULT_MAX_ROUNDS);
		List<Decl.FunctionDef> sources = sources(statements);
		assertTrue(sources.contains(registry.getAssertions("inc").get(0)));
		assertTrue(sources.contains(registry.getFn("inc").getDefinitionalAssertion()));
		assertTrue(containsSource(statements, registry.getAssertions("_op_Gt").get(0)));
	}

	@Test
	public void testMalformedWeightSkipsAxiom() {
		DefinitionRegistry registry = DefinitionRegistry.of(parse("def f(x):\n    return x\n"
				+ "@ch_weight(y)\ndef _assert_f(x):\n    return f(x) == x\n"));
		List<Statement> statements = expand(registry, "def c(y): return f(y)", KnowledgeExpansion.DEFAULT_MAX_ROUNDS);
		assertFalse(containsSource(statements, registry.getAssertions("f").get(0)));
		assertNull(AssertionCompiler.weightOf(registry.getAssertions("f").get(0)));
	}

	@Test
	public void testWeights() {
		PureFile module = parse("@ch_weight(3)\ndef _assert_f(x):\n    return x\n"
				+ "@ch_weight(99999999999)\ndef _assert_g(x):\n    return x\n"
				+ "def _assert_h(x):\n    return x\n");
		List<Decl.FunctionDef> fns = module.getDeclarations();
		assertEquals(Integer.valueOf(3), AssertionCompiler.weightOf(fns.get(0)));
		assertNull(AssertionCompiler.weightOf(fns.get(1)));
		assertEquals(Integer.valueOf(1), AssertionCompiler.weightOf(fns.get(2)));
	}

	@Test
	public void testMismatchedPattern() {
		DefinitionRegistry registry = DefinitionRegistry.of(parse("def f(x):\n    return x\n"
				+ "@ch_pattern(lambda y: f(y))\ndef _assert_f(x):\n    return f(x) == x\n"));
		DefinitionError e = assertThrows(DefinitionError.class,
				() -> expand(registry, "def c(y): return f(y)", KnowledgeExpansion.DEFAULT_MAX_ROUNDS));
		assertEquals("pattern arguments do not match function arguments", e.getMessage());
	}

	@Test
	public void testPatternNotLambda() {
		DefinitionRegistry registry = DefinitionRegistry.of(parse("def f(x):\n    return x\n"
				+ "@ch_pattern(f)\ndef _assert_f(x):\n    return f(x) == x\n"));
		DefinitionError e = assertThrows(DefinitionError.class,
				() -> expand(registry, "def c(y): return f(y)", KnowledgeExpansion.DEFAULT_MAX_ROUNDS));
		assertEquals("pattern must be a lambda", e.getMessage());
	}

	@Test
	public void testInferredPatterns() {
		PureFile module = parse("def _assert_f(x): return _z_wrapbool(_z_implies(_z_isint(x), _z_eq(f(x), x)))\n"
				+ "def _assert_g(x): return g(x) == x\n"
				+ "@ch_pattern(lambda x: h(x), lambda x: k(x))\ndef _assert_h(x): return h(x) == k(x)\n");
		assertEquals("[[f(x)]]", AssertionCompiler.findPatterns(module.getDeclarations().get(0)).toString());
		assertEquals("[[g(x)]]", AssertionCompiler.findPatterns(module.getDeclarations().get(1)).toString());
		assertEquals("[[h(x), k(x)]]", AssertionCompiler.findPatterns(module.getDeclarations().get(2)).toString());
	}
}
