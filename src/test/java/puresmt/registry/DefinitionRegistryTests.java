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
package puresmt.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import puresmt.core.DefinitionError;
import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.io.PureFileParser;
import puresmt.logic.Scope;

public class DefinitionRegistryTests {

	private static PureFile parse(String name, String text) {
		return new PureFileParser(name, text).read();
	}

	@Test
	public void testStandard() {
		DefinitionRegistry registry = DefinitionRegistry.standard();
		assertSame(registry, DefinitionRegistry.standard());
		assertEquals(1, registry.getModules().size());
		assertNotNull(registry.getDefinition("isint"));
		assertNotNull(registry.getDefinition("_op_Add"));
		assertNotNull(registry.getDefinition("_builtin_len"));
		assertNull(registry.getDefinition("nothing"));
		assertEquals(1, registry.getAssertions("isint").size());
		assertEquals(2, registry.getAssertions("_builtin_len").size());
		assertEquals(5, registry.getGlobalAssertions().size());
	}

	@Test
	public void testUnknownFunction() {
		DefinitionError e = assertThrows(DefinitionError.class, () -> DefinitionRegistry.standard().getFn("nothing"));
		assertEquals("unknown function: nothing", e.getMessage());
	}

	@Test
	public void testExtend() {
		PureFile module = parse("m", "def inc(x: isint) -> isint:\n    return x + 1\n"
				+ "def _assert_inc(x: isint):\n    return inc(x) > x\n");
		DefinitionRegistry registry = DefinitionRegistry.of(module);
		assertEquals(2, registry.getModules().size());
		assertSame(module.getDeclarations().get(0), registry.getDefinition("inc"));
		assertEquals(1, registry.getAssertions("inc").size());
		assertNotNull(registry.getDefinition("isint"));
		// the standard registry is unaffected
		assertNull(DefinitionRegistry.standard().getDefinition("inc"));
	}

	@Test
	public void testAssertionBeforeDefinition() {
		PureFile module = parse("m", "def _assert_f(x):\n    return f(x) == x\ndef f(x):\n    return x\n");
		DefinitionRegistry registry = DefinitionRegistry.of(module);
		assertEquals(1, registry.getAssertions("f").size());
	}

	@Test
	public void testAssertionAboutEarlierModule() {
		PureFile module = parse("m", "def _assert_isint(x):\n    return isint(x) or not isint(x)\n");
		DefinitionRegistry registry = DefinitionRegistry.of(module);
		assertEquals(2, registry.getAssertions("isint").size());
		assertEquals(1, DefinitionRegistry.standard().getAssertions("isint").size());
	}

	@Test
	public void testAssertionAboutUnknownFunction() {
		PureFile module = parse("m", "def _assert_nothing(x):\n    return True\n");
		DefinitionError e = assertThrows(DefinitionError.class, () -> DefinitionRegistry.of(module));
		assertEquals("unknown function: nothing", e.getMessage());
	}

	@Test
	public void testMultiplyDefinedAcrossModules() {
		PureFile module = parse("m", "def isint(x):\n    return True\n");
		DefinitionError e = assertThrows(DefinitionError.class, () -> DefinitionRegistry.of(module));
		assertEquals("multiply defined function: isint", e.getMessage());
	}

	@Test
	public void testMultiplyDefinedInModule() {
		PureFile module = parse("m", "def f(x):\n    return x\ndef f(y):\n    return y\n");
		assertThrows(DefinitionError.class, () -> DefinitionRegistry.of(module));
	}

	@Test
	public void testGlobalAssertions() {
		PureFile module = parse("m", "def _assert_():\n    return True\n");
		DefinitionRegistry registry = DefinitionRegistry.of(module);
		assertEquals(6, registry.getGlobalAssertions().size());
	}

	@Test
	public void testDefinitionalAssertion() {
		PureFile module = parse("m", "def inc(x: isint) -> isint:\n    return x + 1\n"
				+ "def pick(x: isint, y):\n    return y\n"
				+ "def plain(x):\n    return x\n");
		DefinitionRegistry registry = DefinitionRegistry.of(module);
		Decl.FunctionDef inc = registry.getFn("inc").getDefinitionalAssertion();
		assertEquals("_assertdef_inc", inc.getName());
		assertEquals("isint(inc(x))", inc.getBody().toString());
		assertEquals(1, inc.getParameters().size());
		assertEquals("isdefined(pick(x, y))", registry.getFn("pick").getDefinitionalAssertion().getBody().toString());
		assertNull(registry.getFn("plain").getDefinitionalAssertion());
	}

	@Test
	public void testScope() {
		PureFile module = parse("m", "def inc(x):\n    return x + 1\n");
		DefinitionRegistry registry = DefinitionRegistry.of(module);
		Decl.FunctionDef inc = registry.getDefinition("inc");
		assertSame(inc, registry.getScope(inc).lookup("inc"));
		Decl.FunctionDef isint = registry.getDefinition("isint");
		assertNull(registry.getScope(isint).lookup("inc"));
		assertSame(Scope.EMPTY, registry.getScope(parse("c", "def c(x):\n    return x\n").getDeclarations().get(0)));
	}

	@Test
	public void testFunctionsInModuleOrder() {
		PureFile module = parse("m", "def b(x):\n    return x\ndef a(x):\n    return x\n");
		DefinitionRegistry registry = DefinitionRegistry.of(module);
		int ib = -1;
		int ia = -1;
		for (int i = 0; i != registry.getFunctions().size(); ++i) {
			String name = registry.getFunctions().get(i).getName();
			ib = name.equals("b") ? i : ib;
			ia = name.equals("a") ? i : ia;
		}
		assertTrue(ib >= 0 && ib < ia);
		assertTrue(registry.getFn("isint").getModule() != registry.getFn("a").getModule());
	}
}
