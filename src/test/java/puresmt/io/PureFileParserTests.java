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
package puresmt.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Expr;
import puresmt.core.SyntaxError;

public class PureFileParserTests {

	private static Stream<Arguments> expressions() {
		return Stream.of(
				Arguments.of("1 + 2 * 3", "(1 + (2 * 3))"),
				Arguments.of("1 - 2 - 3", "((1 - 2) - 3)"),
				Arguments.of("a < b <= c", "(a < b <= c)"),
				Arguments.of("not a and b or c", "(((not a) and b) or c)"),
				Arguments.of("a and b and c", "(a and b and c)"),
				Arguments.of("-x ** 2", "(-(x ** 2))"),
				Arguments.of("a // b % c", "((a // b) % c)"),
				Arguments.of("a is not None", "(a is not None)"),
				Arguments.of("a not in b", "(a not in b)"),
				Arguments.of("f(*xs, 1)[0]", "f(*xs, 1)[0]"),
				Arguments.of("x[1:]", "x[1:]"),
				Arguments.of("x[::2]", "x[::2]"),
				Arguments.of("x[1, 2]", "x[(1, 2)]"),
				Arguments.of("x[1:2, 3]", "x[1:2, 3]"),
				Arguments.of("()", "()"),
				Arguments.of("(1,)", "(1,)"),
				Arguments.of("(*t, x)", "(*t, x)"),
				Arguments.of("lambda x, y: x", "(lambda x, y: x)"),
				Arguments.of("(lambda: True)()", "(lambda: True)()"),
				Arguments.of("f(lambda x: x + 1)", "f((lambda x: (x + 1)))"));
	}

	@ParameterizedTest
	@MethodSource("expressions")
	public void testExpression(String input, String expected) {
		assertEquals(expected, PureFileParser.parseExpression(input).toString());
	}

	@Test
	public void testPrintedExpressionReparses() {
		Expr e = PureFileParser.parseExpression("f(a + b * c, not d)[1:x]");
		String text = e.toString();
		assertEquals(text, PureFileParser.parseExpression(text).toString());
	}

	@Test
	public void testModule() {
		String text = "# increment\n"
				+ "@ch_weight(2)\n"
				+ "def inc(x: isint) -> isint:\n"
				+ "    return x + 1\n"
				+ "\n"
				+ "def _assert_inc(x: isint):\n"
				+ "    return inc(x) > \\\n"
				+ "        x\n";
		PureFile file = new PureFileParser("inc", text).read();
		assertEquals("inc", file.getName());
		assertEquals(2, file.getDeclarations().size());
		Decl.FunctionDef inc = file.getDeclarations().get(0);
		assertEquals("inc", inc.getName());
		assertEquals(1, inc.getDecorators().size());
		assertEquals("ch_weight(2)", inc.getDecorators().get(0).toString());
		assertEquals(1, inc.getParameters().size());
		assertEquals("isint", inc.getParameters().get(0).getAnnotation().toString());
		assertEquals("isint", inc.getReturns().toString());
		assertEquals("(x + 1)", inc.getBody().toString());
		Decl.FunctionDef assertion = file.getDeclarations().get(1);
		assertNull(assertion.getReturns());
		assertEquals("(inc(x) > x)", assertion.getBody().toString());
	}

	@Test
	public void testStarredParameter() {
		PureFile file = new PureFileParser("t", "def tuple(*a) -> istuple: return a").read();
		Decl.Parameter p = file.getDeclarations().get(0).getParameters().get(0);
		assertTrue(p.isStarred());
		assertNull(p.getAnnotation());
	}

	@Test
	public void testBracketsSpanLines() {
		PureFile file = new PureFileParser("t", "def f(x,\n      y):\n    return g(x,\n             y)\n").read();
		assertEquals("g(x, y)", file.getDeclarations().get(0).getBody().toString());
	}

	@Test
	public void testPosition() {
		Expr e = PureFileParser.parseExpression("\n  foo");
		PureFile.Position p = e.getAttribute(PureFile.Position.class);
		assertEquals(2, p.getLine());
		assertEquals(2, p.getColumn());
	}

	@Test
	public void testPrinter() {
		PureFile file = new PureFileParser("t", "@ch_pattern(lambda x: f(x))\ndef _assert_f(x): return f(x) == x").read();
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		new PureFilePrinter(bout).write(file);
		String text = new String(bout.toByteArray(), StandardCharsets.UTF_8);
		assertEquals("@ch_pattern((lambda x: f(x)))\ndef _assert_f(x):\n\treturn (f(x) == x)\n\n",
				text.replace(System.lineSeparator(), "\n"));
	}

	@Test
	public void testMissingReturn() {
		assertThrows(SyntaxError.class, () -> new PureFileParser("t", "def f(x): x").read());
	}

	@Test
	public void testIncompleteExpression() {
		assertThrows(SyntaxError.class, () -> PureFileParser.parseExpression("1 +"));
	}

	@Test
	public void testTrailingInput() {
		assertThrows(SyntaxError.class, () -> PureFileParser.parseExpression("f(x) g"));
	}

	@Test
	public void testStarredOutsideTuple() {
		assertThrows(SyntaxError.class, () -> PureFileParser.parseExpression("(*a)"));
	}

	@Test
	public void testUnexpectedCharacter() {
		SyntaxError e = assertThrows(SyntaxError.class, () -> PureFileParser.parseExpression("a $ b"));
		assertTrue(e.getMessage().contains("'$'"));
	}

	@Test
	public void testKeywordAsName() {
		assertThrows(SyntaxError.class, () -> new PureFileParser("t", "def lambda(x): return x").read());
	}
}
