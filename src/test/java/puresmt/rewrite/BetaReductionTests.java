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

import org.junit.jupiter.api.Test;

import puresmt.core.PureFile.Expr;
import puresmt.io.PureFileParser;

public class BetaReductionTests {

	private static Expr.Call call(String text) {
		return (Expr.Call) PureFileParser.parseExpression(text);
	}

	@Test
	public void testReduce() {
		assertEquals("(5 + 1)", BetaReduction.reduce(call("(lambda x: x + 1)(5)")).toString());
		assertEquals("f(2, 1)", BetaReduction.reduce(call("(lambda x, y: f(y, x))(1, 2)")).toString());
	}

	@Test
	public void testNoParameters() {
		assertEquals("True", BetaReduction.reduce(call("(lambda: True)()")).toString());
	}

	@Test
	public void testShadowing() {
		assertEquals("(lambda x: x)(5)", BetaReduction.reduce(call("(lambda x: (lambda x: x)(x))(5)")).toString());
		assertEquals("(lambda y: (y + 5))",
				BetaReduction.reduce(call("(lambda x: lambda y: y + x)(5)")).toString());
	}

	@Test
	public void testNotReducible() {
		Expr.Call[] calls = { call("f(1)"), call("(lambda x, y: x)(1)"), call("(lambda x: x)(*t)"),
				call("(lambda *x: x)(1)") };
		for (Expr.Call c : calls) {
			assertSame(c, BetaReduction.reduce(c));
		}
	}
}
