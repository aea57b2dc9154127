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

import static puresmt.core.PureFile.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Expr;
import puresmt.core.PureFile.Operator;
import puresmt.core.PureFile.Slice;
import puresmt.core.SyntaxError;
import puresmt.io.PureFileLexer.Token;

/**
 * Recursive-descent parser for modules of pure function definitions. A module
 * is a sequence of (optionally decorated) definitions, each of which returns a
 * single expression:
 *
 * <pre>
 * &#64;ch_weight(2)
 * def inc(x: isint) -> isint:
 *     return x + 1
 * </pre>
 *
 * Indentation is not significant, since a body is always a single
 * <code>return</code>.
 *
 * @author The PureSMT Project Developers
 */
public class PureFileParser {
	private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList("def", "return", "lambda", "and", "or",
			"not", "in", "is", "True", "False", "None"));

	private final String name;
	private final String input;
	private final List<Token> tokens;
	private int index;

	public PureFileParser(String name, String input) {
		this.name = name;
		this.input = input;
		this.tokens = new PureFileLexer(input).scan();
	}

	/**
	 * Parse a single expression, such as a rewrite pattern.
	 *
	 * @param text
	 * @return
	 */
	public static Expr parseExpression(String text) {
		PureFileParser parser = new PureFileParser("<expr>", text);
		Expr e = parser.parseExpression();
		parser.skipNewlines();
		parser.match(Token.Kind.EOF);
		return e;
	}

	public PureFile read() {
		ArrayList<Decl.FunctionDef> decls = new ArrayList<>();
		skipNewlines();
		while (lookahead().kind != Token.Kind.EOF) {
			decls.add(parseFunctionDef());
			skipNewlines();
		}
		return new PureFile(name, decls);
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	private Decl.FunctionDef parseFunctionDef() {
		Token first = lookahead();
		ArrayList<Expr> decorators = new ArrayList<>();
		while (lookahead().is("@")) {
			match("@");
			decorators.add(parseExpression());
			match(Token.Kind.NEWLINE);
			skipNewlines();
		}
		Token def = match("def");
		String fn = matchIdentifier().text;
		match("(");
		List<Decl.Parameter> parameters = parseParameters(")", true);
		match(")");
		Expr returns = null;
		if (tryMatch("->")) {
			returns = parseExpression();
		}
		match(":");
		skipNewlines();
		match("return");
		Expr body = parseExpression();
		Token last = tokens.get(index - 1);
		if (lookahead().kind != Token.Kind.EOF) {
			match(Token.Kind.NEWLINE);
		}
		String source = input.substring(first.start, last.end());
		return FUNCTION(fn, parameters, returns, body, decorators, source, position(def));
	}

	private List<Decl.Parameter> parseParameters(String terminator, boolean annotated) {
		ArrayList<Decl.Parameter> parameters = new ArrayList<>();
		while (!lookahead().is(terminator)) {
			Token start = lookahead();
			boolean starred = tryMatch("*");
			String var = matchIdentifier().text;
			Expr annotation = null;
			if (annotated && tryMatch(":")) {
				annotation = parseExpression();
			}
			parameters.add(PARAMETER(var, annotation, starred, position(start)));
			if (!tryMatch(",")) {
				break;
			}
		}
		return parameters;
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public Expr parseExpression() {
		if (lookahead().is("lambda")) {
			return parseLambda();
		}
		return parseOr();
	}

	private Expr parseLambda() {
		Token start = match("lambda");
		List<Decl.Parameter> parameters = parseParameters(":", false);
		match(":");
		Expr body = parseExpression();
		return LAMBDA(parameters, body, position(start));
	}

	private Expr parseOr() {
		return parseBoolOp(Operator.OR);
	}

	private Expr parseAnd() {
		return parseBoolOp(Operator.AND);
	}

	private Expr parseBoolOp(Operator op) {
		Token start = lookahead();
		Expr lhs = op == Operator.OR ? parseAnd() : parseNot();
		if (!lookahead().is(op.getSymbol())) {
			return lhs;
		}
		ArrayList<Expr> operands = new ArrayList<>();
		operands.add(lhs);
		while (tryMatch(op.getSymbol())) {
			operands.add(op == Operator.OR ? parseAnd() : parseNot());
		}
		return BOOLOP(op, operands, position(start));
	}

	private Expr parseNot() {
		Token start = lookahead();
		if (tryMatch("not")) {
			return UNARYOP(Operator.NOT, parseNot(), position(start));
		}
		return parseComparison();
	}

	private Expr parseComparison() {
		Token start = lookahead();
		Expr lhs = parseArithmetic();
		ArrayList<Operator> operators = new ArrayList<>();
		ArrayList<Expr> comparators = new ArrayList<>();
		Operator op;
		while ((op = parseComparisonOperator()) != null) {
			operators.add(op);
			comparators.add(parseArithmetic());
		}
		if (operators.isEmpty()) {
			return lhs;
		}
		return COMPARE(lhs, operators, comparators, position(start));
	}

	private Operator parseComparisonOperator() {
		Token t = lookahead();
		if (t.kind != Token.Kind.OPERATOR && t.kind != Token.Kind.IDENTIFIER) {
			return null;
		} else if (t.is("not") && tokens.get(index + 1).is("in")) {
			index = index + 2;
			return Operator.NOTIN;
		} else if (t.is("is") && tokens.get(index + 1).is("not")) {
			index = index + 2;
			return Operator.ISNOT;
		}
		for (Operator op : Operator.values()) {
			if (op.getKind() == Operator.Kind.COMPARISON && t.text.equals(op.getSymbol())) {
				index = index + 1;
				return op;
			}
		}
		return null;
	}

	private Expr parseArithmetic() {
		Token start = lookahead();
		Expr lhs = parseTerm();
		while (true) {
			if (tryMatch("+")) {
				lhs = BINOP(Operator.ADD, lhs, parseTerm(), position(start));
			} else if (tryMatch("-")) {
				lhs = BINOP(Operator.SUB, lhs, parseTerm(), position(start));
			} else {
				return lhs;
			}
		}
	}

	private Expr parseTerm() {
		Token start = lookahead();
		Expr lhs = parseFactor();
		while (true) {
			Operator op;
			if (tryMatch("*")) {
				op = Operator.MULT;
			} else if (tryMatch("//")) {
				op = Operator.FLOORDIV;
			} else if (tryMatch("/")) {
				op = Operator.DIV;
			} else if (tryMatch("%")) {
				op = Operator.MOD;
			} else {
				return lhs;
			}
			lhs = BINOP(op, lhs, parseFactor(), position(start));
		}
	}

	private Expr parseFactor() {
		Token start = lookahead();
		if (tryMatch("-")) {
			return UNARYOP(Operator.USUB, parseFactor(), position(start));
		} else if (tryMatch("+")) {
			return UNARYOP(Operator.UADD, parseFactor(), position(start));
		}
		return parsePower();
	}

	private Expr parsePower() {
		Token start = lookahead();
		Expr lhs = parsePrimary();
		if (tryMatch("**")) {
			return BINOP(Operator.POW, lhs, parseFactor(), position(start));
		}
		return lhs;
	}

	private Expr parsePrimary() {
		Token start = lookahead();
		Expr e = parseAtom();
		while (true) {
			if (tryMatch("(")) {
				List<Expr> arguments = parseItems(")");
				match(")");
				e = CALL(e, arguments, position(start));
			} else if (tryMatch("[")) {
				Slice slice = parseSlices();
				match("]");
				e = SUBSCRIPT(e, slice, position(start));
			} else {
				return e;
			}
		}
	}

	private Expr parseAtom() {
		Token t = lookahead();
		if (t.kind == Token.Kind.NUMBER) {
			index = index + 1;
			return NUMBER(new BigInteger(t.text), position(t));
		} else if (t.is("True")) {
			index = index + 1;
			return TRUE(position(t));
		} else if (t.is("False")) {
			index = index + 1;
			return FALSE(position(t));
		} else if (t.is("None")) {
			index = index + 1;
			return NONE(position(t));
		} else if (t.is("(")) {
			index = index + 1;
			if (tryMatch(")")) {
				return TUPLE(new ArrayList<>(), position(t));
			}
			Expr first = parseItem();
			if (tryMatch(")")) {
				if (first instanceof Expr.Starred) {
					throw syntaxError(t, "starred expression must be part of a tuple");
				}
				return first;
			}
			match(",");
			ArrayList<Expr> items = new ArrayList<>();
			items.add(first);
			items.addAll(parseItems(")"));
			match(")");
			return TUPLE(items, position(t));
		} else if (t.kind == Token.Kind.IDENTIFIER && !KEYWORDS.contains(t.text)) {
			index = index + 1;
			return NAME(t.text, position(t));
		}
		throw syntaxError(t, "unexpected " + t);
	}

	/**
	 * Parse a comma-separated (possibly empty) list of items, each of which may
	 * be starred.
	 */
	private List<Expr> parseItems(String terminator) {
		ArrayList<Expr> items = new ArrayList<>();
		while (!lookahead().is(terminator)) {
			items.add(parseItem());
			if (!tryMatch(",")) {
				break;
			}
		}
		return items;
	}

	private Expr parseItem() {
		Token start = lookahead();
		if (tryMatch("*")) {
			return STARRED(parseArithmetic(), position(start));
		}
		return parseExpression();
	}

	private Slice parseSlices() {
		Token start = lookahead();
		ArrayList<Slice> dimensions = new ArrayList<>();
		dimensions.add(parseSlice());
		while (tryMatch(",")) {
			dimensions.add(parseSlice());
		}
		if (dimensions.size() == 1) {
			return dimensions.get(0);
		}
		boolean ranged = false;
		ArrayList<Expr> indices = new ArrayList<>();
		for (Slice s : dimensions) {
			if (s instanceof Slice.Index) {
				indices.add(((Slice.Index) s).getIndex());
			} else {
				ranged = true;
			}
		}
		// a plain multi-index is a tuple index
		if (!ranged) {
			return INDEX(TUPLE(indices, position(start)), position(start));
		}
		return EXTENDED(dimensions, position(start));
	}

	private Slice parseSlice() {
		Token start = lookahead();
		Expr lower = null;
		if (!lookahead().is(":")) {
			lower = parseExpression();
			if (!lookahead().is(":")) {
				return INDEX(lower, position(start));
			}
		}
		match(":");
		Expr upper = null;
		Expr step = null;
		if (!endOfSlice() && !lookahead().is(":")) {
			upper = parseExpression();
		}
		if (tryMatch(":") && !endOfSlice()) {
			step = parseExpression();
		}
		return RANGE(lower, upper, step, position(start));
	}

	private boolean endOfSlice() {
		return lookahead().is("]") || lookahead().is(",");
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private Token lookahead() {
		return tokens.get(index);
	}

	private void skipNewlines() {
		while (lookahead().kind == Token.Kind.NEWLINE) {
			index = index + 1;
		}
	}

	private boolean tryMatch(String text) {
		if (lookahead().is(text)) {
			index = index + 1;
			return true;
		}
		return false;
	}

	private Token match(String text) {
		Token t = lookahead();
		if (!t.is(text)) {
			throw syntaxError(t, "expected '" + text + "', found " + t);
		}
		index = index + 1;
		return t;
	}

	private Token match(Token.Kind kind) {
		Token t = lookahead();
		if (t.kind != kind) {
			throw syntaxError(t, "expected " + kind.name().toLowerCase() + ", found " + t);
		}
		index = index + 1;
		return t;
	}

	private Token matchIdentifier() {
		Token t = lookahead();
		if (t.kind != Token.Kind.IDENTIFIER || KEYWORDS.contains(t.text)) {
			throw syntaxError(t, "expected identifier, found " + t);
		}
		index = index + 1;
		return t;
	}

	private static Attribute position(Token t) {
		return POSITION(t.line, t.column);
	}

	private SyntaxError syntaxError(Token t, String message) {
		return new SyntaxError(name + ":" + t.line + ":" + t.column + ": " + message);
	}
}
