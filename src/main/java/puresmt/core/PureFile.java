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
package puresmt.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import puresmt.io.PureFilePrinter;

/**
 * A module of pure function definitions. Every node of the syntax tree is
 * immutable; passes which rewrite a tree construct fresh nodes rather than
 * updating existing ones.
 *
 * @author The PureSMT Project Developers
 */
public class PureFile {
	/**
	 * The name of this module, used when reporting errors.
	 */
	private final String name;
	/**
	 * The list of top-level definitions within this module.
	 */
	private final List<Decl.FunctionDef> declarations;

	public PureFile(String name, Collection<Decl.FunctionDef> declarations) {
		this.name = name;
		this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
	}

	public String getName() {
		return name;
	}

	public List<Decl.FunctionDef> getDeclarations() {
		return declarations;
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		@Override
		public String toString() {
			return PureFilePrinter.toString(this);
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		/**
		 * A function definition of the form <code>def f(x: p, y) -> q: return e</code>.
		 * Parameter annotations and the return annotation are predicates, not
		 * types. Decorators are retained as expressions since they carry prover
		 * hints (weights and trigger patterns).
		 */
		public static class FunctionDef extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Expr returns;
			private final Expr body;
			private final List<Expr> decorators;
			private final String source;

			private FunctionDef(String name, Collection<Parameter> parameters, Expr returns, Expr body,
					Collection<Expr> decorators, String source, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
				this.returns = returns;
				this.body = body;
				this.decorators = Collections.unmodifiableList(new ArrayList<>(decorators));
				this.source = source;
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			/**
			 * Get the return annotation of this function, or <code>null</code> if
			 * there is none.
			 *
			 * @return
			 */
			public Expr getReturns() {
				return returns;
			}

			public Expr getBody() {
				return body;
			}

			public List<Expr> getDecorators() {
				return decorators;
			}

			/**
			 * Get the source text from which this definition was parsed, or
			 * <code>null</code> if it was constructed programmatically.
			 *
			 * @return
			 */
			public String getSource() {
				return source;
			}
		}

		/**
		 * A formal parameter of a function definition or lambda. A starred
		 * parameter collects any remaining arguments.
		 */
		public static class Parameter extends AbstractItem implements Decl {
			private final String name;
			private final Expr annotation;
			private final boolean starred;

			private Parameter(String name, Expr annotation, boolean starred, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.annotation = annotation;
				this.starred = starred;
			}

			public String getName() {
				return name;
			}

			public Expr getAnnotation() {
				return annotation;
			}

			public boolean isStarred() {
				return starred;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	/**
	 * The operators of the expression language. Each operator is given meaning
	 * by a pure definition named <code>_op_</code> followed by its suffix (e.g.
	 * <code>_op_Add</code>).
	 */
	public enum Operator {
		ADD(Kind.BINARY, "+", "Add"),
		SUB(Kind.BINARY, "-", "Sub"),
		MULT(Kind.BINARY, "*", "Mult"),
		DIV(Kind.BINARY, "/", "Div"),
		FLOORDIV(Kind.BINARY, "//", "FloorDiv"),
		MOD(Kind.BINARY, "%", "Mod"),
		POW(Kind.BINARY, "**", "Pow"),
		USUB(Kind.UNARY, "-", "USub"),
		UADD(Kind.UNARY, "+", "UAdd"),
		NOT(Kind.UNARY, "not", "Not"),
		AND(Kind.BOOLEAN, "and", "And"),
		OR(Kind.BOOLEAN, "or", "Or"),
		EQ(Kind.COMPARISON, "==", "Eq"),
		NOTEQ(Kind.COMPARISON, "!=", "NotEq"),
		LT(Kind.COMPARISON, "<", "Lt"),
		LTE(Kind.COMPARISON, "<=", "LtE"),
		GT(Kind.COMPARISON, ">", "Gt"),
		GTE(Kind.COMPARISON, ">=", "GtE"),
		IN(Kind.COMPARISON, "in", "In"),
		NOTIN(Kind.COMPARISON, "not in", "NotIn"),
		IS(Kind.COMPARISON, "is", "Is"),
		ISNOT(Kind.COMPARISON, "is not", "IsNot"),
		GET(Kind.SUBSCRIPT, "[]", "Get"),
		SUBLIST(Kind.SUBSCRIPT, "[:]", "SubList"),
		STEPPEDSUBLIST(Kind.SUBSCRIPT, "[::]", "SteppedSubList");

		public enum Kind {
			BINARY, UNARY, BOOLEAN, COMPARISON, SUBSCRIPT
		}

		private final Kind kind;
		private final String symbol;
		private final String suffix;

		private Operator(Kind kind, String symbol, String suffix) {
			this.kind = kind;
			this.symbol = symbol;
			this.suffix = suffix;
		}

		public Kind getKind() {
			return kind;
		}

		public String getSymbol() {
			return symbol;
		}

		/**
		 * Get the name of the pure definition which gives this operator meaning.
		 *
		 * @return
		 */
		public String getDefinitionName() {
			return "_op_" + suffix;
		}
	}

	public interface Expr extends Item {

		public static class Name extends AbstractItem implements Expr {
			private final String name;

			private Name(String name, Attribute[] attributes) {
				super(attributes);
				this.name = name;
			}

			public String get() {
				return name;
			}
		}

		public static class Number extends AbstractItem implements Expr {
			private final BigInteger value;

			private Number(BigInteger value, Attribute[] attributes) {
				super(attributes);
				this.value = value;
			}

			public BigInteger getValue() {
				return value;
			}
		}

		/**
		 * One of the named constants <code>True</code>, <code>False</code> or
		 * <code>None</code>.
		 */
		public static class Constant extends AbstractItem implements Expr {
			public enum Kind {
				TRUE("True"), FALSE("False"), NONE("None");

				private final String text;

				private Kind(String text) {
					this.text = text;
				}

				public String getText() {
					return text;
				}
			}

			private final Kind kind;

			private Constant(Kind kind, Attribute[] attributes) {
				super(attributes);
				this.kind = kind;
			}

			public Kind getKind() {
				return kind;
			}
		}

		public static class Call extends AbstractItem implements Expr {
			private final Expr callee;
			private final List<Expr> arguments;

			private Call(Expr callee, Collection<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.callee = callee;
				this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
			}

			public Expr getCallee() {
				return callee;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		public static class BinOp extends AbstractItem implements Expr {
			private final Operator operator;
			private final Expr lhs;
			private final Expr rhs;

			private BinOp(Operator operator, Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				if (operator.getKind() != Operator.Kind.BINARY) {
					throw new IllegalArgumentException("invalid binary operator " + operator);
				}
				this.operator = operator;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Operator getOperator() {
				return operator;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class UnaryOp extends AbstractItem implements Expr {
			private final Operator operator;
			private final Expr operand;

			private UnaryOp(Operator operator, Expr operand, Attribute[] attributes) {
				super(attributes);
				if (operator.getKind() != Operator.Kind.UNARY) {
					throw new IllegalArgumentException("invalid unary operator " + operator);
				}
				this.operator = operator;
				this.operand = operand;
			}

			public Operator getOperator() {
				return operator;
			}

			public Expr getOperand() {
				return operand;
			}
		}

		public static class BoolOp extends AbstractItem implements Expr {
			private final Operator operator;
			private final List<Expr> operands;

			private BoolOp(Operator operator, Collection<Expr> operands, Attribute[] attributes) {
				super(attributes);
				if (operator.getKind() != Operator.Kind.BOOLEAN) {
					throw new IllegalArgumentException("invalid boolean operator " + operator);
				} else if (operands.size() < 2) {
					throw new IllegalArgumentException("boolean operator requires at least two operands");
				}
				this.operator = operator;
				this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
			}

			public Operator getOperator() {
				return operator;
			}

			public List<Expr> getOperands() {
				return operands;
			}
		}

		/**
		 * A comparison chain <code>a op1 b op2 c ...</code>, where there is
		 * exactly one comparator for each operator.
		 */
		public static class Compare extends AbstractItem implements Expr {
			private final Expr lhs;
			private final List<Operator> operators;
			private final List<Expr> comparators;

			private Compare(Expr lhs, Collection<Operator> operators, Collection<Expr> comparators,
					Attribute[] attributes) {
				super(attributes);
				if (operators.isEmpty() || operators.size() != comparators.size()) {
					throw new IllegalArgumentException("invalid comparison chain");
				}
				for (Operator op : operators) {
					if (op.getKind() != Operator.Kind.COMPARISON) {
						throw new IllegalArgumentException("invalid comparison operator " + op);
					}
				}
				this.lhs = lhs;
				this.operators = Collections.unmodifiableList(new ArrayList<>(operators));
				this.comparators = Collections.unmodifiableList(new ArrayList<>(comparators));
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public List<Operator> getOperators() {
				return operators;
			}

			public List<Expr> getComparators() {
				return comparators;
			}
		}

		public static class Subscript extends AbstractItem implements Expr {
			private final Expr source;
			private final Slice slice;

			private Subscript(Expr source, Slice slice, Attribute[] attributes) {
				super(attributes);
				this.source = source;
				this.slice = slice;
			}

			public Expr getSource() {
				return source;
			}

			public Slice getSlice() {
				return slice;
			}
		}

		public static class Tuple extends AbstractItem implements Expr {
			private final List<Expr> items;

			private Tuple(Collection<Expr> items, Attribute[] attributes) {
				super(attributes);
				this.items = Collections.unmodifiableList(new ArrayList<>(items));
			}

			public List<Expr> getItems() {
				return items;
			}
		}

		/**
		 * A splatted operand, such as <code>*xs</code> in <code>f(1, *xs)</code>.
		 */
		public static class Starred extends AbstractItem implements Expr {
			private final Expr operand;

			private Starred(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr getOperand() {
				return operand;
			}
		}

		public static class Lambda extends AbstractItem implements Expr {
			private final List<Decl.Parameter> parameters;
			private final Expr body;

			private Lambda(Collection<Decl.Parameter> parameters, Expr body, Attribute[] attributes) {
				super(attributes);
				this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
				this.body = body;
			}

			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			public Expr getBody() {
				return body;
			}
		}
	}

	// =========================================================================
	// Slices
	// =========================================================================

	public interface Slice extends Item {

		public static class Index extends AbstractItem implements Slice {
			private final Expr index;

			private Index(Expr index, Attribute[] attributes) {
				super(attributes);
				this.index = index;
			}

			public Expr getIndex() {
				return index;
			}
		}

		/**
		 * A slice <code>lower:upper</code> or <code>lower:upper:step</code>. Any
		 * bound may be <code>null</code>.
		 */
		public static class Range extends AbstractItem implements Slice {
			private final Expr lower;
			private final Expr upper;
			private final Expr step;

			private Range(Expr lower, Expr upper, Expr step, Attribute[] attributes) {
				super(attributes);
				this.lower = lower;
				this.upper = upper;
				this.step = step;
			}

			public Expr getLower() {
				return lower;
			}

			public Expr getUpper() {
				return upper;
			}

			public Expr getStep() {
				return step;
			}
		}

		/**
		 * A multi-dimensional slice such as <code>a:b, c</code>.
		 */
		public static class Extended extends AbstractItem implements Slice {
			private final List<Slice> dimensions;

			private Extended(Collection<Slice> dimensions, Attribute[] attributes) {
				super(attributes);
				this.dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
			}

			public List<Slice> getDimensions() {
				return dimensions;
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	/**
	 * Identifies the position in the source text where an item begins.
	 */
	public static class Position {
		private final int line;
		private final int column;

		public Position(int line, int column) {
			this.line = line;
			this.column = column;
		}

		public int getLine() {
			return line;
		}

		public int getColumn() {
			return column;
		}

		@Override
		public String toString() {
			return "line " + line + ":" + column;
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return (T) o;
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	public static Attribute POSITION(int line, int column) {
		return ATTRIBUTE(new Position(line, column));
	}

	// Declarations

	public static Decl.FunctionDef FUNCTION(String name, List<Decl.Parameter> parameters, Expr returns, Expr body,
			Attribute... attributes) {
		return new Decl.FunctionDef(name, parameters, returns, body, Collections.emptyList(), null, attributes);
	}

	public static Decl.FunctionDef FUNCTION(String name, List<Decl.Parameter> parameters, Expr returns, Expr body,
			List<Expr> decorators, String source, Attribute... attributes) {
		return new Decl.FunctionDef(name, parameters, returns, body, decorators, source, attributes);
	}

	public static Decl.Parameter PARAMETER(String name, Attribute... attributes) {
		return new Decl.Parameter(name, null, false, attributes);
	}

	public static Decl.Parameter PARAMETER(String name, Expr annotation, boolean starred, Attribute... attributes) {
		return new Decl.Parameter(name, annotation, starred, attributes);
	}

	// Expressions

	public static Expr.Name NAME(String name, Attribute... attributes) {
		return new Expr.Name(name, attributes);
	}

	public static Expr.Number NUMBER(long value, Attribute... attributes) {
		return new Expr.Number(BigInteger.valueOf(value), attributes);
	}

	public static Expr.Number NUMBER(BigInteger value, Attribute... attributes) {
		return new Expr.Number(value, attributes);
	}

	public static Expr.Constant CONSTANT(Expr.Constant.Kind kind, Attribute... attributes) {
		return new Expr.Constant(kind, attributes);
	}

	public static Expr.Constant TRUE(Attribute... attributes) {
		return new Expr.Constant(Expr.Constant.Kind.TRUE, attributes);
	}

	public static Expr.Constant FALSE(Attribute... attributes) {
		return new Expr.Constant(Expr.Constant.Kind.FALSE, attributes);
	}

	public static Expr.Constant NONE(Attribute... attributes) {
		return new Expr.Constant(Expr.Constant.Kind.NONE, attributes);
	}

	public static Expr.Call CALL(Expr callee, List<Expr> arguments, Attribute... attributes) {
		return new Expr.Call(callee, arguments, attributes);
	}

	public static Expr.Call CALL(String callee, Expr... arguments) {
		return new Expr.Call(NAME(callee), Arrays.asList(arguments), new Attribute[0]);
	}

	public static Expr.BinOp BINOP(Operator operator, Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.BinOp(operator, lhs, rhs, attributes);
	}

	public static Expr.UnaryOp UNARYOP(Operator operator, Expr operand, Attribute... attributes) {
		return new Expr.UnaryOp(operator, operand, attributes);
	}

	public static Expr.BoolOp BOOLOP(Operator operator, List<Expr> operands, Attribute... attributes) {
		return new Expr.BoolOp(operator, operands, attributes);
	}

	public static Expr.Compare COMPARE(Expr lhs, List<Operator> operators, List<Expr> comparators,
			Attribute... attributes) {
		return new Expr.Compare(lhs, operators, comparators, attributes);
	}

	public static Expr.Compare COMPARE(Expr lhs, Operator operator, Expr rhs, Attribute... attributes) {
		return new Expr.Compare(lhs, Arrays.asList(operator), Arrays.asList(rhs), attributes);
	}

	public static Expr.Subscript SUBSCRIPT(Expr source, Slice slice, Attribute... attributes) {
		return new Expr.Subscript(source, slice, attributes);
	}

	public static Expr.Tuple TUPLE(List<Expr> items, Attribute... attributes) {
		return new Expr.Tuple(items, attributes);
	}

	public static Expr.Starred STARRED(Expr operand, Attribute... attributes) {
		return new Expr.Starred(operand, attributes);
	}

	public static Expr.Lambda LAMBDA(List<Decl.Parameter> parameters, Expr body, Attribute... attributes) {
		return new Expr.Lambda(parameters, body, attributes);
	}

	// Slices

	public static Slice.Index INDEX(Expr index, Attribute... attributes) {
		return new Slice.Index(index, attributes);
	}

	public static Slice.Range RANGE(Expr lower, Expr upper, Expr step, Attribute... attributes) {
		return new Slice.Range(lower, upper, step, attributes);
	}

	public static Slice.Extended EXTENDED(List<Slice> dimensions, Attribute... attributes) {
		return new Slice.Extended(dimensions, attributes);
	}
}
