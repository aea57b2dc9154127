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
package puresmt.logic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Constructor;
import com.microsoft.z3.Context;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;

/**
 * The single sort onto which every value of the expression language is mapped.
 * It is a tagged union with the variants:
 *
 * <pre>
 * none | bool(tobool: Bool) | int(toint: Int) | func(tofunc: Func)
 *      | cons(tl: Value, hd: Value) | empty | undef
 * </pre>
 *
 * Tuples and argument lists are built left-to-right by consing onto
 * <code>empty</code>, so <code>(1, 2)</code> is
 * <code>cons(cons(empty, int(1)), int(2))</code>. Function handles are values
 * of the uninterpreted sort <code>Func</code> and are called through the
 * uninterpreted binary function <code>App</code>. Two further uninterpreted
 * functions, <code>T</code> and <code>F</code>, give the truthiness and
 * falsiness of a value.
 *
 * @author The PureSMT Project Developers
 */
public class LogicSort {
	private final Context context;
	private final DatatypeSort value;
	private final Sort func;

	private final FuncDecl none;
	private final FuncDecl bool;
	private final FuncDecl integer;
	private final FuncDecl function;
	private final FuncDecl cons;
	private final FuncDecl empty;
	private final FuncDecl undef;

	private final FuncDecl toBool;
	private final FuncDecl toInt;
	private final FuncDecl toFunc;

	private final FuncDecl isNone;
	private final FuncDecl isBool;
	private final FuncDecl isInt;
	private final FuncDecl isFunc;
	private final FuncDecl isCons;
	private final FuncDecl isEmpty;
	private final FuncDecl isUndef;

	private final FuncDecl app;
	private final FuncDecl concat;
	private final FuncDecl truthy;
	private final FuncDecl falsy;

	public LogicSort(Context context) {
		this.context = context;
		this.func = context.mkUninterpretedSort("Func");
		Constructor[] constructors = new Constructor[] {
				context.mkConstructor("none", "is_none", null, null, null),
				context.mkConstructor("bool", "is_bool", new String[] { "tobool" },
						new Sort[] { context.getBoolSort() }, null),
				context.mkConstructor("int", "is_int", new String[] { "toint" },
						new Sort[] { context.getIntSort() }, null),
				context.mkConstructor("func", "is_func", new String[] { "tofunc" }, new Sort[] { func }, null),
				// recursive fields refer to the datatype itself (index 0)
				context.mkConstructor("cons", "is_cons", new String[] { "tl", "hd" }, new Sort[] { null, null },
						new int[] { 0, 0 }),
				context.mkConstructor("empty", "is_empty", null, null, null),
				context.mkConstructor("undef", "is_undef", null, null, null) };
		this.value = context.mkDatatypeSort("Value", constructors);
		this.none = constructors[0].ConstructorDecl();
		this.bool = constructors[1].ConstructorDecl();
		this.integer = constructors[2].ConstructorDecl();
		this.function = constructors[3].ConstructorDecl();
		this.cons = constructors[4].ConstructorDecl();
		this.empty = constructors[5].ConstructorDecl();
		this.undef = constructors[6].ConstructorDecl();
		this.toBool = constructors[1].getAccessorDecls()[0];
		this.toInt = constructors[2].getAccessorDecls()[0];
		this.toFunc = constructors[3].getAccessorDecls()[0];
		this.isNone = constructors[0].getTesterDecl();
		this.isBool = constructors[1].getTesterDecl();
		this.isInt = constructors[2].getTesterDecl();
		this.isFunc = constructors[3].getTesterDecl();
		this.isCons = constructors[4].getTesterDecl();
		this.isEmpty = constructors[5].getTesterDecl();
		this.isUndef = constructors[6].getTesterDecl();
		this.app = context.mkFuncDecl("App", new Sort[] { value, value }, value);
		this.concat = context.mkFuncDecl("Concat", new Sort[] { value, value }, value);
		this.truthy = context.mkFuncDecl("T", new Sort[] { value }, context.getBoolSort());
		this.falsy = context.mkFuncDecl("F", new Sort[] { value }, context.getBoolSort());
	}

	public Context getContext() {
		return context;
	}

	public Sort getValueSort() {
		return value;
	}

	public Sort getFuncSort() {
		return func;
	}

	// =========================================================================
	// Constants
	// =========================================================================

	/**
	 * Construct a symbolic constant of the value sort.
	 *
	 * @param name
	 * @return
	 */
	public Expr constant(String name) {
		return context.mkConst(name, value);
	}

	/**
	 * Construct a symbolic function handle.
	 *
	 * @param name
	 * @return
	 */
	public Expr functionConstant(String name) {
		return context.mkConst(name, func);
	}

	// =========================================================================
	// Constructors
	// =========================================================================

	public Expr none() {
		return context.mkApp(none);
	}

	public Expr bool(BoolExpr b) {
		return context.mkApp(bool, b);
	}

	public Expr bool(boolean b) {
		return bool(context.mkBool(b));
	}

	public Expr integer(ArithExpr i) {
		return context.mkApp(integer, i);
	}

	public Expr integer(String literal) {
		return integer(context.mkInt(literal));
	}

	public Expr function(Expr f) {
		return context.mkApp(function, f);
	}

	public Expr cons(Expr tail, Expr head) {
		return context.mkApp(cons, tail, head);
	}

	public Expr empty() {
		return context.mkApp(empty);
	}

	public Expr undef() {
		return context.mkApp(undef);
	}

	/**
	 * Check whether a term is an application of the <code>bool</code>
	 * constructor.
	 *
	 * @param e
	 * @return
	 */
	public boolean isBoolConstructor(Expr e) {
		return e.isApp() && e.getFuncDecl().equals(bool);
	}

	// =========================================================================
	// Accessors and testers
	// =========================================================================

	public BoolExpr toBool(Expr e) {
		return (BoolExpr) context.mkApp(toBool, e);
	}

	public ArithExpr toInt(Expr e) {
		return (ArithExpr) context.mkApp(toInt, e);
	}

	public Expr toFunc(Expr e) {
		return context.mkApp(toFunc, e);
	}

	public BoolExpr isNone(Expr e) {
		return (BoolExpr) context.mkApp(isNone, e);
	}

	public BoolExpr isBool(Expr e) {
		return (BoolExpr) context.mkApp(isBool, e);
	}

	public BoolExpr isInt(Expr e) {
		return (BoolExpr) context.mkApp(isInt, e);
	}

	public BoolExpr isFunc(Expr e) {
		return (BoolExpr) context.mkApp(isFunc, e);
	}

	/**
	 * A value is a tuple when it is either empty or a cons cell.
	 *
	 * @param e
	 * @return
	 */
	public BoolExpr isTuple(Expr e) {
		return context.mkOr((BoolExpr) context.mkApp(isCons, e), (BoolExpr) context.mkApp(isEmpty, e));
	}

	public BoolExpr isDefined(Expr e) {
		return context.mkNot((BoolExpr) context.mkApp(isUndef, e));
	}

	// =========================================================================
	// Uninterpreted functions
	// =========================================================================

	/**
	 * Apply a function value to an argument list.
	 *
	 * @param f
	 * @param arguments
	 * @return
	 */
	public Expr app(Expr f, Expr arguments) {
		return context.mkApp(app, f, arguments);
	}

	public Expr concat(Expr lhs, Expr rhs) {
		return context.mkApp(concat, lhs, rhs);
	}

	/**
	 * The truthiness of a value.
	 *
	 * @param e
	 * @return
	 */
	public BoolExpr truthy(Expr e) {
		return (BoolExpr) context.mkApp(truthy, e);
	}

	public BoolExpr falsy(Expr e) {
		return (BoolExpr) context.mkApp(falsy, e);
	}
}
