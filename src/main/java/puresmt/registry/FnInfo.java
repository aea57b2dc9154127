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

import static puresmt.core.PureFile.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import puresmt.core.DefinitionError;
import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Expr;

/**
 * Everything known about one function name within a module: its definition
 * (if any), the assertions attached to it and the definitional assertion
 * derived from its annotations. The global assertions of a module are held by
 * the function with the empty name.
 *
 * @author The PureSMT Project Developers
 */
public class FnInfo {
	public static final String DEFINITIONAL_PREFIX = "_assertdef_";

	private final String name;
	private final ModuleInfo module;
	private final List<Decl.FunctionDef> assertions = new ArrayList<>();
	private Decl.FunctionDef definition;
	private Decl.FunctionDef definitionalAssertion;

	FnInfo(String name, ModuleInfo module) {
		this.name = name;
		this.module = module;
	}

	public String getName() {
		return name;
	}

	public ModuleInfo getModule() {
		return module;
	}

	/**
	 * Get the definition of this function, or <code>null</code> if it is only
	 * asserted about (or holds global assertions).
	 *
	 * @return
	 */
	public Decl.FunctionDef getDefinition() {
		return definition;
	}

	public List<Decl.FunctionDef> getAssertions() {
		return Collections.unmodifiableList(assertions);
	}

	/**
	 * Get the assertion derived from the parameter and return annotations of the
	 * definition, or <code>null</code> if it has none.
	 *
	 * @return
	 */
	public Decl.FunctionDef getDefinitionalAssertion() {
		return definitionalAssertion;
	}

	void addAssertion(Decl.FunctionDef assertion) {
		assertions.add(assertion);
	}

	void setDefinition(Decl.FunctionDef definition) {
		if (this.definition != null) {
			throw new DefinitionError("multiply defined function: " + name, definition);
		}
		this.definition = definition;
		this.definitionalAssertion = toDefinitionalAssertion(definition);
	}

	/**
	 * Given <code>def f(x: p, y) -> q: ...</code>, construct the assertion
	 * <code>def _assertdef_f(x: p, y): return q(f(x, y))</code>. Without a
	 * return annotation the predicate is <code>isdefined</code>. A definition
	 * without annotations yields <code>null</code>.
	 *
	 * @param fn
	 * @return
	 */
	static Decl.FunctionDef toDefinitionalAssertion(Decl.FunctionDef fn) {
		boolean preconditions = false;
		ArrayList<Expr> arguments = new ArrayList<>();
		for (Decl.Parameter p : fn.getParameters()) {
			preconditions |= p.getAnnotation() != null;
			Expr.Name ref = NAME(p.getName(), p.getAttributes());
			arguments.add(p.isStarred() ? STARRED(ref, p.getAttributes()) : ref);
		}
		if (!preconditions && fn.getReturns() == null) {
			return null;
		}
		Expr predicate = fn.getReturns() != null ? fn.getReturns() : NAME("isdefined", fn.getAttributes());
		Expr call = CALL(NAME(fn.getName(), fn.getAttributes()), arguments, fn.getAttributes());
		Expr body = CALL(predicate, Collections.singletonList(call), fn.getAttributes());
		return FUNCTION(DEFINITIONAL_PREFIX + fn.getName(), fn.getParameters(), null, body, fn.getAttributes());
	}

	@Override
	public String toString() {
		return name.isEmpty() ? "<global>" : name;
	}
}
