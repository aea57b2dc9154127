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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;

/**
 * A lexical scope mapping names to the declarations which introduce them.
 * Scopes are immutable; entering the parameters of a function or lambda
 * produces a new child scope, leaving the enclosing one untouched.
 *
 * @author The PureSMT Project Developers
 */
public class Scope {
	public static final Scope EMPTY = new Scope(null, Collections.emptyMap());

	private final Scope parent;
	private final Map<String, PureFile.Decl> bindings;

	private Scope(Scope parent, Map<String, PureFile.Decl> bindings) {
		this.parent = parent;
		this.bindings = bindings;
	}

	/**
	 * Construct the top-level scope of a module, which binds the name of every
	 * top-level definition.
	 *
	 * @param module
	 * @return
	 */
	public static Scope of(PureFile module) {
		LinkedHashMap<String, PureFile.Decl> bindings = new LinkedHashMap<>();
		for (Decl.FunctionDef d : module.getDeclarations()) {
			// the first definition of a name wins
			bindings.putIfAbsent(d.getName(), d);
		}
		return new Scope(null, Collections.unmodifiableMap(bindings));
	}

	public Scope enter(List<Decl.Parameter> parameters) {
		LinkedHashMap<String, PureFile.Decl> bindings = new LinkedHashMap<>();
		for (Decl.Parameter p : parameters) {
			bindings.put(p.getName(), p);
		}
		return new Scope(this, Collections.unmodifiableMap(bindings));
	}

	/**
	 * Find the innermost declaration of a given name, or <code>null</code> if
	 * none is visible.
	 *
	 * @param name
	 * @return
	 */
	public PureFile.Decl lookup(String name) {
		for (Scope s = this; s != null; s = s.parent) {
			PureFile.Decl d = s.bindings.get(name);
			if (d != null) {
				return d;
			}
		}
		return null;
	}
}
