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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import puresmt.core.DefinitionError;
import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.logic.Scope;

/**
 * The functions of a single module. A definition named
 * <code>_assert_f</code> is an assertion about <code>f</code>, and one named
 * just <code>_assert_</code> is a global assertion which always holds; every
 * other definition is the primary definition of its own name.
 *
 * @author The PureSMT Project Developers
 */
public class ModuleInfo {
	public static final String ASSERTION_PREFIX = "_assert_";

	private final PureFile module;
	private final Scope scope;
	private final Map<String, FnInfo> functions = new LinkedHashMap<>();

	/**
	 * Construct the function table for a module. An assertion must be about a
	 * function defined in this module, or one accepted by <code>external</code>.
	 *
	 * @param module
	 * @param external
	 */
	public ModuleInfo(PureFile module, Predicate<String> external) {
		this.module = module;
		this.scope = Scope.of(module);
		functions.put("", new FnInfo("", this));
		ArrayList<Decl.FunctionDef> assertions = new ArrayList<>();
		for (Decl.FunctionDef d : module.getDeclarations()) {
			if (d.getName().startsWith(ASSERTION_PREFIX)) {
				assertions.add(d);
			} else {
				fn(d.getName()).setDefinition(d);
			}
		}
		for (Decl.FunctionDef d : assertions) {
			String name = d.getName().substring(ASSERTION_PREFIX.length());
			if (!functions.containsKey(name) && !external.test(name)) {
				throw new DefinitionError("unknown function: " + name, d);
			}
			fn(name).addAssertion(d);
		}
	}

	public PureFile getModule() {
		return module;
	}

	public String getName() {
		return module.getName();
	}

	/**
	 * Get the scope binding the top-level names of this module.
	 *
	 * @return
	 */
	public Scope getScope() {
		return scope;
	}

	/**
	 * Get the information for a given function name.
	 *
	 * @param name
	 * @return
	 * @throws DefinitionError if this module has no such function
	 */
	public FnInfo getFn(String name) {
		FnInfo info = functions.get(name);
		if (info == null) {
			throw new DefinitionError("unknown function: " + name);
		}
		return info;
	}

	public boolean contains(String name) {
		return functions.containsKey(name);
	}

	public List<FnInfo> getFunctions() {
		return Collections.unmodifiableList(new ArrayList<>(functions.values()));
	}

	private FnInfo fn(String name) {
		FnInfo info = functions.get(name);
		if (info == null) {
			info = new FnInfo(name, this);
			functions.put(name, info);
		}
		return info;
	}
}
