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

import puresmt.core.DefinitionError;
import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Expr;
import puresmt.registry.DefinitionRegistry;

/**
 * Resolves name references to the declarations they denote. A name which does
 * not begin with an underscore is first looked up as a shadowed built-in
 * (<code>f</code> as <code>_builtin_f</code>) and then as a core pure
 * definition, both taken from the prelude only. A name beginning with
 * <code>_z_</code> denotes an intrinsic. Everything else is looked up in the
 * enclosing lexical scopes and, failing that, among the definitions of the
 * remaining registered modules.
 *
 * @author The PureSMT Project Developers
 */
public class ScopeResolver {
	public static final String BUILTIN_PREFIX = "_builtin_";

	private final DefinitionRegistry registry;

	public ScopeResolver(DefinitionRegistry registry) {
		this.registry = registry;
	}

	public DefinitionRegistry getRegistry() {
		return registry;
	}

	public Resolution resolve(Expr.Name name, Scope scope) {
		String id = name.get();
		if (!id.startsWith("_")) {
			Decl.FunctionDef builtin = registry.getCoreDefinition(BUILTIN_PREFIX + id);
			if (builtin != null) {
				return Resolution.builtin(builtin, name);
			}
			Decl.FunctionDef definition = registry.getCoreDefinition(id);
			if (definition != null) {
				return Resolution.definition(definition, name);
			}
		} else if (id.startsWith(Intrinsic.PREFIX)) {
			if (id.length() > Intrinsic.PREFIX.length()
					&& Character.isUpperCase(id.charAt(Intrinsic.PREFIX.length()))) {
				throw new DefinitionError("Invalid intrinsic: \"" + id + "\"", name);
			}
			Intrinsic intrinsic = Intrinsic.fromReference(id);
			if (intrinsic == null) {
				throw new DefinitionError("Unknown intrinsic: \"" + id + "\"", name);
			}
			return Resolution.intrinsic(intrinsic, name);
		}
		PureFile.Decl declaration = scope.lookup(id);
		if (declaration != null) {
			return Resolution.definition(declaration, name);
		}
		// definitions from the other modules come last
		Decl.FunctionDef definition = registry.getDefinition(id);
		if (definition != null) {
			return Resolution.definition(definition, name);
		}
		return Resolution.unresolved(name);
	}
}
