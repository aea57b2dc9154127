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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import puresmt.core.DefinitionError;
import puresmt.core.PureFile;
import puresmt.core.PureFile.Decl;
import puresmt.io.PureFileParser;
import puresmt.logic.Scope;

/**
 * An immutable table of pure definitions drawn from an ordered list of
 * modules. The first module is always the standard prelude. A function name
 * may be defined by at most one module, though assertions about it may appear
 * in any later module.
 *
 * @author The PureSMT Project Developers
 */
public class DefinitionRegistry {
	private static final Logger logger = LoggerFactory.getLogger(DefinitionRegistry.class);

	/**
	 * Classpath location of the standard prelude.
	 */
	public static final String PRELUDE = "/puresmt/prelude.pure";

	private static DefinitionRegistry standard;

	private final List<ModuleInfo> modules;
	/**
	 * Maps every registered definition, assertion and definitional assertion to
	 * its module.
	 */
	private final Map<Decl.FunctionDef, ModuleInfo> owners = new IdentityHashMap<>();

	private DefinitionRegistry(List<PureFile> files) {
		ArrayList<ModuleInfo> infos = new ArrayList<>();
		for (PureFile file : files) {
			List<ModuleInfo> earlier = new ArrayList<>(infos);
			ModuleInfo info = new ModuleInfo(file, name -> definedIn(earlier, name) != null);
			for (FnInfo fn : info.getFunctions()) {
				Decl.FunctionDef d = fn.getDefinition();
				if (d != null && definedIn(earlier, fn.getName()) != null) {
					throw new DefinitionError("multiply defined function: " + fn.getName(), d);
				}
				register(d, info);
				register(fn.getDefinitionalAssertion(), info);
				for (Decl.FunctionDef a : fn.getAssertions()) {
					register(a, info);
				}
			}
			logger.debug("registered module {} ({} functions)", file.getName(), info.getFunctions().size() - 1);
			infos.add(info);
		}
		this.modules = Collections.unmodifiableList(infos);
	}

	/**
	 * Get the registry holding just the standard prelude. This is loaded once
	 * and shared.
	 *
	 * @return
	 */
	public static synchronized DefinitionRegistry standard() {
		if (standard == null) {
			standard = new DefinitionRegistry(Arrays.asList(readPrelude()));
		}
		return standard;
	}

	/**
	 * Construct a registry of the standard prelude followed by the given modules.
	 *
	 * @param modules
	 * @return
	 */
	public static DefinitionRegistry of(PureFile... modules) {
		return standard().extend(modules);
	}

	/**
	 * Construct a new registry with some further modules appended to this one.
	 *
	 * @param files
	 * @return
	 */
	public DefinitionRegistry extend(PureFile... files) {
		ArrayList<PureFile> all = new ArrayList<>();
		for (ModuleInfo m : modules) {
			all.add(m.getModule());
		}
		all.addAll(Arrays.asList(files));
		return new DefinitionRegistry(all);
	}

	public List<ModuleInfo> getModules() {
		return modules;
	}

	/**
	 * Get the function defining a given name, or <code>null</code> if there is
	 * none.
	 *
	 * @param name
	 * @return
	 */
	public Decl.FunctionDef getDefinition(String name) {
		FnInfo info = definedIn(modules, name);
		return info == null ? null : info.getDefinition();
	}

	/**
	 * Get the function defining a given name in the standard prelude, or
	 * <code>null</code> if the prelude does not define it.
	 *
	 * @param name
	 * @return
	 */
	public Decl.FunctionDef getCoreDefinition(String name) {
		FnInfo info = definedIn(modules.subList(0, 1), name);
		return info == null ? null : info.getDefinition();
	}

	/**
	 * Get the function information for a given name.
	 *
	 * @param name
	 * @return
	 * @throws DefinitionError if no module defines it
	 */
	public FnInfo getFn(String name) {
		FnInfo info = definedIn(modules, name);
		if (info == null) {
			throw new DefinitionError("unknown function: " + name);
		}
		return info;
	}

	/**
	 * Get every defined function, in module order.
	 *
	 * @return
	 */
	public List<FnInfo> getFunctions() {
		ArrayList<FnInfo> result = new ArrayList<>();
		for (ModuleInfo m : modules) {
			for (FnInfo fn : m.getFunctions()) {
				if (fn.getDefinition() != null) {
					result.add(fn);
				}
			}
		}
		return result;
	}

	/**
	 * Get every assertion about a given name, across all modules.
	 *
	 * @param name
	 * @return
	 */
	public List<Decl.FunctionDef> getAssertions(String name) {
		ArrayList<Decl.FunctionDef> result = new ArrayList<>();
		for (ModuleInfo m : modules) {
			if (m.contains(name)) {
				result.addAll(m.getFn(name).getAssertions());
			}
		}
		return result;
	}

	/**
	 * Get the global assertions of every module, which are always assumed.
	 *
	 * @return
	 */
	public List<Decl.FunctionDef> getGlobalAssertions() {
		return getAssertions("");
	}

	/**
	 * Get the module scope in which a registered function was declared. An
	 * unregistered function (such as a standalone conclusion) has an empty
	 * enclosing scope.
	 *
	 * @param fn
	 * @return
	 */
	public Scope getScope(Decl.FunctionDef fn) {
		ModuleInfo owner = owners.get(fn);
		return owner == null ? Scope.EMPTY : owner.getScope();
	}

	private void register(Decl.FunctionDef fn, ModuleInfo module) {
		if (fn != null) {
			owners.put(fn, module);
		}
	}

	private static FnInfo definedIn(List<ModuleInfo> modules, String name) {
		for (ModuleInfo m : modules) {
			if (m.contains(name) && m.getFn(name).getDefinition() != null) {
				return m.getFn(name);
			}
		}
		return null;
	}

	private static PureFile readPrelude() {
		try (InputStream in = DefinitionRegistry.class.getResourceAsStream(PRELUDE)) {
			if (in == null) {
				throw new IllegalStateException("missing prelude " + PRELUDE);
			}
			String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
			return new PureFileParser("prelude", text).read();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
