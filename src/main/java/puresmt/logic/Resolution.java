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

import puresmt.core.PureFile;
import puresmt.core.PureFile.Expr;

/**
 * The outcome of resolving a name reference.
 *
 * @author The PureSMT Project Developers
 */
public final class Resolution {
	public enum Kind {
		/**
		 * A pure definition shadowing a host built-in (e.g. <code>len</code>
		 * resolving to <code>_builtin_len</code>).
		 */
		BUILTIN,
		/**
		 * A pure function definition or a parameter in an enclosing scope.
		 */
		DEFINITION,
		INTRINSIC,
		UNRESOLVED
	}

	private final Kind kind;
	private final PureFile.Decl declaration;
	private final Intrinsic intrinsic;
	private final Expr.Name reference;

	private Resolution(Kind kind, PureFile.Decl declaration, Intrinsic intrinsic, Expr.Name reference) {
		this.kind = kind;
		this.declaration = declaration;
		this.intrinsic = intrinsic;
		this.reference = reference;
	}

	public static Resolution builtin(PureFile.Decl declaration, Expr.Name reference) {
		return new Resolution(Kind.BUILTIN, declaration, null, reference);
	}

	public static Resolution definition(PureFile.Decl declaration, Expr.Name reference) {
		return new Resolution(Kind.DEFINITION, declaration, null, reference);
	}

	public static Resolution intrinsic(Intrinsic intrinsic, Expr.Name reference) {
		return new Resolution(Kind.INTRINSIC, null, intrinsic, reference);
	}

	public static Resolution unresolved(Expr.Name reference) {
		return new Resolution(Kind.UNRESOLVED, null, null, reference);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Get the declaration referred to, or <code>null</code> for an intrinsic or
	 * unresolved reference.
	 *
	 * @return
	 */
	public PureFile.Decl getDeclaration() {
		return declaration;
	}

	public Intrinsic getIntrinsic() {
		return intrinsic;
	}

	public Expr.Name getReference() {
		return reference;
	}

	@Override
	public String toString() {
		switch (kind) {
		case INTRINSIC:
			return "INTRINSIC(" + intrinsic + ")";
		case UNRESOLVED:
			return "UNRESOLVED(" + reference.get() + ")";
		default:
			return kind + "(" + reference.get() + ")";
		}
	}
}
