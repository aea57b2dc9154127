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

/**
 * The primitives of the logic which may be referenced directly from source
 * text. A reference <code>_z_isint</code> denotes {@link #ISINT}, and so on:
 * the remainder after the prefix must begin with a lower-case letter.
 * Intrinsics are not values; with the exception of {@link #N} they must be
 * applied immediately.
 *
 * @author The PureSMT Project Developers
 */
public enum Intrinsic {
	WRAPBOOL(1),
	WRAPINT(1),
	WRAPFUNC(1),
	BOOL(1),
	INT(1),
	FUNC(1),
	ISBOOL(1),
	ISINT(1),
	ISFUNC(1),
	ISTUPLE(1),
	ISNONE(1),
	ISDEFINED(1),
	EQ(2),
	NEQ(2),
	DISTINCT(-1),
	T(1),
	F(1),
	N(0),
	IMPLIES(2),
	AND(-1),
	OR(-1),
	NOT(1),
	LT(2),
	LTE(2),
	GT(2),
	GTE(2),
	ADD(2),
	SUB(2),
	CONCAT(2),
	FORALL(1),
	THEREEXISTS(1);

	public static final String PREFIX = "_z_";

	/**
	 * Number of arguments required, or <code>-1</code> for any non-zero number.
	 */
	private final int arity;

	private Intrinsic(int arity) {
		this.arity = arity;
	}

	public int getArity() {
		return arity;
	}

	public boolean isQuantifier() {
		return this == FORALL || this == THEREEXISTS;
	}

	/**
	 * Determine the intrinsic named by a reference of the form
	 * <code>_z_name</code>, or return <code>null</code> if there is none.
	 *
	 * @param reference
	 * @return
	 */
	public static Intrinsic fromReference(String reference) {
		String suffix = reference.substring(PREFIX.length());
		if (suffix.isEmpty() || Character.isUpperCase(suffix.charAt(0))) {
			return null;
		}
		for (Intrinsic i : values()) {
			if (i.name().equalsIgnoreCase(suffix)) {
				return i;
			}
		}
		return null;
	}

	/**
	 * Get the name by which this intrinsic is referenced in source text.
	 *
	 * @return
	 */
	public String getReference() {
		return PREFIX + name().toLowerCase();
	}
}
