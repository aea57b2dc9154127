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

/**
 * Base class for all errors raised while compiling or proving pure
 * definitions. Where known, the syntactic element responsible for the error is
 * recorded so that its position can be reported.
 *
 * @author The PureSMT Project Developers
 */
public class PureException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	/**
	 * The item which this exception refers to, or <code>null</code>.
	 */
	private final PureFile.Item element;

	public PureException(String message) {
		this(message, null, null);
	}

	public PureException(String message, PureFile.Item element) {
		this(message, element, null);
	}

	public PureException(String message, PureFile.Item element, Throwable cause) {
		super(message, cause);
		this.element = element;
	}

	public PureFile.Item getElement() {
		return element;
	}

	/**
	 * Get the source position of the offending element, or <code>null</code> if
	 * that is unknown.
	 *
	 * @return
	 */
	public PureFile.Position getPosition() {
		return element == null ? null : element.getAttribute(PureFile.Position.class);
	}
}
