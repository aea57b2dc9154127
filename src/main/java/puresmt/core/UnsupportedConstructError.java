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
 * Signals a syntactic construct which falls outside the supported expression
 * subset at the point where it was encountered.
 */
public class UnsupportedConstructError extends PureException {
	private static final long serialVersionUID = 1L;

	public UnsupportedConstructError(String message) {
		super(message);
	}

	public UnsupportedConstructError(String message, PureFile.Item element) {
		super(message, element);
	}
}
