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
 * Signals that a verdict cannot be trusted. Either the axioms alone were
 * contradictory (the conclusion was not needed to refute its negation), or a
 * proof succeeded even though a concrete counterexample is known. This is
 * never downgraded to a warning.
 */
public class SoundnessError extends PureException {
	private static final long serialVersionUID = 1L;

	public SoundnessError(String message) {
		super(message);
	}

	public SoundnessError(String message, PureFile.Item element) {
		super(message, element);
	}
}
