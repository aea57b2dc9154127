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
package puresmt.prover;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The outcome of a proof attempt.
 *
 * @author The PureSMT Project Developers
 */
public class ProofResult {
	public enum Status {
		/**
		 * The conclusion follows from the axioms.
		 */
		PROVEN,
		/**
		 * A counterexample to the conclusion exists.
		 */
		REFUTED,
		/**
		 * The solver could not decide, gave up or was cancelled.
		 */
		UNKNOWN
	}

	/**
	 * Records whether a single tracked axiom was needed for the proof.
	 */
	public static class Entry {
		private final String source;
		private final boolean used;

		public Entry(String source, boolean used) {
			this.source = source;
			this.used = used;
		}

		public String getSource() {
			return source;
		}

		public boolean isUsed() {
			return used;
		}

		@Override
		public String toString() {
			return (used ? "+ " : "- ") + source;
		}
	}

	private final Status status;
	private final Set<String> core;
	private final String model;
	private final String reason;
	private final List<Entry> report;

	private ProofResult(Status status, Set<String> core, String model, String reason, List<Entry> report) {
		this.status = status;
		this.core = Collections.unmodifiableSet(core);
		this.model = model;
		this.reason = reason;
		this.report = Collections.unmodifiableList(report);
	}

	public static ProofResult proven(Set<String> core, List<Entry> report) {
		return new ProofResult(Status.PROVEN, core, null, null, report);
	}

	public static ProofResult refuted(String model, List<Entry> report) {
		return new ProofResult(Status.REFUTED, Collections.emptySet(), model, null, report);
	}

	public static ProofResult unknown(String reason, List<Entry> report) {
		return new ProofResult(Status.UNKNOWN, Collections.emptySet(), null, reason, report);
	}

	public Status getStatus() {
		return status;
	}

	public boolean isProven() {
		return status == Status.PROVEN;
	}

	/**
	 * Get the labels of the tracked formulas in the unsat core of a proof. This
	 * is empty for other outcomes, and for proofs made without tracking.
	 *
	 * @return
	 */
	public Set<String> getCore() {
		return core;
	}

	/**
	 * Get the counterexample of a refutation, or <code>null</code>.
	 *
	 * @return
	 */
	public String getModel() {
		return model;
	}

	public String getReason() {
		return reason;
	}

	public List<Entry> getReport() {
		return report;
	}

	@Override
	public String toString() {
		switch (status) {
		case PROVEN:
			return "proven " + core;
		case REFUTED:
			return "refuted";
		default:
			return "unknown (" + reason + ")";
		}
	}
}
