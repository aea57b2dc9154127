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
package puresmt.rewrite;

import java.util.ArrayList;
import java.util.List;

/**
 * A rewrite engine whose own rules take priority over, but otherwise extend,
 * those of another engine. Rules added here are never visible to the inner
 * engine.
 */
public class LayeredRewriteEngine extends RewriteEngine {
	private final RewriteEngine inner;

	public LayeredRewriteEngine(RewriteEngine inner) {
		this.inner = inner;
	}

	@Override
	protected List<RewriteRule> lookup(PatternKey key) {
		List<RewriteRule> local = super.lookup(key);
		List<RewriteRule> below = inner.lookup(key);
		if (local.isEmpty()) {
			return below;
		} else if (below.isEmpty()) {
			return local;
		}
		List<RewriteRule> result = new ArrayList<>(local);
		result.addAll(below);
		return result;
	}
}
