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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import puresmt.core.PureFile.Expr;
import puresmt.util.AbstractExpressionTransform;

/**
 * Applies a set of rewrite rules to a tree until no rule applies. Children are
 * rewritten before their parent, and whenever a rule rewrites a node the
 * result is rewritten again from scratch. Rules are tried in the order they
 * were added, and the first one which matches and whose condition holds wins.
 * Termination is the responsibility of whoever supplies the rules.
 *
 * @author The PureSMT Project Developers
 */
public class RewriteEngine extends AbstractExpressionTransform {
	private static final Logger logger = LoggerFactory.getLogger(RewriteEngine.class);

	private final Map<PatternKey, List<RewriteRule>> rules = new HashMap<>();
	private boolean frozen = false;

	public RewriteEngine add(RewriteRule rule) {
		if (frozen) {
			throw new IllegalStateException("rule set is frozen");
		}
		rules.computeIfAbsent(PatternKey.of(rule.getPattern()), k -> new ArrayList<>()).add(rule);
		return this;
	}

	public RewriteEngine add(String pattern, String replacement) {
		return add(RewriteRule.of(pattern, replacement));
	}

	/**
	 * Prevent any further rules from being added. Engines layered over a frozen
	 * one may still add their own.
	 *
	 * @return
	 */
	public RewriteEngine freeze() {
		frozen = true;
		return this;
	}

	public boolean isFrozen() {
		return frozen;
	}

	/**
	 * Rewrite a tree to its fixpoint. The given tree is not modified.
	 *
	 * @param expr
	 * @return
	 */
	public Expr rewrite(Expr expr) {
		return visitExpression(expr);
	}

	@Override
	public Expr visitExpression(Expr expr) {
		while (true) {
			Expr node = super.visitExpression(expr);
			Expr rewritten = rewriteTop(node);
			if (rewritten == node) {
				return node;
			}
			expr = rewritten;
		}
	}

	/**
	 * Get the candidate rules for nodes with a given key, in priority order.
	 *
	 * @param key
	 * @return
	 */
	protected List<RewriteRule> lookup(PatternKey key) {
		List<RewriteRule> candidates = rules.get(key);
		return candidates == null ? Collections.emptyList() : candidates;
	}

	private Expr rewriteTop(Expr node) {
		PatternKey key = PatternKey.of(node);
		Expr result = rewriteWith(node, lookup(key));
		// Calls may also match rules whose callee is a pattern variable
		PatternKey general = key.generalise();
		if (result == node && general != null) {
			result = rewriteWith(node, lookup(general));
		}
		return result;
	}

	private Expr rewriteWith(Expr node, List<RewriteRule> candidates) {
		for (RewriteRule rule : candidates) {
			Map<String, Expr> bindings = new HashMap<>();
			if (Patterns.match(node, rule.getPattern(), bindings) && rule.getCondition().test(bindings)) {
				Expr result = Patterns.substitute(rule.getReplacement(), bindings);
				if (logger.isDebugEnabled()) {
					logger.debug("rewrite {} => {}", node, result);
				}
				return result;
			}
		}
		return node;
	}
}
