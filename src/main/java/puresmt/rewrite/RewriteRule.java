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

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import puresmt.core.PureFile.Expr;
import puresmt.io.PureFileParser;

/**
 * A single rewrite from a pattern to a replacement, guarded by a condition on
 * the bindings produced when the pattern matches.
 */
public class RewriteRule {
	public static final Predicate<Map<String, Expr>> ALWAYS = b -> true;

	private final Expr pattern;
	private final Expr replacement;
	private final Predicate<Map<String, Expr>> condition;

	private RewriteRule(Expr pattern, Expr replacement, Predicate<Map<String, Expr>> condition) {
		this.pattern = pattern;
		this.replacement = replacement;
		this.condition = condition;
	}

	public Expr getPattern() {
		return pattern;
	}

	public Expr getReplacement() {
		return replacement;
	}

	public Predicate<Map<String, Expr>> getCondition() {
		return condition;
	}

	@Override
	public String toString() {
		return pattern + " => " + replacement;
	}

	public static RewriteRule of(String pattern, String replacement) {
		return of(pattern, replacement, ALWAYS);
	}

	/**
	 * Construct a rule from source text, where upper-case names are pattern
	 * variables.
	 *
	 * @param pattern
	 * @param replacement
	 * @param condition
	 * @return
	 */
	public static RewriteRule of(String pattern, String replacement, Predicate<Map<String, Expr>> condition) {
		return of(PureFileParser.parseExpression(pattern), PureFileParser.parseExpression(replacement), condition);
	}

	public static RewriteRule of(Expr pattern, Expr replacement, Predicate<Map<String, Expr>> condition) {
		List<Expr> tagged = Patterns.preprocess(pattern, replacement);
		return new RewriteRule(tagged.get(0), tagged.get(1), condition);
	}

	/**
	 * Construct a rule from trees whose pattern variables are already tagged.
	 *
	 * @param pattern
	 * @param replacement
	 * @param condition
	 * @return
	 */
	public static RewriteRule tagged(Expr pattern, Expr replacement, Predicate<Map<String, Expr>> condition) {
		return new RewriteRule(pattern, replacement, condition);
	}
}
