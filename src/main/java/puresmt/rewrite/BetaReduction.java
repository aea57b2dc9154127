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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import puresmt.core.PureFile.Decl;
import puresmt.core.PureFile.Expr;

/**
 * Inline the application of a lambda expression to its arguments.
 */
public final class BetaReduction {
	private BetaReduction() {
	}

	/**
	 * Reduce a call whose callee is a lambda by substituting the arguments for
	 * the lambda's parameters in its body. Calls of anything other than a lambda,
	 * calls with a different number of arguments than parameters, and calls
	 * involving starred arguments or parameters are returned unchanged.
	 *
	 * @param call
	 * @return
	 */
	public static Expr reduce(Expr.Call call) {
		if (!(call.getCallee() instanceof Expr.Lambda)) {
			return call;
		}
		Expr.Lambda lambda = (Expr.Lambda) call.getCallee();
		List<Decl.Parameter> parameters = lambda.getParameters();
		List<Expr> arguments = call.getArguments();
		if (parameters.size() != arguments.size()) {
			return call;
		}
		Map<String, Expr> mapping = new HashMap<>();
		for (int i = 0; i != parameters.size(); ++i) {
			Decl.Parameter p = parameters.get(i);
			Expr arg = arguments.get(i);
			if (p.isStarred() || arg instanceof Expr.Starred) {
				return call;
			}
			mapping.put(p.getName(), arg);
		}
		return new Substitution(mapping).apply(lambda.getBody());
	}
}
