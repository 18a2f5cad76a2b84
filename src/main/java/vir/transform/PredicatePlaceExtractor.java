// Copyright 2020 The Whiley Project Developers
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
package vir.transform;

import java.util.Collections;
import java.util.List;

import vir.core.PermAmount;
import vir.core.ViperFile.Expr;
import vir.util.AbstractExpressionFold;
import vir.util.Util;

/**
 * Collects the places held by predicate permissions of a given amount, in the
 * order in which they occur.
 */
public class PredicatePlaceExtractor extends AbstractExpressionFold<List<Expr>> {
	private final PermAmount perm;

	public PredicatePlaceExtractor(PermAmount perm) {
		this.perm = perm;
	}

	@Override
	protected List<Expr> visitPredicateAccessPredicate(Expr.PredicateAccessPredicate expr) {
		if (expr.getPermission().equals(perm)) {
			return Collections.singletonList(expr.getArgument());
		} else {
			return BOTTOM();
		}
	}

	@Override
	protected List<Expr> BOTTOM() {
		return Collections.emptyList();
	}

	@Override
	protected List<Expr> join(List<Expr> lhs, List<Expr> rhs) {
		return Util.append(lhs, rhs);
	}
}
