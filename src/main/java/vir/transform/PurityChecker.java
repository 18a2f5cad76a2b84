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

import vir.core.ViperFile.Expr;
import vir.util.AbstractExpressionWalker;

/**
 * Determines whether an expression is free of permissions.
 */
public class PurityChecker extends AbstractExpressionWalker {
	private boolean pure = true;

	public boolean isPure() {
		return pure;
	}

	@Override
	public void visitPredicateAccessPredicate(Expr.PredicateAccessPredicate expr) {
		pure = false;
	}

	@Override
	public void visitFieldAccessPredicate(Expr.FieldAccessPredicate expr) {
		pure = false;
	}
}
