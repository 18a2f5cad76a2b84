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
 * Searches an expression for an occurrence of a given subexpression. The
 * search does not descend into a match.
 */
public class ExprFinder extends AbstractExpressionWalker {
	private final Expr target;
	private boolean found;

	public ExprFinder(Expr target) {
		this.target = target;
	}

	public boolean isFound() {
		return found;
	}

	@Override
	public void visitExpression(Expr expr) {
		if (found) {
			return;
		} else if (expr.equals(target)) {
			found = true;
		} else {
			super.visitExpression(expr);
		}
	}
}
