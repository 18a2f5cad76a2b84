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

import vir.core.PermAmount;
import vir.core.ViperFile.Expr;
import vir.util.AbstractExpressionTransform;

/**
 * Replaces every read permission by <code>true</code>, keeping write
 * permissions as they are. No other amount may occur.
 */
public class ReadPermissionRemover extends AbstractExpressionTransform {

	@Override
	protected Expr constructPredicateAccessPredicate(Expr.PredicateAccessPredicate expr, Expr argument) {
		return strip(expr, super.constructPredicateAccessPredicate(expr, argument));
	}

	@Override
	protected Expr constructFieldAccessPredicate(Expr.FieldAccessPredicate expr, Expr receiver) {
		return strip(expr, super.constructFieldAccessPredicate(expr, receiver));
	}

	private static Expr strip(Expr original, Expr rebuilt) {
		PermAmount perm = original.getPermAmount();
		if (perm.equals(PermAmount.WRITE)) {
			return rebuilt;
		} else if (perm.equals(PermAmount.READ)) {
			return new Expr.Const(true, original.getPosition());
		} else {
			throw new IllegalStateException("unexpected permission amount " + perm + " in " + original);
		}
	}
}
