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
import vir.util.AbstractExpressionTransform;

/**
 * Retains only the permissions within a conjunction. Any conjunct which is not
 * itself a permission or a conjunction becomes <code>true</code>.
 */
public class PermissionConjunctionFilter extends AbstractExpressionTransform {

	@Override
	public Expr visitExpression(Expr expr) {
		if (expr.isPermission()) {
			return expr;
		} else if (expr instanceof Expr.BinOp && ((Expr.BinOp) expr).getKind() == Expr.BinOpKind.AND) {
			return super.visitExpression(expr);
		} else {
			return new Expr.Const(true, expr.getPosition());
		}
	}
}
