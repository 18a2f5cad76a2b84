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

import java.util.function.UnaryOperator;

import vir.core.ViperFile.Expr;
import vir.util.AbstractExpressionTransform;

/**
 * Applies a function to every maximal place. Places within triggers are not
 * affected.
 */
public class PlaceFolder extends AbstractExpressionTransform {
	private final UnaryOperator<Expr> fn;

	public PlaceFolder(UnaryOperator<Expr> fn) {
		this.fn = fn;
	}

	@Override
	public Expr visitExpression(Expr expr) {
		if (expr.isPlace()) {
			return fn.apply(expr);
		} else {
			return super.visitExpression(expr);
		}
	}
}
