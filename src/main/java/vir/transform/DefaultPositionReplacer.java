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

import vir.core.Position;
import vir.core.ViperFile.Expr;
import vir.util.AbstractExpressionTransform;

/**
 * Gives every node without a known position a given position.
 */
public class DefaultPositionReplacer extends AbstractExpressionTransform {
	private final Position position;

	public DefaultPositionReplacer(Position position) {
		this.position = position;
	}

	@Override
	public Expr visitExpression(Expr expr) {
		Expr result = super.visitExpression(expr);
		if (result.getPosition().isDefault()) {
			return result.setPosition(position);
		}
		return result;
	}
}
