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
 * Removes old expressions nested within an old expression at the same label.
 * For example, <code>old[l](old[l](x.f).g)</code> becomes
 * <code>old[l](x.f.g)</code>.
 */
public class RedundantOldRemover extends AbstractExpressionTransform {
	private String currentLabel;

	@Override
	protected Expr visitLabelledOld(Expr.LabelledOld expr) {
		String enclosing = currentLabel;
		currentLabel = expr.getLabel();
		Expr body = visitExpression(expr.getBody());
		currentLabel = enclosing;
		if (expr.getLabel().equals(enclosing)) {
			return body;
		} else {
			return body.old(expr.getLabel()).setPosition(expr.getPosition());
		}
	}
}
