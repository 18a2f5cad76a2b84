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

import java.util.function.Function;

import vir.core.ViperFile.Expr;
import vir.util.AbstractExpressionTransform;

/**
 * Renames the labels of old expressions. Where the renaming gives null, the
 * old expression is dropped in favour of its body.
 */
public class OldLabelMapper extends AbstractExpressionTransform {
	private final Function<String, String> mapping;

	public OldLabelMapper(Function<String, String> mapping) {
		this.mapping = mapping;
	}

	@Override
	protected Expr constructLabelledOld(Expr.LabelledOld expr, Expr body) {
		String label = mapping.apply(expr.getLabel());
		if (label == null) {
			return body;
		} else {
			return body.old(label).setPosition(expr.getPosition());
		}
	}
}
