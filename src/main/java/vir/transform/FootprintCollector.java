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

import static vir.core.ViperFile.ACC;

import java.util.ArrayList;
import java.util.List;

import vir.core.PermAmount;
import vir.core.ViperFile.Expr;
import vir.util.AbstractExpressionWalker;

/**
 * Computes the field permissions needed to evaluate every place accessed in an
 * expression. Permissions are produced shallowest first, and nothing is
 * produced for the state held within old expressions.
 */
public class FootprintCollector extends AbstractExpressionWalker {
	private final PermAmount perm;
	private final List<Expr> footprint = new ArrayList<>();

	public FootprintCollector(PermAmount perm) {
		this.perm = perm;
	}

	public List<Expr> getFootprint() {
		return footprint;
	}

	@Override
	public void visitVariant(Expr.Variant expr) {
		super.visitVariant(expr);
		footprint.add(ACC(expr, perm));
	}

	@Override
	public void visitFieldAccess(Expr.FieldAccess expr) {
		super.visitFieldAccess(expr);
		footprint.add(ACC(expr, perm));
	}

	@Override
	public void visitLabelledOld(Expr.LabelledOld expr) {

	}
}
