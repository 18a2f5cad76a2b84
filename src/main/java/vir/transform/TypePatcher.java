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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import vir.core.LocalVar;
import vir.core.ViperFile.Expr;
import vir.util.AbstractExpressionTransform;

/**
 * Instantiates generic type names by substring replacement. This applies to
 * the types of local variables, the formal parameters of function applications
 * and the names of predicates. Function return types are not patched.
 */
public class TypePatcher extends AbstractExpressionTransform {
	private final Map<String, String> substs;

	public TypePatcher(Map<String, String> substs) {
		this.substs = substs;
	}

	@Override
	protected Expr constructLocal(Expr.Local expr) {
		LocalVar var = expr.getVariable().patch(substs);
		if (var == expr.getVariable()) {
			return expr;
		} else {
			return new Expr.Local(var, expr.getPosition());
		}
	}

	@Override
	protected Expr constructPredicateAccessPredicate(Expr.PredicateAccessPredicate expr, Expr argument) {
		String name = expr.getName();
		for (Map.Entry<String, String> e : substs.entrySet()) {
			name = name.replace(e.getKey(), e.getValue());
		}
		if (name.equals(expr.getName()) && argument == expr.getArgument()) {
			return expr;
		} else {
			return new Expr.PredicateAccessPredicate(name, argument, expr.getPermission(), expr.getPosition());
		}
	}

	@Override
	protected Expr constructFuncApp(Expr.FuncApp expr, List<Expr> arguments) {
		List<LocalVar> formals = new ArrayList<>();
		boolean changed = !identical(expr.getArguments(), arguments);
		for (LocalVar formal : expr.getFormals()) {
			LocalVar patched = formal.patch(substs);
			changed |= (patched != formal);
			formals.add(patched);
		}
		if (!changed) {
			return expr;
		} else {
			return new Expr.FuncApp(expr.getName(), arguments, formals, expr.getReturns(), expr.getPosition());
		}
	}
}
