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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;

import vir.core.Field;
import vir.core.Trigger;
import vir.core.Type;
import vir.core.ViperFile.Expr;
import vir.util.AbstractExpressionTransform;

/**
 * Substitutes a given place throughout an expression. Occurrences beneath a
 * quantifier or let binding which shadows the root variable of the place are
 * left untouched.
 * <p>
 * Types are compared by kind alone, so a typed reference may be replaced by one
 * whose predicate is named differently. When both places are local variables
 * of typed reference type, a type parameter substitution is learned from their
 * type names. This is then applied to the type of any field accessed directly
 * from a substituted place.
 * </p>
 */
public class PlaceReplacer extends AbstractExpressionTransform {
	private final Expr target;
	private final Expr replacement;
	private final TypeParamSubstitution substitution;
	/**
	 * Set when the most recently rewritten node was, or was a field access
	 * chain from, a substituted place.
	 */
	private boolean substituted;

	public PlaceReplacer(Expr target, Expr replacement) {
		checkArgument(target.isPlace(), "expected place, found %s", target);
		if (replacement.isPlace()) {
			Type t1 = target.getType();
			Type t2 = replacement.getType();
			checkArgument(t1.isCompatible(t2),
					"Cannot substitute '%s' with '%s', because they have incompatible types '%s' and '%s'", target,
					replacement, t1, t2);
		}
		this.target = target;
		this.replacement = replacement;
		if (target instanceof Expr.Local && replacement instanceof Expr.Local
				&& target.getType() instanceof Type.TypedRef && replacement.getType() instanceof Type.TypedRef) {
			this.substitution = TypeParamSubstitution.learn(target.getLocalType(), replacement.getLocalType());
		} else {
			this.substitution = null;
		}
	}

	@Override
	public Expr visitExpression(Expr expr) {
		if (expr.isPlace() && expr.equals(target)) {
			substituted = true;
			return replacement;
		}
		Expr result = super.visitExpression(expr);
		if (result instanceof Expr.FieldAccess) {
			Expr.FieldAccess access = (Expr.FieldAccess) result;
			Field field = access.getField();
			if (substitution != null && substituted && field.getType() instanceof Type.TypedRef) {
				Type type = new Type.TypedRef(substitution.apply(field.getType().name()));
				return new Expr.FieldAccess(access.getOperand(), new Field(field.getName(), type),
						access.getPosition());
			}
			return result;
		} else {
			substituted = false;
			return result;
		}
	}

	@Override
	protected Expr visitForAll(Expr.ForAll expr) {
		if (expr.getVariables().contains(target.getBase())) {
			return expr;
		}
		List<Trigger> triggers = new ArrayList<>();
		for (Trigger t : expr.getTriggers()) {
			triggers.add(t.replacePlace(target, replacement));
		}
		Expr body = visitExpression(expr.getBody());
		return new Expr.ForAll(expr.getVariables(), triggers, body, expr.getPosition());
	}

	@Override
	protected Expr visitLetExpr(Expr.LetExpr expr) {
		if (expr.getVariable().equals(target.getBase())) {
			// Only the initialiser lies outside the binding
			Expr initialiser = visitExpression(expr.getInitialiser());
			return constructLetExpr(expr, initialiser, expr.getBody());
		}
		return super.visitLetExpr(expr);
	}
}
