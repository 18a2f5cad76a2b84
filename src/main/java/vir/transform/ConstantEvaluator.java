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

import java.math.BigInteger;
import java.util.List;

import vir.core.Position;
import vir.core.ViperFile.Expr;
import vir.util.AbstractExpressionFold;

/**
 * Evaluates expressions built from constants alone. Integer arithmetic is
 * unbounded, whilst division and modulus are euclidean so that the modulus is
 * never negative.
 */
public class ConstantEvaluator extends AbstractExpressionFold<Object> {

	public static Expr.Const evaluate(Expr expr) {
		Object value = new ConstantEvaluator().visitExpression(expr);
		if (value instanceof Boolean) {
			return new Expr.Const((Boolean) value, Position.UNKNOWN);
		}
		BigInteger i = (BigInteger) value;
		if (i.bitLength() < 64) {
			return new Expr.Const(i.longValue(), Position.UNKNOWN);
		} else {
			return new Expr.Const(i, Position.UNKNOWN);
		}
	}

	@Override
	protected Object constructLocal(Expr.Local expr) {
		throw new IllegalArgumentException("expression is not constant: " + expr);
	}

	@Override
	protected Object constructConst(Expr.Const expr) {
		Object value = expr.getValue();
		if (value instanceof Long) {
			return BigInteger.valueOf((Long) value);
		}
		return value;
	}

	@Override
	protected Object constructUnaryOp(Expr.UnaryOp expr, Object operand) {
		switch (expr.getKind()) {
		case NOT:
			return !asBoolean(operand);
		default:
			return asInteger(operand).negate();
		}
	}

	@Override
	protected Object constructBinOp(Expr.BinOp expr, Object lhs, Object rhs) {
		switch (expr.getKind()) {
		case EQ:
			return lhs.equals(rhs);
		case GT:
			return asInteger(lhs).compareTo(asInteger(rhs)) > 0;
		case GTEQ:
			return asInteger(lhs).compareTo(asInteger(rhs)) >= 0;
		case LT:
			return asInteger(lhs).compareTo(asInteger(rhs)) < 0;
		case LTEQ:
			return asInteger(lhs).compareTo(asInteger(rhs)) <= 0;
		case ADD:
			return asInteger(lhs).add(asInteger(rhs));
		case SUB:
			return asInteger(lhs).subtract(asInteger(rhs));
		case MUL:
			return asInteger(lhs).multiply(asInteger(rhs));
		case DIV: {
			BigInteger l = asInteger(lhs);
			BigInteger r = asInteger(rhs);
			return l.subtract(mod(l, r)).divide(r);
		}
		case MOD:
			return mod(asInteger(lhs), asInteger(rhs));
		case AND:
			return asBoolean(lhs) && asBoolean(rhs);
		case OR:
			return asBoolean(lhs) || asBoolean(rhs);
		default:
			return !asBoolean(lhs) || asBoolean(rhs);
		}
	}

	@Override
	protected Object constructCond(Expr.Cond expr, Object guard, Object trueBranch, Object falseBranch) {
		return asBoolean(guard) ? trueBranch : falseBranch;
	}

	@Override
	protected Object BOTTOM() {
		throw new IllegalArgumentException("expression is not constant");
	}

	@Override
	protected Object join(Object lhs, Object rhs) {
		throw new IllegalArgumentException("expression is not constant");
	}

	@Override
	protected Object join(List<Object> operands) {
		throw new IllegalArgumentException("expression is not constant");
	}

	private static BigInteger mod(BigInteger lhs, BigInteger rhs) {
		checkArgument(rhs.signum() != 0, "division by zero");
		return lhs.mod(rhs.abs());
	}

	private static BigInteger asInteger(Object value) {
		checkArgument(value instanceof BigInteger, "expected integer, found %s", value);
		return (BigInteger) value;
	}

	private static boolean asBoolean(Object value) {
		checkArgument(value instanceof Boolean, "expected boolean, found %s", value);
		return (Boolean) value;
	}
}
