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
package vir.util;

import java.util.List;

import vir.core.ViperFile.Expr;

/**
 * Rewrites an expression bottom-up. By default, every node is rebuilt from its
 * rewritten children, retaining its position. A node whose children are all
 * unchanged is returned as is.
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr> {

    @Override
    protected Expr constructLocal(Expr.Local expr) {
        return expr;
    }

    @Override
    protected Expr constructConst(Expr.Const expr) {
        return expr;
    }

    @Override
    protected Expr constructVariant(Expr.Variant expr, Expr operand) {
        if (expr.getOperand() == operand) {
            return expr;
        } else {
            return new Expr.Variant(operand, expr.getVariant(), expr.getPosition());
        }
    }

    @Override
    protected Expr constructFieldAccess(Expr.FieldAccess expr, Expr operand) {
        if (expr.getOperand() == operand) {
            return expr;
        } else {
            return new Expr.FieldAccess(operand, expr.getField(), expr.getPosition());
        }
    }

    @Override
    protected Expr constructAddrOf(Expr.AddrOf expr, Expr operand) {
        if (expr.getOperand() == operand) {
            return expr;
        } else {
            return new Expr.AddrOf(operand, expr.getAddressType(), expr.getPosition());
        }
    }

    @Override
    protected Expr constructLabelledOld(Expr.LabelledOld expr, Expr body) {
        if (expr.getBody() == body) {
            return expr;
        } else {
            return new Expr.LabelledOld(expr.getLabel(), body, expr.getPosition());
        }
    }

    @Override
    protected Expr constructMagicWand(Expr.MagicWand expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return new Expr.MagicWand(lhs, rhs, expr.getBorrow(), expr.getPosition());
        }
    }

    @Override
    protected Expr constructPredicateAccessPredicate(Expr.PredicateAccessPredicate expr, Expr argument) {
        if (expr.getArgument() == argument) {
            return expr;
        } else {
            return new Expr.PredicateAccessPredicate(expr.getName(), argument, expr.getPermission(),
                    expr.getPosition());
        }
    }

    @Override
    protected Expr constructFieldAccessPredicate(Expr.FieldAccessPredicate expr, Expr receiver) {
        if (expr.getReceiver() == receiver) {
            return expr;
        } else {
            return new Expr.FieldAccessPredicate(receiver, expr.getPermission(), expr.getPosition());
        }
    }

    @Override
    protected Expr constructUnaryOp(Expr.UnaryOp expr, Expr operand) {
        if (expr.getOperand() == operand) {
            return expr;
        } else {
            return new Expr.UnaryOp(expr.getKind(), operand, expr.getPosition());
        }
    }

    @Override
    protected Expr constructBinOp(Expr.BinOp expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return new Expr.BinOp(expr.getKind(), lhs, rhs, expr.getPosition());
        }
    }

    @Override
    protected Expr constructUnfolding(Expr.Unfolding expr, List<Expr> arguments, Expr body) {
        if (identical(expr.getArguments(), arguments) && expr.getBody() == body) {
            return expr;
        } else {
            return new Expr.Unfolding(expr.getPredicate(), arguments, body, expr.getPermission(), expr.getVariant(),
                    expr.getPosition());
        }
    }

    @Override
    protected Expr constructCond(Expr.Cond expr, Expr guard, Expr trueBranch, Expr falseBranch) {
        if (expr.getGuard() == guard && expr.getTrueBranch() == trueBranch && expr.getFalseBranch() == falseBranch) {
            return expr;
        } else {
            return new Expr.Cond(guard, trueBranch, falseBranch, expr.getPosition());
        }
    }

    @Override
    protected Expr constructForAll(Expr.ForAll expr, Expr body) {
        if (expr.getBody() == body) {
            return expr;
        } else {
            return new Expr.ForAll(expr.getVariables(), expr.getTriggers(), body, expr.getPosition());
        }
    }

    @Override
    protected Expr constructLetExpr(Expr.LetExpr expr, Expr initialiser, Expr body) {
        if (expr.getInitialiser() == initialiser && expr.getBody() == body) {
            return expr;
        } else {
            return new Expr.LetExpr(expr.getVariable(), initialiser, body, expr.getPosition());
        }
    }

    @Override
    protected Expr constructFuncApp(Expr.FuncApp expr, List<Expr> arguments) {
        if (identical(expr.getArguments(), arguments)) {
            return expr;
        } else {
            return new Expr.FuncApp(expr.getName(), arguments, expr.getFormals(), expr.getReturns(),
                    expr.getPosition());
        }
    }

    /**
     * Check whether two lists hold the same objects, as determined by reference
     * equality.
     */
    protected static boolean identical(List<Expr> before, List<Expr> after) {
        if (before.size() != after.size()) {
            return false;
        }
        for (int i = 0; i != before.size(); ++i) {
            if (before.get(i) != after.get(i)) {
                return false;
            }
        }
        return true;
    }
}
