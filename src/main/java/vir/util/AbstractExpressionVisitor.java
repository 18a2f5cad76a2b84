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

import java.util.ArrayList;
import java.util.List;

import vir.core.ViperFile.Expr;

/**
 * Visits an expression bottom-up. Each compound node has a
 * <code>visitX</code> method, which visits its children from left to right
 * before calling <code>constructX</code> with their results. Overriding a
 * <code>visitX</code> method replaces the handling of that node altogether.
 *
 * @param <E> The result of visiting an expression.
 */
public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if(expr instanceof Expr.Local) {
            return constructLocal((Expr.Local) expr);
        } else if(expr instanceof Expr.Const) {
            return constructConst((Expr.Const) expr);
        } else if(expr instanceof Expr.Variant) {
            return visitVariant((Expr.Variant) expr);
        } else if(expr instanceof Expr.FieldAccess) {
            return visitFieldAccess((Expr.FieldAccess) expr);
        } else if(expr instanceof Expr.AddrOf) {
            return visitAddrOf((Expr.AddrOf) expr);
        } else if(expr instanceof Expr.LabelledOld) {
            return visitLabelledOld((Expr.LabelledOld) expr);
        } else if(expr instanceof Expr.MagicWand) {
            return visitMagicWand((Expr.MagicWand) expr);
        } else if(expr instanceof Expr.PredicateAccessPredicate) {
            return visitPredicateAccessPredicate((Expr.PredicateAccessPredicate) expr);
        } else if(expr instanceof Expr.FieldAccessPredicate) {
            return visitFieldAccessPredicate((Expr.FieldAccessPredicate) expr);
        } else if(expr instanceof Expr.UnaryOp) {
            return visitUnaryOp((Expr.UnaryOp) expr);
        } else if(expr instanceof Expr.BinOp) {
            return visitBinOp((Expr.BinOp) expr);
        } else if(expr instanceof Expr.Unfolding) {
            return visitUnfolding((Expr.Unfolding) expr);
        } else if(expr instanceof Expr.Cond) {
            return visitCond((Expr.Cond) expr);
        } else if(expr instanceof Expr.ForAll) {
            return visitForAll((Expr.ForAll) expr);
        } else if(expr instanceof Expr.LetExpr) {
            return visitLetExpr((Expr.LetExpr) expr);
        } else if(expr instanceof Expr.FuncApp) {
            return visitFuncApp((Expr.FuncApp) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E visitVariant(Expr.Variant expr) {
        E operand = visitExpression(expr.getOperand());
        return constructVariant(expr, operand);
    }

    protected E visitFieldAccess(Expr.FieldAccess expr) {
        E operand = visitExpression(expr.getOperand());
        return constructFieldAccess(expr, operand);
    }

    protected E visitAddrOf(Expr.AddrOf expr) {
        E operand = visitExpression(expr.getOperand());
        return constructAddrOf(expr, operand);
    }

    protected E visitLabelledOld(Expr.LabelledOld expr) {
        E body = visitExpression(expr.getBody());
        return constructLabelledOld(expr, body);
    }

    protected E visitMagicWand(Expr.MagicWand expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructMagicWand(expr, lhs, rhs);
    }

    protected E visitPredicateAccessPredicate(Expr.PredicateAccessPredicate expr) {
        E argument = visitExpression(expr.getArgument());
        return constructPredicateAccessPredicate(expr, argument);
    }

    protected E visitFieldAccessPredicate(Expr.FieldAccessPredicate expr) {
        E receiver = visitExpression(expr.getReceiver());
        return constructFieldAccessPredicate(expr, receiver);
    }

    protected E visitUnaryOp(Expr.UnaryOp expr) {
        E operand = visitExpression(expr.getOperand());
        return constructUnaryOp(expr, operand);
    }

    protected E visitBinOp(Expr.BinOp expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructBinOp(expr, lhs, rhs);
    }

    protected E visitUnfolding(Expr.Unfolding expr) {
        List<E> arguments = visitExpressions(expr.getArguments());
        E body = visitExpression(expr.getBody());
        return constructUnfolding(expr, arguments, body);
    }

    protected E visitCond(Expr.Cond expr) {
        E guard = visitExpression(expr.getGuard());
        E trueBranch = visitExpression(expr.getTrueBranch());
        E falseBranch = visitExpression(expr.getFalseBranch());
        return constructCond(expr, guard, trueBranch, falseBranch);
    }

    /**
     * Visit the body of a quantifier. Triggers are not visited.
     *
     * @param expr
     * @return
     */
    protected E visitForAll(Expr.ForAll expr) {
        E body = visitExpression(expr.getBody());
        return constructForAll(expr, body);
    }

    protected E visitLetExpr(Expr.LetExpr expr) {
        E initialiser = visitExpression(expr.getInitialiser());
        E body = visitExpression(expr.getBody());
        return constructLetExpr(expr, initialiser, body);
    }

    protected E visitFuncApp(Expr.FuncApp expr) {
        List<E> arguments = visitExpressions(expr.getArguments());
        return constructFuncApp(expr, arguments);
    }

    protected abstract E constructLocal(Expr.Local expr);

    protected abstract E constructConst(Expr.Const expr);

    protected abstract E constructVariant(Expr.Variant expr, E operand);

    protected abstract E constructFieldAccess(Expr.FieldAccess expr, E operand);

    protected abstract E constructAddrOf(Expr.AddrOf expr, E operand);

    protected abstract E constructLabelledOld(Expr.LabelledOld expr, E body);

    protected abstract E constructMagicWand(Expr.MagicWand expr, E lhs, E rhs);

    protected abstract E constructPredicateAccessPredicate(Expr.PredicateAccessPredicate expr, E argument);

    protected abstract E constructFieldAccessPredicate(Expr.FieldAccessPredicate expr, E receiver);

    protected abstract E constructUnaryOp(Expr.UnaryOp expr, E operand);

    protected abstract E constructBinOp(Expr.BinOp expr, E lhs, E rhs);

    protected abstract E constructUnfolding(Expr.Unfolding expr, List<E> arguments, E body);

    protected abstract E constructCond(Expr.Cond expr, E guard, E trueBranch, E falseBranch);

    protected abstract E constructForAll(Expr.ForAll expr, E body);

    protected abstract E constructLetExpr(Expr.LetExpr expr, E initialiser, E body);

    protected abstract E constructFuncApp(Expr.FuncApp expr, List<E> arguments);
}
