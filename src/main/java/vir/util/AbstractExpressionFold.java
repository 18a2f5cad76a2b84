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
 * Aggregates information over an expression. Leaves produce
 * <code>BOTTOM()</code>, and compound nodes join the results of their
 * children.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E constructLocal(Expr.Local expr) {
        return BOTTOM();
    }

    @Override
    protected E constructConst(Expr.Const expr) {
        return BOTTOM();
    }

    @Override
    protected E constructVariant(Expr.Variant expr, E operand) {
        return operand;
    }

    @Override
    protected E constructFieldAccess(Expr.FieldAccess expr, E operand) {
        return operand;
    }

    @Override
    protected E constructAddrOf(Expr.AddrOf expr, E operand) {
        return operand;
    }

    @Override
    protected E constructLabelledOld(Expr.LabelledOld expr, E body) {
        return body;
    }

    @Override
    protected E constructMagicWand(Expr.MagicWand expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructPredicateAccessPredicate(Expr.PredicateAccessPredicate expr, E argument) {
        return argument;
    }

    @Override
    protected E constructFieldAccessPredicate(Expr.FieldAccessPredicate expr, E receiver) {
        return receiver;
    }

    @Override
    protected E constructUnaryOp(Expr.UnaryOp expr, E operand) {
        return operand;
    }

    @Override
    protected E constructBinOp(Expr.BinOp expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructUnfolding(Expr.Unfolding expr, List<E> arguments, E body) {
        return join(join(arguments), body);
    }

    @Override
    protected E constructCond(Expr.Cond expr, E guard, E trueBranch, E falseBranch) {
        return join(guard, join(trueBranch, falseBranch));
    }

    @Override
    protected E constructForAll(Expr.ForAll expr, E body) {
        return body;
    }

    @Override
    protected E constructLetExpr(Expr.LetExpr expr, E initialiser, E body) {
        return join(initialiser, body);
    }

    @Override
    protected E constructFuncApp(Expr.FuncApp expr, List<E> arguments) {
        return join(arguments);
    }

    protected abstract E BOTTOM();

    protected abstract E join(E lhs, E rhs);

    protected E join(List<E> operands) {
        E result = BOTTOM();
        for (int i = 0; i != operands.size(); ++i) {
            result = join(result, operands.get(i));
        }
        return result;
    }
}
