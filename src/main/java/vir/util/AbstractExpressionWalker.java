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

import vir.core.LocalVar;
import vir.core.ViperFile.Expr;

/**
 * Walks an expression without changing it. Children are visited from left to
 * right. Overriding a <code>visitX</code> method without calling its super
 * implementation prunes the walk below that node.
 */
public abstract class AbstractExpressionWalker {

    public void visitExpression(Expr expr) {
        if(expr instanceof Expr.Local) {
            visitLocal((Expr.Local) expr);
        } else if(expr instanceof Expr.Const) {
            visitConst((Expr.Const) expr);
        } else if(expr instanceof Expr.Variant) {
            visitVariant((Expr.Variant) expr);
        } else if(expr instanceof Expr.FieldAccess) {
            visitFieldAccess((Expr.FieldAccess) expr);
        } else if(expr instanceof Expr.AddrOf) {
            visitAddrOf((Expr.AddrOf) expr);
        } else if(expr instanceof Expr.LabelledOld) {
            visitLabelledOld((Expr.LabelledOld) expr);
        } else if(expr instanceof Expr.MagicWand) {
            visitMagicWand((Expr.MagicWand) expr);
        } else if(expr instanceof Expr.PredicateAccessPredicate) {
            visitPredicateAccessPredicate((Expr.PredicateAccessPredicate) expr);
        } else if(expr instanceof Expr.FieldAccessPredicate) {
            visitFieldAccessPredicate((Expr.FieldAccessPredicate) expr);
        } else if(expr instanceof Expr.UnaryOp) {
            visitUnaryOp((Expr.UnaryOp) expr);
        } else if(expr instanceof Expr.BinOp) {
            visitBinOp((Expr.BinOp) expr);
        } else if(expr instanceof Expr.Unfolding) {
            visitUnfolding((Expr.Unfolding) expr);
        } else if(expr instanceof Expr.Cond) {
            visitCond((Expr.Cond) expr);
        } else if(expr instanceof Expr.ForAll) {
            visitForAll((Expr.ForAll) expr);
        } else if(expr instanceof Expr.LetExpr) {
            visitLetExpr((Expr.LetExpr) expr);
        } else if(expr instanceof Expr.FuncApp) {
            visitFuncApp((Expr.FuncApp) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    /**
     * Visit a variable, whether used or declared.
     *
     * @param var
     */
    public void visitLocalVar(LocalVar var) {

    }

    public void visitLocal(Expr.Local expr) {
        visitLocalVar(expr.getVariable());
    }

    public void visitConst(Expr.Const expr) {

    }

    public void visitVariant(Expr.Variant expr) {
        visitExpression(expr.getOperand());
    }

    public void visitFieldAccess(Expr.FieldAccess expr) {
        visitExpression(expr.getOperand());
    }

    public void visitAddrOf(Expr.AddrOf expr) {
        visitExpression(expr.getOperand());
    }

    public void visitLabelledOld(Expr.LabelledOld expr) {
        visitExpression(expr.getBody());
    }

    public void visitMagicWand(Expr.MagicWand expr) {
        visitExpression(expr.getLeftHandSide());
        visitExpression(expr.getRightHandSide());
    }

    public void visitPredicateAccessPredicate(Expr.PredicateAccessPredicate expr) {
        visitExpression(expr.getArgument());
    }

    public void visitFieldAccessPredicate(Expr.FieldAccessPredicate expr) {
        visitExpression(expr.getReceiver());
    }

    public void visitUnaryOp(Expr.UnaryOp expr) {
        visitExpression(expr.getOperand());
    }

    public void visitBinOp(Expr.BinOp expr) {
        visitExpression(expr.getLeftHandSide());
        visitExpression(expr.getRightHandSide());
    }

    public void visitUnfolding(Expr.Unfolding expr) {
        for (Expr arg : expr.getArguments()) {
            visitExpression(arg);
        }
        visitExpression(expr.getBody());
    }

    public void visitCond(Expr.Cond expr) {
        visitExpression(expr.getGuard());
        visitExpression(expr.getTrueBranch());
        visitExpression(expr.getFalseBranch());
    }

    public void visitForAll(Expr.ForAll expr) {
        for (LocalVar var : expr.getVariables()) {
            visitLocalVar(var);
        }
        visitExpression(expr.getBody());
    }

    public void visitLetExpr(Expr.LetExpr expr) {
        visitLocalVar(expr.getVariable());
        visitExpression(expr.getInitialiser());
        visitExpression(expr.getBody());
    }

    public void visitFuncApp(Expr.FuncApp expr) {
        for (Expr arg : expr.getArguments()) {
            visitExpression(arg);
        }
        for (LocalVar var : expr.getFormals()) {
            visitLocalVar(var);
        }
    }
}
