// Copyright 2026 The PureSMT Project Developers
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
package puresmt.util;

import puresmt.core.PureFile.Expr;
import puresmt.core.PureFile.Slice;
import puresmt.core.UnsupportedConstructError;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks an expression tree bottom-up. Each <code>visitX</code> method visits
 * the children of an <code>X</code> node and then passes their results to the
 * corresponding <code>constructX</code> method.
 *
 * @param <E> result of visiting an expression
 * @param <S> result of visiting a slice
 */
public abstract class AbstractExpressionVisitor<E, S> {

    public E visitExpression(Expr expr) {
        if (expr instanceof Expr.Name) {
            return constructName((Expr.Name) expr);
        } else if (expr instanceof Expr.Number) {
            return constructNumber((Expr.Number) expr);
        } else if (expr instanceof Expr.Constant) {
            return constructConstant((Expr.Constant) expr);
        } else if (expr instanceof Expr.Call) {
            return visitCall((Expr.Call) expr);
        } else if (expr instanceof Expr.BinOp) {
            return visitBinOp((Expr.BinOp) expr);
        } else if (expr instanceof Expr.UnaryOp) {
            return visitUnaryOp((Expr.UnaryOp) expr);
        } else if (expr instanceof Expr.BoolOp) {
            return visitBoolOp((Expr.BoolOp) expr);
        } else if (expr instanceof Expr.Compare) {
            return visitCompare((Expr.Compare) expr);
        } else if (expr instanceof Expr.Subscript) {
            return visitSubscript((Expr.Subscript) expr);
        } else if (expr instanceof Expr.Tuple) {
            return visitTuple((Expr.Tuple) expr);
        } else if (expr instanceof Expr.Starred) {
            return visitStarred((Expr.Starred) expr);
        } else if (expr instanceof Expr.Lambda) {
            return visitLambda((Expr.Lambda) expr);
        } else {
            throw new UnsupportedConstructError("unknown expression encountered (" + expr.getClass().getName() + ")", expr);
        }
    }

    protected List<E> visitExpressions(List<Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    public S visitSlice(Slice slice) {
        if (slice instanceof Slice.Index) {
            Slice.Index s = (Slice.Index) slice;
            return constructIndex(s, visitExpression(s.getIndex()));
        } else if (slice instanceof Slice.Range) {
            Slice.Range s = (Slice.Range) slice;
            E lower = s.getLower() == null ? null : visitExpression(s.getLower());
            E upper = s.getUpper() == null ? null : visitExpression(s.getUpper());
            E step = s.getStep() == null ? null : visitExpression(s.getStep());
            return constructRange(s, lower, upper, step);
        } else {
            Slice.Extended s = (Slice.Extended) slice;
            List<S> dimensions = new ArrayList<>();
            for (Slice d : s.getDimensions()) {
                dimensions.add(visitSlice(d));
            }
            return constructExtended(s, dimensions);
        }
    }

    protected E visitCall(Expr.Call expr) {
        E callee = visitExpression(expr.getCallee());
        List<E> arguments = visitExpressions(expr.getArguments());
        return constructCall(expr, callee, arguments);
    }

    protected E visitBinOp(Expr.BinOp expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructBinOp(expr, lhs, rhs);
    }

    protected E visitUnaryOp(Expr.UnaryOp expr) {
        E operand = visitExpression(expr.getOperand());
        return constructUnaryOp(expr, operand);
    }

    protected E visitBoolOp(Expr.BoolOp expr) {
        List<E> operands = visitExpressions(expr.getOperands());
        return constructBoolOp(expr, operands);
    }

    protected E visitCompare(Expr.Compare expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        List<E> comparators = visitExpressions(expr.getComparators());
        return constructCompare(expr, lhs, comparators);
    }

    protected E visitSubscript(Expr.Subscript expr) {
        E source = visitExpression(expr.getSource());
        S slice = visitSlice(expr.getSlice());
        return constructSubscript(expr, source, slice);
    }

    protected E visitTuple(Expr.Tuple expr) {
        List<E> items = visitExpressions(expr.getItems());
        return constructTuple(expr, items);
    }

    protected E visitStarred(Expr.Starred expr) {
        E operand = visitExpression(expr.getOperand());
        return constructStarred(expr, operand);
    }

    protected E visitLambda(Expr.Lambda expr) {
        E body = visitExpression(expr.getBody());
        return constructLambda(expr, body);
    }

    protected abstract E constructName(Expr.Name expr);

    protected abstract E constructNumber(Expr.Number expr);

    protected abstract E constructConstant(Expr.Constant expr);

    protected abstract E constructCall(Expr.Call expr, E callee, List<E> arguments);

    protected abstract E constructBinOp(Expr.BinOp expr, E lhs, E rhs);

    protected abstract E constructUnaryOp(Expr.UnaryOp expr, E operand);

    protected abstract E constructBoolOp(Expr.BoolOp expr, List<E> operands);

    protected abstract E constructCompare(Expr.Compare expr, E lhs, List<E> comparators);

    protected abstract E constructSubscript(Expr.Subscript expr, E source, S slice);

    protected abstract E constructTuple(Expr.Tuple expr, List<E> items);

    protected abstract E constructStarred(Expr.Starred expr, E operand);

    protected abstract E constructLambda(Expr.Lambda expr, E body);

    protected abstract S constructIndex(Slice.Index slice, E index);

    protected abstract S constructRange(Slice.Range slice, E lower, E upper, E step);

    protected abstract S constructExtended(Slice.Extended slice, List<S> dimensions);
}
