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

import java.util.List;

import puresmt.core.PureFile;
import puresmt.core.PureFile.Expr;
import puresmt.core.PureFile.Slice;

/**
 * Rebuilds an expression tree bottom-up. A node is only reconstructed when at
 * least one of its children was changed, so an untouched subtree is returned
 * as is. Subclasses override the <code>construct</code> or <code>visit</code>
 * methods for the nodes they wish to change.
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr, Slice> {

    @Override
    protected Expr constructName(Expr.Name expr) {
        return expr;
    }

    @Override
    protected Expr constructNumber(Expr.Number expr) {
        return expr;
    }

    @Override
    protected Expr constructConstant(Expr.Constant expr) {
        return expr;
    }

    @Override
    protected Expr constructCall(Expr.Call expr, Expr callee, List<Expr> arguments) {
        if (expr.getCallee() == callee && equals(expr.getArguments(), arguments)) {
            return expr;
        } else {
            return PureFile.CALL(callee, arguments, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructBinOp(Expr.BinOp expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return PureFile.BINOP(expr.getOperator(), lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructUnaryOp(Expr.UnaryOp expr, Expr operand) {
        if (expr.getOperand() == operand) {
            return expr;
        } else {
            return PureFile.UNARYOP(expr.getOperator(), operand, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructBoolOp(Expr.BoolOp expr, List<Expr> operands) {
        if (equals(expr.getOperands(), operands)) {
            return expr;
        } else {
            return PureFile.BOOLOP(expr.getOperator(), operands, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructCompare(Expr.Compare expr, Expr lhs, List<Expr> comparators) {
        if (expr.getLeftHandSide() == lhs && equals(expr.getComparators(), comparators)) {
            return expr;
        } else {
            return PureFile.COMPARE(lhs, expr.getOperators(), comparators, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructSubscript(Expr.Subscript expr, Expr source, Slice slice) {
        if (expr.getSource() == source && expr.getSlice() == slice) {
            return expr;
        } else {
            return PureFile.SUBSCRIPT(source, slice, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructTuple(Expr.Tuple expr, List<Expr> items) {
        if (equals(expr.getItems(), items)) {
            return expr;
        } else {
            return PureFile.TUPLE(items, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructStarred(Expr.Starred expr, Expr operand) {
        if (expr.getOperand() == operand) {
            return expr;
        } else {
            return PureFile.STARRED(operand, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructLambda(Expr.Lambda expr, Expr body) {
        if (expr.getBody() == body) {
            return expr;
        } else {
            return PureFile.LAMBDA(expr.getParameters(), body, expr.getAttributes());
        }
    }

    @Override
    protected Slice constructIndex(Slice.Index slice, Expr index) {
        if (slice.getIndex() == index) {
            return slice;
        } else {
            return PureFile.INDEX(index, slice.getAttributes());
        }
    }

    @Override
    protected Slice constructRange(Slice.Range slice, Expr lower, Expr upper, Expr step) {
        if (slice.getLower() == lower && slice.getUpper() == upper && slice.getStep() == step) {
            return slice;
        } else {
            return PureFile.RANGE(lower, upper, step, slice.getAttributes());
        }
    }

    @Override
    protected Slice constructExtended(Slice.Extended slice, List<Slice> dimensions) {
        if (equals(slice.getDimensions(), dimensions)) {
            return slice;
        } else {
            return PureFile.EXTENDED(dimensions, slice.getAttributes());
        }
    }

    /**
     * Check whether two lists hold identical elements (by reference).
     */
    private static <T> boolean equals(List<? extends T> before, List<? extends T> after) {
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
