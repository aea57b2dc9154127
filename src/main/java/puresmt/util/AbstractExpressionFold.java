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

import java.util.Arrays;
import java.util.List;

import puresmt.core.PureFile.Expr;
import puresmt.core.PureFile.Slice;

/**
 * Folds an expression tree into a single summary value, combining the results
 * for child nodes with <code>join</code>. Leaves yield <code>BOTTOM()</code>
 * unless overridden.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E, E> {

    @Override
    protected E constructName(Expr.Name expr) {
        return BOTTOM();
    }

    @Override
    protected E constructNumber(Expr.Number expr) {
        return BOTTOM();
    }

    @Override
    protected E constructConstant(Expr.Constant expr) {
        return BOTTOM();
    }

    @Override
    protected E constructCall(Expr.Call expr, E callee, List<E> arguments) {
        return join(callee, join(arguments));
    }

    @Override
    protected E constructBinOp(Expr.BinOp expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructUnaryOp(Expr.UnaryOp expr, E operand) {
        return operand;
    }

    @Override
    protected E constructBoolOp(Expr.BoolOp expr, List<E> operands) {
        return join(operands);
    }

    @Override
    protected E constructCompare(Expr.Compare expr, E lhs, List<E> comparators) {
        return join(lhs, join(comparators));
    }

    @Override
    protected E constructSubscript(Expr.Subscript expr, E source, E slice) {
        return join(source, slice);
    }

    @Override
    protected E constructTuple(Expr.Tuple expr, List<E> items) {
        return join(items);
    }

    @Override
    protected E constructStarred(Expr.Starred expr, E operand) {
        return operand;
    }

    @Override
    protected E constructLambda(Expr.Lambda expr, E body) {
        return body;
    }

    @Override
    protected E constructIndex(Slice.Index slice, E index) {
        return index;
    }

    @Override
    protected E constructRange(Slice.Range slice, E lower, E upper, E step) {
        E result = BOTTOM();
        for (E bound : Arrays.asList(lower, upper, step)) {
            if (bound != null) {
                result = join(result, bound);
            }
        }
        return result;
    }

    @Override
    protected E constructExtended(Slice.Extended slice, List<E> dimensions) {
        return join(dimensions);
    }

    private E join(List<E> items) {
        E result = BOTTOM();
        for (int i = 0; i != items.size(); ++i) {
            result = join(result, items.get(i));
        }
        return result;
    }

    public abstract E join(E lhs, E rhs);

    public abstract E BOTTOM();
}
