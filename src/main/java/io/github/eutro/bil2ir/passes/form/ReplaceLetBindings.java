package io.github.eutro.bil2ir.passes.form;

import io.github.eutro.bil2ir.bil.Expression;
import io.github.eutro.bil2ir.bil.Variable;
import io.github.eutro.bil2ir.passes.IRPass;

import java.util.*;
import java.util.logging.Logger;

/**
 * A pass which resolves every {@link Expression.Let} in an expression, producing
 * an equivalent expression without any.
 * <p>
 * Bindings are lexically scoped: a {@link Expression.Var} refers to the innermost
 * enclosing {@link Expression.Let} of an equal {@link Variable}, and is replaced by
 * a fresh copy of that binding's (already let-free) bound expression. Variables
 * with no enclosing binding are left as they are.
 * <p>
 * The input is not modified; the result shares no nodes with it.
 */
public class ReplaceLetBindings implements IRPass<Expression, Expression> {
    /**
     * An instance of this pass.
     */
    public static final ReplaceLetBindings INSTANCE = new ReplaceLetBindings();

    private static final Logger LOGGER = Logger.getLogger(ReplaceLetBindings.class.getName());

    private static final class Frame {
        final Expression node;
        final List<Expression> children;
        final List<Expression> done = new ArrayList<>();

        Frame(Expression node) {
            this.node = node;
            this.children = node.children();
        }
    }

    @Override
    public Expression run(Expression expr) {
        Map<Variable, Deque<Expression>> scope = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(expr));
        int replaced = 0;
        while (true) {
            Frame top = stack.peek();
            int next = top.done.size();
            if (next < top.children.size()) {
                if (next == 1 && top.node instanceof Expression.Let) {
                    // bound expression is done, enter the body
                    scope.computeIfAbsent(((Expression.Let) top.node).var, $ -> new ArrayDeque<>())
                            .push(top.done.get(0));
                }
                stack.push(new Frame(top.children.get(next)));
                continue;
            }

            stack.pop();
            Expression result;
            if (top.node instanceof Expression.Let) {
                Variable var = ((Expression.Let) top.node).var;
                Deque<Expression> bindings = scope.get(var);
                bindings.pop();
                if (bindings.isEmpty()) scope.remove(var);
                result = top.done.get(1);
                replaced++;
            } else if (top.node instanceof Expression.Var) {
                Deque<Expression> bindings = scope.get(((Expression.Var) top.node).variable);
                result = bindings == null
                        ? top.node.rebuild(top.done)
                        : bindings.peek().copy();
            } else {
                result = top.node.rebuild(top.done);
            }

            if (stack.isEmpty()) {
                int count = replaced;
                LOGGER.fine(() -> "replaced " + count + " let-bindings");
                return result;
            }
            stack.peek().done.add(result);
        }
    }

    @Override
    public String toString() {
        return "replace-let-bindings";
    }
}
