package io.github.eutro.bil2ir.util;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.function.BiFunction;

/**
 * Whole-tree operations over {@link TreeNode}s.
 * <p>
 * None of these recurse on the Java stack, so they are safe on trees nested
 * arbitrarily deep, such as long concatenation chains from lifted code.
 */
public class Trees {
    /**
     * Fold a tree bottom-up.
     * <p>
     * {@code f} is called once for each node, after it has been called for all of that
     * node's children, with the results for those children in order.
     *
     * @param root The root of the tree.
     * @param f    The function to fold with.
     * @param <T>  The type of nodes.
     * @param <R>  The type of the result.
     * @return The result of {@code f} for the root.
     */
    public static <T extends TreeNode<T>, R> R fold(T root, BiFunction<? super T, List<R>, R> f) {
        List<R> results = new ArrayList<>();
        for (T node : TreeWalker.of(root).postOrder()) {
            int arity = node.children().size();
            List<R> tail = results.subList(results.size() - arity, results.size());
            R result = f.apply(node, new ArrayList<>(tail));
            tail.clear();
            results.add(result);
        }
        return results.get(0);
    }

    /**
     * Check two trees for structural equality.
     *
     * @param a   The first tree.
     * @param b   The second tree.
     * @param <T> The type of nodes.
     * @return Whether every pair of corresponding nodes is {@link TreeNode#shallowEquals(TreeNode) shallowly equal}.
     */
    public static <T extends TreeNode<T>> boolean equal(@Nullable T a, @Nullable T b) {
        List<T> lhs = new ArrayList<>();
        List<T> rhs = new ArrayList<>();
        lhs.add(a);
        rhs.add(b);
        while (!lhs.isEmpty()) {
            T x = lhs.remove(lhs.size() - 1);
            T y = rhs.remove(rhs.size() - 1);
            if (x == y) continue;
            if (x == null || y == null) return false;
            if (!x.shallowEquals(y)) return false;
            List<T> xs = x.children();
            List<T> ys = y.children();
            if (xs.size() != ys.size()) return false;
            lhs.addAll(xs);
            rhs.addAll(ys);
        }
        return true;
    }

    /**
     * Hash a tree, consistently with {@link #equal(TreeNode, TreeNode)}.
     *
     * @param root The root of the tree.
     * @param <T>  The type of nodes.
     * @return The hash.
     */
    public static <T extends TreeNode<T>> int hash(T root) {
        return Trees.<T, Integer>fold(root, (node, childHashes) -> {
            int h = node.shallowHashCode();
            for (int childHash : childHashes) {
                h = 31 * h + childHash;
            }
            return h;
        });
    }

    /**
     * Render a tree from the {@link TreeNode#appendParts(List) parts} of its nodes.
     *
     * @param root The root of the tree.
     * @param <T>  The type of nodes.
     * @return The rendered string.
     */
    public static <T extends TreeNode<T>> String print(T root) {
        StringBuilder sb = new StringBuilder();
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(root);
        List<Object> parts = new ArrayList<>();
        while (!stack.isEmpty()) {
            Object top = stack.pop();
            if (top instanceof TreeNode) {
                parts.clear();
                ((TreeNode<?>) top).appendParts(parts);
                ListIterator<Object> li = parts.listIterator(parts.size());
                while (li.hasPrevious()) {
                    Object part = li.previous();
                    stack.push(part == null ? "null" : part);
                }
            } else {
                sb.append(top);
            }
        }
        return sb.toString();
    }
}
