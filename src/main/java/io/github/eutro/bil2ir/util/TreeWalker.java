package io.github.eutro.bil2ir.util;

import java.util.*;

/**
 * Walks a tree of {@link TreeNode}s with an explicit stack, visiting children left to right.
 *
 * @param <T> The type of nodes in the tree.
 */
public class TreeWalker<T extends TreeNode<T>> {
    final T root;

    public TreeWalker(T root) {
        this.root = root;
    }

    public static <T extends TreeNode<T>> TreeWalker<T> of(T root) {
        return new TreeWalker<>(root);
    }

    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    public Order<T> preOrder() {
        return PreIter::new;
    }

    public Order<T> postOrder() {
        return PostIter::new;
    }

    private static <T> void pushReversed(Deque<? super T> stack, List<T> ts) {
        ListIterator<T> li = ts.listIterator(ts.size());
        while (li.hasPrevious()) {
            stack.push(li.previous());
        }
    }

    private class PreIter implements Iterator<T> {
        private final Deque<T> stack = new ArrayDeque<>();

        {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.pop();
            pushReversed(stack, top.children());
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        private final Object sentinel = new Object();
        private final Deque<Object> stack = new ArrayDeque<>();

        {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @SuppressWarnings("unchecked")
        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Object top = stack.peek();
                if (top == sentinel) {
                    stack.pop();
                    return (T) stack.pop();
                }
                stack.push(sentinel);
                pushReversed(stack, ((T) top).children());
            }
        }
    }
}
