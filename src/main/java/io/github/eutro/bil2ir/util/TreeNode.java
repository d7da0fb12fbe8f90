package io.github.eutro.bil2ir.util;

import java.util.List;

/**
 * A node of an expression tree, exposing just enough of its shape for
 * the whole-tree operations in {@link Trees} to be performed without recursion.
 *
 * @param <T> The type of nodes in the tree.
 */
public interface TreeNode<T extends TreeNode<T>> {
    /**
     * Get the direct children of this node, in declaration order.
     * <p>
     * The returned list is a fresh view; modifying it does not modify the node.
     *
     * @return The children.
     */
    List<T> children();

    /**
     * Compare this node to another, ignoring children.
     *
     * @param other The other node.
     * @return Whether the two nodes are of the same variant and have equal non-child attributes.
     */
    boolean shallowEquals(T other);

    /**
     * Hash the non-child attributes of this node, consistent with {@link #shallowEquals(TreeNode)}.
     *
     * @return The hash.
     */
    int shallowHashCode();

    /**
     * Describe this node for printing, as a sequence of {@link String}s and child nodes.
     *
     * @param parts The list to append the parts to.
     */
    void appendParts(List<Object> parts);
}
