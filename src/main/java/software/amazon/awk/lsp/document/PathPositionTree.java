/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.eclipse.lsp4j.Position;
import software.amazon.awk.lsp.protocol.LspAdapter;

/**
 * Records where nested structures, identified by a path of segment names,
 * start and end in a document, so the structure enclosing a position can be
 * found with a binary search at each level.
 *
 * <p>All nodes live in one list and refer to each other by index. Children of
 * a node are kept in the order they were created, which is text order since
 * the parser creates them left to right. When a path segment occurs more than
 * once under the same parent, the most recently created node is the one paths
 * resolve to.
 */
public final class PathPositionTree {
    private static final int ROOT = 0;

    private final List<Node> nodes = new ArrayList<>();

    public PathPositionTree() {
        clear();
    }

    /**
     * A structure in the document.
     */
    public static final class Node {
        private final String segment;
        private final int parent;
        private final Position start;
        private Position valueStart;
        private Position end;
        private final List<Integer> children = new ArrayList<>();

        private Node(String segment, int parent, Position start) {
            this.segment = segment;
            this.parent = parent;
            this.start = start;
        }

        public String segment() {
            return segment;
        }

        /**
         * @return The position right after the structure's opening token
         */
        public Position start() {
            return start;
        }

        /**
         * @return Where embedded content starts, or {@code null} if the node
         *  has none
         */
        public Position valueStart() {
            return valueStart;
        }

        /**
         * @return Where the structure ends, or {@code null} if not yet known
         */
        public Position end() {
            return end;
        }

        private boolean contains(Position position) {
            return LspAdapter.compare(start, position) <= 0
                   && (end == null || LspAdapter.compare(position, end) <= 0);
        }
    }

    /**
     * Removes every node.
     */
    public void clear() {
        nodes.clear();
        nodes.add(new Node("", -1, new Position(0, 0)));
    }

    /**
     * @return Whether no structures have been recorded
     */
    public boolean isEmpty() {
        return nodes.get(ROOT).children.isEmpty();
    }

    /**
     * @return The number of recorded structures
     */
    public int size() {
        return nodes.size() - 1;
    }

    /**
     * Creates a node for the last segment of {@code path}. Missing ancestors
     * are created starting at the same position.
     *
     * @param path Segments leading to the new node
     * @param start The position right after the opening token
     * @return The new node
     */
    public Node begin(List<String> path, Position start) {
        int parent = ROOT;
        for (int i = 0; i < path.size() - 1; i++) {
            int child = lastChild(parent, path.get(i));
            parent = child < 0 ? append(parent, path.get(i), start) : child;
        }
        return nodes.get(append(parent, path.get(path.size() - 1), start));
    }

    /**
     * Like {@link #begin}, also marking {@code start} as where the node's
     * embedded content begins.
     *
     * @param path Segments leading to the new node
     * @param start The position where the embedded content starts
     * @return The new node
     */
    public Node beginEmbedding(List<String> path, Position start) {
        Node node = begin(path, start);
        node.valueStart = start;
        return node;
    }

    /**
     * Sets the end of the node at {@code path}, unless it already has one.
     *
     * @param path Segments leading to the node
     * @param end The end position
     */
    public void end(List<String> path, Position end) {
        find(path).ifPresent(node -> {
            if (node.end == null) {
                node.end = end;
            }
        });
    }

    /**
     * Sets the end of the embedded content of the node at {@code path}. The
     * first end recorded for a node is kept.
     *
     * @param path Segments leading to the node
     * @param end The end position
     */
    public void endEmbedding(List<String> path, Position end) {
        end(path, end);
    }

    /**
     * Gives every node that was never ended the end of the document.
     *
     * @param documentEnd The end of the document
     */
    public void finish(Position documentEnd) {
        for (int i = 1; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node.end == null) {
                node.end = documentEnd;
            }
        }
    }

    /**
     * @param path Segments leading to the node
     * @return The most recently created node at {@code path}, if any
     */
    public Optional<Node> find(List<String> path) {
        int current = ROOT;
        for (String segment : path) {
            current = lastChild(current, segment);
            if (current < 0) {
                return Optional.empty();
            }
        }
        return current == ROOT ? Optional.empty() : Optional.of(nodes.get(current));
    }

    /**
     * @param position The position to look up
     * @return The path of the innermost structure containing {@code position},
     *  empty if none does
     */
    public List<String> pathAt(Position position) {
        List<String> path = new ArrayList<>();
        int current = ROOT;
        while (true) {
            int child = childContaining(current, position);
            if (child < 0) {
                return Collections.unmodifiableList(path);
            }
            path.add(nodes.get(child).segment);
            current = child;
        }
    }

    /**
     * @param position The position to look up
     * @return The innermost node containing {@code position}, if any
     */
    public Optional<Node> nodeAt(Position position) {
        int current = ROOT;
        int child = childContaining(current, position);
        while (child >= 0) {
            current = child;
            child = childContaining(current, position);
        }
        return current == ROOT ? Optional.empty() : Optional.of(nodes.get(current));
    }

    /**
     * @param node A node of this tree
     * @return The path leading to {@code node}
     */
    public List<String> pathOf(Node node) {
        List<String> path = new ArrayList<>();
        Node current = node;
        while (current.parent >= 0) {
            path.add(0, current.segment);
            current = nodes.get(current.parent);
        }
        return path;
    }

    private int append(int parent, String segment, Position start) {
        nodes.add(new Node(segment, parent, start));
        int index = nodes.size() - 1;
        nodes.get(parent).children.add(index);
        return index;
    }

    private int lastChild(int parent, String segment) {
        List<Integer> children = nodes.get(parent).children;
        for (int i = children.size() - 1; i >= 0; i--) {
            if (nodes.get(children.get(i)).segment.equals(segment)) {
                return children.get(i);
            }
        }
        return -1;
    }

    private int childContaining(int parent, Position position) {
        List<Integer> children = nodes.get(parent).children;
        int low = 0;
        int high = children.size() - 1;
        // Rightmost child starting at or before the position.
        int candidate = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (LspAdapter.compare(nodes.get(children.get(mid)).start, position) <= 0) {
                candidate = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        if (candidate < 0) {
            return -1;
        }
        int index = children.get(candidate);
        return nodes.get(index).contains(position) ? index : -1;
    }
}
