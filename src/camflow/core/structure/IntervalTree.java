package camflow.core.structure;

import java.util.ArrayList;
import java.util.List;

/**
 * Interval tree over half-open time ranges [start, end), keyed by start and augmented
 * with the largest end in each subtree. Answers "what is active at time t" without
 * scanning every entry.
 *
 * <p>Not synchronized; owners build it once and only read it afterwards.</p>
 *
 * @param <T> payload stored with each interval
 */
public class IntervalTree<T> {

    private class Node {
        long start;
        long end;
        long maxEnd;
        T data;
        Node left;
        Node right;

        Node(long start, long end, T data) {
            this.start = start;
            this.end = end;
            this.maxEnd = end;
            this.data = data;
        }
    }

    private Node root;
    private int size;

    public void add(long start, long end, T data) {
        root = insert(root, start, end, data);
        size++;
    }

    public int size() {
        return size;
    }

    /** All payloads whose interval contains {@code point}: start <= point < end. */
    public List<T> query(long point) {
        List<T> result = new ArrayList<>();
        query(root, point, result);
        return result;
    }

    private void query(Node node, long point, List<T> result) {
        if (node == null) return;
        // Nothing below ends after the point
        if (point >= node.maxEnd) return;

        query(node.left, point, result);

        if (node.start <= point && point < node.end) {
            result.add(node.data);
        }

        // Right subtree starts at or after node.start
        if (point >= node.start) {
            query(node.right, point, result);
        }
    }

    // Equal starts go right; no rebalancing, effect lists are built in time order but are small
    private Node insert(Node node, long start, long end, T data) {
        if (node == null) return new Node(start, end, data);

        if (start < node.start) {
            node.left = insert(node.left, start, end, data);
        } else {
            node.right = insert(node.right, start, end, data);
        }
        updateMaxEnd(node);
        return node;
    }

    private void updateMaxEnd(Node node) {
        long max = node.end;
        if (node.left != null) max = Math.max(max, node.left.maxEnd);
        if (node.right != null) max = Math.max(max, node.right.maxEnd);
        node.maxEnd = max;
    }
}
