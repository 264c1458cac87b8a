package structdb.engine.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory B+ tree from long keys to value lists. Leaves are chained for range scans;
 * several values under one key keep their insertion order.
 */
public class BPlusTree<V> {
    private final int order;              // max children per internal node
    private final int maxKeys;            // order - 1
    private final int medianKeyIndex;     // cached median index for splits
    private Node<V> root;
    private int size;                     // number of (key, value) pairs

    public BPlusTree(int order) {
        if (order < 3) {
            throw new IllegalArgumentException("B+ tree order must be >= 3 (got " + order + ")");
        }
        this.order = order;
        this.maxKeys = order - 1;
        this.medianKeyIndex = (order - 1) / 2;
        this.root = new Node<>(true);
    }

    public int getOrder() {
        return order;
    }

    public int size() {
        return size;
    }

    // Immutable list of values under key (may be empty)
    public List<V> search(long key) {
        Node<V> leaf = findLeaf(key);
        int pos = lowerBound(leaf.keys, key);
        if (pos < leaf.keys.size() && leaf.keys.get(pos) == key) {
            return List.copyOf(leaf.values.get(pos));
        }
        return Collections.emptyList();
    }

    /** Values whose key is in [lowInclusive, highInclusive], ascending by key. */
    public List<V> rangeSearch(long lowInclusive, long highInclusive) {
        List<V> result = new ArrayList<>();
        if (lowInclusive > highInclusive) return result;
        Node<V> leaf = findLeaf(lowInclusive);
        int pos = lowerBound(leaf.keys, lowInclusive);
        while (leaf != null) {
            for (int i = pos; i < leaf.keys.size(); i++) {
                if (leaf.keys.get(i) > highInclusive) return result;
                result.addAll(leaf.values.get(i));
            }
            leaf = leaf.next;
            pos = 0;
        }
        return result;
    }

    /** At most max distinct keys that are >= lowInclusive, ascending. */
    public List<Long> keysFrom(long lowInclusive, int max) {
        List<Long> keys = new ArrayList<>(Math.min(max, 256));
        Node<V> leaf = findLeaf(lowInclusive);
        int pos = lowerBound(leaf.keys, lowInclusive);
        while (leaf != null && keys.size() < max) {
            for (int i = pos; i < leaf.keys.size() && keys.size() < max; i++) {
                keys.add(leaf.keys.get(i));
            }
            leaf = leaf.next;
            pos = 0;
        }
        return keys;
    }

    /** Largest key in the tree, or null when empty. */
    public Long maxKey() {
        // deletes do not rebalance, so the rightmost leaf may be empty
        Long max = null;
        Node<V> leaf = findLeaf(Long.MIN_VALUE);
        while (leaf != null) {
            if (!leaf.keys.isEmpty()) max = leaf.keys.get(leaf.keys.size() - 1);
            leaf = leaf.next;
        }
        return max;
    }

    public void insert(long key, V value) {
        Node<V> r = root;
        if (r.keys.size() == maxKeys) {
            Node<V> newRoot = new Node<>(false);
            newRoot.children.add(r);
            splitChild(newRoot, 0, r);
            root = newRoot;
        }
        insertNonFull(root, key, value);
        size++;
    }

    /**
     * Delete one (key, value) pair. No rebalancing; a key goes away with its last value.
     * Returns true if removed.
     */
    public boolean delete(long key, V value) {
        Node<V> leaf = findLeaf(key);
        int pos = lowerBound(leaf.keys, key);
        if (pos >= leaf.keys.size() || leaf.keys.get(pos) != key) {
            return false;
        }
        List<V> vals = leaf.values.get(pos);
        if (!vals.remove(value)) return false;
        if (vals.isEmpty()) {
            leaf.keys.remove(pos);
            leaf.values.remove(pos);
        }
        if (!root.isLeaf && root.keys.isEmpty() && root.children.size() == 1) {
            root = root.children.get(0);
        }
        size--;
        return true;
    }

    /** Remove every value under key; returns how many were removed. */
    public int deleteKey(long key) {
        Node<V> leaf = findLeaf(key);
        int pos = lowerBound(leaf.keys, key);
        if (pos >= leaf.keys.size() || leaf.keys.get(pos) != key) {
            return 0;
        }
        int removed = leaf.values.get(pos).size();
        leaf.keys.remove(pos);
        leaf.values.remove(pos);
        size -= removed;
        return removed;
    }

    // first index with keys[i] >= key
    private static int lowerBound(List<Long> keys, long key) {
        int lo = 0, hi = keys.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (keys.get(mid) < key) lo = mid + 1; else hi = mid;
        }
        return lo;
    }

    // first index with keys[i] > key; equal keys route right
    private static int upperBound(List<Long> keys, long key) {
        int lo = 0, hi = keys.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (keys.get(mid) <= key) lo = mid + 1; else hi = mid;
        }
        return lo;
    }

    private Node<V> findLeaf(long key) {
        Node<V> current = root;
        while (!current.isLeaf) {
            current = current.children.get(upperBound(current.keys, key));
        }
        return current;
    }

    private void insertNonFull(Node<V> node, long key, V value) {
        if (node.isLeaf) {
            int pos = lowerBound(node.keys, key);
            if (pos < node.keys.size() && node.keys.get(pos) == key) {
                node.values.get(pos).add(value);
            } else {
                node.keys.add(pos, key);
                List<V> list = new ArrayList<>();
                list.add(value);
                node.values.add(pos, list);
            }
            return;
        }
        int pos = upperBound(node.keys, key);
        Node<V> child = node.children.get(pos);
        if (child.keys.size() == maxKeys) {
            splitChild(node, pos, child);
            if (key >= node.keys.get(pos)) {
                pos++;
            }
        }
        insertNonFull(node.children.get(pos), key, value);
    }

    private void splitChild(Node<V> parent, int index, Node<V> child) {
        if (child.isLeaf) {
            splitLeafChild(parent, index, child);
        } else {
            splitInternalChild(parent, index, child);
        }
    }

    // Left keeps ceil(n/2) entries; first key of the right sibling is promoted
    private void splitLeafChild(Node<V> parent, int index, Node<V> leaf) {
        int total = leaf.keys.size();
        int leftSize = (total + 1) / 2;
        Node<V> sibling = new Node<>(true);

        List<Long> tailKeys = leaf.keys.subList(leftSize, total);
        List<List<V>> tailVals = leaf.values.subList(leftSize, total);
        sibling.keys.addAll(tailKeys);
        sibling.values.addAll(tailVals);
        tailKeys.clear();
        tailVals.clear();

        sibling.next = leaf.next;
        leaf.next = sibling;

        parent.keys.add(index, sibling.keys.get(0));
        parent.children.add(index + 1, sibling);
    }

    // Median key moves up; left keeps keys < median, right keeps keys > median
    private void splitInternalChild(Node<V> parent, int index, Node<V> internal) {
        int mid = medianKeyIndex;
        long medianKey = internal.keys.get(mid);
        Node<V> sibling = new Node<>(false);

        List<Long> rightKeys = internal.keys.subList(mid + 1, internal.keys.size());
        List<Node<V>> rightChildren = internal.children.subList(mid + 1, internal.children.size());
        sibling.keys.addAll(rightKeys);
        sibling.children.addAll(rightChildren);
        rightChildren.clear();
        internal.keys.subList(mid, internal.keys.size()).clear();

        parent.keys.add(index, medianKey);
        parent.children.add(index + 1, sibling);
    }

    private static final class Node<V> {
        final boolean isLeaf;
        final List<Long> keys = new ArrayList<>();
        final List<Node<V>> children;    // internal nodes only
        final List<List<V>> values;      // leaf nodes only
        Node<V> next;                    // leaf chain

        Node(boolean isLeaf) {
            this.isLeaf = isLeaf;
            this.children = isLeaf ? null : new ArrayList<>();
            this.values = isLeaf ? new ArrayList<>() : null;
        }
    }
}
