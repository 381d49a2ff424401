package nl.bytesoflife.deltatokn.connectivity;

import java.util.Arrays;

/**
 * Disjoint sets over the ints {@code 0..n-1}, growing on demand.
 */
final class UnionFind {

    private int[] parent = new int[16];
    private int size = 0;

    void ensure(int element) {
        if (element >= parent.length) {
            int old = parent.length;
            parent = Arrays.copyOf(parent, Math.max(old * 2, element + 1));
        }
        while (size <= element) {
            parent[size] = size;
            size++;
        }
    }

    int find(int element) {
        int root = element;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[element] != root) {
            int next = parent[element];
            parent[element] = root;
            element = next;
        }
        return root;
    }

    void union(int a, int b) {
        ensure(Math.max(a, b));
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) return;
        // The smaller root survives so set ids follow discovery order
        if (rootA < rootB) {
            parent[rootB] = rootA;
        } else {
            parent[rootA] = rootB;
        }
    }
}
