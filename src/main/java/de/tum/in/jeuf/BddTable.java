/*
 * This file is part of JEUF.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JEUF is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JEUF is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JEUF. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jeuf;

import static de.tum.in.jeuf.Util.checkState;

import java.util.Arrays;
import java.util.BitSet;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;

/* Implementation notes:
 * - Reduced ordered BDD without garbage collection: the table only lives as long as one oracle
 *   session, so nodes are never freed.
 * - Variable numbers increase while descending the tree of a particular node.
 * - Nodes are hash-consed through chained buckets, results of operations are stored in a
 *   direct-mapped cache which is invalidated whenever the table grows.
 */
@SuppressWarnings({"PMD.AvoidReassigningParameters", "AssignmentToMethodParameter"})
final class BddTable {
    private static final Logger logger = Logger.getLogger(BddTable.class.getName());

    static final int TRUE_NODE = -1;
    static final int FALSE_NODE = -2;

    // Use 0 as "not a node" to make re-allocations slightly more efficient
    private static final int NOT_A_NODE = 0;
    private static final int FIRST_NODE = 1;

    private static final int OPERATION_AND = 1;
    private static final int OPERATION_OR = 2;
    private static final int OPERATION_XOR = 3;
    private static final int OPERATION_NOT = 4;
    private static final int CACHE_ENTRY_SIZE = 4;
    private static final int CACHE_DIVIDER = 4;
    private static final int HASH_PRIME = 0x1000193;

    private final double growthFactor;
    private final int maximumNodes;

    private int numberOfVariables = 0;
    private int[] variableNodes = new int[32];

    /* Variable of each node, low and high successors at 2 * node and 2 * node + 1 */
    private int[] variables;
    private int[] tree;
    private int[] hashToChainStart;
    private int[] hashChain;
    /* Next unused node, all nodes below are valid */
    private int nextFreeNode = FIRST_NODE;

    /* Entries of (operation, first, second, result) */
    private int[] cache;

    // Statistics
    private long createdNodes = 0;
    private long cacheLookups = 0;
    private long cacheHits = 0;
    private long growCount = 0;

    BddTable(int initialSize, double growthFactor, int maximumNodes) {
        checkState(growthFactor > 1.0d, "Invalid growth factor %f", growthFactor);
        this.growthFactor = growthFactor;
        this.maximumNodes = maximumNodes;
        int tableSize = Math.max(initialSize, 16);
        variables = new int[tableSize];
        tree = new int[2 * tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
        cache = new int[CACHE_ENTRY_SIZE * Math.max(tableSize / CACHE_DIVIDER, 1)];
    }

    private int tableSize() {
        return variables.length;
    }

    // Nodes

    boolean isLeaf(int node) {
        return node < 0;
    }

    int variableOf(int node) {
        return isLeaf(node) ? -1 : variables[node];
    }

    int low(int node) {
        assert FIRST_NODE <= node && node < nextFreeNode;
        return tree[2 * node];
    }

    int high(int node) {
        assert FIRST_NODE <= node && node < nextFreeNode;
        return tree[2 * node + 1];
    }

    int nodeCount() {
        return nextFreeNode - FIRST_NODE;
    }

    int numberOfVariables() {
        return numberOfVariables;
    }

    int variableNode(int variable) {
        if (variable < 0 || variable >= numberOfVariables) {
            throw new IllegalArgumentException("Unknown variable " + variable);
        }
        return variableNodes[variable];
    }

    int createVariable() {
        int node = makeNode(numberOfVariables, FALSE_NODE, TRUE_NODE);
        if (numberOfVariables == variableNodes.length) {
            variableNodes = Arrays.copyOf(variableNodes, variableNodes.length * 2);
        }
        variableNodes[numberOfVariables] = node;
        numberOfVariables++;
        return node;
    }

    private int makeNode(int variable, int low, int high) {
        assert isLeaf(low) || variable < variableOf(low);
        assert isLeaf(high) || variable < variableOf(high);

        if (low == high) {
            return low;
        }

        int bucket = Math.floorMod(nodeHash(variable, low, high), tableSize());
        int current = hashToChainStart[bucket];
        while (current != NOT_A_NODE) {
            if (variables[current] == variable && tree[2 * current] == low && tree[2 * current + 1] == high) {
                return current;
            }
            current = hashChain[current];
        }

        if (nextFreeNode == tableSize()) {
            grow();
            bucket = Math.floorMod(nodeHash(variable, low, high), tableSize());
        }
        createdNodes += 1;
        int node = nextFreeNode;
        nextFreeNode += 1;
        variables[node] = variable;
        tree[2 * node] = low;
        tree[2 * node + 1] = high;
        hashChain[node] = hashToChainStart[bucket];
        hashToChainStart[bucket] = node;
        return node;
    }

    private static int nodeHash(int variable, int low, int high) {
        return variable + low + high;
    }

    private void grow() {
        int oldSize = tableSize();
        if (oldSize >= maximumNodes) {
            throw new NodeLimitExceededException(maximumNodes);
        }
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = Math.min(maximumNodes, (int) Math.ceil(oldSize * growthFactor));
        growCount += 1;
        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        variables = Arrays.copyOf(variables, newSize);
        tree = Arrays.copyOf(tree, 2 * newSize);
        hashChain = new int[newSize];
        hashToChainStart = new int[newSize];
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            int bucket = Math.floorMod(nodeHash(variables[node], tree[2 * node], tree[2 * node + 1]), newSize);
            hashChain[node] = hashToChainStart[bucket];
            hashToChainStart[bucket] = node;
        }
        cache = new int[CACHE_ENTRY_SIZE * Math.max(newSize / CACHE_DIVIDER, 1)];
    }

    // Cache

    private int cacheIndex(int operation, int first, int second) {
        int entries = cache.length / CACHE_ENTRY_SIZE;
        return CACHE_ENTRY_SIZE * Math.floorMod(HASH_PRIME * operation + first + 31 * second, entries);
    }

    private int cacheLookup(int index, int operation, int first, int second) {
        cacheLookups += 1;
        int[] cache = this.cache;
        if (cache[index] == operation && cache[index + 1] == first && cache[index + 2] == second) {
            cacheHits += 1;
            return cache[index + 3];
        }
        return NOT_A_NODE;
    }

    private void cachePut(int operation, int first, int second, int result) {
        // The table may have grown in the meantime, so the index is recomputed
        int index = cacheIndex(operation, first, second);
        cache[index] = operation;
        cache[index + 1] = first;
        cache[index + 2] = second;
        cache[index + 3] = result;
    }

    // Operations

    int not(int node) {
        if (node == TRUE_NODE) {
            return FALSE_NODE;
        }
        if (node == FALSE_NODE) {
            return TRUE_NODE;
        }
        int cached = cacheLookup(cacheIndex(OPERATION_NOT, node, NOT_A_NODE), OPERATION_NOT, node, NOT_A_NODE);
        if (cached != NOT_A_NODE) {
            return cached;
        }
        int low = not(low(node));
        int high = not(high(node));
        int result = makeNode(variables[node], low, high);
        cachePut(OPERATION_NOT, node, NOT_A_NODE, result);
        return result;
    }

    int and(int node1, int node2) {
        return apply(OPERATION_AND, node1, node2);
    }

    int or(int node1, int node2) {
        return apply(OPERATION_OR, node1, node2);
    }

    int xor(int node1, int node2) {
        return apply(OPERATION_XOR, node1, node2);
    }

    int implication(int node1, int node2) {
        return or(not(node1), node2);
    }

    int equivalence(int node1, int node2) {
        return not(xor(node1, node2));
    }

    private int terminalCase(int operation, int node1, int node2) {
        switch (operation) {
            case OPERATION_AND:
                if (node1 == node2 || node2 == TRUE_NODE) {
                    return node1;
                }
                if (node1 == FALSE_NODE || node2 == FALSE_NODE) {
                    return FALSE_NODE;
                }
                if (node1 == TRUE_NODE) {
                    return node2;
                }
                return NOT_A_NODE;
            case OPERATION_OR:
                if (node1 == node2 || node2 == FALSE_NODE) {
                    return node1;
                }
                if (node1 == TRUE_NODE || node2 == TRUE_NODE) {
                    return TRUE_NODE;
                }
                if (node1 == FALSE_NODE) {
                    return node2;
                }
                return NOT_A_NODE;
            case OPERATION_XOR:
                if (node1 == node2) {
                    return FALSE_NODE;
                }
                if (node1 == FALSE_NODE) {
                    return node2;
                }
                if (node2 == FALSE_NODE) {
                    return node1;
                }
                if (node1 == TRUE_NODE) {
                    return not(node2);
                }
                if (node2 == TRUE_NODE) {
                    return not(node1);
                }
                return NOT_A_NODE;
            default:
                throw new AssertionError(operation);
        }
    }

    private int apply(int operation, int node1, int node2) {
        int terminal = terminalCase(operation, node1, node2);
        if (terminal != NOT_A_NODE) {
            return terminal;
        }

        // All operations are commutative
        if (node2 < node1) {
            int swap = node1;
            node1 = node2;
            node2 = swap;
        }
        int cached = cacheLookup(cacheIndex(operation, node1, node2), operation, node1, node2);
        if (cached != NOT_A_NODE) {
            return cached;
        }

        int variable1 = variables[node1];
        int variable2 = variables[node2];
        int result;
        if (variable1 == variable2) {
            int low = apply(operation, low(node1), low(node2));
            int high = apply(operation, high(node1), high(node2));
            result = makeNode(variable1, low, high);
        } else if (variable1 < variable2) {
            int low = apply(operation, low(node1), node2);
            int high = apply(operation, high(node1), node2);
            result = makeNode(variable1, low, high);
        } else {
            int low = apply(operation, node1, low(node2));
            int high = apply(operation, node1, high(node2));
            result = makeNode(variable2, low, high);
        }
        cachePut(operation, node1, node2, result);
        return result;
    }

    // Solutions

    boolean evaluate(int node, BitSet assignment) {
        int current = node;
        while (!isLeaf(current)) {
            current = assignment.get(variables[current]) ? high(current) : low(current);
        }
        return current == TRUE_NODE;
    }

    /**
     * Returns any satisfying assignment, variables not on the chosen path are false.
     *
     * @throws NoSuchElementException if {@code node} is {@literal false}.
     */
    BitSet getSatisfyingAssignment(int node) {
        if (node == FALSE_NODE) {
            throw new NoSuchElementException("False has no solution");
        }

        BitSet path = new BitSet(numberOfVariables);
        int currentNode = node;
        while (currentNode != TRUE_NODE) {
            int lowNode = low(currentNode);
            if (lowNode == FALSE_NODE) {
                path.set(variables[currentNode]);
                currentNode = high(currentNode);
            } else {
                currentNode = lowNode;
            }
        }
        return path;
    }

    // Statistics and Formatting

    String statistics() {
        return String.format(
                "Node table: %d variables, %d nodes, size %d, grown %d times, %d created%n"
                        + "Cache: %d lookups, %d hits",
                numberOfVariables, nodeCount(), tableSize(), growCount, createdNodes, cacheLookups, cacheHits);
    }

    @Override
    public String toString() {
        return String.format("BDD@%d(%d)", tableSize(), System.identityHashCode(this));
    }

    static final class NodeLimitExceededException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        NodeLimitExceededException(int limit) {
            super("Node table exceeds its limit of " + limit + " nodes");
        }
    }
}
