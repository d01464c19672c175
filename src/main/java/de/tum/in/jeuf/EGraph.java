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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Graph of terms annotated with an equivalence partition, used to compute the congruence closure
 * of a set of equalities.
 *
 * <p>Each distinct term is represented by a node, identified by a small integer. Nodes are stored
 * in an arena of parallel arrays and are never removed. Equivalence classes are tracked by a
 * union-find structure with path compression. Each class representative additionally owns the
 * parent list and the (circular) member list of its class.</p>
 *
 * <p>After each completed {@link #merge(int, int)}, the partition is closed under congruence: two
 * applications of the same symbol whose arguments are pairwise equivalent are equivalent.
 * Congruence propagation is either done by recursive merge calls or, if the graph is
 * <i>iterative</i>, by an explicit work list of pending pairs. Both yield the same partition.</p>
 *
 * <p>Instances are not thread safe.</p>
 */
@SuppressWarnings({"PMD.TooManyFields", "PMD.AvoidReassigningParameters", "AssignmentToMethodParameter"})
public final class EGraph {
    private static final Logger logger = Logger.getLogger(EGraph.class.getName());
    private static final int[] EMPTY_INT_ARRAY = new int[0];
    private static final double GROWTH_FACTOR = 1.5d;

    private final boolean iterative;
    private final Map<Term, Integer> nodeIds;
    private final int nodeCount;

    /* Per node: represented term, argument nodes and parent nodes (applications using the node) */
    private final Term[] terms;
    private final int[][] children;
    private final int[][] parents;

    /* Union-find forest. A node is a representative iff find[node] == node. */
    private final int[] find;
    /* Circular linked list of all members of a class, joined on union */
    private final int[] nextMember;
    /* Only valid for representatives: size of the class and the parents of all its members */
    private final int[] classSize;
    private final int[][] classParents;
    private final int[] classParentCount;
    private int classCount;

    // Iterative work list of pending merges
    private int[] pendingLeft = EMPTY_INT_ARRAY;
    private int[] pendingRight = EMPTY_INT_ARRAY;

    // Statistics
    private long mergeCount = 0;
    private long unionCount = 0;
    private long congruenceChecks = 0;
    private long congruencesFound = 0;
    private long findSteps = 0;

    public EGraph(Collection<Term> terms) {
        this(terms, false);
    }

    /**
     * Creates a graph containing a node for each of the given {@code terms} and all their
     * subterms. Nodes are created in ascending order of depth, hence the arguments of a node always
     * have smaller identifiers than the node itself.
     *
     * @param terms The terms to be represented.
     * @param iterative Whether congruence propagation should use a work list instead of recursion.
     */
    public EGraph(Collection<Term> terms, boolean iterative) {
        this.iterative = iterative;

        Set<Term> closure = new LinkedHashSet<>();
        for (Term term : terms) {
            Term.collectSubterms(term, closure);
        }
        List<Term> sorted = new ArrayList<>(closure);
        // Stable, hence deterministic for a given input order
        sorted.sort(Comparator.comparingInt(Term::depth));

        nodeCount = sorted.size();
        nodeIds = new HashMap<>(nodeCount * 2);
        this.terms = new Term[nodeCount];
        children = new int[nodeCount][];
        parents = new int[nodeCount][];
        find = new int[nodeCount];
        nextMember = new int[nodeCount];
        classSize = new int[nodeCount];
        classParents = new int[nodeCount][];
        classParentCount = new int[nodeCount];
        classCount = nodeCount;

        int[] parentCount = new int[nodeCount];
        int[][] parentLists = new int[nodeCount][];
        for (int node = 0; node < nodeCount; node++) {
            Term term = sorted.get(node);
            ImmutableList<Term> arguments = term.arguments();
            int[] argumentNodes = arguments.isEmpty() ? EMPTY_INT_ARRAY : new int[arguments.size()];
            for (int i = 0; i < argumentNodes.length; i++) {
                Integer argumentNode = nodeIds.get(arguments.get(i));
                checkState(argumentNode != null, "Argument %s of %s created after its parent", arguments.get(i), term);
                argumentNodes[i] = argumentNode;
            }
            this.terms[node] = term;
            children[node] = argumentNodes;
            nodeIds.put(term, node);
            find[node] = node;
            nextMember[node] = node;
            classSize[node] = 1;
            parentLists[node] = EMPTY_INT_ARRAY;

            for (int i = 0; i < argumentNodes.length; i++) {
                int argumentNode = argumentNodes[i];
                if (isRepeatedArgument(argumentNodes, i)) {
                    continue;
                }
                int count = parentCount[argumentNode];
                parentLists[argumentNode] = Util.ensureCapacity(parentLists[argumentNode], count + 1, GROWTH_FACTOR);
                parentLists[argumentNode][count] = node;
                parentCount[argumentNode] = count + 1;
            }
        }
        for (int node = 0; node < nodeCount; node++) {
            parents[node] = Arrays.copyOf(parentLists[node], parentCount[node]);
            classParents[node] = parents[node].clone();
            classParentCount[node] = parents[node].length;
        }

        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "Created {0} with {1} nodes from {2} terms", new Object[] {
                this, nodeCount, terms.size()
            });
        }
    }

    private static boolean isRepeatedArgument(int[] argumentNodes, int index) {
        for (int j = 0; j < index; j++) {
            if (argumentNodes[j] == argumentNodes[index]) {
                return true;
            }
        }
        return false;
    }

    // Nodes

    public int nodeCount() {
        return nodeCount;
    }

    public int classCount() {
        return classCount;
    }

    public boolean isIterative() {
        return iterative;
    }

    public boolean contains(Term term) {
        return nodeIds.containsKey(term);
    }

    /**
     * Returns the identifier of the node representing {@code term}.
     *
     * @throws InvalidTermReferenceException if the term is not part of this graph.
     */
    public int node(Term term) {
        Integer node = nodeIds.get(term);
        if (node == null) {
            throw new InvalidTermReferenceException("Term " + term + " is not part of the graph");
        }
        return node;
    }

    public Term term(int node) {
        checkNode(node);
        return terms[node];
    }

    public int[] children(int node) {
        checkNode(node);
        return children[node].clone();
    }

    public int[] parents(int node) {
        checkNode(node);
        return parents[node].clone();
    }

    private void checkNode(int node) {
        if (node < 0 || node >= nodeCount) {
            throw new InvalidTermReferenceException("Node " + node + " is not part of the graph");
        }
    }

    // Union-find

    /**
     * Returns the representative of the class of {@code node}, compressing the path on the way.
     */
    public int find(int node) {
        checkNode(node);
        return findUnchecked(node);
    }

    private int findUnchecked(int node) {
        int[] find = this.find;
        int root = node;
        while (find[root] != root) {
            root = find[root];
            findSteps += 1;
        }
        while (find[node] != root) {
            int next = find[node];
            find[node] = root;
            node = next;
        }
        return root;
    }

    /**
     * Joins the classes of the two nodes, the representative of {@code node2} stays the
     * representative of the joined class. Does not propagate congruences, use
     * {@link #merge(int, int)} to maintain the closure.
     */
    public void union(int node1, int node2) {
        checkNode(node1);
        checkNode(node2);
        int root1 = findUnchecked(node1);
        int root2 = findUnchecked(node2);
        if (root1 != root2) {
            unionRoots(root1, root2);
        }
    }

    private void unionRoots(int root1, int root2) {
        assert find[root1] == root1 && find[root2] == root2 && root1 != root2;
        unionCount += 1;
        classCount -= 1;

        find[root1] = root2;
        classSize[root2] += classSize[root1];

        // Joining two circular lists by swapping the successors of one element from each
        int next1 = nextMember[root1];
        nextMember[root1] = nextMember[root2];
        nextMember[root2] = next1;

        int count1 = classParentCount[root1];
        if (count1 > 0) {
            int count2 = classParentCount[root2];
            int[] joined = Util.ensureCapacity(classParents[root2], count1 + count2, GROWTH_FACTOR);
            System.arraycopy(classParents[root1], 0, joined, count2, count1);
            classParents[root2] = joined;
            classParentCount[root2] = count1 + count2;
        }
        classParents[root1] = EMPTY_INT_ARRAY;
        classParentCount[root1] = 0;
    }

    // Congruence closure

    /**
     * Determines whether the two nodes are applications of the same function symbol with the same
     * arity and pairwise equivalent arguments.
     */
    public boolean congruent(int node1, int node2) {
        checkNode(node1);
        checkNode(node2);
        return congruentUnchecked(node1, node2);
    }

    private boolean congruentUnchecked(int node1, int node2) {
        congruenceChecks += 1;
        Term term1 = terms[node1];
        Term term2 = terms[node2];
        if (!term1.isApplication() || !term2.isApplication()) {
            return false;
        }
        int[] arguments1 = children[node1];
        int[] arguments2 = children[node2];
        if (arguments1.length != arguments2.length || !term1.name().equals(term2.name())) {
            return false;
        }
        for (int i = 0; i < arguments1.length; i++) {
            if (findUnchecked(arguments1[i]) != findUnchecked(arguments2[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Merges the classes of the two nodes and all classes which become congruent due to that. The
     * representative of {@code node2} is kept for the initial union.
     */
    public void merge(int node1, int node2) {
        checkNode(node1);
        checkNode(node2);
        if (iterative) {
            mergeIterative(node1, node2);
        } else {
            mergeRecursive(node1, node2);
        }
    }

    private int[] classParentSnapshot(int root) {
        return Arrays.copyOf(classParents[root], classParentCount[root]);
    }

    private void mergeRecursive(int node1, int node2) {
        int root1 = findUnchecked(node1);
        int root2 = findUnchecked(node2);
        if (root1 == root2) {
            return;
        }
        mergeCount += 1;
        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, "Merging {0} and {1}", new Object[] {terms[node1], terms[node2]});
        }

        int[] parents1 = classParentSnapshot(root1);
        int[] parents2 = classParentSnapshot(root2);
        unionRoots(root1, root2);

        for (int parent1 : parents1) {
            for (int parent2 : parents2) {
                if (findUnchecked(parent1) != findUnchecked(parent2) && congruentUnchecked(parent1, parent2)) {
                    congruencesFound += 1;
                    mergeRecursive(parent1, parent2);
                }
            }
        }
    }

    private void mergeIterative(int node1, int node2) {
        int stackIndex = 0;
        int left = node1;
        int right = node2;

        while (true) {
            int root1 = findUnchecked(left);
            int root2 = findUnchecked(right);
            if (root1 != root2) {
                mergeCount += 1;
                if (logger.isLoggable(Level.FINEST)) {
                    logger.log(Level.FINEST, "Merging {0} and {1}", new Object[] {terms[left], terms[right]});
                }

                int[] parents1 = classParentSnapshot(root1);
                int[] parents2 = classParentSnapshot(root2);
                unionRoots(root1, root2);

                for (int parent1 : parents1) {
                    for (int parent2 : parents2) {
                        if (findUnchecked(parent1) != findUnchecked(parent2)
                                && congruentUnchecked(parent1, parent2)) {
                            congruencesFound += 1;
                            if (stackIndex == pendingLeft.length) {
                                pendingLeft = Util.ensureCapacity(pendingLeft, stackIndex + 1, 2.0d);
                                pendingRight = Util.ensureCapacity(pendingRight, stackIndex + 1, 2.0d);
                            }
                            pendingLeft[stackIndex] = parent1;
                            pendingRight[stackIndex] = parent2;
                            stackIndex += 1;
                        }
                    }
                }
            }

            if (stackIndex == 0) {
                return;
            }
            stackIndex -= 1;
            left = pendingLeft[stackIndex];
            right = pendingRight[stackIndex];
        }
    }

    /**
     * Merges the two sides of each equation, in the given order.
     *
     * @throws InvalidTermReferenceException if some term is not part of this graph.
     */
    public void mergeEqualities(Collection<Equation> equalities) {
        for (Equation equality : equalities) {
            merge(node(equality.lhs()), node(equality.rhs()));
        }
    }

    /**
     * Checks that no disequality has both of its sides in the same class. Should be called after
     * all equalities have been merged.
     *
     * @return {@code false} iff some disequality is violated.
     */
    public boolean checkConsistency(Collection<Equation> disequalities) {
        return findViolated(disequalities) == null;
    }

    /**
     * Returns the first disequality whose sides are in the same class or {@code null} if there is
     * none.
     */
    @Nullable
    public Equation findViolated(Collection<Equation> disequalities) {
        for (Equation disequality : disequalities) {
            if (findUnchecked(node(disequality.lhs())) == findUnchecked(node(disequality.rhs()))) {
                return disequality;
            }
        }
        return null;
    }

    // Queries

    public boolean areEqual(Term lhs, Term rhs) {
        return findUnchecked(node(lhs)) == findUnchecked(node(rhs));
    }

    /**
     * Returns all terms equivalent to {@code term}, including itself.
     */
    public ImmutableSet<Term> classOf(Term term) {
        return members(findUnchecked(node(term)));
    }

    private ImmutableSet<Term> members(int root) {
        ImmutableSet.Builder<Term> members = ImmutableSet.builderWithExpectedSize(classSize[root]);
        int current = root;
        do {
            members.add(terms[current]);
            current = nextMember[current];
        } while (current != root);
        return members.build();
    }

    /**
     * Returns the current partition of all terms into equivalence classes.
     */
    public ImmutableSet<ImmutableSet<Term>> partition() {
        ImmutableSet.Builder<ImmutableSet<Term>> partition = ImmutableSet.builderWithExpectedSize(classCount);
        for (int node = 0; node < nodeCount; node++) {
            if (find[node] == node) {
                partition.add(members(node));
            }
        }
        return partition.build();
    }

    // Integrity checks and statistics

    /**
     * Performs integrity checks of the union-find structure, the class bookkeeping and the
     * congruence invariant.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     * @throws IllegalStateException if some invariant is violated.
     */
    @SuppressWarnings("PMD.AvoidDeeplyNestedIfStmts")
    public boolean check() {
        logger.log(Level.FINER, "Running integrity check");

        // Acyclic union-find, without compressing paths
        int roots = 0;
        for (int node = 0; node < nodeCount; node++) {
            int current = node;
            int steps = 0;
            while (find[current] != current) {
                current = find[current];
                steps += 1;
                checkState(steps <= nodeCount, "Cycle in union-find starting at %s", terms[node]);
            }
            if (current == node) {
                roots += 1;
            }
        }
        checkState(roots == classCount, "Expected %d classes, found %d roots", classCount, roots);

        // Member lists
        int members = 0;
        for (int node = 0; node < nodeCount; node++) {
            if (find[node] != node) {
                continue;
            }
            int current = node;
            int size = 0;
            do {
                checkState(rootOf(current) == node, "Member %s of %s in wrong class", terms[current], terms[node]);
                size += 1;
                checkState(size <= nodeCount, "Member list of %s is not circular", terms[node]);
                current = nextMember[current];
            } while (current != node);
            checkState(size == classSize[node], "Class of %s has size %d, expected %d", terms[node], size, classSize[node]);
            members += size;

            Set<Integer> expectedParents = new HashSet<>();
            current = node;
            do {
                for (int parent : parents[current]) {
                    expectedParents.add(parent);
                }
                current = nextMember[current];
            } while (current != node);
            Set<Integer> actualParents = new HashSet<>();
            for (int i = 0; i < classParentCount[node]; i++) {
                actualParents.add(classParents[node][i]);
            }
            checkState(expectedParents.equals(actualParents), "Parents of class %s are %s, expected %s",
                    terms[node], actualParents, expectedParents);
        }
        checkState(members == nodeCount, "Classes contain %d members, expected %d", members, nodeCount);

        // Congruence: all applications with the same signature must share a representative
        Map<List<Object>, Integer> signatures = new HashMap<>();
        for (int node = 0; node < nodeCount; node++) {
            if (!terms[node].isApplication()) {
                continue;
            }
            List<Object> signature = new ArrayList<>(children[node].length + 1);
            signature.add(terms[node].name());
            for (int child : children[node]) {
                signature.add(rootOf(child));
            }
            Integer previous = signatures.putIfAbsent(signature, node);
            if (previous != null) {
                checkState(rootOf(previous) == rootOf(node), "Congruent terms %s and %s are not merged",
                        terms[previous], terms[node]);
            }
        }
        return true;
    }

    private int rootOf(int node) {
        int current = node;
        while (find[current] != current) {
            current = find[current];
        }
        return current;
    }

    public String statistics() {
        return String.format(
                "Nodes: %d, classes: %d, merges: %d, unions: %d%n"
                        + "Congruence checks: %d, congruences found: %d, find steps: %d",
                nodeCount, classCount, mergeCount, unionCount, congruenceChecks, congruencesFound, findSteps);
    }

    @Override
    public String toString() {
        return String.format("EGraph%s@%d(%d)", iterative ? "iter" : "rec", nodeCount, System.identityHashCode(this));
    }
}
