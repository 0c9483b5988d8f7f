/*
 * This file is part of PSolve.
 * Copyright (c) 2024 The PSolve authors.
 *
 * PSolve is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * PSolve is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PSolve. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.psolve;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * A rewrite transaction over one graph generation. Algorithms read the input graph and record
 * copies, replacements and removals; every new expression passes through
 * {@link Invariants#insertExpression(Mutator, ExpressionBuilder)}. {@link #close()} copies all
 * untouched nodes, compacts the result into a fresh graph and reports whether anything changed.
 *
 * <p>Nodes of the input graph are mapped into a staging graph. Staging nodes which are subsumed
 * by another node are forwarded to it and dropped during compaction.</p>
 */
final class Mutator {
    private static final Logger logger = Logger.getLogger(Mutator.class.getName());

    private final Graph input;
    private final Graph staging;
    private final String algorithm;

    /* Input node -> staging node or literal */
    private final Map<ParameterOperatable, Operand> transformations = new HashMap<>();
    private final Set<ParameterOperatable> removed = new HashSet<>();
    private final Set<ParameterOperatable> copying = new HashSet<>();

    /* Staging node -> staging node or literal */
    private final Map<ParameterOperatable, Operand> forwards = new HashMap<>();
    private final Set<ParameterOperatable> discardRequests = new HashSet<>();
    private final ListMultimap<ParameterOperatable, ParameterOperatable> origins = ArrayListMultimap.create();

    private boolean closed = false;

    Mutator(Graph input, String algorithm) {
        this.input = input;
        this.staging = new Graph();
        this.algorithm = algorithm;
    }

    Graph input() {
        return input;
    }

    String algorithm() {
        return algorithm;
    }

    Graph staging() {
        return staging;
    }

    boolean isMutated(ParameterOperatable node) {
        return transformations.containsKey(node) || removed.contains(node);
    }

    boolean isRemoved(ParameterOperatable node) {
        return removed.contains(node);
    }

    /**
     * Returns the current counterpart of the operand in the staging graph, copying input nodes
     * (and their operands) on first access. Literals and staging nodes are returned as they are.
     */
    Operand getCopy(Operand operand) {
        checkOpen();
        if (operand instanceof Literal) {
            return operand;
        }
        ParameterOperatable node = (ParameterOperatable) operand;
        if (node.graph() == staging) {
            return resolve(node);
        }
        Util.checkArgument(node.graph() == input, "%s belongs to neither input nor output", node);
        Util.checkState(!removed.contains(node), "%s was removed", node);
        Operand existing = transformations.get(node);
        if (existing != null) {
            return resolve(existing);
        }
        Util.checkState(copying.add(node), "Cyclic copy of %s", node);
        Operand copy;
        try {
            if (node instanceof Parameter) {
                Parameter parameter = (Parameter) node;
                copy = staging.addParameter(parameter.name(), parameter.domain(), parameter.unit(), parameter.within());
            } else {
                Expression expression = (Expression) node;
                List<Operand> operands = new ArrayList<>(expression.operands().size());
                for (Operand child : expression.operands()) {
                    operands.add(getCopy(child));
                }
                copy = insert(ExpressionBuilder.from(expression).withOperands(operands));
            }
        } finally {
            copying.remove(node);
        }
        mapNode(node, copy);
        return resolve(copy);
    }

    /**
     * Inserts a new expression. Operands may be input nodes, staging nodes or literals.
     */
    Operand create(ExpressionBuilder builder) {
        checkOpen();
        List<Operand> operands = new ArrayList<>(builder.operands().size());
        for (Operand operand : builder.operands()) {
            operands.add(getCopy(operand));
        }
        return insert(builder.withOperands(operands));
    }

    /**
     * Replaces the input expression by the expression described by the builder.
     */
    Operand mutate(Expression node, ExpressionBuilder builder) {
        Operand result = create(builder);
        replace(node, result);
        return result;
    }

    /**
     * Maps the input node to the given replacement. Everything using the node now uses the
     * replacement instead.
     */
    void replace(ParameterOperatable node, Operand replacement) {
        checkOpen();
        Util.checkArgument(node.graph() == input, "%s is not an input node", node);
        Util.checkState(!removed.contains(node), "%s was removed", node);
        Operand target = getCopy(replacement);
        Operand previous = transformations.get(node);
        if (previous != null) {
            Operand resolved = resolve(previous);
            if (resolved instanceof ParameterOperatable && resolved != target) {
                forward((ParameterOperatable) resolved, target);
            }
        }
        mapNode(node, target);
        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, "{0}: {1} -> {2}", new Object[] {algorithm, node, target});
        }
    }

    /**
     * Removes the input node. Nodes depending on it are removed when the mutator is closed.
     */
    void remove(ParameterOperatable node) {
        checkOpen();
        Util.checkArgument(node.graph() == input, "%s is not an input node", node);
        if (!removed.add(node)) {
            return;
        }
        Operand previous = transformations.remove(node);
        if (previous != null) {
            Operand resolved = resolve(previous);
            if (resolved instanceof ParameterOperatable) {
                discardRequests.add((ParameterOperatable) resolved);
            }
        }
        logger.log(Level.FINER, "{0}: removed {1}", new Object[] {algorithm, node});
    }

    /**
     * Creates a fresh parameter in the output, not backed by any input node.
     */
    Parameter createParameter(Parameter template) {
        checkOpen();
        return staging.addParameter(template.name(), template.domain(), template.unit(), template.within());
    }

    Operand insert(ExpressionBuilder builder) {
        return Invariants.insertExpression(this, builder).operand();
    }

    private void mapNode(ParameterOperatable node, Operand image) {
        transformations.put(node, image);
        if (image instanceof ParameterOperatable) {
            origins.put((ParameterOperatable) image, node);
        }
    }

    /**
     * Follows forwards of staging nodes.
     */
    Operand resolve(Operand operand) {
        Operand current = operand;
        while (current instanceof ParameterOperatable) {
            Operand next = forwards.get(current);
            if (next == null) {
                break;
            }
            current = next;
        }
        return current;
    }

    /**
     * Marks a staging node as subsumed by the target.
     */
    void forward(ParameterOperatable from, Operand to) {
        Util.checkArgument(from.graph() == staging, "%s is not a staging node", from);
        Operand target = resolve(to);
        Operand source = resolve(from);
        if (source == target || source instanceof Literal) {
            return;
        }
        forwards.put((ParameterOperatable) source, target);
        if (target instanceof ParameterOperatable) {
            origins.putAll((ParameterOperatable) target, origins.get((ParameterOperatable) source));
        }
    }

    boolean isLive(ParameterOperatable stagingNode) {
        return !forwards.containsKey(stagingNode) && !isDiscarded(stagingNode);
    }

    private boolean isDiscarded(ParameterOperatable stagingNode) {
        if (!discardRequests.contains(stagingNode)) {
            return false;
        }
        for (ParameterOperatable origin : origins.get(stagingNode)) {
            if (!removed.contains(origin)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Live staging expressions with the given operator using the anchor as an operand. Untouched
     * input expressions which would map there are copied first, so that they are visible.
     */
    List<Expression> candidates(Operator operator, ParameterOperatable anchor) {
        for (ParameterOperatable origin : ImmutableList.copyOf(origins.get(anchor))) {
            for (Expression parent : input.operations(origin)) {
                if (parent.operator() == operator && !isMutated(parent) && isCopyable(parent)) {
                    getCopy(parent);
                }
            }
        }
        List<Expression> candidates = new ArrayList<>();
        for (Expression parent : staging.operations(anchor)) {
            if (parent.operator() == operator && isLive(parent)) {
                candidates.add(parent);
            }
        }
        return candidates;
    }

    private boolean isCopyable(Expression expression) {
        Set<ParameterOperatable> visited = new HashSet<>();
        Deque<ParameterOperatable> queue = new ArrayDeque<>();
        queue.add(expression);
        while (!queue.isEmpty()) {
            ParameterOperatable node = queue.poll();
            if (removed.contains(node) || copying.contains(node)) {
                return false;
            }
            if (node instanceof Expression && !transformations.containsKey(node)) {
                for (Operand operand : ((Expression) node).operands()) {
                    if (operand instanceof ParameterOperatable && visited.add((ParameterOperatable) operand)) {
                        queue.add((ParameterOperatable) operand);
                    }
                }
            }
        }
        return true;
    }

    private void checkOpen() {
        Util.checkState(!closed, "Mutator of %s already closed", algorithm);
    }

    /**
     * Finishes the transaction. The mutator cannot be used afterwards.
     */
    Result close() {
        checkOpen();
        for (ParameterOperatable node : input.nodes()) {
            if (isMutated(node)) {
                continue;
            }
            if (node instanceof Expression && dependsOnRemoved((Expression) node)) {
                removed.add(node);
                continue;
            }
            getCopy(node);
        }
        closed = true;

        Graph output = new Graph();
        Map<ParameterOperatable, ParameterOperatable> compacted = new HashMap<>();
        Set<ParameterOperatable> dead = new HashSet<>();
        for (ParameterOperatable node : staging.nodes()) {
            compact(node, output, compacted, dead);
        }

        Map<ParameterOperatable, Operand> images = new HashMap<>();
        Set<ParameterOperatable> removedNodes = new HashSet<>(removed);
        for (ParameterOperatable node : input.nodes()) {
            if (removed.contains(node)) {
                continue;
            }
            Operand image = compact(transformations.get(node), output, compacted, dead);
            if (image == null) {
                removedNodes.add(node);
            } else {
                images.put(node, image);
            }
        }
        ReprMap reprMap = new ReprMap(images, removedNodes);
        boolean dirty = isDirty(reprMap, output);
        if (dirty) {
            logger.log(Level.FINE, "{0}: {1} nodes -> {2} nodes", new Object[] {algorithm, input.size(), output.size()});
        }
        return new Result(reprMap, output, dirty);
    }

    private boolean dependsOnRemoved(Expression expression) {
        for (Operand operand : expression.operands()) {
            if (operand instanceof ParameterOperatable && removed.contains(operand)) {
                return true;
            }
        }
        return false;
    }

    @Nullable
    private Operand compact(
            Operand stagingOperand,
            Graph output,
            Map<ParameterOperatable, ParameterOperatable> compacted,
            Set<ParameterOperatable> dead) {
        Operand resolved = resolve(stagingOperand);
        if (resolved instanceof Literal) {
            return resolved;
        }
        ParameterOperatable node = (ParameterOperatable) resolved;
        ParameterOperatable existing = compacted.get(node);
        if (existing != null) {
            return existing;
        }
        if (dead.contains(node)) {
            return null;
        }
        if (isDiscarded(node)) {
            dead.add(node);
            return null;
        }
        ParameterOperatable copy;
        if (node instanceof Parameter) {
            Parameter parameter = (Parameter) node;
            copy = output.addParameter(parameter.name(), parameter.domain(), parameter.unit(), parameter.within());
        } else {
            Expression expression = (Expression) node;
            List<Operand> operands = new ArrayList<>(expression.operands().size());
            for (Operand operand : expression.operands()) {
                Operand image = compact(operand, output, compacted, dead);
                if (image == null) {
                    dead.add(node);
                    return null;
                }
                operands.add(image);
            }
            copy = output.addExpression(
                    expression.operator(), operands, expression.isConstrained(), expression.isTerminated());
        }
        compacted.put(node, copy);
        return copy;
    }

    private boolean isDirty(ReprMap reprMap, Graph output) {
        if (output.size() != input.size()) {
            return true;
        }
        Set<Operand> images = new HashSet<>();
        for (ParameterOperatable node : input.nodes()) {
            Operand image = reprMap.map(node);
            if (image == null || image instanceof Literal || !images.add(image)) {
                return true;
            }
            if (!isStructurallyEqual(node, (ParameterOperatable) image, reprMap)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isStructurallyEqual(ParameterOperatable node, ParameterOperatable image, ReprMap reprMap) {
        if (node instanceof Parameter) {
            if (!(image instanceof Parameter)) {
                return false;
            }
            Parameter parameter = (Parameter) node;
            Parameter other = (Parameter) image;
            return Objects.equals(parameter.name(), other.name())
                    && parameter.domain().equals(other.domain())
                    && parameter.unit().equals(other.unit())
                    && Objects.equals(parameter.within(), other.within());
        }
        if (!(image instanceof Expression)) {
            return false;
        }
        Expression expression = (Expression) node;
        Expression other = (Expression) image;
        if (expression.operator() != other.operator()
                || expression.isConstrained() != other.isConstrained()
                || expression.isTerminated() != other.isTerminated()
                || expression.operands().size() != other.operands().size()) {
            return false;
        }
        for (int i = 0; i < expression.operands().size(); i++) {
            Operand operand = expression.operand(i);
            Operand otherOperand = other.operand(i);
            if (operand instanceof Literal) {
                if (!operand.equals(otherOperand)) {
                    return false;
                }
            } else if (reprMap.map(operand) != otherOperand) {
                return false;
            }
        }
        return true;
    }

    static final class Result {
        private final ReprMap reprMap;
        private final Graph graph;
        private final boolean dirty;

        Result(ReprMap reprMap, Graph graph, boolean dirty) {
            this.reprMap = reprMap;
            this.graph = graph;
            this.dirty = dirty;
        }

        ReprMap reprMap() {
            return reprMap;
        }

        Graph graph() {
            return graph;
        }

        boolean isDirty() {
            return dirty;
        }
    }
}
