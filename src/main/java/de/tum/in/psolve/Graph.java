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
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/**
 * An arena of parameters and expressions. Nodes are only ever appended; rewriting a graph
 * produces a new graph with a fresh {@link #generation() generation number}.
 */
public final class Graph {
    private static final AtomicLong generations = new AtomicLong();

    private final long generation;
    private final List<ParameterOperatable> nodes = new ArrayList<>();
    private final ListMultimap<ParameterOperatable, Expression> operations = ArrayListMultimap.create();

    public Graph() {
        this.generation = generations.incrementAndGet();
    }

    public long generation() {
        return generation;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<ParameterOperatable> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Parameter> parameters() {
        List<Parameter> parameters = new ArrayList<>();
        for (ParameterOperatable node : nodes) {
            if (node instanceof Parameter) {
                parameters.add((Parameter) node);
            }
        }
        return parameters;
    }

    public List<Expression> expressions() {
        List<Expression> expressions = new ArrayList<>();
        for (ParameterOperatable node : nodes) {
            if (node instanceof Expression) {
                expressions.add((Expression) node);
            }
        }
        return expressions;
    }

    /**
     * All expressions which use the given node as a direct operand.
     */
    public List<Expression> operations(ParameterOperatable node) {
        checkOwned(node);
        return Collections.unmodifiableList(operations.get(node));
    }

    public Parameter parameter(@Nullable String name, Domain domain) {
        return addParameter(name, domain, Unit.DIMENSIONLESS, null);
    }

    public Parameter parameter(@Nullable String name, Domain domain, Unit unit, @Nullable Literal within) {
        if (within != null) {
            Util.checkArgument(
                    within.kind() == domain.universe().kind(), "Bound %s does not match domain %s", within, domain);
        }
        return addParameter(name, domain, unit, within);
    }

    public Expression expression(Operator operator, Operand... operands) {
        return expression(operator, Arrays.asList(operands));
    }

    public Expression expression(Operator operator, List<? extends Operand> operands) {
        operator.checkArity(operands.size());
        for (Operand operand : operands) {
            if (operand instanceof ParameterOperatable) {
                checkOwned((ParameterOperatable) operand);
            }
        }
        return addExpression(operator, operands, false, false);
    }

    /**
     * Creates an expression and constrains it.
     */
    public Expression assertExpression(Operator operator, Operand... operands) {
        Util.checkArgument(operator.isPredicate(), "Cannot assert %s expression", operator);
        Expression expression = expression(operator, operands);
        expression.constrain();
        return expression;
    }

    Parameter addParameter(@Nullable String name, Domain domain, Unit unit, @Nullable Literal within) {
        Parameter parameter = new Parameter(this, nodes.size(), name, domain, unit, within);
        nodes.add(parameter);
        return parameter;
    }

    Expression addExpression(Operator operator, List<? extends Operand> operands, boolean constrained, boolean terminated) {
        Expression expression = new Expression(this, nodes.size(), operator, ImmutableList.copyOf(operands));
        nodes.add(expression);
        Set<ParameterOperatable> seen = new LinkedHashSet<>();
        for (Operand operand : operands) {
            if (operand instanceof ParameterOperatable && seen.add((ParameterOperatable) operand)) {
                operations.put((ParameterOperatable) operand, expression);
            }
        }
        if (constrained) {
            expression.constrain();
        }
        if (terminated) {
            expression.terminate();
        }
        return expression;
    }

    private void checkOwned(ParameterOperatable node) {
        Util.checkArgument(node.graph() == this, "%s belongs to another graph", node);
    }

    /**
     * Constrained {@code Is} between two non-literal operands.
     */
    static boolean isAlias(Expression expression) {
        return expression.operator() == Operator.IS
                && expression.isConstrained()
                && !expression.operand(0).isLiteral()
                && !expression.operand(1).isLiteral();
    }

    /**
     * If the expression is a constrained fact bounding the subject by a literal, returns that
     * literal. Without {@code allowSubset}, only singleton aliases count.
     */
    @Nullable
    static Literal factLiteral(Expression expression, ParameterOperatable subject, boolean allowSubset) {
        if (!expression.isConstrained() || expression.operands().size() != 2) {
            return null;
        }
        Operand first = expression.operand(0);
        Operand second = expression.operand(1);
        switch (expression.operator()) {
            case IS: {
                Operand other = first == subject ? second : second == subject ? first : null;
                if (other instanceof Literal) {
                    Literal literal = (Literal) other;
                    return literal.isSingleton() || allowSubset ? literal : null;
                }
                return null;
            }
            case IS_SUBSET:
                return allowSubset && first == subject && second instanceof Literal ? (Literal) second : null;
            default:
                return null;
        }
    }

    /**
     * The nodes proven equal to the given one by constrained aliases which are not excluded,
     * including itself.
     */
    Set<ParameterOperatable> aliasClass(ParameterOperatable node, Predicate<Expression> excluded) {
        checkOwned(node);
        Set<ParameterOperatable> members = new LinkedHashSet<>();
        Deque<ParameterOperatable> queue = new ArrayDeque<>();
        members.add(node);
        queue.add(node);
        while (!queue.isEmpty()) {
            ParameterOperatable current = queue.poll();
            for (Expression parent : operations.get(current)) {
                if (!isAlias(parent) || excluded.test(parent)) {
                    continue;
                }
                for (Operand operand : parent.operands()) {
                    ParameterOperatable other = (ParameterOperatable) operand;
                    if (members.add(other)) {
                        queue.add(other);
                    }
                }
            }
        }
        return members;
    }

    /**
     * Intersects all literal facts about the node and its alias class, ignoring the excluded
     * facts. Returns {@code null} if there are none.
     */
    @Nullable
    Literal knownSuperset(ParameterOperatable node, boolean allowSubset, Predicate<Expression> excluded) {
        Literal result = null;
        for (ParameterOperatable member : aliasClass(node, excluded)) {
            for (Expression parent : operations.get(member)) {
                if (excluded.test(parent)) {
                    continue;
                }
                Literal literal = factLiteral(parent, member, allowSubset);
                if (literal != null) {
                    result = result == null ? literal : result.intersect(literal);
                }
            }
        }
        return result;
    }

    @Nullable
    Literal knownSuperset(ParameterOperatable node, boolean allowSubset) {
        return knownSuperset(node, allowSubset, expression -> false);
    }

    /**
     * The facts {@code node ⊆! literal} and {@code node is! singleton} directly attached to the node.
     */
    List<Expression> supersetFacts(ParameterOperatable node) {
        List<Expression> facts = new ArrayList<>();
        for (Expression parent : operations.get(node)) {
            if (!parent.isConstrained() || parent.operand(0) != node || !parent.operand(1).isLiteral()) {
                continue;
            }
            if (parent.operator() == Operator.IS_SUBSET
                    || (parent.operator() == Operator.IS && ((Literal) parent.operand(1)).isSingleton())) {
                facts.add(parent);
            }
        }
        return facts;
    }

    /**
     * The facts {@code literal ⊆! node} directly attached to the node.
     */
    List<Expression> subsetFacts(ParameterOperatable node) {
        List<Expression> facts = new ArrayList<>();
        for (Expression parent : operations.get(node)) {
            if (parent.isConstrained()
                    && parent.operator() == Operator.IS_SUBSET
                    && parent.operand(1) == node
                    && parent.operand(0).isLiteral()) {
                facts.add(parent);
            }
        }
        return facts;
    }

    @Override
    public String toString() {
        return "Graph#" + generation + "(" + nodes.size() + " nodes)";
    }
}
