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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Passes which look at the neighbourhood of nodes: aliases, literal bounds and connected
 * components.
 */
final class StructuralAlgorithms {
    private static final Logger logger = Logger.getLogger(StructuralAlgorithms.class.getName());

    static final SolverAlgorithm REMOVE_UNCONSTRAINED =
            SolverAlgorithm.of("Remove unconstrained", StructuralAlgorithms::removeUnconstrained);
    static final SolverAlgorithm CONVERT_ALIASED_SINGLETON_TO_LITERAL = SolverAlgorithm.of(
            "Convert aliased singletons into literals", StructuralAlgorithms::convertAliasedSingletonToLiteral);
    static final SolverAlgorithm REMOVE_CONGRUENT_EXPRESSIONS =
            SolverAlgorithm.of("Remove congruent expressions", StructuralAlgorithms::removeCongruentExpressions);
    static final SolverAlgorithm RESOLVE_ALIAS_CLASSES =
            SolverAlgorithm.of("Resolve alias classes", StructuralAlgorithms::resolveAliasClasses);
    static final SolverAlgorithm MERGE_INTERSECTING_SUBSETS =
            SolverAlgorithm.of("Merge intersecting subsets", StructuralAlgorithms::mergeIntersectingSubsets);
    static final SolverAlgorithm PREDICATE_LITERAL_DEDUCE =
            SolverAlgorithm.of("Predicate literal deduce", StructuralAlgorithms::predicateLiteralDeduce);
    static final SolverAlgorithm PREDICATE_UNCONSTRAINED_OPERANDS_DEDUCE = SolverAlgorithm.of(
            "Predicate unconstrained operands deduce", StructuralAlgorithms::predicateUnconstrainedOperandsDeduce);
    static final SolverAlgorithm EMPTY_SET_CONTRADICTION =
            SolverAlgorithm.of("Empty set contradiction", StructuralAlgorithms::emptySetContradiction);
    static final SolverAlgorithm TRANSITIVE_SUBSET =
            SolverAlgorithm.of("Transitive subset", StructuralAlgorithms::transitiveSubset);
    static final SolverAlgorithm REMOVE_EMPTY_GRAPHS =
            SolverAlgorithm.of("Remove empty graphs", StructuralAlgorithms::removeEmptyGraphs);
    static final SolverAlgorithm ISOLATE_LONE_PARAMETERS =
            SolverAlgorithm.of("Isolate lone parameters", StructuralAlgorithms::isolateLoneParameters);
    static final SolverAlgorithm UPPER_ESTIMATION =
            SolverAlgorithm.of("Upper estimation of expressions with subsets", StructuralAlgorithms::upperEstimation);

    private static final NumericSet MINUS_ONE = NumericSet.singleton(-1.0d);

    private StructuralAlgorithms() {}

    /**
     * Removes unconstrained expressions nothing depends on, together with the derived bounds
     * attached to them.
     */
    static void removeUnconstrained(Mutator mutator) {
        Graph graph = mutator.input();
        List<ParameterOperatable> nodes = graph.nodes();
        Set<Expression> removable = new HashSet<>();
        for (int i = nodes.size() - 1; i >= 0; i--) {
            ParameterOperatable node = nodes.get(i);
            if (!(node instanceof Expression) || ((Expression) node).isConstrained()) {
                continue;
            }
            boolean unused = true;
            for (Expression parent : graph.operations(node)) {
                if (!removable.contains(parent) && !isEstimateOf(parent, node)) {
                    unused = false;
                    break;
                }
            }
            if (unused) {
                removable.add((Expression) node);
            }
        }
        for (Expression expression : graph.expressions()) {
            if (expression.isTerminated()
                    && expression.operand(0) instanceof Expression
                    && isEstimateOf(expression, (Expression) expression.operand(0))
                    && removable.contains((Expression) expression.operand(0))) {
                removable.add(expression);
            }
        }
        for (Expression expression : removable) {
            mutator.remove(expression);
        }
    }

    private static boolean isEstimateOf(Expression fact, ParameterOperatable subject) {
        return fact.isTerminated()
                && fact.operator() == Operator.IS_SUBSET
                && fact.operand(0) == subject
                && fact.operand(1).isLiteral();
    }

    /**
     * Substitutes nodes aliased to a single value by that value everywhere except in the
     * aliases themselves.
     */
    static void convertAliasedSingletonToLiteral(Mutator mutator) {
        Graph graph = mutator.input();
        Map<ParameterOperatable, Literal> values = new HashMap<>();
        for (ParameterOperatable node : graph.nodes()) {
            for (Expression parent : graph.operations(node)) {
                Literal literal = Graph.factLiteral(parent, node, false);
                if (literal != null) {
                    values.put(node, literal);
                    break;
                }
            }
        }
        if (values.isEmpty()) {
            return;
        }
        for (Expression expression : graph.expressions()) {
            if (mutator.isRemoved(expression)) {
                continue;
            }
            boolean changed = false;
            List<Operand> operands = new ArrayList<>(expression.operands().size());
            for (Operand operand : expression.operands()) {
                Literal value = operand instanceof ParameterOperatable ? values.get(operand) : null;
                if (value != null && !isSingletonAlias(expression, (ParameterOperatable) operand, value)) {
                    operands.add(value);
                    changed = true;
                } else {
                    operands.add(operand);
                }
            }
            if (changed) {
                mutator.mutate(expression, ExpressionBuilder.from(expression).withOperands(operands));
            }
        }
    }

    private static boolean isSingletonAlias(Expression expression, ParameterOperatable node, Literal value) {
        return value.equals(Graph.factLiteral(expression, node, false));
    }

    /**
     * If an arithmetic expression aliased to a value has a single parameter which is not aliased
     * to a value itself, moves everything else to the value side:
     * {@code A + B is! 10, B is! 3} gives {@code A is! 10 + (-1 * 3)}.
     */
    static void isolateLoneParameters(Mutator mutator) {
        Graph graph = mutator.input();
        for (Expression expression : graph.expressions()) {
            if (expression.operator() != Operator.IS
                    || !expression.isConstrained()
                    || mutator.isRemoved(expression)
                    || !(expression.operand(0) instanceof Expression)
                    || !(expression.operand(1) instanceof NumericSet)) {
                continue;
            }
            Set<Parameter> free = new HashSet<>();
            collectFreeParameters(graph, expression.operand(0), free);
            if (free.size() != 1) {
                continue;
            }
            Parameter parameter = free.iterator().next();

            Operand retained = expression.operand(0);
            Operand value = expression.operand(1);
            while (retained instanceof Expression) {
                Expression current = (Expression) retained;
                List<Operand> moved = new ArrayList<>();
                Operand next = null;
                for (Operand operand : current.operands()) {
                    if (!contains(operand, parameter)) {
                        moved.add(operand);
                    } else if (next == null) {
                        next = operand;
                    } else {
                        // The parameter occurs in several operands
                        next = null;
                        break;
                    }
                }
                if (next == null || moved.isEmpty()
                        || (current.operator() == Operator.POWER && current.operand(0) != next)) {
                    break;
                }
                Operand inverted = invert(mutator, current.operator(), value, moved);
                if (inverted == null) {
                    break;
                }
                retained = next;
                value = inverted;
            }
            if (retained != expression.operand(0)) {
                logger.log(Level.FINE, "Isolated {0} in {1}", new Object[] {parameter, expression});
                mutator.mutate(expression, ExpressionBuilder.from(expression).withOperands(retained, value));
            }
        }
    }

    /**
     * Solves {@code op(X, moved...) = value} for X. Factors have to be non-zero literals.
     */
    @Nullable
    private static Operand invert(Mutator mutator, Operator operator, Operand value, List<Operand> moved) {
        switch (operator) {
            case ADD: {
                List<Operand> summands = new ArrayList<>(moved.size() + 1);
                summands.add(value);
                for (Operand operand : moved) {
                    summands.add(mutator.create(ExpressionBuilder.of(Operator.MULTIPLY, operand, MINUS_ONE)));
                }
                return mutator.create(ExpressionBuilder.of(Operator.ADD, summands));
            }
            case MULTIPLY: {
                List<Operand> factors = new ArrayList<>(moved.size() + 1);
                factors.add(value);
                for (Operand operand : moved) {
                    if (!(operand instanceof NumericSet) || ((NumericSet) operand).contains(0.0d)) {
                        return null;
                    }
                    factors.add(mutator.create(ExpressionBuilder.of(Operator.POWER, operand, MINUS_ONE)));
                }
                return mutator.create(ExpressionBuilder.of(Operator.MULTIPLY, factors));
            }
            case POWER:
                // Only the reciprocal is its own inverse on the whole domain
                if (moved.size() == 1 && MINUS_ONE.equals(moved.get(0))) {
                    return mutator.create(ExpressionBuilder.of(Operator.POWER, value, MINUS_ONE));
                }
                return null;
            default:
                return null;
        }
    }

    private static void collectFreeParameters(Graph graph, Operand operand, Set<Parameter> free) {
        if (operand instanceof Parameter) {
            if (!hasValue(graph, (Parameter) operand)) {
                free.add((Parameter) operand);
            }
        } else if (operand instanceof Expression) {
            for (Operand child : ((Expression) operand).operands()) {
                collectFreeParameters(graph, child, free);
            }
        }
    }

    private static boolean hasValue(Graph graph, Parameter parameter) {
        for (Expression parent : graph.operations(parameter)) {
            if (Graph.factLiteral(parent, parameter, false) != null) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(Operand operand, Parameter parameter) {
        if (operand == parameter) {
            return true;
        }
        if (operand instanceof Expression) {
            for (Operand child : ((Expression) operand).operands()) {
                if (contains(child, parameter)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Copies every expression through the insertion gate, which reuses congruent ones.
     */
    static void removeCongruentExpressions(Mutator mutator) {
        Set<Operand> images = new HashSet<>();
        int merged = 0;
        for (Expression expression : mutator.input().expressions()) {
            if (mutator.isRemoved(expression)) {
                continue;
            }
            Operand copy = mutator.getCopy(expression);
            if (copy instanceof Expression && !images.add(copy)) {
                merged += 1;
            }
        }
        if (merged > 0) {
            logger.log(Level.FINE, "Merged {0} congruent expressions", merged);
        }
    }

    /**
     * Collapses parameters proven equal into one fresh representative parameter.
     */
    static void resolveAliasClasses(Mutator mutator) {
        Graph graph = mutator.input();
        EquivalenceClasses<ParameterOperatable> classes = new EquivalenceClasses<>();
        for (Expression expression : graph.expressions()) {
            if (Graph.isAlias(expression)) {
                classes.union((ParameterOperatable) expression.operand(0), (ParameterOperatable) expression.operand(1));
            }
        }
        for (Set<ParameterOperatable> members : classes.classes()) {
            List<Parameter> parameters = new ArrayList<>();
            for (ParameterOperatable member : members) {
                if (member instanceof Parameter) {
                    parameters.add((Parameter) member);
                }
            }
            if (parameters.size() < 2) {
                continue;
            }
            Parameter template = parameters.get(0);
            for (Parameter parameter : parameters) {
                if (parameter.name() != null) {
                    template = parameter;
                    break;
                }
            }
            Parameter representative = mutator.createParameter(template);
            for (Parameter parameter : parameters) {
                mutator.replace(parameter, representative);
            }
            logger.log(Level.FINER, "Merged alias class {0} into {1}", new Object[] {parameters, representative});
        }
    }

    /**
     * Re-inserts nodes with several literal bounds, so that the insertion gate intersects the
     * upper bounds and unites the lower bounds.
     */
    static void mergeIntersectingSubsets(Mutator mutator) {
        Graph graph = mutator.input();
        for (ParameterOperatable node : graph.nodes()) {
            List<Expression> supersets = graph.supersetFacts(node);
            if (supersets.size() >= 2) {
                copyAll(mutator, supersets);
            }
            List<Expression> subsets = graph.subsetFacts(node);
            if (subsets.size() >= 2) {
                copyAll(mutator, subsets);
            }
        }
    }

    private static void copyAll(Mutator mutator, List<Expression> expressions) {
        for (Expression expression : expressions) {
            if (!mutator.isRemoved(expression)) {
                mutator.getCopy(expression);
            }
        }
    }

    /**
     * Evaluates predicates over the known bounds of their operands. A predicate that is always
     * true is replaced by {@code true}; a constrained predicate that is always false is a
     * contradiction.
     */
    static void predicateLiteralDeduce(Mutator mutator) {
        Graph graph = mutator.input();
        Set<Expression> deduced = new HashSet<>();
        for (Expression expression : graph.expressions()) {
            if (!expression.isPredicate()
                    || expression.isTerminated()
                    || expression.hasOnlyLiteralOperands()
                    || mutator.isRemoved(expression)) {
                continue;
            }
            Operator operator = expression.operator();
            if ((operator == Operator.IS_SUBSET && !expression.operand(1).isLiteral())
                    || (operator == Operator.IS_SUPERSET && !expression.operand(0).isLiteral())) {
                continue;
            }
            Predicate<Expression> excluded = fact -> fact == expression || deduced.contains(fact);
            List<Literal> supersets = new ArrayList<>(expression.operands().size());
            for (Operand operand : expression.operands()) {
                Literal superset = superset(graph, operand, excluded);
                if (superset == null) {
                    break;
                }
                supersets.add(superset);
            }
            if (supersets.size() < expression.operands().size()) {
                continue;
            }
            BooleanSet truth = operator.estimate(supersets);
            if (truth == BooleanSet.TRUE) {
                deduced.add(expression);
                mutator.replace(expression, BooleanSet.TRUE);
            } else if (truth == BooleanSet.FALSE || truth == BooleanSet.EMPTY) {
                if (expression.isConstrained()) {
                    throw new ContradictionByLiteral(
                            String.format("Constrained predicate %s is false", expression),
                            ImmutableList.of(expression),
                            supersets);
                }
                if (truth == BooleanSet.FALSE) {
                    mutator.replace(expression, BooleanSet.FALSE);
                }
            }
        }
    }

    @Nullable
    private static Literal superset(Graph graph, Operand operand, Predicate<Expression> excluded) {
        if (operand instanceof Literal) {
            return (Literal) operand;
        }
        ParameterOperatable node = (ParameterOperatable) operand;
        Literal known = graph.knownSuperset(node, true, excluded);
        if (known != null) {
            return known;
        }
        if (node instanceof Parameter) {
            return ((Parameter) node).domain().universe();
        }
        Expression expression = (Expression) node;
        if (expression.isPredicate()) {
            return expression.isConstrained() && !excluded.test(expression) ? BooleanSet.TRUE : BooleanSet.BOTH;
        }
        return null;
    }

    /**
     * Terminates constrained predicates which can always be satisfied by choosing a value for a
     * parameter that appears nowhere else.
     */
    static void predicateUnconstrainedOperandsDeduce(Mutator mutator) {
        Graph graph = mutator.input();
        for (Expression expression : graph.expressions()) {
            if (!expression.isConstrained()
                    || expression.isTerminated()
                    || expression.hasLiteralOperand()
                    || mutator.isMutated(expression)) {
                continue;
            }
            switch (expression.operator()) {
                case IS:
                case GREATER_OR_EQUAL:
                case OR:
                case NOT:
                    break;
                default:
                    continue;
            }
            for (Operand operand : expression.operands()) {
                if (operand instanceof Parameter && isFree(graph, (Parameter) operand)) {
                    logger.log(Level.FINER, "{0} is satisfiable through {1}", new Object[] {expression, operand});
                    mutator.mutate(expression, ExpressionBuilder.from(expression).withTerminated(true));
                    break;
                }
            }
        }
    }

    private static boolean isFree(Graph graph, Parameter parameter) {
        return graph.operations(parameter).size() == 1
                && parameter.within() == null
                && parameter.domain().isUnrestricted();
    }

    static void emptySetContradiction(Mutator mutator) {
        for (Expression expression : mutator.input().expressions()) {
            if (!expression.isConstrained()
                    || (expression.operator() != Operator.IS_SUBSET && expression.operator() != Operator.IS)
                    || expression.operand(0).isLiteral()
                    || !(expression.operand(1) instanceof Literal)) {
                continue;
            }
            Literal superset = (Literal) expression.operand(1);
            if (superset.isEmpty()) {
                throw new ContradictionByLiteral(
                        String.format("Empty superset for %s", expression.operand(0)),
                        ImmutableList.of(expression.operand(0)),
                        ImmutableList.of(superset));
            }
        }
    }

    /**
     * From {@code a ⊆! b} and {@code b ⊆! c} derives {@code a ⊆! c}, where {@code c} is a node
     * or the literal bound of {@code b}.
     */
    static void transitiveSubset(Mutator mutator) {
        Graph graph = mutator.input();
        for (Expression expression : graph.expressions()) {
            if (!isNodeSubset(expression)) {
                continue;
            }
            ParameterOperatable subset = (ParameterOperatable) expression.operand(0);
            ParameterOperatable superset = (ParameterOperatable) expression.operand(1);
            Literal bound = graph.knownSuperset(superset, true);
            if (bound != null) {
                mutator.create(ExpressionBuilder.asserted(Operator.IS_SUBSET, subset, bound));
            }
            for (Expression parent : graph.operations(superset)) {
                if (isNodeSubset(parent) && parent.operand(0) == superset) {
                    mutator.create(ExpressionBuilder.asserted(Operator.IS_SUBSET, subset, parent.operand(1)));
                }
            }
        }
    }

    private static boolean isNodeSubset(Expression expression) {
        return expression.operator() == Operator.IS_SUBSET
                && expression.isConstrained()
                && !expression.operand(0).isLiteral()
                && !expression.operand(1).isLiteral();
    }

    /**
     * Removes connected components without any open constrained predicate.
     */
    static void removeEmptyGraphs(Mutator mutator) {
        Graph graph = mutator.input();
        EquivalenceClasses<ParameterOperatable> components = new EquivalenceClasses<>();
        for (ParameterOperatable node : graph.nodes()) {
            components.add(node);
            if (node instanceof Expression) {
                for (Operand operand : ((Expression) node).operands()) {
                    if (operand instanceof ParameterOperatable) {
                        components.union(node, (ParameterOperatable) operand);
                    }
                }
            }
        }
        for (Set<ParameterOperatable> component : components.classes()) {
            boolean live = false;
            for (ParameterOperatable node : component) {
                if (node instanceof Expression
                        && ((Expression) node).isConstrained()
                        && !((Expression) node).isTerminated()) {
                    live = true;
                    break;
                }
            }
            if (!live) {
                for (ParameterOperatable node : component) {
                    mutator.remove(node);
                }
            }
        }
    }

    /**
     * Bounds arithmetic expressions by evaluating them over the bounds of their operands. The
     * derived bounds are terminated facts.
     */
    static void upperEstimation(Mutator mutator) {
        Graph graph = mutator.input();
        for (Expression expression : graph.expressions()) {
            switch (expression.operator()) {
                case ADD:
                case MULTIPLY:
                case POWER:
                case ABS:
                case ROUND:
                case FLOOR:
                case CEIL:
                case SIN:
                case LOG:
                    break;
                default:
                    continue;
            }
            if (mutator.isRemoved(expression)) {
                continue;
            }
            List<Literal> supersets = new ArrayList<>(expression.operands().size());
            for (Operand operand : expression.operands()) {
                Literal superset =
                        operand instanceof Literal ? (Literal) operand : graph.knownSuperset((ParameterOperatable) operand, true);
                if (!(superset instanceof NumericSet)) {
                    break;
                }
                supersets.add(superset);
            }
            if (supersets.size() < expression.operands().size()) {
                continue;
            }
            Literal estimate = expression.operator().fold(supersets);
            if (estimate.equals(NumericSet.reals())) {
                continue;
            }
            mutator.create(ExpressionBuilder.asserted(Operator.IS_SUBSET, expression, estimate).withTerminated(true));
        }
    }
}
