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

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Human-readable names for operands in log output. Unnamed parameters are called {@code A},
 * {@code B}, ..., {@code Z}, {@code A1}, ... and keep their name across graph generations.
 */
public final class ReprContext {
    private final Map<ParameterOperatable, String> names = new HashMap<>();
    private int counter = 0;

    public String name(Parameter parameter) {
        String declared = parameter.name();
        if (declared != null) {
            return declared;
        }
        return names.computeIfAbsent(parameter, key -> nextName());
    }

    private String nextName() {
        int index = counter++;
        char letter = (char) ('A' + index % 26);
        int round = index / 26;
        return round == 0 ? String.valueOf(letter) : letter + Integer.toString(round);
    }

    /**
     * Transfers names to the images of the named nodes.
     */
    void carryOver(ReprMap reprMap) {
        for (Map.Entry<ParameterOperatable, String> entry : new HashMap<>(names).entrySet()) {
            Operand image = reprMap.map(entry.getKey());
            if (image instanceof ParameterOperatable) {
                names.putIfAbsent((ParameterOperatable) image, entry.getValue());
            }
        }
    }

    public String print(Operand operand) {
        return print(operand, false);
    }

    private String print(Operand operand, boolean nested) {
        if (operand instanceof Literal) {
            return operand.toString();
        }
        if (operand instanceof Parameter) {
            return name((Parameter) operand);
        }
        Expression expression = (Expression) operand;
        String symbol = expression.operator().symbol()
                + (expression.isTerminated() ? "!!" : expression.isConstrained() ? "!" : "");
        if (expression.operands().size() == 1) {
            if (Character.isLetter(symbol.charAt(0))) {
                return symbol + "(" + print(expression.operand(0), false) + ")";
            }
            return symbol + print(expression.operand(0), true);
        }
        String body = expression.operands().stream()
                .map(child -> print(child, true))
                .collect(Collectors.joining(" " + symbol + " "));
        return nested ? "(" + body + ")" : body;
    }

    /**
     * All constrained expressions of the graph, one per line.
     */
    public String print(Graph graph) {
        return graph.expressions().stream()
                .filter(Expression::isConstrained)
                .map(this::print)
                .collect(Collectors.joining("\n"));
    }
}
