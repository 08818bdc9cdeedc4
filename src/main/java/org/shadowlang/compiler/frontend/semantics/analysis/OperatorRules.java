package org.shadowlang.compiler.frontend.semantics.analysis;

import org.shadowlang.compiler.frontend.parser.ast.Operator;
import org.shadowlang.compiler.frontend.parser.ast.Type;

import java.util.Optional;

/**
 * The typing rules of all operators.
 */
public final class OperatorRules {

    private OperatorRules() {}

    /**
     * @param operator A unary operator.
     * @param operand The operand type, not UNKNOWN.
     * @return The result type, or empty if the operator does not apply to the operand.
     */
    public static Optional<Type> unaryResult(Operator operator, Type operand) {
        return switch (operator) {
            case NEGATE -> operand.isNumeric() ? Optional.of(operand) : Optional.empty();
            case NOT -> operand == Type.BOOL ? Optional.of(Type.BOOL) : Optional.empty();
            default -> Optional.empty();
        };
    }

    /**
     * Both operands must have the same type. Arithmetic needs int or float and keeps the
     * type, comparison accepts any type and yields bool, logical needs bool.
     * @param operator A binary operator.
     * @param left The left operand type, not UNKNOWN.
     * @param right The right operand type, not UNKNOWN.
     * @return The result type, or empty if the operator does not apply to the operands.
     */
    public static Optional<Type> binaryResult(Operator operator, Type left, Type right) {
        if (left != right) {
            return Optional.empty();
        }
        return switch (operator.category()) {
            case ARITHMETIC -> left.isNumeric() ? Optional.of(left) : Optional.empty();
            case COMPARISON -> Optional.of(Type.BOOL);
            case LOGICAL -> left == Type.BOOL ? Optional.of(Type.BOOL) : Optional.empty();
            case UNARY -> Optional.empty();
        };
    }
}
