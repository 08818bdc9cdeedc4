package org.shadowlang.compiler.frontend.parser.ast;

import org.shadowlang.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A (parallel) assignment {@code a, b = x, y}. An assignment without targets stands for an
 * absent init or step in a loop header.
 *
 * @param targets The assigned variables.
 * @param values The values, one per target.
 * @param source The position of the first target.
 */
public record Assignment(
        List<Variable> targets,
        List<Expression> values,
        SourceInfo source
) implements Statement {

    /**
     * Compact constructor making the lists immutable.
     */
    public Assignment {
        targets = List.copyOf(targets);
        values = List.copyOf(values);
    }

    /**
     * @param source The position the absent assignment stands in for.
     * @return An assignment without targets and values.
     */
    public static Assignment empty(SourceInfo source) {
        return new Assignment(List.of(), List.of(), source);
    }

    /**
     * @return true if this assignment has no targets.
     */
    public boolean isEmpty() {
        return targets.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(targets);
        children.addAll(values);
        return children;
    }
}
