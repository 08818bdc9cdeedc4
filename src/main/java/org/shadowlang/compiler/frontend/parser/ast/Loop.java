package org.shadowlang.compiler.frontend.parser.ast;

import org.shadowlang.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code for} loop. The body runs while all tests hold; an empty test list always holds.
 *
 * @param init The assignment run once before the first test, possibly empty.
 * @param tests The tests, combined with a logical and.
 * @param step The assignment run after each pass of the body, possibly empty.
 * @param body The loop body.
 * @param source The position of the {@code for} keyword.
 */
public record Loop(
        Assignment init,
        List<Expression> tests,
        Assignment step,
        Block body,
        SourceInfo source
) implements Statement {

    /**
     * Compact constructor making the test list immutable.
     */
    public Loop {
        tests = List.copyOf(tests);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(init);
        children.addAll(tests);
        children.add(step);
        children.add(body);
        return children;
    }
}
