package org.shadowlang.compiler.frontend.parser.ast;

import org.shadowlang.compiler.api.SourceInfo;

import java.util.regex.Pattern;

/**
 * A literal constant. Its type is derived from the literal's shape when it is parsed.
 *
 * @param literal The literal exactly as written, including quotes for strings.
 * @param type The type derived from the literal's shape.
 * @param source The position of the literal.
 */
public record Constant(
        String literal,
        Type type,
        SourceInfo source
) implements Expression {

    private static final Pattern FLOAT = Pattern.compile("-?\\d+\\.\\d*");
    private static final Pattern INT = Pattern.compile("-?\\d+");
    private static final Pattern STRING = Pattern.compile("\".*\"");
    private static final Pattern BOOL = Pattern.compile("true|false");

    /**
     * Creates a constant whose type is classified from the literal.
     * @param literal The literal text.
     * @param source The source position.
     */
    public Constant(String literal, SourceInfo source) {
        this(literal, classify(literal), source);
    }

    /**
     * Classifies a literal by trying, in order, the float, int, string and bool shapes.
     * @param literal The literal text.
     * @return The first matching type, or {@link Type#UNKNOWN} if no shape matches.
     */
    public static Type classify(String literal) {
        if (FLOAT.matcher(literal).matches()) return Type.FLOAT;
        if (INT.matcher(literal).matches()) return Type.INT;
        if (STRING.matcher(literal).matches()) return Type.STRING;
        if (BOOL.matcher(literal).matches()) return Type.BOOL;
        return Type.UNKNOWN;
    }

    /**
     * @return For string constants, the text between the quotes; otherwise the literal itself.
     */
    public String value() {
        if (type == Type.STRING) {
            return literal.substring(1, literal.length() - 1);
        }
        return literal;
    }
}
