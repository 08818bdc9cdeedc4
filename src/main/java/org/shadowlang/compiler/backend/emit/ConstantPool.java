package org.shadowlang.compiler.backend.emit;

import org.shadowlang.compiler.api.AssemblyDocument.ConstantEntry;
import org.shadowlang.compiler.api.AssemblyDocument.DataEntry;
import org.shadowlang.compiler.frontend.TreeWalker;
import org.shadowlang.compiler.frontend.parser.ast.AstNode;
import org.shadowlang.compiler.frontend.parser.ast.Constant;
import org.shadowlang.compiler.frontend.parser.ast.Type;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Promotes every distinct literal of a program to a named constant.
 * <ul>
 *   <li>int: {@code c0 equ 42}</li>
 *   <li>float: {@code c1 equ 0x...}, the IEEE-754 bit pattern of the double</li>
 *   <li>bool: {@code c2 equ 1}</li>
 *   <li>string: the bytes as data {@code s0 db "text"} plus {@code s0@len equ 4}</li>
 * </ul>
 */
public class ConstantPool {

    /** Suffix of the length constant or slot that belongs to a string. */
    public static final String LENGTH_SUFFIX = "@len";

    private final Map<String, String> namesByLiteral = new LinkedHashMap<>();
    private final List<ConstantEntry> constants = new ArrayList<>();
    private final List<DataEntry> data = new ArrayList<>();
    private int nextScalar = 0;
    private int nextString = 0;

    /**
     * Collects all constants below the given node, in source order.
     * @param root The root of the typed tree.
     * @return The filled pool.
     */
    public static ConstantPool collect(AstNode root) {
        ConstantPool pool = new ConstantPool();
        new TreeWalker(Map.of(Constant.class, node -> pool.add((Constant) node))).walk(root);
        return pool;
    }

    /**
     * Adds a literal unless an equal literal is already pooled.
     * @param constant The constant.
     * @return The symbol name of the literal.
     */
    public String add(Constant constant) {
        String existing = namesByLiteral.get(constant.literal());
        if (existing != null) {
            return existing;
        }
        String name;
        if (constant.type() == Type.STRING) {
            name = "s" + nextString++;
            String text = constant.value();
            data.add(new DataEntry(name, "db", text.isEmpty() ? "0" : "\"" + text + "\""));
            int length = text.getBytes(StandardCharsets.UTF_8).length;
            constants.add(new ConstantEntry(name + LENGTH_SUFFIX, Integer.toString(length)));
        } else {
            name = "c" + nextScalar++;
            constants.add(new ConstantEntry(name, valueOf(constant)));
        }
        namesByLiteral.put(constant.literal(), name);
        return name;
    }

    /**
     * @param constant A pooled constant.
     * @return Its symbol name.
     * @throws IllegalStateException if the literal was never pooled.
     */
    public String nameOf(Constant constant) {
        String name = namesByLiteral.get(constant.literal());
        if (name == null) {
            throw new IllegalStateException("Literal " + constant.literal() + " is not in the constant pool.");
        }
        return name;
    }

    /**
     * @return The {@code equ} definitions.
     */
    public List<ConstantEntry> constants() {
        return List.copyOf(constants);
    }

    /**
     * @return The string literal data.
     */
    public List<DataEntry> data() {
        return List.copyOf(data);
    }

    private static String valueOf(Constant constant) {
        return switch (constant.type()) {
            case INT -> Long.toString(Long.parseLong(constant.literal()));
            case FLOAT -> String.format("0x%016X", Double.doubleToRawLongBits(Double.parseDouble(constant.literal())));
            case BOOL -> "true".equals(constant.literal()) ? "1" : "0";
            default -> throw new IllegalStateException("Constant " + constant.literal() + " has no scalar value.");
        };
    }
}
