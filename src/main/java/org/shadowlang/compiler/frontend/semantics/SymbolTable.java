package org.shadowlang.compiler.frontend.semantics;

import org.shadowlang.compiler.api.SourceInfo;
import org.shadowlang.compiler.frontend.parser.ast.AstNode;
import org.shadowlang.compiler.frontend.parser.ast.Type;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for managing scopes and variable bindings during semantic analysis.
 * It supports nested scopes and resolving names from the current scope outwards to the
 * root (global) scope.
 * <p>
 * The table owns all scopes. AST nodes do not reference their scope; instead the table maps
 * each scope-owning node (blocks and loop headers) to its scope by node identity.
 */
public class SymbolTable {

    /** Prefix of every variable storage name. */
    public static final String STORAGE_PREFIX = "v_";

    /**
     * Represents a single scope in the symbol table.
     */
    public static class Scope {
        private final Scope parent;
        private final List<Scope> children = new ArrayList<>();
        private final Map<String, Symbol> symbols = new LinkedHashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }

        void addChild(Scope child) {
            children.add(child);
        }

        /**
         * @return The enclosing scope, or {@code null} for the root scope.
         */
        public Scope getParent() {
            return parent;
        }

        /**
         * @return The scopes nested directly in this one, in creation order.
         */
        public List<Scope> getChildren() {
            return Collections.unmodifiableList(children);
        }

        /**
         * @param name The variable name.
         * @return The binding declared in exactly this scope, if any.
         */
        public Optional<Symbol> lookupLocal(String name) {
            return Optional.ofNullable(symbols.get(name));
        }
    }

    private final Scope rootScope;
    private Scope currentScope;
    private final Map<AstNode, Scope> scopeMap = new IdentityHashMap<>();
    private final Map<String, Integer> bindingsPerName = new HashMap<>();
    private final Map<String, Symbol> symbolsByStorage = new LinkedHashMap<>();

    /**
     * Constructs a new symbol table containing only the root scope.
     */
    public SymbolTable() {
        this.rootScope = new Scope(null);
        this.currentScope = this.rootScope;
    }

    /**
     * Resets the current scope to the root scope.
     */
    public void resetScope() {
        this.currentScope = this.rootScope;
    }

    /**
     * Enters a new scope nested in the current one.
     * @return The new scope.
     */
    public Scope enterScope() {
        Scope newScope = new Scope(currentScope);
        currentScope.addChild(newScope);
        currentScope = newScope;
        return newScope;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
    }

    /**
     * @return The scope new bindings are declared in.
     */
    Scope getCurrentScope() {
        return currentScope;
    }

    /**
     * @return The root (global) scope.
     */
    public Scope getRootScope() {
        return rootScope;
    }

    /**
     * Associates a scope with the node that owns it.
     * @param node A block or loop.
     * @param scope The node's scope.
     */
    public void bind(AstNode node, Scope scope) {
        scopeMap.put(node, scope);
    }

    /**
     * @param node A block or loop of the analyzed tree.
     * @return The scope owned by exactly this node instance, if any.
     */
    public Optional<Scope> scopeOf(AstNode node) {
        return Optional.ofNullable(scopeMap.get(node));
    }

    /**
     * Declares a new binding in the current scope and assigns it a unique storage name.
     * The caller checks for redeclaration first.
     * @param name The variable name.
     * @param type The binding's type.
     * @param shadowing Whether the binding was introduced with {@code shadow}.
     * @param declaredAt The declaring position.
     * @return The new symbol.
     * @throws IllegalStateException if the name is already bound in the current scope.
     */
    public Symbol declare(String name, Type type, boolean shadowing, SourceInfo declaredAt) {
        if (isDeclaredInCurrentScope(name)) {
            throw new IllegalStateException("'" + name + "' is already declared in the current scope.");
        }
        String shadowed = resolve(name).map(Symbol::storageName).orElse(null);
        int index = bindingsPerName.merge(name, 1, Integer::sum);
        String storageName = index == 1 ? STORAGE_PREFIX + name : STORAGE_PREFIX + name + "@" + index;
        Symbol symbol = new Symbol(name, type, shadowing, storageName, shadowed, declaredAt);
        currentScope.symbols.put(name, symbol);
        symbolsByStorage.put(storageName, symbol);
        return symbol;
    }

    /**
     * Fixes the type of a binding that was declared with an unknown type.
     * @param symbol The binding.
     * @param type The type to fix.
     * @return The updated symbol.
     */
    public Symbol refineType(Symbol symbol, Type type) {
        Symbol updated = symbol.withType(type);
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            if (scope.lookupLocal(symbol.name()).orElse(null) == symbol) {
                scope.symbols.put(symbol.name(), updated);
                break;
            }
        }
        symbolsByStorage.put(updated.storageName(), updated);
        return updated;
    }

    /**
     * Resolves a name, searching from the current scope upwards to the root.
     * @param name The variable name.
     * @return The innermost visible binding, or empty if there is none.
     */
    public Optional<Symbol> resolve(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * @param name The variable name.
     * @return true if the name is bound in the current scope itself.
     */
    public boolean isDeclaredInCurrentScope(String name) {
        return currentScope.lookupLocal(name).isPresent();
    }

    /**
     * @param storageName A storage name handed out by {@link #declare}.
     * @return The binding with that storage name.
     */
    public Optional<Symbol> byStorageName(String storageName) {
        return Optional.ofNullable(symbolsByStorage.get(storageName));
    }

    /**
     * @return All bindings of all scopes, in declaration order.
     */
    public Collection<Symbol> getAllSymbols() {
        return Collections.unmodifiableCollection(symbolsByStorage.values());
    }
}
