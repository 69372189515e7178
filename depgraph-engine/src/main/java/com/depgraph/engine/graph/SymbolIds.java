package com.depgraph.engine.graph;

/**
 * Generates deterministic, file-scoped symbol ids following the convention:
 *   {@code <file-path>#<name>/<arity>}
 * e.g. {@code src/orders.py#OrderService.create/1} or {@code src/orders.py#<module>/0}.
 */
public final class SymbolIds {

    /** Name of the pseudo-symbol that owns a file's top-level code and imports. */
    public static final String MODULE_NAME = "<module>";

    private SymbolIds() {}

    public static String of(String fileId, String name, int arity) {
        return fileId + "#" + name + "/" + arity;
    }

    public static String module(String fileId) {
        return of(fileId, MODULE_NAME, 0);
    }

    /** File id component of a symbol id. Names never contain '#', paths may. */
    public static String fileOf(String symbolId) {
        int sep = symbolId.lastIndexOf('#');
        if (sep < 0) {
            throw new IllegalArgumentException("Not a symbol id: " + symbolId);
        }
        return symbolId.substring(0, sep);
    }

    /** {@code OrderService.create} -> {@code create}; bare names are returned unchanged. */
    public static String simpleName(String name) {
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    /**
     * Whether a reference name is qualified by a type ({@code PaymentService.charge}) rather than by a
     * module or variable ({@code utils.helper}). Type-qualified names must match a symbol exactly.
     */
    public static boolean isTypeQualified(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0) return false;
        String qualifier = name.substring(0, dot);
        int lastSegment = qualifier.lastIndexOf('.');
        char first = qualifier.charAt(lastSegment + 1);
        return Character.isUpperCase(first);
    }
}
