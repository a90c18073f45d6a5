package com.questrail.fidl.ir;

import java.util.Set;

/**
 * Identifiers
 * -----------------------------------------------------------------------------
 * Helpers for the identifier spellings that appear in FIDL IR.
 *
 * <p>A fully-qualified identifier has the form {@code library.name/Member},
 * for example {@code fuchsia.io/Directory}. The compiler generates result and
 * response payload names such as {@code x/Echo_Say_Result}; those are
 * <em>normalized</em> by dropping every underscore so that the same logical
 * name is produced no matter how often it is looked up.</p>
 *
 * <p>All functions are pure.</p>
 */
public final class Identifiers
{
    private static final String RESULT_SUFFIX = "_Result";
    private static final String RESPONSE_SUFFIX = "_Response";

    /**
     * Java keywords and literals, plus the members of {@link Object} that a
     * subclass cannot redeclare with an arbitrary signature.
     */
    private static final Set<String> RESERVED = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char",
            "class", "const", "continue", "default", "do", "double", "else", "enum",
            "extends", "final", "finally", "float", "for", "goto", "if", "implements",
            "import", "instanceof", "int", "interface", "long", "native", "new",
            "package", "private", "protected", "public", "return", "short", "static",
            "strictfp", "super", "switch", "synchronized", "this", "throw", "throws",
            "transient", "try", "void", "volatile", "while", "true", "false", "null",
            "var", "yield", "record", "sealed", "permits", "_",
            "wait", "notify", "notifyAll", "getClass", "hashCode", "equals",
            "toString", "clone", "finalize");

    private Identifiers() {
    }

    /**
     * Normalizes result and response identifiers by removing underscores.
     * Any other identifier is returned unchanged.
     *
     * <p>Idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.</p>
     */
    public static String normalize(String identifier) {
        if (identifier.endsWith(RESULT_SUFFIX) || identifier.endsWith(RESPONSE_SUFFIX)) {
            return identifier.replace("_", "");
        }
        return identifier;
    }

    /**
     * {@code foo.bar/Baz} returns {@code foo.bar}. An identifier without a
     * library part is returned as-is.
     */
    public static String libraryOf(String identifier) {
        int slash = identifier.indexOf('/');
        return slash < 0 ? identifier : identifier.substring(0, slash);
    }

    /**
     * {@code foo.bar/Baz_Result} returns {@code BazResult}.
     */
    public static String memberOf(String identifier) {
        String normalized = normalize(identifier);
        int slash = normalized.indexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }

    /**
     * Protocol discovery marker: {@code foo.bar/Baz} returns {@code foo.bar.Baz}.
     */
    public static String marker(String identifier) {
        return normalize(identifier).replace('/', '.');
    }

    /**
     * Struct, table and union member name: snake_case, with a trailing
     * underscore when the name is reserved.
     */
    public static String memberName(String name) {
        return disambiguate(camelToSnake(name));
    }

    /**
     * Protocol method name as exposed to Java handlers: lowerCamelCase, with a
     * trailing underscore when the name is reserved.
     */
    public static String methodName(String name) {
        String camel = name.indexOf('_') >= 0 ? snakeToCamel(name) : name;
        if (camel.isEmpty()) {
            return camel;
        }
        return disambiguate(Character.toLowerCase(camel.charAt(0)) + camel.substring(1));
    }

    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    static String disambiguate(String name) {
        return isReserved(name) ? name + "_" : name;
    }

    /**
     * {@code FooBar} returns {@code foo_bar}, {@code HTTPServer} returns
     * {@code http_server}. Names already in snake_case are unchanged.
     */
    public static String camelToSnake(String name) {
        StringBuilder out = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                boolean hasPrev = i > 0 && name.charAt(i - 1) != '_';
                boolean prevLowerOrDigit = i > 0
                        && (Character.isLowerCase(name.charAt(i - 1)) || Character.isDigit(name.charAt(i - 1)));
                boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                if (hasPrev && (prevLowerOrDigit || nextLower)) {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            }
            else {
                out.append(c);
            }
        }
        return out.toString();
    }

    static String snakeToCamel(String name) {
        StringBuilder out = new StringBuilder(name.length());
        boolean upperNext = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upperNext = out.length() > 0;
                continue;
            }
            out.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        return out.toString();
    }
}
