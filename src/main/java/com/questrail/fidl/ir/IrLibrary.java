package com.questrail.fidl.ir;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * IrLibrary
 * -----------------------------------------------------------------------------
 * A parsed IR document for one library.
 *
 * <h2>Declaration tables</h2>
 * The document carries:
 * <ul>
 *   <li>a {@code declarations} map from raw identifier to kind spelling</li>
 *   <li>one {@code <kind>_declarations} list per kind</li>
 *   <li>a {@code declaration_order} list: a topological order in which every
 *       declaration only references declarations that precede it</li>
 * </ul>
 *
 * Instances are immutable and shared process-wide through {@link IrRegistry};
 * identity matters, so never re-parse a document outside the registry.
 */
public final class IrLibrary extends IrNode
{
    private final Map<DeclarationKind, Map<String, IrNode>> declarationsByKind;
    private final Map<String, String> declarationKinds;
    private final List<String> declarationOrder;

    public IrLibrary(Path source, JsonNode json) {
        super(source, json);

        Map<DeclarationKind, Map<String, IrNode>> byKind = new EnumMap<>(DeclarationKind.class);
        for (DeclarationKind kind : DeclarationKind.values()) {
            Map<String, IrNode> table = new LinkedHashMap<>();
            for (IrNode declaration : list(kind.declarationListKey())) {
                table.put(declaration.rawName(), declaration);
            }
            byKind.put(kind, Collections.unmodifiableMap(table));
        }
        this.declarationsByKind = Collections.unmodifiableMap(byKind);

        Map<String, String> kinds = new LinkedHashMap<>();
        find("declarations").ifPresent(node ->
                node.json().fields().forEachRemaining(e -> kinds.put(e.getKey(), e.getValue().asText())));
        this.declarationKinds = Collections.unmodifiableMap(kinds);

        List<String> order = new ArrayList<>();
        for (IrNode entry : list("declaration_order")) {
            order.add(entry.json().asText());
        }
        this.declarationOrder = Collections.unmodifiableList(order);
    }

    /**
     * @return the library name, e.g. {@code fuchsia.io}
     */
    public String libraryName() {
        return rawName();
    }

    /**
     * Looks up the kind spelling of a declaration in this library.
     *
     * @param rawIdentifier identifier as spelled in the IR (may contain underscores)
     * @return the kind (e.g. {@code "struct"}), or empty if this library does not declare it
     */
    public Optional<String> declarationKind(String rawIdentifier) {
        return Optional.ofNullable(declarationKinds.get(rawIdentifier));
    }

    public Optional<IrNode> declaration(DeclarationKind kind, String rawIdentifier) {
        return Optional.ofNullable(declarationsByKind.get(kind).get(rawIdentifier));
    }

    /**
     * Declarations of one kind, in {@code declaration_order}.
     */
    public List<IrNode> sortedDeclarations(DeclarationKind kind) {
        Map<String, IrNode> table = declarationsByKind.get(kind);
        List<IrNode> sorted = new ArrayList<>();
        for (String identifier : declarationOrder) {
            IrNode declaration = table.get(identifier);
            if (declaration != null && kind.irName().equals(declarationKinds.get(identifier))) {
                sorted.add(declaration);
            }
        }
        return sorted;
    }

    public List<String> declarationOrder() {
        return declarationOrder;
    }

    public List<String> libraryDependencies() {
        List<String> names = new ArrayList<>();
        for (IrNode dependency : list("library_dependencies")) {
            names.add(dependency.rawName());
        }
        return names;
    }

    @Override
    public String toString() {
        return "IrLibrary(" + libraryName() + " @ " + source() + ")";
    }
}
