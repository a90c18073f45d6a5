package com.questrail.fidl.library;

import com.questrail.fidl.decl.AliasType;
import com.questrail.fidl.decl.BitsType;
import com.questrail.fidl.decl.CompiledDeclaration;
import com.questrail.fidl.decl.ConstDeclaration;
import com.questrail.fidl.decl.EnumType;
import com.questrail.fidl.decl.StructType;
import com.questrail.fidl.decl.TableType;
import com.questrail.fidl.decl.UnionType;
import com.questrail.fidl.ir.DefinitionException;
import com.questrail.fidl.protocol.ProtocolType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * LibraryNamespace
 * -----------------------------------------------------------------------------
 * Every compiled declaration of one library, keyed by member name.
 *
 * <p>Declarations are exported in the order they were compiled. Once the
 * owning {@link LibraryRegistry} has finished materializing the library the
 * namespace is sealed and never changes again.</p>
 */
public final class LibraryNamespace
{
    private final String library;
    private final String documentation;
    private final Map<String, CompiledDeclaration> exports = new LinkedHashMap<>();
    private volatile boolean sealed;

    LibraryNamespace(String library, String documentation) {
        this.library = library;
        this.documentation = documentation;
    }

    public String library() {
        return library;
    }

    public String documentation() {
        return documentation;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * @return exported member names, in export order
     */
    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(exports.keySet()));
    }

    public Collection<CompiledDeclaration> declarations() {
        return Collections.unmodifiableCollection(exports.values());
    }

    public boolean contains(String name) {
        return exports.containsKey(name);
    }

    public Optional<CompiledDeclaration> find(String name) {
        return Optional.ofNullable(exports.get(name));
    }

    /**
     * @throws DefinitionException if the library exports no such member
     */
    public CompiledDeclaration get(String name) {
        CompiledDeclaration declaration = exports.get(name);
        if (declaration == null) {
            throw new DefinitionException("Library " + library + " has no member " + name);
        }
        return declaration;
    }

    public StructType struct(String name) {
        return get(name, StructType.class);
    }

    public TableType table(String name) {
        return get(name, TableType.class);
    }

    public UnionType union(String name) {
        return get(name, UnionType.class);
    }

    public EnumType enumType(String name) {
        return get(name, EnumType.class);
    }

    public BitsType bits(String name) {
        return get(name, BitsType.class);
    }

    public AliasType alias(String name) {
        return get(name, AliasType.class);
    }

    public ConstDeclaration constant(String name) {
        return get(name, ConstDeclaration.class);
    }

    public ProtocolType protocol(String name) {
        return get(name, ProtocolType.class);
    }

    private <T extends CompiledDeclaration> T get(String name, Class<T> type) {
        CompiledDeclaration declaration = get(name);
        if (!type.isInstance(declaration)) {
            throw new DefinitionException(library + "/" + name + " is a " + declaration.kind().irName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(declaration);
    }

    void export(CompiledDeclaration declaration) {
        if (sealed) {
            throw new IllegalStateException("Library " + library + " is already materialized");
        }
        exports.put(declaration.name(), declaration);
    }

    void seal() {
        sealed = true;
    }

    @Override
    public String toString() {
        return "LibraryNamespace(" + library + ", " + exports.size() + " declarations)";
    }
}
