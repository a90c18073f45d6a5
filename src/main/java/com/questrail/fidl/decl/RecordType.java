package com.questrail.fidl.decl;

import com.questrail.fidl.ir.DeclarationKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * RecordType
 * -----------------------------------------------------------------------------
 * Common base of structs and tables: an ordered list of named members and a
 * factory for {@link RecordValue}s.
 *
 * <p>Subclasses decide what happens to a member the caller leaves out and
 * what a default-constructed value holds.</p>
 */
public abstract class RecordType extends AbstractDeclaration implements EncodableType
{
    private final List<MemberSpec> members;
    private final Map<String, MemberSpec> membersByName;

    protected RecordType(DeclarationKind kind, String rawQualifiedName, Optional<String> documentation,
                         List<MemberSpec> members) {
        super(kind, rawQualifiedName, documentation);
        this.members = List.copyOf(members);
        Map<String, MemberSpec> byName = new LinkedHashMap<>();
        for (MemberSpec member : this.members) {
            byName.put(member.name(), member);
        }
        this.membersByName = Collections.unmodifiableMap(byName);
    }

    public List<MemberSpec> members() {
        return members;
    }

    public Optional<MemberSpec> member(String name) {
        return Optional.ofNullable(membersByName.get(name));
    }

    /**
     * Builds a value from member values keyed by member name.
     *
     * @throws IllegalArgumentException for an undeclared member name, a value
     *         of the wrong kind, {@code null} for a member that cannot hold it,
     *         or (structs) a missing member
     */
    public RecordValue create(Map<String, ?> values) {
        for (String name : values.keySet()) {
            if (!membersByName.containsKey(name)) {
                throw new IllegalArgumentException(qualifiedName() + " has no member '" + name + "'");
            }
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (MemberSpec member : members) {
            Object value = values.containsKey(member.name())
                    ? accept(member, values.get(member.name()))
                    : omitted(member);
            fields.put(member.name(), value);
        }
        return new RecordValue(this, fields);
    }

    @Override
    public RecordValue makeDefault() {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (MemberSpec member : members) {
            fields.put(member.name(), defaultValue(member));
        }
        return new RecordValue(this, fields);
    }

    /**
     * Value of a member left out of {@link #create(Map)}.
     */
    protected abstract Object omitted(MemberSpec member);

    /**
     * Value of a member in {@link #makeDefault()}.
     */
    protected abstract Object defaultValue(MemberSpec member);

    /**
     * Whether a member may be explicitly set to {@code null}.
     */
    protected abstract boolean allowsNull(MemberSpec member);

    private Object accept(MemberSpec member, Object value) {
        if (value == null && !allowsNull(member)) {
            throw new IllegalArgumentException(qualifiedName() + "." + member.name()
                    + ": null for non-nullable " + member.type());
        }
        return member.accept(value, qualifiedName());
    }

    RecordValue with(RecordValue base, String name, Object value) {
        MemberSpec member = member(name)
                .orElseThrow(() -> new IllegalArgumentException(qualifiedName() + " has no member '" + name + "'"));
        Map<String, Object> fields = new LinkedHashMap<>(base.fields());
        fields.put(name, accept(member, value));
        return new RecordValue(this, fields);
    }
}
