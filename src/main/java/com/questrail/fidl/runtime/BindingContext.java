package com.questrail.fidl.runtime;

import com.questrail.fidl.codec.FidlCodec;
import com.questrail.fidl.codec.ValueConstructor;
import com.questrail.fidl.decl.TypeLookup;
import com.questrail.fidl.observability.BindingObservabilitySink;
import com.questrail.fidl.observability.NullObservabilitySink;
import com.questrail.fidl.transport.HandleWaker;

import java.util.Objects;

/**
 * Collaborators shared by every server, client and event handler bound
 * through one {@link BindingRuntime}.
 */
public record BindingContext(
        FidlCodec codec,
        HandleWaker waker,
        TypeLookup types,
        ValueConstructor values,
        BindingObservabilitySink sink
) {
    public BindingContext {
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(waker, "waker");
        Objects.requireNonNull(types, "types");
        Objects.requireNonNull(values, "values");
        sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
    }

    public static BindingContext of(FidlCodec codec, HandleWaker waker, TypeLookup types,
                                    BindingObservabilitySink sink) {
        return new BindingContext(codec, waker, types, new ValueConstructor(types), sink);
    }
}
