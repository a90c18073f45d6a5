package com.questrail.fidl.decl;

import com.questrail.fidl.codec.EncodedMessage;
import com.questrail.fidl.codec.FidlCodec;

/**
 * A type whose values can be encoded standalone: structs, tables and unions.
 */
public interface EncodableType extends DeclaredType
{
    /**
     * Encodes a value of this type, yielding the wire bytes and the handles to
     * transfer with them. The codec is given the raw fully-qualified type name.
     */
    default EncodedMessage encode(Object value, FidlCodec codec) {
        return codec.encodeObject(value, library(), rawQualifiedName());
    }
}
