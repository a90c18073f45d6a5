package com.questrail.fidl.codec;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Output of the codec: wire bytes plus the handles to transfer with them.
 */
public record EncodedMessage(
        byte[] bytes,
        List<HandleDisposition> handles
) {
    public EncodedMessage {
        Objects.requireNonNull(bytes, "bytes");
        handles = List.copyOf(Objects.requireNonNull(handles, "handles"));
    }

    public static EncodedMessage of(byte[] bytes) {
        return new EncodedMessage(bytes, List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncodedMessage)) {
            return false;
        }
        EncodedMessage other = (EncodedMessage) o;
        return Arrays.equals(bytes, other.bytes) && handles.equals(other.handles);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + handles.hashCode();
    }

    @Override
    public String toString() {
        return "EncodedMessage(" + bytes.length + " bytes, " + handles.size() + " handles)";
    }
}
