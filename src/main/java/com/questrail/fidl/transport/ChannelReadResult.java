package com.questrail.fidl.transport;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a single {@link Channel#read()}.
 */
public sealed interface ChannelReadResult
        permits ChannelReadResult.Message, ChannelReadResult.WouldBlock, ChannelReadResult.PeerClosed
{
    WouldBlock WOULD_BLOCK = new WouldBlock();
    PeerClosed PEER_CLOSED = new PeerClosed();

    /** A complete message and the raw values of the handles transferred with it. */
    record Message(byte[] bytes, List<Long> handles) implements ChannelReadResult {
        public Message {
            Objects.requireNonNull(bytes, "bytes");
            handles = List.copyOf(Objects.requireNonNull(handles, "handles"));
        }

        public static Message of(byte[] bytes) {
            return new Message(bytes, List.of());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Message)) {
                return false;
            }
            Message other = (Message) o;
            return Arrays.equals(bytes, other.bytes) && handles.equals(other.handles);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(bytes) + handles.hashCode();
        }

        @Override
        public String toString() {
            return "Message(" + bytes.length + " bytes, " + handles.size() + " handles)";
        }
    }

    /** Nothing is queued yet. */
    record WouldBlock() implements ChannelReadResult {
    }

    /** The peer closed its end; nothing more will arrive. */
    record PeerClosed() implements ChannelReadResult {
    }
}
