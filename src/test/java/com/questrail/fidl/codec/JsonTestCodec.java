package com.questrail.fidl.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * JsonTestCodec
 * -----------------------------------------------------------------------------
 * Test-only {@link FidlCodec}: a real {@link MessageHeader} followed by the
 * payload's plain form as JSON.
 *
 * <p>Every encode call is recorded with the type name the caller passed, so
 * tests can assert on what the bindings asked the codec to do.</p>
 */
public final class JsonTestCodec implements FidlCodec {

    public record Encoded(long ordinal, long txid, String library, String typeName, Object payload) {}

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<Encoded> encoded = new ArrayList<>();

    @Override
    public Object decodeMessage(byte[] bytes, List<Long> handles) {
        if (bytes.length <= MessageHeader.SIZE) {
            return null;
        }
        try {
            return mapper.readValue(bytes, MessageHeader.SIZE, bytes.length - MessageHeader.SIZE, Object.class);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Undecodable test payload", e);
        }
    }

    @Override
    public EncodedMessage encodeMessage(long ordinal, Object object, String library, long txid, String typeName) {
        Object plain = ValueConstructor.toPlain(object);
        synchronized (this) {
            encoded.add(new Encoded(ordinal, txid, library, typeName, plain));
        }
        byte[] header = MessageHeader.of(txid, ordinal).encode();
        if (plain == null) {
            return EncodedMessage.of(header);
        }
        byte[] body = json(plain);
        byte[] message = Arrays.copyOf(header, header.length + body.length);
        System.arraycopy(body, 0, message, header.length, body.length);
        return EncodedMessage.of(message);
    }

    @Override
    public EncodedMessage encodeObject(Object object, String library, String typeName) {
        Object plain = ValueConstructor.toPlain(object);
        synchronized (this) {
            encoded.add(new Encoded(0, 0, library, typeName, plain));
        }
        return EncodedMessage.of(json(plain));
    }

    /**
     * Builds a request message the way a remote client would.
     */
    public byte[] request(long txid, long ordinal, Object plainPayload) {
        byte[] header = MessageHeader.of(txid, ordinal).encode();
        if (plainPayload == null) {
            return header;
        }
        byte[] body = json(plainPayload);
        byte[] message = Arrays.copyOf(header, header.length + body.length);
        System.arraycopy(body, 0, message, header.length, body.length);
        return message;
    }

    public synchronized List<Encoded> encoded() {
        return Collections.unmodifiableList(new ArrayList<>(encoded));
    }

    private byte[] json(Object plain) {
        try {
            return mapper.writeValueAsBytes(plain);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unencodable test payload " + plain, e);
        }
    }
}
