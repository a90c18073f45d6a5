package com.questrail.fidl.ir;

import java.util.Optional;

/**
 * IrMethod
 * -----------------------------------------------------------------------------
 * One method record of a protocol declaration.
 *
 * <p>The IR uses direction-based terminology: a method with
 * {@code has_request == false} is an <em>event</em> (server to client) whose
 * payload lives under {@code maybe_response_payload}.</p>
 */
public final class IrMethod extends IrNode
{
    private static final String REQUEST_PAYLOAD = "maybe_request_payload";
    private static final String RESPONSE_PAYLOAD = "maybe_response_payload";

    public IrMethod(IrNode node) {
        super(node.source(), node.json());
    }

    public long ordinal() {
        return longValue("ordinal");
    }

    public boolean hasRequest() {
        return flag("has_request");
    }

    public boolean hasResponse() {
        return flag("has_response");
    }

    public boolean strict() {
        return flag("strict");
    }

    public boolean hasError() {
        return flag("has_error");
    }

    /**
     * A result is a response that can carry an error: either the method
     * declares an error type, or it is a flexible two-way method (which may
     * answer with a framework error).
     */
    public boolean hasResult() {
        return hasError() || (!strict() && hasResponse());
    }

    public Optional<IrNode> requestPayload() {
        return find(REQUEST_PAYLOAD);
    }

    public Optional<IrNode> responsePayload() {
        return find(RESPONSE_PAYLOAD);
    }

    /**
     * @return the normalized request payload identifier, if the method has a payload
     */
    public Optional<String> requestPayloadIdentifier() {
        return requestPayload().map(IrNode::identifier);
    }

    /**
     * @return the response payload identifier as spelled in the IR
     */
    public Optional<String> responsePayloadRawIdentifier() {
        return responsePayload().map(IrNode::rawIdentifier);
    }
}
