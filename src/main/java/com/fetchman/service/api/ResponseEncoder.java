package com.fetchman.service.api;

import com.fetchman.model.EncodedBody;

public interface ResponseEncoder {

    /**
     * Classifies a raw response payload and encodes it for transport.
     *
     * @param raw                The complete response body, may be empty.
     * @param contentType        The declared {@code Content-Type}, may be {@code null}.
     * @param contentDisposition The declared {@code Content-Disposition}, may be {@code null}.
     * @return The encoded body. Never fails: undecodable payloads fall back to text or base64.
     */
    EncodedBody encode(byte[] raw, String contentType, String contentDisposition);
}
