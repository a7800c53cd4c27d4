package com.fetchman.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * The normalized, timed result of one outbound call.
 *
 * @param status      Numeric HTTP status.
 * @param statusText  Reason phrase of the status, empty for non-standard codes.
 * @param headers     Response headers with lower-cased names.
 * @param body        Parsed JSON, UTF-8 text or base64, depending on {@code bodyType}.
 * @param bodyType    Classification of the payload.
 * @param bodyText    Decoded text for JSON and HTML payloads.
 * @param encoding    Encoding of {@code body} when it is a string.
 * @param contentType Content type exactly as the server declared it.
 * @param elapsedMs   Wall-clock time from issuing the call to having read the full body.
 * @param sizeBytes   Exact byte length of the raw payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(
        int status,
        String statusText,
        Map<String, String> headers,
        Object body,
        BodyType bodyType,
        String bodyText,
        BodyEncoding encoding,
        String contentType,
        long elapsedMs,
        long sizeBytes) {

    public static ExecutionResponse of(int status, String statusText, Map<String, String> headers,
                                       EncodedBody encoded, String contentType, long elapsedMs, long sizeBytes) {
        return new ExecutionResponse(status, statusText, headers, encoded.body(), encoded.bodyType(),
                encoded.bodyText(), encoded.encoding(), contentType, elapsedMs, sizeBytes);
    }
}
