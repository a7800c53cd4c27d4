package com.fetchman.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Base64;

/**
 * A response payload mapped to one of the five transport-safe representations.
 *
 * @param bodyType The classification.
 * @param body     A {@link JsonNode} for {@code json}, otherwise a string (UTF-8 text or base64).
 * @param bodyText The decoded text for {@code json} and {@code html}, {@code null} otherwise.
 * @param encoding How {@code body} is encoded when it is a string.
 */
public record EncodedBody(BodyType bodyType, Object body, String bodyText, BodyEncoding encoding) {

    public static EncodedBody text(String text) {
        return new EncodedBody(BodyType.TEXT, text, null, BodyEncoding.UTF8);
    }

    public static EncodedBody json(JsonNode parsed, String text) {
        return new EncodedBody(BodyType.JSON, parsed, text, BodyEncoding.UTF8);
    }

    public static EncodedBody html(String text) {
        return new EncodedBody(BodyType.HTML, text, text, BodyEncoding.UTF8);
    }

    public static EncodedBody image(byte[] raw) {
        return new EncodedBody(BodyType.IMAGE, Base64.getEncoder().encodeToString(raw), null, BodyEncoding.BASE64);
    }

    public static EncodedBody binary(byte[] raw) {
        return new EncodedBody(BodyType.BINARY, Base64.getEncoder().encodeToString(raw), null, BodyEncoding.BASE64);
    }

    public EncodedBody withEncoding(BodyEncoding newEncoding) {
        return new EncodedBody(bodyType, body, bodyText, newEncoding);
    }
}
