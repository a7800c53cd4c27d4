package com.fetchman.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fetchman.model.BodyEncoding;
import com.fetchman.model.BodyType;
import com.fetchman.model.EncodedBody;
import com.fetchman.service.api.ResponseEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a raw response payload to one of the five body representations.
 * <p>
 * Classification, first match wins: empty body, JSON, HTML, other {@code text/*}, {@code image/*},
 * anything else as binary. Text payloads that are not valid UTF-8 and JSON payloads that do not
 * parse degrade to a safer representation instead of failing the execution.
 */
@Service
@Slf4j
public class ResponseEncoderImpl implements ResponseEncoder {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final ObjectReader jsonReader;

    public ResponseEncoderImpl(ObjectMapper objectMapper) {
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public EncodedBody encode(byte[] raw, String contentType, String contentDisposition) {
        if (raw == null || raw.length == 0) {
            return EncodedBody.text("");
        }
        String type = contentType == null ? "" : contentType.trim().toLowerCase(Locale.ROOT);

        EncodedBody encoded;
        if (type.contains("application/json")) {
            encoded = encodeJson(raw);
        } else if (type.contains("text/html")) {
            encoded = decodeUtf8(raw).map(EncodedBody::html).orElseGet(() -> EncodedBody.binary(raw));
        } else if (type.startsWith("text/")) {
            encoded = decodeUtf8(raw).map(EncodedBody::text).orElseGet(() -> EncodedBody.binary(raw));
        } else if (type.startsWith("image/")) {
            encoded = EncodedBody.image(raw);
        } else {
            encoded = EncodedBody.binary(raw);
        }

        if (encoded.bodyType() == BodyType.BINARY && declaresFilename(contentDisposition)) {
            encoded = encoded.withEncoding(BodyEncoding.BASE64);
        }
        return encoded;
    }

    private EncodedBody encodeJson(byte[] raw) {
        Optional<String> decoded = decodeUtf8(raw);
        if (decoded.isEmpty()) {
            return EncodedBody.binary(raw);
        }
        String text = decoded.get();
        // a leading byte order mark is not JSON whitespace
        String json = text.startsWith(BYTE_ORDER_MARK) ? text.substring(1) : text;
        try {
            JsonNode parsed = jsonReader.readTree(json);
            if (parsed == null || parsed.isMissingNode()) {
                return EncodedBody.text(text);
            }
            return EncodedBody.json(parsed, text);
        } catch (JsonProcessingException e) {
            log.debug("Response declared JSON but did not parse, returning it as text: {}", e.getOriginalMessage());
            return EncodedBody.text(text);
        }
    }

    /**
     * Strict UTF-8 decoding: malformed input yields empty instead of replacement characters.
     */
    private Optional<String> decodeUtf8(byte[] raw) {
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString());
        } catch (CharacterCodingException e) {
            log.debug("Response body is not valid UTF-8, falling back to base64");
            return Optional.empty();
        }
    }

    private boolean declaresFilename(String contentDisposition) {
        if (contentDisposition == null || contentDisposition.isBlank()) {
            return false;
        }
        try {
            return ContentDisposition.parse(contentDisposition).getFilename() != null;
        } catch (IllegalArgumentException e) {
            return contentDisposition.toLowerCase(Locale.ROOT).contains("filename");
        }
    }
}
