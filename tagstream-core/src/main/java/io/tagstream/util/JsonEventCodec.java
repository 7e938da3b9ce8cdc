package io.tagstream.util;

import io.tagstream.EventDecodingException;
import io.tagstream.model.StoredEvent;
import io.tagstream.spi.EventCodec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Dependency-free {@link EventCodec} storing an event as a flat UTF-8 JSON object:
 *
 * <pre>{@code {"entityId":"order-1","sequenceNumber":3,"payload":"..."}}</pre>
 *
 * <p>Only {@link String} payloads (or {@code null}) are supported. Applications with
 * richer payloads plug in their own codec backed by Jackson, Protobuf or similar.
 * Unknown keys are ignored on decode.
 */
public final class JsonEventCodec implements EventCodec {
    public static final JsonEventCodec INSTANCE = new JsonEventCodec();

    private static final String ENTITY_ID = "entityId";
    private static final String SEQUENCE_NUMBER = "sequenceNumber";
    private static final String PAYLOAD = "payload";

    private JsonEventCodec() {
    }

    @Override
    public byte[] encode(StoredEvent event) {
        Object payload = event.payload();
        if (payload != null && !(payload instanceof String)) {
            throw new IllegalArgumentException(
                    "JsonEventCodec only supports String payloads, got " + payload.getClass().getName());
        }
        StringBuilder sb = new StringBuilder(64);
        sb.append('{');
        appendString(sb.append('"').append(ENTITY_ID).append("\":"), event.entityId());
        sb.append(",\"").append(SEQUENCE_NUMBER).append("\":").append(event.sequenceNumber());
        sb.append(",\"").append(PAYLOAD).append("\":");
        if (payload == null) {
            sb.append("null");
        } else {
            appendString(sb, (String) payload);
        }
        sb.append('}');
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public StoredEvent decode(byte[] serialized) {
        if (serialized == null) {
            throw new EventDecodingException("Cannot decode null entry", null);
        }
        String json;
        try {
            json = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(serialized))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new EventDecodingException("Entry is not valid UTF-8", e);
        }
        Map<String, Object> fields;
        try {
            fields = new Reader(json).readObject();
        } catch (IllegalArgumentException e) {
            throw new EventDecodingException("Malformed event JSON: " + e.getMessage(), e);
        }
        Object entityId = fields.get(ENTITY_ID);
        Object sequenceNumber = fields.get(SEQUENCE_NUMBER);
        Object payload = fields.get(PAYLOAD);
        if (!(entityId instanceof String id) || id.isEmpty()) {
            throw new EventDecodingException("Missing or invalid '" + ENTITY_ID + "'", null);
        }
        if (!(sequenceNumber instanceof Long seqNr) || seqNr < 0) {
            throw new EventDecodingException("Missing or invalid '" + SEQUENCE_NUMBER + "'", null);
        }
        if (payload != null && !(payload instanceof String)) {
            throw new EventDecodingException("'" + PAYLOAD + "' must be a string or null", null);
        }
        return new StoredEvent(id, seqNr, payload);
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }

    /**
     * Single-object reader accepting string, integer and null values.
     */
    private static final class Reader {
        private final String input;
        private int pos;

        Reader(String input) {
            this.input = input;
        }

        Map<String, Object> readObject() {
            skipWhitespace();
            expect('{');
            Map<String, Object> fields = new HashMap<>();
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return finish(fields);
            }
            while (true) {
                skipWhitespace();
                expect('"');
                String key = readString();
                skipWhitespace();
                expect(':');
                skipWhitespace();
                fields.put(key, readValue());
                skipWhitespace();
                char next = next();
                if (next == '}') {
                    return finish(fields);
                }
                if (next != ',') {
                    throw new IllegalArgumentException("Expected ',' or '}' at " + (pos - 1));
                }
            }
        }

        private Map<String, Object> finish(Map<String, Object> fields) {
            skipWhitespace();
            if (pos != input.length()) {
                throw new IllegalArgumentException("Trailing characters at " + pos);
            }
            return fields;
        }

        private Object readValue() {
            char c = peek();
            if (c == '"') {
                pos++;
                return readString();
            }
            if (input.startsWith("null", pos)) {
                pos += 4;
                return null;
            }
            if (c == '-' || (c >= '0' && c <= '9')) {
                int start = pos++;
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    pos++;
                }
                try {
                    return Long.parseLong(input.substring(start, pos));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid number at " + start, e);
                }
            }
            throw new IllegalArgumentException("Unsupported value at " + pos);
        }

        private String readString() {
            StringBuilder sb = new StringBuilder();
            while (true) {
                char c = next();
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                char escaped = next();
                switch (escaped) {
                    case '"':
                    case '\\':
                    case '/':
                        sb.append(escaped);
                        break;
                    case 'b':
                        sb.append('\b');
                        break;
                    case 'f':
                        sb.append('\f');
                        break;
                    case 'n':
                        sb.append('\n');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'u':
                        if (pos + 4 > input.length()) {
                            throw new IllegalArgumentException("Invalid unicode escape");
                        }
                        try {
                            sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Invalid unicode escape", e);
                        }
                        pos += 4;
                        break;
                    default:
                        throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
                }
            }
        }

        private void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        private void expect(char expected) {
            char actual = next();
            if (actual != expected) {
                throw new IllegalArgumentException("Expected '" + expected + "' at " + (pos - 1));
            }
        }

        private char peek() {
            if (pos >= input.length()) {
                throw new IllegalArgumentException("Unexpected end of input");
            }
            return input.charAt(pos);
        }

        private char next() {
            char c = peek();
            pos++;
            return c;
        }
    }
}
