/**
 * ProtocolMessage.java
 *
 * A JSON-RPC message received from a session client. The method is a tag (known
 * methods map onto {@link LspMethod}) and the params stay an open JSON object,
 * because their shape depends entirely on the method.
 */
package club.ppmc.leanedit.model;

import club.ppmc.leanedit.exception.ProtocolValidationException;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.Optional;

public final class ProtocolMessage {

    public static final String MALFORMED_MESSAGE = "malformed-message";

    private final JsonObject json;

    public ProtocolMessage(JsonObject json) {
        this.json = json;
    }

    /**
     * Parses one WebSocket text frame.
     *
     * @throws ProtocolValidationException if the frame is not a JSON object.
     */
    public static ProtocolMessage parse(String text) {
        JsonElement element;
        try {
            element = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new ProtocolValidationException(MALFORMED_MESSAGE, "not valid JSON: " + e.getMessage());
        }
        if (element == null || !element.isJsonObject()) {
            throw new ProtocolValidationException(MALFORMED_MESSAGE, "message is not a JSON object");
        }
        return new ProtocolMessage(element.getAsJsonObject());
    }

    public JsonObject json() {
        return json;
    }

    /** The method name, or {@code null} for responses. */
    public String method() {
        return stringMember(json, "method");
    }

    public Optional<LspMethod> knownMethod() {
        return LspMethod.fromName(method());
    }

    /** The params object, or {@code null} if absent or not an object. */
    public JsonObject params() {
        return objectMember(json, "params");
    }

    /**
     * Full document text carried by the message, if any.
     *
     * <p>{@code didOpen} carries it in {@code textDocument.text}. For {@code didChange}
     * only the last content change counts and only when it replaces the whole document;
     * a ranged (incremental) change yields nothing.
     */
    public Optional<String> documentText() {
        JsonObject params = params();
        if (params == null) {
            return Optional.empty();
        }
        LspMethod method = knownMethod().orElse(null);
        if (method == LspMethod.DID_OPEN) {
            JsonObject textDocument = objectMember(params, "textDocument");
            return Optional.ofNullable(textDocument == null ? null : stringMember(textDocument, "text"));
        }
        if (method == LspMethod.DID_CHANGE) {
            JsonElement changes = params.get("contentChanges");
            if (changes == null || !changes.isJsonArray()) {
                return Optional.empty();
            }
            JsonArray array = changes.getAsJsonArray();
            if (array.isEmpty() || !array.get(array.size() - 1).isJsonObject()) {
                return Optional.empty();
            }
            JsonObject last = array.get(array.size() - 1).getAsJsonObject();
            if (last.has("range")) {
                return Optional.empty();
            }
            return Optional.ofNullable(stringMember(last, "text"));
        }
        return Optional.empty();
    }

    static JsonObject objectMember(JsonObject owner, String name) {
        JsonElement element = owner.get(name);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    static String stringMember(JsonObject owner, String name) {
        JsonElement element = owner.get(name);
        if (element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            return element.getAsString();
        }
        return null;
    }

    @Override
    public String toString() {
        return "ProtocolMessage[method=" + method() + "]";
    }
}
