/**
 * ProtocolMessageValidator.java
 *
 * Checks the URI-shaped fields of inbound client messages before they reach a
 * language server. A failed check is fatal to the session (fail-closed).
 */
package club.ppmc.leanedit.service;

import club.ppmc.leanedit.exception.ProtocolValidationException;
import club.ppmc.leanedit.model.LspMethod;
import club.ppmc.leanedit.model.ProtocolMessage;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.net.URI;
import java.net.URISyntaxException;
import org.springframework.stereotype.Component;

@Component
public class ProtocolMessageValidator {

    public static final String INVALID_ROOT_URI = "invalid-uri: rootUri";
    public static final String INVALID_DOCUMENT_URI = "invalid-uri: textDocument.uri";

    private static final String FILE_SCHEME = "file";

    /**
     * Validates one message. Messages without a params object pass unchecked.
     *
     * <ul>
     *   <li>{@code initialize}: {@code params.rootUri} must be a file URI.</li>
     *   <li>every method: if {@code params.textDocument} is present, it must be an object
     *       whose {@code uri} is a file URI.</li>
     * </ul>
     *
     * @throws ProtocolValidationException on the first failed check.
     */
    public void validate(ProtocolMessage message) {
        JsonObject params = message.params();
        if (params == null) {
            return;
        }

        if (message.knownMethod().filter(m -> m == LspMethod.INITIALIZE).isPresent()) {
            requireFileUri(params.get("rootUri"), INVALID_ROOT_URI);
        }

        // Document-addressing methods and unknown ones share the textDocument rule.
        JsonElement textDocument = params.get("textDocument");
        if (textDocument == null) {
            return;
        }
        if (!textDocument.isJsonObject()) {
            throw new ProtocolValidationException(INVALID_DOCUMENT_URI, "textDocument is not an object");
        }
        requireFileUri(textDocument.getAsJsonObject().get("uri"), INVALID_DOCUMENT_URI);
    }

    private static void requireFileUri(JsonElement value, String reason) {
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new ProtocolValidationException(reason, "missing or not a string");
        }
        String uri = value.getAsString();
        if (!isFileUri(uri)) {
            throw new ProtocolValidationException(reason, "not a file URI: " + uri);
        }
    }

    /**
     * A valid file URI parses, has scheme exactly {@code file} and a non-empty path.
     */
    public static boolean isFileUri(String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        try {
            URI uri = new URI(candidate);
            String path = uri.getPath();
            return FILE_SCHEME.equals(uri.getScheme()) && path != null && !path.isEmpty();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
