package club.ppmc.leanedit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.leanedit.exception.ProtocolValidationException;
import club.ppmc.leanedit.model.ProtocolMessage;
import org.junit.jupiter.api.Test;

class ProtocolMessageValidatorTest {

    private final ProtocolMessageValidator validator = new ProtocolMessageValidator();

    private void assertRejected(String json, String reason) {
        assertThatThrownBy(() -> validator.validate(ProtocolMessage.parse(json)))
                .isInstanceOf(ProtocolValidationException.class)
                .extracting(e -> ((ProtocolValidationException) e).getReason())
                .isEqualTo(reason);
    }

    private void assertAccepted(String json) {
        assertThatCode(() -> validator.validate(ProtocolMessage.parse(json))).doesNotThrowAnyException();
    }

    @Test
    void initializeNeedsFileRootUri() {
        assertAccepted("{\"id\":0,\"method\":\"initialize\",\"params\":{\"rootUri\":\"file:///work/lean-project\"}}");
        assertRejected("{\"id\":0,\"method\":\"initialize\",\"params\":{\"rootUri\":\"http://example.com/x\"}}",
                ProtocolMessageValidator.INVALID_ROOT_URI);
        assertRejected("{\"id\":0,\"method\":\"initialize\",\"params\":{\"processId\":null}}",
                ProtocolMessageValidator.INVALID_ROOT_URI);
        assertRejected("{\"id\":0,\"method\":\"initialize\",\"params\":{\"rootUri\":null}}",
                ProtocolMessageValidator.INVALID_ROOT_URI);
    }

    @Test
    void textDocumentUriMustBeFileUriForAnyMethod() {
        assertAccepted("{\"method\":\"textDocument/hover\",\"params\":{\"textDocument\":{\"uri\":\"file:///a/B.lean\"},"
                + "\"position\":{\"line\":0,\"character\":1}}}");
        assertRejected("{\"method\":\"textDocument/didOpen\",\"params\":{\"textDocument\":{\"uri\":\"not-a-uri\"}}}",
                ProtocolMessageValidator.INVALID_DOCUMENT_URI);
        assertRejected("{\"method\":\"$/lean/plainGoal\",\"params\":{\"textDocument\":{\"uri\":\"untitled:1\"}}}",
                ProtocolMessageValidator.INVALID_DOCUMENT_URI);
        assertRejected("{\"method\":\"x/custom\",\"params\":{\"textDocument\":\"file:///a\"}}",
                ProtocolMessageValidator.INVALID_DOCUMENT_URI);
        assertRejected("{\"method\":\"textDocument/didClose\",\"params\":{\"textDocument\":{}}}",
                ProtocolMessageValidator.INVALID_DOCUMENT_URI);
    }

    @Test
    void messagesWithoutParamsPassUnchecked() {
        assertAccepted("{\"id\":3,\"result\":null}");
        assertAccepted("{\"method\":\"shutdown\",\"id\":9}");
        assertAccepted("{\"method\":\"initialized\",\"params\":{}}");
    }

    @Test
    void fileUriRecognition() {
        assertThat(ProtocolMessageValidator.isFileUri("file:///tmp/x.lean")).isTrue();
        assertThat(ProtocolMessageValidator.isFileUri("file:///tmp/with%20space.lean")).isTrue();
        assertThat(ProtocolMessageValidator.isFileUri("FILE:///tmp/x.lean")).isFalse();
        assertThat(ProtocolMessageValidator.isFileUri("file:")).isFalse();
        assertThat(ProtocolMessageValidator.isFileUri("file:///tmp/x y")).isFalse();
        assertThat(ProtocolMessageValidator.isFileUri("")).isFalse();
        assertThat(ProtocolMessageValidator.isFileUri(null)).isFalse();
    }
}
