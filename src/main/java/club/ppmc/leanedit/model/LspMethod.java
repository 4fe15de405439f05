/**
 * LspMethod.java
 *
 * JSON-RPC methods the bridge knows by name. Anything else is still forwarded;
 * it simply maps to no constant.
 */
package club.ppmc.leanedit.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum LspMethod {
    INITIALIZE("initialize", false),
    INITIALIZED("initialized", false),
    SHUTDOWN("shutdown", false),
    EXIT("exit", false),

    DID_OPEN("textDocument/didOpen", true),
    DID_CHANGE("textDocument/didChange", true),
    DID_CLOSE("textDocument/didClose", true),
    DID_SAVE("textDocument/didSave", true),
    HOVER("textDocument/hover", true),
    COMPLETION("textDocument/completion", true),
    DEFINITION("textDocument/definition", true),
    TYPE_DEFINITION("textDocument/typeDefinition", true),
    REFERENCES("textDocument/references", true),
    DOCUMENT_HIGHLIGHT("textDocument/documentHighlight", true),
    DOCUMENT_SYMBOL("textDocument/documentSymbol", true),
    CODE_ACTION("textDocument/codeAction", true),
    FOLDING_RANGE("textDocument/foldingRange", true),
    SEMANTIC_TOKENS_FULL("textDocument/semanticTokens/full", true),
    SEMANTIC_TOKENS_RANGE("textDocument/semanticTokens/range", true),

    // Lean 4 server extensions
    PLAIN_GOAL("$/lean/plainGoal", true),
    PLAIN_TERM_GOAL("$/lean/plainTermGoal", true),
    RPC_CONNECT("$/lean/rpc/connect", false),
    RPC_CALL("$/lean/rpc/call", true),
    RPC_KEEP_ALIVE("$/lean/rpc/keepAlive", false);

    private static final Map<String, LspMethod> BY_NAME =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(LspMethod::methodName, Function.identity()));

    private final String methodName;
    private final boolean documentAddressing;

    LspMethod(String methodName, boolean documentAddressing) {
        this.methodName = methodName;
        this.documentAddressing = documentAddressing;
    }

    public String methodName() {
        return methodName;
    }

    /** Whether the method's params normally carry a {@code textDocument} identifier. */
    public boolean isDocumentAddressing() {
        return documentAddressing;
    }

    public static Optional<LspMethod> fromName(String name) {
        return Optional.ofNullable(name).map(BY_NAME::get);
    }
}
