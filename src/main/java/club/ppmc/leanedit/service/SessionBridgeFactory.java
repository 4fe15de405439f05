/**
 * SessionBridgeFactory.java
 *
 * Creates SessionBridge instances wired to the shared services and starts them on
 * the bridge executor, one task per session connection.
 */
package club.ppmc.leanedit.service;

import club.ppmc.leanedit.util.LspMessageFramer;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class SessionBridgeFactory {

    private final AnalysisProcessManager processManager;
    private final ProtocolMessageValidator validator;
    private final DocumentMirrorService mirrorService;
    private final LspMessageFramer framer;
    private final ExecutorService bridgeExecutor;
    private final SettingsService settingsService;

    public SessionBridgeFactory(
            AnalysisProcessManager processManager,
            ProtocolMessageValidator validator,
            DocumentMirrorService mirrorService,
            LspMessageFramer framer,
            @Qualifier("bridgeExecutor") ExecutorService bridgeExecutor,
            SettingsService settingsService) {
        this.processManager = processManager;
        this.validator = validator;
        this.mirrorService = mirrorService;
        this.framer = framer;
        this.bridgeExecutor = bridgeExecutor;
        this.settingsService = settingsService;
    }

    public SessionBridge create(String sessionId, ClientConnection connection) {
        return new SessionBridge(
                sessionId,
                connection,
                processManager,
                validator,
                mirrorService,
                framer,
                bridgeExecutor,
                settingsService.getCancelTimeout());
    }

    /**
     * Creates a bridge and runs it asynchronously.
     *
     * @return the running bridge.
     */
    public SessionBridge start(String sessionId, ClientConnection connection) {
        SessionBridge bridge = create(sessionId, connection);
        bridgeExecutor.execute(bridge);
        return bridge;
    }
}
