/**
 * AnalysisProcess.java
 *
 * One running language server instance owned by AnalysisProcessManager.
 * Bridges borrow it for the lifetime of their session and never outlive the
 * manager's entry for it.
 */
package club.ppmc.leanedit.model;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;

/**
 * @param sessionId the client-supplied session id the process is registered under.
 * @param process   the underlying OS process, with all three standard streams piped.
 * @param startedAt when the process was started.
 */
public record AnalysisProcess(String sessionId, Process process, Instant startedAt) {

    public boolean isAlive() {
        return process.isAlive();
    }

    public long pid() {
        return process.pid();
    }

    public OutputStream stdin() {
        return process.getOutputStream();
    }

    public InputStream stdout() {
        return process.getInputStream();
    }

    public InputStream stderr() {
        return process.getErrorStream();
    }
}
