/**
 * SessionController.java
 *
 * Read-only view of the analysis processes currently tracked per session id.
 */
package club.ppmc.leanedit.controller;

import club.ppmc.leanedit.model.AnalysisProcess;
import club.ppmc.leanedit.service.AnalysisProcessManager;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final AnalysisProcessManager processManager;

    public SessionController(AnalysisProcessManager processManager) {
        this.processManager = processManager;
    }

    @GetMapping
    public ResponseEntity<List<SessionStatus>> listSessions() {
        List<SessionStatus> sessions = processManager.activeProcesses().stream()
                .map(SessionStatus::of)
                .toList();
        return ResponseEntity.ok(sessions);
    }

    public record SessionStatus(String sessionId, long pid, boolean alive, String startedAt) {

        static SessionStatus of(AnalysisProcess process) {
            return new SessionStatus(
                    process.sessionId(), process.pid(), process.isAlive(), process.startedAt().toString());
        }
    }
}
