/**
 * AppConfig.java
 *
 * Application-level bean definitions.
 * Provides the shared Gson instance used for JSON-RPC messages and the executor
 * that runs session bridges and their forwarding loops.
 */
package club.ppmc.leanedit.config;

import club.ppmc.leanedit.service.SettingsService;
import club.ppmc.leanedit.service.room.FileUpdateStore;
import club.ppmc.leanedit.service.room.UpdateStoreFactory;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * Gson used to render client JSON-RPC messages before LSP4J frames them.
     *
     * <p>Null members must survive re-serialization ({@code "result": null} is a valid
     * response), and HTML escaping would rewrite {@code <} and {@code >} in Lean source.
     *
     * @return the shared Gson instance.
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
    }

    /**
     * Thread pool for session bridges. Each bridge occupies one thread for its
     * lifetime plus three for its forwarding loops, so the pool is unbounded.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService bridgeExecutor() {
        var counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            var thread = new Thread(runnable, "lsp-bridge-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public UpdateStoreFactory updateStoreFactory(SettingsService settingsService) {
        return roomName -> new FileUpdateStore(settingsService.resolveRoomLog(roomName));
    }
}
