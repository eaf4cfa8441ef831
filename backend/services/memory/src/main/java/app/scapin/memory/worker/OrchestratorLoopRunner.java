package app.scapin.memory.worker;

import app.scapin.memory.config.WorkerProps;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Starts the loop on its own thread once the application is ready.
 */
@Component
public class OrchestratorLoopRunner {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorLoopRunner.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final OrchestratorLoop loop;
    private final WorkerProps props;
    private final ExecutorService executor;

    public OrchestratorLoopRunner(OrchestratorLoop loop, WorkerProps props) {
        this.loop = loop;
        this.props = props;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "memory-cycle-loop");
            thread.setDaemon(true);
            return thread;
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!props.enabled()) {
            log.info("Memory cycle loop disabled");
            return;
        }
        executor.execute(loop::run);
    }

    @PreDestroy
    public void shutdown() {
        loop.stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Memory cycle loop did not stop in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
