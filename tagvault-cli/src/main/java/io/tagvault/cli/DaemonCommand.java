package io.tagvault.cli;

import io.tagvault.core.config.model.TagVaultConfig;
import io.tagvault.core.memory.MemoryStoreFactory;
import io.tagvault.core.memory.TaggedMemoryStore;
import io.tagvault.core.retention.MaintenanceScheduler;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine.Command;

@Command(name = "daemon", description = "Run periodic expiry sweeps until interrupted")
public final class DaemonCommand implements Callable<Integer> {
    private final CliContext context;

    public DaemonCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TagVaultConfig config = context.loadConfig();
            TaggedMemoryStore store = MemoryStoreFactory.open(config, context.clock());
            Duration interval = Duration.ofMinutes(config.retention().sweepIntervalMinutes());

            CountDownLatch shutdown = new CountDownLatch(1);
            try (MaintenanceScheduler scheduler = new MaintenanceScheduler(store, interval, config.retention().saveAfterSweep())) {
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    scheduler.close();
                    try {
                        store.save();
                    } catch (IOException e) {
                        System.err.println("Final save failed: " + e.getMessage());
                    }
                    shutdown.countDown();
                }));
                scheduler.start();
                System.out.println("Sweeping " + store.count() + " memories every " + interval.toMinutes() + " minutes");
                shutdown.await();
            }
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } catch (Exception e) {
            System.err.println("Daemon failed: " + e.getMessage());
            return 1;
        }
    }
}
