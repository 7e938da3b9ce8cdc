package io.tagstream.publisher;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-consumer command queue drained on an {@link Executor}.
 *
 * <p>Commands may be posted from any thread. They run one at a time, in posting
 * order, and never concurrently, so the state they touch needs no locking even when
 * the executor is a shared pool. A command posted while another runs is picked up by
 * the same drain loop.
 *
 * <p>Once the executor refuses a drain, every command still queued is dropped and its
 * rejection handler runs instead, on the thread whose post was refused. This includes
 * commands whose {@link #post} already returned {@code true}.
 */
final class Mailbox {
    private static final Logger logger = Logger.getLogger(Mailbox.class.getName());

    private static final Runnable IGNORE = () -> {
    };

    private final String name;
    private final Executor executor;
    private final Queue<Command> commands = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pending = new AtomicInteger();

    Mailbox(String name, Executor executor) {
        this.name = Objects.requireNonNull(name, "name");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    boolean post(Runnable command) {
        return post(command, IGNORE);
    }

    /**
     * Enqueues a command.
     *
     * @param command    runs on the executor
     * @param onRejected runs instead of {@code command} if the executor refuses to drain
     * @return {@code false} if the executor refused to schedule a drain
     */
    boolean post(Runnable command, Runnable onRejected) {
        commands.add(new Command(Objects.requireNonNull(command, "command"),
                Objects.requireNonNull(onRejected, "onRejected")));
        if (pending.getAndIncrement() != 0) {
            return true;
        }
        try {
            executor.execute(this::drain);
            return true;
        } catch (RejectedExecutionException e) {
            logger.log(Level.FINE, "Mailbox {0} rejected commands, executor is shut down", name);
            drainRejected();
            return false;
        }
    }

    private void drain() {
        int missed = 1;
        do {
            Command command;
            while ((command = commands.poll()) != null) {
                run(command.action());
                missed = pending.addAndGet(-1);
                if (missed == 0) {
                    return;
                }
            }
        } while (missed != 0);
    }

    // Same accounting as drain(); a poster racing with this loop either has its
    // command picked up here or finds pending at 0 and is rejected itself.
    private void drainRejected() {
        int missed = 1;
        do {
            Command command;
            while ((command = commands.poll()) != null) {
                run(command.onRejected());
                missed = pending.addAndGet(-1);
                if (missed == 0) {
                    return;
                }
            }
        } while (missed != 0);
    }

    private void run(Runnable action) {
        try {
            action.run();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Command failed in mailbox " + name, t);
        }
    }

    private record Command(Runnable action, Runnable onRejected) {
    }
}
