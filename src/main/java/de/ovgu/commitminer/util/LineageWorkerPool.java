package de.ovgu.commitminer.util;

import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;

/**
 * A fixed set of worker threads, each permanently bound to one lineage, i.e., one ordered list of work items.  Worker
 * <code>i</code> processes the items of lineage <code>i</code> strictly in order.  Results travel back to the calling
 * thread over a bounded channel and are handed to a consumer as they complete, so a slow consumer slows the workers
 * down instead of piling up results.
 *
 * @param <TWorkItem> Type of the items to process
 * @param <TResult>   Type of the per-item results
 */
public abstract class LineageWorkerPool<TWorkItem, TResult> {
    private static final Logger LOG = Logger.getLogger(LineageWorkerPool.class);

    private final List<Thread> workers = new ArrayList<>();
    private volatile boolean terminationRequested = false;

    public void processLineages(final List<List<TWorkItem>> lineages, Consumer<TResult> resultConsumer)
            throws UncaughtWorkerThreadException {
        final int numThreads = lineages.size();
        if (numThreads == 0) return;

        final BlockingQueue<Message<TResult>> channel = new ArrayBlockingQueue<>(2 * numThreads);
        final List<UncaughtWorkerThreadException> uncaughtWorkerThreadExceptions = new ArrayList<>();

        Thread.UncaughtExceptionHandler uncaughtExceptionHandler = (th, ex) -> {
            LOG.error("Worker thread " + th.getName() + " died.", ex);
            synchronized (uncaughtWorkerThreadExceptions) {
                uncaughtWorkerThreadExceptions.add(new UncaughtWorkerThreadException(th.getName(), ex));
            }
            requestTermination();
        };

        synchronized (workers) {
            workers.clear();
            for (int i = 0; i < numThreads; i++) {
                final int lineageIndex = i;
                final List<TWorkItem> lineage = lineages.get(i);
                Thread t = new Thread("lineage-worker-" + i) {
                    @Override
                    public void run() {
                        try {
                            for (TWorkItem item : lineage) {
                                if (terminationRequested) {
                                    LOG.info("Terminating thread " + getName() + ": termination requested.");
                                    break;
                                }
                                TResult result = processItem(lineageIndex, item);
                                putUninterruptibly(channel, Message.result(result));
                            }
                        } finally {
                            putUninterruptibly(channel, Message.done());
                        }
                    }
                };
                t.setUncaughtExceptionHandler(uncaughtExceptionHandler);
                workers.add(t);
            }
        }

        for (Thread t : workers) {
            t.start();
        }

        drain(channel, numThreads, resultConsumer);

        for (Thread t : workers) {
            joinUninterruptibly(t);
        }

        synchronized (uncaughtWorkerThreadExceptions) {
            if (!uncaughtWorkerThreadExceptions.isEmpty()) {
                throw uncaughtWorkerThreadExceptions.get(0);
            }
        }
    }

    private void drain(BlockingQueue<Message<TResult>> channel, int numThreads, Consumer<TResult> resultConsumer) {
        int running = numThreads;
        boolean interrupted = false;
        while (running > 0) {
            final Message<TResult> message;
            try {
                message = channel.take();
            } catch (InterruptedException e) {
                LOG.warn("Interrupted while waiting for results. Asking workers to stop.");
                interrupted = true;
                requestTermination();
                continue;
            }
            if (message.done) {
                running--;
            } else {
                try {
                    resultConsumer.accept(message.result);
                } catch (RuntimeException e) {
                    LOG.error("Error handling result " + message.result, e);
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Ask all workers to stop after the item they are currently processing.  Items not yet started are dropped.
     */
    public void requestTermination() {
        this.terminationRequested = true;
    }

    public boolean isTerminationRequested() {
        return terminationRequested;
    }

    protected abstract TResult processItem(int lineageIndex, TWorkItem item);

    private static <T> void putUninterruptibly(BlockingQueue<T> queue, T element) {
        boolean interrupted = false;
        while (true) {
            try {
                queue.put(element);
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static void joinUninterruptibly(Thread t) {
        boolean interrupted = false;
        while (true) {
            try {
                t.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class Message<TResult> {
        final TResult result;
        final boolean done;

        private Message(TResult result, boolean done) {
            this.result = result;
            this.done = done;
        }

        static <TResult> Message<TResult> result(TResult result) {
            return new Message<>(result, false);
        }

        static <TResult> Message<TResult> done() {
            return new Message<>(null, true);
        }
    }
}
