package ptychodus.diffraction.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ptychodus.diffraction.api.DiffractionArray;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads every array of a dataset on a fixed pool of worker threads.
 * <p>
 * Runs as a single background task. One loader per array is fanned out to the pool and
 * each finished result is forwarded to the foreground queue in completion order. A
 * failing loader is logged and only its array is lost.
 *
 * @author Ptychodus Team
 * @since 0.1.0
 */
public class LoadAllArrays implements BackgroundTask {

    /**
     * Creates the loader for the array at a given position of the source.
     */
    @FunctionalInterface
    public interface LoaderFactory {
        BackgroundTask createLoader(int arrayIndex, DiffractionArray array);
    }

    private static final Logger logger = LoggerFactory.getLogger(LoadAllArrays.class);

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final List<DiffractionArray> arrays;
    private final LoaderFactory loaderFactory;
    private final ForegroundTaskManager foregroundTaskManager;
    private final int numThreads;
    private final CountDownLatch finished = new CountDownLatch(1);

    /**
     * @param arrays                arrays to load, in submission order
     * @param loaderFactory         creates the loader for one array and its position
     * @param foregroundTaskManager receives the results
     * @param numThreads            pool size
     */
    public LoadAllArrays(List<DiffractionArray> arrays, LoaderFactory loaderFactory,
                         ForegroundTaskManager foregroundTaskManager, int numThreads) {
        this.arrays = List.copyOf(arrays);
        this.loaderFactory = Objects.requireNonNull(loaderFactory, "Loader factory must not be null");
        this.foregroundTaskManager = Objects.requireNonNull(foregroundTaskManager,
                "Foreground task manager must not be null");
        this.numThreads = Math.max(1, numThreads);
    }

    @Override
    public Optional<ForegroundTask> call() {
        int poolId = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(numThreads, r -> {
            Thread t = new Thread(r, "Diffraction-Loader-" + poolId + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            logger.info("Loading {} arrays on {} threads", arrays.size(), numThreads);
            CompletionService<Optional<ForegroundTask>> completionService = new ExecutorCompletionService<>(pool);
            List<Future<Optional<ForegroundTask>>> futures = new ArrayList<>();

            for (int i = 0; i < arrays.size(); i++) {
                BackgroundTask loader = loaderFactory.createLoader(i, arrays.get(i));
                futures.add(completionService.submit(loader::call));
            }

            int loaded = 0;
            for (int i = 0; i < futures.size(); i++) {
                Future<Optional<ForegroundTask>> future;
                try {
                    future = completionService.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted after loading {} of {} arrays", loaded, arrays.size());
                    break;
                }
                try {
                    Optional<ForegroundTask> result = future.get();
                    if (result.isPresent()) {
                        foregroundTaskManager.putForegroundTask(result.get());
                        loaded++;
                    }
                } catch (ExecutionException e) {
                    logger.error("Failed to load array", e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            logger.info("Loaded {} of {} arrays", loaded, arrays.size());
        } finally {
            pool.shutdownNow();
            finished.countDown();
        }
        return Optional.empty();
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    /**
     * Waits until every array has been loaded or has failed.
     *
     * @return true if finished within the timeout
     */
    public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    @Override
    public String toString() {
        return "LoadAllArrays{" + arrays.size() + " arrays}";
    }
}
