package works.mongobridge.reactor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerTest {
	final Worker worker = new Worker("test worker");

	@AfterEach
	void closeWorker() {
		worker.close();
	}

	@Test
	void tasks_runInSubmissionOrder() throws InterruptedException {
		List<Integer> order = new CopyOnWriteArrayList<>();
		CountDownLatch done = new CountDownLatch(1);
		for (int i = 0; i < 100; i++) {
			int n = i;
			worker.submit(() -> order.add(n));
		}
		worker.submit(done::countDown);
		assertTrue(done.await(10, SECONDS));
		for (int i = 0; i < 100; i++) {
			assertEquals(i, order.get(i));
		}
	}

	@Test
	void tasks_runOnWorkerThread() throws InterruptedException {
		AtomicBoolean onWorker = new AtomicBoolean(false);
		CountDownLatch done = new CountDownLatch(1);
		worker.submit(() -> {
			onWorker.set(worker.isWorkerThread() && Thread.currentThread().getName().equals("test worker"));
			done.countDown();
		});
		assertTrue(done.await(10, SECONDS));
		assertTrue(onWorker.get());
		assertFalse(worker.isWorkerThread());
	}

	@Test
	void throwingTask_doesNotStopWorker() throws InterruptedException {
		CountDownLatch done = new CountDownLatch(1);
		worker.submit(() -> { throw new IllegalStateException("Expected exception from test"); });
		worker.submit(done::countDown);
		assertTrue(done.await(10, SECONDS));
	}

	@Test
	void close_runsPendingThenRejects() throws InterruptedException {
		CountDownLatch release = new CountDownLatch(1);
		AtomicBoolean secondRan = new AtomicBoolean(false);
		worker.submit(() -> {
			try {
				release.await();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});
		worker.submit(() -> secondRan.set(true));
		worker.close();
		assertTrue(worker.isShutdown());
		assertThrows(RejectedExecutionException.class, () -> worker.submit(() -> { }));
		release.countDown();
		assertTrue(worker.awaitTermination(Duration.ofSeconds(10)));
		assertTrue(secondRan.get());
	}
}
