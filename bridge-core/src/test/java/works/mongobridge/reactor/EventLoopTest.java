package works.mongobridge.reactor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventLoopTest {

	@Test
	void run_executesTasksOnCallingThreadUntilStopped() {
		EventLoop loop = new EventLoop();
		List<String> log = new CopyOnWriteArrayList<>();
		AtomicBoolean onLoopThread = new AtomicBoolean(false);
		loop.submit(() -> log.add("first"));
		loop.submit(() -> {
			onLoopThread.set(loop.isLoopThread());
			log.add("second");
		});
		loop.submit(loop::stop);
		loop.run();
		assertEquals(List.of("first", "second"), log);
		assertTrue(onLoopThread.get());
		assertThrows(RejectedExecutionException.class, () -> loop.submit(() -> { }));
	}

	@Test
	void throwingTask_doesNotStopLoop() throws InterruptedException {
		EventLoop loop = EventLoop.startThread("test loop");
		CountDownLatch done = new CountDownLatch(1);
		loop.submit(() -> { throw new IllegalStateException("Expected exception from test"); });
		loop.submit(done::countDown);
		assertTrue(done.await(10, SECONDS));
		loop.stop();
	}
}
