package works.mongobridge.testing;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManualLoopTest {
	final ManualLoop loop = new ManualLoop();

	@Test
	void runPending_runsNestedSubmissionsInOrder() {
		List<String> log = new ArrayList<>();
		loop.submit(() -> {
			log.add("first");
			loop.submit(() -> log.add("third"));
		});
		loop.submit(() -> log.add("second"));
		assertEquals(3, loop.runPending());
		assertEquals(List.of("first", "second", "third"), log);
		assertTrue(loop.isIdle());
	}

	@Test
	void runUntil_waitsForOtherThreads() throws InterruptedException {
		AtomicBoolean done = new AtomicBoolean(false);
		Thread other = new Thread(() -> loop.submit(() -> done.set(true)));
		other.start();
		loop.runUntil(done::get, Duration.ofSeconds(10));
		other.join();
		assertTrue(done.get());
	}

	@Test
	void runUntil_timesOut() {
		assertThrows(AssertionError.class, () -> loop.runUntil(() -> false, Duration.ofMillis(50)));
	}

	@Test
	void taskException_propagates() {
		loop.submit(() -> { throw new IllegalStateException("boom"); });
		assertThrows(IllegalStateException.class, loop::runPending);
	}
}
