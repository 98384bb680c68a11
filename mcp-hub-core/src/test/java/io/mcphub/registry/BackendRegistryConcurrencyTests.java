/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.mcphub.registry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.mcphub.MockBackendSession;
import io.mcphub.MockBackendSessionFactory;
import io.mcphub.error.HubErrorKind;
import io.mcphub.error.HubException;
import io.mcphub.router.InvocationRouter;
import io.mcphub.session.BackendSession;
import io.mcphub.session.BackendSessionFactory;
import io.mcphub.session.ConnectionParams;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Verifies that lifecycle transitions on a name are serialized against reads of that
 * name.
 */
@Timeout(15)
class BackendRegistryConcurrencyTests {

	private static final ConnectionParams STDIO = ConnectionParams.Stdio.of("server", List.of(), Map.of());

	private ExecutorService executor;

	@BeforeEach
	void setUp() {
		executor = Executors.newFixedThreadPool(4);
	}

	@AfterEach
	void tearDown() {
		executor.shutdownNow();
	}

	@Test
	void disconnectWaitsForInFlightInvocation() throws Exception {
		MockBackendSessionFactory sessionFactory = new MockBackendSessionFactory();
		BackendRegistry registry = new BackendRegistry(sessionFactory);
		InvocationRouter router = new InvocationRouter(registry);

		CountDownLatch started = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		MockBackendSession session = sessionFactory.prepare("slow").respondWith(invocation -> {
			started.countDown();
			awaitQuietly(release);
			return TextNode.valueOf("finished");
		});
		registry.connect("slow", STDIO);

		CompletableFuture<JsonNode> invocation = CompletableFuture
			.supplyAsync(() -> router.invoke("slow", "work", Map.of()), executor);
		assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

		CompletableFuture<Void> disconnect = CompletableFuture.runAsync(() -> registry.disconnect("slow"), executor);

		await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> !disconnect.isDone());
		assertThat(session.isClosed()).isFalse();

		release.countDown();

		assertThat(invocation.get(5, TimeUnit.SECONDS).asText()).isEqualTo("finished");
		disconnect.get(5, TimeUnit.SECONDS);
		assertThat(session.isClosed()).isTrue();

		assertThatThrownBy(() -> router.invoke("slow", "work", Map.of())).isInstanceOfSatisfying(HubException.class,
				e -> assertThat(e.getKind()).isEqualTo(HubErrorKind.NOT_CONNECTED));
	}

	@Test
	void racingDisconnectAndInvokeResolveToOneOfTwoOutcomes() throws Exception {
		for (int round = 0; round < 50; round++) {
			MockBackendSessionFactory sessionFactory = new MockBackendSessionFactory();
			BackendRegistry registry = new BackendRegistry(sessionFactory);
			InvocationRouter router = new InvocationRouter(registry);
			registry.connect("racy", STDIO);
			MockBackendSession session = sessionFactory.session("racy");

			CountDownLatch go = new CountDownLatch(1);
			CompletableFuture<Object> invocation = CompletableFuture.supplyAsync(() -> {
				awaitQuietly(go);
				try {
					return router.invoke("racy", "work", Map.of());
				}
				catch (HubException e) {
					return e;
				}
			}, executor);
			CompletableFuture<Void> disconnect = CompletableFuture.runAsync(() -> {
				awaitQuietly(go);
				registry.disconnect("racy");
			}, executor);
			go.countDown();

			Object outcome = invocation.get(5, TimeUnit.SECONDS);
			disconnect.get(5, TimeUnit.SECONDS);

			if (outcome instanceof HubException error) {
				assertThat(error.getKind()).isEqualTo(HubErrorKind.NOT_CONNECTED);
				assertThat(session.getInvocations()).isEmpty();
			}
			else {
				assertThat(outcome).isInstanceOf(JsonNode.class);
				assertThat(session.getInvocations()).hasSize(1);
			}
			assertThat(session.isClosed()).isTrue();
			assertThat(registry.listNames()).isEmpty();
		}
	}

	@Test
	void concurrentConnectsOfOneNameOpenASingleSession() throws Exception {
		AtomicInteger opened = new AtomicInteger();
		CountDownLatch opening = new CountDownLatch(1);
		BackendSessionFactory slowFactory = (name, params) -> {
			opening.countDown();
			opened.incrementAndGet();
			sleepQuietly(100);
			return new MockBackendSession();
		};
		BackendRegistry registry = new BackendRegistry(slowFactory);

		CompletableFuture<Object> first = CompletableFuture.supplyAsync(() -> attemptConnect(registry), executor);
		assertThat(opening.await(5, TimeUnit.SECONDS)).isTrue();
		CompletableFuture<Object> second = CompletableFuture.supplyAsync(() -> attemptConnect(registry), executor);

		List<Object> outcomes = List.of(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));

		assertThat(opened).hasValue(1);
		assertThat(outcomes).filteredOn(HubException.class::isInstance)
			.singleElement()
			.satisfies(e -> assertThat(((HubException) e).getKind()).isEqualTo(HubErrorKind.ALREADY_CONNECTED));
		assertThat(registry.listNames()).containsExactly("shared");
	}

	@Test
	void slowConnectDoesNotBlockOtherNames() throws Exception {
		CountDownLatch release = new CountDownLatch(1);
		BackendSessionFactory factory = (name, params) -> {
			if (name.equals("slow")) {
				awaitQuietly(release);
			}
			return new MockBackendSession();
		};
		BackendRegistry registry = new BackendRegistry(factory);

		CompletableFuture<Void> slow = CompletableFuture.runAsync(() -> registry.connect("slow", STDIO), executor);
		registry.connect("fast", STDIO);

		assertThat(registry.listNames()).containsExactly("fast");
		assertThat(slow).isNotDone();

		release.countDown();
		slow.get(5, TimeUnit.SECONDS);
		assertThat(registry.listNames()).containsExactly("fast", "slow");
	}

	private static Object attemptConnect(BackendRegistry registry) {
		try {
			registry.connect("shared", STDIO);
			return "connected";
		}
		catch (HubException e) {
			return e;
		}
	}

	private static void awaitQuietly(CountDownLatch latch) {
		try {
			if (!latch.await(10, TimeUnit.SECONDS)) {
				throw new IllegalStateException("Timed out waiting for latch");
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException(e);
		}
	}

	private static void sleepQuietly(long millis) {
		try {
			Thread.sleep(millis);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException(e);
		}
	}

}
