package dev.tmcp.server.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.tmcp.identity.IdentityManager;
import dev.tmcp.testing.InMemoryDirectoryClient;
import dev.tmcp.testing.TestIdentities;
import dev.tmcp.transport.ConnectionScope;
import dev.tmcp.transport.DuplexStreams;

class SessionRegistryTest {

	private final ExecutorService executor = Executors.newCachedThreadPool();

	private IdentityManager server;

	private IdentityManager client;

	@BeforeEach
	void setUp() {
		InMemoryDirectoryClient directory = new InMemoryDirectoryClient();
		this.server = TestIdentities.create(directory, "Server", "sse://localhost:8080/sse");
		this.client = TestIdentities.create(directory, "Client", "tmcpclient://");
	}

	@AfterEach
	void tearDown() {
		this.executor.shutdownNow();
	}

	@Test
	void lookupReturnsRegisteredSession() {
		SessionRegistry registry = new SessionRegistry(ReconnectPolicy.REPLACE);
		SessionHandle handle = handle("first");

		registry.register(handle);

		assertThat(registry.lookup(this.client.localDid())).containsSame(handle);
		assertThat(registry.lookup("did:web:test.local:other")).isEmpty();
	}

	@Test
	void newerSessionReplacesOlderOne() {
		SessionRegistry registry = new SessionRegistry(ReconnectPolicy.REPLACE);
		SessionHandle first = handle("first");
		SessionHandle second = handle("second");

		registry.register(first);
		registry.register(second);

		assertThat(registry.lookup(this.client.localDid())).containsSame(second);
	}

	@Test
	void removingAnOlderSessionKeepsTheNewerOne() {
		SessionRegistry registry = new SessionRegistry(ReconnectPolicy.REPLACE);
		SessionHandle first = handle("first");
		SessionHandle second = handle("second");
		registry.register(first);
		registry.register(second);

		registry.remove(first);

		assertThat(registry.lookup(this.client.localDid())).containsSame(second);
	}

	@Test
	void removingTheNewerSessionFallsBackToAnOpenOlderOne() {
		SessionRegistry registry = new SessionRegistry(ReconnectPolicy.REPLACE);
		SessionHandle first = handle("first");
		SessionHandle second = handle("second");
		registry.register(first);
		registry.register(second);

		registry.remove(second);

		assertThat(registry.lookup(this.client.localDid())).containsSame(first);
	}

	@Test
	void closedSessionsAreNeverReturned() {
		SessionRegistry registry = new SessionRegistry(ReconnectPolicy.REPLACE);
		SessionHandle handle = handle("first");
		registry.register(handle);

		handle.streams().close();

		assertThat(registry.lookup(this.client.localDid())).isEmpty();
	}

	@Test
	void removingTheLastSessionDropsThePeer() {
		SessionRegistry registry = new SessionRegistry(ReconnectPolicy.REPLACE);
		SessionHandle handle = handle("first");
		registry.register(handle);

		registry.remove(handle);
		registry.remove(handle);

		assertThat(registry.size()).isZero();
	}

	@Test
	void rejectPolicyRefusesSecondOpenSession() {
		SessionRegistry registry = new SessionRegistry(ReconnectPolicy.REJECT);
		SessionHandle first = handle("first");
		registry.register(first);

		assertThatThrownBy(() -> registry.register(handle("second"))).isInstanceOf(SessionConflictException.class);
		assertThat(registry.lookup(this.client.localDid())).containsSame(first);

		first.streams().close();
		SessionHandle third = handle("third");
		registry.register(third);
		assertThat(registry.lookup(this.client.localDid())).containsSame(third);
	}

	@Test
	void concurrentChurnNeverHidesALongLivedSession() throws Exception {
		SessionRegistry registry = new SessionRegistry(ReconnectPolicy.REPLACE);
		SessionHandle survivor = handle("survivor");
		registry.register(survivor);
		List<List<SessionHandle>> batches = new ArrayList<>();
		for (int t = 0; t < 4; t++) {
			List<SessionHandle> batch = new ArrayList<>();
			for (int i = 0; i < 100; i++) {
				batch.add(handle("churn-" + t + "-" + i));
			}
			batches.add(batch);
		}
		CountDownLatch start = new CountDownLatch(1);
		AtomicBoolean missed = new AtomicBoolean();
		List<Future<?>> workers = new ArrayList<>();
		for (List<SessionHandle> batch : batches) {
			workers.add(this.executor.submit(() -> {
				start.await();
				for (SessionHandle handle : batch) {
					registry.register(handle);
					if (registry.lookup(this.client.localDid()).isEmpty()) {
						missed.set(true);
					}
					registry.remove(handle);
				}
				return null;
			}));
		}

		start.countDown();
		for (Future<?> worker : workers) {
			worker.get(10, TimeUnit.SECONDS);
		}

		assertThat(missed).isFalse();
		assertThat(registry.lookup(this.client.localDid())).containsSame(survivor);
		assertThat(registry.size()).isEqualTo(1);
		registry.remove(survivor);
		assertThat(registry.size()).isZero();
	}

	private SessionHandle handle(String name) {
		ConnectionScope scope = new ConnectionScope(name, this.executor);
		return new SessionHandle(this.server.connect(this.client.localDid()),
				DuplexStreams.open(this.client.localDid(), scope));
	}

}
