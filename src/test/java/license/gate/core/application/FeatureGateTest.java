package license.gate.core.application;

import license.gate.core.Fixtures;
import license.gate.core.licensing.EnvironmentAttestation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static license.gate.core.Fixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

public class FeatureGateTest {

    private Fixtures.Harness h;

    @BeforeEach
    void setUp() throws Exception {
        h = new Fixtures.Harness();
        h.store.activate(h.provision("cust-1"));
    }

    @Test
    void grantsOnlyLicensedFeatures() {
        assertThat(h.gate.checkAccess("cust-1", "module_extraction")).isTrue();
        assertThat(h.gate.checkAccess("cust-1", "llm_integration")).isTrue();
        assertThat(h.gate.checkAccess("cust-1", "flow_extraction")).isFalse();
    }

    @Test
    void neverThrowsOnMissingInput() {
        assertThat(h.gate.checkAccess(null, "module_extraction")).isFalse();
        assertThat(h.gate.checkAccess("cust-1", null)).isFalse();
        assertThat(h.gate.checkAccess("nobody", "module_extraction")).isFalse();
        assertThat(h.gate.listFeatures("nobody")).isEmpty();
        assertThat(h.gate.listFeatures(null)).isEmpty();
    }

    @Test
    void everyCallCountsOnceEvenWhenDenied() {
        h.gate.checkAccess("cust-1", "module_extraction");
        h.gate.checkAccess("cust-1", "flow_extraction");
        h.gate.checkAccess("cust-1", "unknown_feature");
        assertThat(h.store.accessCount("cust-1")).isEqualTo(3);
    }

    @Test
    void listingFeaturesDoesNotCount() {
        assertThat(h.gate.listFeatures("cust-1"))
                .containsExactly("llm_integration", "module_extraction", "step_extraction");
        assertThat(h.store.accessCount("cust-1")).isZero();
    }

    @Test
    void quotaCapsAccessAtConfiguredCount() throws Exception {
        Fixtures.Harness small = new Fixtures.Harness(
                CoreSettings.builder()
                        .signingSecret("s").unlockSecret("u").maxAccessCount(5).build(),
                EnvironmentAttestation.permitAll());
        small.store.activate(small.provision("cust-1"));

        for (int i = 0; i < 5; i++) {
            assertThat(small.gate.checkAccess("cust-1", "module_extraction")).as("acceso %d", i).isTrue();
        }
        assertThat(small.gate.checkAccess("cust-1", "module_extraction")).isFalse();
        assertThat(small.gate.listFeatures("cust-1")).isEmpty();
        assertThat(small.store.size()).isEqualTo(1);
    }

    @Test
    void defaultCapIsOneThousand() {
        int granted = 0;
        for (int i = 0; i < 1005; i++) {
            if (h.gate.checkAccess("cust-1", "module_extraction")) granted++;
        }
        assertThat(granted).isEqualTo(1000);
        assertThat(h.store.accessCount("cust-1")).isEqualTo(1005);
    }

    @Test
    void concurrentChecksCountExactly() throws Exception {
        int threads = 8;
        int perThread = 100;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        if (h.gate.checkAccess("cust-1", "step_extraction")) granted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertThat(h.store.accessCount("cust-1")).isEqualTo(threads * perThread);
        assertThat(granted).hasValue(threads * perThread);
    }

    @Test
    void deniesAfterLicenseExpires() {
        h.clock.set(T0.plus(Duration.ofDays(14)));
        assertThat(h.gate.checkAccess("cust-1", "module_extraction")).isFalse();
        assertThat(h.gate.listFeatures("cust-1")).isEmpty();
        assertThat(h.store.size()).isZero();
    }
}
