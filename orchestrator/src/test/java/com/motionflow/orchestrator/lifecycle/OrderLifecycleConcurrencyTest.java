package com.motionflow.orchestrator.lifecycle;

import com.motionflow.orchestrator.model.ExecutionTier;
import com.motionflow.orchestrator.model.MotionOrder;
import com.motionflow.orchestrator.model.OrderStatus;
import com.motionflow.orchestrator.model.PricingTier;
import com.motionflow.orchestrator.repository.OrderRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Two threads, each in its own transaction, race to move the same order
 * from the same version. Exactly one write lands.
 */
@DataJpaTest
@Import({OrderLifecycleService.class, OrderStatusMachine.class, OrderLifecycleConcurrencyTest.Clocks.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class OrderLifecycleConcurrencyTest {

    @TestConfiguration
    static class Clocks {
        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }

    @Autowired OrderLifecycleService lifecycle;
    @Autowired OrderRepository       orderRepo;

    MotionOrder order;
    ExecutorService pool;

    @BeforeEach
    void setUp() {
        order = orderRepo.saveAndFlush(new MotionOrder("MF-20260301-RACE01", "MOTION_TO_COMPEL",
                "client@firm.com", ExecutionTier.B, PricingTier.B, 59_900L));
        pool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        orderRepo.deleteAll();
    }

    @Test
    void concurrentTransitionsFromSameVersion_exactlyOneWins() throws Exception {
        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch go    = new CountDownLatch(1);

        List<Future<MotionOrder>> results = new ArrayList<>();
        results.add(pool.submit(racer(ready, go, OrderStatus.PROCESSING)));
        results.add(pool.submit(racer(ready, go, OrderStatus.CANCELLED_USER)));

        assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
        go.countDown();

        List<MotionOrder> winners   = new ArrayList<>();
        List<Throwable>   conflicts = new ArrayList<>();
        for (Future<MotionOrder> f : results) {
            try {
                winners.add(f.get(10, TimeUnit.SECONDS));
            } catch (ExecutionException e) {
                conflicts.add(e.getCause());
            }
        }

        assertThat(winners).hasSize(1);
        assertThat(conflicts).hasSize(1);
        assertThat(conflicts.get(0)).isInstanceOf(ConcurrencyConflictException.class);

        MotionOrder reloaded = orderRepo.findById(order.getId()).orElseThrow();
        assertThat(reloaded.getStatusVersion()).isEqualTo(2);
        assertThat(reloaded.getStatus()).isEqualTo(winners.get(0).getStatus());
    }

    private Callable<MotionOrder> racer(CountDownLatch ready, CountDownLatch go, OrderStatus target) {
        return () -> {
            ready.countDown();
            go.await();
            return lifecycle.transition(order.getId(), 1, target);
        };
    }
}
