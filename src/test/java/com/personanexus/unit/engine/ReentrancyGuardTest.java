/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.unit.engine;

import com.personanexus.engine.ReentrancyGuard;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReentrancyGuard.
 */
class ReentrancyGuardTest {

    @Test
    void shouldAdmitFirstDeliveryAndRejectDuplicate() {
        ReentrancyGuard guard = new ReentrancyGuard();

        assertTrue(guard.tryAdmit("m1"));
        assertFalse(guard.tryAdmit("m1"), "Second delivery of an in-flight id should be rejected");
        assertTrue(guard.tryAdmit("m2"), "Different ids are independent");
    }

    @Test
    void shouldAdmitAgainAfterRelease() {
        ReentrancyGuard guard = new ReentrancyGuard();
        guard.tryAdmit("m1");

        guard.release("m1");

        assertFalse(guard.isInFlight("m1"));
        assertTrue(guard.tryAdmit("m1"));
    }

    @Test
    void releasingUnknownIdShouldBeNoOp() {
        ReentrancyGuard guard = new ReentrancyGuard();

        guard.release("never-admitted");

        assertEquals(0, guard.inFlightCount());
    }

    @Test
    void admissionShouldReleaseOnClose() {
        ReentrancyGuard guard = new ReentrancyGuard();

        Optional<ReentrancyGuard.Admission> admission = guard.admit("m1");
        assertTrue(admission.isPresent());
        try (ReentrancyGuard.Admission a = admission.get()) {
            assertEquals("m1", a.messageId());
            assertTrue(guard.admit("m1").isEmpty(), "Duplicate should be rejected while admitted");
        }

        assertFalse(guard.isInFlight("m1"), "Closing the admission should release the id");
    }

    @Test
    void admissionShouldReleaseWhenBlockThrows() {
        ReentrancyGuard guard = new ReentrancyGuard();

        assertThrows(IllegalStateException.class, () -> {
            try (ReentrancyGuard.Admission ignored = guard.admit("m1").orElseThrow()) {
                throw new IllegalStateException("boom");
            }
        });

        assertFalse(guard.isInFlight("m1"));
    }

    @Test
    void closingTwiceShouldNotReleaseLaterAdmission() {
        ReentrancyGuard guard = new ReentrancyGuard();
        ReentrancyGuard.Admission first = guard.admit("m1").orElseThrow();
        first.close();
        ReentrancyGuard.Admission second = guard.admit("m1").orElseThrow();

        first.close();

        assertTrue(guard.isInFlight("m1"), "A stale admission must not release a newer one");
        second.close();
    }

    @Test
    void concurrentDeliveriesShouldAdmitExactlyOne() throws Exception {
        ReentrancyGuard guard = new ReentrancyGuard();
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();

        for (int i = 0; i < 64; i++) {
            executor.submit(() -> {
                start.await();
                if (guard.tryAdmit("same-id")) {
                    admitted.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, admitted.get());
    }

    @Property
    void admitThenReleaseShouldLeaveGuardEmpty(@ForAll @AlphaChars @StringLength(min = 1, max = 20) String id) {
        ReentrancyGuard guard = new ReentrancyGuard();

        assertTrue(guard.tryAdmit(id));
        assertFalse(guard.tryAdmit(id));
        guard.release(id);

        assertEquals(0, guard.inFlightCount());
    }
}
