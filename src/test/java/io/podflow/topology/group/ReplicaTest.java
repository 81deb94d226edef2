package io.podflow.topology.group;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ReplicaTest {

    @Test
    void admissionStopsOnceDraining() {
        final Replica replica = new Replica(0, null);
        assertTrue(replica.tryAcquire());
        assertEquals(1, replica.inFlight());

        replica.stopAccepting();
        assertFalse(replica.tryAcquire());
        assertEquals(1, replica.inFlight(), "a rejected caller must not stay counted");

        replica.release();
        assertEquals(0, replica.inFlight());
        replica.resumeAccepting();
        assertTrue(replica.tryAcquire());
    }

    @Test
    void drainWaitsForAdmittedCalls() throws InterruptedException {
        final Replica replica = new Replica(0, null);
        assertTrue(replica.tryAcquire());
        replica.stopAccepting();

        assertFalse(replica.awaitDrained(20));

        final Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            replica.release();
        });
        releaser.start();
        assertTrue(replica.awaitDrained(5_000));
        releaser.join();
    }
}
