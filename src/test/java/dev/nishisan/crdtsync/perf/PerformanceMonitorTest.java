/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.crdtsync.perf;

import dev.nishisan.crdtsync.MutableClock;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class PerformanceMonitorTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    /** Probe with a heap that grows 2 MB on every read. */
    private static final class SteppingProbe implements ResourceProbe {
        private final AtomicInteger heapReads = new AtomicInteger();
        private final AtomicInteger cpuReads = new AtomicInteger();

        @Override
        public long usedHeapBytes() {
            return heapReads.getAndIncrement() * 2L * 1024 * 1024;
        }

        @Override
        public long currentThreadCpuNanos() {
            return -1L;
        }

        @Override
        public double processCpuPercent() {
            cpuReads.incrementAndGet();
            return 12.5;
        }
    }

    private static PerformanceSample sample(String type, double latency, boolean success) {
        return new PerformanceSample(type, latency, 1.0, 10.0, T0, success, 0L);
    }

    @Test
    void measureRecordsSuccessfulOperation() throws Exception {
        MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        PerformanceMonitor monitor = PerformanceMonitor.builder()
                .probe(new SteppingProbe())
                .clock(clock)
                .build();

        byte[] result = monitor.measure("delta_compression", () -> new byte[64]);

        assertEquals(64, result.length);
        PerformanceSample recorded = monitor.samples().get(0);
        assertEquals("delta_compression", recorded.operationType());
        assertTrue(recorded.success());
        assertEquals(64L, recorded.payloadSizeBytes());
        assertEquals(2.0, recorded.memoryUsageMb(), 1e-9);
        assertEquals(0.0, recorded.cpuUsagePercent());
        assertEquals(T0, recorded.timestamp());
        assertTrue(recorded.latencyMs() >= 0.0);
    }

    @Test
    void failingOperationIsRecordedAndRethrown() {
        PerformanceMonitor monitor = PerformanceMonitor.builder().probe(new SteppingProbe()).build();

        IOException thrown = assertThrows(IOException.class, () -> monitor.measure("peer_sync", () -> {
            throw new IOException("link down");
        }));

        assertEquals("link down", thrown.getMessage());
        assertEquals(1, monitor.historySize());
        assertFalse(monitor.samples().get(0).success());
        assertEquals(0L, monitor.samples().get(0).payloadSizeBytes());
    }

    @Test
    void supplierVariantWrapsCheckedFailures() {
        PerformanceMonitor monitor = PerformanceMonitor.builder().probe(new SteppingProbe()).build();

        IllegalArgumentException unchecked = assertThrows(IllegalArgumentException.class,
                () -> monitor.measureSupplier("op", () -> {
                    throw new IllegalArgumentException("boom");
                }));
        assertEquals("boom", unchecked.getMessage());

        IllegalStateException wrapped = assertThrows(IllegalStateException.class,
                () -> monitor.measureSupplier("op", () -> {
                    PerformanceMonitorTest.<RuntimeException>sneakyThrow(new IOException("disk full"));
                    return null;
                }));
        assertInstanceOf(IOException.class, wrapped.getCause());

        AtomicInteger runs = new AtomicInteger();
        monitor.measureRunnable("op", runs::incrementAndGet);

        assertEquals(1, runs.get());
        assertEquals(3, monitor.historySize());
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E {
        throw (E) t;
    }

    @Test
    void failureIsLeftToTheCallerToReport() {
        java.util.logging.Logger julLogger = java.util.logging.Logger.getLogger(PerformanceMonitor.class.getName());
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        capture.setLevel(Level.ALL);
        julLogger.addHandler(capture);
        try {
            PerformanceMonitor monitor = PerformanceMonitor.builder().probe(new SteppingProbe()).build();
            assertThrows(IOException.class, () -> monitor.measure("peer_sync", () -> {
                throw new IOException("link down");
            }));
        } finally {
            julLogger.removeHandler(capture);
        }

        assertTrue(records.stream().noneMatch(r -> r.getLevel().intValue() >= Level.WARNING.intValue()));
    }

    @Test
    void summaryComputesLatencyStatistics() {
        PerformanceMonitor monitor = PerformanceMonitor.builder().build();
        for (int i = 1; i <= 20; i++) {
            monitor.record(sample("peer_sync", i, i != 20));
        }
        monitor.record(sample("delta_compression", 500, true));

        PerformanceSummary sync = monitor.summary("peer_sync");

        assertTrue(sync.hasData());
        assertEquals(20, sync.count());
        assertEquals(0.95, sync.successRate(), 1e-9);
        assertEquals(10.5, sync.latency().avgMs(), 1e-9);
        assertEquals(1.0, sync.latency().minMs());
        assertEquals(20.0, sync.latency().maxMs());
        assertEquals(20.0, sync.latency().p95Ms());
        assertEquals(1.0, sync.memory().avg(), 1e-9);
        assertEquals(10.0, sync.cpu().peak(), 1e-9);

        PerformanceSummary all = monitor.summary();
        assertEquals(21, all.count());
        assertEquals(500.0, all.latency().maxMs());
        assertEquals(Set.of("delta_compression", "peer_sync"), monitor.operationTypes());
    }

    @Test
    void p95OfSmallSampleIsLargestValue() {
        PerformanceMonitor monitor = PerformanceMonitor.builder().build();
        List.of(5.0, 1.0, 3.0).forEach(l -> monitor.record(sample("op", l, true)));

        assertEquals(5.0, monitor.summary("op").latency().p95Ms());
    }

    @Test
    void summaryWithoutSamplesReportsNoData() {
        PerformanceMonitor monitor = PerformanceMonitor.builder().build();

        PerformanceSummary summary = monitor.summary("peer_sync");

        assertFalse(summary.hasData());
        assertEquals(0, summary.count());
        assertEquals("peer_sync", summary.operationType());
    }

    @Test
    void historyIsBounded() {
        PerformanceMonitor monitor = PerformanceMonitor.builder().historyCapacity(5).build();
        for (int i = 0; i < 12; i++) {
            monitor.record(sample("op", i, true));
        }

        assertEquals(5, monitor.historySize());
        assertEquals(7.0, monitor.samples().get(0).latencyMs());
    }

    @Test
    void backgroundSamplerStartsAndStops() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            SteppingProbe probe = new SteppingProbe();
            PerformanceMonitor monitor = PerformanceMonitor.builder()
                    .probe(probe)
                    .sampling(scheduler, Duration.ofMillis(20))
                    .build();
            assertFalse(monitor.isMonitoring());

            monitor.start();
            assertTrue(monitor.isMonitoring());
            await("sampler ticks").atMost(5, TimeUnit.SECONDS).until(() -> probe.cpuReads.get() >= 3);

            assertTrue(monitor.stop());
            assertFalse(monitor.isMonitoring());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void monitorWithoutSchedulerIgnoresLifecycle() {
        PerformanceMonitor monitor = PerformanceMonitor.builder().build();
        monitor.start();
        assertFalse(monitor.isMonitoring());
        assertTrue(monitor.stop());
    }
}
