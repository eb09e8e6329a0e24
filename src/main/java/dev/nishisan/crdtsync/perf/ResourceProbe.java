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

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;

/**
 * Source of resource readings used by {@link PerformanceMonitor}.
 */
public interface ResourceProbe {

    /**
     * @return heap bytes currently in use
     */
    long usedHeapBytes();

    /**
     * @return CPU time consumed by the calling thread in nanoseconds, or -1
     *         when not supported
     */
    long currentThreadCpuNanos();

    /**
     * @return recent CPU load of the JVM process in percent, or -1 when not
     *         supported
     */
    double processCpuPercent();

    /**
     * @return a probe backed by the platform MXBeans
     */
    static ResourceProbe jvm() {
        return JvmResourceProbe.INSTANCE;
    }

    /**
     * Default probe reading {@link Runtime} and the management beans.
     */
    final class JvmResourceProbe implements ResourceProbe {
        static final JvmResourceProbe INSTANCE = new JvmResourceProbe();

        private final ThreadMXBean threads = ManagementFactory.getThreadMXBean();
        private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        private final boolean threadCpuSupported;

        private JvmResourceProbe() {
            boolean supported = threads.isCurrentThreadCpuTimeSupported();
            if (supported && !threads.isThreadCpuTimeEnabled()) {
                try {
                    threads.setThreadCpuTimeEnabled(true);
                } catch (UnsupportedOperationException | SecurityException e) {
                    supported = false;
                }
            }
            this.threadCpuSupported = supported;
        }

        @Override
        public long usedHeapBytes() {
            Runtime runtime = Runtime.getRuntime();
            return runtime.totalMemory() - runtime.freeMemory();
        }

        @Override
        public long currentThreadCpuNanos() {
            return threadCpuSupported ? threads.getCurrentThreadCpuTime() : -1L;
        }

        @Override
        public double processCpuPercent() {
            if (os instanceof com.sun.management.OperatingSystemMXBean) {
                double load = ((com.sun.management.OperatingSystemMXBean) os).getProcessCpuLoad();
                return load < 0 ? -1.0 : load * 100.0;
            }
            return -1.0;
        }
    }
}
