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

package dev.nishisan.crdtsync.metrics;

import dev.nishisan.crdtsync.conflict.ConflictRecord;

/**
 * Ingestion side of the metrics pipeline. Producers push samples here
 * without knowing how they are aggregated.
 */
public interface MetricsRecorder {

    void recordHealthSample(HealthSample sample);

    void recordSyncAttempt(SyncAttempt attempt);

    void recordConflict(ConflictRecord conflict);

    /**
     * @return a recorder that discards everything
     */
    static MetricsRecorder noop() {
        return NoopRecorder.INSTANCE;
    }

    /**
     * Recorder used when no collector is attached.
     */
    enum NoopRecorder implements MetricsRecorder {
        INSTANCE;

        @Override
        public void recordHealthSample(HealthSample sample) {
        }

        @Override
        public void recordSyncAttempt(SyncAttempt attempt) {
        }

        @Override
        public void recordConflict(ConflictRecord conflict) {
        }
    }
}
