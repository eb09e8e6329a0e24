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

package dev.nishisan.crdtsync.sync;

import java.util.Locale;

/**
 * Priority of a scheduled peer synchronization. The factor scales the
 * activity-adjusted interval.
 */
public enum SyncPriority {
    CRITICAL(0.1),
    HIGH(0.5),
    NORMAL(1.0),
    LOW(2.0);

    private final double intervalFactor;

    SyncPriority(double intervalFactor) {
        this.intervalFactor = intervalFactor;
    }

    public double intervalFactor() {
        return intervalFactor;
    }

    /**
     * Maps the replication engine's activity level ({@code high},
     * {@code normal}, {@code low}) to a priority. Anything else, including
     * {@code null}, maps to {@link #NORMAL}.
     *
     * @param activityLevel activity level label
     * @return the priority
     */
    public static SyncPriority fromActivityLevel(String activityLevel) {
        if (activityLevel == null) {
            return NORMAL;
        }
        switch (activityLevel.trim().toLowerCase(Locale.ROOT)) {
            case "high":
                return HIGH;
            case "low":
                return LOW;
            case "normal":
            default:
                return NORMAL;
        }
    }
}
