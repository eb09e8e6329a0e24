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

package dev.nishisan.crdtsync.alerting;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rule and alert counts for health reports.
 *
 * @param activeRules      enabled rules
 * @param recentAlerts     alerts raised in the last 24 hours
 * @param alertsBySeverity recent alerts per severity
 */
public record AlertingSummary(
        int activeRules,
        int recentAlerts,
        Map<AlertSeverity, Integer> alertsBySeverity) {

    public AlertingSummary {
        alertsBySeverity = Collections.unmodifiableMap(alertsBySeverity.isEmpty()
                ? new EnumMap<>(AlertSeverity.class)
                : new EnumMap<>(alertsBySeverity));
    }
}
