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

import dev.nishisan.crdtsync.metrics.HealthSample;

import java.time.Instant;

/**
 * Alert raised by the {@link AlertingEngine} when a rule fires.
 *
 * @param timestamp when the rule fired
 * @param ruleName  rule that fired
 * @param severity  rule severity at the time it fired
 * @param sample    the sample that triggered the rule
 * @param message   human-readable description
 */
public record Alert(
        Instant timestamp,
        String ruleName,
        AlertSeverity severity,
        HealthSample sample,
        String message) {
}
