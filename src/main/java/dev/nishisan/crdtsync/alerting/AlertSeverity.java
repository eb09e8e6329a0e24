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

import dev.nishisan.crdtsync.config.InvalidConfigurationException;

import java.util.Locale;

/**
 * Severity of an {@link Alert}, in increasing order.
 */
public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Parses a severity name, case-insensitively.
     *
     * @param name the name
     * @return the severity
     * @throws InvalidConfigurationException if the name is unknown
     */
    public static AlertSeverity parse(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Alert severity must not be empty");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Unknown alert severity: " + name, e);
        }
    }
}
