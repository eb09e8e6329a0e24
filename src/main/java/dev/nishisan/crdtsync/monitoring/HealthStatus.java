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

package dev.nishisan.crdtsync.monitoring;

/**
 * Health band derived from the composite score.
 */
public enum HealthStatus {
    EXCELLENT,
    GOOD,
    WARNING,
    CRITICAL;

    public static HealthStatus fromScore(double score) {
        if (score >= 95.0) {
            return EXCELLENT;
        }
        if (score >= 85.0) {
            return GOOD;
        }
        if (score >= 70.0) {
            return WARNING;
        }
        return CRITICAL;
    }
}
