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

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Threshold rule evaluated against every {@link HealthSample}.
 *
 * @param name        unique rule name, also the cooldown key
 * @param condition   fires the rule when it returns {@code true}
 * @param severity    severity of the raised alert
 * @param cooldown    minimum time between two alerts of this rule
 * @param description appended to the alert message, may be {@code null}
 * @param enabled     disabled rules are skipped
 */
public record AlertRule(
        String name,
        Predicate<HealthSample> condition,
        AlertSeverity severity,
        Duration cooldown,
        String description,
        boolean enabled) {

    public AlertRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(cooldown, "cooldown");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Alert rule name must not be blank");
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("Alert rule cooldown must not be negative: " + name);
        }
    }

    public static AlertRule of(String name, Predicate<HealthSample> condition, AlertSeverity severity,
            Duration cooldown) {
        return new AlertRule(name, condition, severity, cooldown, null, true);
    }

    public AlertRule withSeverity(AlertSeverity severity) {
        return new AlertRule(name, condition, severity, cooldown, description, enabled);
    }

    public AlertRule withCooldown(Duration cooldown) {
        return new AlertRule(name, condition, severity, cooldown, description, enabled);
    }

    public AlertRule withDescription(String description) {
        return new AlertRule(name, condition, severity, cooldown, description, enabled);
    }

    public AlertRule withEnabled(boolean enabled) {
        return new AlertRule(name, condition, severity, cooldown, description, enabled);
    }
}
