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
import dev.nishisan.crdtsync.metrics.HealthSample;
import dev.nishisan.crdtsync.stats.list.BoundedHistory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates {@link AlertRule}s against health samples and dispatches the
 * resulting {@link Alert}s to registered {@link AlertListener listeners}.
 *
 * <p>
 * Each rule has its own cooldown, keyed by rule name, to prevent alert
 * storms. A listener that throws is logged and does not prevent other
 * listeners or later alerts from running.
 * </p>
 */
public final class AlertingEngine {

    private static final Logger LOGGER = Logger.getLogger(AlertingEngine.class.getName());

    public static final int DEFAULT_HISTORY_CAPACITY = 1000;
    /** Window of {@link AlertingSummary#recentAlerts()}. */
    public static final Duration SUMMARY_WINDOW = Duration.ofHours(24);

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, AlertRule> rules = new LinkedHashMap<>();
    private final Map<String, Instant> lastFired = new HashMap<>();
    private final BoundedHistory<Alert> history;
    private final List<AlertListener> listeners = new CopyOnWriteArrayList<>();

    private AlertingEngine(Builder builder) {
        this.clock = builder.clock;
        this.history = new BoundedHistory<>("alerts", builder.historyCapacity);
        builder.rules.forEach(this::addRule);
        listeners.addAll(builder.listeners);
    }

    /**
     * Registers a rule, replacing any rule with the same name. The cooldown of
     * a replaced rule carries over.
     *
     * @param rule the rule
     */
    public void addRule(AlertRule rule) {
        Objects.requireNonNull(rule, "rule");
        lock.lock();
        try {
            AlertRule previous = rules.put(rule.name(), rule);
            if (previous != null) {
                LOGGER.fine(() -> "Replaced alert rule " + rule.name());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a rule and its cooldown state.
     *
     * @param name rule name
     * @throws InvalidConfigurationException if no such rule exists
     */
    public void removeRule(String name) {
        lock.lock();
        try {
            if (rules.remove(name) == null) {
                throw new InvalidConfigurationException("Unknown alert rule: " + name);
            }
            lastFired.remove(name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param name    rule name
     * @param enabled new state
     * @throws InvalidConfigurationException if no such rule exists
     */
    public void setRuleEnabled(String name, boolean enabled) {
        lock.lock();
        try {
            AlertRule rule = rules.get(name);
            if (rule == null) {
                throw new InvalidConfigurationException("Unknown alert rule: " + name);
            }
            rules.put(name, rule.withEnabled(enabled));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evaluates every enabled rule against the sample. Rules whose condition
     * holds and whose cooldown has elapsed raise an alert, which is recorded
     * and dispatched to the listeners.
     *
     * @param sample the sample
     * @return the alerts raised, possibly empty
     */
    public List<Alert> checkAlerts(HealthSample sample) {
        Objects.requireNonNull(sample, "sample");
        List<Alert> fired = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            for (AlertRule rule : rules.values()) {
                if (!rule.enabled() || !matches(rule, sample)) {
                    continue;
                }
                Instant last = lastFired.get(rule.name());
                if (last != null && now.isBefore(last.plus(rule.cooldown()))) {
                    continue;
                }
                lastFired.put(rule.name(), now);
                Alert alert = new Alert(now, rule.name(), rule.severity(), sample, message(rule));
                history.add(alert);
                fired.add(alert);
            }
        } finally {
            lock.unlock();
        }
        fired.forEach(this::dispatch);
        return fired;
    }

    private static boolean matches(AlertRule rule, HealthSample sample) {
        try {
            return rule.condition().test(sample);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Alert rule " + rule.name() + " failed to evaluate", e);
            return false;
        }
    }

    private static String message(AlertRule rule) {
        String message = "CRDT alert: " + rule.name() + " triggered";
        if (rule.description() != null && !rule.description().isBlank()) {
            message += " (" + rule.description() + ")";
        }
        return message;
    }

    private void dispatch(Alert alert) {
        LOGGER.info(() -> "[ALERT] " + alert.severity() + " " + alert.ruleName() + ": " + alert.message());
        for (AlertListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (Throwable t) {
                LOGGER.log(Level.WARNING, "Alert listener threw exception", t);
            }
        }
    }

    /**
     * @return registered rules, in registration order
     */
    public List<AlertRule> rules() {
        lock.lock();
        try {
            return List.copyOf(rules.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return raised alerts, oldest first
     */
    public List<Alert> history() {
        return history.snapshot();
    }

    /**
     * @param window trailing window
     * @return alerts raised strictly after {@code now - window}
     */
    public List<Alert> recentAlerts(Duration window) {
        Instant since = clock.instant().minus(window);
        return history.filter(a -> a.timestamp().isAfter(since));
    }

    public AlertingSummary summary() {
        int active = (int) rules().stream().filter(AlertRule::enabled).count();
        List<Alert> recent = recentAlerts(SUMMARY_WINDOW);
        Map<AlertSeverity, Integer> bySeverity = new EnumMap<>(AlertSeverity.class);
        recent.forEach(a -> bySeverity.merge(a.severity(), 1, Integer::sum));
        return new AlertingSummary(active, recent.size(), bySeverity);
    }

    /**
     * Registers a listener for dispatched alerts.
     *
     * @param listener the listener
     */
    public void addListener(AlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener
     */
    public void removeListener(AlertListener listener) {
        listeners.remove(listener);
    }

    /**
     * Returns the number of currently registered listeners.
     * Mainly for testing.
     *
     * @return the listener count
     */
    public int listenerCount() {
        return listeners.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link AlertingEngine}.
     */
    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
        private final List<AlertRule> rules = new ArrayList<>();
        private final List<AlertListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder historyCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
            return this;
        }

        /**
         * Registers the {@link DefaultAlertRules presets}.
         *
         * @return this builder
         */
        public Builder withDefaultRules() {
            rules.addAll(DefaultAlertRules.all());
            return this;
        }

        public Builder rule(AlertRule rule) {
            rules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Builder listener(AlertListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public AlertingEngine build() {
            return new AlertingEngine(this);
        }
    }
}
