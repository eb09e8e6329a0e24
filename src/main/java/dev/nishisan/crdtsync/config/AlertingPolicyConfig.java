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

package dev.nishisan.crdtsync.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serial;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertingPolicyConfig implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private boolean defaultRules = true;
    private boolean loggingListener = true;
    private Map<String, RuleConfig> rules = new LinkedHashMap<>(); // keyed by rule name

    public boolean isDefaultRules() {
        return defaultRules;
    }

    public void setDefaultRules(boolean defaultRules) {
        this.defaultRules = defaultRules;
    }

    public boolean isLoggingListener() {
        return loggingListener;
    }

    public void setLoggingListener(boolean loggingListener) {
        this.loggingListener = loggingListener;
    }

    public Map<String, RuleConfig> getRules() {
        return rules;
    }

    public void setRules(Map<String, RuleConfig> rules) {
        this.rules = rules;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleConfig implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;
        private boolean enabled = true;
        private String cooldown; // "10m"
        private String severity; // LOW, MEDIUM, HIGH, CRITICAL

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCooldown() {
            return cooldown;
        }

        public void setCooldown(String cooldown) {
            this.cooldown = cooldown;
        }

        public String getSeverity() {
            return severity;
        }

        public void setSeverity(String severity) {
            this.severity = severity;
        }
    }
}
