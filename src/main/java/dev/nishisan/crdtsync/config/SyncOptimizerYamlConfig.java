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
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncOptimizerYamlConfig {

    @JsonProperty("node")
    private NodeIdentityConfig node;

    @JsonProperty("compression")
    private CompressionPolicyConfig compression;

    @JsonProperty("sync")
    private SyncPolicyConfig sync;

    @JsonProperty("conflicts")
    private ConflictPolicyConfig conflicts;

    @JsonProperty("monitor")
    private MonitorPolicyConfig monitor;

    @JsonProperty("metrics")
    private MetricsPolicyConfig metrics;

    @JsonProperty("alerting")
    private AlertingPolicyConfig alerting;

    public NodeIdentityConfig getNode() {
        return node;
    }

    public void setNode(NodeIdentityConfig node) {
        this.node = node;
    }

    public CompressionPolicyConfig getCompression() {
        return compression;
    }

    public void setCompression(CompressionPolicyConfig compression) {
        this.compression = compression;
    }

    public SyncPolicyConfig getSync() {
        return sync;
    }

    public void setSync(SyncPolicyConfig sync) {
        this.sync = sync;
    }

    public ConflictPolicyConfig getConflicts() {
        return conflicts;
    }

    public void setConflicts(ConflictPolicyConfig conflicts) {
        this.conflicts = conflicts;
    }

    public MonitorPolicyConfig getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorPolicyConfig monitor) {
        this.monitor = monitor;
    }

    public MetricsPolicyConfig getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsPolicyConfig metrics) {
        this.metrics = metrics;
    }

    public AlertingPolicyConfig getAlerting() {
        return alerting;
    }

    public void setAlerting(AlertingPolicyConfig alerting) {
        this.alerting = alerting;
    }
}
