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

/**
 * Health metrics collection and report settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricsPolicyConfig implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private Integer historyCapacity;
    private String sampleInterval; // "30s"
    private Integer reportWindowHours;
    private ReportConfig report;

    public Integer getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(Integer historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public String getSampleInterval() {
        return sampleInterval;
    }

    public void setSampleInterval(String sampleInterval) {
        this.sampleInterval = sampleInterval;
    }

    public Integer getReportWindowHours() {
        return reportWindowHours;
    }

    public void setReportWindowHours(Integer reportWindowHours) {
        this.reportWindowHours = reportWindowHours;
    }

    public ReportConfig getReport() {
        return report;
    }

    public void setReport(ReportConfig report) {
        this.report = report;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReportConfig implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;
        private String path;
        private String interval; // "1m"

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }
    }
}
