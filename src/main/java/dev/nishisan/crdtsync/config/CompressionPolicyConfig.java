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
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CompressionPolicyConfig implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private Integer thresholdBytes; // payloads below this are sent uncompressed
    private Integer highRatioThresholdBytes;
    private List<String> disabledAlgorithms = new ArrayList<>(); // "fast", "high-ratio"

    public Integer getThresholdBytes() {
        return thresholdBytes;
    }

    public void setThresholdBytes(Integer thresholdBytes) {
        this.thresholdBytes = thresholdBytes;
    }

    public Integer getHighRatioThresholdBytes() {
        return highRatioThresholdBytes;
    }

    public void setHighRatioThresholdBytes(Integer highRatioThresholdBytes) {
        this.highRatioThresholdBytes = highRatioThresholdBytes;
    }

    public List<String> getDisabledAlgorithms() {
        return disabledAlgorithms;
    }

    public void setDisabledAlgorithms(List<String> disabledAlgorithms) {
        this.disabledAlgorithms = disabledAlgorithms;
    }
}
