package com.signalsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Whale flow metric of one snapshot: signed net flow (positive = inflow).
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WhaleFlow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double netFlow;

    @JsonCreator
    public WhaleFlow(@JsonProperty("netFlow") double netFlow) {
        this.netFlow = netFlow;
    }

    public double getNetFlow() {
        return netFlow;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WhaleFlow that))
            return false;
        return Double.compare(netFlow, that.netFlow) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(netFlow);
    }

    @Override
    public String toString() {
        return "WhaleFlow{netFlow=" + netFlow + '}';
    }
}
