package com.finance.audit.model;

import lombok.Value;

import java.util.List;

/**
 * One logical series: a unique dimension key with its observations sorted by period.
 */
@Value
public class DimensionGroup {

    DimensionKey key;
    List<Observation> observations;

    public DimensionGroup(DimensionKey key, List<Observation> observations) {
        for (int i = 1; i < observations.size(); i++) {
            if (observations.get(i - 1).getPeriod().compareTo(observations.get(i).getPeriod()) >= 0) {
                throw new IllegalArgumentException("Observations of " + key
                        + " must have unique periods in ascending order");
            }
        }
        this.key = key;
        this.observations = List.copyOf(observations);
    }

    public int size() {
        return observations.size();
    }

    public double[] values() {
        double[] values = new double[observations.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = observations.get(i).getValue();
        }
        return values;
    }
}
