package com.fieldops.clustering.engine;

import lombok.Value;

import java.util.List;

/**
 * Outcome of one {@link WeightedPartitioner} run. {@code groups} holds no empty
 * group; {@code iterations} is 0 when the input was small enough to short-circuit.
 */
@Value
public class Partition {

    List<PointGroup> groups;
    int iterations;
    boolean converged;
}
