package com.z254.butterfly.prism.causal;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of re-estimating an effect with the cause column randomly permuted.
 * A genuine cause should lose its effect under permutation.
 */
@Value
@Builder
public class PlaceboRefutation {

    double placeboEffect;

    double placeboPValue;

    /** True when the placebo effect is not significant */
    boolean passed;
}
