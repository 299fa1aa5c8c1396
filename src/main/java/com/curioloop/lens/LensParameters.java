/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

import java.util.Map;

/**
 * Immutable parameter set of one lens profile.
 * <p>
 * Values are not validated. The ranges published by
 * {@link LensProfile#getDefaultBounds()} are advisory.
 * </p>
 */
public interface LensParameters {

    /**
     * Gets the values in {@link LensProfile#getParamNames()} order.
     * @return Fresh array of values
     */
    double[] toArray();

    /**
     * Gets the values keyed by parameter name, in parameter order.
     * @return Unmodifiable map
     */
    Map<String, Double> toMap();
}
