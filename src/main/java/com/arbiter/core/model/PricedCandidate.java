package com.arbiter.core.model;

import java.io.Serializable;

/**
 * A candidate specification together with its priced cost.
 */
public record PricedCandidate(
    Specification specification,
    Cost cost
) implements Serializable {}
