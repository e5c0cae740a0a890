package com.arbiter.core.model;

/**
 * Which candidate a specification is: the base derived from intent, or one
 * of the two variants derived from that base.
 */
public enum SpecVariant {
    BASE,
    SIMPLIFIED,
    ROBUST
}
