package com.discernus.gasket;

/**
 * Which marker-delimited block wins when a response contains more than one.
 * {@link #LAST} assumes earlier blocks are illustrative or quoted.
 */
public enum MultipleBlockPolicy {
    LAST,
    FIRST,
    REJECT
}
