/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.schema;

/**
 * Resolution of a {@link FieldType.TimestampType}: the stored value counts units since the epoch.
 */
public enum TimeUnit {

    SECOND("s", 1L),
    MILLI("ms", 1_000L),
    MICRO("us", 1_000_000L),
    NANO("ns", 1_000_000_000L);

    private final String symbol;
    private final long perSecond;

    TimeUnit(String symbol, long perSecond) {
        this.symbol = symbol;
        this.perSecond = perSecond;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Number of units in one second.
     */
    public long perSecond() {
        return perSecond;
    }

    /**
     * Nanoseconds covered by one unit.
     */
    public long nanosPerUnit() {
        return 1_000_000_000L / perSecond;
    }
}
