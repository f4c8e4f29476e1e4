/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.conversion;

import java.time.Instant;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dev.driftwood.reader.TypeConflictException;
import dev.driftwood.schema.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampConverterTest {

    @Test
    void testDateIsMidnightUtc() throws Exception {
        assertThat(TimestampConverter.toEpochUnits("1970-01-01", TimeUnit.SECOND)).isZero();
        assertThat(TimestampConverter.toEpochUnits("1991-02-03", TimeUnit.SECOND))
                .isEqualTo(Instant.parse("1991-02-03T00:00:00Z").getEpochSecond());
    }

    @Test
    void testDateTimeForms() throws Exception {
        long expected = Instant.parse("2018-11-13T17:11:10Z").getEpochSecond();

        assertThat(TimestampConverter.toEpochUnits("2018-11-13 17:11:10", TimeUnit.SECOND)).isEqualTo(expected);
        assertThat(TimestampConverter.toEpochUnits("2018-11-13T17:11:10", TimeUnit.SECOND)).isEqualTo(expected);
        assertThat(TimestampConverter.toEpochUnits("2018-11-13T17:11:10Z", TimeUnit.SECOND)).isEqualTo(expected);
        assertThat(TimestampConverter.toEpochUnits("2018-11-13T19:11:10+02:00", TimeUnit.SECOND)).isEqualTo(expected);
        assertThat(TimestampConverter.toEpochUnits("2018-11-13T17:11", TimeUnit.SECOND)).isEqualTo(expected - 10);
    }

    @Test
    void testFinerUnits() throws Exception {
        Instant instant = Instant.parse("2018-11-13T17:11:10.123Z");

        assertThat(TimestampConverter.toEpochUnits("2018-11-13T17:11:10.123Z", TimeUnit.MILLI))
                .isEqualTo(instant.toEpochMilli());
        assertThat(TimestampConverter.toEpochUnits("2018-11-13T17:11:10.123456Z", TimeUnit.MICRO))
                .isEqualTo(instant.getEpochSecond() * 1_000_000L + 123_456L);
        assertThat(TimestampConverter.toEpochUnits("1969-12-31T23:59:59.5", TimeUnit.MILLI)).isEqualTo(-500L);
        assertThat(TimestampConverter.toEpochUnits("2018-11-13 17:11:10.123456789-01:30", TimeUnit.NANO))
                .isEqualTo((instant.getEpochSecond() + 5400) * 1_000_000_000L + 123_456_789L);
    }

    @Test
    void testLossyConversionRejected() {
        assertThatThrownBy(() -> TimestampConverter.toEpochUnits("2018-11-13T17:11:10.5", TimeUnit.SECOND))
                .isInstanceOf(TypeConflictException.class)
                .hasMessageContaining("precision");
    }

    @Test
    void testEpochDays() throws Exception {
        assertThat(TimestampConverter.toEpochDays("2020-01-02")).isEqualTo((int) LocalDate.of(2020, 1, 2).toEpochDay());
        assertThat(TimestampConverter.toEpochDays("1969-12-31")).isEqualTo(-1);
        assertThatThrownBy(() -> TimestampConverter.toEpochDays("2020-01-02T00:00"))
                .isInstanceOf(TypeConflictException.class);
        assertThatThrownBy(() -> TimestampConverter.toEpochDays("+999999999-01-01"))
                .isInstanceOf(TypeConflictException.class)
                .hasMessageContaining("out of range");
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "hello", "2018-11-13T", "2018-13-01", "2018-02-30", "2018-11-13T24:00",
            "2018-11-13T17:11:10.", "2018-11-13T17:11:10Zjunk", "18-11-13", "2018/11/13", "12:00:00",
            "2018-11-13T17:11:10.1234567891", "2018-11-13T17:11:10+19:00", "2018-11-13T17:11:60", "2018-11-13T7:11" })
    void testNotTimestamps(String text) {
        assertThat(TimestampConverter.isInferableTimestamp(text)).isFalse();
        assertThatThrownBy(() -> TimestampConverter.toEpochUnits(text, TimeUnit.NANO))
                .isInstanceOf(TypeConflictException.class);
    }

    @Test
    void testInferableTimestamps() {
        assertThat(TimestampConverter.isInferableTimestamp("2018-11-13")).isTrue();
        assertThat(TimestampConverter.isInferableTimestamp("2018-11-13 17:11:10")).isTrue();
        assertThat(TimestampConverter.isInferableTimestamp("2018-11-13T17:11:10.000")).isFalse();
    }
}
