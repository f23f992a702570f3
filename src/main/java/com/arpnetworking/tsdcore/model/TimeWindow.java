/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.tsdcore.model;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.Duration;
import java.time.Instant;

/**
 * A span of time between two UTC instants. The start is inclusive and the end
 * is exclusive; the end is never before the start.
 */
@Loggable
public final class TimeWindow {

    public Instant getStart() {
        return _start;
    }

    public Instant getEnd() {
        return _end;
    }

    public Duration getDuration() {
        return Duration.between(_start, _end);
    }

    /**
     * Create a window with the same end whose start is moved earlier.
     *
     * @param padding How much earlier the start should be. Cannot be negative.
     * @return The widened {@link TimeWindow}.
     */
    public TimeWindow widen(final Duration padding) {
        Preconditions.checkArgument(!padding.isNegative(), "Padding cannot be negative; padding=%s", padding);
        return new Builder()
                .setStart(_start.minus(padding))
                .setEnd(_end)
                .build();
    }

    /**
     * Split this window into contiguous sub-windows none of which is longer
     * than the specified length. Every sub-window except possibly the last
     * has exactly that length. An empty window has no sub-windows.
     *
     * @param maxLength The maximum length of a sub-window. Must be positive.
     * @return The sub-windows in ascending order.
     */
    public ImmutableList<TimeWindow> partition(final Duration maxLength) {
        Preconditions.checkArgument(
                !maxLength.isNegative() && !maxLength.isZero(),
                "Sub-window length must be positive; maxLength=%s",
                maxLength);
        final ImmutableList.Builder<TimeWindow> windows = ImmutableList.builder();
        Instant cursor = _start;
        while (cursor.isBefore(_end)) {
            final Instant next = cursor.plus(maxLength);
            final Instant subWindowEnd = next.isBefore(_end) ? next : _end;
            windows.add(new Builder()
                    .setStart(cursor)
                    .setEnd(subWindowEnd)
                    .build());
            cursor = subWindowEnd;
        }
        return windows.build();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final TimeWindow other = (TimeWindow) object;

        return Objects.equal(_start, other._start)
                && Objects.equal(_end, other._end);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_start, _end);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Start", _start)
                .add("End", _end)
                .toString();
    }

    private TimeWindow(final Builder builder) {
        _start = builder._start;
        _end = builder._end;
    }

    private final Instant _start;
    private final Instant _end;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link TimeWindow}.
     */
    public static final class Builder extends OvalBuilder<TimeWindow> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(TimeWindow::new);
        }

        /**
         * Set the start. Required. Cannot be null.
         *
         * @param value The start.
         * @return This {@link Builder} instance.
         */
        public Builder setStart(final Instant value) {
            _start = value;
            return this;
        }

        /**
         * Set the end. Required. Cannot be null. Cannot be before the start.
         *
         * @param value The end.
         * @return This {@link Builder} instance.
         */
        public Builder setEnd(final Instant value) {
            _end = value;
            return this;
        }

        /**
         * Validate that the end is not before the start.
         *
         * @param end the end of the window
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateEnd(final Instant end) {
            return _start == null || !end.isBefore(_start);
        }

        @NotNull
        private Instant _start;
        @NotNull
        @ValidateWithMethod(methodName = "validateEnd", parameterType = Instant.class)
        private Instant _end;
    }
}
