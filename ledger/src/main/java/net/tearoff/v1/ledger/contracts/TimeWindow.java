package net.tearoff.v1.ledger.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.tearoff.v1.base.annotations.TearoffSerializable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An interval of time within which a transaction must be notarised. Either bound may be open, but not both.
 * The start is inclusive and the end is exclusive.
 */
@TearoffSerializable
public final class TimeWindow {

    @Nullable
    private final Instant fromTime;

    @Nullable
    private final Instant untilTime;

    @JsonCreator
    private TimeWindow(@JsonProperty("fromTime") @Nullable Instant fromTime, @JsonProperty("untilTime") @Nullable Instant untilTime) {
        if (fromTime == null && untilTime == null) {
            throw new IllegalArgumentException("At least one of fromTime and untilTime must be specified");
        }
        if (fromTime != null && untilTime != null && !fromTime.isBefore(untilTime)) {
            throw new IllegalArgumentException("fromTime must be earlier than untilTime: " + fromTime + " >= " + untilTime);
        }
        this.fromTime = fromTime;
        this.untilTime = untilTime;
    }

    /**
     * Creates a window with no end.
     */
    @NotNull
    public static TimeWindow fromOnly(@NotNull Instant fromTime) {
        return new TimeWindow(Objects.requireNonNull(fromTime, "fromTime"), null);
    }

    /**
     * Creates a window with no start.
     */
    @NotNull
    public static TimeWindow untilOnly(@NotNull Instant untilTime) {
        return new TimeWindow(null, Objects.requireNonNull(untilTime, "untilTime"));
    }

    /**
     * Creates a window from {@code fromTime} inclusive to {@code untilTime} exclusive.
     *
     * @throws IllegalArgumentException if {@code fromTime} is not before {@code untilTime}.
     */
    @NotNull
    public static TimeWindow between(@NotNull Instant fromTime, @NotNull Instant untilTime) {
        return new TimeWindow(Objects.requireNonNull(fromTime, "fromTime"), Objects.requireNonNull(untilTime, "untilTime"));
    }

    @NotNull
    public static TimeWindow fromStartAndDuration(@NotNull Instant fromTime, @NotNull Duration duration) {
        return between(fromTime, fromTime.plus(duration));
    }

    /**
     * Creates a window centred on {@code instant}, extending {@code tolerance} either side of it.
     */
    @NotNull
    public static TimeWindow withTolerance(@NotNull Instant instant, @NotNull Duration tolerance) {
        return between(instant.minus(tolerance), instant.plus(tolerance));
    }

    @Nullable
    public Instant getFromTime() {
        return fromTime;
    }

    @Nullable
    public Instant getUntilTime() {
        return untilTime;
    }

    /**
     * @return The middle of the window, or null if one of its bounds is open.
     */
    @JsonIgnore
    @Nullable
    public Instant getMidpoint() {
        final Duration length = getLength();
        return length == null ? null : Objects.requireNonNull(fromTime).plus(length.dividedBy(2));
    }

    /**
     * @return The duration between the bounds, or null if one of them is open.
     */
    @JsonIgnore
    @Nullable
    public Duration getLength() {
        return fromTime == null || untilTime == null ? null : Duration.between(fromTime, untilTime);
    }

    public boolean contains(@NotNull Instant instant) {
        return (fromTime == null || !instant.isBefore(fromTime)) && (untilTime == null || instant.isBefore(untilTime));
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final TimeWindow that = (TimeWindow) o;
        return Objects.equals(fromTime, that.fromTime) && Objects.equals(untilTime, that.untilTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromTime, untilTime);
    }

    @Override
    public String toString() {
        if (fromTime == null) {
            return "[-∞, " + untilTime + ")";
        }
        if (untilTime == null) {
            return "[" + fromTime + ", ∞)";
        }
        return "[" + fromTime + ", " + untilTime + ")";
    }
}
