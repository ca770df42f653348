package com.fleetaudit.core.script;

import java.util.Objects;

/**
 * Outcome of one helper-script invocation.
 *
 * <ul>
 * <li>{@link Status#SUCCESS}: exit code 0 and a parseable JSON value on stdout</li>
 * <li>{@link Status#ABSENT}: exit code 1, the script found nothing to report</li>
 * <li>{@link Status#BROKEN}: any other exit code, unparseable output, a
 * timeout or a launch failure</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ScriptResult {

    public enum Status {
        SUCCESS, ABSENT, BROKEN
    }

    private static final ScriptResult ABSENT = new ScriptResult(Status.ABSENT, null, null);

    private final Status status;
    private final Object value;
    private final String reason;

    private ScriptResult(Status status, Object value, String reason) {
        this.status = status;
        this.value = value;
        this.reason = reason;
    }

    /**
     * @param value decoded JSON value, may be {@code null} for a JSON {@code null}
     */
    public static ScriptResult success(Object value) {
        return new ScriptResult(Status.SUCCESS, value, null);
    }

    public static ScriptResult absent() {
        return ABSENT;
    }

    public static ScriptResult broken(String reason) {
        return new ScriptResult(Status.BROKEN, null, Objects.requireNonNull(reason, "reason must not be null"));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isAbsent() {
        return status == Status.ABSENT;
    }

    public boolean isBroken() {
        return status == Status.BROKEN;
    }

    /**
     * @return the decoded value; only meaningful for {@link Status#SUCCESS}
     */
    public Object getValue() {
        return value;
    }

    /**
     * @return why the script is considered broken, or {@code null}
     */
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScriptResult that)) {
            return false;
        }
        return status == that.status
                && Objects.equals(value, that.value)
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, value, reason);
    }

    @Override
    public String toString() {
        return switch (status) {
            case SUCCESS -> "ScriptResult{SUCCESS, value=" + value + '}';
            case ABSENT -> "ScriptResult{ABSENT}";
            case BROKEN -> "ScriptResult{BROKEN, reason='" + reason + "'}";
        };
    }
}
