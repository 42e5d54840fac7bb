package com.studioscout.core.extract;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * 필드 추출 결과.
 * PRESENT: 값 있음 / ABSENT: 셀렉터 미매칭(오류 아님) / FAILED: 매칭은 됐으나 가공 실패.
 */
public final class FieldResult<T> {

    public enum Status { PRESENT, ABSENT, FAILED }

    private static final FieldResult<?> ABSENT = new FieldResult<>(Status.ABSENT, null, null);

    private final Status status;
    private final T value;
    private final Throwable cause;

    private FieldResult(Status status, T value, Throwable cause) {
        this.status = status;
        this.value = value;
        this.cause = cause;
    }

    public static <T> FieldResult<T> present(T value) {
        return new FieldResult<>(Status.PRESENT, Objects.requireNonNull(value, "value"), null);
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldResult<T> absent() {
        return (FieldResult<T>) ABSENT;
    }

    public static <T> FieldResult<T> failed(Throwable cause) {
        return new FieldResult<>(Status.FAILED, null, Objects.requireNonNull(cause, "cause"));
    }

    /** Optional을 PRESENT/ABSENT로 */
    public static <T> FieldResult<T> ofOptional(Optional<T> v) {
        return v.map(FieldResult::present).orElseGet(FieldResult::absent);
    }

    public Status status() { return status; }
    public boolean isPresent() { return status == Status.PRESENT; }
    public boolean isAbsent() { return status == Status.ABSENT; }
    public boolean isFailed() { return status == Status.FAILED; }

    public T get() {
        if (status != Status.PRESENT) throw new NoSuchElementException("no value: " + status);
        return value;
    }

    public Throwable cause() { return cause; }

    @Override public String toString() {
        return switch (status) {
            case PRESENT -> "present(" + value + ")";
            case ABSENT -> "absent";
            case FAILED -> "failed(" + cause + ")";
        };
    }
}
