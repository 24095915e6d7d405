package org.disnet.dcdb.processing.support;

/*
 * This file is part of DISNET DCDB.
 *
 * Copyright (C) 2025 DISNET
 *
 * DISNET DCDB is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DISNET DCDB is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DISNET DCDB.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.util.Objects;

/**
 * Outcome of resolving one entity: either a value, or an expected
 * "unresolvable" with a numeric reason code. Unexpected failures are thrown,
 * never carried here.
 *
 * @param <T> resolved value type
 */
public final class Resolution<T> {

    private final T value;
    private final int code;
    private final String reason;

    private Resolution(T value, int code, String reason) {
        this.value = value;
        this.code = code;
        this.reason = reason;
    }

    public static <T> Resolution<T> resolved(T value) {
        return new Resolution<>(Objects.requireNonNull(value, "value"), 0, null);
    }

    public static <T> Resolution<T> unresolvable(int code, String reason) {
        if (code <= 0) {
            throw new IllegalArgumentException("reason code must be positive: " + code);
        }
        return new Resolution<>(null, code, reason);
    }

    public boolean isResolved() {
        return value != null;
    }

    /**
     * @throws IllegalStateException if unresolvable
     */
    public T getValue() {
        if (value == null) {
            throw new IllegalStateException("Unresolvable (" + code + "): " + reason);
        }
        return value;
    }

    /** Reason code, 0 when resolved. */
    public int getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isResolved() ? "Resolved[" + value + "]" : "Unresolvable[" + code + ": " + reason + "]";
    }
}
