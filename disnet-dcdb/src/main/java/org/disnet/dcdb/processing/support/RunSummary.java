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

import java.util.concurrent.atomic.AtomicInteger;

import org.disnet.dcdb.util.Logger;

/**
 * Thread-safe counters for one stage or one run.
 */
public final class RunSummary {

    private final String label;
    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    public RunSummary(String label) {
        this.label = label;
    }

    public void success() { succeeded.incrementAndGet(); }
    public void skip()    { skipped.incrementAndGet(); }
    public void failure() { failed.incrementAndGet(); }

    public int getSucceeded() { return succeeded.get(); }
    public int getSkipped()   { return skipped.get(); }
    public int getFailed()    { return failed.get(); }

    public int getTotal() {
        return getSucceeded() + getSkipped() + getFailed();
    }

    public String getLabel() {
        return label;
    }

    /** Log the counters at INFO, or WARN if anything failed. */
    public void log() {
        if (getFailed() > 0) {
            Logger.warn("{} finished: {}", label, this);
        } else {
            Logger.info("{} finished: {}", label, this);
        }
    }

    @Override
    public String toString() {
        return "succeeded=" + getSucceeded() + ", skipped=" + getSkipped() + ", failed=" + getFailed();
    }
}
