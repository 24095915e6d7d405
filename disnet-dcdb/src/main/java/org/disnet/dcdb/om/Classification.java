package org.disnet.dcdb.om;

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

/**
 * Experiment classification derived from the score vote.
 */
public enum Classification {

    SYNERGISTIC(1, "Synergistic"),
    ADDITIVE(0, "Additive"),
    ANTAGONISTIC(-1, "Antagonistic");

    private final int vote;
    private final String label;

    Classification(int vote, String label) {
        this.vote = vote;
        this.label = label;
    }

    public int getVote() {
        return vote;
    }

    /** Name stored in {@code experiment_classification}. */
    public String getLabel() {
        return label;
    }

    public static Classification fromVote(int vote) {
        if (vote > 0) return SYNERGISTIC;
        if (vote < 0) return ANTAGONISTIC;
        return ADDITIVE;
    }
}
