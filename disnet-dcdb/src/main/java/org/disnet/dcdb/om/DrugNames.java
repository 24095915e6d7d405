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

import org.apache.commons.lang3.StringUtils;

/**
 * Drug-name normalization applied before any lookup or staging.
 */
public final class DrugNames {

    private static final String APPROVED_MARKER = "(approved)";

    private DrugNames() {}

    /**
     * Strip every {@code "(approved)"} marker (case-insensitive) and trim.
     * {@code "5-FU(approved)"} becomes {@code "5-FU"}. Returns null for null.
     */
    public static String normalize(String name) {
        if (name == null) return null;
        String cleaned = StringUtils.replaceIgnoreCase(name, APPROVED_MARKER, "");
        return StringUtils.normalizeSpace(cleaned);
    }
}
