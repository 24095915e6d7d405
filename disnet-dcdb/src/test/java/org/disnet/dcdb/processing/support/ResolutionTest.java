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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ResolutionTest {

	@Test
	void resolved_carries_value_and_zero_code() {
		Resolution<String> r = Resolution.resolved("CHEMBL185");
		assertTrue(r.isResolved());
		assertEquals("CHEMBL185", r.getValue());
		assertEquals(0, r.getCode());
	}

	@Test
	void unresolvable_carries_code_and_refuses_value() {
		Resolution<String> r = Resolution.unresolvable(2, "no ChEMBL mapping");
		assertFalse(r.isResolved());
		assertEquals(2, r.getCode());
		IllegalStateException ex = assertThrows(IllegalStateException.class, r::getValue);
		assertTrue(ex.getMessage().contains("no ChEMBL mapping"));
	}

	@Test
	void invalid_construction_is_rejected() {
		assertThrows(NullPointerException.class, () -> Resolution.resolved(null));
		assertThrows(IllegalArgumentException.class, () -> Resolution.unresolvable(0, "none"));
	}
}
