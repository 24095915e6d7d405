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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ClassificationTest {

	@Test
	void vote_sign_selects_label() {
		assertEquals(Classification.SYNERGISTIC, Classification.fromVote(3));
		assertEquals(Classification.ADDITIVE, Classification.fromVote(0));
		assertEquals(Classification.ANTAGONISTIC, Classification.fromVote(-1));
		assertEquals("Synergistic", Classification.SYNERGISTIC.getLabel());
		assertEquals(-1, Classification.ANTAGONISTIC.getVote());
	}

	@Test
	void round4_rounds_half_up() {
		assertEquals(5.5369, Score.round4(5.53686));
		assertEquals(-2.7507, Score.round4(-2.75071));
		assertEquals(1.0, Score.round4(0.99996));
	}
}
