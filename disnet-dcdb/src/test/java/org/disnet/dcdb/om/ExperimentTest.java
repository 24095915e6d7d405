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
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

class ExperimentTest {

	private static List<Score> scores() {
		List<Score> s = new ArrayList<>();
		s.add(new Score(Score.HSA, 5.5369, 1));
		s.add(new Score(Score.BLISS, 6.2566, 2));
		s.add(new Score(Score.LOEWE, -2.7507, 3));
		s.add(new Score(Score.ZIP, 1.7183, 4));
		return s;
	}

	@Test
	void hash_ignores_score_order() {
		List<Score> reversed = scores();
		Collections.reverse(reversed);

		Experiment a = new Experiment(7L, "CVCL_0001", 1, 1, scores());
		Experiment b = new Experiment(7L, "CVCL_0001", 1, 1, reversed);

		assertEquals(a.contentHash(), b.contentHash());
		assertEquals(64, a.contentHash().length());
	}

	@Test
	void hash_depends_on_every_field() {
		String base = new Experiment(7L, "CVCL_0001", 1, 1, scores()).contentHash();

		assertNotEquals(base, new Experiment(8L, "CVCL_0001", 1, 1, scores()).contentHash());
		assertNotEquals(base, new Experiment(7L, "CVCL_0002", 1, 1, scores()).contentHash());
		assertNotEquals(base, new Experiment(7L, "CVCL_0001", 2, 1, scores()).contentHash());
		assertNotEquals(base, new Experiment(7L, "CVCL_0001", 1, 2, scores()).contentHash());

		List<Score> changed = scores();
		changed.get(0).setScoreValue(5.5370);
		assertNotEquals(base, new Experiment(7L, "CVCL_0001", 1, 1, changed).contentHash());
	}

	@Test
	void values_equal_to_four_places_hash_the_same() {
		List<Score> noisy = scores();
		noisy.get(1).setScoreValue(6.256600001);

		assertEquals(new Experiment(7L, "CVCL_0001", 1, 1, scores()).contentHash(),
				new Experiment(7L, "CVCL_0001", 1, 1, noisy).contentHash());
	}

	@Test
	void unresolved_score_id_is_rejected() {
		List<Score> s = scores();
		s.add(new Score("extra", 1.0, null));
		Experiment e = new Experiment(7L, "CVCL_0001", 1, 1, s);
		assertThrows(IllegalStateException.class, e::contentHash);
	}
}
