package org.disnet.dcdb.processing.cellline;

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
import static org.mockito.Mockito.*;

import org.disnet.dcdb.api.CellosaurusClient;
import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.DrugCombDbClient.CellLineInfo;
import org.disnet.dcdb.api.UmlsClient;
import org.disnet.dcdb.api.UmlsClient.UmlsConcept;
import org.disnet.dcdb.om.CellLine;
import org.disnet.dcdb.om.Disease;
import org.disnet.dcdb.processing.persist.CellLineRepository;
import org.disnet.dcdb.processing.support.Resolution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CellLineResolverTest {

	private DrugCombDbClient dcdb;
	private CellosaurusClient cellosaurus;
	private UmlsClient umls;
	private CellLineRepository cellLines;
	private CellLineResolver resolver;

	@BeforeEach
	void setUp() {
		dcdb = mock(DrugCombDbClient.class);
		cellosaurus = mock(CellosaurusClient.class);
		umls = mock(UmlsClient.class);
		cellLines = mock(CellLineRepository.class);
		resolver = new CellLineResolver(dcdb, cellosaurus, umls, cellLines, 3, 16);

		when(dcdb.getCellLine("A2058")).thenReturn(new CellLineInfo("CVCL_1059", "Skin", "COSMIC:909"));
		when(cellosaurus.getDiseaseAccession("CVCL_1059")).thenReturn("C3224");
		when(umls.ncitToCui("C3224")).thenReturn(new UmlsConcept("C0025202", "Melanoma"));
	}

	@Test
	void resolves_accession_disease_and_cui() {
		CellLineFetchResult r = resolver.resolve("A2058").getValue();

		assertEquals(new CellLine("CVCL_1059", 3, "A2058", "C0025202", "Skin"), r.getCellLine());
		assertEquals(new Disease("C0025202", "Melanoma"), r.getDisease());
		assertFalse(r.isCached());
	}

	@Test
	void second_lookup_is_served_from_cache_and_not_persisted_again() throws Exception {
		CellLineFetchResult first = resolver.fetch("A2058");
		resolver.persist(first);
		CellLineFetchResult second = resolver.fetch("A2058");
		resolver.persist(second);

		assertTrue(second.isCached());
		assertEquals(first.getCellLine(), second.getCellLine());
		verify(dcdb, times(1)).getCellLine("A2058");
		verify(cellLines, times(1)).save(first.getCellLine(), first.getDisease());
	}

	@Test
	void cached_result_is_still_written_when_the_first_was_never_persisted() throws Exception {
		CellLineFetchResult unused = resolver.fetch("A2058");
		CellLineFetchResult second = resolver.fetch("A2058");

		assertFalse(second.isCached());
		resolver.persist(second);
		resolver.persist(unused);

		verify(dcdb, times(1)).getCellLine("A2058");
		verify(cellLines, times(1)).save(second.getCellLine(), second.getDisease());
		assertTrue(resolver.fetch("A2058").isCached());
	}

	@Test
	void failed_save_is_retried_on_the_next_persist() throws Exception {
		CellLineFetchResult r = resolver.fetch("A2058");
		when(cellLines.save(r.getCellLine(), r.getDisease()))
				.thenThrow(new IllegalStateException("connection lost"))
				.thenReturn("CVCL_1059");

		assertThrows(IllegalStateException.class, () -> resolver.persist(r));
		resolver.persist(resolver.fetch("A2058"));

		verify(cellLines, times(2)).save(r.getCellLine(), r.getDisease());
	}

	@Test
	void missing_disease_leaves_cell_line_without_cui() {
		when(dcdb.getCellLine("HAP1")).thenReturn(new CellLineInfo("CVCL_Y019", null, null));

		CellLineFetchResult r = resolver.resolve("HAP1").getValue();

		assertNull(r.getDisease());
		assertNull(r.getCellLine().getDiseaseId());
		verifyNoInteractions(umls);
	}

	@Test
	void no_accession_is_unresolvable_and_remembered() {
		Resolution<CellLineFetchResult> r = resolver.resolve("Ghost");
		resolver.resolve("Ghost");

		assertFalse(r.isResolved());
		assertEquals(CellLineErrorCode.NO_ACCESSION.getCode(), r.getCode());
		verify(dcdb, times(1)).getCellLine("Ghost");

		CellLineNotResolvableException ex = assertThrows(CellLineNotResolvableException.class,
				() -> resolver.fetch("Ghost"));
		assertEquals("Ghost", ex.getCellLineName());
	}
}
