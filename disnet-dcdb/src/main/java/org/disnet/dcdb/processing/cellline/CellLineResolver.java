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

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import org.disnet.dcdb.api.CellosaurusClient;
import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.DrugCombDbClient.CellLineInfo;
import org.disnet.dcdb.api.UmlsClient;
import org.disnet.dcdb.api.UmlsClient.UmlsConcept;
import org.disnet.dcdb.om.CellLine;
import org.disnet.dcdb.om.Disease;
import org.disnet.dcdb.processing.persist.CellLineRepository;
import org.disnet.dcdb.processing.support.Resolution;
import org.disnet.dcdb.util.Logger;
import org.disnet.dcdb.util.LruCache;

/**
 * Resolves a cell line without staging: DrugCombDB for the accession, then
 * Cellosaurus for the NCIt disease, then UMLS. Known results and known-bad
 * names are cached separately so neither is queried twice. A cached result is
 * only reported as already stored once {@link #persist(CellLineFetchResult)}
 * has written it; resolving alone writes nothing.
 */
public class CellLineResolver {

    private final DrugCombDbClient dcdb;
    private final CellosaurusClient cellosaurus;
    private final UmlsClient umls;
    private final CellLineRepository cellLines;
    private final int cellosaurusSourceId;

    private final Map<String, CellLineFetchResult> cache;
    private final Map<String, CellLineErrorCode> errorCache;
    private final Set<String> persisted;

    public CellLineResolver(DrugCombDbClient dcdb,
                            CellosaurusClient cellosaurus,
                            UmlsClient umls,
                            CellLineRepository cellLines,
                            int cellosaurusSourceId,
                            int cacheSize) {
        this.dcdb = dcdb;
        this.cellosaurus = cellosaurus;
        this.umls = umls;
        this.cellLines = cellLines;
        this.cellosaurusSourceId = cellosaurusSourceId;
        this.cache = Collections.synchronizedMap(new LruCache<>(cacheSize));
        this.errorCache = Collections.synchronizedMap(new LruCache<>(cacheSize));
        this.persisted = Collections.synchronizedSet(Collections.newSetFromMap(new LruCache<>(cacheSize)));
    }

    /**
     * @throws org.disnet.dcdb.api.ServiceException on service failure (not cached)
     */
    public Resolution<CellLineFetchResult> resolve(String name) {
        CellLineFetchResult hit = cache.get(name);
        if (hit != null) {
            boolean stored = persisted.contains(hit.getCellLine().getCellLineId());
            return Resolution.resolved(new CellLineFetchResult(hit.getCellLine(), hit.getDisease(), stored));
        }
        CellLineErrorCode known = errorCache.get(name);
        if (known != null) {
            return Resolution.unresolvable(known.getCode(), known.getReason());
        }

        CellLineInfo info = dcdb.getCellLine(name);
        if (info == null || info.getAccession() == null) {
            Logger.debug("Cell line '{}' has no accession", name);
            errorCache.put(name, CellLineErrorCode.NO_ACCESSION);
            return Resolution.unresolvable(CellLineErrorCode.NO_ACCESSION.getCode(), CellLineErrorCode.NO_ACCESSION.getReason());
        }

        Disease disease = null;
        String ncit = cellosaurus.getDiseaseAccession(info.getAccession());
        if (ncit != null) {
            UmlsConcept concept = umls.ncitToCui(ncit);
            if (concept != null) {
                disease = new Disease(concept.getCui(), concept.getName());
            }
        }

        CellLine cellLine = new CellLine(info.getAccession(), cellosaurusSourceId, name,
                disease == null ? null : disease.getDiseaseId(), info.getTissue());
        CellLineFetchResult result = new CellLineFetchResult(cellLine, disease, false);
        cache.put(name, result);
        return Resolution.resolved(result);
    }

    /**
     * @throws CellLineNotResolvableException when no accession exists for {@code name}
     */
    public CellLineFetchResult fetch(String name) throws CellLineNotResolvableException {
        Resolution<CellLineFetchResult> r = resolve(name);
        if (!r.isResolved()) {
            throw new CellLineNotResolvableException(name, r.getCode(), r.getReason());
        }
        return r.getValue();
    }

    /** Disease then cell line; no-op once this accession has been written. */
    public void persist(CellLineFetchResult result) {
        String accession = result.getCellLine().getCellLineId();
        if (persisted.contains(accession)) {
            return;
        }
        cellLines.save(result.getCellLine(), result.getDisease());
        persisted.add(accession);
    }
}
