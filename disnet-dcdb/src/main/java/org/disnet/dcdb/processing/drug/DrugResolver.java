package org.disnet.dcdb.processing.drug;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.disnet.dcdb.api.ChemblClient;
import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.DrugCombDbClient.RawDrugInfo;
import org.disnet.dcdb.api.UniChemClient;
import org.disnet.dcdb.api.UniChemClient.CompoundMapping;
import org.disnet.dcdb.om.Drug;
import org.disnet.dcdb.om.DrugNames;
import org.disnet.dcdb.processing.persist.DrugRepository;
import org.disnet.dcdb.processing.support.Resolution;
import org.disnet.dcdb.util.Logger;
import org.disnet.dcdb.util.LruCache;

/**
 * Resolves drugs one combination at a time, without staging: DrugCombDB, then
 * UniChem, then ChEMBL. Results and expected failures are cached by normalized
 * name for the lifetime of the instance. Nothing is written until
 * {@link #persist(Collection)}.
 */
public class DrugResolver {

    private final DrugCombDbClient dcdb;
    private final UniChemClient unichem;
    private final ChemblClient chembl;
    private final DrugRepository drugs;
    private final int pubchemSourceId;
    private final int chemblSourceId;

    private final Map<String, DrugFetchResult> cache;
    private final Map<String, DrugErrorCode> errorCache;

    public DrugResolver(DrugCombDbClient dcdb,
                        UniChemClient unichem,
                        ChemblClient chembl,
                        DrugRepository drugs,
                        int pubchemSourceId,
                        int chemblSourceId,
                        int cacheSize) {
        this.dcdb = dcdb;
        this.unichem = unichem;
        this.chembl = chembl;
        this.drugs = drugs;
        this.pubchemSourceId = pubchemSourceId;
        this.chemblSourceId = chemblSourceId;
        this.cache = Collections.synchronizedMap(new LruCache<>(cacheSize));
        this.errorCache = Collections.synchronizedMap(new LruCache<>(cacheSize));
    }

    /**
     * Resolve one drug name.
     *
     * @throws org.disnet.dcdb.api.ServiceException on service failure (not cached)
     */
    public Resolution<DrugFetchResult> resolve(String drugName) {
        String name = DrugNames.normalize(drugName);
        DrugFetchResult hit = cache.get(name);
        if (hit != null) {
            return Resolution.resolved(hit);
        }
        DrugErrorCode known = errorCache.get(name);
        if (known != null) {
            return Resolution.unresolvable(known.getCode(), known.getReason());
        }

        RawDrugInfo info = dcdb.getDrug(name);
        if (info == null || info.getPubchemId() == null) {
            return unresolvable(name, DrugErrorCode.NOT_FOUND_IN_SOURCE);
        }
        Drug raw = Drug.raw(info.getPubchemId(),
                info.getOfficialName() != null ? info.getOfficialName() : name,
                pubchemSourceId, info.getSmiles());

        CompoundMapping mapping = unichem.getCompoundMapping(raw.getDrugId());
        if (mapping != null) {
            raw.setInchiKey(mapping.getInchiKey());
        }
        if (mapping == null || mapping.getChemblId() == null) {
            return unresolvable(name, DrugErrorCode.NOT_FOUND_IN_CROSSREF);
        }

        Drug canonical = chembl.getMolecule(mapping.getChemblId(), chemblSourceId);
        if (canonical == null) {
            return unresolvable(name, DrugErrorCode.NOT_FOUND_IN_CANONICAL);
        }
        if (canonical.getDrugName() == null) {
            canonical.setDrugName(name);
        }

        DrugFetchResult result = new DrugFetchResult(raw, canonical);
        cache.put(name, result);
        return Resolution.resolved(result);
    }

    /**
     * Resolve every name, failing on the first one that cannot be resolved.
     *
     * @throws DrugNotResolvableException carrying the drug name and reason code
     */
    public List<DrugFetchResult> fetch(Collection<String> drugNames) throws DrugNotResolvableException {
        List<DrugFetchResult> out = new ArrayList<>(drugNames.size());
        for (String n : drugNames) {
            Resolution<DrugFetchResult> r = resolve(n);
            if (!r.isResolved()) {
                throw new DrugNotResolvableException(DrugNames.normalize(n), r.getCode(), r.getReason());
            }
            out.add(r.getValue());
        }
        return out;
    }

    /** Write raw drug, ChEMBL drug and their mapping for each result. */
    public void persist(Collection<DrugFetchResult> results) {
        for (DrugFetchResult r : results) {
            drugs.saveResolved(r.getRaw(), r.getCanonical());
        }
    }

    private Resolution<DrugFetchResult> unresolvable(String name, DrugErrorCode code) {
        Logger.debug("Drug '{}' unresolvable: {}", name, code.getReason());
        errorCache.put(name, code);
        return Resolution.unresolvable(code.getCode(), code.getReason());
    }
}
