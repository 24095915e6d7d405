package org.disnet.dcdb.api;

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

import java.net.http.HttpClient;
import java.time.Duration;

import org.disnet.dcdb.conf.ConfigLoader;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Cellosaurus lookups: disease (NCIt) by accession, and accession, disease
 * and site in one call by COSMIC cell line ID.
 */
public class CellosaurusClient extends ServiceClient {

    /** Fields of a Cellosaurus entry; any of them may be null. */
    @Data
    @AllArgsConstructor
    public static class CellosaurusEntry {
        private String accession;
        private String ncitCode;
        private String site;

        /** Accession, site and disease all present. */
        public boolean isComplete() {
            return accession != null && ncitCode != null && site != null;
        }
    }

    public CellosaurusClient(ConfigLoader cfg) {
        super(cfg.getCellosaurusBaseUrl(), Duration.ofSeconds(cfg.getHttpTimeoutSeconds()), cfg.getHttpMaxRetries());
    }

    public CellosaurusClient(HttpClient http, String baseUrl, Duration timeout, int maxRetries) {
        super(http, baseUrl, timeout, maxRetries);
    }

    /**
     * NCIt accession of the first disease of {@code accession}, or null when
     * the cell line has no disease.
     *
     * @throws IllegalArgumentException if {@code accession} is null
     */
    public String getDiseaseAccession(String accession) {
        if (accession == null) {
            throw new IllegalArgumentException("accession must not be null");
        }
        JsonNode json = getJson("cell-line/" + enc(accession) + "?fields=din&format=json");
        CellosaurusEntry entry = firstEntry(json);
        return entry == null ? null : entry.getNcitCode();
    }

    /** Search by COSMIC cell line ID. Null when nothing matches. */
    public CellosaurusEntry findByCosmicId(String cosmicId) {
        JsonNode json = getJson("search/cell-line?q=" + enc("dr:" + cosmicId) + "&fields=ac,din,site&format=json&rows=1");
        return firstEntry(json);
    }

    static CellosaurusEntry firstEntry(JsonNode json) {
        if (json == null) return null;
        JsonNode list = json.path("Cellosaurus").path("cell-line-list");
        if (!list.isArray() || list.isEmpty()) {
            return null;
        }
        JsonNode e = list.get(0);
        return new CellosaurusEntry(
                text(e.path("accession-list").path(0).get("value")),
                text(e.path("disease-list").path(0).get("accession")),
                text(e.path("derived-from-site-list").path(0).path("site").get("value")));
    }
}
