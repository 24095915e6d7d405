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
 * UMLS Terminology Services: NCIt code to UMLS concept.
 */
public class UmlsClient extends ServiceClient {

    /** Marker the UTS search returns when nothing matched. */
    static final String NO_RESULT_UI = "NONE";

    @Data
    @AllArgsConstructor
    public static class UmlsConcept {
        private String cui;
        private String name;
    }

    private final String apiKey;

    public UmlsClient(ConfigLoader cfg) {
        super(cfg.getUmlsBaseUrl(), Duration.ofSeconds(cfg.getHttpTimeoutSeconds()), cfg.getHttpMaxRetries());
        this.apiKey = cfg.getUmlsApiKey();
    }

    public UmlsClient(HttpClient http, String baseUrl, Duration timeout, int maxRetries, String apiKey) {
        super(http, baseUrl, timeout, maxRetries);
        this.apiKey = apiKey;
    }

    /** Exact match of an NCIt code among NCI source atoms. Null when unmapped. */
    public UmlsConcept ncitToCui(String ncitCode) {
        JsonNode json = getJson("search/current?string=" + enc(ncitCode)
                + "&inputType=sourceUi&searchType=exact&sabs=NCI&apiKey=" + enc(apiKey));
        return parse(json);
    }

    static UmlsConcept parse(JsonNode json) {
        if (json == null) return null;
        JsonNode first = json.path("result").path("results").path(0);
        String ui = text(first.get("ui"));
        if (ui == null || NO_RESULT_UI.equals(ui)) {
            return null;
        }
        return new UmlsConcept(ui, text(first.get("name")));
    }
}
