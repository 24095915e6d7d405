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

import org.disnet.dcdb.conf.ConfigLoader;

import lombok.Builder;
import lombok.Data;

/**
 * Run tunables shared by the pipelines.
 */
@Data
@Builder
public class PipelineSettings {

    @Builder.Default
    private boolean localMode = false;

    @Builder.Default
    private int stageBatchSize = 1000;

    @Builder.Default
    private int persistBatchSize = 500;

    @Builder.Default
    private int cacheMaxEntries = 1000;

    @Builder.Default
    private int resolverThreads = 2;

    @Builder.Default
    private boolean retryFailedOnResume = false;

    public static PipelineSettings from(ConfigLoader cfg) {
        return PipelineSettings.builder()
                .localMode(cfg.isLocalMode())
                .stageBatchSize(cfg.getStageBatchSize())
                .persistBatchSize(cfg.getPersistBatchSize())
                .cacheMaxEntries(cfg.getCacheMaxEntries())
                .resolverThreads(cfg.getResolverThreads())
                .retryFailedOnResume(cfg.isRetryFailedOnResume())
                .build();
    }

    public static PipelineSettings defaults() {
        return PipelineSettings.builder().build();
    }
}
