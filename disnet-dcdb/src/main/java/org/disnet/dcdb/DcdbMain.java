package org.disnet.dcdb;

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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.disnet.dcdb.api.CellosaurusClient;
import org.disnet.dcdb.api.ChemblClient;
import org.disnet.dcdb.api.DrugCombDbClient;
import org.disnet.dcdb.api.UmlsClient;
import org.disnet.dcdb.api.UniChemClient;
import org.disnet.dcdb.conf.ConfigLoader;
import org.disnet.dcdb.om.SourceNames;
import org.disnet.dcdb.processing.BatchIntegrationPipeline;
import org.disnet.dcdb.processing.CombinationDownloader;
import org.disnet.dcdb.processing.StreamingIntegrationPipeline;
import org.disnet.dcdb.processing.cellline.CellLineResolver;
import org.disnet.dcdb.processing.cellline.StagedCellLinePipeline;
import org.disnet.dcdb.processing.drug.DrugResolver;
import org.disnet.dcdb.processing.drug.StagedDrugPipeline;
import org.disnet.dcdb.processing.experiment.ExperimentAssembler;
import org.disnet.dcdb.processing.persist.CellLineRepository;
import org.disnet.dcdb.processing.persist.DisnetDatabase;
import org.disnet.dcdb.processing.persist.DrugCombinationRepository;
import org.disnet.dcdb.processing.persist.DrugRepository;
import org.disnet.dcdb.processing.persist.ExperimentRepository;
import org.disnet.dcdb.processing.persist.SchemaInitializer;
import org.disnet.dcdb.processing.persist.ScoreRepository;
import org.disnet.dcdb.processing.persist.SourceRepository;
import org.disnet.dcdb.processing.score.ScoreClassifier;
import org.disnet.dcdb.processing.support.CheckpointStore;
import org.disnet.dcdb.processing.support.PipelineSettings;
import org.disnet.dcdb.processing.support.RunSummary;
import org.disnet.dcdb.processing.support.SkipAuditLog;
import org.disnet.dcdb.processing.support.StagingFailureReport;
import org.disnet.dcdb.staging.CellLineStagingDao;
import org.disnet.dcdb.staging.DrugStagingDao;
import org.disnet.dcdb.staging.LocalMirror;
import org.disnet.dcdb.staging.StagingStore;
import org.disnet.dcdb.util.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 *   batch [--local]            integrate pending rows of the local mirror
 *   stream &lt;start&gt; &lt;end&gt; [step] integrate indices [start, end) from the API
 *   download &lt;start&gt; &lt;end&gt;     fill the local mirror from the API
 *   report &lt;csv&gt;               export failed staging rows
 * </pre>
 *
 * Configuration is read by {@link ConfigLoader}; see
 * {@code config/dcdb.properties}.
 */
public class DcdbMain {

	static final String USAGE = "Usage: DcdbMain batch [--local] | stream <start> <end> [step]"
			+ " | download <start> <end> | report <csv>";

	private final ConfigLoader cfg;

	public DcdbMain(ConfigLoader cfg) {
		this.cfg = cfg;
	}

	/**
	 * Application entry point.
	 *
	 * @param args command and its arguments
	 */
	public static void main(String[] args) {
		if (args.length == 0) {
			System.err.println(USAGE);
			System.exit(2);
		}
		ConfigLoader cfg = new ConfigLoader();
		List<String> issues = cfg.validate();
		if (!issues.isEmpty()) {
			issues.forEach(i -> Logger.error("Configuration: {}", i));
			System.exit(1);
		}
		Logger.attachFile(cfg.getLogFile());

		int status;
		try {
			status = new DcdbMain(cfg).run(args);
		} catch (Exception e) {
			Logger.error("Run aborted: {}", e, e.getMessage());
			status = 1;
		} finally {
			Logger.detachFile();
		}
		System.exit(status);
	}

	/**
	 * Dispatch one command.
	 *
	 * @return process exit status
	 */
	int run(String[] args) throws Exception {
		String command = args[0];
		switch (command) {
		case "batch":
			return runBatch(args.length > 1 && "--local".equals(args[1]));
		case "stream":
			if (args.length < 3) return usage();
			return runStream(Integer.parseInt(args[1]), Integer.parseInt(args[2]),
					args.length > 3 ? Integer.parseInt(args[3]) : 1);
		case "download":
			if (args.length < 3) return usage();
			return runDownload(Integer.parseInt(args[1]), Integer.parseInt(args[2]));
		case "report":
			if (args.length < 2) return usage();
			return runReport(Paths.get(args[1]));
		default:
			return usage();
		}
	}

	private int runBatch(boolean localFlag) throws Exception {
		PipelineSettings settings = PipelineSettings.from(cfg);
		if (localFlag) {
			settings.setLocalMode(true);
		}
		Logger.info("Batch mode, local={}", settings.isLocalMode());

		try (StagingStore store = new StagingStore(cfg.getStagingDbPath());
				DisnetDatabase db = DisnetDatabase.connect(cfg)) {
			new SchemaInitializer(db).createTables();

			int cache = settings.getCacheMaxEntries();
			SourceRepository sources = new SourceRepository(db, cache);
			int chemblSourceId = sources.getOrCreateSource(SourceNames.CHEMBL);
			int pubchemSourceId = sources.getOrCreateSource(SourceNames.PUBCHEM);
			int cellosaurusSourceId = sources.getOrCreateSource(SourceNames.CELLOSAURUS);

			DrugCombDbClient dcdb = new DrugCombDbClient(cfg);
			LocalMirror mirror = new LocalMirror(store);
			DrugStagingDao drugStaging = new DrugStagingDao(store);
			CellLineStagingDao cellLineStaging = new CellLineStagingDao(store);

			StagedDrugPipeline drugs = new StagedDrugPipeline(drugStaging, mirror, dcdb,
					new UniChemClient(cfg), new ChemblClient(cfg), new DrugRepository(db),
					pubchemSourceId, chemblSourceId, settings);
			StagedCellLinePipeline cellLines = new StagedCellLinePipeline(cellLineStaging, mirror, dcdb,
					new CellosaurusClient(cfg), new UmlsClient(cfg), new CellLineRepository(db),
					cellosaurusSourceId, settings);

			BatchIntegrationPipeline pipeline = new BatchIntegrationPipeline(mirror, drugStaging, cellLineStaging,
					drugs, cellLines, new ScoreClassifier(new ScoreRepository(db, cache)), assembler(db, cache),
					new SkipAuditLog(cfg.getAuditPath()));
			return exitStatus(pipeline.run());
		}
	}

	private int runStream(int start, int end, int step) {
		PipelineSettings settings = PipelineSettings.from(cfg);
		try (DisnetDatabase db = DisnetDatabase.connect(cfg)) {
			new SchemaInitializer(db).createTables();

			int cache = settings.getCacheMaxEntries();
			SourceRepository sources = new SourceRepository(db, cache);
			int chemblSourceId = sources.getOrCreateSource(SourceNames.CHEMBL);
			int pubchemSourceId = sources.getOrCreateSource(SourceNames.PUBCHEM);
			int cellosaurusSourceId = sources.getOrCreateSource(SourceNames.CELLOSAURUS);

			DrugCombDbClient dcdb = new DrugCombDbClient(cfg);
			DrugResolver drugs = new DrugResolver(dcdb, new UniChemClient(cfg), new ChemblClient(cfg),
					new DrugRepository(db), pubchemSourceId, chemblSourceId, cache);
			CellLineResolver cellLines = new CellLineResolver(dcdb, new CellosaurusClient(cfg), new UmlsClient(cfg),
					new CellLineRepository(db), cellosaurusSourceId, cache);

			StreamingIntegrationPipeline pipeline = new StreamingIntegrationPipeline(dcdb, drugs, cellLines,
					new ScoreClassifier(new ScoreRepository(db, cache)), assembler(db, cache),
					new CheckpointStore(cfg.getCheckpointPath()), new SkipAuditLog(cfg.getAuditPath()), settings);
			return exitStatus(pipeline.run(start, end, step));
		}
	}

	private int runDownload(int start, int end) throws Exception {
		try (StagingStore store = new StagingStore(cfg.getStagingDbPath())) {
			CombinationDownloader downloader = new CombinationDownloader(new DrugCombDbClient(cfg), new LocalMirror(store));
			return exitStatus(downloader.download(start, end));
		}
	}

	private int runReport(Path csv) throws Exception {
		try (StagingStore store = new StagingStore(cfg.getStagingDbPath())) {
			new StagingFailureReport(new DrugStagingDao(store), new CellLineStagingDao(store)).write(csv);
			return 0;
		}
	}

	private static ExperimentAssembler assembler(DisnetDatabase db, int cache) {
		return new ExperimentAssembler(db, new DrugCombinationRepository(db, cache), new ExperimentRepository(db, cache));
	}

	private static int exitStatus(RunSummary summary) {
		Logger.info("{}: {}", summary.getLabel(), summary);
		return summary.getFailed() > 0 ? 3 : 0;
	}

	private static int usage() {
		System.err.println(USAGE);
		return 2;
	}
}
