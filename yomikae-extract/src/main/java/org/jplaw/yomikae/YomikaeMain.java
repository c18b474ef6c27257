package org.jplaw.yomikae;

/*
 * This file is part of Yomikae.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * Yomikae is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Yomikae is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Yomikae.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.jplaw.yomikae.conf.ConfigLoader;
import org.jplaw.yomikae.om.ProvisionError;
import org.jplaw.yomikae.om.SubstitutionSet;
import org.jplaw.yomikae.processing.PipelineResult;
import org.jplaw.yomikae.processing.YomikaeProcessingPipeline;
import org.jplaw.yomikae.processing.persist.CsvWriters;
import org.jplaw.yomikae.processing.support.LawIndex;
import org.jplaw.yomikae.processing.support.LawSource;
import org.jplaw.yomikae.util.Logger;

/**
 * Main entry point for read-as rule extraction over a corpus of law XML files
 * (e-Gov 法令標準XML).
 *
 * Usage: {@code YomikaeMain [config.properties]}. Without an argument the
 * configuration is resolved by {@link ConfigLoader#ConfigLoader()}.
 */
public class YomikaeMain {

	private final ConfigLoader cfg;

	public YomikaeMain() {
		this(new ConfigLoader());
	}

	YomikaeMain(ConfigLoader cfg) {
		this.cfg = cfg;
	}

	/**
	 * Application entry point.
	 */
	public static void main(String[] args) {
		ConfigLoader cfg = args.length > 0 ? new ConfigLoader(Paths.get(args[0])) : new ConfigLoader();
		List<String> issues = cfg.validate();
		if (!issues.isEmpty()) {
			issues.forEach(i -> Logger.error("Configuration: {}", i));
			System.exit(1);
		}

		try {
			new YomikaeMain(cfg).run();
		} catch (IOException e) {
			Logger.error("Extraction failed", e);
			System.exit(2);
		}
	}

	/**
	 * List the laws, run the pipeline and write the rule and error CSV files.
	 */
	PipelineResult run() throws IOException {
		Path lawDir = Paths.get(cfg.getLawXmlPath());
		Path outDir = Paths.get(cfg.getOutputPath());
		Files.createDirectories(outDir);

		List<LawSource> sources = listSources(lawDir);
		Logger.log("Law files to process: " + sources.size());

		YomikaeProcessingPipeline pipeline = new YomikaeProcessingPipeline(cfg);
		PipelineResult result = pipeline.run(sources);

		Path ruleFile = outDir.resolve(cfg.getRuleOutputFile());
		Path errorFile = outDir.resolve(cfg.getErrorOutputFile());
		try (CsvWriters writers = new CsvWriters(ruleFile, errorFile, cfg.getBeforeWordsSeparator())) {
			for (SubstitutionSet set : result.getRuleSets()) {
				writers.writeRuleSet(set);
			}
			for (ProvisionError err : result.getErrors()) {
				writers.writeError(err);
			}
		}

		Logger.log("Rule sets: " + result.getRuleSets().size() + ", rules: " + result.ruleCount());
		Logger.log("Distinct errors: " + result.getErrors().size());
		Logger.log("Wrote " + ruleFile + " and " + errorFile);
		Logger.log("End");
		return result;
	}

	private List<LawSource> listSources(Path lawDir) throws IOException {
		String index = cfg.getLawIndexFile();
		if (StringUtils.isNotBlank(index)) {
			Logger.log("Reading law index: " + index);
			return LawIndex.load(Paths.get(index), lawDir);
		}
		Logger.log("Scanning law directory: " + lawDir);
		return LawIndex.scan(lawDir);
	}
}
