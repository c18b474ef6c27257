package org.jplaw.yomikae.processing;

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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.jplaw.yomikae.conf.ConfigLoader;
import org.jplaw.yomikae.om.ErrorKind;
import org.jplaw.yomikae.om.LawDocument;
import org.jplaw.yomikae.om.LawProvision;
import org.jplaw.yomikae.om.ProvisionError;
import org.jplaw.yomikae.om.SubstitutionSet;
import org.jplaw.yomikae.processing.extract.LawXmlReader;
import org.jplaw.yomikae.processing.support.GlobalTrackers;
import org.jplaw.yomikae.processing.support.LawSource;
import org.jplaw.yomikae.util.Logger;

/**
 * Runs the provision analyzer over a list of law files.
 *
 * <p>One task per law on a fixed pool. A law that cannot be read, or that
 * fails unexpectedly, is logged and skipped; the other laws are unaffected.
 * Results keep the input order regardless of completion order.</p>
 */
public class YomikaeProcessingPipeline {

	private static final int PROGRESS_EVERY = 500;

	private final ProvisionAnalyzer analyzer;
	private final LawXmlReader reader;
	private final int threadCount;
	private final long maxFileBytes;

	// Global
	final GlobalTrackers trackers = new GlobalTrackers();

	public YomikaeProcessingPipeline(ConfigLoader cfg) {
		this(new ProvisionAnalyzer(), new LawXmlReader(), cfg.getParallelLawLimit(), cfg.getMaxLawFileBytes());
	}

	public YomikaeProcessingPipeline(ProvisionAnalyzer analyzer, LawXmlReader reader, int threadCount,
			long maxFileBytes) {
		this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
		this.reader = Objects.requireNonNull(reader, "reader");
		this.threadCount = Math.max(1, threadCount);
		this.maxFileBytes = maxFileBytes;
	}

	public GlobalTrackers getTrackers() {
		return trackers;
	}

	/**
	 * Process every law and aggregate the results.
	 */
	public PipelineResult run(List<LawSource> sources) {
		Logger.info("Processing {} law files on {} threads", sources.size(), threadCount);

		ExecutorService pool = Executors.newFixedThreadPool(threadCount);
		AtomicInteger completed = new AtomicInteger(0);
		List<Future<LawResult>> futures = new ArrayList<>(sources.size());
		try {
			for (LawSource src : sources) {
				futures.add(pool.submit(() -> {
					try {
						return processLaw(src);
					} finally {
						int done = completed.incrementAndGet();
						if (done % PROGRESS_EVERY == 0) {
							Logger.info("Processed {} laws...", done);
						}
					}
				}));
			}

			List<SubstitutionSet> sets = new ArrayList<>();
			Set<ProvisionError> errors = new LinkedHashSet<>();
			for (int i = 0; i < futures.size(); i++) {
				try {
					LawResult r = futures.get(i).get();
					sets.addAll(r.ruleSets());
					errors.addAll(r.errors());
				} catch (ExecutionException e) {
					trackers.lawsFailed.incrementAndGet();
					Logger.error("Failed to process {}", e.getCause(), sources.get(i).getFile());
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IllegalStateException("Interrupted while waiting for law results", e);
				}
			}

			Logger.info("Batch complete: {}", trackers.summary());
			return new PipelineResult(List.copyOf(sets), List.copyOf(errors));
		} finally {
			pool.shutdownNow();
		}
	}

	/**
	 * Read and analyze one law file. Oversized and unreadable files yield an
	 * empty result.
	 */
	LawResult processLaw(LawSource src) {
		Path file = src.getFile();
		try {
			long size = Files.size(file);
			if (maxFileBytes > 0 && size > maxFileBytes) {
				trackers.lawsSkipped.incrementAndGet();
				Logger.warn("Skipping oversized law file ({} bytes): {}", size, file);
				return LawResult.EMPTY;
			}
			LawDocument doc = reader.read(file, src.getLawNum());
			trackers.lawsRead.incrementAndGet();
			return processDocument(doc);
		} catch (IOException e) {
			trackers.lawsSkipped.incrementAndGet();
			Logger.warn("Skipping unreadable law file {}: {}", file, e.getMessage());
			return LawResult.EMPTY;
		}
	}

	/** Analyze the candidate provisions of a parsed law. */
	LawResult processDocument(LawDocument doc) {
		List<SubstitutionSet> sets = new ArrayList<>();
		List<ProvisionError> errors = new ArrayList<>();

		for (LawProvision p : analyzer.selectCandidates(doc.getProvisions())) {
			trackers.candidates.incrementAndGet();
			ProvisionOutcome outcome = analyzer.analyze(p);
			if (outcome.isSuccess()) {
				sets.add(outcome.getRuleSet());
				trackers.ruleSets.incrementAndGet();
				trackers.rules.addAndGet(outcome.getRuleSet().getRules().size());
			} else {
				ProvisionError err = outcome.getError();
				errors.add(err);
				if (err.getKind() == ErrorKind.NO_RULE_FOUND) {
					trackers.noRuleFound.incrementAndGet();
				} else {
					trackers.hardErrors.incrementAndGet();
					Logger.warn("{}", err);
				}
			}
		}
		return new LawResult(sets, errors);
	}

	/** Per-law result handed back by a worker. */
	record LawResult(List<SubstitutionSet> ruleSets, List<ProvisionError> errors) {
		static final LawResult EMPTY = new LawResult(List.of(), List.of());
	}
}
