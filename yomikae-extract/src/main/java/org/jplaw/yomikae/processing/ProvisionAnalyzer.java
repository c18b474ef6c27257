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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.jplaw.yomikae.conf.TriggerPhraseFilter;
import org.jplaw.yomikae.om.ErrorKind;
import org.jplaw.yomikae.om.LawProvision;
import org.jplaw.yomikae.om.ProvisionCoordinate;
import org.jplaw.yomikae.om.ProvisionError;
import org.jplaw.yomikae.om.SubstitutionRule;
import org.jplaw.yomikae.om.SubstitutionSet;
import org.jplaw.yomikae.om.YomikaeException;
import org.jplaw.yomikae.processing.extract.SubstitutionExtractor;
import org.jplaw.yomikae.processing.extract.TabularExtractor;
import org.jplaw.yomikae.processing.segment.BracketSegmenter;
import org.jplaw.yomikae.util.Logger;

/**
 * Decides which provisions are read-as provisions and runs the matching
 * extractor on each of them.
 *
 * <ul>
 *   <li>Sentences containing a prose trigger are segmented and walked by the
 *       {@link SubstitutionExtractor}.</li>
 *   <li>Tables whose introducing sentence contains a table trigger go to the
 *       {@link TabularExtractor}.</li>
 * </ul>
 *
 * Instances hold no per-call state and may be shared between worker threads.
 */
public class ProvisionAnalyzer {

	private final BracketSegmenter segmenter;
	private final SubstitutionExtractor extractor;
	private final TabularExtractor tabular;
	private final TriggerPhraseFilter triggers;

	public ProvisionAnalyzer() {
		this(new TriggerPhraseFilter());
	}

	public ProvisionAnalyzer(TriggerPhraseFilter triggers) {
		this(new BracketSegmenter(), new SubstitutionExtractor(), new TabularExtractor(), triggers);
	}

	public ProvisionAnalyzer(BracketSegmenter segmenter, SubstitutionExtractor extractor, TabularExtractor tabular,
			TriggerPhraseFilter triggers) {
		this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
		this.extractor = Objects.requireNonNull(extractor, "extractor");
		this.tabular = Objects.requireNonNull(tabular, "tabular");
		this.triggers = Objects.requireNonNull(triggers, "triggers");
	}

	/** True if the provision carries a read-as trigger for its own form (prose or table). */
	public boolean isCandidate(LawProvision provision) {
		if (provision.isTable())
			return triggers.isTableTrigger(provision.getText());
		return triggers.isProseTrigger(provision.getText());
	}

	/**
	 * Candidates of one law in document order. A sentence that introduces a
	 * read-as table is left to the table itself when that table is present at
	 * the same coordinate.
	 */
	public List<LawProvision> selectCandidates(List<LawProvision> provisions) {
		Set<ProvisionCoordinate> tableScopes = new HashSet<>();
		for (LawProvision p : provisions) {
			if (p.isTable() && isCandidate(p)) {
				tableScopes.add(p.getCoordinate());
			}
		}

		List<LawProvision> out = new ArrayList<>();
		for (LawProvision p : provisions) {
			if (!isCandidate(p))
				continue;
			if (!p.isTable() && triggers.isTableTrigger(p.getText()) && tableScopes.contains(p.getCoordinate()))
				continue;
			out.add(p);
		}
		return out;
	}

	/**
	 * Extract the rules of one provision.
	 *
	 * @return the rule set, or an error carrying the provision's law number and
	 *         coordinate; a provision that yields no rule is reported as
	 *         {@link ErrorKind#NO_RULE_FOUND}
	 */
	public ProvisionOutcome analyze(LawProvision provision) {
		List<SubstitutionRule> rules;
		try {
			if (provision.isTable()) {
				rules = tabular.extract(provision.getRows());
			} else {
				rules = extractor.extract(segmenter.segmentOrThrow(provision.getText()));
			}
		} catch (YomikaeException e) {
			Logger.debug("{} {}: {} ({})", provision.getLawNum(), provision.getCoordinate().label(),
					e.getKind().getDescription(), e.getMessage());
			return ProvisionOutcome.failure(ProvisionError.of(e.getKind(), provision));
		}

		if (rules.isEmpty()) {
			Logger.debug("{} {}: no rule found", provision.getLawNum(), provision.getCoordinate().label());
			return ProvisionOutcome.failure(ProvisionError.of(ErrorKind.NO_RULE_FOUND, provision));
		}
		return ProvisionOutcome.success(new SubstitutionSet(provision.getLawNum(), provision.getCoordinate(), rules));
	}
}
