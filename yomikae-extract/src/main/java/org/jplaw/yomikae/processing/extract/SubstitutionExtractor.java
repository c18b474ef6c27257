package org.jplaw.yomikae.processing.extract;

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
import java.util.List;
import java.util.Optional;

import org.jplaw.yomikae.om.SubstitutionRule;
import org.jplaw.yomikae.om.YomikaeException;
import org.jplaw.yomikae.processing.segment.SegmentToken;
import org.jplaw.yomikae.util.Logger;

/**
 * Walks a segmented read-as sentence and collects its substitution rules.
 *
 * <p>A read-as sentence has the shape</p>
 * <pre>
 *   ( (「X」とあり …)* 「X」とあるのは 「Y」 (と、 | と) )+ 読み替える
 * </pre>
 * <p>with minor variations in punctuation. Each bracketed span loads the
 * scratch phrase; the literal that follows it is matched against
 * {@link Connector}. Literals that match no connector discard the pending
 * chain without failing, since unrelated quotations may share the sentence
 * with one or more read-as chains.</p>
 *
 * <p>Stateless; every call works on its own {@link ExtractorState}.</p>
 */
public class SubstitutionExtractor {

	/**
	 * Extract rules in sentence order.
	 *
	 * @param tokens alternating span sequence from the bracket segmenter
	 * @return rules in emission order; empty when no chain completes
	 * @throws YomikaeException on an antecedent chained after a closed group
	 */
	public List<SubstitutionRule> extract(List<SegmentToken> tokens) throws YomikaeException {
		List<SubstitutionRule> rules = new ArrayList<>();
		ExtractorState state = new ExtractorState();
		boolean afterBracket = false;

		for (int i = 0; i < tokens.size(); i++) {
			SegmentToken token = tokens.get(i);
			if (token.isBracketed()) {
				state.load(token.getContent());
				afterBracket = true;
				continue;
			}
			if (!afterBracket) {
				// leading text of the sentence
				continue;
			}

			boolean bracketFollows = i + 1 < tokens.size() && tokens.get(i + 1).isBracketed();
			Optional<Connector> connector = Connector.match(token.getText(), bracketFollows);
			if (connector.isPresent()) {
				connector.get().apply(state, rules);
			} else {
				if (!state.getPendingBefore().isEmpty()) {
					Logger.trace("Dropping unfinished chain {} before '{}'", state.getPendingBefore(),
							token.getText());
				}
				state.reset();
			}
		}
		return rules;
	}
}
