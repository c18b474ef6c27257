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

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.jplaw.yomikae.om.ErrorKind;
import org.jplaw.yomikae.om.SubstitutionRule;
import org.jplaw.yomikae.om.YomikaeException;

/**
 * Connector phrases that may follow a closing quotation in a read-as
 * sentence, with the transition each one applies. Matching is by prefix of
 * the literal span, longest keyword first.
 */
enum Connector {

	/** 「…」と読み替える: last rule of the chain. */
	READ_AS("と読み替える") {
		@Override
		void apply(ExtractorState state, List<SubstitutionRule> out) {
			state.emitInto(out);
		}
	},

	/** 「…」とあり、及び…: another before phrase follows. */
	CHAIN_ANTECEDENT("とあり") {
		@Override
		void apply(ExtractorState state, List<SubstitutionRule> out) throws YomikaeException {
			if (state.isAntecedentClosed()) {
				throw new YomikaeException(ErrorKind.UNEXPECTED_PARALLEL_ANTECEDENT,
						"Antecedent chained after a closed group: " + state.getPendingBefore());
			}
			state.pushAntecedent(false);
		}
	},

	/** 「…」とあるのは: last before phrase of the group. */
	CLOSE_ANTECEDENT("とある") {
		@Override
		void apply(ExtractorState state, List<SubstitutionRule> out) {
			state.pushAntecedent(true);
		}
	},

	/** 「…」と、「…」とあるのは…: rule complete, another one follows. */
	NEXT_RULE("と、") {
		@Override
		void apply(ExtractorState state, List<SubstitutionRule> out) {
			state.emitInto(out);
		}
	},

	/** 「…」と「…」とあるのは…: the comma is omitted; the literal is exactly "と". */
	NEXT_RULE_UNPUNCTUATED("と") {
		@Override
		boolean matches(String literal, boolean bracketFollows) {
			return bracketFollows && keyword.equals(literal);
		}

		@Override
		void apply(ExtractorState state, List<SubstitutionRule> out) {
			state.emitInto(out);
		}
	};

	private static final List<Connector> LONGEST_FIRST = Arrays.stream(values())
			.sorted(Comparator.comparingInt((Connector c) -> c.keyword.length()).reversed())
			.toList();

	final String keyword;

	Connector(String keyword) {
		this.keyword = keyword;
	}

	boolean matches(String literal, boolean bracketFollows) {
		return literal.startsWith(keyword);
	}

	abstract void apply(ExtractorState state, List<SubstitutionRule> out) throws YomikaeException;

	/**
	 * Find the connector at the start of a literal span.
	 *
	 * @param literal        text following a closing quotation
	 * @param bracketFollows whether another bracketed span comes after the literal
	 */
	static Optional<Connector> match(String literal, boolean bracketFollows) {
		if (literal == null || literal.isEmpty())
			return Optional.empty();
		for (Connector c : LONGEST_FIRST) {
			if (c.matches(literal, bracketFollows))
				return Optional.of(c);
		}
		return Optional.empty();
	}
}
