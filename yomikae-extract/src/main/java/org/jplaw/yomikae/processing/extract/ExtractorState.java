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

import org.jplaw.yomikae.om.SubstitutionRule;

/**
 * Accumulator for one provision's walk over the segmented sentence: the
 * before phrases collected so far, the content of the last bracketed span and
 * whether the antecedent group has been closed by "とある".
 */
final class ExtractorState {

	private final List<String> pendingBefore = new ArrayList<>();
	private String scratch = "";
	private boolean antecedentClosed = false;

	void load(String bracketContent) {
		this.scratch = bracketContent == null ? "" : bracketContent;
	}

	/** Move the scratch phrase onto the before list. */
	void pushAntecedent(boolean closes) {
		pendingBefore.add(scratch);
		scratch = "";
		antecedentClosed = closes;
	}

	/** Emit a rule when both sides are present, then start a new chain either way. */
	void emitInto(List<SubstitutionRule> out) {
		if (!pendingBefore.isEmpty() && !scratch.isEmpty()) {
			out.add(new SubstitutionRule(pendingBefore, scratch));
		}
		reset();
	}

	void reset() {
		pendingBefore.clear();
		scratch = "";
		antecedentClosed = false;
	}

	boolean isAntecedentClosed() {
		return antecedentClosed;
	}

	List<String> getPendingBefore() {
		return List.copyOf(pendingBefore);
	}

	String getScratch() {
		return scratch;
	}
}
