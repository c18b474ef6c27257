package org.jplaw.yomikae.om;

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

/**
 * Kinds of per-provision failures. The first three abort the provision's
 * parse; {@link #NO_RULE_FOUND} only flags it for manual review.
 */
public enum ErrorKind {

	/** A table row has neither 2 nor 3 columns. */
	TABLE_COLUMN_COUNT("Table row has an unsupported column count", true),

	/** The bracket segmenter exhausted every partition of the quote markers. */
	UNRESOLVABLE_BRACKET_STRUCTURE("Unmatched quotation brackets", true),

	/** A "とあり" antecedent followed an antecedent group already closed by "とある". */
	UNEXPECTED_PARALLEL_ANTECEDENT("Unexpected parallel antecedent", true),

	/** The provision qualified but no complete rule was recognized. */
	NO_RULE_FOUND("No substitution rule found", false);

	private final String description;
	private final boolean hard;

	ErrorKind(String description, boolean hard) {
		this.description = description;
		this.hard = hard;
	}

	public String getDescription() {
		return description;
	}

	/** True when the provision's parse was aborted and no rule list exists. */
	public boolean isHard() {
		return hard;
	}
}
