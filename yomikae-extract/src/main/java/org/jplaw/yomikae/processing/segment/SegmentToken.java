package org.jplaw.yomikae.processing.segment;

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

import lombok.Value;

/**
 * One span of a segmented sentence. A bracketed span keeps its delimiters in
 * {@link #getText()}; {@link #getContent()} returns the text between them.
 */
@Value
public class SegmentToken {

	public enum Kind {
		LITERAL, BRACKETED
	}

	Kind kind;
	String text;

	public static SegmentToken literal(String text) {
		return new SegmentToken(Kind.LITERAL, text);
	}

	public static SegmentToken bracketed(String text) {
		if (text == null || text.length() < 2) {
			throw new IllegalArgumentException("Bracketed span needs both delimiters: " + text);
		}
		return new SegmentToken(Kind.BRACKETED, text);
	}

	public boolean isBracketed() {
		return kind == Kind.BRACKETED;
	}

	/** Text without the outer delimiters for bracketed spans, the text itself otherwise. */
	public String getContent() {
		if (kind == Kind.LITERAL)
			return text;
		return text.substring(1, text.length() - 1);
	}
}
