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
 * Position and kind of one quotation bracket (「 or 」) in a sentence.
 */
@Value
public class BracketMarker {

	public enum Kind {
		OPEN, CLOSE
	}

	int position;
	Kind kind;

	public boolean isOpen() {
		return kind == Kind.OPEN;
	}

	public boolean isClose() {
		return kind == Kind.CLOSE;
	}
}
