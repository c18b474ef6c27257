package org.jplaw.yomikae.processing.support;

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

import java.nio.file.Path;

import lombok.Value;

/**
 * A law XML file queued for processing. {@code lawNum} may be blank, in which
 * case the number written in the file is used.
 */
@Value
public class LawSource {

	String lawNum;
	Path file;

	public static LawSource of(Path file) {
		return new LawSource(null, file);
	}
}
