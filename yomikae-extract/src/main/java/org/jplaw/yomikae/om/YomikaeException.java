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

import java.util.Objects;

/**
 * Checked failure raised by the segmenter and the extractors. Carries the
 * {@link ErrorKind} so callers can turn it into a {@link ProvisionError}.
 */
public class YomikaeException extends Exception {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	public YomikaeException(ErrorKind kind, String message) {
		super(message);
		this.kind = Objects.requireNonNull(kind, "kind");
	}

	public ErrorKind getKind() {
		return kind;
	}
}
