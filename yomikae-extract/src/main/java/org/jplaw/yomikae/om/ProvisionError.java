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

import lombok.Value;

/**
 * A failed or empty analysis of one provision. Two errors are equal when
 * kind, law, coordinate and contents match, which lets a corpus run report
 * repeated occurrences once.
 */
@Value
public class ProvisionError {

	ErrorKind kind;
	String lawNum;
	ProvisionCoordinate coordinate;
	String contents;

	public static ProvisionError of(ErrorKind kind, LawProvision provision) {
		return new ProvisionError(kind, provision.getLawNum(), provision.getCoordinate(), provision.render());
	}

	public boolean isHard() {
		return kind.isHard();
	}

	@Override
	public String toString() {
		return kind.getDescription() + " at " + lawNum + " " + coordinate.label();
	}
}
