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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * A unit of law text handed to the analyzer: either the sentence text of a
 * paragraph / item, or the rows of a table together with the sentence that
 * introduces it.
 */
@Value
public class LawProvision {

	String lawNum;
	ProvisionCoordinate coordinate;

	/** Sentence text; for tables, the sentence that introduces the table (may be empty). */
	String text;

	/** Table rows, or {@code null} for a sentence provision. */
	List<List<String>> rows;

	private LawProvision(String lawNum, ProvisionCoordinate coordinate, String text, List<List<String>> rows) {
		this.lawNum = lawNum;
		this.coordinate = coordinate == null ? ProvisionCoordinate.ROOT : coordinate;
		this.text = text == null ? "" : text;
		this.rows = rows;
	}

	public static LawProvision sentence(String lawNum, ProvisionCoordinate coordinate, String text) {
		return new LawProvision(lawNum, coordinate, text, null);
	}

	public static LawProvision table(String lawNum, ProvisionCoordinate coordinate, String leadText,
			List<List<String>> rows) {
		List<List<String>> copy = new ArrayList<>();
		for (List<String> row : rows) {
			copy.add(List.copyOf(row));
		}
		return new LawProvision(lawNum, coordinate, leadText, List.copyOf(copy));
	}

	public boolean isTable() {
		return rows != null;
	}

	/** Flat rendering used in error reports: the sentence, or rows joined with "|" and "/". */
	public String render() {
		if (!isTable())
			return text;
		return rows.stream().map(r -> String.join("|", r)).collect(Collectors.joining(" / "));
	}
}
