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

import org.apache.commons.lang3.StringUtils;
import org.jplaw.yomikae.om.ErrorKind;
import org.jplaw.yomikae.om.SubstitutionRule;
import org.jplaw.yomikae.om.YomikaeException;
import org.jplaw.yomikae.util.Logger;

/**
 * Converts a read-as table into rules. Two-column rows are
 * {@code [before, after]}; three-column rows are
 * {@code [provision, before, after]} and the first column is ignored.
 */
public class TabularExtractor {

	/**
	 * @param rows table rows, each an ordered list of cell texts
	 * @return one rule per row whose before and after cells are both non-blank
	 * @throws YomikaeException if any row has a column count other than 2 or 3
	 */
	public List<SubstitutionRule> extract(List<List<String>> rows) throws YomikaeException {
		List<SubstitutionRule> rules = new ArrayList<>(rows.size());
		int rowNo = 0;
		for (List<String> row : rows) {
			rowNo++;
			String before;
			String after;
			switch (row.size()) {
			case 2 -> {
				before = row.get(0);
				after = row.get(1);
			}
			case 3 -> {
				before = row.get(1);
				after = row.get(2);
			}
			default -> throw new YomikaeException(ErrorKind.TABLE_COLUMN_COUNT,
					"Row " + rowNo + " has " + row.size() + " columns");
			}

			if (StringUtils.isBlank(before) || StringUtils.isBlank(after)) {
				Logger.debug("Skipping table row {} with a blank cell: {}", rowNo, row);
				continue;
			}
			rules.add(SubstitutionRule.of(before, after));
		}
		return rules;
	}
}
