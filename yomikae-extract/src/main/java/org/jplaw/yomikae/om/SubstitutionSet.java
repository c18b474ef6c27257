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

import lombok.Data;

/**
 * Rules extracted from a single provision of a law.
 */
@Data
public class SubstitutionSet {

	private String lawNum;
	private ProvisionCoordinate coordinate;
	private List<SubstitutionRule> rules;

	public SubstitutionSet() {
		this.rules = new ArrayList<>();
	}

	public SubstitutionSet(String lawNum, ProvisionCoordinate coordinate, List<SubstitutionRule> rules) {
		this.lawNum = lawNum;
		this.coordinate = coordinate;
		this.rules = new ArrayList<>(rules);
	}

	public boolean isEmpty() {
		return rules.isEmpty();
	}
}
