package org.jplaw.yomikae.processing;

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

import java.util.List;

import org.jplaw.yomikae.om.ProvisionError;
import org.jplaw.yomikae.om.SubstitutionSet;

import lombok.Value;

/**
 * Aggregated output of a batch run: rule sets in law order, then provision
 * order; errors once each, in order of first occurrence.
 */
@Value
public class PipelineResult {

	List<SubstitutionSet> ruleSets;
	List<ProvisionError> errors;

	public int ruleCount() {
		return ruleSets.stream().mapToInt(s -> s.getRules().size()).sum();
	}
}
