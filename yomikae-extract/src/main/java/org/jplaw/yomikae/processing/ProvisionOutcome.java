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

import org.jplaw.yomikae.om.ProvisionError;
import org.jplaw.yomikae.om.SubstitutionSet;

import lombok.Value;

/**
 * Result of analyzing one provision: exactly one of {@link #getRuleSet()} and
 * {@link #getError()} is non-null.
 */
@Value
public class ProvisionOutcome {

	SubstitutionSet ruleSet;
	ProvisionError error;

	public static ProvisionOutcome success(SubstitutionSet ruleSet) {
		return new ProvisionOutcome(ruleSet, null);
	}

	public static ProvisionOutcome failure(ProvisionError error) {
		return new ProvisionOutcome(null, error);
	}

	public boolean isSuccess() {
		return ruleSet != null;
	}
}
