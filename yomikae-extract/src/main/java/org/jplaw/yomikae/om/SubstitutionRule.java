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

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import lombok.Value;

/**
 * One read-as rule: when the referenced provision is applied, each phrase in
 * {@code beforeWords} is read as {@code afterWord}. Immutable once built.
 */
@Value
public class SubstitutionRule {

	List<String> beforeWords;
	String afterWord;

	public SubstitutionRule(List<String> beforeWords, String afterWord) {
		if (beforeWords == null || beforeWords.isEmpty()) {
			throw new IllegalArgumentException("beforeWords must not be empty");
		}
		if (StringUtils.isEmpty(afterWord)) {
			throw new IllegalArgumentException("afterWord must not be empty");
		}
		this.beforeWords = List.copyOf(beforeWords);
		this.afterWord = afterWord;
	}

	public static SubstitutionRule of(String beforeWord, String afterWord) {
		return new SubstitutionRule(List.of(beforeWord), afterWord);
	}
}
