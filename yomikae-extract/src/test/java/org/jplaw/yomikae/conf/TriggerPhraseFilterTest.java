package org.jplaw.yomikae.conf;

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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class TriggerPhraseFilterTest {

	@Test
	void classpath_phrases_are_loaded() {
		TriggerPhraseFilter f = new TriggerPhraseFilter();

		assertTrue(f.prose().contains("と読み替える"));
		assertTrue(f.table().contains("下欄に掲げる字句と読み替える"));
		assertTrue(f.table().size() > 1);
	}

	@Test
	void prose_trigger_matches_anywhere_in_the_sentence() {
		TriggerPhraseFilter f = new TriggerPhraseFilter();

		assertTrue(f.isProseTrigger("この場合において、「甲」とあるのは「乙」と読み替えるものとする。"));
		assertFalse(f.isProseTrigger("前条の規定は、この場合に準用する。"));
		assertFalse(f.isProseTrigger(null));
		assertFalse(f.isProseTrigger(""));
	}

	@Test
	void table_trigger_matches_any_configured_variant() {
		TriggerPhraseFilter f = new TriggerPhraseFilter();

		assertTrue(f.isTableTrigger("次の表の上欄に掲げる字句は、それぞれ同表の下欄に掲げる字句と読み替えるものとする。"));
		assertTrue(f.isTableTrigger("同表の右欄に掲げる字句と読み替える。"));
		assertFalse(f.isTableTrigger("「甲」とあるのは「乙」と読み替える。"));
	}

	@Test
	void explicit_phrases_replace_the_configuration() {
		TriggerPhraseFilter f = new TriggerPhraseFilter(List.of("とする"), List.of());

		assertTrue(f.isProseTrigger("甲とする。"));
		assertFalse(f.isProseTrigger("甲と読み替える。"));
		assertFalse(f.isTableTrigger("下欄に掲げる字句と読み替える"));
	}
}
