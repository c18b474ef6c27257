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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.jplaw.yomikae.om.ErrorKind;
import org.jplaw.yomikae.om.SubstitutionRule;
import org.jplaw.yomikae.om.YomikaeException;
import org.junit.jupiter.api.Test;

class TabularExtractorTest {

	private final TabularExtractor extractor = new TabularExtractor();

	@Test
	void two_column_rows_are_before_and_after() throws Exception {
		List<SubstitutionRule> rules = extractor.extract(List.of(List.of("市町村長", "都道府県知事"), List.of("市町村", "都道府県")));
		assertEquals(List.of(SubstitutionRule.of("市町村長", "都道府県知事"), SubstitutionRule.of("市町村", "都道府県")), rules);
	}

	@Test
	void three_column_rows_ignore_the_provision_column() throws Exception {
		List<SubstitutionRule> rules = extractor.extract(List.of(List.of("第五条第一項", "同項各号", "第一号又は第二号"),
				List.of("第七条", "前条", "第六条")));
		assertEquals(2, rules.size());
		assertEquals(List.of("同項各号"), rules.get(0).getBeforeWords());
		assertEquals("第一号又は第二号", rules.get(0).getAfterWord());
		assertEquals(SubstitutionRule.of("前条", "第六条"), rules.get(1));
	}

	@Test
	void rows_with_blank_cells_are_skipped() throws Exception {
		List<SubstitutionRule> rules = extractor.extract(List.of(List.of("第五条", "", "乙"), List.of("甲", "　"),
				List.of("丙", "丁")));
		assertEquals(List.of(SubstitutionRule.of("丙", "丁")), rules);
	}

	@Test
	void empty_table_yields_no_rule() throws Exception {
		assertTrue(extractor.extract(List.of()).isEmpty());
	}

	@Test
	void unsupported_column_count_fails_the_whole_table() {
		YomikaeException ex = assertThrows(YomikaeException.class,
				() -> extractor.extract(List.of(List.of("甲", "乙"), List.of("一", "二", "三", "四"))));
		assertEquals(ErrorKind.TABLE_COLUMN_COUNT, ex.getKind());
		assertTrue(ex.getMessage().contains("Row 2"));

		assertThrows(YomikaeException.class, () -> extractor.extract(List.of(List.of("甲"))));
	}
}
