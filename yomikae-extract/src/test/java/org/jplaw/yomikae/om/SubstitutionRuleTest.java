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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

class SubstitutionRuleTest {

	@Test
	void rule_requires_both_sides() {
		assertThrows(IllegalArgumentException.class, () -> new SubstitutionRule(List.of(), "乙"));
		assertThrows(IllegalArgumentException.class, () -> new SubstitutionRule(null, "乙"));
		assertThrows(IllegalArgumentException.class, () -> SubstitutionRule.of("甲", ""));
	}

	@Test
	void before_words_are_copied() {
		List<String> before = new ArrayList<>(List.of("甲", "乙"));
		SubstitutionRule rule = new SubstitutionRule(before, "丙");
		before.add("丁");

		assertEquals(List.of("甲", "乙"), rule.getBeforeWords());
		assertThrows(UnsupportedOperationException.class, () -> rule.getBeforeWords().add("戊"));
	}

	@Test
	void substitution_set_copies_its_rules() {
		List<SubstitutionRule> rules = new ArrayList<>(List.of(SubstitutionRule.of("甲", "乙")));
		SubstitutionSet set = new SubstitutionSet("L", ProvisionCoordinate.ROOT, rules);
		rules.clear();

		assertFalse(set.isEmpty());
		assertTrue(new SubstitutionSet().isEmpty());
	}

	@Test
	void provision_errors_deduplicate_by_value() {
		LawProvision p = LawProvision.sentence("L", ProvisionCoordinate.ROOT.atArticle("1"), "「甲」とあるのは「乙");
		Set<ProvisionError> errors = new LinkedHashSet<>();
		errors.add(ProvisionError.of(ErrorKind.UNRESOLVABLE_BRACKET_STRUCTURE, p));
		errors.add(ProvisionError.of(ErrorKind.UNRESOLVABLE_BRACKET_STRUCTURE, p));
		errors.add(ProvisionError.of(ErrorKind.NO_RULE_FOUND, p));

		assertEquals(2, errors.size());
		assertEquals("Unmatched quotation brackets at L Art.1", errors.iterator().next().toString());
	}

	@Test
	void only_no_rule_found_is_soft() {
		for (ErrorKind k : ErrorKind.values()) {
			assertEquals(k != ErrorKind.NO_RULE_FOUND, k.isHard(), k.name());
		}
	}

	@Test
	void table_provisions_render_rows() {
		LawProvision t = LawProvision.table("L", null, null, List.of(List.of("甲", "乙"), List.of("丙", "丁")));
		assertTrue(t.isTable());
		assertEquals("", t.getText());
		assertEquals(ProvisionCoordinate.ROOT, t.getCoordinate());
		assertEquals("甲|乙 / 丙|丁", t.render());
		assertEquals("本文", LawProvision.sentence("L", null, "本文").render());
	}
}
