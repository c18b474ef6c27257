package org.jplaw.yomikae.processing.segment;

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

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.jplaw.yomikae.om.ErrorKind;
import org.jplaw.yomikae.om.YomikaeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BracketSegmenterTest {

	private final BracketSegmenter segmenter = new BracketSegmenter();

	// --- helpers -------------------------------------------------------------

	private List<String> texts(String sentence) {
		Optional<List<SegmentToken>> tokens = segmenter.segment(sentence);
		assertTrue(tokens.isPresent(), "expected a partition for: " + sentence);
		return tokens.get().stream().map(SegmentToken::getText).collect(Collectors.toList());
	}

	private static void assertAlternates(List<SegmentToken> tokens) {
		assertEquals(1, tokens.size() % 2, "odd number of spans");
		for (int i = 0; i < tokens.size(); i++) {
			assertEquals(i % 2 == 1, tokens.get(i).isBracketed(), "span " + i);
		}
	}

	// --- balanced and malformed quotations -------------------------------------

	@Test
	void balanced_pairs_split_into_alternating_spans() {
		assertEquals(List.of("あ", "「い」", "う", "「え」", "お"), texts("あ「い」う「え」お"));
	}

	@Test
	void repeated_doubled_close_is_kept_inside_each_span() {
		assertEquals(List.of("あ", "「い」」", "う", "「え」」", "お"), texts("あ「い」」う「え」」お"));
	}

	@Test
	void repeated_doubled_open_is_kept_inside_each_span() {
		assertEquals(List.of("あ", "「「い」", "う", "「「え」", "お"), texts("あ「「い」う「「え」お"));
	}

	@Test
	void repeated_runs_of_three_closes() {
		assertEquals(List.of("あ", "「い」う」え」", "お", "「か」き」く」", "け"),
				texts("あ「い」う」え」お「か」き」く」け"));
	}

	@Test
	void repeated_open_close_open_close_close_groups() {
		assertEquals(List.of("あ", "「た」ち「つ」て」", "と", "「な」に「ぬ」ね」", "の"),
				texts("あ「た」ち「つ」て」と「な」に「ぬ」ね」の"));
	}

	@Test
	void several_repeated_shapes_in_one_sentence() {
		String s = "あ「い」」う「え」」お「か「き」く」け」こ「さ「し」す」せ」そ「た」ち「つ」て」と「な」に「ぬ」ね」の";
		assertEquals(List.of("あ", "「い」」", "う", "「え」」", "お", "「か「き」く」け」", "こ", "「さ「し」す」せ」", "そ",
				"「た」ち「つ」て」", "と", "「な」に「ぬ」ね」", "の"), texts(s));
	}

	@Test
	void repeated_shape_followed_by_balanced_pairs() {
		assertEquals(List.of("あ", "「い」」", "う", "「え」」", "お", "「か」」", "き", "「く」", "け", "「こ」", "さ"),
				texts("あ「い」」う「え」」お「か」」き「く」け「こ」さ"));
	}

	@Test
	void triple_repeat_ending_the_sentence() {
		assertEquals(List.of("あ", "「い」」", "う", "「え」」", "お", "「か」」", "き"), texts("あ「い」」う「え」」お「か」」き"));
	}

	// --- structural properties -------------------------------------------------

	@Test
	@DisplayName("Concatenating the spans gives back the sentence")
	void reconstruction_is_lossless() {
		String s = "この場合において、同項中「それぞれ同項各号に定める者」とあり、及び同項第二号中「その者」とあるのは、「都道府県の教育委員会」と読み替えるものとする。";
		List<SegmentToken> tokens = segmenter.segment(s).orElseThrow();
		assertEquals(s, tokens.stream().map(SegmentToken::getText).collect(Collectors.joining()));
		assertAlternates(tokens);
		assertEquals("それぞれ同項各号に定める者", tokens.get(1).getContent());
	}

	@Test
	void quotes_inside_parentheses_are_not_markers() {
		String s = "「甲」とあるのは「乙法（以下「新法」という。）」と読み替える";
		List<String> spans = texts(s);
		assertEquals(List.of("", "「甲」", "とあるのは", "「乙法（以下「新法」という。）」", "と読み替える"), spans);
	}

	@Test
	void half_width_parentheses_also_hide_markers() {
		assertEquals(List.of("あ", "「い(「う」)え」", "お"), texts("あ「い(「う」)え」お"));
	}

	@Test
	void stray_close_parenthesis_does_not_hide_later_markers() {
		assertEquals(List.of("）あ", "「い」", "う"), texts("）あ「い」う"));
	}

	@Test
	void sentence_without_markers_is_a_single_literal() {
		List<SegmentToken> tokens = segmenter.segment("前条の規定を準用する。").orElseThrow();
		assertEquals(1, tokens.size());
		assertFalse(tokens.get(0).isBracketed());
	}

	@Test
	void empty_and_null_sentences_segment_to_one_empty_literal() {
		assertEquals(List.of(""), texts(""));
		assertEquals(List.of(""), texts(null));
	}

	@Test
	void adjacent_quotations_produce_empty_literal_between_them() {
		assertEquals(List.of("", "「甲」", "", "「乙」", ""), texts("「甲」「乙」"));
	}

	// --- failures --------------------------------------------------------------

	@Test
	void leading_close_marker_has_no_partition() {
		assertTrue(segmenter.segment("あ」い「う」").isEmpty());
	}

	@Test
	void lone_open_marker_has_no_partition() {
		assertTrue(segmenter.segment("あ「い").isEmpty());
	}

	@Test
	void trailing_open_marker_has_no_partition() {
		assertTrue(segmenter.segment("あ「い」う「").isEmpty());
	}

	@Test
	void segment_or_throw_reports_unresolvable_structure() {
		YomikaeException ex = assertThrows(YomikaeException.class, () -> segmenter.segmentOrThrow("「甲」とあるのは「乙"));
		assertEquals(ErrorKind.UNRESOLVABLE_BRACKET_STRUCTURE, ex.getKind());
	}

	// --- scale -------------------------------------------------------------------

	@Test
	void long_sentences_do_not_exhaust_the_stack() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < 600; i++) {
			sb.append("「語").append(i).append("」とあるのは「訳").append(i).append("」と、");
		}
		List<SegmentToken> tokens = segmenter.segment(sb.toString()).orElseThrow();
		assertEquals(2 * 1200 + 1, tokens.size());
		assertAlternates(tokens);
	}

	@Test
	void unsolvable_long_sentence_fails_quickly() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < 400; i++) {
			sb.append("「い」」う");
		}
		sb.append("「");
		assertTrue(segmenter.segment(sb.toString()).isEmpty());
	}

	// --- internals -----------------------------------------------------------------

	@Test
	void scan_skips_markers_nested_at_any_parenthesis_depth() {
		List<BracketMarker> markers = BracketSegmenter.scanMarkers("「あ（い（「う」）え）」");
		assertEquals(2, markers.size());
		assertTrue(markers.get(0).isOpen());
		assertTrue(markers.get(1).isClose());
	}

	@Test
	void repeated_candidates_are_offered_before_single_groups() {
		List<BracketMarker> markers = BracketSegmenter.scanMarkers("「い」」う「え」」");
		List<BracketSegmenter.RepeatCandidate> cs = BracketSegmenter.candidatesAt(markers, 0);
		assertEquals(new BracketSegmenter.RepeatCandidate(3, 2), cs.get(0));
		assertTrue(cs.contains(new BracketSegmenter.RepeatCandidate(6, 1)));
	}
}
