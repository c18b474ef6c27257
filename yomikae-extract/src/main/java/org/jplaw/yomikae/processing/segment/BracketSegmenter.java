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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.jplaw.yomikae.om.ErrorKind;
import org.jplaw.yomikae.om.YomikaeException;
import org.jplaw.yomikae.util.Logger;

/**
 * Splits a sentence into alternating literal and bracketed spans
 * ({@code Literal, Bracketed, Literal, ..., Literal}) even when 「 and 」 are
 * not balanced across the sentence.
 *
 * <p>Statutory quotations are frequently malformed: a quoted phrase may
 * itself contain a stray 」 (「い」」) or an unclosed 「 (「「い」). The
 * segmenter therefore does not pair brackets by depth. It partitions the
 * marker sequence into contiguous groups, each of which begins with an open
 * marker and ends with a close marker, and cuts only at a close→open
 * boundary. Quote markers inside a parenthetical aside (（…）) are not
 * candidates at all: they belong to definitions such as
 * {@code （以下「整備法」という。）}.</p>
 *
 * <p>The partition is found by backtracking over an explicit stack of choice
 * points. At each head position the candidates are runs of {@code times}
 * structurally identical groups of {@code length} markers; repeated runs are
 * tried before single groups, shorter groups before longer ones, so the
 * common idiom of back-to-back identical quotations wins. A dead end pops
 * back to the most recent choice point that still has an untried
 * alternative.</p>
 *
 * <p>Instances are stateless and may be shared between threads.</p>
 */
public class BracketSegmenter {

	public static final char OPEN_QUOTE = '「';
	public static final char CLOSE_QUOTE = '」';

	private static final String OPEN_PARENS = "（(";
	private static final String CLOSE_PARENS = "）)";

	/** {@code times} consecutive groups of {@code length} markers sharing one open/close shape. */
	record RepeatCandidate(int length, int times) {
		int span() {
			return length * times;
		}
	}

	/** A head position, the candidates available there and the one currently taken. */
	private static final class ChoicePoint {
		private final int head;
		private final List<RepeatCandidate> alternatives;
		private int current;

		ChoicePoint(int head, List<RepeatCandidate> alternatives) {
			this.head = head;
			this.alternatives = alternatives;
			this.current = 0;
		}

		RepeatCandidate chosen() {
			return alternatives.get(current);
		}

		/** Head position after the chosen candidate. */
		int nextHead() {
			return head + chosen().span();
		}

		boolean advance() {
			if (current + 1 >= alternatives.size())
				return false;
			current++;
			return true;
		}
	}

	/**
	 * Segment a sentence.
	 *
	 * @param sentence text containing quotation and parenthesis glyphs
	 * @return the alternating span sequence, or empty when no valid partition
	 *         of the quotation markers exists
	 */
	public Optional<List<SegmentToken>> segment(String sentence) {
		String text = sentence == null ? "" : sentence;
		List<BracketMarker> markers = scanMarkers(text);
		Optional<List<RepeatCandidate>> plan = partition(markers);
		if (plan.isEmpty()) {
			Logger.debug("No bracket partition for {} markers: {}", markers.size(), text);
			return Optional.empty();
		}
		return Optional.of(materialize(text, markers, plan.get()));
	}

	/**
	 * Same as {@link #segment(String)} but reports failure as
	 * {@link ErrorKind#UNRESOLVABLE_BRACKET_STRUCTURE}.
	 */
	public List<SegmentToken> segmentOrThrow(String sentence) throws YomikaeException {
		return segment(sentence).orElseThrow(() -> new YomikaeException(ErrorKind.UNRESOLVABLE_BRACKET_STRUCTURE,
				"Cannot partition quotation brackets: " + sentence));
	}

	// ---------- Preprocessing ----------

	/**
	 * Collect quotation markers, skipping those nested in parentheses. A stray
	 * closing parenthesis never drives the depth below zero.
	 */
	static List<BracketMarker> scanMarkers(String text) {
		List<BracketMarker> markers = new ArrayList<>();
		int depth = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (OPEN_PARENS.indexOf(c) >= 0) {
				depth++;
			} else if (CLOSE_PARENS.indexOf(c) >= 0) {
				if (depth > 0)
					depth--;
			} else if (depth == 0) {
				if (c == OPEN_QUOTE) {
					markers.add(new BracketMarker(i, BracketMarker.Kind.OPEN));
				} else if (c == CLOSE_QUOTE) {
					markers.add(new BracketMarker(i, BracketMarker.Kind.CLOSE));
				}
			}
		}
		return markers;
	}

	// ---------- Partitioning ----------

	/**
	 * Backtracking search for a partition of {@code markers}. Returns the chosen
	 * candidates in sentence order.
	 */
	static Optional<List<RepeatCandidate>> partition(List<BracketMarker> markers) {
		Deque<ChoicePoint> stack = new ArrayDeque<>();
		BitSet deadHeads = new BitSet(markers.size());
		int head = 0;
		int backtracks = 0;

		while (head < markers.size()) {
			List<RepeatCandidate> candidates = deadHeads.get(head) ? List.of() : candidatesAt(markers, head);
			if (!candidates.isEmpty()) {
				ChoicePoint cp = new ChoicePoint(head, candidates);
				stack.push(cp);
				head = cp.nextHead();
				continue;
			}

			// dead end: resume from the latest choice point with an untried alternative
			backtracks++;
			deadHeads.set(head);
			head = -1;
			while (!stack.isEmpty()) {
				ChoicePoint top = stack.peek();
				if (top.advance()) {
					head = top.nextHead();
					break;
				}
				deadHeads.set(top.head);
				stack.pop();
			}
			if (head < 0) {
				Logger.trace("Bracket search exhausted after {} backtracks", backtracks);
				return Optional.empty();
			}
		}

		List<RepeatCandidate> plan = new ArrayList<>(stack.size());
		Iterator<ChoicePoint> bottomUp = stack.descendingIterator();
		while (bottomUp.hasNext()) {
			plan.add(bottomUp.next().chosen());
		}
		if (backtracks > 0) {
			Logger.trace("Bracket partition found after {} backtracks: {}", backtracks, plan);
		}
		return Optional.of(plan);
	}

	/**
	 * Candidates at {@code head}: repeated runs (times &ge; 2) by length
	 * ascending then times descending, followed by single groups by length
	 * ascending. A candidate is only offered when the cut after it is legal.
	 */
	static List<RepeatCandidate> candidatesAt(List<BracketMarker> markers, int head) {
		int remaining = markers.size() - head;
		if (remaining < 2 || !markers.get(head).isOpen()) {
			return List.of();
		}

		List<RepeatCandidate> repeated = new ArrayList<>();
		List<RepeatCandidate> single = new ArrayList<>();
		for (int length = 2; length <= remaining; length++) {
			if (!markers.get(head + length - 1).isClose())
				continue;

			int times = 1;
			while (head + length * (times + 1) <= markers.size()
					&& sameShape(markers, head, head + length * times, length)) {
				times++;
			}
			for (int t = times; t >= 2; t--) {
				if (isLegalCut(markers, head + length * t)) {
					repeated.add(new RepeatCandidate(length, t));
				}
			}
			if (isLegalCut(markers, head + length)) {
				single.add(new RepeatCandidate(length, 1));
			}
		}
		repeated.addAll(single);
		return repeated;
	}

	private static boolean sameShape(List<BracketMarker> markers, int a, int b, int length) {
		for (int i = 0; i < length; i++) {
			if (markers.get(a + i).getKind() != markers.get(b + i).getKind())
				return false;
		}
		return true;
	}

	/** A group may end before {@code pos} only at a close→open boundary or at the end. */
	private static boolean isLegalCut(List<BracketMarker> markers, int pos) {
		return pos == markers.size() || markers.get(pos).isOpen();
	}

	// ---------- Materialization ----------

	static List<SegmentToken> materialize(String text, List<BracketMarker> markers, List<RepeatCandidate> plan) {
		List<SegmentToken> tokens = new ArrayList<>();
		int cursor = 0;
		int markerIdx = 0;
		for (RepeatCandidate c : plan) {
			for (int n = 0; n < c.times(); n++) {
				int first = markers.get(markerIdx).getPosition();
				int last = markers.get(markerIdx + c.length() - 1).getPosition();
				tokens.add(SegmentToken.literal(text.substring(cursor, first)));
				tokens.add(SegmentToken.bracketed(text.substring(first, last + 1)));
				cursor = last + 1;
				markerIdx += c.length();
			}
		}
		tokens.add(SegmentToken.literal(text.substring(cursor)));
		return tokens;
	}
}
