package org.jplaw.yomikae.processing.support;

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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe counters shared by the workers of one batch run.
 */
public final class GlobalTrackers {

	public final AtomicInteger lawsRead     = new AtomicInteger();
	public final AtomicInteger lawsSkipped  = new AtomicInteger();
	public final AtomicInteger lawsFailed   = new AtomicInteger();

	// provision counters
	public final AtomicInteger candidates   = new AtomicInteger();
	public final AtomicInteger ruleSets     = new AtomicInteger();
	public final AtomicInteger rules        = new AtomicInteger();
	public final AtomicInteger hardErrors   = new AtomicInteger();
	public final AtomicInteger noRuleFound  = new AtomicInteger();

	public GlobalTrackers() { /* default */ }

	/** One-line summary for the end-of-run log. */
	public String summary() {
		return "laws read=" + lawsRead.get() + ", skipped=" + lawsSkipped.get() + ", failed=" + lawsFailed.get()
				+ "; candidates=" + candidates.get() + ", rule sets=" + ruleSets.get() + ", rules=" + rules.get()
				+ ", hard errors=" + hardErrors.get() + ", no rule found=" + noRuleFound.get();
	}
}
