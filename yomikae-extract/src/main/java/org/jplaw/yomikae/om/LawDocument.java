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

import lombok.Value;

/**
 * A parsed law file: its law number and the provisions found in document order.
 */
@Value
public class LawDocument {

	String lawNum;
	List<LawProvision> provisions;
}
