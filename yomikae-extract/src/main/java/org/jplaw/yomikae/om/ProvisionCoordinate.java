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

import org.apache.commons.lang3.StringUtils;

import lombok.Builder;
import lombok.Value;

/**
 * Location of a sentence or table inside a law: article, paragraph, item and
 * sub-item numbers as they appear in the {@code Num} attributes of the law
 * XML (e.g. {@code "2_3"} for 第二条の三), plus the label of the
 * supplementary provision when the text sits in 附則.
 *
 * <p>Any level may be {@code null}. Value equality is relied upon when
 * errors are deduplicated.</p>
 */
@Value
@Builder(toBuilder = true)
public class ProvisionCoordinate {

	/** Coordinate with every level unset. */
	public static final ProvisionCoordinate ROOT = ProvisionCoordinate.builder().build();

	String supplProvision;
	String article;
	String paragraph;
	String item;
	String subItem;

	/** Enter an article: paragraph and below are reset. */
	public ProvisionCoordinate atArticle(String num) {
		return toBuilder().article(num).paragraph(null).item(null).subItem(null).build();
	}

	/** Enter a paragraph: item and below are reset. */
	public ProvisionCoordinate atParagraph(String num) {
		return toBuilder().paragraph(num).item(null).subItem(null).build();
	}

	public ProvisionCoordinate atItem(String num) {
		return toBuilder().item(num).subItem(null).build();
	}

	public ProvisionCoordinate atSubItem(String num) {
		return toBuilder().subItem(num).build();
	}

	/** Enter a supplementary provision: all numbered levels are reset. */
	public ProvisionCoordinate inSupplProvision(String label) {
		return ProvisionCoordinate.builder().supplProvision(label).build();
	}

	/**
	 * Compact label such as {@code 附則[平成十一年法律第百六十号] Art.3 Para.2 Item.1}.
	 */
	public String label() {
		StringBuilder sb = new StringBuilder();
		if (supplProvision != null) {
			sb.append("附則");
			if (StringUtils.isNotBlank(supplProvision)) {
				sb.append('[').append(supplProvision).append(']');
			}
		}
		append(sb, "Art.", article);
		append(sb, "Para.", paragraph);
		append(sb, "Item.", item);
		append(sb, "Sub.", subItem);
		return sb.toString();
	}

	private static void append(StringBuilder sb, String prefix, String value) {
		if (value == null)
			return;
		if (sb.length() > 0)
			sb.append(' ');
		sb.append(prefix).append(value);
	}
}
