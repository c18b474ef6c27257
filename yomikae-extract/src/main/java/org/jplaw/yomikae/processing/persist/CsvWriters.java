package org.jplaw.yomikae.processing.persist;

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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.jplaw.yomikae.om.ProvisionCoordinate;
import org.jplaw.yomikae.om.ProvisionError;
import org.jplaw.yomikae.om.SubstitutionRule;
import org.jplaw.yomikae.om.SubstitutionSet;

/**
 * The two output streams of a batch run:
 * <ul>
 *   <li>rules, one row per {@link SubstitutionRule} with its law coordinate,</li>
 *   <li>errors, one row per distinct {@link ProvisionError}.</li>
 * </ul>
 * Headers are written on construction; {@link #close()} flushes and closes both.
 */
public class CsvWriters implements AutoCloseable {

	static final String[] RULE_HEADER = { "LAW_NUM", "ARTICLE", "PARAGRAPH", "ITEM", "SUB_ITEM",
			"SUPPL_PROVISION", "RULE_NO", "BEFORE_WORDS", "AFTER_WORD" };

	static final String[] ERROR_HEADER = { "ERROR_KIND", "LAW_NUM", "ARTICLE", "PARAGRAPH", "ITEM", "SUB_ITEM",
			"SUPPL_PROVISION", "CONTENTS" };

	private final CSVPrinter rules;
	private final CSVPrinter errors;
	private final String separator;

	/** Opens (and truncates) both files as UTF-8. */
	public CsvWriters(Path ruleFile, Path errorFile, String separator) throws IOException {
		this(Files.newBufferedWriter(ruleFile, StandardCharsets.UTF_8),
				Files.newBufferedWriter(errorFile, StandardCharsets.UTF_8), separator);
	}

	public CsvWriters(Appendable ruleOut, Appendable errorOut, String separator) throws IOException {
		Objects.requireNonNull(ruleOut, "ruleOut");
		Objects.requireNonNull(errorOut, "errorOut");
		this.separator = Objects.requireNonNull(separator, "separator");
		this.rules = new CSVPrinter(ruleOut, CSVFormat.DEFAULT.withHeader(RULE_HEADER));
		this.errors = new CSVPrinter(errorOut, CSVFormat.DEFAULT.withHeader(ERROR_HEADER));
	}

	/** Writes every rule of the set, numbered from 1. */
	public void writeRuleSet(SubstitutionSet set) throws IOException {
		ProvisionCoordinate c = set.getCoordinate();
		int ruleNo = 0;
		for (SubstitutionRule rule : set.getRules()) {
			ruleNo++;
			rules.printRecord(set.getLawNum(), c.getArticle(), c.getParagraph(), c.getItem(), c.getSubItem(),
					c.getSupplProvision(), ruleNo, String.join(separator, rule.getBeforeWords()),
					rule.getAfterWord());
		}
	}

	public void writeError(ProvisionError error) throws IOException {
		ProvisionCoordinate c = error.getCoordinate();
		errors.printRecord(error.getKind().name(), error.getLawNum(), c.getArticle(), c.getParagraph(), c.getItem(),
				c.getSubItem(), c.getSupplProvision(), error.getContents());
	}

	public void flushAll() throws IOException {
		rules.flush();
		errors.flush();
	}

	@Override
	public void close() throws IOException {
		try {
			rules.close(true);
		} finally {
			errors.close(true);
		}
	}
}
