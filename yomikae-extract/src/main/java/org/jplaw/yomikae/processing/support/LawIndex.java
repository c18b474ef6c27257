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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.jplaw.yomikae.util.Logger;

/**
 * Lists the law files of a batch run, either from an index CSV or by scanning
 * the law XML directory.
 *
 * <p>Index format (header required, case-insensitive):</p>
 * <pre>
 * LawNum,File
 * 昭和二十二年法律第六十七号,322AC0000000067.xml
 * </pre>
 * Relative {@code File} values are resolved against the law XML directory.
 */
public final class LawIndex {

	public static final String COL_LAW_NUM = "LawNum";
	public static final String COL_FILE = "File";

	private LawIndex() {
	}

	/**
	 * Read the index. Rows without a file name are skipped and counted.
	 *
	 * @param csv     index file
	 * @param baseDir directory relative file names are resolved against
	 * @throws IOException if the index cannot be read
	 */
	public static List<LawSource> load(Path csv, Path baseDir) throws IOException {
		List<LawSource> out = new ArrayList<>();
		CSVFormat format = CSVFormat.DEFAULT.withHeader().withIgnoreHeaderCase().withTrim();

		int row = 0;
		int badRows = 0;
		try (Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8);
				CSVParser parser = new CSVParser(reader, format)) {
			if (!parser.getHeaderMap().containsKey(COL_FILE)) {
				throw new IOException("Law index has no '" + COL_FILE + "' column: " + csv);
			}
			boolean hasLawNum = parser.getHeaderMap().containsKey(COL_LAW_NUM);
			for (CSVRecord record : parser) {
				row++;
				String file = record.isSet(COL_FILE) ? record.get(COL_FILE) : null;
				if (StringUtils.isBlank(file)) {
					badRows++;
					continue;
				}
				String lawNum = hasLawNum && record.isSet(COL_LAW_NUM) ? StringUtils.trimToNull(record.get(COL_LAW_NUM))
						: null;
				out.add(new LawSource(lawNum, baseDir.resolve(file)));
			}
		}

		Logger.info("Law index loaded: rows={}, laws={}, bad-rows={}", row, out.size(), badRows);
		return out;
	}

	/**
	 * All {@code *.xml} files directly under {@code dir}, sorted by file name.
	 *
	 * @throws IOException if the directory cannot be listed
	 */
	public static List<LawSource> scan(Path dir) throws IOException {
		if (!Files.isDirectory(dir)) {
			throw new IOException("Law XML directory does not exist: " + dir);
		}
		try (Stream<Path> stream = Files.list(dir)) {
			return stream.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xml"))
					.sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
					.map(LawSource::of)
					.collect(Collectors.toList());
		}
	}
}
