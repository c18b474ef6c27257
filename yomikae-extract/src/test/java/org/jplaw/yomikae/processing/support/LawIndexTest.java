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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LawIndexTest {

	@TempDir
	Path tmp;

	@Test
	void index_rows_resolve_against_the_law_directory() throws Exception {
		Path csv = tmp.resolve("index.csv");
		Files.writeString(csv, "lawnum,file\n"
				+ "昭和二十二年法律第六十七号, 322AC0000000067.xml \n"
				+ ",405AC0000000088.xml\n"
				+ "平成五年法律第八十八号,\n");

		List<LawSource> sources = LawIndex.load(csv, tmp.resolve("xml"));

		assertEquals(2, sources.size());
		assertEquals("昭和二十二年法律第六十七号", sources.get(0).getLawNum());
		assertEquals(tmp.resolve("xml").resolve("322AC0000000067.xml"), sources.get(0).getFile());
		assertNull(sources.get(1).getLawNum());
	}

	@Test
	void index_without_file_column_is_rejected() throws Exception {
		Path csv = tmp.resolve("bad.csv");
		Files.writeString(csv, "LawNum,Path\nA,b.xml\n");
		assertThrows(IOException.class, () -> LawIndex.load(csv, tmp));
	}

	@Test
	void scan_lists_xml_files_sorted_by_name() throws Exception {
		Files.writeString(tmp.resolve("b.xml"), "<Law/>");
		Files.writeString(tmp.resolve("a.XML"), "<Law/>");
		Files.writeString(tmp.resolve("notes.txt"), "x");
		Files.createDirectories(tmp.resolve("sub.xml"));

		List<String> names = LawIndex.scan(tmp).stream().map(s -> s.getFile().getFileName().toString())
				.collect(Collectors.toList());

		assertEquals(List.of("a.XML", "b.xml"), names);
		assertTrue(LawIndex.scan(tmp).stream().allMatch(s -> s.getLawNum() == null));
	}

	@Test
	void scan_of_missing_directory_fails() {
		assertThrows(IOException.class, () -> LawIndex.scan(tmp.resolve("nope")));
	}
}
