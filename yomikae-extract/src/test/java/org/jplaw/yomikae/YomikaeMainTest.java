package org.jplaw.yomikae;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.jplaw.yomikae.conf.ConfigLoader;
import org.jplaw.yomikae.processing.PipelineResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YomikaeMainTest {

	@TempDir
	Path tmp;

	private Path lawDir() throws Exception {
		Path dir = Files.createDirectories(tmp.resolve("xml"));
		try (InputStream in = getClass().getResourceAsStream("/laws/sample_law.xml")) {
			Files.copy(in, dir.resolve("sample_law.xml"));
		}
		Files.writeString(dir.resolve("broken.xml"), "<Law>");
		return dir;
	}

	private Properties props(Path lawDir, Path outDir) {
		Properties p = new Properties();
		p.setProperty("LAW_XML_PATH", lawDir.toString());
		p.setProperty("OUTPUT_PATH", outDir.toString());
		p.setProperty("PARALLEL_LAW_LIMIT", "2");
		return p;
	}

	@Test
	void scans_directory_and_writes_both_csv_files() throws Exception {
		Path out = tmp.resolve("out");
		PipelineResult result = new YomikaeMain(new ConfigLoader(props(lawDir(), out))).run();

		assertEquals(4, result.getRuleSets().size());
		List<String> rules = Files.readAllLines(out.resolve("yomikae_rules.csv"), StandardCharsets.UTF_8);
		assertEquals(1 + 5, rules.size());
		assertTrue(rules.get(0).startsWith("LAW_NUM,"));
		assertTrue(rules.stream().anyMatch(l -> l.endsWith(",テスト,試験")));

		List<String> errors = Files.readAllLines(out.resolve("yomikae_errors.csv"), StandardCharsets.UTF_8);
		assertEquals(1, errors.size());
	}

	@Test
	void index_file_limits_the_laws_processed() throws Exception {
		Path dir = lawDir();
		Path index = tmp.resolve("index.csv");
		Files.writeString(index, "LawNum,File\n索引法律第九号,sample_law.xml\n");

		Properties p = props(dir, tmp.resolve("out2"));
		p.setProperty("LAW_INDEX_FILE", index.toString());
		p.setProperty("RULE_OUTPUT_FILE", "r.csv");
		p.setProperty("ERROR_OUTPUT_FILE", "e.csv");

		PipelineResult result = new YomikaeMain(new ConfigLoader(p)).run();

		assertTrue(result.getRuleSets().stream().allMatch(s -> "索引法律第九号".equals(s.getLawNum())));
		assertTrue(Files.exists(tmp.resolve("out2").resolve("r.csv")));
		assertTrue(Files.exists(tmp.resolve("out2").resolve("e.csv")));
	}
}
