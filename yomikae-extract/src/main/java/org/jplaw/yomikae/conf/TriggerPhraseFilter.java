package org.jplaw.yomikae.conf;

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

import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import org.jplaw.yomikae.util.Logger;

/**
 * Trigger phrases deciding whether a provision is a read-as provision and
 * whether its rules are written in prose or in a table.
 *
 * <p>Read from {@value #DEFAULT_CLASSPATH_RESOURCE}:</p>
 * <pre>
 * prose = と読み替える
 * table = 下欄に掲げる字句と読み替える, 右欄に掲げる字句と読み替える
 * </pre>
 */
public final class TriggerPhraseFilter {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/trigger-phrases.properties";

	private static final String DEFAULT_PROSE = "と読み替える";
	private static final String DEFAULT_TABLE = "下欄に掲げる字句と読み替える";

	// --------------------------------------------------------------------------
	private final Properties properties = new Properties();

	private final List<String> prose;
	private final List<String> table;

	/** Loads {@value #DEFAULT_CLASSPATH_RESOURCE}; built-in phrases are used if it is missing. */
	public TriggerPhraseFilter() {
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
		this.prose = parseList(properties.getProperty("prose", DEFAULT_PROSE));
		this.table = parseList(properties.getProperty("table", DEFAULT_TABLE));
	}

	public TriggerPhraseFilter(List<String> prose, List<String> table) {
		this.prose = List.copyOf(prose);
		this.table = List.copyOf(table);
	}

	// -------------------------- Internals --------------------------------------
	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.warn("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private static List<String> parseList(String raw) {
		if (raw == null)
			return List.of();
		// allow commas, whitespace, newlines
		return Arrays.stream(raw.split("[,\\s]+")).map(String::trim).filter(s -> !s.isEmpty())
				.collect(Collectors.toUnmodifiableList());
	}

	/** True if the sentence refers to a read-as table. */
	public boolean isTableTrigger(String text) {
		return containsAny(text, table);
	}

	/** True if the sentence states read-as rules, in prose or by table reference. */
	public boolean isProseTrigger(String text) {
		return containsAny(text, prose);
	}

	private static boolean containsAny(String text, List<String> phrases) {
		if (text == null || text.isEmpty())
			return false;
		for (String p : phrases) {
			if (text.contains(p))
				return true;
		}
		return false;
	}

	public List<String> prose() {
		return prose;
	}

	public List<String> table() {
		return table;
	}
}
