package org.jplaw.yomikae.processing.extract;

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

import java.util.regex.Pattern;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

final class TextCleaner {
	private TextCleaner() {
	}

	// Layout whitespace from pretty-printed XML; the ideographic space U+3000 is kept
	private static final Pattern LAYOUT_SPACE = Pattern.compile("[ \\t\\r\\n\\u00A0]+");

	/** Ruby readings are printed beside the base text and are not part of the sentence. */
	private static final String RUBY_READING = "Rt";

	/** Text content of a node without ruby readings and layout whitespace. */
	static String textOf(Node node) {
		if (node == null)
			return "";
		StringBuilder sb = new StringBuilder();
		collect(node, sb);
		return clean(sb.toString());
	}

	static String clean(String src) {
		if (src == null || src.isEmpty())
			return "";
		return LAYOUT_SPACE.matcher(src).replaceAll("");
	}

	/** Local name of an element, whether or not the parser was namespace aware. */
	static String nameOf(Element e) {
		String local = e.getLocalName();
		return local != null ? local : e.getTagName();
	}

	private static void collect(Node node, StringBuilder sb) {
		switch (node.getNodeType()) {
		case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> sb.append(node.getNodeValue());
		case Node.ELEMENT_NODE, Node.DOCUMENT_NODE -> {
			if (node instanceof Element && RUBY_READING.equals(nameOf((Element) node)))
				return;
			NodeList children = node.getChildNodes();
			for (int i = 0; i < children.getLength(); i++) {
				collect(children.item(i), sb);
			}
		}
		default -> {
			// comments and processing instructions carry no law text
		}
		}
	}
}
