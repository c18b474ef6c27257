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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;

import org.apache.commons.lang3.StringUtils;
import org.jplaw.yomikae.om.LawDocument;
import org.jplaw.yomikae.om.LawProvision;
import org.jplaw.yomikae.om.ProvisionCoordinate;
import org.jplaw.yomikae.util.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Reads an e-Gov law XML file into a flat list of {@link LawProvision}s.
 *
 * <p>One provision is produced per sentence container
 * ({@code ParagraphSentence}, {@code ItemSentence}, {@code Subitem1Sentence},
 * …) and one per {@code TableStruct}. A table provision carries the text of
 * the last sentence read in the same paragraph or item, which is where a
 * read-as table is introduced (…同表の下欄に掲げる字句と読み替えるものとする。).
 * Coordinates follow the {@code Num} attributes of {@code Article},
 * {@code Paragraph}, {@code Item} and {@code SubitemN}; supplementary
 * provisions are labelled with their {@code AmendLawNum}.</p>
 */
public class LawXmlReader {

	private static final Set<String> SKIPPED = Set.of("TOC", "LawTitle", "ArticleCaption", "ArticleTitle",
			"ParagraphNum", "ItemTitle", "SupplProvisionLabel");

	// Columns of a single sentence (e.g. a defined term and its definition)
	private static final String COLUMN_SEPARATOR = "　";

	/** Thread-local, hardened DOM builder (XXE / DTD disabled). */
	private static final ThreadLocal<DocumentBuilder> TL_DOM = ThreadLocal.withInitial(() -> {
		try {
			DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
			f.setNamespaceAware(true);
			f.setValidating(false);
			f.setXIncludeAware(false);
			f.setExpandEntityReferences(false);
			f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
			f.setFeature("http://xml.org/sax/features/external-general-entities", false);
			f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
			f.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
			f.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
			return f.newDocumentBuilder();
		} catch (Exception e) {
			throw new IllegalStateException("Failed to init secure XML builder", e);
		}
	});

	/** Last sentence seen in the enclosing paragraph / item. */
	private static final class Scope {
		private String lead = "";
	}

	/**
	 * Parse a law file. The law number is taken from {@code LawNum}.
	 *
	 * @throws IOException if the file cannot be read or is not well-formed XML
	 */
	public LawDocument read(Path file) throws IOException {
		return read(file, null);
	}

	/** Parse a law file, overriding its law number when {@code lawNum} is not blank. */
	public LawDocument read(Path file, String lawNum) throws IOException {
		try (InputStream in = Files.newInputStream(file)) {
			return read(in, lawNum);
		}
	}

	/**
	 * Parse law XML from a stream.
	 *
	 * @param in      XML content
	 * @param lawNum  law number to use; when blank, {@code LawNum} from the document
	 */
	public LawDocument read(InputStream in, String lawNum) throws IOException {
		Document doc;
		try {
			DocumentBuilder b = TL_DOM.get();
			b.reset();
			doc = b.parse(in);
		} catch (SAXException e) {
			throw new IOException("Malformed law XML: " + e.getMessage(), e);
		}
		doc.getDocumentElement().normalize();

		String num = StringUtils.isNotBlank(lawNum) ? lawNum.trim() : extractLawNum(doc);
		List<LawProvision> out = new ArrayList<>();
		walk(doc.getDocumentElement(), num, ProvisionCoordinate.ROOT, new Scope(), out);
		Logger.debug("Read {} provisions from {}", out.size(), num);
		return new LawDocument(num, out);
	}

	private static String extractLawNum(Document doc) {
		NodeList nums = doc.getElementsByTagName("LawNum");
		if (nums.getLength() == 0) {
			return "";
		}
		return TextCleaner.textOf(nums.item(0));
	}

	private void walk(Element e, String lawNum, ProvisionCoordinate coord, Scope scope, List<LawProvision> out) {
		String name = TextCleaner.nameOf(e);
		if (SKIPPED.contains(name))
			return;

		ProvisionCoordinate here = coord;
		Scope inner = scope;
		switch (name) {
		case "SupplProvision" -> here = coord.inSupplProvision(e.getAttribute("AmendLawNum"));
		case "Article" -> here = coord.atArticle(num(e));
		case "Paragraph" -> {
			here = coord.atParagraph(num(e));
			inner = new Scope();
		}
		case "Item" -> {
			here = coord.atItem(num(e));
			inner = new Scope();
		}
		case "TableStruct" -> {
			out.add(LawProvision.table(lawNum, coord, scope.lead, readRows(e)));
			return;
		}
		default -> {
			if (name.startsWith("Subitem") && !name.endsWith("Sentence") && !name.endsWith("Title")) {
				here = coord.atSubItem(subItemPath(coord.getSubItem(), name, num(e)));
				inner = new Scope();
			} else if (isSentenceContainer(name)) {
				String text = sentenceText(e);
				if (!text.isEmpty()) {
					out.add(LawProvision.sentence(lawNum, coord, text));
					scope.lead = text;
				}
				return;
			}
		}
		}

		for (Node child = e.getFirstChild(); child != null; child = child.getNextSibling()) {
			if (child.getNodeType() == Node.ELEMENT_NODE) {
				walk((Element) child, lawNum, here, inner, out);
			}
		}
	}

	/** ParagraphSentence, ItemSentence, Subitem1Sentence, ... but not Sentence itself. */
	private static boolean isSentenceContainer(String name) {
		return name.endsWith("Sentence") && !"Sentence".equals(name);
	}

	/** Subitem1 starts a path, deeper SubitemN levels extend it ("2", "2.1", ...). */
	private static String subItemPath(String parent, String name, String num) {
		if ("Subitem1".equals(name) || parent == null)
			return num;
		return parent + "." + num;
	}

	private static String num(Element e) {
		String n = e.getAttribute("Num");
		return StringUtils.isBlank(n) ? "" : n.trim();
	}

	/** Sentences are concatenated; columns are joined with an ideographic space. */
	static String sentenceText(Element container) {
		StringBuilder sentences = new StringBuilder();
		List<String> columns = new ArrayList<>();
		for (Node child = container.getFirstChild(); child != null; child = child.getNextSibling()) {
			if (child.getNodeType() != Node.ELEMENT_NODE)
				continue;
			Element c = (Element) child;
			if ("Column".equals(TextCleaner.nameOf(c))) {
				columns.add(TextCleaner.textOf(c));
			} else {
				sentences.append(TextCleaner.textOf(c));
			}
		}
		if (!columns.isEmpty()) {
			return sentences + String.join(COLUMN_SEPARATOR, columns);
		}
		return sentences.toString();
	}

	private static List<List<String>> readRows(Element tableStruct) {
		List<List<String>> rows = new ArrayList<>();
		NodeList tableRows = tableStruct.getElementsByTagName("TableRow");
		for (int i = 0; i < tableRows.getLength(); i++) {
			Element row = (Element) tableRows.item(i);
			List<String> cells = new ArrayList<>();
			for (Node child = row.getFirstChild(); child != null; child = child.getNextSibling()) {
				if (child.getNodeType() == Node.ELEMENT_NODE
						&& "TableColumn".equals(TextCleaner.nameOf((Element) child))) {
					cells.add(TextCleaner.textOf(child));
				}
			}
			rows.add(cells);
		}
		return rows;
	}
}
