package com.scholary.unlinkmkv.chapter;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * In-memory Matroska chapter structure ({@code Chapters → EditionEntry → ChapterAtom}).
 *
 * <p>Editions are addressed with 1-based indices, matching the {@code EditionEntry[n]} numbering
 * that mkvextract users see. Only the direct {@code ChapterAtom} children of an edition are
 * exposed; nested sub-chapters travel along untouched.
 */
public class ChapterDocument {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChapterDocument.class);

  static final String EDITION_ENTRY = "EditionEntry";
  static final String CHAPTER_ATOM = "ChapterAtom";
  static final String FLAG_DEFAULT = "EditionFlagDefault";
  static final String FLAG_ORDERED = "EditionFlagOrdered";
  static final String SEGMENT_EDITION_UID = "ChapterSegmentEditionUID";

  private final Document document;

  private ChapterDocument(Document document) {
    this.document = document;
  }

  /**
   * Parse chapter XML as produced by {@code mkvextract chapters}.
   *
   * @throws MalformedChapterStructureException if the XML cannot be parsed or has no root
   */
  public static ChapterDocument parse(String xml) {
    if (xml == null || xml.isBlank()) {
      throw new MalformedChapterStructureException("Chapter XML is empty");
    }
    try {
      DocumentBuilder builder = newFactory().newDocumentBuilder();
      Document document =
          builder.parse(new ByteArrayInputStream(xml.trim().getBytes(StandardCharsets.UTF_8)));
      removeWhitespaceNodes(document.getDocumentElement());
      return new ChapterDocument(document);
    } catch (ParserConfigurationException | SAXException | IOException e) {
      throw new MalformedChapterStructureException("Unable to parse chapter XML", e);
    }
  }

  /** A file is linked when its chapters reference other segments. */
  public static boolean isLinked(String chapterXml) {
    return chapterXml != null && chapterXml.contains("<" + ChapterEntry.SEGMENT_UID);
  }

  private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    // mkvextract output references matroskachapters.dtd, which is never available locally
    factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    factory.setExpandEntityReferences(false);
    factory.setNamespaceAware(false);
    return factory;
  }

  public int editionCount() {
    return editions().size();
  }

  /**
   * The chapters of one edition, in document order.
   *
   * <p>Atoms without both a start and an end time are skipped.
   *
   * @param edition 1-based edition index
   * @throws NoSuchEditionException if the edition does not exist
   */
  public List<ChapterEntry> entries(int edition) {
    Element editionElement = edition(edition);
    List<ChapterEntry> entries = new ArrayList<>();
    for (Element atom : children(editionElement, CHAPTER_ATOM)) {
      if (!ChapterEntry.isComplete(atom)) {
        LOGGER.debug("Skipping chapter atom without start/end time in edition {}", edition);
        continue;
      }
      entries.add(new ChapterEntry(atom));
    }
    return entries;
  }

  /**
   * Keep only the given edition.
   *
   * @param edition 1-based edition index
   * @throws NoSuchEditionException if the edition does not exist
   */
  public void selectEdition(int edition) {
    Element keep = edition(edition);
    for (Element other : editions()) {
      if (other != keep) {
        other.getParentNode().removeChild(other);
      }
    }
  }

  /**
   * Remove editions whose {@code EditionFlagDefault} is 0.
   *
   * @return number of editions removed
   */
  public int dropNonDefaultEditions() {
    int dropped = 0;
    for (Element edition : editions()) {
      Element flag = firstChild(edition, FLAG_DEFAULT);
      if (flag != null && "0".equals(flag.getTextContent().trim())) {
        edition.getParentNode().removeChild(edition);
        dropped++;
      }
    }
    return dropped;
  }

  /** The flattened structure is no longer an ordered timeline. */
  public void clearOrderedFlag() {
    removeAll(FLAG_ORDERED);
  }

  /** Remove every remaining cross-segment reference. */
  public void stripSegmentReferences() {
    removeAll(ChapterEntry.SEGMENT_UID);
    removeAll(SEGMENT_EDITION_UID);
  }

  /** Pretty-printed UTF-8 XML with declaration. */
  public byte[] serialize() {
    try {
      TransformerFactory transformerFactory = TransformerFactory.newInstance();
      transformerFactory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      Transformer transformer = transformerFactory.newTransformer();
      transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
      transformer.setOutputProperty(OutputKeys.INDENT, "yes");
      transformer.setOutputProperty(OutputKeys.STANDALONE, "no");
      transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      transformer.transform(new DOMSource(document), new StreamResult(out));
      return out.toByteArray();
    } catch (TransformerException e) {
      throw new IllegalStateException("Unable to serialize chapter XML", e);
    }
  }

  private Element edition(int edition) {
    List<Element> editions = editions();
    if (edition < 1 || edition > editions.size()) {
      throw new NoSuchEditionException(edition, editions.size());
    }
    return editions.get(edition - 1);
  }

  private List<Element> editions() {
    return children(document.getDocumentElement(), EDITION_ENTRY);
  }

  private void removeAll(String tagName) {
    NodeList nodes = document.getElementsByTagName(tagName);
    // live list: collect first
    List<Node> toRemove = new ArrayList<>();
    for (int i = 0; i < nodes.getLength(); i++) {
      toRemove.add(nodes.item(i));
    }
    for (Node node : toRemove) {
      node.getParentNode().removeChild(node);
    }
  }

  static Element firstChild(Element parent, String name) {
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
        return (Element) node;
      }
    }
    return null;
  }

  static List<Element> children(Element parent, String name) {
    List<Element> result = new ArrayList<>();
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
        result.add((Element) node);
      }
    }
    return result;
  }

  private static void removeWhitespaceNodes(Element element) {
    Node node = element.getFirstChild();
    while (node != null) {
      Node next = node.getNextSibling();
      if (node.getNodeType() == Node.TEXT_NODE && node.getTextContent().isBlank()) {
        element.removeChild(node);
      } else if (node.getNodeType() == Node.ELEMENT_NODE) {
        removeWhitespaceNodes((Element) node);
      }
      node = next;
    }
  }
}
