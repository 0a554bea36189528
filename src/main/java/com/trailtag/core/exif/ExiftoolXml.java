package com.trailtag.core.exif;

import com.trailtag.core.error.ParseException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Вывод exiftool -X (RDF/XML): список rdf:Description, по одному на файл.
 *
 * Группа тега берётся из пространства имён: http://ns.exiftool.org/EXIF/ExifIFD/1.0/ → "ExifIFD",
 * http://ns.exiftool.org/QuickTime/Track1/1.0/ → "Track1". Ключ тега: "Group:Name".
 * Повторяющиеся теги (-ee) сохраняются в порядке документа.
 */
public final class ExiftoolXml {

    public static final String RDF_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";

    /** Один тег в порядке документа. */
    public record Tag(String group, String name, String text) {
        public String key() {
            return group + ":" + name;
        }
    }

    /** Описание одного файла. */
    public static final class Description {
        private final String about;
        private final List<Tag> tags;
        private final Map<String, List<String>> byKey = new LinkedHashMap<>();

        Description(String about, List<Tag> tags) {
            this.about = about;
            this.tags = List.copyOf(tags);
            for (Tag t : this.tags) {
                byKey.computeIfAbsent(t.key(), k -> new ArrayList<>()).add(t.text());
            }
        }

        /** Путь файла из rdf:about, null если нет. */
        public String about() {
            return about;
        }

        public List<Tag> tags() {
            return tags;
        }

        public List<String> all(String key) {
            List<String> v = byKey.get(key);
            return v == null ? List.of() : Collections.unmodifiableList(v);
        }

        /** Первое значение первого найденного ключа. */
        public String first(String... keys) {
            for (String k : keys) {
                List<String> v = byKey.get(k);
                if (v != null && !v.isEmpty()) {
                    return v.get(0);
                }
            }
            return null;
        }

        public boolean hasAll(String... keys) {
            for (String k : keys) {
                if (!byKey.containsKey(k)) {
                    return false;
                }
            }
            return true;
        }

        /** Плоская карта "Group:Name" → первое значение. */
        public Map<String, String> toMap() {
            Map<String, String> out = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> e : byKey.entrySet()) {
                out.put(e.getKey(), e.getValue().get(0));
            }
            return out;
        }
    }

    private ExiftoolXml() {
        // no-op
    }

    public static List<Description> parse(Path file) throws ParseException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        } catch (IOException e) {
            throw new ParseException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    public static List<Description> parse(InputStream in) throws ParseException {
        Document doc;
        try {
            doc = newBuilder().parse(in);
        } catch (SAXException | IOException e) {
            throw new ParseException("Invalid exiftool XML: " + e.getMessage(), e);
        }
        NodeList nodes = doc.getElementsByTagNameNS(RDF_NS, "Description");
        List<Description> out = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            Element d = (Element) nodes.item(i);
            String about = d.getAttributeNS(RDF_NS, "about");
            out.add(new Description(about.isEmpty() ? null : about, tagsOf(d)));
        }
        return out;
    }

    private static List<Tag> tagsOf(Element description) {
        List<Tag> tags = new ArrayList<>();
        for (Node n = description.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element e = (Element) n;
            String group = group(e.getNamespaceURI(), e.getPrefix());
            tags.add(new Tag(group, e.getLocalName(), e.getTextContent().trim()));
        }
        return tags;
    }

    /** Имя группы из URI пространства имён, иначе префикс. */
    static String group(String namespace, String prefix) {
        if (namespace == null || namespace.isEmpty()) {
            return prefix == null ? "" : prefix;
        }
        String[] parts = namespace.replaceAll("/+$", "").split("/");
        if (parts.length >= 2 && parts[parts.length - 1].matches("\\d+(\\.\\d+)*")) {
            return parts[parts.length - 2];
        }
        return parts[parts.length - 1];
    }

    private static DocumentBuilder newBuilder() throws ParseException {
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            f.setExpandEntityReferences(false);
            return f.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new ParseException("XML parser is not available: " + e.getMessage(), e);
        }
    }
}
