package com.example.docstandards.compliance.parser;

import com.example.docstandards.compliance.model.DocumentStructure;
import com.example.docstandards.compliance.model.Heading;
import com.example.docstandards.compliance.model.StyleDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Parses an OpenDocument package into a {@link DocumentStructure}.
 *
 * <p>The same parse path serves promotion (deriving a rule set from a golden document)
 * and validation, so a document always promotes into a Standard it satisfies.
 * Stateless and thread-safe: a new DOM builder is created per call.
 */
@Slf4j
@Component
public class OdfStructureParser {

    static final String NS_OFFICE = "urn:oasis:names:tc:opendocument:xmlns:office:1.0";
    static final String NS_STYLE = "urn:oasis:names:tc:opendocument:xmlns:style:1.0";
    static final String NS_TEXT = "urn:oasis:names:tc:opendocument:xmlns:text:1.0";
    static final String NS_META = "urn:oasis:names:tc:opendocument:xmlns:meta:1.0";

    static final String MIMETYPE_PREFIX = "application/vnd.oasis.opendocument.";

    private static final String ENTRY_MIMETYPE = "mimetype";
    private static final String ENTRY_CONTENT = "content.xml";
    private static final String ENTRY_STYLES = "styles.xml";
    private static final String ENTRY_META = "meta.xml";

    // Zip bomb guards
    private static final int MAX_ENTRIES = 10_000;
    private static final long MAX_XML_ENTRY_BYTES = 64L * 1024 * 1024;

    public DocumentStructure parse(byte[] content) {
        if (content == null || content.length == 0) {
            throw new MalformedDocumentException("Document is empty");
        }

        PackageContents contents = readPackage(content);

        byte[] mimetypeBytes = contents.parts().get(ENTRY_MIMETYPE);
        if (mimetypeBytes == null) {
            throw new MalformedDocumentException("Missing mimetype entry");
        }
        String mimeType = new String(mimetypeBytes, StandardCharsets.US_ASCII).trim();
        if (!mimeType.startsWith(MIMETYPE_PREFIX)) {
            throw new MalformedDocumentException("Not an OpenDocument package: mimetype " + mimeType);
        }

        byte[] contentXml = contents.parts().get(ENTRY_CONTENT);
        if (contentXml == null) {
            throw new MalformedDocumentException("Missing " + ENTRY_CONTENT);
        }

        Document contentDoc = parseXml(ENTRY_CONTENT, contentXml);
        Document stylesDoc = contents.parts().containsKey(ENTRY_STYLES)
                ? parseXml(ENTRY_STYLES, contents.parts().get(ENTRY_STYLES))
                : null;
        Document metaDoc = contents.parts().containsKey(ENTRY_META)
                ? parseXml(ENTRY_META, contents.parts().get(ENTRY_META))
                : null;

        Map<String, StyleDefinition> namedStyles = new LinkedHashMap<>();
        Map<String, StyleDefinition> automaticStyles = new LinkedHashMap<>();
        if (stylesDoc != null) {
            collectStyles(stylesDoc, "styles", false, namedStyles);
            collectStyles(stylesDoc, "automatic-styles", true, automaticStyles);
        }
        collectStyles(contentDoc, "automatic-styles", true, automaticStyles);

        Set<String> fonts = new LinkedHashSet<>();
        collectFonts(contentDoc, fonts);
        if (stylesDoc != null) {
            collectFonts(stylesDoc, fonts);
        }

        DocumentStructure structure = new DocumentStructure(
                schemaVersion(contentDoc, stylesDoc, metaDoc),
                mimeType,
                metaDoc != null ? extractMetadata(metaDoc) : Map.of(),
                namedStyles,
                automaticStyles,
                new ArrayList<>(fonts),
                extractHeadings(contentDoc),
                contents.entryNames());

        log.debug("Parsed package: mimeType={}, version={}, headings={}, namedStyles={}, entries={}",
                mimeType, structure.schemaVersion(), structure.headings().size(),
                namedStyles.size(), structure.entries().size());
        return structure;
    }

    private PackageContents readPackage(byte[] content) {
        Map<String, byte[]> parts = new LinkedHashMap<>();
        List<String> entryNames = new ArrayList<>();

        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(content))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entryNames.size() >= MAX_ENTRIES) {
                    throw new MalformedDocumentException("Package has more than " + MAX_ENTRIES + " entries");
                }
                String name = entry.getName();
                entryNames.add(name);
                if (isStructuralPart(name)) {
                    parts.put(name, readBounded(zip, name));
                }
            }
        } catch (ZipException e) {
            throw new MalformedDocumentException("Not a valid zip package: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedDocumentException("Unreadable package: " + e.getMessage(), e);
        }

        if (entryNames.isEmpty()) {
            throw new MalformedDocumentException("Not a zip package");
        }
        return new PackageContents(parts, entryNames);
    }

    private static boolean isStructuralPart(String name) {
        return ENTRY_MIMETYPE.equals(name) || ENTRY_CONTENT.equals(name)
                || ENTRY_STYLES.equals(name) || ENTRY_META.equals(name);
    }

    private static byte[] readBounded(InputStream in, String name) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > MAX_XML_ENTRY_BYTES) {
                throw new MalformedDocumentException(name + " exceeds " + MAX_XML_ENTRY_BYTES + " bytes");
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    private Document parseXml(String name, byte[] xml) {
        try {
            DocumentBuilder builder = newSecureFactory().newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler()); // fatal errors still throw, nothing printed
            return builder.parse(new ByteArrayInputStream(xml));
        } catch (SAXException e) {
            throw new MalformedDocumentException(name + " is not well-formed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedDocumentException(name + " could not be read: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser misconfigured", e);
        }
    }

    private static DocumentBuilderFactory newSecureFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    private static String schemaVersion(Document contentDoc, Document stylesDoc, Document metaDoc) {
        for (Document doc : new Document[]{contentDoc, stylesDoc, metaDoc}) {
            if (doc == null) {
                continue;
            }
            String version = doc.getDocumentElement().getAttributeNS(NS_OFFICE, "version");
            if (!version.isEmpty()) {
                return version;
            }
        }
        return null;
    }

    private static Map<String, String> extractMetadata(Document metaDoc) {
        Map<String, String> metadata = new LinkedHashMap<>();
        Element meta = firstChild(metaDoc.getDocumentElement(), NS_OFFICE, "meta");
        if (meta == null) {
            return metadata;
        }
        for (Element field : childElements(meta)) {
            String key = field.getLocalName();
            if ("user-defined".equals(key) && NS_META.equals(field.getNamespaceURI())) {
                key = "user-defined:" + field.getAttributeNS(NS_META, "name");
            }
            String value = normalizeWhitespace(field.getTextContent());
            // Repeated fields (keywords) are joined
            metadata.merge(key, value, (existing, added) -> existing + ", " + added);
        }
        return metadata;
    }

    private static void collectStyles(Document doc, String containerName, boolean automatic,
                                      Map<String, StyleDefinition> target) {
        Element container = firstChild(doc.getDocumentElement(), NS_OFFICE, containerName);
        if (container == null) {
            return;
        }
        for (Element style : childElements(container)) {
            if (!NS_STYLE.equals(style.getNamespaceURI()) || !"style".equals(style.getLocalName())) {
                continue;
            }
            String name = style.getAttributeNS(NS_STYLE, "name");
            if (name.isEmpty()) {
                continue;
            }
            Map<String, String> properties = new LinkedHashMap<>();
            for (Element child : childElements(style)) {
                if (!NS_STYLE.equals(child.getNamespaceURI())) {
                    continue;
                }
                if ("text-properties".equals(child.getLocalName())) {
                    copyAttributes(child, "text:", properties);
                } else if ("paragraph-properties".equals(child.getLocalName())) {
                    copyAttributes(child, "paragraph:", properties);
                }
            }
            String parent = style.getAttributeNS(NS_STYLE, "parent-style-name");
            target.putIfAbsent(name, new StyleDefinition(
                    name,
                    style.getAttributeNS(NS_STYLE, "family"),
                    parent.isEmpty() ? null : parent,
                    automatic,
                    properties));
        }
    }

    private static void copyAttributes(Element element, String prefix, Map<String, String> target) {
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            String localName = attr.getLocalName() != null ? attr.getLocalName() : attr.getName();
            target.putIfAbsent(prefix + localName, attr.getValue());
        }
    }

    private static void collectFonts(Document doc, Set<String> fonts) {
        Element decls = firstChild(doc.getDocumentElement(), NS_OFFICE, "font-face-decls");
        if (decls == null) {
            return;
        }
        for (Element face : childElements(decls)) {
            if (NS_STYLE.equals(face.getNamespaceURI()) && "font-face".equals(face.getLocalName())) {
                String name = face.getAttributeNS(NS_STYLE, "name");
                if (!name.isEmpty()) {
                    fonts.add(name);
                }
            }
        }
    }

    private static List<Heading> extractHeadings(Document contentDoc) {
        List<Heading> headings = new ArrayList<>();
        Element body = firstChild(contentDoc.getDocumentElement(), NS_OFFICE, "body");
        if (body == null) {
            return headings;
        }
        NodeList nodes = body.getElementsByTagNameNS(NS_TEXT, "h");
        for (int i = 0; i < nodes.getLength(); i++) {
            Element heading = (Element) nodes.item(i);
            headings.add(new Heading(i, outlineLevel(heading), normalizeWhitespace(heading.getTextContent())));
        }
        return headings;
    }

    private static int outlineLevel(Element heading) {
        String level = heading.getAttributeNS(NS_TEXT, "outline-level");
        if (level.isEmpty()) {
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(level.trim()));
        } catch (NumberFormatException e) {
            throw new MalformedDocumentException("Invalid outline level: " + level, e);
        }
    }

    private static Element firstChild(Element parent, String namespace, String localName) {
        for (Element child : childElements(parent)) {
            if (namespace.equals(child.getNamespaceURI()) && localName.equals(child.getLocalName())) {
                return child;
            }
        }
        return null;
    }

    private static List<Element> childElements(Element parent) {
        List<Element> elements = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    private static String normalizeWhitespace(String value) {
        return value == null ? "" : value.trim().replaceAll("\\s+", " ");
    }

    private record PackageContents(Map<String, byte[]> parts, List<String> entryNames) {
    }
}
