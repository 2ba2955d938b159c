import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one record element of the dump into a {@link DblpRecord}.
 * Not thread-safe, use one instance per traversal.
 */
public class RecordExtractor {

    // Markup inside titles (<i>, <sub>, <sup>, ...) and line breaks
    private static final Pattern MARKUP = Pattern.compile("<.*?>|\\n");
    private static final Pattern CHARACTER_REFERENCE = Pattern.compile("&#(?:[xX]([0-9a-fA-F]{1,6})|([0-9]{1,7}));");

    private final Transformer serializer;

    public RecordExtractor() {
        Transformer transformer = null;
        try {
            transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
        } catch (TransformerConfigurationException e) {
            System.err.println("WARNING: No XML serializer available, titles are read as plain text: " + e.getMessage());
        }
        serializer = transformer;
    }

    public DblpRecord extract(Element element, FieldSelection fields, boolean includeMetadata) throws MissingAttributeException {
        String type = element.getTagName();
        String key = null;
        String mdate = null;

        if (includeMetadata) {
            key = requireAttribute(element, DblpRecord.KEY);
            mdate = requireAttribute(element, DblpRecord.MDATE);
        }

        // Every requested field is present, even if the record does not have it
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, List<String>> lists = new LinkedHashMap<>();
        for (String field : fields) {
            if (FeatureSchema.cardinalityOf(field) == FeatureSchema.Cardinality.MULTI) {
                lists.put(field, new ArrayList<>());
                values.put(field, List.of());
            } else {
                values.put(field, "");
            }
        }

        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element child = (Element) node;
            String tag = child.getTagName();

            if (!FeatureSchema.isValidField(tag)) {
                System.err.printf("WARNING: Unknown field <%s> in record <%s> %s, skipping it.%n",
                        tag, type, element.getAttribute(DblpRecord.KEY));
                continue;
            }
            if (!fields.contains(tag)) {
                continue;
            }

            String text = textOf(child);
            if (text == null || text.isEmpty()) {
                continue;
            }

            if (FeatureSchema.cardinalityOf(tag) == FeatureSchema.Cardinality.MULTI) {
                lists.get(tag).add(text);
            } else {
                values.put(tag, text);
            }
        }

        lists.forEach((field, list) -> values.put(field, List.copyOf(list)));

        return new DblpRecord(type, key, mdate, values);
    }

    private String textOf(Element child) {
        switch (child.getTagName()) {
            case "title":
                return plainTitle(child);
            case "pages":
                return PageCounter.count(child.getTextContent());
            default:
                return child.getTextContent();
        }
    }

    String plainTitle(Element title) {
        if (serializer == null) {
            return title.getTextContent();
        }
        try {
            StringWriter writer = new StringWriter();
            serializer.transform(new DOMSource(title), new StreamResult(writer));
            return unescape(MARKUP.matcher(writer.toString()).replaceAll(""));
        } catch (TransformerException e) {
            System.err.println("WARNING: Could not serialize title, using its text instead: " + e.getMessage());
            return title.getTextContent();
        }
    }

    // Serialization escapes the predefined entities, carriage returns and characters outside the BMP
    private static String unescape(String s) {
        if (s.indexOf('&') < 0) {
            return s;
        }
        String decoded = CHARACTER_REFERENCE.matcher(s).replaceAll(m -> {
            int codePoint = m.group(1) != null
                    ? Integer.parseInt(m.group(1), 16)
                    : Integer.parseInt(m.group(2));
            return Matcher.quoteReplacement(new String(Character.toChars(codePoint)));
        });
        return decoded.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }

    private static String requireAttribute(Element element, String name) throws MissingAttributeException {
        if (!element.hasAttribute(name)) {
            throw new MissingAttributeException(element.getTagName(), name);
        }
        return element.getAttribute(name);
    }
}
