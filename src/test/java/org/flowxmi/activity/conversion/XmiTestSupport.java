package org.flowxmi.activity.conversion;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads serialized XMI back into a DOM for assertions.
 */
public class XmiTestSupport {

    public static Document parse(String xmi) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            return factory.newDocumentBuilder().parse(new org.xml.sax.InputSource(new StringReader(xmi)));
        } catch (Exception e) {
            throw new RuntimeException("Failed to parse XMI", e);
        }
    }

    public static List<Element> elements(Document doc, String tagName) {
        NodeList list = doc.getElementsByTagName(tagName);
        List<Element> result = new ArrayList<>();
        for (int i = 0; i < list.getLength(); i++) {
            result.add((Element) list.item(i));
        }
        return result;
    }

    /** {@code node} elements of the UML model with the given {@code xmi:type}. */
    public static List<Element> modelNodes(Document doc, String umlType) {
        return elements(doc, "node").stream()
                .filter(e -> umlType.equals(e.getAttribute("xmi:type")))
                .toList();
    }

    /** Control flow {@code edge} elements of the UML model. */
    public static List<Element> modelEdges(Document doc) {
        return elements(doc, "edge");
    }

    /** Diagram objects, i.e. {@code element} children carrying a {@code subject}. */
    public static List<Element> diagramObjects(Document doc) {
        return elements(doc, "element").stream()
                .filter(e -> e.hasAttribute("subject"))
                .toList();
    }
}
