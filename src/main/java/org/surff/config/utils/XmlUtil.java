package org.surff.config.utils;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.Unmarshaller;
import org.w3c.dom.Document;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.InputStream;

public class XmlUtil {

    private XmlUtil() {}

    /**
     * Parses a stream into a DOM. DTDs and external entities are refused.
     */
    public static Document parse(InputStream in) throws Exception {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbf.setExpandEntityReferences(false);
        DocumentBuilder builder = dbf.newDocumentBuilder();
        return builder.parse(in);
    }

    /**
     * Convert XML → Java object of the given JAXB-annotated type.
     */
    public static <T> T unmarshal(Document xmlDoc, Class<T> type) throws Exception {
        JAXBContext ctx = JAXBContext.newInstance(type);
        Unmarshaller um = ctx.createUnmarshaller();
        return um.unmarshal(xmlDoc, type).getValue();
    }
}
