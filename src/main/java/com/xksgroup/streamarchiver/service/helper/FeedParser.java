package com.xksgroup.streamarchiver.service.helper;

import com.xksgroup.streamarchiver.exception.FeedFetchException;
import com.xksgroup.streamarchiver.model.FeedEntry;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the Atom upload feed of a channel.
 */
public final class FeedParser {

    private FeedParser() {
    }

    public static List<FeedEntry> parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new FeedFetchException("Empty feed document");
        }
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(false);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder db = dbf.newDocumentBuilder();
            Document doc = db.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
            doc.getDocumentElement().normalize();

            List<FeedEntry> entries = new ArrayList<>();
            NodeList nodes = doc.getElementsByTagName("entry");
            for (int i = 0; i < nodes.getLength(); i++) {
                Element e = (Element) nodes.item(i);
                String summary = text(e, "media:description");
                if (summary.isEmpty()) summary = text(e, "summary");
                if (summary.isEmpty()) summary = text(e, "content");
                entries.add(new FeedEntry(
                        text(e, "title"),
                        summary,
                        attrOf(e, "link", "href"),
                        text(e, "yt:videoId"),
                        text(e, "name")));
            }
            return entries;
        } catch (FeedFetchException e) {
            throw e;
        } catch (Exception e) {
            throw new FeedFetchException("Failed to parse feed: " + e.getMessage(), e);
        }
    }

    private static String text(Element parent, String tag) {
        NodeList nl = parent.getElementsByTagName(tag);
        if (nl.getLength() == 0) return "";
        String content = nl.item(0).getTextContent();
        return content != null ? content.trim() : "";
    }

    private static String attrOf(Element parent, String tag, String attr) {
        NodeList nl = parent.getElementsByTagName(tag);
        for (int i = 0; i < nl.getLength(); i++) {
            Element link = (Element) nl.item(i);
            String rel = link.getAttribute("rel");
            if (rel.isEmpty() || "alternate".equals(rel)) {
                return link.getAttribute(attr);
            }
        }
        return "";
    }
}
