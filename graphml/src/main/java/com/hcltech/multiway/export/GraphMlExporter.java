package com.hcltech.multiway.export;

import com.hcltech.multiway.Edge;
import com.hcltech.multiway.GraphView;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamWriter2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import java.io.IOException;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GraphML writer on Woodstox. Keys are declared per domain ({@code graph}, {@code node},
 * {@code edge}) with ids {@code d0, d1, ...}; nodes and edges are written in graph order.
 */
public final class GraphMlExporter implements GraphExporter {
    private static final Logger log = LoggerFactory.getLogger(GraphMlExporter.class);

    static final String NS = "http://graphml.graphdrawing.org/xmlns";
    static final String XSI = "http://www.w3.org/2001/XMLSchema-instance";
    static final String SCHEMA = NS + " http://graphml.graphdrawing.org/xmlns/1.0/graphml.xsd";

    private static final ThreadLocal<XMLOutputFactory2> FACTORY = ThreadLocal.withInitial(() -> {
        XMLOutputFactory2 f = (XMLOutputFactory2) XMLOutputFactory.newInstance();
        f.setProperty(XMLOutputFactory.IS_REPAIRING_NAMESPACES, Boolean.FALSE);
        f.setProperty(XMLOutputFactory2.P_AUTOMATIC_EMPTY_ELEMENTS, Boolean.TRUE);
        return f;
    });

    @Override
    public String format() {
        return "graphml";
    }

    @Override
    public String extension() {
        return "graphml";
    }

    @Override
    public <N> void write(GraphView<N> view, OutputStream out) throws IOException {
        XMLStreamWriter2 w = null;
        try {
            w = (XMLStreamWriter2) FACTORY.get().createXMLStreamWriter(out, "UTF-8");
            writeDocument(view, w);
            w.flush();
        } catch (XMLStreamException e) {
            throw new IOException("GraphML serialisation failed: " + e.getMessage(), e);
        } finally {
            if (w != null) {
                try {
                    w.close();
                } catch (XMLStreamException e) {
                    log.warn("Failed to close GraphML writer: {}", e.getMessage());
                }
            }
        }
    }

    private <N> void writeDocument(GraphView<N> view, XMLStreamWriter2 w) throws XMLStreamException {
        Map<String, Object> graphAttrs = GraphMetadata.attributes(view);
        AttributeKeys graphKeys = new AttributeKeys();
        graphKeys.add(graphAttrs);
        AttributeKeys nodeKeys = new AttributeKeys();
        for (N n : view.graph().nodes()) nodeKeys.add(view.nodes().attributes(n));
        AttributeKeys edgeKeys = new AttributeKeys();
        for (Edge<N> e : view.graph().edges()) edgeKeys.add(view.edges().attributes(e));

        w.writeStartDocument("UTF-8", "1.0");
        w.setDefaultNamespace(NS);
        w.setPrefix("xsi", XSI);
        w.writeStartElement("graphml");
        w.writeDefaultNamespace(NS);
        w.writeNamespace("xsi", XSI);
        w.writeAttribute("xsi", XSI, "schemaLocation", SCHEMA);

        int[] next = {0};
        Map<String, String> graphIds = declareKeys(w, "graph", graphKeys, next);
        Map<String, String> nodeIds = declareKeys(w, "node", nodeKeys, next);
        Map<String, String> edgeIds = declareKeys(w, "edge", edgeKeys, next);

        w.writeStartElement("graph");
        w.writeAttribute("id", view.name());
        w.writeAttribute("edgedefault", view.directed() ? "directed" : "undirected");
        writeData(w, graphIds, graphAttrs);

        for (N n : view.graph().nodes()) {
            w.writeStartElement("node");
            w.writeAttribute("id", view.nodes().id(n));
            writeData(w, nodeIds, view.nodes().attributes(n));
            w.writeEndElement();
        }
        for (Edge<N> e : view.graph().edges()) {
            w.writeStartElement("edge");
            w.writeAttribute("source", view.nodes().id(e.from()));
            w.writeAttribute("target", view.nodes().id(e.to()));
            writeData(w, edgeIds, view.edges().attributes(e));
            w.writeEndElement();
        }
        w.writeEndElement(); // graph
        w.writeEndElement(); // graphml
        w.writeEndDocument();
        log.debug("GraphML '{}': {} nodes, {} edges", view.name(), view.nodeCount(), view.edgeCount());
    }

    private static Map<String, String> declareKeys(XMLStreamWriter2 w, String domain, AttributeKeys keys, int[] next)
            throws XMLStreamException {
        Map<String, String> ids = new LinkedHashMap<>();
        for (var en : keys.types().entrySet()) {
            String id = "d" + next[0]++;
            ids.put(en.getKey(), id);
            w.writeEmptyElement("key");
            w.writeAttribute("id", id);
            w.writeAttribute("for", domain);
            w.writeAttribute("attr.name", en.getKey());
            w.writeAttribute("attr.type", en.getValue());
        }
        return ids;
    }

    private static void writeData(XMLStreamWriter2 w, Map<String, String> ids, Map<String, Object> attrs)
            throws XMLStreamException {
        for (var en : attrs.entrySet()) {
            w.writeStartElement("data");
            w.writeAttribute("key", ids.get(en.getKey()));
            w.writeCharacters(String.valueOf(en.getValue()));
            w.writeEndElement();
        }
    }
}
