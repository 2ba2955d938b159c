import me.tongfei.progressbar.ConsoleProgressBarConsumer;
import me.tongfei.progressbar.ProgressBar;
import me.tongfei.progressbar.ProgressBarBuilder;
import me.tongfei.progressbar.ProgressBarStyle;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Stack;
import java.util.zip.GZIPInputStream;

// Single pass over the top-level records of a dblp dump.
// Each record is built into its own DOM fragment and cleared once the next one is requested,
// so returned elements must not be kept across calls to next().
public class DblpReader implements Iterator<Element>, Closeable {

    private static final int MAX_CONSOLE_WIDTH = 80;

    private final InputStream input;
    private final XMLStreamReader reader;
    private final DocumentBuilder documentBuilder;
    private final Stack<Node> path = new Stack<>();

    private Document fragment;
    private Element next;
    private Element current;

    private boolean isCaptureActive = false;
    private boolean finished = false;
    private int depth = 0;

    private long residentNodes = 0;
    private long peakResidentNodes = 0;
    private long recordCount = 0;

    public DblpReader(InputStream input, String systemId) {
        this.input = input;

        // The dblp DTD declares a lot of character entities
        System.setProperty("entityExpansionLimit", "2500000");

        try {
            documentBuilder = DocumentBuilderFactory.newInstance().newDocumentBuilder();

            XMLInputFactory factory = XMLInputFactory.newInstance();
            factory.setProperty(XMLInputFactory.SUPPORT_DTD, true);
            factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, true);
            factory.setProperty(XMLInputFactory.IS_REPLACING_ENTITY_REFERENCES, true);
            factory.setProperty(XMLInputFactory.IS_COALESCING, true);
            factory.setProperty(XMLInputFactory.IS_VALIDATING, false);

            reader = systemId == null
                    ? factory.createXMLStreamReader(input)
                    : factory.createXMLStreamReader(systemId, input);
        } catch (ParserConfigurationException | XMLStreamException e) {
            closeQuietly();
            throw new LoadFailureException("Failed to open dblp XML stream: " + e.getMessage(), e);
        }
    }

    // Files ending in .gz are decompressed on the fly, dblp.dtd is expected next to the file
    public static DblpReader open(Path file, boolean showProgress) {
        Path dtd = file.toAbsolutePath().resolveSibling("dblp.dtd");
        if (!Files.exists(dtd)) {
            System.err.printf("WARNING: File 'dblp.dtd' not found next to '%s'. Entities declared there cannot be resolved.%n", file);
        }

        InputStream fileStream = null;
        InputStream is;
        try {
            fileStream = new FileInputStream(file.toFile());
            if (showProgress) {
                ProgressBarBuilder pbb = new ProgressBarBuilder()
                        .setTaskName("dblp")
                        .setConsumer(new ConsoleProgressBarConsumer(System.out, MAX_CONSOLE_WIDTH))
                        .continuousUpdate()
                        .setUnit("MB", 1_048_576)
                        .setStyle(ProgressBarStyle.ASCII);
                fileStream = ProgressBar.wrap(fileStream, pbb);
            }

            // If XML input file is still compressed, transparently uncompress it
            is = file.getFileName().toString().endsWith(".gz")
                    ? new GZIPInputStream(new BufferedInputStream(fileStream))
                    : new BufferedInputStream(fileStream);
        } catch (IOException e) {
            if (fileStream != null) {
                try {
                    fileStream.close();
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new LoadFailureException("Failed to load file '" + file + "': " + e.getMessage(), e);
        }

        return new DblpReader(is, file.toAbsolutePath().toUri().toString());
    }

    @Override
    public boolean hasNext() {
        if (next == null && !finished) {
            advance();
        }
        return next != null;
    }

    @Override
    public Element next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        current = next;
        next = null;
        return current;
    }

    public long recordCount() {
        return recordCount;
    }

    // Nodes of the record currently held in memory
    public long residentNodes() {
        return residentNodes;
    }

    public long peakResidentNodes() {
        return peakResidentNodes;
    }

    private void advance() {
        release();
        try {
            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT:
                        startElement();
                        break;
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.CDATA:
                    case XMLStreamConstants.SPACE:
                    case XMLStreamConstants.ENTITY_REFERENCE:
                        characters();
                        break;
                    case XMLStreamConstants.END_ELEMENT:
                        if (endElement()) {
                            return;
                        }
                        break;
                    default:
                        break;
                }
            }
            finished = true;
        } catch (XMLStreamException e) {
            finished = true;
            throw new LoadFailureException("Malformed dblp XML near line "
                    + (e.getLocation() == null ? "?" : e.getLocation().getLineNumber()) + ": " + e.getMessage(), e);
        }
    }

    private void startElement() {
        depth++;

        String name = reader.getLocalName();
        if (depth == 2) {
            // Only look at record types, other top-level children are never built
            isCaptureActive = FeatureSchema.isRecordType(name);
            if (isCaptureActive) {
                fragment = documentBuilder.newDocument();
                path.push(fragment);
            }
        }

        if (depth >= 2 && isCaptureActive) {
            Element element = fragment.createElement(name);
            residentNodes++;

            int attrLen = reader.getAttributeCount();
            for (int i = 0; i < attrLen; i++) {
                element.setAttribute(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
            }

            path.peek().appendChild(element);
            path.push(element);
            peakResidentNodes = Math.max(peakResidentNodes, residentNodes);
        }
    }

    private void characters() {
        // Text directly below the root element is only indentation
        if (isCaptureActive && depth >= 2) {
            path.peek().appendChild(fragment.createTextNode(reader.getText()));
            residentNodes++;
            peakResidentNodes = Math.max(peakResidentNodes, residentNodes);
        }
    }

    // true once a complete record is ready
    private boolean endElement() {
        boolean recordDone = false;
        if (isCaptureActive) {
            path.pop();
            if (depth == 2) {
                next = fragment.getDocumentElement();
                path.clear();
                isCaptureActive = false;
                recordCount++;
                recordDone = true;
            }
        }
        depth--;
        return recordDone;
    }

    // Drops the previously returned record so it can be garbage collected
    private void release() {
        if (current != null) {
            while (current.hasChildNodes()) {
                current.removeChild(current.getFirstChild());
            }
            NamedNodeMap attributes = current.getAttributes();
            while (attributes.getLength() > 0) {
                current.removeAttribute(attributes.item(0).getNodeName());
            }
            current = null;
        }
        fragment = null;
        residentNodes = 0;
    }

    @Override
    public void close() throws IOException {
        release();
        finished = true;
        try {
            if (reader != null) {
                reader.close();
            }
        } catch (XMLStreamException e) {
            throw new IOException("Failed to close dblp XML stream", e);
        } finally {
            input.close();
        }
    }

    private void closeQuietly() {
        try {
            input.close();
        } catch (IOException e) {
            System.err.println("WARNING: Could not close dblp input: " + e.getMessage());
        }
    }
}
