package com.nasexporter.collectors.nifcloud;

import com.nasexporter.collectors.api.FetchErrorKind;
import com.nasexporter.collectors.api.MetricFetchException;
import com.nasexporter.core.model.DataPoint;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the XML body of a {@code GetMetricStatistics} response.
 */
public final class MetricStatisticsParser {
    // RFC 3339 date-time: seconds required, fraction optional, offset or Z required.
    private static final DateTimeFormatter RFC_3339 = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendOffset("+HH:MM", "Z")
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern NOT_A_NUMBER = Pattern.compile("(?i)nan");
    private static final Pattern INFINITY = Pattern.compile("(?i)[+-]?inf(inity)?");

    private MetricStatisticsParser() {
    }

    public static List<DataPoint> parseDatapoints(String xml) {
        Element root = parseDocument(xml).getDocumentElement();
        if ("ErrorResponse".equals(localName(root))) {
            throw new MetricFetchException(FetchErrorKind.TRANSPORT, "API error " + describeError(root));
        }

        List<DataPoint> points = new ArrayList<>();
        for (Element datapoints : descendants(root, "Datapoints")) {
            for (Element member : children(datapoints, "member")) {
                points.add(toDataPoint(member));
            }
        }
        return points;
    }

    /**
     * Best-effort summary of an error body, used when the API answers with a non-2xx status.
     */
    public static Optional<String> errorSummary(String xml) {
        if (xml == null || xml.isBlank()) {
            return Optional.empty();
        }
        try {
            Element root = parseDocument(xml).getDocumentElement();
            return Optional.of(describeError(root));
        } catch (MetricFetchException notXml) {
            return Optional.empty();
        }
    }

    private static DataPoint toDataPoint(Element member) {
        String rawTimestamp = childText(member, "Timestamp")
                .orElseThrow(() -> new MetricFetchException(FetchErrorKind.PARSE_FAILURE, "datapoint has no Timestamp"));
        String rawSum = childText(member, "Sum")
                .orElseThrow(() -> new MetricFetchException(FetchErrorKind.PARSE_FAILURE, "datapoint has no Sum"));

        Instant timestamp;
        try {
            timestamp = OffsetDateTime.parse(rawTimestamp, RFC_3339).toInstant();
        } catch (DateTimeParseException e) {
            throw new MetricFetchException(FetchErrorKind.PARSE_FAILURE,
                    "could not parse timestamp \"" + rawTimestamp + "\"", e);
        }
        return new DataPoint(timestamp, parseSum(rawSum));
    }

    static double parseSum(String raw) {
        if (DECIMAL.matcher(raw).matches()) {
            return Double.parseDouble(raw);
        }
        if (NOT_A_NUMBER.matcher(raw).matches()) {
            return Double.NaN;
        }
        if (INFINITY.matcher(raw).matches()) {
            return raw.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        throw new MetricFetchException(FetchErrorKind.PARSE_FAILURE, "could not parse sum \"" + raw + "\"");
    }

    private static String describeError(Element root) {
        String code = descendants(root, "Code").stream().findFirst().map(MetricStatisticsParser::text).orElse("Unknown");
        String message = descendants(root, "Message").stream().findFirst().map(MetricStatisticsParser::text).orElse("");
        return message.isEmpty() ? code : code + ": " + message;
    }

    private static Document parseDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(true);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                }

                @Override
                public void error(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }
            });
            return builder.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new MetricFetchException(FetchErrorKind.TRANSPORT, "malformed API response: " + e.getMessage(), e);
        }
    }

    private static List<Element> descendants(Element parent, String name) {
        NodeList nodes = parent.getElementsByTagNameNS("*", name);
        List<Element> elements = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element) {
                elements.add(element);
            }
        }
        return elements;
    }

    private static List<Element> children(Element parent, String name) {
        NodeList nodes = parent.getChildNodes();
        List<Element> elements = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element element && name.equals(localName(element))) {
                elements.add(element);
            }
        }
        return elements;
    }

    private static Optional<String> childText(Element parent, String name) {
        return children(parent, name).stream().findFirst().map(MetricStatisticsParser::text);
    }

    private static String text(Element element) {
        String content = element.getTextContent();
        return content == null ? "" : content.trim();
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }
}
