package com.waypoint.core.compiler;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.model.ComparisonOperator;
import com.waypoint.core.model.PlanNode;
import com.waypoint.core.model.TaskPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses behaviour-tree plan XML into a {@link TaskPlan}.
 * <p>
 * Reads the first {@code BehaviorTree} element (in any namespace) and its root {@code Sequence}.
 * Everything outside the tree (mission metadata, task descriptions) is ignored.
 */
@Component
public class TaskPlanParser {

    private static final Logger log = LoggerFactory.getLogger(TaskPlanParser.class);

    private final Set<String> actionTypes;

    @Autowired
    public TaskPlanParser(WaypointProperties properties) {
        this(properties.getPlan().getActionTypes());
    }

    public TaskPlanParser(List<String> actionTypes) {
        this.actionTypes = new LinkedHashSet<>(actionTypes);
    }

    /**
     * @throws PlanParseException        if the text is not a well-formed plan
     * @throws UnknownNodeKindException  if the tree uses an element this parser does not know
     */
    public TaskPlan parse(String xml) {
        Document document = readDocument(xml);

        NodeList trees = document.getElementsByTagNameNS("*", "BehaviorTree");
        if (trees.getLength() == 0) {
            throw new PlanParseException("Plan has no BehaviorTree element");
        }
        Element tree = (Element) trees.item(0);
        Element rootSequence = childElements(tree).stream()
                .filter(e -> "Sequence".equals(localName(e)))
                .findFirst()
                .orElseThrow(() -> new PlanParseException("BehaviorTree has no root Sequence"));

        PlanNode root = parseNode(rootSequence);
        log.debug("Parsed plan with root {}", root.getClass().getSimpleName());
        return new TaskPlan(root, xml);
    }

    private Document readDocument(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new PlanParseException("Plan text is empty");
        }
        try {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            var builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml.strip())));
        } catch (SAXException e) {
            throw new PlanParseException("Plan XML is malformed: " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new PlanParseException("Failed to read plan XML: " + e.getMessage(), e);
        }
    }

    private PlanNode parseNode(Element element) {
        String tag = localName(element);
        switch (tag) {
            case "Sequence":
                return new PlanNode.Sequence(parseChildren(element));
            case "Fallback":
                return new PlanNode.Fallback(parseChildren(element));
            case "Parallel":
                return new PlanNode.Parallel(parseChildren(element));
            case "AssertTrue":
                return new PlanNode.AssertTrue(variableRef(requireAttribute(element, "result")));
            case "CheckValue":
                return parseCheckValue(element);
            default:
                if (actionTypes.contains(tag)) {
                    return new PlanNode.ActionLeaf(requireAttribute(element, "name"), tag);
                }
                log.error("Unknown tag in plan: {}", tag);
                throw new UnknownNodeKindException(tag);
        }
    }

    private PlanNode.CheckValue parseCheckValue(Element element) {
        String value = variableRef(requireAttribute(element, "value"));
        String rawThreshold = requireAttribute(element, "threshold").trim();
        String comp = requireAttribute(element, "comp");

        int threshold;
        try {
            threshold = Integer.parseInt(rawThreshold);
        } catch (NumberFormatException e) {
            throw new PlanParseException("CheckValue threshold must be an integer, got '" + rawThreshold + "'", e);
        }
        try {
            return new PlanNode.CheckValue(value, threshold, ComparisonOperator.fromCode(comp));
        } catch (IllegalArgumentException e) {
            throw new PlanParseException("CheckValue has unknown comparator '" + comp
                    + "' (expected one of lt, lte, gt, gte, eq, neq)", e);
        }
    }

    private List<PlanNode> parseChildren(Element element) {
        var children = new ArrayList<PlanNode>();
        for (Element child : childElements(element)) {
            children.add(parseNode(child));
        }
        return children;
    }

    private static String requireAttribute(Element element, String name) {
        String value = element.getAttribute(name);
        if (value == null || value.isBlank()) {
            throw new PlanParseException(localName(element) + " element is missing required attribute '" + name + "'");
        }
        return value;
    }

    /**
     * Strips the blackboard braces from {@code {var}} references.
     */
    static String variableRef(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        if (trimmed.isEmpty()) {
            throw new PlanParseException("Empty variable reference '" + raw + "'");
        }
        return trimmed;
    }

    private static List<Element> childElements(Element parent) {
        var result = new ArrayList<Element>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }
}
