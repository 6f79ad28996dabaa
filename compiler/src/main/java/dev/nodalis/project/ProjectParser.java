package dev.nodalis.project;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * DOM parser for IEC project XML into a {@link Project}. The document is read
 * without namespace processing so that {@code xsi:type} is an ordinary
 * attribute name.
 */
public final class ProjectParser {

    private static final Logger logger = LogManager.getLogger(ProjectParser.class);

    public Project parse(String xml) throws MalformedProjectException {
        Objects.requireNonNull(xml, "xml");
        Document doc = load(xml);
        Element root = doc.getDocumentElement();
        if (root == null || !"Project".equals(root.getTagName())) {
            throw new MalformedProjectException("Expected a <Project> root element but found <"
                    + (root == null ? "" : root.getTagName()) + ">");
        }

        ProjectTypes types = parseTypes(root);
        MappingTable mappingTable = parseMappingTable(root);

        List<Configuration> configurations = new ArrayList<>();
        for (Element configuration : elements(root, "Configuration")) {
            configurations.add(parseConfiguration(configuration, types, mappingTable));
        }
        if (configurations.isEmpty()) {
            throw new MalformedProjectException("The project declares no configuration");
        }
        logger.debug("Parsed project with {} configuration(s), {} program(s), {} function block(s)",
                configurations.size(), types.getPrograms().size(), types.getFunctionBlocks().size());
        return new Project(configurations, types, mappingTable);
    }

    private static Document load(String xml) throws MalformedProjectException {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(false);
        f.setIgnoringComments(true);
        f.setCoalescing(true);
        f.setExpandEntityReferences(false);
        try {
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder b = f.newDocumentBuilder();
            b.setErrorHandler(new DefaultHandler());
            return b.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException e) {
            throw new MalformedProjectException("XML parser could not be configured", e);
        } catch (SAXException e) {
            throw new MalformedProjectException("Project file is not well-formed XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MalformedProjectException("Project file could not be read: " + e.getMessage(), e);
        }
    }

    private ProjectTypes parseTypes(Element root) throws MalformedProjectException {
        List<ProgramDefinition> programs = new ArrayList<>();
        for (Element program : elements(root, "Program")) {
            String name = requiredAttr(program, "name");
            programs.add(new ProgramDefinition(name,
                    variables(child(program, "Vars")),
                    parseBody(name, child(program, "MainBody"))));
        }
        List<FunctionBlockDefinition> functionBlocks = new ArrayList<>();
        for (Element block : elements(root, "FunctionBlock")) {
            String name = requiredAttr(block, "name");
            Element parameters = child(block, "Parameters");
            Element inputs = parameters == null ? null : child(parameters, "InputVars");
            Element outputs = parameters == null ? null : child(parameters, "OutputVars");
            functionBlocks.add(new FunctionBlockDefinition(name,
                    variables(inputs),
                    variables(outputs),
                    variables(child(block, "Vars")),
                    parseBody(name, child(block, "MainBody"))));
        }
        return new ProjectTypes(programs, functionBlocks);
    }

    private PouBody parseBody(String owner, Element mainBody) throws MalformedProjectException {
        Element content = mainBody == null ? null : child(mainBody, "BodyContent");
        if (content == null) {
            return new TextBody("");
        }
        String language = attrOr(content, "xsi:type", "ST");
        switch (language) {
            case "ST": {
                Element st = child(content, "ST");
                return new TextBody(st == null ? "" : st.getTextContent());
            }
            case "LD": {
                List<Rung> rungs = new ArrayList<>();
                for (Element rung : elements(content, "Rung")) {
                    rungs.add(parseRung(rung));
                }
                return new LadderBody(owner, rungs);
            }
            case "FBD":
                return new DiagramBody(owner, elements(content, "Network").size());
            default:
                throw new MalformedProjectException(owner + " has a body in unknown language '" + language + "'");
        }
    }

    private Rung parseRung(Element rung) throws MalformedProjectException {
        int order = intAttr(rung, "evaluationOrder");
        List<LadderElement> objects = new ArrayList<>();
        for (Element ld : elements(rung, "LdObject")) {
            String type = attrOr(ld, "xsi:type", "Contact");
            objects.add(new LadderElement(
                    LadderElement.kindOf(type),
                    type,
                    attrOrNull(ld, "operand"),
                    attrOrNull(ld, "operand1"),
                    attrOrNull(ld, "operand2"),
                    attrOrNull(ld, "compareOperator"),
                    "true".equalsIgnoreCase(ld.getAttribute("negated")),
                    latch(ld.getAttribute("latch")),
                    inputRefs(ld),
                    outputIds(ld)));
        }
        for (Element fbd : elements(rung, "FbdObject")) {
            String type = attrOr(fbd, "typeName", attrOr(fbd, "xsi:type", "FbdObject"));
            objects.add(new LadderElement(LadderElement.Kind.BLOCK, type, null, null, null, null,
                    false, LadderElement.Latch.NONE, inputRefs(fbd), outputIds(fbd)));
        }
        return new Rung(order, objects);
    }

    private static LadderElement.Latch latch(String value) {
        if ("set".equalsIgnoreCase(value)) {
            return LadderElement.Latch.SET;
        }
        if ("reset".equalsIgnoreCase(value)) {
            return LadderElement.Latch.RESET;
        }
        return LadderElement.Latch.NONE;
    }

    private static List<String> inputRefs(Element object) {
        List<String> refs = new ArrayList<>();
        for (Element point : elements(object, "ConnectionPointIn")) {
            for (Element connection : elements(point, "Connection")) {
                String ref = connection.getAttribute("refConnectionPointOutId");
                if (!ref.isEmpty()) {
                    refs.add(ref);
                }
            }
        }
        return refs;
    }

    private static List<String> outputIds(Element object) {
        List<String> ids = new ArrayList<>();
        for (Element point : elements(object, "ConnectionPointOut")) {
            String id = point.getAttribute("connectionPointOutId");
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static MappingTable parseMappingTable(Element root) {
        Element table = child(root, "MappingTable");
        if (table == null) {
            return MappingTable.empty();
        }
        List<MappingEntry> entries = new ArrayList<>();
        for (Element map : elements(table, "Map")) {
            entries.add(new MappingEntry(
                    map.getAttribute("ModuleID"),
                    map.getAttribute("ModulePort"),
                    map.getAttribute("Protocol"),
                    map.getAttribute("RemoteAddress"),
                    map.getAttribute("RemoteSize"),
                    map.getAttribute("InternalAddress"),
                    map.getAttribute("Resource"),
                    map.getAttribute("PollTime"),
                    map.getAttribute("ProtocolProperties")));
        }
        return new MappingTable(entries);
    }

    private Configuration parseConfiguration(Element configuration, ProjectTypes types, MappingTable mappingTable)
            throws MalformedProjectException {
        String name = requiredAttr(configuration, "name");
        List<Resource> resources = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Element resource : elements(configuration, "Resource")) {
            String resourceName = requiredAttr(resource, "name");
            if (!seen.add(resourceName)) {
                throw new MalformedProjectException("Configuration " + name + " declares resource "
                        + resourceName + " more than once");
            }
            List<TaskDeclaration> tasks = new ArrayList<>();
            for (Element task : elements(resource, "Task")) {
                tasks.add(new TaskDeclaration(requiredAttr(task, "name"),
                        attrOr(task, "interval", "1000"),
                        attrOr(task, "priority", "1")));
            }
            List<ProgramInstanceDeclaration> instances = new ArrayList<>();
            for (Element instance : elements(resource, "ProgramInstance")) {
                instances.add(new ProgramInstanceDeclaration(
                        attrOr(instance, "name", ""),
                        requiredAttr(instance, "typeName"),
                        attrOr(instance, "associatedTaskName", "")));
            }
            resources.add(new Resource(resourceName,
                    attrOr(resource, "resourceTypeName", ""),
                    variables(child(resource, "GlobalVars")),
                    tasks,
                    instances,
                    types,
                    mappingTable));
        }
        return new Configuration(name, resources);
    }

    private static List<ProjectVariable> variables(Element container) throws MalformedProjectException {
        List<ProjectVariable> variables = new ArrayList<>();
        if (container == null) {
            return variables;
        }
        for (Element variable : elements(container, "Variable")) {
            String name = requiredAttr(variable, "name");
            Element type = child(variable, "Type");
            Element typeName = type == null ? null : child(type, "TypeName");
            if (typeName == null || typeName.getTextContent().isBlank()) {
                throw new MalformedProjectException("Variable " + name + " has no <Type><TypeName>");
            }
            Element address = child(variable, "Address");
            Address located = address == null ? null : new Address(
                    attrOr(address, "location", "Q"),
                    attrOr(address, "size", "X"),
                    address.getAttribute("address"));
            String order = variable.getAttribute("orderWithinParamSet");
            variables.add(new ProjectVariable(name, typeName.getTextContent().trim(), located,
                    order.isEmpty() ? 0 : parseInt(order, "orderWithinParamSet of " + name)));
        }
        return variables;
    }

    // ------------------------------------------------------------------
    // DOM helpers
    // ------------------------------------------------------------------

    /**
     * Descendant elements with the given tag, in document order.
     */
    private static List<Element> elements(Element parent, String tag) {
        NodeList nodes = parent.getElementsByTagName(tag);
        List<Element> out = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n instanceof Element) {
                out.add((Element) n);
            }
        }
        return out;
    }

    private static Element child(Element parent, String tag) {
        NodeList nodes = parent.getElementsByTagName(tag);
        return nodes.getLength() == 0 ? null : (Element) nodes.item(0);
    }

    private static String requiredAttr(Element el, String name) throws MalformedProjectException {
        String value = el.getAttribute(name);
        if (value.isEmpty()) {
            throw new MalformedProjectException("<" + el.getTagName() + "> is missing the '" + name + "' attribute");
        }
        return value;
    }

    private static String attrOr(Element el, String name, String fallback) {
        String value = el.getAttribute(name);
        return value.isEmpty() ? fallback : value;
    }

    private static String attrOrNull(Element el, String name) {
        return attrOr(el, name, null);
    }

    private static int intAttr(Element el, String name) throws MalformedProjectException {
        String value = el.getAttribute(name);
        return value.isEmpty() ? 0 : parseInt(value, name + " of <" + el.getTagName() + ">");
    }

    private static int parseInt(String value, String what) throws MalformedProjectException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedProjectException(what + " is not an integer: " + value, e);
        }
    }
}
