package edu.upf.taln.treediff.common;

import edu.upf.taln.treediff.core.ComparisonMode;
import edu.upf.taln.treediff.core.structures.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds an XML document from a flat list of patched nodes.
 * Each node is attached to the closest preceding element whose tag equals the node's parent label. Attribute
 * nodes become attributes of that element and terminal markers are dropped.
 */
public class XmlSerializer
{
	public static final String DEFAULT_WRAPPER = "patch";
	public static final int DEFAULT_INDENT = 2;

	private final ComparisonMode mode;
	private final String wrapper;
	private final int indent;
	private final static Logger log = LogManager.getLogger();

	public XmlSerializer(ComparisonMode mode)
	{
		this(mode, DEFAULT_WRAPPER, DEFAULT_INDENT);
	}

	/**
	 * @param wrapper tag of the document element used when the nodes contain several top-level elements
	 * @param indent number of spaces per indentation level
	 */
	public XmlSerializer(ComparisonMode mode, String wrapper, int indent)
	{
		this.mode = mode;
		this.wrapper = wrapper;
		this.indent = indent;
	}

	public Document toDocument(List<Node> nodes)
	{
		final Document document = createDocument();
		final List<Element> created = new ArrayList<>();
		final List<Element> top_level = new ArrayList<>();

		for (Node node : nodes)
		{
			if (node.isTerminal())
				continue;

			final Optional<Element> parent = node.isRoot() ? Optional.empty() : findParent(node, created, top_level);
			if (node.getLabel().isAttribute())
			{
				if (parent.isPresent())
					parent.get().setAttribute(node.getLabel().getName(), node.getLabel().getAttribute().getRight());
				else
					log.warn("Dropping attribute without parent element: " + node);
				continue;
			}

			final Element element = document.createElement(node.getLabel().getName());
			if (mode.isTextAware() && node.getText().isPresent() && !node.getText().get().isEmpty())
				element.appendChild(document.createTextNode(node.getText().get()));

			if (parent.isPresent())
				parent.get().appendChild(element);
			else
				top_level.add(element);
			created.add(element);
		}

		if (top_level.size() == 1)
			document.appendChild(top_level.get(0));
		else
		{
			final Element root = document.createElement(wrapper);
			top_level.forEach(root::appendChild);
			document.appendChild(root);
		}

		return document;
	}

	private static Optional<Element> findParent(Node node, List<Element> created, List<Element> top_level)
	{
		for (int i = created.size() - 1; i >= 0; --i)
		{
			if (created.get(i).getTagName().equals(node.getParentLabel()))
				return Optional.of(created.get(i));
		}

		if (top_level.isEmpty())
			return Optional.empty();

		log.debug("No element " + node.getParentLabel() + " precedes " + node + ", attaching to top-level element");
		return Optional.of(top_level.get(top_level.size() - 1));
	}

	public String serialize(List<Node> nodes)
	{
		final StringWriter writer = new StringWriter();
		try
		{
			createTransformer().transform(new DOMSource(toDocument(nodes)), new StreamResult(writer));
		}
		catch (TransformerException e)
		{
			throw new IllegalStateException("Cannot serialize document: " + e.getMessage(), e);
		}
		return writer.toString();
	}

	public void write(List<Node> nodes, Path output_file)
	{
		FileUtils.writeTextToFile(output_file, serialize(nodes));
		log.debug("Written " + nodes.size() + " nodes to " + output_file);
	}

	private static Document createDocument()
	{
		try
		{
			final Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
			document.setXmlStandalone(true);
			return document;
		}
		catch (ParserConfigurationException e)
		{
			throw new IllegalStateException("Cannot create XML document", e);
		}
	}

	private Transformer createTransformer() throws TransformerException
	{
		final Transformer transformer = TransformerFactory.newInstance().newTransformer();
		transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
		transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
		transformer.setOutputProperty(OutputKeys.INDENT, indent > 0 ? "yes" : "no");
		if (indent > 0)
			transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", Integer.toString(indent));
		return transformer;
	}
}
