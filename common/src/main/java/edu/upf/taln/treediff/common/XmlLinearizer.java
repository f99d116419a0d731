package edu.upf.taln.treediff.common;

import edu.upf.taln.treediff.core.ComparisonMode;
import edu.upf.taln.treediff.core.structures.Label;
import edu.upf.taln.treediff.core.structures.Node;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads XML documents into linearized trees: one node per element in pre-order, followed by one node per
 * attribute and, for elements without child elements, a terminal marker. Attribute and terminal nodes sit one
 * level below their element.
 * Attributes are linearized in the order reported by the DOM parser.
 */
public class XmlLinearizer
{
	private final ComparisonMode mode;
	private final boolean include_attributes;
	private final static Logger log = LogManager.getLogger();

	public XmlLinearizer(ComparisonMode mode)
	{
		this(mode, true);
	}

	public XmlLinearizer(ComparisonMode mode, boolean include_attributes)
	{
		this.mode = mode;
		this.include_attributes = include_attributes;
	}

	public List<Node> linearize(Path xml_file)
	{
		log.debug("Linearizing " + xml_file);
		return linearize(parse(new InputSource(xml_file.toUri().toString())));
	}

	public List<Node> linearize(String xml_contents)
	{
		return linearize(parse(new InputSource(new StringReader(xml_contents))));
	}

	public List<Node> linearize(Document document)
	{
		final List<Node> nodes = new ArrayList<>();
		final Deque<Element> stack = new ArrayDeque<>();
		stack.push(document.getDocumentElement());

		while (!stack.isEmpty())
		{
			final Element element = stack.pop();
			final String tag = element.getTagName();
			final org.w3c.dom.Node parent = element.getParentNode();
			final String parent_label = parent instanceof Element ? ((Element) parent).getTagName() : Node.ROOT;
			final int depth = getDepth(element);

			nodes.add(create(parent_label, Label.tag(tag), depth, getLeadingText(element)));

			if (include_attributes)
			{
				final NamedNodeMap attributes = element.getAttributes();
				for (int i = 0; i < attributes.getLength(); ++i)
				{
					final Attr attribute = (Attr) attributes.item(i);
					nodes.add(create(tag, Label.attribute(attribute.getName(), attribute.getValue()), depth + 1,
							attribute.getValue()));
				}
			}

			final List<Element> children = getChildElements(element);
			if (children.isEmpty())
				nodes.add(create(tag, Label.TERMINAL, depth + 1, ""));
			else
			{
				for (int i = children.size() - 1; i >= 0; --i)
					stack.push(children.get(i));
			}
		}

		return nodes;
	}

	private Node create(String parent_label, Label label, int depth, String text)
	{
		return new Node(parent_label, label, depth, mode.isTextAware() ? text : null);
	}

	private static int getDepth(Element element)
	{
		int depth = 0;
		for (org.w3c.dom.Node p = element.getParentNode(); p instanceof Element; p = p.getParentNode())
			++depth;
		return depth;
	}

	private static List<Element> getChildElements(Element element)
	{
		final List<Element> children = new ArrayList<>();
		for (org.w3c.dom.Node c = element.getFirstChild(); c != null; c = c.getNextSibling())
		{
			if (c instanceof Element)
				children.add((Element) c);
		}
		return children;
	}

	/**
	 * @return text preceding the first child node of any other kind, or the empty string if it is blank
	 */
	private static String getLeadingText(Element element)
	{
		final StringBuilder text = new StringBuilder();
		for (org.w3c.dom.Node c = element.getFirstChild(); c != null; c = c.getNextSibling())
		{
			if (c.getNodeType() != org.w3c.dom.Node.TEXT_NODE && c.getNodeType() != org.w3c.dom.Node.CDATA_SECTION_NODE)
				break;
			text.append(c.getNodeValue());
		}

		return StringUtils.isBlank(text) ? "" : text.toString();
	}

	public static boolean isWellFormed(Path xml_file)
	{
		try
		{
			parse(new InputSource(xml_file.toUri().toString()));
			return true;
		}
		catch (DocumentParseException e)
		{
			log.warn("Document " + xml_file + " is not well-formed: " + e.getMessage());
			return false;
		}
		catch (UncheckedIOException e)
		{
			log.warn("Cannot read " + xml_file + ": " + e.getCause().getMessage());
			return false;
		}
	}

	static Document parse(InputSource source)
	{
		try
		{
			final DocumentBuilder builder = createFactory().newDocumentBuilder();
			builder.setErrorHandler(new ErrorHandler()
			{
				@Override
				public void warning(SAXParseException e)
				{
					log.warn("XML parser warning: " + e.getMessage());
				}

				@Override
				public void error(SAXParseException e) throws SAXException
				{
					throw e;
				}

				@Override
				public void fatalError(SAXParseException e) throws SAXException
				{
					throw e;
				}
			});
			return builder.parse(source);
		}
		catch (SAXException e)
		{
			throw new DocumentParseException(e.getMessage(), e);
		}
		catch (ParserConfigurationException e)
		{
			throw new IllegalStateException("Cannot configure XML parser", e);
		}
		catch (IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}

	private static DocumentBuilderFactory createFactory() throws ParserConfigurationException
	{
		final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
		factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
		factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
		factory.setNamespaceAware(false);
		factory.setIgnoringComments(false);
		return factory;
	}
}
