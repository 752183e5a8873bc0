package com.acme.courier.crawler;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.helper.W3CDom;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * A list of DOM nodes from a single document, filtered with XPath.
 *
 * <p>XPath expressions given to {@link #filterXPath(String)} are evaluated as if the crawler were
 * a fake parent of its nodes: {@code div} or {@code ./div} match the crawler's own div nodes, not
 * their children, and {@code //div} matches div nodes anywhere below (and including) them. See
 * {@link XPathRelativizer}.
 *
 * <p>Not thread-safe.
 */
@Slf4j
public class Crawler implements Iterable<Node> {
  public static final String DEFAULT_NAMESPACE_PREFIX = "default";

  private static final Pattern NAMESPACE_PREFIX =
      Pattern.compile("(?<prefix>[a-z_][a-z_0-9\\-.]*+):[^\"/:]", Pattern.CASE_INSENSITIVE);

  private final List<Node> nodes = new ArrayList<>();
  private final String uri;
  private Document document;
  private Map<String, String> namespaces = new LinkedHashMap<>();
  private String defaultNamespacePrefix = DEFAULT_NAMESPACE_PREFIX;

  public Crawler() {
    this((String) null);
  }

  public Crawler(String uri) {
    this.uri = uri;
  }

  public Crawler(Node... nodes) {
    this((String) null);
    addNodes(List.of(nodes));
  }

  public static Crawler ofNodes(Collection<? extends Node> nodes, String uri) {
    Crawler crawler = new Crawler(uri);
    crawler.addNodes(nodes);
    return crawler;
  }

  public String getUri() {
    return uri;
  }

  /** Parse HTML with jsoup and add the root element of the converted document */
  public Crawler addHtmlContent(String html) {
    org.jsoup.nodes.Document parsed = Jsoup.parse(html, uri != null ? uri : "");
    return addDocument(new W3CDom().namespaceAware(false).fromJsoup(parsed));
  }

  /**
   * Parse namespace-aware XML and add its root element. DTDs and external entities are not
   * loaded.
   *
   * @throws CrawlerException if the content is not well-formed
   */
  public Crawler addXmlContent(String xml) {
    try {
      DocumentBuilder builder = xmlFactory().newDocumentBuilder();
      return addDocument(builder.parse(new InputSource(new StringReader(xml))));
    } catch (ParserConfigurationException | SAXException | IOException e) {
      throw new CrawlerException("Cannot parse XML content: " + e.getMessage(), e);
    }
  }

  public Crawler addDocument(Document dom) {
    if (dom.getDocumentElement() != null) {
      addNode(dom.getDocumentElement());
    }
    return this;
  }

  public Crawler addNodes(Collection<? extends Node> added) {
    added.forEach(this::addNode);
    return this;
  }

  /**
   * @throws IllegalArgumentException if the node belongs to another document than the nodes
   *     already in the crawler
   */
  public Crawler addNode(Node node) {
    if (node instanceof Document dom) {
      return addDocument(dom);
    }
    Document owner = node.getOwnerDocument();
    if (document == null) {
      document = owner;
    } else if (document != owner) {
      throw new IllegalArgumentException(
          "Attaching DOM nodes from multiple documents in the same crawler is forbidden.");
    }
    if (!nodes.contains(node)) {
      nodes.add(node);
    }
    return this;
  }

  /** Map a namespace prefix used in XPath expressions to a URI, overriding discovery */
  public Crawler registerNamespace(String prefix, String namespaceUri) {
    namespaces.put(prefix, namespaceUri);
    return this;
  }

  /** Prefix standing for the document's default namespace ({@code default} unless changed) */
  public Crawler setDefaultNamespacePrefix(String prefix) {
    this.defaultNamespacePrefix = prefix;
    return this;
  }

  public Crawler filterXPath(String xpath) {
    RelativizedXPath relative = XPathRelativizer.relativize(xpath);
    if (relative instanceof RelativizedXPath.Invalid invalid) {
      log.warn("Ignoring invalid XPath \"{}\": {}", xpath, invalid.reason());
      return createSubCrawler(List.of());
    }
    // every branch was dropped: nothing can match
    if (!relative.isMatchable()) {
      return createSubCrawler(List.of());
    }
    return filterRelativeXPath(relative.expression());
  }

  /** Whether the first node is itself selected by the expression */
  public boolean matches(String xpath) {
    if (nodes.isEmpty()) {
      return false;
    }
    return first().filterXPath(xpath).nodes.contains(nodes.get(0));
  }

  public Crawler children() {
    requireNodes();
    return filterRelativeXPath("child::*");
  }

  /** Ancestor elements of the first node, nearest first */
  public Crawler parents() {
    requireNodes();
    List<Node> parents = new ArrayList<>();
    for (Node parent = nodes.get(0).getParentNode();
        parent != null && parent.getNodeType() == Node.ELEMENT_NODE;
        parent = parent.getParentNode()) {
      parents.add(parent);
    }
    return createSubCrawler(parents);
  }

  public Crawler eq(int position) {
    Node node = getNode(position);
    return createSubCrawler(node != null ? List.of(node) : List.of());
  }

  public Crawler first() {
    return eq(0);
  }

  public Crawler last() {
    return eq(nodes.size() - 1);
  }

  /** Apply a function to each node, wrapped in its own crawler, along with its position */
  public <T> List<T> each(BiFunction<Crawler, Integer, T> function) {
    List<T> results = new ArrayList<>(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      results.add(function.apply(createSubCrawler(List.of(nodes.get(i))), i));
    }
    return results;
  }

  /** Keep the nodes for which the predicate holds */
  public Crawler reduce(BiPredicate<Crawler, Integer> predicate) {
    List<Node> kept = new ArrayList<>();
    for (int i = 0; i < nodes.size(); i++) {
      if (predicate.test(createSubCrawler(List.of(nodes.get(i))), i)) {
        kept.add(nodes.get(i));
      }
    }
    return createSubCrawler(kept);
  }

  public Node getNode(int position) {
    return position >= 0 && position < nodes.size() ? nodes.get(position) : null;
  }

  public int count() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  @Override
  public Iterator<Node> iterator() {
    return Collections.unmodifiableList(nodes).iterator();
  }

  public String nodeName() {
    requireNodes();
    return nodes.get(0).getNodeName();
  }

  public String text() {
    requireNodes();
    return nodes.get(0).getTextContent();
  }

  public String text(String defaultValue) {
    return nodes.isEmpty() ? defaultValue : text();
  }

  /** Attribute value of the first node, or null when the attribute is absent */
  public String attr(String attribute) {
    requireNodes();
    Node node = nodes.get(0);
    if (node instanceof Element element && element.hasAttribute(attribute)) {
      return element.getAttribute(attribute);
    }
    return null;
  }

  /**
   * One row per node holding the requested attribute values. {@code _text} and {@code _name}
   * stand for the node's text and name.
   */
  public List<List<String>> extract(List<String> attributes) {
    List<List<String>> rows = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      Crawler single = createSubCrawler(List.of(node));
      List<String> row = new ArrayList<>(attributes.size());
      for (String attribute : attributes) {
        row.add(
            switch (attribute) {
              case "_text" -> single.text();
              case "_name" -> single.nodeName();
              default -> single.attr(attribute);
            });
      }
      rows.add(row);
    }
    return rows;
  }

  public List<String> extract(String attribute) {
    return extract(List.of(attribute)).stream().map(row -> row.get(0)).toList();
  }

  public static String xpathLiteral(String s) {
    return XPathLiterals.of(s);
  }

  /** Evaluate an already relative expression with every node as the context node */
  private Crawler filterRelativeXPath(String xpath) {
    if (nodes.isEmpty()) {
      return createSubCrawler(List.of());
    }
    XPath engine = XPathFactory.newInstance().newXPath();
    engine.setNamespaceContext(namespaceContext(findNamespacePrefixes(xpath)));

    XPathExpression expression;
    try {
      expression = engine.compile(xpath);
    } catch (XPathExpressionException e) {
      throw new InvalidXPathException("Invalid XPath expression: " + xpath, e);
    }

    Set<Node> found = new LinkedHashSet<>();
    for (Node node : nodes) {
      try {
        NodeList list = (NodeList) expression.evaluate(node, XPathConstants.NODESET);
        for (int i = 0; i < list.getLength(); i++) {
          found.add(list.item(i));
        }
      } catch (XPathExpressionException e) {
        throw new InvalidXPathException("Cannot evaluate XPath expression: " + xpath, e);
      }
    }
    log.debug("XPath {} matched {} node(s) in {} context node(s)", xpath, found.size(), count());
    return createSubCrawler(found);
  }

  private NamespaceContext namespaceContext(Set<String> prefixes) {
    Map<String, String> bound = new LinkedHashMap<>();
    for (String prefix : prefixes) {
      String namespace = discoverNamespace(prefix);
      if (namespace != null) {
        bound.put(prefix, namespace);
      } else {
        log.debug("No namespace found for prefix {}", prefix);
      }
    }
    return new PrefixNamespaceContext(bound);
  }

  /**
   * Registered namespaces win; otherwise the last declaration of the prefix in document order.
   * The default prefix looks up the default namespace declaration.
   */
  private String discoverNamespace(String prefix) {
    if (namespaces.containsKey(prefix)) {
      return namespaces.get(prefix);
    }
    if (document == null || document.getDocumentElement() == null) {
      return null;
    }
    String declaration =
        prefix.equals(defaultNamespacePrefix)
            ? XMLConstants.XMLNS_ATTRIBUTE
            : XMLConstants.XMLNS_ATTRIBUTE + ":" + prefix;

    String namespace = null;
    Deque<Node> pending = new ArrayDeque<>();
    pending.push(document.getDocumentElement());
    while (!pending.isEmpty()) {
      Node node = pending.pop();
      NamedNodeMap attributes = node.getAttributes();
      if (attributes != null) {
        Attr attr = (Attr) attributes.getNamedItem(declaration);
        if (attr != null) {
          namespace = attr.getValue();
        }
      }
      // push in reverse so children pop in document order
      NodeList children = node.getChildNodes();
      for (int i = children.getLength() - 1; i >= 0; i--) {
        if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
          pending.push(children.item(i));
        }
      }
    }
    return namespace;
  }

  static Set<String> findNamespacePrefixes(String xpath) {
    Set<String> prefixes = new LinkedHashSet<>();
    Matcher matcher = NAMESPACE_PREFIX.matcher(xpath);
    while (matcher.find()) {
      prefixes.add(matcher.group("prefix"));
    }
    return prefixes;
  }

  private Crawler createSubCrawler(Collection<Node> subNodes) {
    Crawler crawler = new Crawler(uri);
    crawler.document = document;
    crawler.namespaces = new LinkedHashMap<>(namespaces);
    crawler.defaultNamespacePrefix = defaultNamespacePrefix;
    crawler.nodes.addAll(subNodes);
    return crawler;
  }

  private void requireNodes() {
    if (nodes.isEmpty()) {
      throw new IllegalStateException("The current node list is empty.");
    }
  }

  private static DocumentBuilderFactory xmlFactory() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
    factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
    factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
    factory.setExpandEntityReferences(false);
    return factory;
  }

  private static final class PrefixNamespaceContext implements NamespaceContext {
    private final Map<String, String> byPrefix;

    PrefixNamespaceContext(Map<String, String> byPrefix) {
      this.byPrefix = byPrefix;
    }

    @Override
    public String getNamespaceURI(String prefix) {
      return byPrefix.getOrDefault(prefix, XMLConstants.NULL_NS_URI);
    }

    @Override
    public String getPrefix(String namespaceUri) {
      return byPrefix.entrySet().stream()
          .filter(e -> e.getValue().equals(namespaceUri))
          .map(Map.Entry::getKey)
          .findFirst()
          .orElse(null);
    }

    @Override
    public Iterator<String> getPrefixes(String namespaceUri) {
      return byPrefix.entrySet().stream()
          .filter(e -> e.getValue().equals(namespaceUri))
          .map(Map.Entry::getKey)
          .iterator();
    }
  }
}
