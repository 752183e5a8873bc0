package com.acme.courier.crawler;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class XPathLiteralsTest {

  @Test
  @DisplayName("should use single quotes when the string has none")
  void testSingleQuotes() {
    assertThat(XPathLiterals.of("foo \" bar")).isEqualTo("'foo \" bar'");
  }

  @Test
  @DisplayName("should use double quotes when the string has single quotes only")
  void testDoubleQuotes() {
    assertThat(XPathLiterals.of("foo ' bar")).isEqualTo("\"foo ' bar\"");
  }

  @Test
  @DisplayName("should build a concat() call when both quote kinds occur")
  void testConcat() {
    assertThat(Crawler.xpathLiteral("a'b\"c")).isEqualTo("concat('a', \"'\", 'b\"c')");
    assertThat(XPathLiterals.of("'\"'")).isEqualTo("concat('', \"'\", '\"', \"'\", '')");
  }
}
