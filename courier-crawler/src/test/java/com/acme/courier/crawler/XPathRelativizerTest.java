package com.acme.courier.crawler;

import static com.acme.courier.crawler.XPathRelativizer.NON_MATCHING_EXPRESSION;
import static org.assertj.core.api.Assertions.*;

import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/** Unit tests for XPathRelativizer */
class XPathRelativizerTest {

  private static String relativize(String xpath) {
    RelativizedXPath result = XPathRelativizer.relativize(xpath);
    assertThat(result).isInstanceOf(RelativizedXPath.Rewritten.class);
    return result.expression();
  }

  static Stream<Arguments> branchRewrites() {
    return Stream.of(
        Arguments.of("//div", "descendant-or-self::div"),
        Arguments.of(".//div", "descendant-or-self::div"),
        Arguments.of("./div", "self::div"),
        Arguments.of("child::div", "self::div"),
        Arguments.of("div", "self::div"),
        Arguments.of("*", "self::*"),
        Arguments.of("self::*/div", "self::div"),
        Arguments.of("descendant::div", "descendant-or-self::div"),
        Arguments.of("descendant-or-self::div", "descendant-or-self::div"),
        Arguments.of("/html", NON_MATCHING_EXPRESSION),
        Arguments.of("/", NON_MATCHING_EXPRESSION),
        Arguments.of(".", NON_MATCHING_EXPRESSION),
        Arguments.of("..", NON_MATCHING_EXPRESSION),
        Arguments.of("self::div", NON_MATCHING_EXPRESSION),
        Arguments.of("ancestor::div", NON_MATCHING_EXPRESSION),
        Arguments.of("ancestor-or-self::div", NON_MATCHING_EXPRESSION),
        Arguments.of("attribute::id", NON_MATCHING_EXPRESSION),
        Arguments.of("following::div", NON_MATCHING_EXPRESSION),
        Arguments.of("following-sibling::div", NON_MATCHING_EXPRESSION),
        Arguments.of("namespace::*", NON_MATCHING_EXPRESSION),
        Arguments.of("parent::div", NON_MATCHING_EXPRESSION),
        Arguments.of("preceding::div", NON_MATCHING_EXPRESSION),
        Arguments.of("preceding-sibling::div", NON_MATCHING_EXPRESSION),
        Arguments.of("@id", "self::@id"),
        Arguments.of("  //div  ", "descendant-or-self::div"));
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @MethodSource("branchRewrites")
  @DisplayName("should rewrite the prefix of a single branch")
  void testBranchRewrites(String xpath, String expected) {
    assertThat(relativize(xpath)).isEqualTo(expected);
  }

  @Nested
  @DisplayName("Union Tests")
  class UnionTests {

    @Test
    @DisplayName("should rewrite each top-level branch and join with ' | '")
    void testUnion() {
      assertThat(relativize("./span | //a")).isEqualTo("self::span | descendant-or-self::a");
    }

    @Test
    @DisplayName("should not split on | inside a predicate")
    void testPipeInPredicate() {
      assertThat(relativize("//a[@rel|@rev] | b"))
          .isEqualTo("descendant-or-self::a[@rel|@rev] | self::b");
    }

    @Test
    @DisplayName("should not split on | or brackets inside string literals")
    void testPipeInLiteral() {
      assertThat(relativize("//a[@title='x | ] y']|//b[text()=\"[\"]"))
          .isEqualTo("descendant-or-self::a[@title='x | ] y'] | descendant-or-self::b[text()=\"[\"]");
    }

    @Test
    @DisplayName("should handle nested predicates")
    void testNestedPredicates() {
      assertThat(relativize("div[p[@class='x']|span] | /html"))
          .isEqualTo("self::div[p[@class='x']|span] | " + NON_MATCHING_EXPRESSION);
    }

    @Test
    @DisplayName("should keep opening parentheses of a parenthesized union")
    void testParenthesizedUnion() {
      assertThat(relativize("(//a | //b)[1]"))
          .isEqualTo("(descendant-or-self::a | descendant-or-self::b)[1]");
    }

    @Test
    @DisplayName("should keep nested opening parentheses and whitespace")
    void testNestedParentheses() {
      assertThat(relativize("(( .//a | b))")).isEqualTo("(( descendant-or-self::a | self::b))");
    }

    @Test
    @DisplayName("should replace empty branches with the non-matching expression")
    void testEmptyBranch() {
      assertThat(relativize("a | ")).isEqualTo("self::a | " + NON_MATCHING_EXPRESSION);
      assertThat(relativize("| a")).isEqualTo(NON_MATCHING_EXPRESSION + " | self::a");
    }

    @Test
    @DisplayName("should skip whitespace, including newlines, around separators")
    void testWhitespace() {
      assertThat(relativize("\n  //a \t|\n  b  ")).isEqualTo("descendant-or-self::a | self::b");
    }
  }

  @Nested
  @DisplayName("Invalid Expression Tests")
  class InvalidTests {

    @Test
    @DisplayName("should return the input unchanged for an unterminated quote")
    void testUnterminatedQuote() {
      String xpath = "//a[@href='it\\'s']";

      RelativizedXPath result = XPathRelativizer.relativize(xpath);

      assertThat(result).isInstanceOf(RelativizedXPath.Invalid.class);
      assertThat(result.expression()).isEqualTo(xpath);
      assertThat(result.isMatchable()).isFalse();
      assertThat(((RelativizedXPath.Invalid) result).reason()).contains("Unterminated");
      assertThat(XPathRelativizer.relativizeToString(xpath)).isSameAs(xpath);
    }

    @Test
    @DisplayName("should report an unterminated double quote")
    void testUnterminatedDoubleQuote() {
      assertThat(XPathRelativizer.relativize("//a[text()=\"x]"))
          .isInstanceOf(RelativizedXPath.Invalid.class);
    }

    @Test
    @DisplayName("should report unclosed brackets")
    void testUnclosedBracket() {
      RelativizedXPath result = XPathRelativizer.relativize("//a[@id='x'");

      assertThat(result).isInstanceOf(RelativizedXPath.Invalid.class);
      assertThat(result.expression()).isEqualTo("//a[@id='x'");
    }
  }

  @Test
  @DisplayName("empty or blank input should yield an empty, non-matchable expression")
  void testEmpty() {
    assertThat(relativize("")).isEmpty();
    assertThat(relativize("  \n")).isEmpty();
    assertThat(XPathRelativizer.relativize("").isMatchable()).isFalse();
  }

  @Test
  @DisplayName("descendant-or-self branches should be stable under repeated rewriting")
  void testDescendantIdempotent() {
    String once = relativize("//div | .//span[@id='a|b'] | descendant::p");

    assertThat(relativize(once)).isEqualTo(once);
  }

  @Test
  @DisplayName("non-matching expression should stay non-matching when rewritten again")
  void testSentinelRewrite() {
    assertThat(relativize(NON_MATCHING_EXPRESSION)).isEqualTo("self::" + NON_MATCHING_EXPRESSION);
  }
}
