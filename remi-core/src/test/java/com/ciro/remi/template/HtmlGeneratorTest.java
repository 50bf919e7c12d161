package com.ciro.remi.template;

import static org.assertj.core.api.Assertions.assertThat;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HtmlGenerator")
class HtmlGeneratorTest {

    private static Element body(String source) {
        Document doc = Jsoup.parseBodyFragment(Fixtures.generated(source));
        return doc.body();
    }

    @Test
    @DisplayName("output is wrapped in a div and pretty-printed")
    void wrapsAndFormats() {
        assertThat(Fixtures.generated("<render><p>{5}</p></render>"))
                .isEqualTo("<div>\n  <p>\n    5\n  </p>\n</div>");
    }

    @Nested
    @DisplayName("plain placeholders")
    class Plain {

        @Test
        void knownValue() {
            assertThat(body("@client const name = 'Ada';\n<render><p>{name}</p></render>").select("p").text())
                    .isEqualTo("Ada");
        }

        @Test
        void expressionValue() {
            assertThat(body("<render><p>{[1, 2].length * 10}</p></render>").select("p").text()).isEqualTo("20");
        }

        @Test
        @DisplayName("falsy values render as empty")
        void falsyValues() {
            String html = Fixtures.generated(
                    "@client const n = 0;\n<render><i>{n}</i><b>{false}</b><u>{''}</u><s>{null}</s></render>");

            Element body = Jsoup.parseBodyFragment(html).body();
            assertThat(body.select("i").text()).isEmpty();
            assertThat(body.select("b").text()).isEmpty();
            assertThat(body.select("u").text()).isEmpty();
            assertThat(body.select("s").text()).isEmpty();
        }

        @Test
        void arraysJoinWithCommas() {
            assertThat(body("@public const items = ['a', 'b'];\n<render><p>{items}</p></render>").select("p").text())
                    .isEqualTo("a,b");
        }

        @Test
        @DisplayName("values are inserted without escaping")
        void notEscaped() {
            assertThat(body("<render><p>{'<em>hi</em>'}</p></render>").select("p > em").text()).isEqualTo("hi");
        }
    }

    @Nested
    @DisplayName("deferred placeholders")
    class Deferred {

        @Test
        void fallbackWhenVariableUnknown() {
            assertThat(body("<render><p>{\"loading\" until y}</p></render>").select("p").text()).isEqualTo("loading");
        }

        @Test
        void variableValueWhenInitialized() {
            assertThat(body("@client let y = 'ready';\n<render><p>{\"loading\" until y}</p></render>")
                    .select("p").text()).isEqualTo("ready");
        }

        @Test
        @DisplayName("an initialized falsy value still wins over the fallback")
        void falsyVariableValue() {
            assertThat(body("@client let y = 0;\n<render><p>{\"loading\" until y}</p></render>")
                    .select("p").text()).isEqualTo("0");
        }

        @Test
        void falsyFallbackIsEmpty() {
            assertThat(body("<render><p>{0 until y}</p></render>").select("p").text()).isEmpty();
        }
    }

    @Nested
    @DisplayName("ternaries")
    class Ternaries {

        @Test
        void foldsKnownBoolean() {
            Element body = body("@sset let ready = false;\n<render>(ready ? <b>Ready</b> : <i>Waiting</i>)</render>");

            assertThat(body.select("b")).isEmpty();
            assertThat(body.select("i").text()).isEqualTo("Waiting");
        }

        @Test
        @DisplayName("a non-boolean condition renders the true branch")
        void nonBooleanTakesTrueBranch() {
            Element body = body("@client const count = 0;\n<render>(count ? <b>on</b> : <i>off</i>)</render>");

            assertThat(body.select("b").text()).isEqualTo("on");
            assertThat(body.select("i")).isEmpty();
        }

        @Test
        void literalComparisonFolds() {
            Element body = body("<render><p>(1 > 0 ? yes : no)</p><s>(1 < 0 ? yes : no)</s></render>");

            assertThat(body.select("p").text()).isEqualTo("yes");
            assertThat(body.select("s").text()).isEqualTo("no");
        }

        @Test
        @DisplayName("a comparison on a variable renders the true branch and keeps the nesting")
        void variableComparison() {
            Element body = body("@client const count = 5;\n"
                    + "<render><p>(count < 3 ? few : many)</p><i>(count > 0 ? some : none)</i></render>");

            assertThat(body.select("p").text()).isEqualTo("few");
            assertThat(body.select("i").text()).isEqualTo("some");
            assertThat(body.select("div > i")).hasSize(1);
            assertThat(body.select("p i")).isEmpty();
        }

        @Test
        void foldsInsideAttributeValues() {
            Element p = body("@sset let ready = false;\n"
                    + "<render><p class=\"(ready ? on : off)\" title=\"(1 > 0 ? {'a' + 1} : b)\">x</p></render>")
                    .selectFirst("p");

            assertThat(p).isNotNull();
            assertThat(p.className()).isEqualTo("off");
            assertThat(p.attr("title").trim()).isEqualTo("a1");
        }

        @Test
        void unknownConditionTakesTrueBranch() {
            assertThat(Fixtures.generated("<render>(mystery ? yes : no)</render>"))
                    .isEqualTo("<div>\n  yes\n</div>");
        }
    }

    @Nested
    @DisplayName("event bindings")
    class Events {

        @Test
        void bindingsAreDropped() {
            Element button = body("<render><button on:click={inc} class=\"btn\">Go</button></render>")
                    .selectFirst("button");

            assertThat(button).isNotNull();
            assertThat(button.attributes().asList()).extracting(a -> a.getKey()).containsExactly("class");
            assertThat(button.text()).isEqualTo("Go");
        }

        @Test
        @DisplayName("event attribute shapes left in text are stripped")
        void strayShapesStripped() {
            assertThat(body("<render><p>hello on:Hover=\"x y\" there</p></render>").select("p").text())
                    .isEqualTo("hello there");
        }
    }

    @Test
    void attributeValuesAreSubstituted() {
        Element a = body("@client const cls = 'big';\n@client const who = 'Bob';\n"
                + "<render><a class={cls} title=\"Hi {who}\" hidden>x</a></render>").selectFirst("a");

        assertThat(a).isNotNull();
        assertThat(a.className()).isEqualTo("big");
        assertThat(a.attr("title")).isEqualTo("Hi Bob");
        assertThat(a.hasAttr("hidden")).isTrue();
    }

    @Test
    @DisplayName("generating twice gives identical markup")
    void deterministic() {
        String source = "@client const t = 'x';\n<render><ul><li>{t}</li>(flag ? <li>a</li> : <li>b</li>)</ul></render>";

        assertThat(Fixtures.generated(source)).isEqualTo(Fixtures.generated(source));
    }
}
