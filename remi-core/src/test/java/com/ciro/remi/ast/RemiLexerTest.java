package com.ciro.remi.ast;

import static org.assertj.core.api.Assertions.assertThat;

import com.ciro.remi.ast.RemiLexer.Token;
import com.ciro.remi.ast.RemiLexer.TokenType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RemiLexer")
class RemiLexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    @Test
    void textPlaceholdersAndTags() {
        List<Token> tokens = RemiLexer.lex("a {b} <i>c</i>");

        assertThat(types(tokens)).containsExactly(
                TokenType.TEXT, TokenType.PLACEHOLDER, TokenType.TEXT,
                TokenType.TAG_OPEN, TokenType.TEXT, TokenType.TAG_CLOSE);
        assertThat(tokens.get(1).content()).isEqualTo("b");
        assertThat(tokens.get(1).offset()).isEqualTo(2);
        assertThat(tokens.get(3).name()).isEqualTo("i");
        assertThat(tokens.get(5).content()).isEqualTo("</i>");
    }

    @Test
    @DisplayName("offsets are absolute when lexing a slice")
    void sliceOffsets() {
        String source = "head <render><p>{x}</p></render>";
        int start = source.indexOf("<p>");
        int end = source.indexOf("</render>");

        List<Token> tokens = RemiLexer.lex(source, start, end);

        assertThat(tokens.get(0).offset()).isEqualTo(start);
        assertThat(tokens.get(1).offset()).isEqualTo(source.indexOf("{x}"));
    }

    @Test
    @DisplayName("braces inside strings do not close a placeholder")
    void bracesInStrings() {
        List<Token> tokens = RemiLexer.lex("{'}' + \"{\"}");

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.PLACEHOLDER);
        assertThat(tokens.get(0).content()).isEqualTo("'}' + \"{\"");
    }

    @Test
    @DisplayName("nested braces balance")
    void nestedBraces() {
        List<Token> tokens = RemiLexer.lex("{{a: 1}.a}");

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).content()).isEqualTo("{a: 1}.a");
    }

    @Test
    void emptyAndUnterminatedBracesAreText() {
        assertThat(types(RemiLexer.lex("a {} b"))).containsExactly(TokenType.TEXT);
        assertThat(types(RemiLexer.lex("a {b"))).containsExactly(TokenType.TEXT);
    }

    @Test
    void declarationsAndComparisonsAreText() {
        assertThat(types(RemiLexer.lex("<!DOCTYPE html>"))).containsExactly(TokenType.TEXT);
        assertThat(types(RemiLexer.lex("<!-- note -->"))).containsExactly(TokenType.TEXT);
        assertThat(types(RemiLexer.lex("1 < 2 and 3 > 2"))).containsExactly(TokenType.TEXT);
    }

    @Test
    @DisplayName("'>' inside a quoted attribute does not close the tag")
    void quotedGreaterThan() {
        List<Token> tokens = RemiLexer.lex("<p title=\"a > b\">x</p>");

        assertThat(types(tokens)).containsExactly(TokenType.TAG_OPEN, TokenType.TEXT, TokenType.TAG_CLOSE);
        RemiLexer.RawAttribute title = tokens.get(0).attributes().get(0);
        assertThat(title.name()).isEqualTo("title");
        assertThat(title.quote()).isEqualTo('"');
        assertThat(title.value()).extracting(Token::content).containsExactly("a > b");
    }

    @Test
    void selfClosingTag() {
        Token img = RemiLexer.lex("<img src=\"a.png\"/>").get(0);

        assertThat(img.type()).isEqualTo(TokenType.TAG_OPEN);
        assertThat(img.selfClosing()).isTrue();
        assertThat(img.attributes()).extracting(RemiLexer.RawAttribute::name).containsExactly("src");
    }

    @Test
    void attributeForms() {
        Token tag = RemiLexer.lex("<a title=\"Hi {name}!\" class={cls} data-x=plain disabled on:click={go}>").get(0);
        List<RemiLexer.RawAttribute> attrs = tag.attributes();

        assertThat(attrs).extracting(RemiLexer.RawAttribute::name)
                .containsExactly("title", "class", "data-x", "disabled", "on:click");
        assertThat(attrs.get(0).value()).extracting(Token::type)
                .containsExactly(TokenType.TEXT, TokenType.PLACEHOLDER, TokenType.TEXT);
        assertThat(attrs.get(1).quote()).isEqualTo('{');
        assertThat(attrs.get(1).value().get(0).content()).isEqualTo("cls");
        assertThat(attrs.get(2).quote()).isEqualTo((char) 0);
        assertThat(attrs.get(3).value()).isNull();
        assertThat(attrs.get(4).value().get(0).content()).isEqualTo("go");
    }

    @Test
    void ternaryMarkers() {
        List<Token> tokens = RemiLexer.lex("(ok ? <b>y</b> : n)");

        assertThat(types(tokens)).containsExactly(
                TokenType.COND_OPEN, TokenType.TEXT, TokenType.TAG_OPEN, TokenType.TEXT,
                TokenType.TAG_CLOSE, TokenType.TEXT, TokenType.COND_ELSE, TokenType.TEXT,
                TokenType.COND_CLOSE);
        assertThat(tokens.get(0).content()).isEqualTo("ok ");
    }

    @Test
    @DisplayName("parentheses that are not a ternary stay text")
    void plainParentheses() {
        assertThat(types(RemiLexer.lex("(see notes: below)"))).containsExactly(TokenType.TEXT);
        assertThat(types(RemiLexer.lex("(why?)"))).containsExactly(TokenType.TEXT);
        assertThat(types(RemiLexer.lex("(a ? b"))).containsExactly(TokenType.TEXT);
        assertThat(types(RemiLexer.lex("(a ?? b : c)"))).containsExactly(TokenType.TEXT);
    }

    @Test
    @DisplayName("comparison operators may appear in a ternary condition")
    void comparisonConditions() {
        List<Token> greater = RemiLexer.lex("(count > 0 ? a : b)");
        assertThat(types(greater)).containsExactly(
                TokenType.COND_OPEN, TokenType.TEXT, TokenType.COND_ELSE, TokenType.TEXT, TokenType.COND_CLOSE);
        assertThat(greater.get(0).content()).isEqualTo("count > 0 ");

        List<Token> less = RemiLexer.lex("<p>(n < 3 ? few : many)</p>");
        assertThat(types(less)).containsExactly(
                TokenType.TAG_OPEN, TokenType.COND_OPEN, TokenType.TEXT, TokenType.COND_ELSE,
                TokenType.TEXT, TokenType.COND_CLOSE, TokenType.TAG_CLOSE);
        assertThat(less.get(1).content()).isEqualTo("n < 3 ");
    }

    @Test
    @DisplayName("a tag inside the condition is not a ternary")
    void tagInsideCondition() {
        assertThat(types(RemiLexer.lex("(a<b>x</b> ? c : d)"))).containsExactly(
                TokenType.TEXT, TokenType.TAG_OPEN, TokenType.TEXT, TokenType.TAG_CLOSE, TokenType.TEXT);
    }

    @Test
    void ternaryInsideAttributeValue() {
        List<RemiLexer.RawAttribute> attrs = RemiLexer.lex("<p class=\"(on ? {big} : small)\" title=\"(a ? b\">").get(0).attributes();

        assertThat(types(attrs.get(0).value())).containsExactly(
                TokenType.COND_OPEN, TokenType.TEXT, TokenType.PLACEHOLDER, TokenType.TEXT,
                TokenType.COND_ELSE, TokenType.TEXT, TokenType.COND_CLOSE);
        assertThat(attrs.get(0).value().get(0).content()).isEqualTo("on ");
        // sin ')' dentro del valor no hay ternario
        assertThat(types(attrs.get(1).value())).containsExactly(TokenType.TEXT);
    }

    @Test
    void ternaryBranchesSkipTagsAndPlaceholders() {
        List<Token> tokens = RemiLexer.lex("(flag ? <a href=\"x:y\">{'a:b'}</a> : (none))");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.COND_OPEN);
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.COND_CLOSE);
        assertThat(types(tokens)).containsOnlyOnce(TokenType.COND_ELSE);
    }
}
