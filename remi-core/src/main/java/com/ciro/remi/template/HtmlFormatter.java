package com.ciro.remi.template;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pretty-printer mínimo: una etiqueta o texto por línea, 2 espacios por nivel.
 * Es un punto fijo: formatear su propia salida no la cambia.
 */
public final class HtmlFormatter {

    private static final int INDENT_SIZE = 2;
    private static final Pattern TOKEN = Pattern.compile("<[^>]+>|[^<>]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\n\\s*\n+");
    private static final Pattern TRAILING_WS = Pattern.compile("(?m)\\s+$");

    private HtmlFormatter() {}

    public static String format(String html) {
        List<String> tokens = tokenize(html);
        StringBuilder out = new StringBuilder();
        int indent = 0;

        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);

            if (token.startsWith("</")) {
                indent = Math.max(0, indent - 1);
                line(out, indent, token);
            } else if (token.startsWith("<")) {
                line(out, indent, token);
                // <x/>, <!DOCTYPE> y <?xml?> no abren nivel
                if (!token.endsWith("/>") && !token.startsWith("<!") && !token.startsWith("<?")) {
                    indent++;
                    if (i < tokens.size() - 1 && !tokens.get(i + 1).startsWith("<")) {
                        String content = tokens.get(i + 1).trim();
                        if (!content.isEmpty()) line(out, indent, content);
                        i++;
                    }
                }
            } else {
                String content = token.trim();
                if (!content.isEmpty()) line(out, indent, content);
            }
        }

        String result = BLANK_LINES.matcher(out).replaceAll("\n");
        return TRAILING_WS.matcher(result).replaceAll("");
    }

    private static List<String> tokenize(String html) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(html);
        while (m.find()) tokens.add(m.group());
        return tokens;
    }

    private static void line(StringBuilder out, int indent, String content) {
        out.append(" ".repeat(indent * INDENT_SIZE)).append(content).append('\n');
    }
}
