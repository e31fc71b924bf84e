package io.rota4j.notification;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code {{name}}} placeholders with values from the entity data.
 * Dotted names walk nested maps. A placeholder without a value is an error.
 */
public class PlaceholderNotificationRenderer implements NotificationRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.]+)\\s*}}");

    @Override
    public RenderedNotification render(NotificationTemplate template, Map<String, Object> data) {
        Objects.requireNonNull(template, "template must not be null");
        Map<String, Object> values = data == null ? Map.of() : data;
        return new RenderedNotification(
                fill(template.subject(), values, template.name()),
                fill(template.body(), values, template.name())
        );
    }

    private static String fill(String text, Map<String, Object> values, String templateName) {
        if (text == null) {
            return null;
        }
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            Object value = lookup(values, m.group(1));
            if (value == null) {
                throw new IllegalArgumentException("template " + templateName + " references missing variable: " + m.group(1));
            }
            m.appendReplacement(out, Matcher.quoteReplacement(String.valueOf(value)));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static Object lookup(Map<String, Object> values, String path) {
        Object cur = values;
        for (String part : path.split("\\.")) {
            if (!(cur instanceof Map<?, ?> map)) {
                return null;
            }
            cur = map.get(part);
        }
        return cur;
    }
}
