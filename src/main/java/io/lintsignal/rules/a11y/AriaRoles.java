package io.lintsignal.rules.a11y;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Knowledge about HTML elements and ARIA needed by accessibility rules.
 */
public class AriaRoles {

    private static final Set<String> ALWAYS_INTERACTIVE = Set.of(
            "button", "select", "textarea", "details", "summary", "iframe", "embed", "option", "datalist"
    );

    /**
     * Returns true if the element takes keyboard focus without a {@code tabIndex}.
     *
     * @param element    Lower-case element name
     * @param attributes Statically known attributes, bare attributes mapped to {@code "true"}
     */
    public boolean isInteractiveElement(String element, Map<String, String> attributes) {
        if (isEditable(attributes)) {
            return true;
        }
        String name = element.toLowerCase(Locale.ROOT);
        if (ALWAYS_INTERACTIVE.contains(name)) {
            return true;
        }
        return switch (name) {
            case "a", "area" -> attributes.containsKey("href");
            case "input" -> !"hidden".equalsIgnoreCase(attributes.getOrDefault("type", "text"));
            case "audio", "video" -> attributes.containsKey("controls");
            case "img", "object" -> attributes.containsKey("usemap");
            default -> false;
        };
    }

    private static boolean isEditable(Map<String, String> attributes) {
        String value = attributes.get("contentEditable");
        if (value == null) {
            value = attributes.get("contenteditable");
        }
        return value != null && (value.isEmpty() || value.equalsIgnoreCase("true"));
    }
}
