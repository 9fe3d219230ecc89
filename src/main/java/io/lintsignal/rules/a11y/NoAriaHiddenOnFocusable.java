package io.lintsignal.rules.a11y;

import io.lintsignal.diagnostic.RuleDiagnostic;
import io.lintsignal.markup.MarkupAttribute;
import io.lintsignal.markup.MarkupElement;
import io.lintsignal.mutation.BatchMutation;
import io.lintsignal.rule.FixKind;
import io.lintsignal.rule.NoOptions;
import io.lintsignal.rule.Query;
import io.lintsignal.rule.Rule;
import io.lintsignal.rule.RuleAction;
import io.lintsignal.rule.RuleContext;
import io.lintsignal.rule.RuleMetadata;
import io.lintsignal.rule.Unit;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Enforce that {@code aria-hidden="true"} is not set on focusable elements.
 * <p>
 * {@code aria-hidden="true"} hides decorative content from screen readers. A focusable element with
 * {@code aria-hidden="true"} can still be reached with the keyboard, which confuses screen reader users.
 * <p>
 * Invalid:
 * <pre>
 * &lt;div aria-hidden="true" tabIndex="0" /&gt;
 * &lt;a href="/" aria-hidden="true" /&gt;
 * </pre>
 * Valid:
 * <pre>
 * &lt;button aria-hidden="true" tabIndex="-1" /&gt;
 * &lt;button aria-hidden="true" tabIndex={-1} /&gt;
 * &lt;div aria-hidden="true"&gt;&lt;a href="#"&gt;&lt;/a&gt;&lt;/div&gt;
 * </pre>
 */
public class NoAriaHiddenOnFocusable implements Rule<MarkupElement, Unit, NoOptions> {

    private static final RuleMetadata METADATA =
            new RuleMetadata("a11y", "noAriaHiddenOnFocusable", "1.4.0", true, FixKind.UNSAFE);

    @Override
    public RuleMetadata metadata() {
        return METADATA;
    }

    @Override
    public Query<MarkupElement> query() {
        return MarkupElement::cast;
    }

    @Override
    public Class<NoOptions> optionsType() {
        return NoOptions.class;
    }

    @Override
    public NoOptions defaultOptions() {
        return NoOptions.INSTANCE;
    }

    @Override
    public Set<Class<?>> requiredServices() {
        return Set.of(AriaRoles.class);
    }

    @Override
    public List<Unit> run(RuleContext<MarkupElement, NoOptions> ctx) {
        MarkupElement element = ctx.query();
        if (!element.isHtmlElement()) {
            return List.of();
        }
        Optional<String> ariaHidden = element.findAttribute("aria-hidden").flatMap(MarkupAttribute::staticValue);
        if (ariaHidden.isEmpty() || ariaHidden.get().equals("false")) {
            return List.of();
        }

        Optional<MarkupAttribute> tabIndex = element.findAttribute("tabIndex");
        if (tabIndex.isPresent()) {
            Optional<Integer> value = tabIndex.get().value()
                    .flatMap(v -> v.numberLikeValue())
                    .flatMap(NoAriaHiddenOnFocusable::parseInt);
            return value.filter(v -> v >= 0).isPresent() ? List.of(Unit.INSTANCE) : List.of();
        }

        AriaRoles ariaRoles = ctx.service(AriaRoles.class);
        if (ariaRoles.isInteractiveElement(element.name(), element.staticAttributes())) {
            return List.of(Unit.INSTANCE);
        }
        return List.of();
    }

    @Override
    public Optional<RuleDiagnostic> diagnostic(RuleContext<MarkupElement, NoOptions> ctx, Unit state) {
        MarkupElement element = ctx.query();
        return Optional.of(RuleDiagnostic.create(
                        ctx.metadata().category(),
                        element.node().textTrimmedRange(),
                        "Disallow aria-hidden=\"true\" from being set on focusable elements.")
                .note("aria-hidden should not be set to true on focusable elements because this can lead to "
                        + "confusing behavior for screen reader users."));
    }

    @Override
    public Optional<RuleAction> action(RuleContext<MarkupElement, NoOptions> ctx, Unit state) {
        MarkupElement element = ctx.query();
        return element.findAttribute("aria-hidden").map(attribute -> RuleAction.quickFix(
                ctx.metadata(),
                "Remove the aria-hidden attribute from the element.",
                BatchMutation.begin(ctx.root()).removeNode(attribute.node())));
    }

    private static Optional<Integer> parseInt(String text) {
        try {
            return Optional.of(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
