package io.lintsignal.analyzer;

import io.lintsignal.diagnostic.RuleDiagnostic;
import io.lintsignal.markup.MarkupElement;
import io.lintsignal.markup.MarkupKind;
import io.lintsignal.mutation.BatchMutation;
import io.lintsignal.rule.FixKind;
import io.lintsignal.rule.Query;
import io.lintsignal.rule.Rule;
import io.lintsignal.rule.RuleAction;
import io.lintsignal.rule.RuleContext;
import io.lintsignal.rule.RuleMetadata;
import io.lintsignal.syntax.SyntaxNode;
import io.lintsignal.syntax.SyntaxToken;
import io.lintsignal.syntax.TextRange;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Configurable rule for tests: flags elements with a given name and offers to rename them.
 */
public class StubRule implements Rule<MarkupElement, String, StubRule.Options> {

    /**
     * @param replacement Element name the fix renames to
     */
    public record Options(String replacement) {
    }

    private RuleMetadata metadata;
    private String target = "target";
    private Applicability declared = Applicability.MAYBE_INCORRECT;
    private boolean withAction = true;
    private boolean withRange = true;
    private boolean withTransform = false;
    private String anchorAttribute;
    private Set<Class<?>> services = Set.of();

    private StubRule(String group, String name) {
        this.metadata = new RuleMetadata(group, name, "1.0.0", true, FixKind.UNSAFE);
    }

    public static StubRule named(String group, String name) {
        return new StubRule(group, name);
    }

    public StubRule matching(String elementName) {
        this.target = elementName;
        return this;
    }

    public StubRule declaring(Applicability applicability) {
        this.declared = applicability;
        return this;
    }

    public StubRule recommended(boolean recommended) {
        this.metadata = new RuleMetadata(metadata.group(), metadata.name(), metadata.version(), recommended,
                metadata.fixKind());
        return this;
    }

    public StubRule withoutAction() {
        this.withAction = false;
        return this;
    }

    public StubRule withoutRange() {
        this.withRange = false;
        return this;
    }

    /**
     * Anchors findings at the named attribute instead of the whole element.
     */
    public StubRule anchoringAt(String attribute) {
        this.anchorAttribute = attribute;
        return this;
    }

    public StubRule withTransform() {
        this.withTransform = true;
        return this;
    }

    public StubRule requiring(Class<?> service) {
        this.services = Set.of(service);
        return this;
    }

    @Override
    public RuleMetadata metadata() {
        return metadata;
    }

    @Override
    public Query<MarkupElement> query() {
        return MarkupElement::cast;
    }

    @Override
    public Class<Options> optionsType() {
        return Options.class;
    }

    @Override
    public Options defaultOptions() {
        return new Options("span");
    }

    @Override
    public Set<Class<?>> requiredServices() {
        return services;
    }

    @Override
    public List<String> run(RuleContext<MarkupElement, Options> ctx) {
        MarkupElement element = ctx.query();
        return element.name().equals(target) ? List.of(element.name()) : List.of();
    }

    @Override
    public Optional<RuleDiagnostic> diagnostic(RuleContext<MarkupElement, Options> ctx, String state) {
        return Optional.of(RuleDiagnostic.create(
                ctx.metadata().category(),
                ctx.query().node().textTrimmedRange(),
                "Found <" + state + ">"));
    }

    @Override
    public Optional<RuleAction> action(RuleContext<MarkupElement, Options> ctx, String state) {
        if (!withAction) {
            return Optional.empty();
        }
        String replacement = ctx.options().replacement();
        return Optional.of(new RuleAction(ActionCategory.QUICK_FIX, declared, "Rename to " + replacement,
                rename(ctx.root(), ctx.query(), replacement)));
    }

    @Override
    public Optional<TextRange> textRange(RuleContext<MarkupElement, Options> ctx, String state) {
        if (!withRange) {
            return Optional.empty();
        }
        if (anchorAttribute != null) {
            return ctx.query().findAttribute(anchorAttribute).map(attribute -> attribute.node().textTrimmedRange());
        }
        return Rule.super.textRange(ctx, state);
    }

    @Override
    public Optional<BatchMutation> transform(RuleContext<MarkupElement, Options> ctx, String state) {
        if (!withTransform) {
            return Optional.empty();
        }
        return Optional.of(rename(ctx.root(), ctx.query(), ctx.options().replacement()));
    }

    private static BatchMutation rename(SyntaxNode root, MarkupElement element, String replacement) {
        BatchMutation mutation = BatchMutation.begin(root);
        renameToken(mutation, element.nameToken(), replacement);
        if (!element.isSelfClosing()) {
            element.node().childNode(MarkupKind.CLOSING_ELEMENT)
                    .flatMap(closing -> closing.childToken(MarkupKind.NAME))
                    .ifPresent(name -> renameToken(mutation, name, replacement));
        }
        return mutation;
    }

    private static void renameToken(BatchMutation mutation, SyntaxToken token, String replacement) {
        mutation.replaceToken(token, new SyntaxToken(token.kind(), 0, token.leadingTrivia(), replacement,
                token.trailingTrivia()));
    }
}
